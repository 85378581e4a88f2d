package com.vulnharvest.core.export;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/** 결과 파일 이름 규칙: &lt;name&gt;_&lt;yyyyMMdd-HHmmss&gt;.json, &lt;name&gt;_latest.json, &lt;name&gt;_analytics_&lt;ts&gt;.json */
public final class ResultNaming {
    private ResultNaming() {}

    public static final DateTimeFormatter TS_FMT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneId.systemDefault());

    public static String timestamp(Instant at) { return TS_FMT.format(at); }

    public static Path resultPath(Path outDir, String name, Instant at) {
        return base(outDir).resolve(safe(name) + "_" + timestamp(at) + ".json");
    }

    public static Path latestPath(Path outDir, String name) {
        return base(outDir).resolve(safe(name) + "_latest.json");
    }

    public static Path analyticsPath(Path outDir, String name, Instant at) {
        return base(outDir).resolve(safe(name) + "_analytics_" + timestamp(at) + ".json");
    }

    private static Path base(Path outDir) { return outDir == null ? Paths.get("output") : outDir; }

    private static String safe(String name) {
        if (name == null || name.isBlank()) return "cve_data";
        return name.trim().replaceAll("[^A-Za-z0-9._-]", "-");
    }
}
