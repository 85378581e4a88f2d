package com.vulnharvest.app.cli;

import com.vulnharvest.app.app.App;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ValidateCommandTest {

    @TempDir
    Path tmp;

    private final ByteArrayOutputStream buf = new ByteArrayOutputStream();

    private int run(String... args) {
        ValidateCommand cmd = new ValidateCommand();
        cmd.out = new PrintStream(buf, true, StandardCharsets.UTF_8);
        return new CommandLine(cmd).execute(args);
    }

    private String output() {
        return buf.toString(StandardCharsets.UTF_8);
    }

    private Path resultFile() throws Exception {
        Path f = tmp.resolve("cve_data_latest.json");
        Files.writeString(f, """
                {
                  "collectedAt": "2025-01-01T00:00:00Z",
                  "records": [
                    {"id": "CVE-2024-0001", "severity": "HIGH", "sourceUrl": "https://nvd.nist.gov/x"},
                    {"id": "GHSA-abcd", "severity": "LOW"},
                    {"id": "CVE-2024-0001", "severity": "HIGH"}
                  ]
                }
                """);
        return f;
    }

    @Test
    void reports_invalid_and_duplicate_records() throws Exception {
        int code = run(resultFile().toString());

        assertThat(code).isEqualTo(App.EXIT_OK);
        assertThat(output())
                .contains("INVALID GHSA-abcd")
                .contains("DUPLICATE CVE-2024-0001")
                .contains("records=3 valid=2 invalid=1 duplicates=1");
    }

    @Test
    void strict_mode_fails_on_violations() throws Exception {
        assertThat(run("--strict", resultFile().toString())).isEqualTo(App.EXIT_FAILURE);
    }

    @Test
    void unreadable_file_fails() {
        assertThat(run(tmp.resolve("missing.json").toString())).isEqualTo(App.EXIT_FAILURE);
    }
}
