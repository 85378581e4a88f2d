package com.vulnharvest.app.cli;

import com.vulnharvest.app.app.App;
import com.vulnharvest.core.export.ResultExporter;
import com.vulnharvest.core.model.VulnRecord;
import com.vulnharvest.core.transform.RecordValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * 결과 파일 구조 검증. 레코드별 위반과 중복 id를 보고한다.
 * 읽기 실패만 종료 코드 1, 위반은 보고용(--strict면 1).
 */
@Command(
        name = "validate",
        mixinStandardHelpOptions = true,
        description = "결과 파일의 레코드를 검증한다"
)
public class ValidateCommand implements Callable<Integer> {
    private static final Logger LOG = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "결과 JSON 파일")
    Path file;

    @Option(names = {"--strict"}, description = "위반이 하나라도 있으면 실패 코드로 종료")
    boolean strict;

    PrintStream out = System.out;

    @Override
    public Integer call() {
        List<VulnRecord> records;
        try {
            records = ResultExporter.readRecords(file);
        } catch (IOException e) {
            LOG.error("Cannot read {}: {}", file, e.getMessage());
            return App.EXIT_FAILURE;
        }

        int invalid = 0, duplicates = 0;
        Set<String> seen = new HashSet<>();
        for (VulnRecord r : records) {
            if (!seen.add(r.getId())) {
                duplicates++;
                out.println("DUPLICATE " + r.getId());
            }
            List<String> v = RecordValidator.violations(r);
            if (!v.isEmpty()) {
                invalid++;
                out.println("INVALID " + r.getId() + ": " + String.join("; ", v));
            }
        }
        out.printf(Locale.ROOT, "records=%d valid=%d invalid=%d duplicates=%d%n",
                records.size(), records.size() - invalid, invalid, duplicates);
        return (strict && (invalid > 0 || duplicates > 0)) ? App.EXIT_FAILURE : App.EXIT_OK;
    }
}
