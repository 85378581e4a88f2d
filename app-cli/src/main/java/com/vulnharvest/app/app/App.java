package com.vulnharvest.app.app;

import com.vulnharvest.app.cli.AnalyticsCommand;
import com.vulnharvest.app.cli.CollectCommand;
import com.vulnharvest.app.cli.ResumeCommand;
import com.vulnharvest.app.cli.ValidateCommand;
import com.vulnharvest.app.logging.LogSetup;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Level;
import java.util.logging.Logger;

/** CLI 진입점 */
@Command(
        name = "vulnharvest",
        mixinStandardHelpOptions = true,
        version = "VulnHarvest 0.3.0",
        description = "CVE 데이터베이스 전수 수집기 (필터 팬아웃 + 중복 제거 + 체크포인트)",
        subcommands = {
                CollectCommand.class,
                ResumeCommand.class,
                AnalyticsCommand.class,
                ValidateCommand.class
        }
)
public class App implements Runnable {
    private static final Logger LOG = Logger.getLogger(App.class.getName());

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_UPSTREAM_UNAVAILABLE = 2;

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        // 서브커맨드 없이 호출되면 사용법 출력
        spec.commandLine().usage(System.out);
    }

    public static CommandLine commandLine() {
        return new CommandLine(new App());
    }

    public static void main(String[] args) {
        // 로그 초기화 (-Dvh.log.dir 없으면 "logs")
        Path logDir = Paths.get(System.getProperty("vh.log.dir", "logs"));
        LogSetup.init(logDir);

        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                LOG.log(Level.SEVERE, "\n==== Uncaught: " + t.getName() + " ====", e));

        int code = commandLine().execute(args);
        System.exit(code);
    }
}
