package com.vulnharvest.app.cli;

import picocli.CommandLine.Command;

/** collect --resume 별칭 */
@Command(
        name = "resume",
        mixinStandardHelpOptions = true,
        description = "최신 체크포인트에서 수집을 재개한다 (collect --resume)"
)
public class ResumeCommand extends CollectCommand {
    @Override
    public Integer call() {
        resume = true;
        return super.call();
    }
}
