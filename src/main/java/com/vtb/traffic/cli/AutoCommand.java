package com.vtb.traffic.cli;

import com.vtb.traffic.automation.AutomationRequest;
import com.vtb.traffic.automation.AutomationRunResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

@Command(name = "auto", description = "Выполнить все незавершенные цели из трафика")
class AutoCommand extends AbstractTrafficCommand {

    @Mixin
    private AutomationOptions options;

    @Override
    protected int execute(CliContext context) {
        AutomationRequest request = AutomationRequest.builder()
            .dryRun(options.dryRun)
            .delayMs(options.delayMs())
            .build();
        AutomationRunResult result = context.sessionAutomation().run(request);
        if (result.getTargets().isEmpty() && !result.isDryRun()) {
            out().println("Незавершенных целей нет");
        }
        return AutomationOptions.print(out(), result);
    }
}
