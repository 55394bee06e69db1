package com.vtb.traffic.cli;

import com.vtb.traffic.automation.AutomationRequest;
import com.vtb.traffic.automation.AutomationRunResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.util.List;

@Command(name = "complete", description = "Выполнить цели для указанных ресурсов")
class CompleteCommand extends AbstractTrafficCommand {

    @Parameters(arity = "1..*", description = "Идентификаторы ресурсов")
    private List<String> resourceIds;

    @Mixin
    private AutomationOptions options;

    @Override
    protected int execute(CliContext context) {
        AutomationRequest request = AutomationRequest.builder()
            .dryRun(options.dryRun)
            .delayMs(options.delayMs())
            .resourceIds(resourceIds)
            .build();
        AutomationRunResult result = context.sessionAutomation().run(request);
        return AutomationOptions.print(out(), result);
    }
}
