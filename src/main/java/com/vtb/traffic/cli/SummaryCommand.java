package com.vtb.traffic.cli;

import com.vtb.traffic.automation.SessionAutomation;
import com.vtb.traffic.models.AutomationTarget;
import picocli.CommandLine.Command;

import java.util.List;

@Command(name = "summary", description = "Цели автоматизации, найденные в трафике")
class SummaryCommand extends AbstractTrafficCommand {

    @Override
    protected int execute(CliContext context) {
        SessionAutomation automation = context.sessionAutomation();
        List<AutomationTarget> targets = automation.enumerateTargets();
        if (targets.isEmpty()) {
            out().println("Цели не найдены");
            return ExitCodes.OK;
        }
        long complete = targets.stream().filter(AutomationTarget::isObservedComplete).count();
        out().println(ConsoleFormat.LINE);
        out().printf("%-40s %-6s %-10s %s%n", "Ресурс", "Часть", "Выполнено", "Транзакция");
        out().println(ConsoleFormat.LINE);
        for (AutomationTarget target : targets) {
            out().printf("%-40s %-6d %-10s #%s%n",
                ConsoleFormat.shorten(target.getResourceId(), 40), target.getPartIndex(),
                target.isObservedComplete() ? "да" : "нет", target.getSourceTransactionId());
        }
        out().println(ConsoleFormat.LINE);
        out().printf("Всего: %d, выполнено: %d, осталось: %d%n", targets.size(), complete, targets.size() - complete);
        return ExitCodes.OK;
    }
}
