package com.vtb.traffic.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

@Command(name = "clear", description = "Удалить все транзакции")
class ClearCommand extends AbstractTrafficCommand {

    @Option(names = {"--yes"}, description = "Не спрашивать подтверждение")
    private boolean yes;

    @Override
    protected int execute(CliContext context) throws IOException {
        long total = context.getStore().count(null);
        if (!yes && !confirm(total)) {
            out().println("Очистка отменена");
            return ExitCodes.OK;
        }
        int removed = context.getStore().clear();
        out().printf("Удалено транзакций: %d%n", removed);
        return ExitCodes.OK;
    }

    private boolean confirm(long total) throws IOException {
        out().printf("Будет удалено %d транзакций. Введите 'yes' для подтверждения: ", total);
        out().flush();
        BufferedReader reader = new BufferedReader(new InputStreamReader(parent.getInput(), StandardCharsets.UTF_8));
        String answer = reader.readLine();
        return answer != null && "yes".equalsIgnoreCase(answer.trim());
    }
}
