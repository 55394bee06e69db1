package com.vtb.traffic.cli;

import com.vtb.traffic.models.Transaction;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;

@Command(name = "search", description = "Поиск подстроки в URL, телах и заголовках")
class SearchCommand extends AbstractTrafficCommand {

    @Parameters(index = "0", description = "Строка поиска")
    private String query;

    @Option(names = {"--limit"}, defaultValue = "50", description = "Максимум записей (по умолчанию: ${DEFAULT-VALUE})")
    private int limit;

    @Override
    protected int execute(CliContext context) {
        if (limit < 0) {
            throw new IllegalArgumentException("--limit не может быть отрицательным");
        }
        List<Transaction> found = context.getQueryEngine().search(query, limit);
        found.forEach(t -> out().println(ConsoleFormat.row(t)));
        out().printf("Найдено: %d%n", found.size());
        return ExitCodes.OK;
    }
}
