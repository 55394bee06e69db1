package com.vtb.traffic.cli;

import com.vtb.traffic.models.Transaction;
import com.vtb.traffic.query.HostMatch;
import com.vtb.traffic.query.QueryCriteria;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

@Command(name = "list", description = "Последние транзакции, от новых к старым")
class ListCommand extends AbstractTrafficCommand {

    @Option(names = {"--host"}, description = "Хост или родительский домен")
    private String host;

    @Option(names = {"--exact-host"}, description = "Сравнивать хост точно, без поддоменов")
    private boolean exactHost;

    @Option(names = {"--method"}, description = "HTTP метод")
    private String method;

    @Option(names = {"--status"}, description = "Код ответа")
    private Integer status;

    @Option(names = {"--limit"}, defaultValue = "20", description = "Максимум записей (по умолчанию: ${DEFAULT-VALUE})")
    private int limit;

    @Override
    protected int execute(CliContext context) {
        if (limit < 0) {
            throw new IllegalArgumentException("--limit не может быть отрицательным");
        }
        QueryCriteria criteria = QueryCriteria.builder()
            .host(host)
            .hostMatch(exactHost ? HostMatch.EXACT : HostMatch.SUFFIX)
            .method(method)
            .statusCode(status)
            .build();
        List<Transaction> transactions = context.getQueryEngine().list(criteria, limit);
        if (transactions.isEmpty()) {
            out().println("Транзакций не найдено");
            return ExitCodes.OK;
        }
        transactions.forEach(t -> out().println(ConsoleFormat.row(t)));
        out().printf("%nПоказано: %d%n", transactions.size());
        return ExitCodes.OK;
    }
}
