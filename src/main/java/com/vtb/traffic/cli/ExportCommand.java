package com.vtb.traffic.cli;

import com.vtb.traffic.query.QueryCriteria;
import com.vtb.traffic.query.TransactionQuery;
import com.vtb.traffic.reports.ExportFormat;
import com.vtb.traffic.reports.TransactionExporter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;

@Command(name = "export", description = "Экспорт транзакций в JSON или HAR")
class ExportCommand extends AbstractTrafficCommand {

    @Parameters(index = "0", description = "Файл назначения (.har - HAR, иначе JSON)")
    private Path output;

    @Option(names = {"--host"}, description = "Хост или родительский домен")
    private String host;

    @Option(names = {"--limit"}, description = "Максимум записей (по умолчанию все)")
    private Long limit;

    @Option(names = {"--format"}, description = "Формат: json или har (по умолчанию по расширению файла)")
    private String format;

    @Override
    protected int execute(CliContext context) throws Exception {
        ExportFormat exportFormat = format != null ? ExportFormat.parse(format) : ExportFormat.fromPath(output);
        TransactionQuery query = context.getQueryEngine().find(QueryCriteria.builder().host(host).build());
        if (limit != null) {
            query = query.limit(limit);
        }
        TransactionExporter exporter = exportFormat.createExporter();
        long exported = exporter.export(query, output);
        out().printf("Экспортировано %d транзакций в %s (%s)%n", exported, output, exportFormat.getExtension());
        return ExitCodes.OK;
    }
}
