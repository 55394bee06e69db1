package com.vtb.traffic.cli;

import com.vtb.traffic.reports.TransactionImporter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;

@Command(name = "import", description = "Импорт транзакций из JSON-экспорта")
class ImportCommand extends AbstractTrafficCommand {

    @Parameters(index = "0", description = "Файл JSON-экспорта")
    private Path input;

    @Override
    protected int execute(CliContext context) throws Exception {
        if (!Files.isRegularFile(input)) {
            throw new IllegalArgumentException("Файл не найден: " + input);
        }
        long imported = new TransactionImporter().importInto(context.getStore(), input);
        out().printf("Импортировано транзакций: %d%n", imported);
        return ExitCodes.OK;
    }
}
