package com.vtb.traffic.cli;

import com.vtb.traffic.models.Transaction;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "show", description = "Полные данные транзакции")
class ShowCommand extends AbstractTrafficCommand {

    @Parameters(index = "0", description = "Id транзакции")
    private long id;

    @Override
    protected int execute(CliContext context) {
        Transaction transaction = context.getQueryEngine().get(id);
        ConsoleFormat.details(out(), transaction);
        return ExitCodes.OK;
    }
}
