package com.vtb.traffic.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "notes", description = "Записать заметку к транзакции")
class NotesCommand extends AbstractTrafficCommand {

    @Parameters(index = "0", description = "Id транзакции")
    private long id;

    @Parameters(index = "1", description = "Текст заметки")
    private String text;

    @Override
    protected int execute(CliContext context) {
        context.getQueryEngine().get(id);
        context.getStore().updateNotes(id, text);
        out().printf("Заметка сохранена для #%d%n", id);
        return ExitCodes.OK;
    }
}
