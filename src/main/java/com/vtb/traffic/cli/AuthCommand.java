package com.vtb.traffic.cli;

import com.vtb.traffic.errors.NoSessionFoundException;
import com.vtb.traffic.models.SessionContext;
import picocli.CommandLine.Command;

@Command(name = "auth", description = "Показать сессию, извлеченную из трафика")
class AuthCommand extends AbstractTrafficCommand {

    @Override
    protected int execute(CliContext context) {
        String host = context.getConfig().getAutomation().getTargetHost();
        SessionContext session = context.sessionAutomation().deriveSession()
            .orElseThrow(() -> new NoSessionFoundException(host));
        out().printf("Хост:       %s%n", session.getHost());
        out().printf("Токен:      %s%n", session.maskedCredential());
        out().printf("Область:    %s%n", session.getScopeIdentifier() != null ? session.getScopeIdentifier() : "не найдена");
        out().printf("Источник:   транзакция #%d%n", session.getDerivedFromTransactionId());
        out().printf("Извлечено:  %s%n", session.getDerivedAt());
        return ExitCodes.OK;
    }
}
