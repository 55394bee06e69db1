package com.vtb.traffic.cli;

import com.vtb.traffic.automation.AutomationRunResult;
import com.vtb.traffic.errors.ValidationException;
import com.vtb.traffic.models.AutomationTarget;
import com.vtb.traffic.replay.SentRequest;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.util.Locale;

/**
 * Общие опции и вывод для auto и complete
 */
class AutomationOptions {

    @Option(names = {"--dry-run"}, description = "Только показать запросы, ничего не отправлять")
    boolean dryRun;

    @Option(names = {"--delay"}, description = "Задержка между запросами, секунды (по умолчанию из конфигурации)")
    Double delaySec;

    Long delayMs() {
        if (delaySec == null) {
            return null;
        }
        if (delaySec <= 0 || delaySec.isNaN()) {
            throw new ValidationException("--delay должен быть положительным");
        }
        return Math.max(1L, Math.round(delaySec * 1000));
    }

    static int print(PrintWriter out, AutomationRunResult result) {
        out.printf("Сессия из транзакции #%d, токен %s%n",
            result.getSession().getDerivedFromTransactionId(), result.getSession().maskedCredential());
        if (!result.getAlreadyComplete().isEmpty()) {
            out.printf("Уже выполнено по трафику: %d%n", result.getAlreadyComplete().size());
        }
        if (result.isDryRun()) {
            out.printf("Режим dry-run, запланировано запросов: %d%n", result.getRequests().size());
            for (SentRequest request : result.getRequests()) {
                out.printf("  %s %s%n", request.getMethod(), request.getUrl());
                if (request.getBody() != null) {
                    out.printf("    %s%n", request.getBody());
                }
            }
            return ExitCodes.OK;
        }
        for (AutomationTarget target : result.getTargets()) {
            out.printf(Locale.ROOT, "  %-40s %-16s %s%n", target.key(), target.getState(),
                target.getError() != null ? target.getError() + (target.getLastStatus() != null ? " " + target.getLastStatus() : "") : "");
        }
        out.printf("Успешно: %d, с ошибкой: %d, запросов: %d%n",
            result.getSucceeded(), result.getFailed(), result.getNetworkCalls());
        if (result.isCancelled()) {
            out.println("Прогон отменен");
        }
        if (result.getUnrecordedResponses() > 0) {
            out.printf("Не сохранено в хранилище ответов: %d%n", result.getUnrecordedResponses());
        }
        if (result.isRequiresReauthentication()) {
            out.printf("Сессия недействительна (%s): получите свежий трафик с новым токеном и повторите%n",
                result.getStopReason());
            return ExitCodes.RUNTIME;
        }
        return result.getFailed() > 0 ? ExitCodes.RUNTIME : ExitCodes.OK;
    }
}
