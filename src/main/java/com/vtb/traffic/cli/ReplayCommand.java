package com.vtb.traffic.cli;

import com.vtb.traffic.replay.ReplayOverrides;
import com.vtb.traffic.replay.ReplayResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Command(name = "replay", description = "Повторно отправить сохраненный запрос")
class ReplayCommand extends AbstractTrafficCommand {

    @Parameters(index = "0", description = "Id транзакции")
    private long id;

    @Option(names = {"--url"}, description = "Заменить URL")
    private String url;

    @Option(names = {"--header", "-H"}, description = "Заменить заголовок: 'Имя: значение'; 'Имя:' удаляет заголовок")
    private List<String> headers = new ArrayList<>();

    @Option(names = {"--body"}, description = "Заменить тело запроса")
    private String body;

    @Option(names = {"--store"}, description = "Сохранить результат как новую транзакцию")
    private boolean store;

    @Override
    protected int execute(CliContext context) {
        // Проверка области и существования до отправки
        context.getQueryEngine().get(id);

        ReplayOverrides overrides = ReplayOverrides.builder()
            .url(url)
            .headers(parseHeaders(headers))
            .body(body)
            .build();
        ReplayResult result = context.replayEngine().replay(id, overrides);

        out().printf(Locale.ROOT, "Повтор #%d: %s %s%n", id,
            result.getSentRequest().getMethod(), result.getSentRequest().getUrl());
        out().printf(Locale.ROOT, "Статус: %d, время: %.0f мс%n", result.getStatus(), result.getDurationSec() * 1000);
        if (result.getResponseSummary() != null && !result.getResponseSummary().isEmpty()) {
            out().println(result.getResponseSummary());
        }
        if (store) {
            long newId = context.getStore().append(result.toTransaction());
            out().printf("Сохранено как транзакция #%d%n", newId);
        }
        return ExitCodes.OK;
    }

    static Map<String, String> parseHeaders(List<String> values) {
        Map<String, String> parsed = new LinkedHashMap<>();
        for (String value : values) {
            int colon = value.indexOf(':');
            if (colon <= 0) {
                throw new IllegalArgumentException("Неверный формат заголовка: '" + value + "', ожидается 'Имя: значение'");
            }
            String name = value.substring(0, colon).trim();
            String headerValue = value.substring(colon + 1).trim();
            parsed.put(name, headerValue.isEmpty() ? null : headerValue);
        }
        return parsed;
    }
}
