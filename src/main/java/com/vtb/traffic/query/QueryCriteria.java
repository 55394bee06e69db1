package com.vtb.traffic.query;

import com.vtb.traffic.errors.InvalidQueryException;
import com.vtb.traffic.models.Transaction;
import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Критерии выборки транзакций. Все заданные критерии объединяются через AND.
 */
@Data
@Builder(toBuilder = true)
public class QueryCriteria {

    public static final String METHOD = "method";
    public static final String HOST = "host";
    public static final String HOST_MATCH = "host_match";
    public static final String STATUS = "status";
    public static final String PROTOCOL = "protocol";
    public static final String SINCE = "since";
    public static final String UNTIL = "until";
    public static final String TEXT = "text";

    private static final Set<String> SUPPORTED = Set.of(
        METHOD, HOST, HOST_MATCH, STATUS, PROTOCOL, SINCE, UNTIL, TEXT);

    private String method;
    private String host;
    @Builder.Default
    private HostMatch hostMatch = HostMatch.SUFFIX;
    private Integer statusCode;
    private String protocol;
    /** Нижняя граница времени перехвата, включительно (секунды) */
    private Double since;
    /** Верхняя граница, не включительно */
    private Double until;
    /** Подстрока для поиска по url, телам и заголовкам */
    private String text;
    @Builder.Default
    private HostScope scope = HostScope.unrestricted();

    public static QueryCriteria all() {
        return QueryCriteria.builder().build();
    }

    /**
     * Разобрать критерии из набора строковых параметров (CLI и т.п.).
     * Неизвестный параметр считается ошибкой.
     */
    public static QueryCriteria fromParameters(Map<String, String> parameters) {
        QueryCriteriaBuilder builder = QueryCriteria.builder();
        if (parameters == null || parameters.isEmpty()) {
            return builder.build();
        }
        Map<String, String> normalized = new LinkedHashMap<>();
        parameters.forEach((key, value) -> {
            String name = key == null ? "" : key.trim().toLowerCase(Locale.ROOT);
            if (!SUPPORTED.contains(name)) {
                throw new InvalidQueryException("Неподдерживаемый критерий запроса: " + key);
            }
            normalized.put(name, value);
        });

        if (normalized.containsKey(HOST_MATCH) && isBlank(normalized.get(HOST))) {
            throw new InvalidQueryException("host_match задан без host");
        }

        builder.method(blankToNull(normalized.get(METHOD)));
        builder.host(blankToNull(normalized.get(HOST)));
        if (normalized.containsKey(HOST_MATCH)) {
            HostMatch match = HostMatch.parse(normalized.get(HOST_MATCH));
            if (match == null) {
                throw new InvalidQueryException("Неизвестный режим host_match: " + normalized.get(HOST_MATCH));
            }
            builder.hostMatch(match);
        }
        if (normalized.containsKey(STATUS)) {
            builder.statusCode(parseInt(STATUS, normalized.get(STATUS)));
        }
        builder.protocol(blankToNull(normalized.get(PROTOCOL)));
        if (normalized.containsKey(SINCE)) {
            builder.since(parseDouble(SINCE, normalized.get(SINCE)));
        }
        if (normalized.containsKey(UNTIL)) {
            builder.until(parseDouble(UNTIL, normalized.get(UNTIL)));
        }
        if (normalized.containsKey(TEXT)) {
            String text = normalized.get(TEXT);
            if (text == null || text.isEmpty()) {
                throw new InvalidQueryException("Пустая строка поиска");
            }
            builder.text(text);
        }

        QueryCriteria criteria = builder.build();
        criteria.validate();
        return criteria;
    }

    /**
     * Проверить согласованность критериев
     */
    public void validate() {
        if (hostMatch == null) {
            throw new InvalidQueryException("Режим сопоставления хоста не задан");
        }
        if (host != null && host.isBlank()) {
            throw new InvalidQueryException("Пустой host");
        }
        if (statusCode != null && (statusCode < 100 || statusCode > 599)) {
            throw new InvalidQueryException("Код статуса вне диапазона 100..599: " + statusCode);
        }
        if (protocol != null) {
            String p = protocol.toLowerCase(Locale.ROOT);
            if (!Transaction.HTTP.equals(p) && !Transaction.HTTPS.equals(p)) {
                throw new InvalidQueryException("Неподдерживаемый протокол: " + protocol);
            }
        }
        if (since != null && (since.isNaN() || since.isInfinite())) {
            throw new InvalidQueryException("Некорректная граница since");
        }
        if (until != null && (until.isNaN() || until.isInfinite())) {
            throw new InvalidQueryException("Некорректная граница until");
        }
        if (since != null && until != null && since > until) {
            throw new InvalidQueryException("since (" + since + ") больше until (" + until + ")");
        }
        if (text != null && text.isEmpty()) {
            throw new InvalidQueryException("Пустая строка поиска");
        }
        if (scope == null) {
            throw new InvalidQueryException("Область хостов не задана");
        }
    }

    public QueryCriteria withScope(HostScope hostScope) {
        return toBuilder().scope(hostScope != null ? hostScope : HostScope.unrestricted()).build();
    }

    /**
     * Проверка одной транзакции в памяти. Совпадает с SQL-фильтром хранилища.
     */
    public boolean matches(Transaction transaction) {
        if (transaction == null) {
            return false;
        }
        if (method != null && !method.equalsIgnoreCase(transaction.getMethod())) {
            return false;
        }
        if (host != null && !hostMatch.matches(transaction.getHost(), host)) {
            return false;
        }
        if (statusCode != null && !statusCode.equals(transaction.getResponseStatus())) {
            return false;
        }
        if (protocol != null && !protocol.equalsIgnoreCase(transaction.getProtocol())) {
            return false;
        }
        if (since != null && transaction.getTimestamp() < since) {
            return false;
        }
        if (until != null && transaction.getTimestamp() >= until) {
            return false;
        }
        if (!scope.allows(transaction.getHost())) {
            return false;
        }
        return text == null || containsText(transaction);
    }

    private boolean containsText(Transaction t) {
        return containsIgnoreCase(t.getUrl(), text)
            || containsIgnoreCase(t.getRequestBody(), text)
            || containsIgnoreCase(t.getResponseBody(), text)
            || (t.getRequestHeaders() != null && containsIgnoreCase(t.getRequestHeaders().toString(), text))
            || (t.getResponseHeaders() != null && containsIgnoreCase(t.getResponseHeaders().toString(), text));
    }

    /**
     * Поиск подстроки без учета регистра, включая кириллицу.
     * Хранилище регистрирует эту же функцию в SQLite для текстового фильтра.
     */
    public static boolean containsIgnoreCase(String haystack, String needle) {
        if (haystack == null || needle == null) {
            return false;
        }
        return haystack.toLowerCase(Locale.ROOT).contains(needle.toLowerCase(Locale.ROOT));
    }

    private static Integer parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException | NullPointerException e) {
            throw new InvalidQueryException("Некорректное значение " + name + ": " + value);
        }
    }

    private static Double parseDouble(String name, String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException | NullPointerException e) {
            throw new InvalidQueryException("Некорректное значение " + name + ": " + value);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String blankToNull(String value) {
        return isBlank(value) ? null : value.trim();
    }
}
