package com.vtb.traffic.heuristics;

import com.vtb.traffic.models.Transaction;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Общие проверки данных для правил
 */
final class RuleSupport {

    private RuleSupport() {
    }

    /**
     * Заголовки ответа, или исключение, если они не разобрались при чтении из хранилища
     */
    static Transaction requireResponseHeaders(Transaction t) {
        if (t.getResponseHeaders() == null) {
            throw new IllegalStateException("Заголовки ответа транзакции " + t.getId() + " повреждены");
        }
        return t;
    }

    static Transaction requireRequestHeaders(Transaction t) {
        if (t.getRequestHeaders() == null) {
            throw new IllegalStateException("Заголовки запроса транзакции " + t.getId() + " повреждены");
        }
        return t;
    }

    static String hostWithoutPort(String host) {
        if (host == null) {
            return "";
        }
        String h = host.trim().toLowerCase(Locale.ROOT);
        if (h.startsWith("[")) {
            int end = h.indexOf(']');
            return end > 0 ? h.substring(0, end + 1) : h;
        }
        int colon = h.indexOf(':');
        if (colon > 0 && h.indexOf(':', colon + 1) < 0) {
            return h.substring(0, colon);
        }
        return h;
    }

    /**
     * Параметры строки запроса в порядке появления; значения декодируются
     */
    static Map<String, String> queryParameters(String url) {
        Map<String, String> parameters = new LinkedHashMap<>();
        String query = rawQuery(url);
        if (query == null || query.isEmpty()) {
            return parameters;
        }
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String name = eq >= 0 ? pair.substring(0, eq) : pair;
            String value = eq >= 0 ? pair.substring(eq + 1) : "";
            parameters.put(decode(name), decode(value));
        }
        return parameters;
    }

    private static String rawQuery(String url) {
        if (url == null) {
            return null;
        }
        try {
            return URI.create(url).getRawQuery();
        } catch (IllegalArgumentException e) {
            int q = url.indexOf('?');
            if (q < 0) {
                return null;
            }
            int hash = url.indexOf('#', q);
            return hash > 0 ? url.substring(q + 1, hash) : url.substring(q + 1);
        }
    }

    private static String decode(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return value;
        }
    }

    static long contentLength(Transaction t) {
        String value = t.responseHeader("Content-Length");
        if (value == null) {
            return -1;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
