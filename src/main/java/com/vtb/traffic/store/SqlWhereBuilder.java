package com.vtb.traffic.store;

import com.vtb.traffic.query.HostMatch;
import com.vtb.traffic.query.QueryCriteria;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Преобразует {@link QueryCriteria} в параметризованное WHERE-условие.
 * Значения передаются только через параметры.
 */
final class SqlWhereBuilder {

    private final List<String> conditions = new ArrayList<>();
    private final List<Object> parameters = new ArrayList<>();

    static SqlWhereBuilder from(QueryCriteria criteria) {
        SqlWhereBuilder builder = new SqlWhereBuilder();
        if (criteria == null) {
            return builder;
        }
        criteria.validate();

        if (criteria.getMethod() != null) {
            builder.add("UPPER(method) = ?", criteria.getMethod().trim().toUpperCase(Locale.ROOT));
        }
        if (criteria.getHost() != null) {
            builder.addHost(criteria.getHost(), criteria.getHostMatch());
        }
        if (criteria.getStatusCode() != null) {
            builder.add("response_status = ?", criteria.getStatusCode());
        }
        if (criteria.getProtocol() != null) {
            builder.add("LOWER(protocol) = ?", criteria.getProtocol().trim().toLowerCase(Locale.ROOT));
        }
        if (criteria.getSince() != null) {
            builder.add("timestamp >= ?", criteria.getSince());
        }
        if (criteria.getUntil() != null) {
            builder.add("timestamp < ?", criteria.getUntil());
        }
        if (criteria.getText() != null) {
            String fn = ContainsTextFunction.NAME;
            builder.conditions.add("(" + fn + "(url, ?) OR " + fn + "(request_body, ?) " +
                "OR " + fn + "(response_body, ?) OR " + fn + "(request_headers, ?) " +
                "OR " + fn + "(response_headers, ?))");
            for (int i = 0; i < 5; i++) {
                builder.parameters.add(criteria.getText());
            }
        }
        if (criteria.getScope().isRestricted()) {
            List<String> parts = new ArrayList<>();
            for (String suffix : criteria.getScope().getSuffixes()) {
                parts.add("(LOWER(host) = ? OR LOWER(host) LIKE ? ESCAPE '\\')");
                builder.parameters.add(suffix);
                builder.parameters.add("%." + escapeLike(suffix));
            }
            builder.conditions.add("(" + String.join(" OR ", parts) + ")");
        }
        return builder;
    }

    private void addHost(String host, HostMatch match) {
        String normalized = host.trim().toLowerCase(Locale.ROOT);
        while (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        if (match == HostMatch.EXACT) {
            add("LOWER(host) = ?", normalized);
        } else {
            conditions.add("(LOWER(host) = ? OR LOWER(host) LIKE ? ESCAPE '\\')");
            parameters.add(normalized);
            parameters.add("%." + escapeLike(normalized));
        }
    }

    /**
     * Дополнительное условие (например, keyset-пагинация)
     */
    SqlWhereBuilder and(String condition, Object value) {
        add(condition, value);
        return this;
    }

    private void add(String condition, Object value) {
        conditions.add(condition);
        parameters.add(value);
    }

    String toSql() {
        return conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
    }

    List<Object> getParameters() {
        return parameters;
    }

    static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
