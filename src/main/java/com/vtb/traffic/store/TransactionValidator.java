package com.vtb.traffic.store;

import com.vtb.traffic.config.TrafficConfig;
import com.vtb.traffic.errors.ValidationException;
import com.vtb.traffic.models.Transaction;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.LinkedHashMap;
import java.util.Locale;

/**
 * Проверка и нормализация транзакции перед записью.
 * Исходный объект не меняется; возвращается копия с выведенными полями и обрезанными телами.
 */
final class TransactionValidator {

    private final int bodySizeLimit;
    private final String truncationMarker;

    TransactionValidator(TrafficConfig.Store settings) {
        this.bodySizeLimit = settings.getBodySizeLimit();
        this.truncationMarker = settings.getTruncationMarker();
    }

    Transaction normalize(Transaction transaction) {
        if (transaction == null) {
            throw new ValidationException("Транзакция не может быть null");
        }
        requireField("method", transaction.getMethod());
        requireField("url", transaction.getUrl());
        requireField("host", transaction.getHost());

        double timestamp = transaction.getTimestamp();
        if (Double.isNaN(timestamp) || Double.isInfinite(timestamp) || timestamp < 0) {
            throw new ValidationException("Некорректный timestamp: " + timestamp);
        }
        double duration = transaction.getDuration();
        if (Double.isNaN(duration) || Double.isInfinite(duration) || duration < 0) {
            throw new ValidationException("Длительность должна быть неотрицательной: " + duration);
        }

        Transaction.TransactionBuilder builder = transaction.toBuilder().id(null);

        String protocol = transaction.getProtocol();
        if (protocol == null || protocol.isBlank()) {
            protocol = schemeOf(transaction.getUrl());
            builder.protocol(protocol);
        }
        String lowerProtocol = protocol.toLowerCase(Locale.ROOT);
        if (!Transaction.HTTP.equals(lowerProtocol) && !Transaction.HTTPS.equals(lowerProtocol)) {
            throw new ValidationException("Протокол должен быть http или https: " + protocol);
        }

        if (transaction.getPath() == null) {
            builder.path(pathOf(transaction.getUrl()));
        }

        Integer status = transaction.getResponseStatus();
        if (status == null) {
            boolean hasHeaders = transaction.getResponseHeaders() != null && !transaction.getResponseHeaders().isEmpty();
            boolean hasBody = transaction.getResponseBody() != null && !transaction.getResponseBody().isEmpty();
            if (hasHeaders || hasBody) {
                throw new ValidationException("Ответ без кода статуса не может содержать заголовки или тело");
            }
        } else if (status < 100 || status > 599) {
            throw new ValidationException("Код статуса вне диапазона 100..599: " + status);
        }

        if (transaction.getRequestHeaders() == null) {
            builder.requestHeaders(new LinkedHashMap<>());
        }
        if (transaction.getResponseHeaders() == null) {
            builder.responseHeaders(new LinkedHashMap<>());
        }

        String requestBody = transaction.getRequestBody();
        if (exceedsLimit(requestBody)) {
            builder.requestBody(truncate(requestBody)).requestBodyTruncated(true);
        }
        String responseBody = transaction.getResponseBody();
        if (exceedsLimit(responseBody)) {
            builder.responseBody(truncate(responseBody)).responseBodyTruncated(true);
        }
        return builder.build();
    }

    private boolean exceedsLimit(String body) {
        return body != null && body.length() > bodySizeLimit;
    }

    private String truncate(String body) {
        int keep = Math.max(0, bodySizeLimit - truncationMarker.length());
        // Не разрываем суррогатную пару
        if (keep > 0 && Character.isHighSurrogate(body.charAt(keep - 1))) {
            keep--;
        }
        return body.substring(0, keep) + truncationMarker;
    }

    private static void requireField(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Обязательное поле отсутствует: " + name);
        }
    }

    private static String schemeOf(String url) {
        try {
            String scheme = new URI(url.trim()).getScheme();
            if (scheme == null) {
                throw new ValidationException("Не удалось определить протокол из url: " + url);
            }
            return scheme.toLowerCase(Locale.ROOT);
        } catch (URISyntaxException e) {
            throw new ValidationException("Некорректный url: " + url);
        }
    }

    private static String pathOf(String url) {
        try {
            URI uri = new URI(url.trim());
            String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
            return uri.getRawQuery() != null ? path + "?" + uri.getRawQuery() : path;
        } catch (URISyntaxException e) {
            return "/";
        }
    }
}
