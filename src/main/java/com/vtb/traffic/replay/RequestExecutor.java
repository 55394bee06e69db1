package com.vtb.traffic.replay;

import com.vtb.traffic.errors.NetworkException;
import com.vtb.traffic.errors.TransportTimeoutException;
import com.vtb.traffic.errors.ValidationException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Headers;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Отправка одного запроса без повторов.
 * Таймаут отличается от прочих сетевых ошибок типом исключения.
 */
@Slf4j
public class RequestExecutor {

    private static final MediaType DEFAULT_MEDIA_TYPE = MediaType.parse("application/octet-stream");
    private static final Set<String> NO_BODY_METHODS = Set.of("GET", "HEAD");
    private static final Set<String> BODY_REQUIRED_METHODS = Set.of("POST", "PUT", "PATCH", "PROPPATCH", "REPORT");

    private final OkHttpClient httpClient;

    public RequestExecutor(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    /**
     * @throws TransportTimeoutException если ответ не получен за отведенное время
     * @throws NetworkException при ошибке соединения или ввода-вывода
     */
    public ExecutedResponse execute(SentRequest sent) {
        Request request = buildRequest(sent);
        double startedAt = System.currentTimeMillis() / 1000.0;
        long start = System.nanoTime();
        try (Response response = httpClient.newCall(request).execute()) {
            String body = response.body() != null ? response.body().string() : null;
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            log.debug("{} {} -> {} ({} мс)", sent.getMethod(), sent.getUrl(), response.code(), durationMs);
            return ExecutedResponse.builder()
                .status(response.code())
                .headers(flatten(response.headers()))
                .body(body)
                .durationSec(durationMs / 1000.0)
                .startedAt(startedAt)
                .build();
        } catch (InterruptedIOException timeout) {
            log.warn("Таймаут запроса {} {}", sent.getMethod(), sent.getUrl());
            throw new TransportTimeoutException("Нет ответа от " + request.url().host() + ": " + timeout.getMessage(), timeout);
        } catch (IOException ioe) {
            log.warn("Сетевая ошибка {} {}: {}", sent.getMethod(), sent.getUrl(), ioe.getMessage());
            throw new NetworkException("Сетевая ошибка при обращении к " + request.url().host() + ": " + ioe.getMessage(), ioe);
        }
    }

    Request buildRequest(SentRequest sent) {
        HttpUrl url = sent.getUrl() != null ? HttpUrl.parse(sent.getUrl()) : null;
        if (url == null) {
            throw new ValidationException("Некорректный URL запроса: " + sent.getUrl());
        }
        Request.Builder builder = new Request.Builder().url(url);
        String contentType = null;
        for (Map.Entry<String, String> header : sent.getHeaders().entrySet()) {
            if (header.getKey() == null || header.getValue() == null) {
                continue;
            }
            if ("Content-Type".equalsIgnoreCase(header.getKey())) {
                contentType = header.getValue();
            }
            try {
                builder.addHeader(header.getKey(), header.getValue());
            } catch (IllegalArgumentException e) {
                log.warn("Заголовок {} пропущен: {}", header.getKey(), e.getMessage());
            }
        }

        String method = sent.getMethod() != null ? sent.getMethod().toUpperCase(Locale.ROOT) : "GET";
        String body = sent.getBody();
        RequestBody requestBody = null;
        if (!NO_BODY_METHODS.contains(method)) {
            MediaType mediaType = contentType != null ? MediaType.parse(contentType) : null;
            if (body != null) {
                requestBody = RequestBody.create(body, mediaType != null ? mediaType : DEFAULT_MEDIA_TYPE);
            } else if (BODY_REQUIRED_METHODS.contains(method)) {
                requestBody = RequestBody.create(new byte[0], mediaType);
            }
        } else if (body != null && !body.isEmpty()) {
            log.debug("Тело {}-запроса не отправляется", method);
        }
        builder.method(method, requestBody);
        return builder.build();
    }

    static Map<String, String> flatten(Headers headers) {
        Map<String, String> result = new LinkedHashMap<>();
        for (String name : headers.names()) {
            result.put(name, String.join(", ", headers.values(name)));
        }
        return result;
    }
}
