package com.vtb.traffic.replay;

import com.vtb.traffic.models.Transaction;
import lombok.Builder;
import lombok.Data;
import okhttp3.HttpUrl;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Результат повтора. Не сохраняется, пока вызывающий код явно не добавит {@link #toTransaction()}.
 */
@Data
@Builder
public class ReplayResult {
    private long sourceTransactionId;
    private int status;
    private double durationSec;
    /** Начало тела ответа для вывода */
    private String responseSummary;
    private String responseBody;
    @Builder.Default
    private Map<String, String> responseHeaders = new LinkedHashMap<>();
    private SentRequest sentRequest;
    /** Время отправки, секунды с начала эпохи */
    private double timestamp;

    /**
     * Новая транзакция для хранилища: отправленный запрос и полученный ответ
     */
    public Transaction toTransaction() {
        HttpUrl url = HttpUrl.parse(sentRequest.getUrl());
        String path = url != null ? url.encodedPath() + (url.encodedQuery() != null ? "?" + url.encodedQuery() : "") : null;
        return Transaction.builder()
            .timestamp(timestamp)
            .method(sentRequest.getMethod())
            .url(sentRequest.getUrl())
            .host(url != null ? url.host() : null)
            .path(path)
            .protocol(url != null ? url.scheme() : null)
            .requestHeaders(new LinkedHashMap<>(sentRequest.getHeaders()))
            .requestBody(sentRequest.getBody())
            .responseStatus(status)
            .responseHeaders(new LinkedHashMap<>(responseHeaders))
            .responseBody(responseBody)
            .duration(durationSec)
            .notes("Повтор транзакции #" + sourceTransactionId)
            .build();
    }
}
