package com.vtb.traffic.models;

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Одна перехваченная пара запрос/ответ.
 *
 * <p>{@code id} назначается хранилищем при добавлении. {@code responseStatus == null}
 * означает, что ответ не был получен; в этом случае заголовки и тело ответа пусты.
 */
@Data
@Builder(toBuilder = true)
public class Transaction {

    public static final String HTTP = "http";
    public static final String HTTPS = "https";

    private Long id;
    /** Время перехвата, секунды с начала эпохи */
    private double timestamp;
    private String method;
    private String url;
    private String host;
    private String path;
    private String protocol;
    @Builder.Default
    private Map<String, String> requestHeaders = new LinkedHashMap<>();
    private String requestBody;
    private boolean requestBodyTruncated;
    private Integer responseStatus;
    @Builder.Default
    private Map<String, String> responseHeaders = new LinkedHashMap<>();
    private String responseBody;
    private boolean responseBodyTruncated;
    /** Длительность, секунды */
    private double duration;
    private boolean analyzed;
    private String notes;

    public boolean hasResponse() {
        return responseStatus != null;
    }

    public boolean isHttps() {
        return HTTPS.equalsIgnoreCase(protocol);
    }

    public String requestHeader(String name) {
        return findHeader(requestHeaders, name);
    }

    public String responseHeader(String name) {
        return findHeader(responseHeaders, name);
    }

    public boolean hasResponseHeader(String name) {
        return responseHeader(name) != null;
    }

    public int requestBodyLength() {
        return requestBody != null ? requestBody.length() : 0;
    }

    public int responseBodyLength() {
        return responseBody != null ? responseBody.length() : 0;
    }

    /**
     * Заголовки HTTP регистронезависимы, а в захвате встречаются оба варианта
     */
    static String findHeader(Map<String, String> headers, String name) {
        if (headers == null || headers.isEmpty() || name == null) {
            return null;
        }
        String direct = headers.get(name);
        if (direct != null) {
            return direct;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey() != null && entry.getKey().toLowerCase(Locale.ROOT).equals(lower)) {
                return entry.getValue();
            }
        }
        return null;
    }
}
