package com.vtb.traffic;

import com.vtb.traffic.models.Transaction;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Готовые транзакции для тестов
 */
public final class TestTransactions {

    private TestTransactions() {
    }

    /**
     * HTTPS GET с полным набором заголовков безопасности, кэширования и сжатия
     */
    public static Transaction.TransactionBuilder cleanGet(String host, String path) {
        Map<String, String> requestHeaders = new LinkedHashMap<>();
        requestHeaders.put("Accept", "application/json");
        Map<String, String> responseHeaders = new LinkedHashMap<>();
        responseHeaders.put("Content-Type", "application/json");
        responseHeaders.put("Strict-Transport-Security", "max-age=31536000");
        responseHeaders.put("X-Content-Type-Options", "nosniff");
        responseHeaders.put("X-Frame-Options", "DENY");
        responseHeaders.put("Cache-Control", "no-store");
        responseHeaders.put("Content-Encoding", "gzip");
        return Transaction.builder()
            .timestamp(1_700_000_000.0)
            .method("GET")
            .url("https://" + host + path)
            .host(host)
            .path(path)
            .protocol("https")
            .requestHeaders(requestHeaders)
            .responseStatus(200)
            .responseHeaders(responseHeaders)
            .responseBody("{\"ok\":true}")
            .duration(0.1);
    }

    public static Transaction.TransactionBuilder request(String method, String url) {
        String host = url.replaceFirst("^https?://", "").replaceFirst("[/:?].*$", "");
        return Transaction.builder()
            .timestamp(1_700_000_000.0)
            .method(method)
            .url(url)
            .host(host)
            .protocol(url.startsWith("https:") ? "https" : "http")
            .duration(0.05);
    }
}
