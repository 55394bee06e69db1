package com.vtb.traffic.automation;

import com.vtb.traffic.models.Transaction;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

final class AutomationFixtures {

    static final String SCOPE = "COURSE-7";

    private AutomationFixtures() {
    }

    static AutomationProfile profile(String host, String actionBaseUrl, boolean recordResults) {
        return profile(host, actionBaseUrl, recordResults, 1000);
    }

    static AutomationProfile profile(String host, String actionBaseUrl, boolean recordResults, int scanLimit) {
        return AutomationProfile.builder()
            .targetHost(host)
            .actionPathPattern(Pattern.compile("/content_resource/(\\d+)/activity"))
            .actionUrlTemplate(actionBaseUrl + "/v1/content_resource/{resourceId}/activity")
            .actionMethod("POST")
            .scopeField("scope_code")
            .partField("part")
            .completeField("complete")
            .completionEvent("completed")
            .delayMs(10)
            .scanLimit(scanLimit)
            .recordResults(recordResults)
            .build();
    }

    /**
     * Перехваченный запрос действия к ресурсу
     */
    static Transaction.TransactionBuilder action(String baseUrl, String host, String resourceId, int part,
                                                 boolean complete, String token, Integer status) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", "application/json");
        if (token != null) {
            headers.put("Authorization", "Bearer " + token);
        }
        String body = "{\"part\":" + part + ",\"complete\":" + complete + ",\"scope_code\":\"" + SCOPE + "\"}";
        String url = baseUrl + "/v1/content_resource/" + resourceId + "/activity";
        return Transaction.builder()
            .timestamp(1_700_000_000.0)
            .method("POST")
            .url(url)
            .host(host)
            .path("/v1/content_resource/" + resourceId + "/activity")
            .protocol(url.startsWith("https:") ? "https" : "http")
            .requestHeaders(headers)
            .requestBody(body)
            .responseStatus(status)
            .duration(0.1);
    }
}
