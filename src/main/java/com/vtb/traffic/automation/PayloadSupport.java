package com.vtb.traffic.automation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.traffic.models.Transaction;
import com.vtb.traffic.query.HostMatch;

import java.util.Optional;

/**
 * Разбор перехваченных тел запросов
 */
final class PayloadSupport {

    static final ObjectMapper MAPPER = new ObjectMapper();
    static final String BEARER_PREFIX = "Bearer ";

    private PayloadSupport() {
    }

    static Optional<JsonNode> jsonObject(String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = MAPPER.readTree(body);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    static Optional<String> bearer(Transaction transaction) {
        if (transaction.getRequestHeaders() == null) {
            return Optional.empty();
        }
        String authorization = transaction.requestHeader("Authorization");
        if (authorization == null) {
            return Optional.empty();
        }
        String value = authorization.trim();
        if (!value.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return Optional.empty();
        }
        String credential = value.substring(BEARER_PREFIX.length()).trim();
        return credential.isEmpty() ? Optional.empty() : Optional.of(credential);
    }

    static boolean isTargetHost(Transaction transaction, AutomationProfile profile) {
        return HostMatch.SUFFIX.matches(transaction.getHost(), profile.getTargetHost());
    }

    static String pathOf(Transaction transaction) {
        String path = transaction.getPath();
        if (path == null) {
            return transaction.getUrl() != null ? transaction.getUrl() : "";
        }
        int query = path.indexOf('?');
        return query >= 0 ? path.substring(0, query) : path;
    }
}
