package com.vtb.traffic.automation;

import com.fasterxml.jackson.databind.JsonNode;
import com.vtb.traffic.models.SessionContext;
import com.vtb.traffic.models.Transaction;

import java.time.Clock;
import java.util.Optional;

/**
 * Извлечение сессии из истории трафика. Чистая функция: не пишет и не обращается к сети.
 */
public final class SessionDeriver {

    private SessionDeriver() {
    }

    public static Optional<SessionContext> derive(Iterable<Transaction> snapshot, AutomationProfile profile) {
        return derive(snapshot, profile, Clock.systemUTC());
    }

    /**
     * Найти самую свежую транзакцию к целевому хосту с Bearer-токеном
     *
     * @param snapshot транзакции от новых к старым
     */
    public static Optional<SessionContext> derive(Iterable<Transaction> snapshot, AutomationProfile profile, Clock clock) {
        Transaction source = null;
        String credential = null;
        String scope = null;

        for (Transaction transaction : snapshot) {
            if (!PayloadSupport.isTargetHost(transaction, profile)) {
                continue;
            }
            Optional<String> bearer = PayloadSupport.bearer(transaction);
            if (bearer.isEmpty()) {
                continue;
            }
            if (source == null) {
                source = transaction;
                credential = bearer.get();
                scope = scopeOf(transaction, profile);
                if (scope != null) {
                    break;
                }
            } else if (credential.equals(bearer.get())) {
                // Идентификатор области берем из более старого запроса с тем же токеном
                scope = scopeOf(transaction, profile);
                if (scope != null) {
                    break;
                }
            }
        }

        if (source == null) {
            return Optional.empty();
        }
        return Optional.of(SessionContext.builder()
            .host(source.getHost())
            .bearerCredential(credential)
            .scopeIdentifier(scope)
            .derivedFromTransactionId(source.getId() != null ? source.getId() : 0L)
            .derivedAt(clock.instant())
            .build());
    }

    private static String scopeOf(Transaction transaction, AutomationProfile profile) {
        return PayloadSupport.jsonObject(transaction.getRequestBody())
            .map(body -> body.get(profile.getScopeField()))
            .filter(node -> node != null && !node.isNull() && !node.isContainerNode())
            .map(JsonNode::asText)
            .filter(text -> !text.isBlank())
            .orElse(null);
    }
}
