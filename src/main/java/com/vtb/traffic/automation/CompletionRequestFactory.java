package com.vtb.traffic.automation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vtb.traffic.models.AutomationTarget;
import com.vtb.traffic.models.SessionContext;
import com.vtb.traffic.replay.SentRequest;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Построение запроса завершения по профилю: Bearer-токен сессии и JSON-тело
 */
public class CompletionRequestFactory {

    private final AutomationProfile profile;
    private final Clock clock;

    public CompletionRequestFactory(AutomationProfile profile, Clock clock) {
        this.profile = profile;
        this.clock = clock;
    }

    public SentRequest build(AutomationTarget target, SessionContext session) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Authorization", PayloadSupport.BEARER_PREFIX + session.getBearerCredential());
        headers.put("Content-Type", "application/json");
        headers.put("Accept", "application/json");
        profile.getExtraHeaders().forEach(headers::putIfAbsent);

        return SentRequest.builder()
            .method(profile.getActionMethod())
            .url(profile.actionUrl(target.getResourceId()))
            .headers(headers)
            .body(payload(target, session))
            .build();
    }

    private String payload(AutomationTarget target, SessionContext session) {
        ObjectNode body = PayloadSupport.MAPPER.createObjectNode();
        body.put(profile.getPartField(), target.getPartIndex());
        body.put(profile.getCompleteField(), true);
        ObjectNode metadata = body.putObject("metadata");
        metadata.put("event", profile.getCompletionEvent());
        metadata.put("timestamp", clock.instant().toString());
        if (session.getScopeIdentifier() != null) {
            body.put(profile.getScopeField(), session.getScopeIdentifier());
        }
        try {
            return PayloadSupport.MAPPER.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Не удалось сериализовать тело запроса: " + e.getMessage(), e);
        }
    }
}
