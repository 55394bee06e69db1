package com.vtb.traffic.automation;

import com.fasterxml.jackson.databind.JsonNode;
import com.vtb.traffic.models.AutomationTarget;
import com.vtb.traffic.models.Transaction;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Поиск кандидатов на действие в истории трафика. Чистая функция.
 *
 * <p>Цель - пара (ресурс, часть). Цель считается выполненной, если среди перехваченных
 * запросов есть запрос с флагом завершения и успешным (2xx) ответом.
 */
public final class TargetEnumerator {

    private TargetEnumerator() {
    }

    /**
     * @param snapshot транзакции от новых к старым
     * @return цели в порядке первого появления в снимке
     */
    public static List<AutomationTarget> enumerate(Iterable<Transaction> snapshot, AutomationProfile profile) {
        Map<String, AutomationTarget> targets = new LinkedHashMap<>();

        for (Transaction transaction : snapshot) {
            if (!PayloadSupport.isTargetHost(transaction, profile)
                || !profile.getActionMethod().equalsIgnoreCase(transaction.getMethod())) {
                continue;
            }
            Matcher matcher = profile.getActionPathPattern().matcher(PayloadSupport.pathOf(transaction));
            if (!matcher.find()) {
                continue;
            }
            String resourceId = matcher.group(1);
            Optional<JsonNode> body = PayloadSupport.jsonObject(transaction.getRequestBody());
            if (!AutomationProfile.isValidResourceId(resourceId) || body.isEmpty()) {
                continue;
            }

            int part = body.get().path(profile.getPartField()).asInt(0);
            boolean complete = body.get().path(profile.getCompleteField()).asBoolean(false);
            boolean accepted = transaction.getResponseStatus() != null
                && transaction.getResponseStatus() >= 200 && transaction.getResponseStatus() < 300;

            String key = resourceId + "#" + part;
            AutomationTarget target = targets.get(key);
            if (target == null) {
                target = AutomationTarget.builder()
                    .resourceId(resourceId)
                    .partIndex(part)
                    .sourceTransactionId(transaction.getId())
                    .build();
                targets.put(key, target);
            }
            if (complete && accepted) {
                target.setObservedComplete(true);
            }
        }
        return new ArrayList<>(targets.values());
    }
}
