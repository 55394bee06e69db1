package com.vtb.traffic.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Сериализация упорядоченных заголовков в JSON-текст для хранения
 */
@Slf4j
final class HeaderCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private HeaderCodec() {
    }

    static String encode(Map<String, String> headers) {
        if (headers == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(headers);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Не удалось сериализовать заголовки: " + e.getMessage(), e);
        }
    }

    /**
     * Разобрать заголовки из хранилища.
     *
     * @return {@code null}, если текст поврежден; правила анализа с такими заголовками пропускаются
     */
    static Map<String, String> decode(String json, long transactionId) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            JsonNode node = MAPPER.readTree(json);
            if (node == null || !node.isObject()) {
                log.warn("Заголовки транзакции {} не являются JSON-объектом", transactionId);
                return null;
            }
            Map<String, String> headers = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode value = field.getValue();
                headers.put(field.getKey(), value == null || value.isNull() ? null : value.asText());
            }
            return headers;
        } catch (JsonProcessingException e) {
            log.warn("Поврежденные заголовки у транзакции {}: {}", transactionId, e.getOriginalMessage());
            return null;
        }
    }
}
