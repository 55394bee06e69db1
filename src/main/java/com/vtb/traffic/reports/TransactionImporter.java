package com.vtb.traffic.reports;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.traffic.errors.ValidationException;
import com.vtb.traffic.models.Transaction;
import com.vtb.traffic.store.TransactionStore;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.vtb.traffic.reports.TransactionJsonFields.*;

/**
 * Импорт JSON-экспорта обратно в хранилище.
 * Массив читается потоково, по одному объекту; id из файла не используется.
 */
@Slf4j
public class TransactionImporter {

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Разобрать файл экспорта без записи в хранилище
     */
    public List<Transaction> read(InputStream in) throws IOException {
        List<Transaction> result = new ArrayList<>();
        readEach(in, result::add);
        return result;
    }

    /**
     * Добавить все транзакции из файла в хранилище
     *
     * @return количество добавленных транзакций
     */
    public long importInto(TransactionStore store, Path inputPath) throws IOException {
        log.info("Импорт транзакций из {}", inputPath);
        try (InputStream in = Files.newInputStream(inputPath)) {
            return importInto(store, in);
        }
    }

    public long importInto(TransactionStore store, InputStream in) throws IOException {
        long[] count = {0};
        readEach(in, t -> {
            store.append(t);
            count[0]++;
        });
        log.info("Импортировано транзакций: {}", count[0]);
        return count[0];
    }

    private interface TransactionSink {
        void accept(Transaction transaction);
    }

    private void readEach(InputStream in, TransactionSink sink) throws IOException {
        try (JsonParser parser = objectMapper.getFactory().createParser(in)) {
            if (parser.nextToken() != JsonToken.START_ARRAY) {
                throw new ValidationException("Ожидался JSON-массив транзакций");
            }
            int index = 0;
            while (parser.nextToken() == JsonToken.START_OBJECT) {
                JsonNode node = parser.readValueAsTree();
                sink.accept(toTransaction(node, index++));
            }
            if (parser.currentToken() != JsonToken.END_ARRAY) {
                throw new ValidationException("Элемент #" + index + " не является объектом транзакции");
            }
        }
    }

    private Transaction toTransaction(JsonNode node, int index) {
        JsonNode status = node.get(RESPONSE_STATUS);
        return Transaction.builder()
            .timestamp(requireNumber(node, TIMESTAMP, index))
            .method(text(node, METHOD))
            .url(text(node, URL))
            .host(text(node, HOST))
            .path(text(node, PATH))
            .protocol(text(node, PROTOCOL))
            .requestHeaders(headers(node.get(REQUEST_HEADERS)))
            .requestBody(text(node, REQUEST_BODY))
            .requestBodyTruncated(node.path(REQUEST_BODY_TRUNCATED).asBoolean(false))
            .responseStatus(status == null || status.isNull() ? null : status.asInt())
            .responseHeaders(headers(node.get(RESPONSE_HEADERS)))
            .responseBody(text(node, RESPONSE_BODY))
            .responseBodyTruncated(node.path(RESPONSE_BODY_TRUNCATED).asBoolean(false))
            .duration(node.path(DURATION).asDouble(0.0))
            .analyzed(node.path(ANALYZED).asBoolean(false))
            .notes(text(node, NOTES))
            .build();
    }

    private static double requireNumber(JsonNode node, String field, int index) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            throw new ValidationException("Транзакция #" + index + ": поле " + field + " должно быть числом");
        }
        return value.asDouble();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Map<String, String> headers(JsonNode node) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (node == null || !node.isObject()) {
            return headers;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            headers.put(field.getKey(), field.getValue().isNull() ? null : field.getValue().asText());
        }
        return headers;
    }
}
