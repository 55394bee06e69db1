package com.vtb.traffic.reports;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.vtb.traffic.models.Transaction;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Map;

import static com.vtb.traffic.reports.TransactionJsonFields.*;

/**
 * Экспорт без потерь: JSON-массив плоских объектов со всеми полями транзакции.
 * Формат читается обратно {@link TransactionImporter}.
 */
@Slf4j
public class JsonTransactionExporter implements TransactionExporter {

    private final JsonFactory jsonFactory;
    private final boolean pretty;

    public JsonTransactionExporter() {
        this(true);
    }

    public JsonTransactionExporter(boolean pretty) {
        this.jsonFactory = new JsonFactory();
        this.jsonFactory.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        this.pretty = pretty;
    }

    @Override
    public long export(Iterable<Transaction> transactions, OutputStream out) throws IOException {
        if (transactions == null) {
            throw new IllegalArgumentException("Transactions не может быть null");
        }
        long count = 0;
        try (JsonGenerator gen = jsonFactory.createGenerator(out, JsonEncoding.UTF8)) {
            if (pretty) {
                gen.useDefaultPrettyPrinter();
            }
            gen.writeStartArray();
            for (Transaction t : transactions) {
                writeTransaction(gen, t);
                count++;
            }
            gen.writeEndArray();
        }
        log.info("JSON экспорт: {} транзакций", count);
        return count;
    }

    private void writeTransaction(JsonGenerator gen, Transaction t) throws IOException {
        gen.writeStartObject();
        if (t.getId() != null) {
            gen.writeNumberField(ID, t.getId());
        } else {
            gen.writeNullField(ID);
        }
        gen.writeNumberField(TIMESTAMP, t.getTimestamp());
        gen.writeStringField(METHOD, t.getMethod());
        gen.writeStringField(URL, t.getUrl());
        gen.writeStringField(HOST, t.getHost());
        gen.writeStringField(PATH, t.getPath());
        gen.writeStringField(PROTOCOL, t.getProtocol());
        writeHeaders(gen, REQUEST_HEADERS, t.getRequestHeaders());
        gen.writeStringField(REQUEST_BODY, t.getRequestBody());
        gen.writeBooleanField(REQUEST_BODY_TRUNCATED, t.isRequestBodyTruncated());
        if (t.getResponseStatus() != null) {
            gen.writeNumberField(RESPONSE_STATUS, t.getResponseStatus());
        } else {
            gen.writeNullField(RESPONSE_STATUS);
        }
        writeHeaders(gen, RESPONSE_HEADERS, t.getResponseHeaders());
        gen.writeStringField(RESPONSE_BODY, t.getResponseBody());
        gen.writeBooleanField(RESPONSE_BODY_TRUNCATED, t.isResponseBodyTruncated());
        gen.writeNumberField(DURATION, t.getDuration());
        gen.writeBooleanField(ANALYZED, t.isAnalyzed());
        gen.writeStringField(NOTES, t.getNotes());
        gen.writeEndObject();
    }

    private void writeHeaders(JsonGenerator gen, String field, Map<String, String> headers) throws IOException {
        if (headers == null) {
            gen.writeNullField(field);
            return;
        }
        gen.writeObjectFieldStart(field);
        for (Map.Entry<String, String> header : headers.entrySet()) {
            gen.writeStringField(header.getKey(), header.getValue());
        }
        gen.writeEndObject();
    }

    @Override
    public String getFileExtension() {
        return "json";
    }
}
