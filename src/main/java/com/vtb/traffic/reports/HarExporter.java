package com.vtb.traffic.reports;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.vtb.traffic.models.Transaction;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;

/**
 * Экспорт в HAR 1.2 для просмотра в браузерных инструментах и прокси.
 * Поля, которых нет в захвате (размеры заголовков, фазы соединения), пишутся как -1.
 */
@Slf4j
public class HarExporter implements TransactionExporter {

    static final String HAR_VERSION = "1.2";
    static final String CREATOR_NAME = "VTB Traffic Analyzer";
    static final String CREATOR_VERSION = "1.0.0";
    private static final String HTTP_VERSION = "HTTP/1.1";

    private final JsonFactory jsonFactory;

    public HarExporter() {
        this.jsonFactory = new JsonFactory();
        this.jsonFactory.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    }

    @Override
    public long export(Iterable<Transaction> transactions, OutputStream out) throws IOException {
        if (transactions == null) {
            throw new IllegalArgumentException("Transactions не может быть null");
        }
        long count = 0;
        try (JsonGenerator gen = jsonFactory.createGenerator(out, JsonEncoding.UTF8)) {
            gen.useDefaultPrettyPrinter();
            gen.writeStartObject();
            gen.writeObjectFieldStart("log");
            gen.writeStringField("version", HAR_VERSION);
            gen.writeObjectFieldStart("creator");
            gen.writeStringField("name", CREATOR_NAME);
            gen.writeStringField("version", CREATOR_VERSION);
            gen.writeEndObject();
            gen.writeArrayFieldStart("entries");
            for (Transaction t : transactions) {
                writeEntry(gen, t);
                count++;
            }
            gen.writeEndArray();
            gen.writeEndObject();
            gen.writeEndObject();
        }
        log.info("HAR экспорт: {} записей", count);
        return count;
    }

    private void writeEntry(JsonGenerator gen, Transaction t) throws IOException {
        long timeMs = Math.round(t.getDuration() * 1000.0);
        gen.writeStartObject();
        gen.writeStringField("startedDateTime", isoTimestamp(t.getTimestamp()));
        gen.writeNumberField("time", timeMs);
        writeRequest(gen, t);
        writeResponse(gen, t);
        gen.writeObjectFieldStart("cache");
        gen.writeEndObject();
        gen.writeObjectFieldStart("timings");
        gen.writeNumberField("blocked", -1);
        gen.writeNumberField("dns", -1);
        gen.writeNumberField("connect", -1);
        gen.writeNumberField("send", 0);
        gen.writeNumberField("wait", timeMs);
        gen.writeNumberField("receive", 0);
        gen.writeNumberField("ssl", -1);
        gen.writeEndObject();
        if (t.getNotes() != null) {
            gen.writeStringField("comment", t.getNotes());
        }
        gen.writeEndObject();
    }

    private void writeRequest(JsonGenerator gen, Transaction t) throws IOException {
        gen.writeObjectFieldStart("request");
        gen.writeStringField("method", t.getMethod());
        gen.writeStringField("url", t.getUrl());
        gen.writeStringField("httpVersion", HTTP_VERSION);
        writeCookies(gen, t.requestHeader("Cookie"));
        writeHeaders(gen, t.getRequestHeaders());
        writeQueryString(gen, t.getUrl());
        if (t.getRequestBody() != null && !t.getRequestBody().isEmpty()) {
            gen.writeObjectFieldStart("postData");
            gen.writeStringField("mimeType", orEmpty(t.requestHeader("Content-Type")));
            gen.writeStringField("text", t.getRequestBody());
            gen.writeEndObject();
        }
        gen.writeNumberField("headersSize", -1);
        gen.writeNumberField("bodySize", t.requestBodyLength());
        gen.writeEndObject();
    }

    private void writeResponse(JsonGenerator gen, Transaction t) throws IOException {
        int status = t.getResponseStatus() != null ? t.getResponseStatus() : 0;
        gen.writeObjectFieldStart("response");
        gen.writeNumberField("status", status);
        gen.writeStringField("statusText", statusText(status));
        gen.writeStringField("httpVersion", HTTP_VERSION);
        writeCookies(gen, null);
        writeHeaders(gen, t.getResponseHeaders());
        gen.writeObjectFieldStart("content");
        gen.writeNumberField("size", t.responseBodyLength());
        gen.writeStringField("mimeType", orEmpty(t.responseHeader("Content-Type")));
        if (t.getResponseBody() != null) {
            gen.writeStringField("text", t.getResponseBody());
        }
        gen.writeEndObject();
        gen.writeStringField("redirectURL", orEmpty(t.responseHeader("Location")));
        gen.writeNumberField("headersSize", -1);
        gen.writeNumberField("bodySize", t.hasResponse() ? t.responseBodyLength() : -1);
        gen.writeEndObject();
    }

    private void writeHeaders(JsonGenerator gen, Map<String, String> headers) throws IOException {
        gen.writeArrayFieldStart("headers");
        if (headers != null) {
            for (Map.Entry<String, String> header : headers.entrySet()) {
                writeNameValue(gen, header.getKey(), header.getValue());
            }
        }
        gen.writeEndArray();
    }

    private void writeCookies(JsonGenerator gen, String cookieHeader) throws IOException {
        gen.writeArrayFieldStart("cookies");
        if (cookieHeader != null) {
            for (String cookie : cookieHeader.split(";")) {
                String pair = cookie.trim();
                if (pair.isEmpty()) {
                    continue;
                }
                int eq = pair.indexOf('=');
                writeNameValue(gen, eq >= 0 ? pair.substring(0, eq) : pair, eq >= 0 ? pair.substring(eq + 1) : "");
            }
        }
        gen.writeEndArray();
    }

    private void writeQueryString(JsonGenerator gen, String url) throws IOException {
        gen.writeArrayFieldStart("queryString");
        String query = rawQuery(url);
        if (query != null) {
            for (String pair : query.split("&")) {
                if (pair.isEmpty()) {
                    continue;
                }
                int eq = pair.indexOf('=');
                String name = eq >= 0 ? pair.substring(0, eq) : pair;
                String value = eq >= 0 ? pair.substring(eq + 1) : "";
                writeNameValue(gen, decode(name), decode(value));
            }
        }
        gen.writeEndArray();
    }

    private void writeNameValue(JsonGenerator gen, String name, String value) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("name", name);
        gen.writeStringField("value", orEmpty(value));
        gen.writeEndObject();
    }

    private static String rawQuery(String url) {
        if (url == null) {
            return null;
        }
        try {
            return URI.create(url).getRawQuery();
        } catch (IllegalArgumentException e) {
            int q = url.indexOf('?');
            return q >= 0 ? url.substring(q + 1) : null;
        }
    }

    private static String decode(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return value;
        }
    }

    static String isoTimestamp(double epochSeconds) {
        return Instant.ofEpochMilli(Math.round(epochSeconds * 1000.0)).toString();
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }

    static String statusText(int status) {
        switch (status) {
            case 200: return "OK";
            case 201: return "Created";
            case 202: return "Accepted";
            case 204: return "No Content";
            case 301: return "Moved Permanently";
            case 302: return "Found";
            case 304: return "Not Modified";
            case 307: return "Temporary Redirect";
            case 308: return "Permanent Redirect";
            case 400: return "Bad Request";
            case 401: return "Unauthorized";
            case 403: return "Forbidden";
            case 404: return "Not Found";
            case 405: return "Method Not Allowed";
            case 409: return "Conflict";
            case 422: return "Unprocessable Entity";
            case 429: return "Too Many Requests";
            case 500: return "Internal Server Error";
            case 502: return "Bad Gateway";
            case 503: return "Service Unavailable";
            case 504: return "Gateway Timeout";
            default: return "";
        }
    }

    @Override
    public String getFileExtension() {
        return "har";
    }
}
