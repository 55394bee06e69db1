package com.vtb.traffic.cli;

import com.vtb.traffic.models.Finding;
import com.vtb.traffic.models.Transaction;

import java.io.PrintWriter;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;

/**
 * Текстовое представление для консоли
 */
final class ConsoleFormat {

    static final String LINE = "━".repeat(80);

    private ConsoleFormat() {
    }

    static String row(Transaction t) {
        String status = t.getResponseStatus() != null ? String.valueOf(t.getResponseStatus()) : "---";
        return String.format(Locale.ROOT, "#%-6d %-7s %-4s %6.0f мс  %s",
            t.getId(), t.getMethod(), status, t.getDuration() * 1000, shorten(t.getUrl(), 90));
    }

    static void details(PrintWriter out, Transaction t) {
        out.println(LINE);
        out.printf(Locale.ROOT, "Транзакция #%d%n", t.getId());
        out.println(LINE);
        out.printf("Время:        %s%n", timestamp(t.getTimestamp()));
        out.printf("Запрос:       %s %s%n", t.getMethod(), t.getUrl());
        out.printf("Хост:         %s (%s)%n", t.getHost(), t.getProtocol());
        out.printf("Статус:       %s%n", t.getResponseStatus() != null ? t.getResponseStatus() : "нет ответа");
        out.printf(Locale.ROOT, "Длительность: %.0f мс%n", t.getDuration() * 1000);
        out.printf("Проанализирована: %s%n", t.isAnalyzed() ? "да" : "нет");
        if (t.getNotes() != null) {
            out.printf("Заметки:      %s%n", t.getNotes());
        }
        out.println();
        out.println("Заголовки запроса:");
        headers(out, t.getRequestHeaders());
        if (t.getRequestBody() != null && !t.getRequestBody().isEmpty()) {
            out.println("Тело запроса" + (t.isRequestBodyTruncated() ? " (обрезано)" : "") + ":");
            out.println(t.getRequestBody());
        }
        out.println();
        out.println("Заголовки ответа:");
        headers(out, t.getResponseHeaders());
        if (t.getResponseBody() != null && !t.getResponseBody().isEmpty()) {
            out.println("Тело ответа" + (t.isResponseBodyTruncated() ? " (обрезано)" : "") + ":");
            out.println(t.getResponseBody());
        }
    }

    static void finding(PrintWriter out, Finding finding) {
        out.printf("  [%s] %-14s %s: %s%n",
            finding.getSeverity().getRussianName(), finding.getCategory().getCode(), finding.getRuleId(), finding.getMessage());
    }

    private static void headers(PrintWriter out, Map<String, String> headers) {
        if (headers == null) {
            out.println("  (повреждены)");
            return;
        }
        if (headers.isEmpty()) {
            out.println("  (нет)");
            return;
        }
        headers.forEach((name, value) -> out.printf("  %s: %s%n", name, value));
    }

    static String timestamp(double epochSeconds) {
        return Instant.ofEpochMilli(Math.round(epochSeconds * 1000.0)).toString();
    }

    static String shorten(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max - 3) + "...";
    }
}
