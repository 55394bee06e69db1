package com.vtb.traffic.reports;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vtb.traffic.models.SessionReport;
import com.vtb.traffic.models.TransactionAnalysis;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON-представление результатов анализа (сводка сессии, разбор транзакции)
 */
@Slf4j
public class SessionReportWriter {

    private final ObjectMapper objectMapper;

    public SessionReportWriter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(SessionReport report) throws IOException {
        if (report == null) {
            throw new IllegalArgumentException("SessionReport не может быть null");
        }
        return objectMapper.writeValueAsString(report);
    }

    public String toJson(TransactionAnalysis analysis) throws IOException {
        if (analysis == null) {
            throw new IllegalArgumentException("TransactionAnalysis не может быть null");
        }
        return objectMapper.writeValueAsString(analysis);
    }

    public void write(SessionReport report, Path outputPath) throws IOException {
        log.info("Сохранение сводки сессии: {}", outputPath);
        Files.writeString(outputPath, toJson(report));
        log.info("Сводка сохранена: {} ({} байт)", outputPath, Files.size(outputPath));
    }
}
