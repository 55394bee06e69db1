package com.vtb.traffic.reports;

import com.vtb.traffic.errors.ValidationException;

import java.nio.file.Path;
import java.util.Locale;

public enum ExportFormat {
    JSON("json"),
    HAR("har");

    private final String extension;

    ExportFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    public TransactionExporter createExporter() {
        return this == HAR ? new HarExporter() : new JsonTransactionExporter();
    }

    /**
     * Формат по расширению файла: {@code .har} - HAR, иначе JSON
     */
    public static ExportFormat fromPath(Path path) {
        if (path == null || path.getFileName() == null) {
            return JSON;
        }
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith("." + HAR.extension) ? HAR : JSON;
    }

    public static ExportFormat parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return ExportFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Неизвестный формат экспорта: " + value + " (json, har)");
        }
    }
}
