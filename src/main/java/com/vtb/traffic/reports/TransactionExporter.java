package com.vtb.traffic.reports;

import com.vtb.traffic.models.Transaction;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Интерфейс для экспорта транзакций.
 * Реализации пишут потоково и не держат всю выборку в памяти.
 */
public interface TransactionExporter {

    /**
     * Записать транзакции в поток. Поток не закрывается.
     *
     * @return количество записанных транзакций
     * @throws IOException если произошла ошибка записи
     */
    long export(Iterable<Transaction> transactions, OutputStream out) throws IOException;

    /**
     * Получить расширение файла
     */
    String getFileExtension();

    default long export(Iterable<Transaction> transactions, Path outputPath) throws IOException {
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = Files.newOutputStream(outputPath)) {
            return export(transactions, out);
        }
    }
}
