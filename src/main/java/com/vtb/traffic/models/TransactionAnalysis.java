package com.vtb.traffic.models;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Находки по транзакции и правила, пропущенные из-за некорректных данных
 */
@Data
@Builder
public class TransactionAnalysis {
    private long transactionId;
    @Builder.Default
    private List<Finding> findings = new ArrayList<>();
    @Builder.Default
    private List<String> skippedRules = new ArrayList<>();

    public int score() {
        return findings.stream().mapToInt(f -> f.getSeverity().getWeight()).sum();
    }

    public long count(FindingCategory category) {
        return findings.stream().filter(f -> f.getCategory() == category).count();
    }
}
