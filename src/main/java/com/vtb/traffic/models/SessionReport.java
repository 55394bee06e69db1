package com.vtb.traffic.models;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Сводка по последним транзакциям. Строится только из находок по отдельным транзакциям.
 */
@Data
@Builder
public class SessionReport {
    private Instant generatedAt;
    private int analyzedTransactions;
    private int uniqueHosts;
    private double avgDurationSec;
    private int skippedRules;

    @Builder.Default
    private Map<String, Long> findingCounts = new LinkedHashMap<>();
    @Builder.Default
    private Map<FindingCategory, Long> categoryCounts = new EnumMap<>(FindingCategory.class);
    @Builder.Default
    private Map<Severity, Long> severityCounts = new EnumMap<>(Severity.class);
    @Builder.Default
    private List<OffenderSummary> topOffenders = new ArrayList<>();

    @Builder.Default
    private Map<String, Long> methods = new LinkedHashMap<>();
    @Builder.Default
    private Map<Integer, Long> statusCodes = new LinkedHashMap<>();
    @Builder.Default
    private List<String> recommendations = new ArrayList<>();

    public long countFor(String ruleId) {
        return findingCounts.getOrDefault(ruleId, 0L);
    }

    public long countFor(FindingCategory category) {
        return categoryCounts.getOrDefault(category, 0L);
    }
}
