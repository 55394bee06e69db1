package com.vtb.traffic.models;

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Агрегированная статистика по трафику
 */
@Data
@Builder
public class TrafficStatistics {
    private long totalRequests;
    private long uniqueHosts;
    private double avgDurationSec;
    private double minDurationSec;
    private double maxDurationSec;
    private long slowRequests;
    @Builder.Default
    private Map<String, Long> methods = new LinkedHashMap<>();
    @Builder.Default
    private Map<Integer, Long> statusCodes = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, Long> topHosts = new LinkedHashMap<>();
}
