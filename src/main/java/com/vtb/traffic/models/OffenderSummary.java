package com.vtb.traffic.models;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class OffenderSummary {
    private long transactionId;
    private String method;
    private String url;
    private int score;
    private int findingCount;
    private Severity highestSeverity;
}
