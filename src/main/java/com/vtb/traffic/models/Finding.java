package com.vtb.traffic.models;

import lombok.Builder;
import lombok.Data;

/**
 * Результат одного эвристического правила для транзакции.
 * Вычисляется по запросу и не хранится отдельно от транзакции.
 */
@Data
@Builder
public class Finding {
    private long transactionId;
    private String ruleId;
    private FindingCategory category;
    private Severity severity;
    private String message;
}
