package com.vtb.traffic.heuristics;

import com.vtb.traffic.models.FindingCategory;
import com.vtb.traffic.models.Severity;
import com.vtb.traffic.models.Transaction;

import java.util.Optional;

/**
 * Одно эвристическое правило. Правило не хранит состояния и не обращается к сети.
 */
public interface HeuristicRule {

    /**
     * Стабильный код правила, используется в подсчетах сводки
     */
    String getId();

    FindingCategory getCategory();

    Severity getSeverity();

    /**
     * @return текст находки, если правило сработало
     * @throws RuntimeException если данные транзакции непригодны для правила
     */
    Optional<String> evaluate(Transaction transaction);
}
