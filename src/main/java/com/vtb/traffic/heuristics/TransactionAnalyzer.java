package com.vtb.traffic.heuristics;

import com.vtb.traffic.config.TrafficConfig;
import com.vtb.traffic.models.Finding;
import com.vtb.traffic.models.Transaction;
import com.vtb.traffic.models.TransactionAnalysis;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Применяет все правила к одной транзакции.
 *
 * <p>Каждое правило изолировано: исключение внутри правила переводит его в
 * "пропущено" для этой транзакции и не влияет на остальные правила.
 */
@Slf4j
public class TransactionAnalyzer {

    private final List<HeuristicRule> rules;

    public TransactionAnalyzer(TrafficConfig.Analyzer settings) {
        this(defaultRules(settings));
    }

    public TransactionAnalyzer(List<HeuristicRule> rules) {
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
    }

    public static List<HeuristicRule> defaultRules(TrafficConfig.Analyzer settings) {
        settings.ensureDefaults();
        List<HeuristicRule> rules = new ArrayList<>();
        rules.addAll(SecurityRules.create(settings));
        rules.addAll(PerformanceRules.create(settings));
        rules.addAll(BestPracticeRules.create(settings));
        return rules;
    }

    public List<HeuristicRule> getRules() {
        return rules;
    }

    public List<Finding> analyze(Transaction transaction) {
        return inspect(transaction).getFindings();
    }

    public TransactionAnalysis inspect(Transaction transaction) {
        long transactionId = transaction.getId() != null ? transaction.getId() : 0L;
        TransactionAnalysis analysis = TransactionAnalysis.builder()
            .transactionId(transactionId)
            .build();

        for (HeuristicRule rule : rules) {
            try {
                Optional<String> message = rule.evaluate(transaction);
                message.ifPresent(text -> analysis.getFindings().add(Finding.builder()
                    .transactionId(transactionId)
                    .ruleId(rule.getId())
                    .category(rule.getCategory())
                    .severity(rule.getSeverity())
                    .message(text)
                    .build()));
            } catch (RuntimeException e) {
                log.debug("Правило {} пропущено для транзакции {}: {}", rule.getId(), transactionId, e.getMessage());
                analysis.getSkippedRules().add(rule.getId());
            }
        }
        return analysis;
    }
}
