package com.vtb.traffic.heuristics;

import com.vtb.traffic.config.TrafficConfig;
import com.vtb.traffic.models.Finding;
import com.vtb.traffic.models.FindingCategory;
import com.vtb.traffic.models.OffenderSummary;
import com.vtb.traffic.models.SessionReport;
import com.vtb.traffic.models.Severity;
import com.vtb.traffic.models.Transaction;
import com.vtb.traffic.models.TransactionAnalysis;
import com.vtb.traffic.query.QueryEngine;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Сводка по последним транзакциям сессии.
 * Агрегаты строятся только из находок {@link TransactionAnalyzer}.
 */
@Slf4j
public class SessionAnalyzer {

    private static final double FAILURE_RATE_THRESHOLD = 0.10;

    private final QueryEngine queryEngine;
    private final TransactionAnalyzer analyzer;
    private final TrafficConfig.Analyzer settings;

    public SessionAnalyzer(QueryEngine queryEngine, TransactionAnalyzer analyzer, TrafficConfig.Analyzer settings) {
        this.queryEngine = queryEngine;
        this.analyzer = analyzer;
        this.settings = settings;
        this.settings.ensureDefaults();
    }

    public SessionReport analyzeSession() {
        return analyzeSession(settings.getSessionLimit());
    }

    /**
     * Проанализировать последние {@code limit} транзакций в области движка запросов
     */
    public SessionReport analyzeSession(int limit) {
        List<Transaction> transactions = queryEngine.recent(limit);
        log.info("Анализ сессии: {} транзакций", transactions.size());
        return summarize(transactions);
    }

    SessionReport summarize(List<Transaction> transactions) {
        Map<String, Long> findingCounts = new TreeMap<>();
        Map<FindingCategory, Long> categoryCounts = new EnumMap<>(FindingCategory.class);
        Map<Severity, Long> severityCounts = new EnumMap<>(Severity.class);
        for (FindingCategory category : FindingCategory.values()) {
            categoryCounts.put(category, 0L);
        }
        for (Severity severity : Severity.values()) {
            severityCounts.put(severity, 0L);
        }

        Map<String, Long> methods = new LinkedHashMap<>();
        Map<Integer, Long> statusCodes = new TreeMap<>();
        Set<String> hosts = new HashSet<>();
        List<OffenderSummary> offenders = new ArrayList<>();
        double totalDuration = 0;
        int skipped = 0;
        long plaintext = 0;
        long failed = 0;
        long slow = 0;

        for (Transaction transaction : transactions) {
            TransactionAnalysis analysis = analyzer.inspect(transaction);
            skipped += analysis.getSkippedRules().size();

            for (Finding finding : analysis.getFindings()) {
                findingCounts.merge(finding.getRuleId(), 1L, Long::sum);
                categoryCounts.merge(finding.getCategory(), 1L, Long::sum);
                severityCounts.merge(finding.getSeverity(), 1L, Long::sum);
                if (SecurityRules.PLAINTEXT_PROTOCOL.equals(finding.getRuleId())) {
                    plaintext++;
                }
                if (PerformanceRules.SLOW_REQUEST.equals(finding.getRuleId())) {
                    slow++;
                }
            }
            if (!analysis.getFindings().isEmpty()) {
                offenders.add(toOffender(transaction, analysis));
            }

            String method = transaction.getMethod() != null ? transaction.getMethod().toUpperCase(Locale.ROOT) : "?";
            methods.merge(method, 1L, Long::sum);
            if (transaction.getResponseStatus() != null) {
                statusCodes.merge(transaction.getResponseStatus(), 1L, Long::sum);
                if (transaction.getResponseStatus() >= 400) {
                    failed++;
                }
            }
            if (transaction.getHost() != null) {
                hosts.add(transaction.getHost().toLowerCase(Locale.ROOT));
            }
            totalDuration += transaction.getDuration();
        }

        offenders.sort(Comparator.comparingInt(OffenderSummary::getScore).reversed()
            .thenComparing(Comparator.comparingLong(OffenderSummary::getTransactionId).reversed()));
        int top = settings.getTopOffenders();
        List<OffenderSummary> topOffenders = offenders.size() > top
            ? new ArrayList<>(offenders.subList(0, top)) : offenders;

        return SessionReport.builder()
            .generatedAt(Instant.now())
            .analyzedTransactions(transactions.size())
            .uniqueHosts(hosts.size())
            .avgDurationSec(transactions.isEmpty() ? 0.0 : totalDuration / transactions.size())
            .skippedRules(skipped)
            .findingCounts(findingCounts)
            .categoryCounts(categoryCounts)
            .severityCounts(severityCounts)
            .topOffenders(topOffenders)
            .methods(methods)
            .statusCodes(statusCodes)
            .recommendations(recommendations(transactions.size(), plaintext, failed, slow))
            .build();
    }

    private OffenderSummary toOffender(Transaction transaction, TransactionAnalysis analysis) {
        Severity highest = Severity.INFO;
        for (Finding finding : analysis.getFindings()) {
            if (finding.getSeverity().isAtLeast(highest)) {
                highest = finding.getSeverity();
            }
        }
        return OffenderSummary.builder()
            .transactionId(analysis.getTransactionId())
            .method(transaction.getMethod())
            .url(transaction.getUrl())
            .score(analysis.score())
            .findingCount(analysis.getFindings().size())
            .highestSeverity(highest)
            .build();
    }

    private List<String> recommendations(int total, long plaintext, long failed, long slow) {
        List<String> result = new ArrayList<>();
        if (plaintext > 0) {
            result.add(plaintext + " запрос(ов) по незащищенному HTTP: переведите на HTTPS");
        }
        if (total > 0 && failed > total * FAILURE_RATE_THRESHOLD) {
            result.add(String.format(Locale.ROOT,
                "Высокая доля ошибок (%d/%d): проверьте ответы 4xx/5xx", failed, total));
        }
        if (slow > 0) {
            result.add(slow + " медленных запрос(ов): оптимизируйте производительность");
        }
        return result;
    }
}
