package com.vtb.traffic.heuristics;

import com.vtb.traffic.TestTransactions;
import com.vtb.traffic.config.TrafficConfig;
import com.vtb.traffic.models.FindingCategory;
import com.vtb.traffic.models.OffenderSummary;
import com.vtb.traffic.models.SessionReport;
import com.vtb.traffic.models.Severity;
import com.vtb.traffic.query.QueryEngine;
import com.vtb.traffic.store.SqliteTransactionStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SessionAnalyzerTest {

    @TempDir
    Path tempDir;

    private SqliteTransactionStore store;
    private SessionAnalyzer sessionAnalyzer;

    @BeforeEach
    void setUp() {
        TrafficConfig config = TrafficConfig.defaults();
        config.getAnalyzer().setSlowRequestThresholdSec(1.0);
        store = new SqliteTransactionStore(tempDir.resolve("traffic.db"), config.getStore());
        QueryEngine engine = new QueryEngine(store);
        sessionAnalyzer = new SessionAnalyzer(engine, new TransactionAnalyzer(config.getAnalyzer()), config.getAnalyzer());
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void reportsSlowAndPlaintextButNotErrorStatus() {
        long plaintext = store.append(TestTransactions.cleanGet("a.example", "/")
            .url("http://a.example/").protocol("http").build());
        store.append(TestTransactions.cleanGet("b.example", "/missing").responseStatus(404).build());
        long slow = store.append(TestTransactions.cleanGet("a.example", "/report").duration(3.2).build());

        SessionReport report = sessionAnalyzer.analyzeSession();

        assertEquals(3, report.getAnalyzedTransactions());
        assertEquals(2, report.getUniqueHosts());
        assertEquals(1, report.countFor(PerformanceRules.SLOW_REQUEST));
        assertEquals(1, report.countFor(SecurityRules.PLAINTEXT_PROTOCOL));
        assertEquals(1, report.countFor(FindingCategory.SECURITY));
        assertEquals(1, report.countFor(FindingCategory.PERFORMANCE));
        assertEquals(0, report.countFor(FindingCategory.BEST_PRACTICE));
        assertEquals(2, report.getSeverityCounts().get(Severity.WARNING));
        assertEquals(0L, report.getSeverityCounts().get(Severity.HIGH));
        assertEquals(0, report.getSkippedRules());

        assertEquals(2, report.getTopOffenders().size());
        // Равный счет: более новая транзакция первой
        assertEquals(slow, report.getTopOffenders().get(0).getTransactionId());
        assertEquals(plaintext, report.getTopOffenders().get(1).getTransactionId());
        assertEquals(1L, report.getStatusCodes().get(404));
        assertFalse(report.getRecommendations().isEmpty());
    }

    @Test
    void sessionLimitTakesMostRecent() {
        store.append(TestTransactions.cleanGet("a.example", "/old").duration(5.0).build());
        store.append(TestTransactions.cleanGet("a.example", "/new").build());

        SessionReport report = sessionAnalyzer.analyzeSession(1);
        assertEquals(1, report.getAnalyzedTransactions());
        assertEquals(0, report.countFor(PerformanceRules.SLOW_REQUEST));
        assertTrue(report.getTopOffenders().isEmpty());
    }

    @Test
    void emptyStoreProducesZeroReport() {
        SessionReport report = sessionAnalyzer.analyzeSession();
        assertEquals(0, report.getAnalyzedTransactions());
        assertEquals(0.0, report.getAvgDurationSec());
        assertEquals(0L, report.getCategoryCounts().get(FindingCategory.SECURITY));
        assertTrue(report.getRecommendations().isEmpty());
    }

    @Test
    void offendersRankedByScore() {
        long high = store.append(TestTransactions.cleanGet("a.example", "/v1/login?password=x").build());
        store.append(TestTransactions.cleanGet("a.example", "/v1/slow").duration(2.0).build());

        OffenderSummary top = sessionAnalyzer.analyzeSession().getTopOffenders().get(0);
        assertEquals(high, top.getTransactionId());
        assertEquals(Severity.HIGH, top.getHighestSeverity());
        assertEquals(Severity.HIGH.getWeight(), top.getScore());
    }
}
