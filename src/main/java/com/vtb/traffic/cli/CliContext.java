package com.vtb.traffic.cli;

import com.vtb.traffic.automation.AutomationProfile;
import com.vtb.traffic.automation.SessionAutomation;
import com.vtb.traffic.config.TrafficConfig;
import com.vtb.traffic.heuristics.SessionAnalyzer;
import com.vtb.traffic.heuristics.TransactionAnalyzer;
import com.vtb.traffic.query.HostScope;
import com.vtb.traffic.query.QueryEngine;
import com.vtb.traffic.replay.HttpClientFactory;
import com.vtb.traffic.replay.ReplayEngine;
import com.vtb.traffic.replay.RequestExecutor;
import com.vtb.traffic.store.SqliteTransactionStore;
import com.vtb.traffic.store.TransactionStore;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.List;

/**
 * Компоненты, которые нужны одной команде. Хранилище открывается при создании
 * и закрывается вместе с контекстом.
 */
@Slf4j
class CliContext implements AutoCloseable {

    @Getter
    private final TrafficConfig config;
    @Getter
    private final TransactionStore store;
    @Getter
    private final QueryEngine queryEngine;
    private ReplayEngine replayEngine;

    CliContext(TrafficConfig config, Path databasePath, List<String> scopeOverride) {
        this.config = config;
        List<String> suffixes = scopeOverride != null && !scopeOverride.isEmpty()
            ? scopeOverride : config.getScope().getHostSuffixes();
        HostScope scope = HostScope.of(suffixes);
        log.debug("Хранилище: {}, область: {}", databasePath, scope);
        this.store = new SqliteTransactionStore(databasePath, config.getStore());
        this.queryEngine = new QueryEngine(store, scope, config.getStore().getPageSize());
    }

    TransactionAnalyzer transactionAnalyzer() {
        return new TransactionAnalyzer(config.getAnalyzer());
    }

    SessionAnalyzer sessionAnalyzer() {
        return new SessionAnalyzer(queryEngine, transactionAnalyzer(), config.getAnalyzer());
    }

    ReplayEngine replayEngine() {
        if (replayEngine == null) {
            replayEngine = new ReplayEngine(store, config.getReplay());
        }
        return replayEngine;
    }

    SessionAutomation sessionAutomation() {
        AutomationProfile profile = AutomationProfile.from(config.getAutomation());
        RequestExecutor executor = new RequestExecutor(
            HttpClientFactory.create(config.getAutomation().getTimeoutSec()));
        return new SessionAutomation(queryEngine, executor, profile);
    }

    @Override
    public void close() {
        if (replayEngine != null) {
            replayEngine.close();
        }
        store.close();
    }
}
