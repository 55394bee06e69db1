package com.vtb.traffic.replay;

import com.vtb.traffic.config.TrafficConfig;
import com.vtb.traffic.models.Transaction;
import com.vtb.traffic.store.TransactionStore;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Повтор сохраненной транзакции с необязательными изменениями.
 *
 * <p>Исходная транзакция не меняется, результат не сохраняется. Асинхронный вариант
 * выполняется на собственном пуле движка.
 */
@Slf4j
public class ReplayEngine implements AutoCloseable {

    /** Заголовки соединения, которые клиент выставляет сам */
    static final Set<String> DROPPED_HEADERS = Set.of(
        "host", "content-length", "connection", "transfer-encoding", "accept-encoding",
        "keep-alive", "proxy-connection", "te", "upgrade");

    private final TransactionStore store;
    private final TrafficConfig.Replay settings;
    private final RequestExecutor executor;
    private final ExecutorService asyncPool;

    public ReplayEngine(TransactionStore store, TrafficConfig.Replay settings) {
        this(store, settings, HttpClientFactory.create(settings.getTimeoutSec()));
    }

    public ReplayEngine(TransactionStore store, TrafficConfig.Replay settings, OkHttpClient httpClient) {
        settings.ensureDefaults();
        this.store = store;
        this.settings = settings;
        this.executor = new RequestExecutor(httpClient);
        this.asyncPool = Executors.newFixedThreadPool(settings.getWorkerThreads(), new ReplayThreadFactory());
    }

    public ReplayResult replay(long transactionId) {
        return replay(transactionId, ReplayOverrides.none());
    }

    /**
     * Повторить транзакцию
     *
     * @throws com.vtb.traffic.errors.TransactionNotFoundException если id не существует
     * @throws com.vtb.traffic.errors.TransportTimeoutException если ответ не получен вовремя
     * @throws com.vtb.traffic.errors.NetworkException при сетевой ошибке
     */
    public ReplayResult replay(long transactionId, ReplayOverrides overrides) {
        Transaction original = store.get(transactionId);
        SentRequest sent = buildRequest(original, overrides != null ? overrides : ReplayOverrides.none());
        log.info("Повтор транзакции {}: {} {}", transactionId, sent.getMethod(), sent.getUrl());

        ExecutedResponse response = executor.execute(sent);
        return ReplayResult.builder()
            .sourceTransactionId(transactionId)
            .status(response.getStatus())
            .durationSec(response.getDurationSec())
            .responseSummary(truncate(response.getBody(), settings.getResponseSummaryLimit()))
            .responseBody(response.getBody())
            .responseHeaders(response.getHeaders())
            .sentRequest(sent)
            .timestamp(response.getStartedAt())
            .build();
    }

    public CompletableFuture<ReplayResult> replayAsync(long transactionId, ReplayOverrides overrides) {
        return CompletableFuture.supplyAsync(() -> replay(transactionId, overrides), asyncPool);
    }

    SentRequest buildRequest(Transaction original, ReplayOverrides overrides) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (original.getRequestHeaders() != null) {
            original.getRequestHeaders().forEach((name, value) -> {
                if (name != null && !DROPPED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                    headers.put(name, value);
                }
            });
        }
        if (overrides.getHeaders() != null) {
            overrides.getHeaders().forEach((name, value) -> {
                headers.keySet().removeIf(existing -> existing.equalsIgnoreCase(name));
                if (value != null) {
                    headers.put(name, value);
                }
            });
        }
        boolean hasUserAgent = headers.keySet().stream().anyMatch("User-Agent"::equalsIgnoreCase);
        if (!hasUserAgent) {
            headers.put("User-Agent", settings.getUserAgent());
        }

        return SentRequest.builder()
            .method(original.getMethod())
            .url(overrides.getUrl() != null ? overrides.getUrl() : original.getUrl())
            .headers(headers)
            .body(overrides.getBody() != null ? overrides.getBody() : original.getRequestBody())
            .build();
    }

    private static String truncate(String text, int limit) {
        if (text == null || text.length() <= limit) {
            return text;
        }
        return text.substring(0, Math.max(0, limit)) + "...";
    }

    @Override
    public void close() {
        asyncPool.shutdown();
        try {
            if (!asyncPool.awaitTermination(settings.getTimeoutSec(), TimeUnit.SECONDS)) {
                asyncPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            asyncPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class ReplayThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "replay-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
