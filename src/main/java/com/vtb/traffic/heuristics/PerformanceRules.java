package com.vtb.traffic.heuristics;

import com.vtb.traffic.config.TrafficConfig;
import com.vtb.traffic.models.FindingCategory;
import com.vtb.traffic.models.Severity;
import com.vtb.traffic.models.Transaction;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

public final class PerformanceRules {

    public static final String SLOW_REQUEST = "slow-request";
    public static final String LARGE_RESPONSE = "large-response";
    public static final String MISSING_CACHE_HEADERS = "missing-cache-headers";
    public static final String MISSING_COMPRESSION = "missing-compression";

    private static final List<String> CACHE_HEADERS = List.of("Cache-Control", "ETag", "Expires", "Last-Modified");

    private PerformanceRules() {
    }

    public static List<HeuristicRule> create(TrafficConfig.Analyzer settings) {
        double slowThreshold = settings.getSlowRequestThresholdSec();
        long largeThreshold = settings.getLargeResponseThresholdBytes();
        return List.of(
            new SimpleRule(SLOW_REQUEST, FindingCategory.PERFORMANCE, Severity.WARNING,
                t -> slowRequest(t, slowThreshold)),
            new SimpleRule(LARGE_RESPONSE, FindingCategory.PERFORMANCE, Severity.INFO,
                t -> largeResponse(t, largeThreshold)),
            new SimpleRule(MISSING_CACHE_HEADERS, FindingCategory.PERFORMANCE, Severity.INFO,
                PerformanceRules::missingCacheHeaders),
            new SimpleRule(MISSING_COMPRESSION, FindingCategory.PERFORMANCE, Severity.INFO,
                PerformanceRules::missingCompression)
        );
    }

    private static Optional<String> slowRequest(Transaction t, double thresholdSec) {
        if (t.getDuration() > thresholdSec) {
            return Optional.of(String.format(Locale.ROOT,
                "Медленный запрос: %.2f с (порог %.2f с)", t.getDuration(), thresholdSec));
        }
        return Optional.empty();
    }

    private static Optional<String> largeResponse(Transaction t, long thresholdBytes) {
        if (!t.hasResponse()) {
            return Optional.empty();
        }
        RuleSupport.requireResponseHeaders(t);
        long size = Math.max(t.responseBodyLength(), RuleSupport.contentLength(t));
        if (size > thresholdBytes) {
            return Optional.of("Большой ответ: " + size + " байт (рассмотрите пагинацию или сжатие)");
        }
        return Optional.empty();
    }

    private static Optional<String> missingCacheHeaders(Transaction t) {
        if (!"GET".equalsIgnoreCase(t.getMethod()) || t.getResponseStatus() == null || t.getResponseStatus() != 200) {
            return Optional.empty();
        }
        RuleSupport.requireResponseHeaders(t);
        for (String header : CACHE_HEADERS) {
            if (t.hasResponseHeader(header)) {
                return Optional.empty();
            }
        }
        return Optional.of("GET-ответ без заголовков кэширования (Cache-Control, ETag, Expires, Last-Modified)");
    }

    private static Optional<String> missingCompression(Transaction t) {
        if (!t.hasResponse() || t.responseBodyLength() == 0) {
            return Optional.empty();
        }
        RuleSupport.requireResponseHeaders(t);
        if (t.hasResponseHeader("Content-Encoding")) {
            return Optional.empty();
        }
        return Optional.of("Ответ не сжат: включите gzip или brotli");
    }
}
