package com.vtb.traffic.heuristics;

import com.vtb.traffic.config.TrafficConfig;
import com.vtb.traffic.models.FindingCategory;
import com.vtb.traffic.models.Severity;
import com.vtb.traffic.models.Transaction;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

public final class BestPracticeRules {

    public static final String MISSING_API_VERSION = "missing-api-version";
    public static final String BODY_ON_SAFE_METHOD = "body-on-safe-method";
    public static final String CORS_WILDCARD = "cors-wildcard";

    private static final Pattern API_SEGMENT = Pattern.compile("(^|/)api(/|$)", Pattern.CASE_INSENSITIVE);
    private static final Pattern VERSION_SEGMENT = Pattern.compile("/v\\d+(/|$|\\?)", Pattern.CASE_INSENSITIVE);
    private static final Set<String> SAFE_METHODS = Set.of("GET", "HEAD", "OPTIONS");

    private BestPracticeRules() {
    }

    public static List<HeuristicRule> create(TrafficConfig.Analyzer settings) {
        List<String> versionHeaders = settings.getVersionHeaders();
        return List.of(
            new SimpleRule(MISSING_API_VERSION, FindingCategory.BEST_PRACTICE, Severity.INFO,
                t -> missingApiVersion(t, versionHeaders)),
            new SimpleRule(BODY_ON_SAFE_METHOD, FindingCategory.BEST_PRACTICE, Severity.WARNING,
                BestPracticeRules::bodyOnSafeMethod),
            new SimpleRule(CORS_WILDCARD, FindingCategory.BEST_PRACTICE, Severity.WARNING,
                BestPracticeRules::corsWildcard)
        );
    }

    private static Optional<String> missingApiVersion(Transaction t, List<String> versionHeaders) {
        String path = t.getPath() != null ? t.getPath() : "";
        int query = path.indexOf('?');
        String pathOnly = query >= 0 ? path.substring(0, query) : path;
        if (!API_SEGMENT.matcher(pathOnly).find() || VERSION_SEGMENT.matcher(pathOnly).find()) {
            return Optional.empty();
        }
        RuleSupport.requireRequestHeaders(t);
        for (String header : versionHeaders) {
            if (t.requestHeader(header) != null) {
                return Optional.empty();
            }
        }
        return Optional.of("API-эндпоинт без версии в пути (/v1/...) или заголовке версии: " + pathOnly);
    }

    private static Optional<String> bodyOnSafeMethod(Transaction t) {
        String method = t.getMethod() != null ? t.getMethod().toUpperCase(Locale.ROOT) : "";
        if (SAFE_METHODS.contains(method) && t.requestBodyLength() > 0) {
            return Optional.of(method + "-запрос с телом (" + t.requestBodyLength() + " символов); безопасные методы не должны иметь тела");
        }
        return Optional.empty();
    }

    private static Optional<String> corsWildcard(Transaction t) {
        if (!t.hasResponse()) {
            return Optional.empty();
        }
        RuleSupport.requireResponseHeaders(t);
        String origin = t.responseHeader("Access-Control-Allow-Origin");
        if (origin != null && "*".equals(origin.trim())) {
            return Optional.of("CORS разрешает любой источник (Access-Control-Allow-Origin: *)");
        }
        return Optional.empty();
    }
}
