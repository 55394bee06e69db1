package com.vtb.traffic.heuristics;

import com.vtb.traffic.config.TrafficConfig;
import com.vtb.traffic.models.FindingCategory;
import com.vtb.traffic.models.Severity;
import com.vtb.traffic.models.Transaction;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Правила безопасности: протокол, заголовки ответа, секреты в URL, сигнатуры инъекций.
 */
@Slf4j
public final class SecurityRules {

    public static final String PLAINTEXT_PROTOCOL = "plaintext-protocol";
    public static final String MISSING_HSTS = "missing-hsts";
    public static final String MISSING_X_CONTENT_TYPE_OPTIONS = "missing-x-content-type-options";
    public static final String MISSING_X_FRAME_OPTIONS = "missing-x-frame-options";
    public static final String CREDENTIAL_IN_URL = "credential-in-url";
    public static final String SQL_INJECTION_SIGNATURE = "sql-injection-signature";
    public static final String SCRIPT_INJECTION_SIGNATURE = "script-injection-signature";
    public static final String BASIC_AUTH = "basic-auth";

    private static final Pattern TOKEN_LIKE = Pattern.compile("^[A-Za-z0-9+/_.=-]+$");
    private static final Pattern HAS_DIGIT = Pattern.compile("\\d");
    private static final Pattern HAS_LETTER = Pattern.compile("[A-Za-z]");

    private SecurityRules() {
    }

    public static List<HeuristicRule> create(TrafficConfig.Analyzer settings) {
        Set<String> localHosts = lowerCaseSet(settings.getLocalHosts());
        Set<String> credentialNames = lowerCaseSet(settings.getCredentialParameters());
        int minSecretLength = settings.getMinSecretLength();
        List<Pattern> sqlSignatures = compile(settings.getSqlSignatures(), SQL_INJECTION_SIGNATURE);
        List<Pattern> scriptSignatures = compile(settings.getScriptSignatures(), SCRIPT_INJECTION_SIGNATURE);

        List<HeuristicRule> rules = new ArrayList<>();
        rules.add(new SimpleRule(PLAINTEXT_PROTOCOL, FindingCategory.SECURITY, Severity.WARNING,
            t -> plaintextProtocol(t, localHosts)));
        rules.add(new SimpleRule(MISSING_HSTS, FindingCategory.SECURITY, Severity.WARNING,
            SecurityRules::missingHsts));
        rules.add(new SimpleRule(MISSING_X_CONTENT_TYPE_OPTIONS, FindingCategory.SECURITY, Severity.INFO,
            t -> missingResponseHeader(t, "X-Content-Type-Options", "защита от MIME sniffing")));
        rules.add(new SimpleRule(MISSING_X_FRAME_OPTIONS, FindingCategory.SECURITY, Severity.INFO,
            t -> missingResponseHeader(t, "X-Frame-Options", "защита от clickjacking")));
        rules.add(new SimpleRule(CREDENTIAL_IN_URL, FindingCategory.SECURITY, Severity.HIGH,
            t -> credentialInUrl(t, credentialNames, minSecretLength)));
        rules.add(new SimpleRule(SQL_INJECTION_SIGNATURE, FindingCategory.SECURITY, Severity.HIGH,
            t -> bodySignature(t, sqlSignatures, "Возможная SQL-инъекция в теле запроса")));
        rules.add(new SimpleRule(SCRIPT_INJECTION_SIGNATURE, FindingCategory.SECURITY, Severity.HIGH,
            t -> bodySignature(t, scriptSignatures, "Возможная XSS-нагрузка в теле запроса")));
        rules.add(new SimpleRule(BASIC_AUTH, FindingCategory.SECURITY, Severity.WARNING,
            SecurityRules::basicAuth));
        return rules;
    }

    private static Optional<String> plaintextProtocol(Transaction t, Set<String> localHosts) {
        if (t.isHttps()) {
            return Optional.empty();
        }
        String host = RuleSupport.hostWithoutPort(t.getHost());
        if (localHosts.contains(host)) {
            return Optional.empty();
        }
        return Optional.of("Незащищенный протокол HTTP к хосту " + host + " (используйте HTTPS)");
    }

    private static Optional<String> missingHsts(Transaction t) {
        if (!t.isHttps() || !t.hasResponse()) {
            return Optional.empty();
        }
        RuleSupport.requireResponseHeaders(t);
        if (t.hasResponseHeader("Strict-Transport-Security")) {
            return Optional.empty();
        }
        return Optional.of("Отсутствует заголовок Strict-Transport-Security (HSTS)");
    }

    private static Optional<String> missingResponseHeader(Transaction t, String header, String purpose) {
        if (!t.hasResponse()) {
            return Optional.empty();
        }
        RuleSupport.requireResponseHeaders(t);
        if (t.hasResponseHeader(header)) {
            return Optional.empty();
        }
        return Optional.of("Отсутствует заголовок " + header + " (" + purpose + ")");
    }

    private static Optional<String> credentialInUrl(Transaction t, Set<String> credentialNames, int minSecretLength) {
        Map<String, String> parameters = RuleSupport.queryParameters(t.getUrl());
        for (Map.Entry<String, String> entry : parameters.entrySet()) {
            String name = entry.getKey().toLowerCase(Locale.ROOT);
            if (credentialNames.contains(name)) {
                return Optional.of("Учетные данные в URL: параметр '" + entry.getKey() +
                    "' (передавайте секреты в теле или заголовке)");
            }
        }
        for (Map.Entry<String, String> entry : parameters.entrySet()) {
            String value = entry.getValue();
            if (value.length() >= minSecretLength && TOKEN_LIKE.matcher(value).matches()
                && HAS_DIGIT.matcher(value).find() && HAS_LETTER.matcher(value).find()) {
                return Optional.of("Похожее на секрет значение длиной " + value.length() +
                    " в параметре '" + entry.getKey() + "'");
            }
        }
        return Optional.empty();
    }

    private static Optional<String> bodySignature(Transaction t, List<Pattern> signatures, String message) {
        String body = t.getRequestBody();
        if (body == null || body.isEmpty()) {
            return Optional.empty();
        }
        for (Pattern signature : signatures) {
            if (signature.matcher(body).find()) {
                return Optional.of(message + " (сигнатура " + signature.pattern() + ")");
            }
        }
        return Optional.empty();
    }

    private static Optional<String> basicAuth(Transaction t) {
        RuleSupport.requireRequestHeaders(t);
        String authorization = t.requestHeader("Authorization");
        if (authorization != null && authorization.trim().regionMatches(true, 0, "Basic ", 0, 6)) {
            return Optional.of("Basic-аутентификация: учетные данные передаются в каждом запросе (рассмотрите OAuth или JWT)");
        }
        return Optional.empty();
    }

    private static List<Pattern> compile(List<String> expressions, String ruleId) {
        List<Pattern> patterns = new ArrayList<>();
        if (expressions == null) {
            return patterns;
        }
        for (String expression : expressions) {
            try {
                patterns.add(Pattern.compile(expression));
            } catch (PatternSyntaxException e) {
                log.warn("Некорректная сигнатура для {} пропущена: {}", ruleId, e.getDescription());
            }
        }
        return patterns;
    }

    private static Set<String> lowerCaseSet(List<String> values) {
        Set<String> result = new HashSet<>();
        if (values != null) {
            for (String value : values) {
                if (value != null) {
                    result.add(value.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        return result;
    }
}
