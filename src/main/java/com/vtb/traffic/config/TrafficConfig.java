package com.vtb.traffic.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Конфигурация анализатора из YAML файла.
 * Пороговые значения, сигнатуры и профиль автоматизации не зашиты в код.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TrafficConfig {

    public static final String DEFAULT_RESOURCE = "traffic-config.yaml";

    private Store store;
    private Analyzer analyzer;
    private Scope scope;
    private Replay replay;
    private Automation automation;

    private static TrafficConfig instance;

    /**
     * Загрузить конфигурацию из classpath
     */
    public static synchronized TrafficConfig load() {
        if (instance == null) {
            try (InputStream is = TrafficConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
                if (is == null) {
                    throw new IllegalStateException(DEFAULT_RESOURCE + " не найден в classpath");
                }
                instance = read(is);
            } catch (IOException e) {
                throw new IllegalStateException("Ошибка загрузки конфигурации: " + e.getMessage(), e);
            }
        }
        return instance;
    }

    /**
     * Загрузить конфигурацию из файла (опция --config)
     */
    public static TrafficConfig load(Path path) {
        if (path == null) {
            return load();
        }
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Файл конфигурации не найден: " + path);
        }
        try (InputStream is = Files.newInputStream(path)) {
            return read(is);
        } catch (IOException e) {
            throw new IllegalStateException("Ошибка загрузки конфигурации " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Конфигурация только со значениями по умолчанию, без YAML
     */
    public static TrafficConfig defaults() {
        TrafficConfig config = new TrafficConfig();
        config.ensureDefaults();
        return config;
    }

    private static TrafficConfig read(InputStream is) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        TrafficConfig config = mapper.readValue(is, TrafficConfig.class);
        config.ensureDefaults();
        return config;
    }

    public void ensureDefaults() {
        if (store == null) {
            store = new Store();
        }
        store.ensureDefaults();
        if (analyzer == null) {
            analyzer = new Analyzer();
        }
        analyzer.ensureDefaults();
        if (scope == null) {
            scope = new Scope();
        }
        scope.ensureDefaults();
        if (replay == null) {
            replay = new Replay();
        }
        replay.ensureDefaults();
        if (automation == null) {
            automation = new Automation();
        }
        automation.ensureDefaults();
    }

    @Data
    public static class Store {
        private static final int DEFAULT_BODY_SIZE_LIMIT = 1024 * 1024;

        private String path;
        private Integer bodySizeLimit;
        private String truncationMarker;
        private Integer busyTimeoutMs;
        private Integer pageSize;

        public void ensureDefaults() {
            if (path == null || path.isBlank()) {
                path = "data/traffic.db";
            }
            if (bodySizeLimit == null || bodySizeLimit <= 0) {
                bodySizeLimit = DEFAULT_BODY_SIZE_LIMIT;
            }
            if (truncationMarker == null || truncationMarker.isEmpty()) {
                truncationMarker = "...[truncated]";
            }
            if (busyTimeoutMs == null || busyTimeoutMs < 0) {
                busyTimeoutMs = 5000;
            }
            if (pageSize == null || pageSize <= 0) {
                pageSize = 200;
            }
        }
    }

    @Data
    public static class Analyzer {
        private Double slowRequestThresholdSec;
        private Long largeResponseThresholdBytes;
        private Integer minSecretLength;
        private Integer sessionLimit;
        private Integer topOffenders;
        private List<String> localHosts;
        private List<String> credentialParameters;
        private List<String> sqlSignatures;
        private List<String> scriptSignatures;
        private List<String> versionHeaders;

        public void ensureDefaults() {
            if (slowRequestThresholdSec == null || slowRequestThresholdSec <= 0) {
                slowRequestThresholdSec = 1.0;
            }
            if (largeResponseThresholdBytes == null || largeResponseThresholdBytes <= 0) {
                largeResponseThresholdBytes = 1_000_000L;
            }
            if (minSecretLength == null || minSecretLength < 8) {
                minSecretLength = 32;
            }
            if (sessionLimit == null || sessionLimit <= 0) {
                sessionLimit = 100;
            }
            if (topOffenders == null || topOffenders <= 0) {
                topOffenders = 10;
            }
            if (localHosts == null || localHosts.isEmpty()) {
                localHosts = new ArrayList<>(List.of("localhost", "127.0.0.1", "::1", "[::1]", "0.0.0.0"));
            }
            if (credentialParameters == null || credentialParameters.isEmpty()) {
                credentialParameters = new ArrayList<>(List.of(
                    "password", "passwd", "pwd", "token", "access_token", "refresh_token",
                    "id_token", "secret", "client_secret", "api_key", "apikey", "auth", "session_id"));
            }
            if (sqlSignatures == null || sqlSignatures.isEmpty()) {
                sqlSignatures = new ArrayList<>(List.of(
                    "(?i)\\bunion\\s+(all\\s+)?select\\b",
                    "(?i)'\\s*or\\s+'?\\w+'?\\s*=\\s*'?\\w+",
                    "(?i);\\s*(drop|delete|truncate|alter)\\s+(table|from|database)\\b",
                    "(?i)\\bselect\\b[^;]{0,200}\\bfrom\\b\\s+\\w+",
                    "(?i)\\binsert\\s+into\\b\\s+\\w+",
                    "(?i)\\b(sleep|benchmark|pg_sleep|waitfor\\s+delay)\\s*\\("));
            }
            if (scriptSignatures == null || scriptSignatures.isEmpty()) {
                scriptSignatures = new ArrayList<>(List.of(
                    "(?i)<\\s*script\\b",
                    "(?i)javascript\\s*:",
                    "(?i)\\bon(error|load|mouseover|focus)\\s*=",
                    "(?i)<\\s*iframe\\b",
                    "(?i)document\\.cookie"));
            }
            if (versionHeaders == null || versionHeaders.isEmpty()) {
                versionHeaders = new ArrayList<>(List.of("Api-Version", "X-Api-Version", "Accept-Version"));
            }
        }
    }

    /**
     * Ограничение по семейству хостов, общее для всех компонентов
     */
    @Data
    public static class Scope {
        private List<String> hostSuffixes;

        public void ensureDefaults() {
            if (hostSuffixes == null) {
                hostSuffixes = new ArrayList<>();
            }
        }
    }

    @Data
    public static class Replay {
        private Integer timeoutSec;
        private Integer responseSummaryLimit;
        private Integer workerThreads;
        private String userAgent;

        public void ensureDefaults() {
            if (timeoutSec == null || timeoutSec <= 0) {
                timeoutSec = 10;
            }
            if (responseSummaryLimit == null || responseSummaryLimit <= 0) {
                responseSummaryLimit = 1000;
            }
            if (workerThreads == null || workerThreads <= 0) {
                workerThreads = 2;
            }
            if (userAgent == null || userAgent.isBlank()) {
                userAgent = "VTB-Traffic-Analyzer/1.0 (replay)";
            }
        }
    }

    @Data
    public static class Automation {
        private static final long DEFAULT_DELAY_MS = 1000L;

        private String targetHost;
        private String actionPathPattern;
        private String actionUrlTemplate;
        private String actionMethod;
        private String scopeField;
        private String partField;
        private String completeField;
        private String completionEvent;
        private Long delayMs;
        private Integer timeoutSec;
        private Integer scanLimit;
        private Boolean recordResults;
        private Map<String, String> extraHeaders;

        public void ensureDefaults() {
            if (targetHost == null || targetHost.isBlank()) {
                targetHost = "api.example.com";
            }
            if (actionPathPattern == null || actionPathPattern.isBlank()) {
                actionPathPattern = "/content_resource/(\\d+)/activity";
            }
            if (actionUrlTemplate == null || actionUrlTemplate.isBlank()) {
                actionUrlTemplate = "https://" + targetHost + "/v1/content_resource/{resourceId}/activity";
            }
            if (actionMethod == null || actionMethod.isBlank()) {
                actionMethod = "POST";
            }
            if (scopeField == null || scopeField.isBlank()) {
                scopeField = "scope_code";
            }
            if (partField == null || partField.isBlank()) {
                partField = "part";
            }
            if (completeField == null || completeField.isBlank()) {
                completeField = "complete";
            }
            if (completionEvent == null || completionEvent.isBlank()) {
                completionEvent = "completed";
            }
            // Нулевая задержка не допускается: это ограничитель частоты запросов
            if (delayMs == null || delayMs <= 0) {
                delayMs = DEFAULT_DELAY_MS;
            }
            if (timeoutSec == null || timeoutSec <= 0) {
                timeoutSec = 10;
            }
            if (scanLimit == null || scanLimit <= 0) {
                scanLimit = 1000;
            }
            if (recordResults == null) {
                recordResults = Boolean.TRUE;
            }
            if (extraHeaders == null) {
                extraHeaders = new LinkedHashMap<>();
            }
        }

        public boolean isRecordResults() {
            return Boolean.TRUE.equals(recordResults);
        }
    }
}
