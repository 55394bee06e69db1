package com.vtb.traffic.automation;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.vtb.traffic.TestTransactions;
import com.vtb.traffic.config.TrafficConfig;
import com.vtb.traffic.errors.AuthExpiredException;
import com.vtb.traffic.errors.NetworkException;
import com.vtb.traffic.errors.NoSessionFoundException;
import com.vtb.traffic.errors.StoreException;
import com.vtb.traffic.errors.TransportTimeoutException;
import com.vtb.traffic.errors.ValidationException;
import com.vtb.traffic.models.AutomationTarget;
import com.vtb.traffic.models.SessionContext;
import com.vtb.traffic.models.TargetError;
import com.vtb.traffic.models.TargetState;
import com.vtb.traffic.models.Transaction;
import com.vtb.traffic.query.QueryEngine;
import com.vtb.traffic.replay.ExecutedResponse;
import com.vtb.traffic.replay.HttpClientFactory;
import com.vtb.traffic.replay.RequestExecutor;
import com.vtb.traffic.replay.SentRequest;
import com.vtb.traffic.store.SqliteTransactionStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class SessionAutomationTest {

    private static final String HOST = "127.0.0.1";

    @TempDir
    Path tempDir;

    private HttpServer server;
    private String baseUrl;
    private SqliteTransactionStore store;
    private QueryEngine queryEngine;
    private final CopyOnWriteArrayList<String> calls = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<String> authorizations = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<String> bodies = new CopyOnWriteArrayList<>();
    private final Map<String, Integer> statusByResource = new ConcurrentHashMap<>();

    @BeforeEach
    void setUp() throws Exception {
        server = HttpServer.create(new InetSocketAddress(HOST, 0), 0);
        server.createContext("/v1/content_resource/", this::handleAction);
        server.start();
        baseUrl = "http://" + HOST + ":" + server.getAddress().getPort();

        store = new SqliteTransactionStore(tempDir.resolve("traffic.db"), TrafficConfig.defaults().getStore());
        queryEngine = new QueryEngine(store);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
        store.close();
    }

    private void handleAction(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        calls.add(path);
        authorizations.add(exchange.getRequestHeaders().getFirst("Authorization"));
        bodies.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
        String resourceId = path.replaceAll("^/v1/content_resource/([^/]+)/activity$", "$1");
        int status = statusByResource.getOrDefault(resourceId, 200);
        byte[] body = ("{\"status\":" + status + "}").getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    private SessionAutomation automation(boolean recordResults) {
        AutomationProfile profile = AutomationFixtures.profile(HOST, baseUrl, recordResults);
        return new SessionAutomation(queryEngine, new RequestExecutor(HttpClientFactory.create(5)), profile);
    }

    /**
     * Незавершенные ресурсы 101, 102, 103 и завершенный 104; в снимке порядок 104, 103, 102, 101
     */
    private void seedTraffic() {
        for (String id : List.of("101", "102", "103")) {
            store.append(AutomationFixtures.action(baseUrl, HOST, id, 0, false, "session-token", 200).build());
        }
        store.append(AutomationFixtures.action(baseUrl, HOST, "104", 0, true, "session-token", 200).build());
    }

    private static AutomationRequest request(boolean dryRun) {
        return AutomationRequest.builder().dryRun(dryRun).delayMs(10L).build();
    }

    @Test
    void dryRunMakesNoNetworkCalls() {
        seedTraffic();

        AutomationRunResult result = automation(false).run(request(true));

        assertTrue(calls.isEmpty());
        assertEquals(0, result.getNetworkCalls());
        assertEquals(3, result.getRequests().size());
        assertEquals(3, result.count(TargetState.SKIPPED_DRY_RUN));
        assertEquals(1, result.getAlreadyComplete().size());
        assertEquals("104", result.getAlreadyComplete().get(0).getResourceId());
        assertEquals(AutomationFixtures.SCOPE, result.getSession().getScopeIdentifier());
        assertEquals(baseUrl + "/v1/content_resource/103/activity", result.getRequests().get(0).getUrl());
    }

    @Test
    void completesPendingTargetsSequentially() {
        seedTraffic();

        AutomationRunResult result = automation(false).run(request(false));

        assertEquals(List.of(
            "/v1/content_resource/103/activity",
            "/v1/content_resource/102/activity",
            "/v1/content_resource/101/activity"), calls);
        assertEquals(3, result.getSucceeded());
        assertEquals(0, result.getFailed());
        assertFalse(result.isRequiresReauthentication());
        assertTrue(authorizations.stream().allMatch("Bearer session-token"::equals));
        assertTrue(bodies.get(0).contains("\"complete\":true"));
        assertTrue(bodies.get(0).contains("\"scope_code\":\"" + AutomationFixtures.SCOPE + "\""));
        // Без записи результатов хранилище не меняется
        assertEquals(4, store.count(null));
    }

    @Test
    void allCompleteTargetsMakeNoCalls() {
        store.append(AutomationFixtures.action(baseUrl, HOST, "201", 0, true, "session-token", 200).build());
        store.append(AutomationFixtures.action(baseUrl, HOST, "202", 1, true, "session-token", 204).build());

        AutomationRunResult result = automation(false).run(request(false));

        assertTrue(calls.isEmpty());
        assertTrue(result.getTargets().isEmpty());
        assertEquals(2, result.getAlreadyComplete().size());
    }

    @Test
    void unauthorizedStopsRunAndLeavesRestUnattempted() {
        seedTraffic();
        statusByResource.put("102", 401);

        AutomationRunResult result = automation(false).run(request(false));

        assertEquals(2, calls.size());
        assertEquals(2, result.getNetworkCalls());
        assertTrue(result.isSessionStale());
        assertTrue(result.isRequiresReauthentication());
        assertEquals(TargetError.AUTH_EXPIRED, result.getStopReason());

        Map<String, AutomationTarget> byId = new ConcurrentHashMap<>();
        result.getTargets().forEach(t -> byId.put(t.getResourceId(), t));
        assertEquals(TargetState.SUCCESS, byId.get("103").getState());
        assertEquals(TargetState.FAILED, byId.get("102").getState());
        assertEquals(TargetError.AUTH_EXPIRED, byId.get("102").getError());
        assertEquals(401, byId.get("102").getLastStatus());
        assertEquals(TargetState.UNATTEMPTED, byId.get("101").getState());
    }

    @Test
    void runOrThrowReportsExpiredSession() {
        seedTraffic();
        statusByResource.put("103", 401);

        assertThrows(AuthExpiredException.class, () -> automation(false).runOrThrow(request(false)));
        assertEquals(1, calls.size());
    }

    @Test
    void otherErrorsRecordStatusAndContinue() {
        seedTraffic();
        statusByResource.put("103", 500);

        AutomationRunResult result = automation(false).run(request(false));

        assertEquals(3, calls.size());
        assertEquals(1, result.getFailed());
        assertEquals(2, result.getSucceeded());
        AutomationTarget failed = result.getTargets().get(0);
        assertEquals(TargetError.HTTP_STATUS, failed.getError());
        assertEquals(500, failed.getLastStatus());
        assertNull(result.getStopReason());
    }

    @Test
    void explicitSubsetIncludesUnknownResources() {
        seedTraffic();
        AutomationRequest request = AutomationRequest.builder()
            .delayMs(10L)
            .resourceIds(List.of("101", "999", "101", "104"))
            .build();

        AutomationRunResult result = automation(false).run(request);

        assertEquals(List.of("/v1/content_resource/101/activity", "/v1/content_resource/999/activity"), calls);
        assertEquals(1, result.getAlreadyComplete().size());
        assertEquals(0, result.getTargets().get(1).getPartIndex());
    }

    @Test
    void cancelledRunSendsNothing() {
        seedTraffic();
        CancellationSignal cancellation = new CancellationSignal();
        cancellation.cancel();
        AutomationRequest request = AutomationRequest.builder().delayMs(10L).cancellation(cancellation).build();

        AutomationRunResult result = automation(false).run(request);

        assertTrue(result.isCancelled());
        assertTrue(calls.isEmpty());
        assertEquals(3, result.count(TargetState.UNATTEMPTED));
    }

    @Test
    void recordedResultsMakeRerunIdempotent() {
        seedTraffic();
        SessionAutomation automation = automation(true);

        AutomationRunResult first = automation.run(request(false));
        assertEquals(3, first.getSucceeded());
        assertEquals(7, store.count(null));

        AutomationRunResult second = automation.run(request(false));
        assertEquals(3, calls.size());
        assertTrue(second.getTargets().isEmpty());
        assertEquals(4, second.getAlreadyComplete().size());
    }

    @Test
    void missingSessionAndInvalidDelayAreRejected() {
        store.append(AutomationFixtures.action(baseUrl, HOST, "101", 0, false, null, 200).build());
        SessionAutomation automation = automation(false);

        assertThrows(NoSessionFoundException.class, () -> automation.run(request(false)));
        assertThrows(ValidationException.class,
            () -> automation.run(AutomationRequest.builder().delayMs(0L).build()));
        assertTrue(calls.isEmpty());
    }

    @Test
    void sessionIsFoundBehindNewerUnauthenticatedTraffic() {
        long source = store.append(AutomationFixtures.action(baseUrl, HOST, "101", 0, false, "old-token", 200).build());
        for (int i = 0; i < 5; i++) {
            store.append(TestTransactions.request("GET", baseUrl + "/static/app" + i + ".js").build());
        }
        AutomationProfile profile = AutomationFixtures.profile(HOST, baseUrl, false, 3);
        SessionAutomation automation = new SessionAutomation(queryEngine,
            new RequestExecutor(HttpClientFactory.create(5)), profile);

        SessionContext session = automation.deriveSession().orElseThrow();
        assertEquals(source, session.getDerivedFromTransactionId());
        assertEquals("old-token", session.getBearerCredential());
        // Поиск целей по-прежнему ограничен окном
        assertTrue(automation.enumerateTargets().isEmpty());
    }

    @Test
    void storeFailureAfterResponseKeepsRunGoing() {
        AtomicBoolean failWrites = new AtomicBoolean(false);
        SqliteTransactionStore flaky = new SqliteTransactionStore(tempDir.resolve("flaky.db"),
            TrafficConfig.defaults().getStore()) {
            @Override
            public long append(Transaction transaction) {
                if (failWrites.get()) {
                    throw new StoreException("database is locked (SQLITE_BUSY)", null);
                }
                return super.append(transaction);
            }
        };
        try {
            for (String id : List.of("101", "102")) {
                flaky.append(AutomationFixtures.action(baseUrl, HOST, id, 0, false, "session-token", 200).build());
            }
            failWrites.set(true);
            SessionAutomation automation = new SessionAutomation(new QueryEngine(flaky),
                new RequestExecutor(HttpClientFactory.create(5)), AutomationFixtures.profile(HOST, baseUrl, true));

            AutomationRunResult result = automation.run(request(false));

            assertEquals(2, calls.size());
            assertEquals(2, result.getSucceeded());
            assertEquals(2, result.getUnrecordedResponses());
            assertEquals(0, result.count(TargetState.IN_FLIGHT));
            assertEquals(2, flaky.count(null));
        } finally {
            flaky.close();
        }
    }

    @Test
    void transportFailuresMarkTargetAndContinue() {
        seedTraffic();
        RequestExecutor executor = new RequestExecutor(HttpClientFactory.create(5)) {
            @Override
            public ExecutedResponse execute(SentRequest sent) {
                if (sent.getUrl().contains("/103/")) {
                    throw new TransportTimeoutException("нет ответа за 5 с", null);
                }
                if (sent.getUrl().contains("/102/")) {
                    throw new NetworkException("Connection refused", null);
                }
                return super.execute(sent);
            }
        };
        SessionAutomation automation = new SessionAutomation(queryEngine, executor,
            AutomationFixtures.profile(HOST, baseUrl, false));

        AutomationRunResult result = automation.run(request(false));

        assertEquals(List.of("/v1/content_resource/101/activity"), calls);
        assertEquals(3, result.getNetworkCalls());
        assertEquals(TargetError.TIMEOUT, result.getTargets().get(0).getError());
        assertEquals(TargetError.NETWORK, result.getTargets().get(1).getError());
        assertEquals(TargetState.SUCCESS, result.getTargets().get(2).getState());
        assertEquals(2, result.getFailed());
        assertNull(result.getStopReason());
        assertFalse(result.isRequiresReauthentication());
    }

    @Test
    void cancelDuringWaitKeepsFinishedTargets() {
        seedTraffic();
        CancellationSignal cancellation = new CancellationSignal();
        RequestExecutor executor = new RequestExecutor(HttpClientFactory.create(5)) {
            @Override
            public ExecutedResponse execute(SentRequest sent) {
                ExecutedResponse response = super.execute(sent);
                cancellation.cancel();
                return response;
            }
        };
        SessionAutomation automation = new SessionAutomation(queryEngine, executor,
            AutomationFixtures.profile(HOST, baseUrl, false));
        AutomationRequest request = AutomationRequest.builder().delayMs(30_000L).cancellation(cancellation).build();

        long started = System.nanoTime();
        AutomationRunResult result = automation.run(request);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertTrue(elapsedMs < 10_000, "ожидание должно прерываться отменой: " + elapsedMs);
        assertTrue(result.isCancelled());
        assertEquals(1, calls.size());
        assertEquals(TargetState.SUCCESS, result.getTargets().get(0).getState());
        assertEquals(2, result.count(TargetState.UNATTEMPTED));
    }

    @Test
    void resourceIdsThatBreakThePathAreRejected() {
        seedTraffic();
        SessionAutomation automation = automation(false);

        for (String id : List.of("../admin", "1?x=2", "..", "a/b")) {
            AutomationRequest request = AutomationRequest.builder().delayMs(10L).resourceIds(List.of(id)).build();
            assertThrows(ValidationException.class, () -> automation.run(request), id);
        }
        assertTrue(calls.isEmpty());
        assertFalse(AutomationProfile.isValidResourceId("a#b"));
        assertTrue(AutomationProfile.isValidResourceId("101"));
    }
}
