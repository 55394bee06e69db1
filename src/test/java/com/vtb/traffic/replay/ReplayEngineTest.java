package com.vtb.traffic.replay;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.vtb.traffic.TestTransactions;
import com.vtb.traffic.config.TrafficConfig;
import com.vtb.traffic.errors.NetworkException;
import com.vtb.traffic.errors.TransactionNotFoundException;
import com.vtb.traffic.errors.TransportTimeoutException;
import com.vtb.traffic.models.Transaction;
import com.vtb.traffic.store.SqliteTransactionStore;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ReplayEngineTest {

    @TempDir
    Path tempDir;

    private HttpServer server;
    private ExecutorService serverPool;
    private String baseUrl;
    private SqliteTransactionStore store;
    private ReplayEngine engine;
    private final CopyOnWriteArrayList<String> receivedTokens = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<String> receivedBodies = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/echo", this::echo);
        server.createContext("/slow", exchange -> {
            try {
                Thread.sleep(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(exchange, 200, "late");
        });
        serverPool = Executors.newCachedThreadPool();
        server.setExecutor(serverPool);
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();

        store = new SqliteTransactionStore(tempDir.resolve("traffic.db"), TrafficConfig.defaults().getStore());
        OkHttpClient client = new OkHttpClient.Builder()
            .readTimeout(300, TimeUnit.MILLISECONDS)
            .callTimeout(500, TimeUnit.MILLISECONDS)
            .retryOnConnectionFailure(false)
            .build();
        engine = new ReplayEngine(store, TrafficConfig.defaults().getReplay(), client);
    }

    @AfterEach
    void tearDown() {
        engine.close();
        store.close();
        server.stop(0);
        serverPool.shutdownNow();
    }

    private void echo(HttpExchange exchange) throws IOException {
        receivedTokens.add(String.valueOf(exchange.getRequestHeaders().getFirst("X-Token")));
        receivedBodies.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
        respond(exchange, 201, "{\"echo\":\"" + exchange.getRequestHeaders().getFirst("X-Token") + "\"}");
    }

    private static void respond(HttpExchange exchange, int status, String text) throws IOException {
        byte[] body = text.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    private long storeOriginal(String path) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("X-Token", "original");
        headers.put("Content-Type", "application/json");
        headers.put("Content-Length", "13");
        headers.put("Host", "old.example");
        return store.append(TestTransactions.request("POST", baseUrl + path)
            .requestHeaders(headers)
            .requestBody("{\"a\":\"orig\"}")
            .build());
    }

    @Test
    void replayReusesOriginalRequest() {
        long id = storeOriginal("/echo");

        ReplayResult result = engine.replay(id);

        assertEquals(201, result.getStatus());
        assertEquals("{\"echo\":\"original\"}", result.getResponseSummary());
        assertEquals("original", receivedTokens.get(0));
        assertEquals("{\"a\":\"orig\"}", receivedBodies.get(0));
        assertTrue(result.getDurationSec() >= 0);
        assertFalse(result.getSentRequest().getHeaders().containsKey("Host"));
        assertFalse(result.getSentRequest().getHeaders().containsKey("Content-Length"));
        assertTrue(result.getSentRequest().getHeaders().containsKey("User-Agent"));
    }

    @Test
    void headerOverrideDoesNotModifyStoredTransaction() {
        long id = storeOriginal("/echo");
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("x-token", "override");
        ReplayOverrides overrides = ReplayOverrides.builder().headers(headers).body("{\"a\":\"new\"}").build();

        ReplayResult result = engine.replay(id, overrides);

        assertEquals("override", receivedTokens.get(0));
        assertEquals("{\"a\":\"new\"}", receivedBodies.get(0));
        assertEquals("override", result.getSentRequest().getHeaders().get("x-token"));
        assertFalse(result.getSentRequest().getHeaders().containsKey("X-Token"));

        Transaction stored = store.get(id);
        assertEquals("original", stored.getRequestHeaders().get("X-Token"));
        assertEquals("{\"a\":\"orig\"}", stored.getRequestBody());
        assertEquals(1, store.count(null));
    }

    @Test
    void nullOverrideRemovesHeader() {
        long id = storeOriginal("/echo");
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("X-Token", null);

        engine.replay(id, ReplayOverrides.builder().headers(headers).build());
        assertEquals("null", receivedTokens.get(0));
    }

    @Test
    void resultCanBeStoredAsNewTransaction() {
        long id = storeOriginal("/echo");
        ReplayResult result = engine.replay(id);

        long newId = store.append(result.toTransaction());
        Transaction copy = store.get(newId);
        assertTrue(newId > id);
        assertEquals(201, copy.getResponseStatus());
        assertEquals("Повтор транзакции #" + id, copy.getNotes());
        assertEquals("127.0.0.1", copy.getHost());
    }

    @Test
    void unknownIdIsNotFound() {
        assertThrows(TransactionNotFoundException.class, () -> engine.replay(999));
        assertTrue(receivedTokens.isEmpty());
    }

    @Test
    void timeoutIsDistinguishedFromRefusedConnection() throws Exception {
        long slow = storeOriginal("/slow");
        assertThrows(TransportTimeoutException.class, () -> engine.replay(slow));

        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        long refused = store.append(TestTransactions.request("GET", "http://127.0.0.1:" + closedPort + "/x").build());
        NetworkException error = assertThrows(NetworkException.class, () -> engine.replay(refused));
        assertFalse(error instanceof TransportTimeoutException);
    }

    @Test
    void asyncReplayCompletes() throws Exception {
        long id = storeOriginal("/echo");
        ReplayResult result = engine.replayAsync(id, ReplayOverrides.none()).get(5, TimeUnit.SECONDS);
        assertEquals(201, result.getStatus());
    }
}
