package com.vtb.traffic.cli;

import com.vtb.traffic.TestTransactions;
import com.vtb.traffic.config.TrafficConfig;
import com.vtb.traffic.store.SqliteTransactionStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MainCommandTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int runWithInput(String input, String... args) {
        MainCommand command = new MainCommand()
            .withInput(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)));
        CommandLine commandLine = MainCommand.newCommandLine(command);
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    private int run(String... args) {
        return runWithInput("", args);
    }

    private String db() {
        return tempDir.resolve("cli.db").toString();
    }

    private long seed(String url, int status) {
        try (SqliteTransactionStore store = new SqliteTransactionStore(Path.of(db()), TrafficConfig.defaults().getStore())) {
            return store.append(TestTransactions.request("GET", url).responseStatus(status).build());
        }
    }

    @Test
    void statsOnEmptyStoreSucceeds() {
        assertEquals(ExitCodes.OK, run("--db", db(), "stats"));
        assertTrue(out.toString().contains("Всего запросов:    0"));
    }

    @Test
    void usageErrorsExitWithOne() {
        assertEquals(ExitCodes.USAGE, run());
        assertEquals(ExitCodes.USAGE, run("--db", db(), "list", "--unknown"));
        assertEquals(ExitCodes.USAGE, run("--db", db(), "show", "not-a-number"));
        assertEquals(ExitCodes.USAGE, run("--db", db(), "frobnicate"));
    }

    @Test
    void missingTransactionExitsWithOne() {
        assertEquals(ExitCodes.USAGE, run("--db", db(), "show", "99"));
        assertTrue(err.toString().contains("99"));
    }

    @Test
    void invalidQueryExitsWithOne() {
        assertEquals(ExitCodes.USAGE, run("--db", db(), "search", ""));
        assertEquals(ExitCodes.USAGE, run("--db", db(), "list", "--status", "42"));
    }

    @Test
    void listShowAndNotes() {
        long id = seed("https://api.example.com/v1/orders", 200);
        seed("https://cdn.other.org/app.js", 404);

        assertEquals(ExitCodes.OK, run("--db", db(), "list", "--host", "example.com"));
        assertTrue(out.toString().contains("/v1/orders"));
        assertFalse(out.toString().contains("app.js"));

        assertEquals(ExitCodes.OK, run("--db", db(), "notes", String.valueOf(id), "проверено"));
        assertEquals(ExitCodes.OK, run("--db", db(), "show", String.valueOf(id)));
        assertTrue(out.toString().contains("проверено"));
    }

    @Test
    void scopeHidesOtherHosts() {
        long other = seed("https://cdn.other.org/app.js", 200);
        assertEquals(ExitCodes.USAGE, run("--db", db(), "--scope", "example.com", "show", String.valueOf(other)));
    }

    @Test
    void analyzeSingleTransactionMarksItAnalyzed() {
        long id = seed("http://shop.example/cart", 200);

        assertEquals(ExitCodes.OK, run("--db", db(), "analyze", "--id", String.valueOf(id)));
        assertTrue(out.toString().contains("plaintext-protocol"));

        try (SqliteTransactionStore store = new SqliteTransactionStore(Path.of(db()), TrafficConfig.defaults().getStore())) {
            assertTrue(store.get(id).isAnalyzed());
        }
        assertEquals(ExitCodes.OK, run("--db", db(), "analyze", "--json"));
        assertTrue(out.toString().contains("\"analyzedTransactions\" : 1"));

        Path report = tempDir.resolve("session.json");
        assertEquals(ExitCodes.OK, run("--db", db(), "analyze", "--output", report.toString()));
        assertTrue(Files.exists(report));
    }

    @Test
    void exportAndImportThroughCli() throws Exception {
        seed("https://api.example.com/a", 200);
        seed("https://api.example.com/b", 201);
        Path json = tempDir.resolve("out.json");
        Path har = tempDir.resolve("out.har");

        assertEquals(ExitCodes.OK, run("--db", db(), "export", json.toString()));
        assertEquals(ExitCodes.OK, run("--db", db(), "export", har.toString(), "--limit", "1"));
        assertTrue(Files.readString(har).contains("\"entries\""));

        Path copy = tempDir.resolve("copy.db");
        assertEquals(ExitCodes.OK, run("--db", copy.toString(), "import", json.toString()));
        assertTrue(out.toString().contains("Импортировано транзакций: 2"));

        assertEquals(ExitCodes.USAGE, run("--db", db(), "export", json.toString(), "--format", "xml"));
        assertEquals(ExitCodes.USAGE, run("--db", db(), "import", tempDir.resolve("missing.json").toString()));
    }

    @Test
    void clearAsksForConfirmation() {
        seed("https://api.example.com/a", 200);

        assertEquals(ExitCodes.OK, runWithInput("no\n", "--db", db(), "clear"));
        assertTrue(out.toString().contains("Очистка отменена"));

        assertEquals(ExitCodes.OK, runWithInput("yes\n", "--db", db(), "clear"));
        assertTrue(out.toString().contains("Удалено транзакций: 1"));

        seed("https://api.example.com/b", 200);
        assertEquals(ExitCodes.OK, run("--db", db(), "clear", "--yes"));
    }

    @Test
    void replayRejectsMalformedHeader() {
        long id = seed("https://api.example.com/a", 200);
        assertEquals(ExitCodes.USAGE, run("--db", db(), "replay", String.valueOf(id), "--header", "no-colon"));
    }

    @Test
    void automationWithoutSessionIsRuntimeError() {
        assertEquals(ExitCodes.RUNTIME, run("--db", db(), "auth"));
        assertEquals(ExitCodes.RUNTIME, run("--db", db(), "auto", "--dry-run"));
        assertEquals(ExitCodes.OK, run("--db", db(), "summary"));
    }

    @Test
    void nonPositiveDelayIsRejected() {
        assertEquals(ExitCodes.USAGE, run("--db", db(), "complete", "101", "--delay", "0"));
    }

    @Test
    void automationWithFailedTargetsIsRuntimeError() throws Exception {
        String actionUrl = "http://127.0.0.1:1/v1/content_resource/5/activity";
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Authorization", "Bearer cli-session-token");
        try (SqliteTransactionStore store = new SqliteTransactionStore(Path.of(db()), TrafficConfig.defaults().getStore())) {
            store.append(TestTransactions.request("POST", actionUrl)
                .requestHeaders(headers)
                .requestBody("{\"part\":0,\"complete\":false,\"scope_code\":\"C-1\"}")
                .responseStatus(200)
                .build());
        }
        Path config = tempDir.resolve("automation.yaml");
        Files.writeString(config, String.join("\n",
            "automation:",
            "  targetHost: 127.0.0.1",
            "  actionUrlTemplate: \"http://127.0.0.1:1/v1/content_resource/{resourceId}/activity\"",
            "  delayMs: 10",
            "  timeoutSec: 2",
            "  recordResults: false",
            ""));

        assertEquals(ExitCodes.OK, run("--db", db(), "--config", config.toString(), "auto", "--dry-run"));
        assertEquals(ExitCodes.RUNTIME, run("--db", db(), "--config", config.toString(), "auto"));
        assertTrue(out.toString().contains("NETWORK"));
        assertEquals(ExitCodes.RUNTIME, run("--db", db(), "--config", config.toString(), "complete", "5"));
        assertEquals(ExitCodes.USAGE, run("--db", db(), "--config", config.toString(), "complete", "../5"));
    }
}
