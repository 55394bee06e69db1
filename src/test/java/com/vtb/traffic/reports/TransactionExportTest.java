package com.vtb.traffic.reports;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.traffic.TestTransactions;
import com.vtb.traffic.config.TrafficConfig;
import com.vtb.traffic.errors.ValidationException;
import com.vtb.traffic.models.Transaction;
import com.vtb.traffic.query.QueryEngine;
import com.vtb.traffic.store.SqliteTransactionStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TransactionExportTest {

    @TempDir
    Path tempDir;

    private TrafficConfig.Store settings;
    private SqliteTransactionStore store;

    @BeforeEach
    void setUp() {
        settings = TrafficConfig.defaults().getStore();
        store = new SqliteTransactionStore(tempDir.resolve("source.db"), settings);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private Transaction richTransaction() {
        Map<String, String> requestHeaders = new LinkedHashMap<>();
        requestHeaders.put("Content-Type", "application/json");
        requestHeaders.put("Cookie", "sid=abc; theme=dark");
        requestHeaders.put("X-Трассировка", "значение");
        return TestTransactions.cleanGet("api.example.com", "/v1/items?q=a%20b&page=2")
            .method("POST")
            .requestHeaders(requestHeaders)
            .requestBody("{\"name\":\"Ёлка\",\"emoji\":\"🎄\"}")
            .responseStatus(201)
            .duration(0.25)
            .notes("экспорт")
            .analyzed(true)
            .build();
    }

    @Test
    void jsonExportImportPreservesEveryField() throws Exception {
        store.append(richTransaction());
        store.append(TestTransactions.request("GET", "http://a.example/no-response").build());
        QueryEngine engine = new QueryEngine(store);
        List<Transaction> originals = engine.findAll().toList();

        Path file = tempDir.resolve("export.json");
        long exported = new JsonTransactionExporter().export(engine.findAll(), file);
        assertEquals(2, exported);

        try (SqliteTransactionStore target = new SqliteTransactionStore(tempDir.resolve("target.db"), settings)) {
            assertEquals(2, new TransactionImporter().importInto(target, file));
            List<Transaction> imported = new QueryEngine(target).findAll().toList();
            assertEquals(originals.size(), imported.size());
            // Импорт добавляет записи в порядке файла, поэтому порядок выдачи обратный
            for (int i = 0; i < originals.size(); i++) {
                Transaction expected = originals.get(i);
                Transaction actual = imported.get(imported.size() - 1 - i);
                assertEquals(expected.toBuilder().id(null).build(), actual.toBuilder().id(null).build());
                assertEquals(List.copyOf(expected.getRequestHeaders().keySet()),
                    List.copyOf(actual.getRequestHeaders().keySet()));
            }
        }
    }

    @Test
    void jsonExportUsesSnakeCaseFieldNames() throws Exception {
        long id = store.append(richTransaction());
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        new JsonTransactionExporter(false).export(new QueryEngine(store).findAll(), out);

        JsonNode array = new ObjectMapper().readTree(out.toByteArray());
        assertTrue(array.isArray());
        JsonNode node = array.get(0);
        assertEquals(id, node.get("id").asLong());
        assertEquals(201, node.get("response_status").asInt());
        assertEquals("значение", node.get("request_headers").get("X-Трассировка").asText());
        assertFalse(node.get("request_body_truncated").asBoolean());
        assertTrue(node.get("analyzed").asBoolean());
    }

    @Test
    void emptyExportIsEmptyArray() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        assertEquals(0, new JsonTransactionExporter().export(List.of(), out));
        assertEquals(0, new ObjectMapper().readTree(out.toByteArray()).size());
    }

    @Test
    void importRejectsNonArrayAndInvalidRecords() {
        TransactionImporter importer = new TransactionImporter();
        assertThrows(ValidationException.class, () -> importer.read(
            new ByteArrayInputStream("{\"id\":1}".getBytes(StandardCharsets.UTF_8))));
        assertThrows(ValidationException.class, () -> importer.read(
            new ByteArrayInputStream("[{\"method\":\"GET\"}]".getBytes(StandardCharsets.UTF_8))));
    }

    @Test
    void harExportHasStandardStructure() throws Exception {
        store.append(richTransaction());
        store.append(TestTransactions.request("GET", "http://a.example/pending").build());
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        long count = new HarExporter().export(new QueryEngine(store).findAll(), out);
        assertEquals(2, count);

        JsonNode log = new ObjectMapper().readTree(out.toByteArray()).get("log");
        assertEquals("1.2", log.get("version").asText());
        assertEquals("VTB Traffic Analyzer", log.get("creator").get("name").asText());

        JsonNode pending = log.get("entries").get(0);
        assertEquals(0, pending.get("response").get("status").asInt());
        assertEquals(-1, pending.get("response").get("bodySize").asInt());

        JsonNode entry = log.get("entries").get(1);
        assertEquals("2023-11-14T22:13:20Z", entry.get("startedDateTime").asText());
        assertEquals(250, entry.get("time").asLong());
        assertEquals("экспорт", entry.get("comment").asText());

        JsonNode request = entry.get("request");
        assertEquals("POST", request.get("method").asText());
        assertEquals("HTTP/1.1", request.get("httpVersion").asText());
        assertEquals(3, request.get("headers").size());
        assertEquals("sid", request.get("cookies").get(0).get("name").asText());
        assertEquals("dark", request.get("cookies").get(1).get("value").asText());
        assertEquals("a b", request.get("queryString").get(0).get("value").asText());
        assertEquals("application/json", request.get("postData").get("mimeType").asText());

        JsonNode response = entry.get("response");
        assertEquals(201, response.get("status").asInt());
        assertEquals("Created", response.get("statusText").asText());
        assertEquals("application/json", response.get("content").get("mimeType").asText());
        assertEquals("{\"ok\":true}", response.get("content").get("text").asText());
        assertTrue(entry.get("timings").has("wait"));
    }

    @Test
    void formatIsChosenByFlagOrExtension() {
        assertEquals(ExportFormat.HAR, ExportFormat.fromPath(Path.of("out/session.HAR")));
        assertEquals(ExportFormat.JSON, ExportFormat.fromPath(Path.of("out/session.json")));
        assertEquals(ExportFormat.HAR, ExportFormat.parse("har"));
        assertNull(ExportFormat.parse(" "));
        assertThrows(ValidationException.class, () -> ExportFormat.parse("xml"));
        assertInstanceOf(HarExporter.class, ExportFormat.HAR.createExporter());
    }
}
