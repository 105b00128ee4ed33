// file: server/src/test/java/io/backlite/server/WebServerTest.java
package io.backlite.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.backlite.core.FailureKind;
import io.backlite.server.testutil.TestStack;
import io.backlite.storage.Mappers;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end specs for the maintenance HTTP API.
 *
 * Focus:
 *  - Status codes for success and for every failure kind that can reach HTTP.
 *  - Attachments for export and download.
 *  - The restore confirmation gate and the upload size limit.
 */
class WebServerTest {

    private static final int PORT = 18181; // test-only port
    private static final int MAX_UPLOAD = 64 * 1024;
    private static final String BASE = "http://localhost:" + PORT;

    @TempDir
    Path dir;

    private TestStack stack;
    private WebServer server;
    private HttpClient client;
    private final ObjectMapper json = Mappers.json();

    @BeforeEach
    void startServer() {
        stack = new TestStack(dir);
        stack.seed();
        server = new WebServer(PORT, stack.gateway, MAX_UPLOAD, stack.clock);
        server.start();
        client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(2))
                .build();
    }

    @AfterEach
    void stopServer() throws Exception {
        if (server != null) server.stop();
        if (stack != null) stack.close();
    }

    // ---------- helpers ----------

    private HttpResponse<byte[]> send(String method, String path, byte[] body, Map<String, String> headers) throws Exception {
        HttpRequest.Builder b = HttpRequest.newBuilder(URI.create(BASE + path))
                .timeout(Duration.ofSeconds(5))
                .method(method, body == null
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofByteArray(body));
        headers.forEach(b::header);
        return client.send(b.build(), HttpResponse.BodyHandlers.ofByteArray());
    }

    private HttpResponse<byte[]> send(String method, String path) throws Exception {
        return send(method, path, null, Map.of());
    }

    private HttpResponse<byte[]> sendJson(String method, String path, String body) throws Exception {
        return send(method, path, body.getBytes(StandardCharsets.UTF_8), Map.of("Content-Type", "application/json"));
    }

    private JsonNode body(HttpResponse<byte[]> resp) throws Exception {
        return json.readTree(resp.body());
    }

    // ---------- specs ----------

    @Test
    void health_answers_ok() throws Exception {
        var resp = send("GET", "/admin/health");
        assertEquals(200, resp.statusCode());
        assertEquals("ok", body(resp).get("status").asText());
    }

    @Test
    void create_list_download_and_delete_a_backup() throws Exception {
        var created = send("POST", "/api/maintenance/backup", null, Map.of(WebServer.ACTOR_HEADER, "alice"));
        assertEquals(201, created.statusCode());
        JsonNode rec = body(created);
        String id = rec.get("id").asText();
        assertEquals("manual", rec.get("source").asText());
        assertEquals("alice", rec.get("createdBy").asText());

        var history = send("GET", "/api/maintenance/backup/history?page=1&pageSize=5");
        assertEquals(200, history.statusCode());
        JsonNode page = body(history);
        assertEquals(1, page.get("total").asInt());
        assertEquals(id, page.get("history").get(0).get("id").asText());

        var download = send("GET", "/api/maintenance/backup/download/" + id);
        assertEquals(200, download.statusCode());
        assertTrue(download.headers().firstValue("Content-Disposition").orElse("")
                .contains(rec.get("filename").asText()));
        assertEquals(rec.get("sizeBytes").asLong(), download.body().length);

        var deleted = send("DELETE", "/api/maintenance/backup/" + id);
        assertEquals(200, deleted.statusCode());
        assertEquals(id, body(deleted).get("deleted").asText());

        var gone = send("GET", "/api/maintenance/backup/download/" + id);
        assertEquals(404, gone.statusCode());
        assertEquals(FailureKind.NOT_FOUND.code(), body(gone).get("error").asText());
    }

    @Test
    void export_is_an_attachment_and_not_stored() throws Exception {
        var resp = send("GET", "/api/maintenance/backup");

        assertEquals(200, resp.statusCode());
        assertTrue(resp.headers().firstValue("Content-Disposition").orElse("").contains("backup-"));
        JsonNode doc = body(resp);
        assertEquals(1, doc.get("schemaVersion").asInt());
        assertEquals(2, doc.get("collections").get("items").size());
        assertEquals(0, stack.backups.list(1, 5).total());
    }

    @Test
    void history_rejects_bad_paging() throws Exception {
        assertEquals(400, send("GET", "/api/maintenance/backup/history?page=0").statusCode());
        assertEquals(400, send("GET", "/api/maintenance/backup/history?pageSize=abc").statusCode());
    }

    @Test
    void restore_needs_confirmation() throws Exception {
        byte[] doc = stack.codec.toBytes(stack.codec.encode());

        var resp = send("POST", "/api/maintenance/backup/upload", doc, Map.of("Content-Type", "application/json"));

        assertEquals(428, resp.statusCode());
        assertEquals(FailureKind.CONFIRMATION_REQUIRED.code(), body(resp).get("error").asText());
    }

    @Test
    void confirmed_restore_replaces_the_data() throws Exception {
        byte[] doc = stack.codec.toBytes(stack.codec.encode());
        var before = stack.datastore.view();
        stack.datastore.put("items", Map.of("_id", "new"));

        var resp = send("POST", "/api/maintenance/backup/upload?confirm=true", doc,
                Map.of("Content-Type", "application/json", WebServer.ACTOR_HEADER, "bob"));

        assertEquals(200, resp.statusCode());
        JsonNode report = body(resp);
        assertEquals(2, report.get("replaced").get("items").asInt());
        assertEquals(before.get("items"), stack.datastore.read("items"));
    }

    @Test
    void multipart_upload_is_accepted() throws Exception {
        byte[] doc = stack.codec.toBytes(stack.codec.encode());
        stack.datastore.delete("customers", "c1");
        String boundary = "----backlite-test";
        String head = "--" + boundary + "\r\n"
                + "Content-Disposition: form-data; name=\"file\"; filename=\"backup.json\"\r\n"
                + "Content-Type: application/json\r\n\r\n";
        String tail = "\r\n--" + boundary + "--\r\n";
        byte[] body = concat(head.getBytes(StandardCharsets.UTF_8), doc, tail.getBytes(StandardCharsets.UTF_8));

        var resp = send("POST", "/api/maintenance/backup/upload", body, Map.of(
                "Content-Type", "multipart/form-data; boundary=" + boundary,
                WebServer.CONFIRM_HEADER, "true"));

        assertEquals(200, resp.statusCode());
        assertTrue(stack.datastore.find("customers", "c1").isPresent());
    }

    @Test
    void urlencoded_upload_is_read_as_the_raw_document() throws Exception {
        byte[] doc = stack.codec.toBytes(stack.codec.encode());
        stack.datastore.delete("customers", "c1");

        var resp = send("POST", "/api/maintenance/backup/upload", doc, Map.of(
                "Content-Type", "application/x-www-form-urlencoded",
                WebServer.CONFIRM_HEADER, "true"));

        assertEquals(200, resp.statusCode());
        assertTrue(stack.datastore.find("customers", "c1").isPresent());
    }

    @Test
    void bad_documents_map_to_400_and_422() throws Exception {
        Map<String, String> confirm = Map.of(WebServer.CONFIRM_HEADER, "true");

        var malformed = send("POST", "/api/maintenance/backup/upload", "{oops".getBytes(StandardCharsets.UTF_8), confirm);
        var future = send("POST", "/api/maintenance/backup/upload",
                "{\"schemaVersion\":7,\"generatedAt\":\"2024-01-01T00:00:00Z\",\"collections\":{}}"
                        .getBytes(StandardCharsets.UTF_8), confirm);

        assertEquals(400, malformed.statusCode());
        assertEquals(FailureKind.MALFORMED_DOCUMENT.code(), body(malformed).get("error").asText());
        assertEquals(422, future.statusCode());
        assertEquals(FailureKind.UNSUPPORTED_VERSION.code(), body(future).get("error").asText());
        assertEquals(2, stack.datastore.read("items").size());
    }

    @Test
    void oversized_upload_is_refused() throws Exception {
        byte[] big = new byte[MAX_UPLOAD + 10];
        java.util.Arrays.fill(big, (byte) ' ');

        var resp = send("POST", "/api/maintenance/backup/upload", big, Map.of(WebServer.CONFIRM_HEADER, "true"));

        assertEquals(413, resp.statusCode());
    }

    @Test
    void settings_can_be_read_and_changed() throws Exception {
        var initial = send("GET", "/api/maintenance/auto-backup/settings");
        assertEquals(200, initial.statusCode());
        assertFalse(body(initial).get("enabled").asBoolean());
        assertEquals("hours", body(initial).get("intervalUnit").asText());

        var patched = sendJson("PATCH", "/api/maintenance/auto-backup/settings",
                "{\"enabled\":true,\"intervalValue\":2,\"intervalUnit\":\"days\"}");
        assertEquals(200, patched.statusCode());
        JsonNode s = body(patched);
        assertTrue(s.get("enabled").asBoolean());
        assertEquals("2024-03-03T10:00:00Z", s.get("nextRunAt").asText());

        var invalid = sendJson("PATCH", "/api/maintenance/auto-backup/settings", "{\"intervalUnit\":\"years\"}");
        assertEquals(400, invalid.statusCode());
        assertEquals(FailureKind.INVALID_SETTINGS.code(), body(invalid).get("error").asText());

        var garbage = sendJson("PATCH", "/api/maintenance/auto-backup/settings", "not json");
        assertEquals(400, garbage.statusCode());
    }

    @Test
    void trigger_creates_an_auto_backup() throws Exception {
        var resp = send("POST", "/api/maintenance/auto-backup/trigger", null, Map.of(WebServer.ACTOR_HEADER, "carol"));

        assertEquals(201, resp.statusCode());
        assertEquals("auto", body(resp).get("source").asText());
        assertEquals("carol", body(resp).get("createdBy").asText());
    }

    @Test
    void last_admin_rule_surfaces_as_409() throws Exception {
        assertEquals(200, sendJson("PATCH", "/api/admin/users/u2/status", "{\"isActive\":false}").statusCode());

        var resp = sendJson("PATCH", "/api/admin/users/u1/role", "{\"role\":\"EMPLOYEE\"}");

        assertEquals(409, resp.statusCode());
        assertEquals(FailureKind.LAST_ADMIN_INVARIANT_VIOLATION.code(), body(resp).get("error").asText());
    }

    @Test
    void wipe_needs_confirmation_then_clears_data_and_backups() throws Exception {
        assertEquals(201, send("POST", "/api/maintenance/backup").statusCode());

        var refused = send("POST", "/api/maintenance/wipe");
        assertEquals(428, refused.statusCode());
        assertEquals(2, stack.datastore.read("items").size());

        var resp = send("POST", "/api/maintenance/wipe", null, Map.of(WebServer.CONFIRM_WIPE_HEADER, "true"));

        assertEquals(200, resp.statusCode());
        JsonNode report = body(resp);
        assertEquals(2, report.get("cleared").get("items").asInt());
        assertEquals(1, report.get("backupsDeleted").asInt());
        assertTrue(stack.datastore.read("items").isEmpty());
        assertEquals(0, body(send("GET", "/api/maintenance/backup/history")).get("total").asInt());
        assertEquals(405, send("GET", "/api/maintenance/wipe").statusCode());
    }

    @Test
    void unknown_routes_and_methods() throws Exception {
        assertEquals(404, send("GET", "/api/nothing").statusCode());
        assertEquals(405, send("PUT", "/api/maintenance/backup").statusCode());
        assertEquals(405, send("GET", "/api/admin/users/u1/role").statusCode());
    }

    @Test
    void status_mapping_covers_every_kind() {
        for (FailureKind kind : FailureKind.values()) {
            int status = WebServer.statusFor(kind);
            assertTrue(status >= 400 && status < 600, kind + " -> " + status);
        }
        assertEquals(500, WebServer.statusFor(FailureKind.STORAGE_FAILURE));
        assertEquals(404, WebServer.statusFor(FailureKind.NOT_FOUND));
    }

    private static byte[] concat(byte[]... parts) {
        int n = 0;
        for (byte[] p : parts) n += p.length;
        byte[] out = new byte[n];
        int pos = 0;
        for (byte[] p : parts) {
            System.arraycopy(p, 0, out, pos, p.length);
            pos += p.length;
        }
        return out;
    }
}
