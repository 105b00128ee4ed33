// file: server/src/main/java/io/backlite/server/WebServer.java
package io.backlite.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.backlite.core.AutoBackupSettings;
import io.backlite.core.BackupRecord;
import io.backlite.core.BackupSource;
import io.backlite.core.FailureKind;
import io.backlite.core.HistoryPage;
import io.backlite.core.Outcome;
import io.backlite.core.RestoreReport;
import io.backlite.core.WipeReport;
import io.backlite.server.dto.*;
import io.backlite.server.maintenance.Download;
import io.backlite.server.maintenance.MaintenanceGateway;
import io.backlite.server.maintenance.SettingsUpdate;
import io.backlite.storage.Mappers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.RequestTooBigException;
import io.undertow.server.handlers.form.FormData;
import io.undertow.server.handlers.form.FormDataParser;
import io.undertow.server.handlers.form.FormParserFactory;
import io.undertow.server.handlers.form.MultiPartParserDefinition;
import io.undertow.util.Headers;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Thin HTTP adapter over {@link MaintenanceGateway}.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert gateway outcomes back into JSON and status codes.
 *  - Emit per-request logging.
 *
 * Path layout:
 *   - GET    /api/maintenance/backup                    export (download, not stored)
 *   - POST   /api/maintenance/backup                    create a stored manual backup
 *   - GET    /api/maintenance/backup/history            ?page=1&pageSize=5
 *   - GET    /api/maintenance/backup/download/{id}      stored artifact
 *   - DELETE /api/maintenance/backup/{id}
 *   - POST   /api/maintenance/backup/upload             restore; needs ?confirm=true or X-Confirm-Restore: true
 *   - GET    /api/maintenance/auto-backup/settings
 *   - PATCH  /api/maintenance/auto-backup/settings
 *   - POST   /api/maintenance/auto-backup/trigger
 *   - POST   /api/maintenance/wipe                      needs ?confirm=true or X-Confirm-Wipe: true
 *   - PATCH  /api/admin/users/{id}/role
 *   - PATCH  /api/admin/users/{id}/status
 *   - GET    /admin/health
 *
 * The acting operator is taken from the X-Actor header (default "admin").
 * Errors are returned as {"error": "&lt;FailureKind code&gt;", "message": "..."}.
 *
 * Handlers block (fsync, restore), so requests are dispatched off the IO thread.
 */
public final class WebServer {
    public static final String ACTOR_HEADER = "X-Actor";
    public static final String CONFIRM_HEADER = "X-Confirm-Restore";
    public static final String CONFIRM_WIPE_HEADER = "X-Confirm-Wipe";
    public static final String DEFAULT_ACTOR = "admin";

    private static final String BACKUP = "/api/maintenance/backup";
    private static final String HISTORY = BACKUP + "/history";
    private static final String DOWNLOAD_PREFIX = BACKUP + "/download/";
    private static final String UPLOAD = BACKUP + "/upload";
    private static final String SETTINGS = "/api/maintenance/auto-backup/settings";
    private static final String TRIGGER = "/api/maintenance/auto-backup/trigger";
    private static final String WIPE = "/api/maintenance/wipe";
    private static final String USERS_PREFIX = "/api/admin/users/";
    private static final int DEFAULT_PAGE_SIZE = 5;
    private static final int MAX_JSON_BODY_BYTES = 64 * 1024;
    private static final long MULTIPART_OVERHEAD_BYTES = 64 * 1024;
    // any other content type, urlencoded included, is read as the raw document
    private static final FormParserFactory MULTIPART_ONLY = FormParserFactory.builder(false)
            .addParsers(new MultiPartParserDefinition())
            .build();

    private final Undertow server;
    private final MaintenanceGateway gateway;
    private final int maxUploadBytes;
    private final Clock clock;
    private final ObjectMapper json = Mappers.json();

    public WebServer(int port, MaintenanceGateway gateway, int maxUploadBytes, Clock clock) {
        this.gateway = gateway;
        this.maxUploadBytes = maxUploadBytes;
        this.clock = clock;

        HttpHandler router = this::route;
        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(exchange -> {
                    if (exchange.isInIoThread()) {
                        exchange.dispatch(router);
                        return;
                    }
                    router.handleRequest(exchange);
                }).build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    // ---------- routing ----------

    private void route(HttpServerExchange ex) {
        long start = System.nanoTime();
        String method = ex.getRequestMethod().toString();
        String path = ex.getRequestPath();
        String actor = actorOf(ex);
        Throwable error = null;
        try {
            dispatch(ex, method, path, actor);
        } catch (Exception e) {
            error = e;
            sendError(ex, 500, "InternalError", e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest(method, path, actor, ex.getStatusCode(), totalMs, error);
        }
    }

    private void dispatch(HttpServerExchange ex, String method, String path, String actor) throws IOException {
        if ("/admin/health".equals(path)) {
            sendJson(ex, 200, Map.of("status", "ok"));
        } else if (BACKUP.equals(path)) {
            switch (method) {
                case "GET" -> handleExport(ex, actor);
                case "POST" -> respond(ex, 201, gateway.createManualBackup(actor), this::recordDto);
                default -> methodNotAllowed(ex);
            }
        } else if (HISTORY.equals(path)) {
            if ("GET".equals(method)) handleHistory(ex);
            else methodNotAllowed(ex);
        } else if (path.startsWith(DOWNLOAD_PREFIX)) {
            if ("GET".equals(method)) handleDownload(ex, path.substring(DOWNLOAD_PREFIX.length()));
            else methodNotAllowed(ex);
        } else if (UPLOAD.equals(path)) {
            if ("POST".equals(method)) handleUpload(ex, actor);
            else methodNotAllowed(ex);
        } else if (path.startsWith(BACKUP + "/")) {
            String id = path.substring(BACKUP.length() + 1);
            if (!"DELETE".equals(method)) {
                methodNotAllowed(ex);
            } else if (id.isBlank() || id.contains("/")) {
                sendError(ex, 404, FailureKind.NOT_FOUND.code(), "not found");
            } else {
                respond(ex, 200, gateway.deleteBackup(id, actor), rec -> Map.of("deleted", rec.id()));
            }
        } else if (SETTINGS.equals(path)) {
            switch (method) {
                case "GET" -> respond(ex, 200, gateway.settings(), WebServer::settingsDto);
                case "PATCH" -> handleSettingsUpdate(ex, actor);
                default -> methodNotAllowed(ex);
            }
        } else if (TRIGGER.equals(path)) {
            if ("POST".equals(method)) respond(ex, 201, gateway.triggerAutoBackup(actor), this::recordDto);
            else methodNotAllowed(ex);
        } else if (WIPE.equals(path)) {
            if ("POST".equals(method)) {
                respond(ex, 200, gateway.wipe(confirmed(ex, CONFIRM_WIPE_HEADER), actor), WebServer::wipeDto);
            } else {
                methodNotAllowed(ex);
            }
        } else if (path.startsWith(USERS_PREFIX)) {
            handleUsers(ex, path.substring(USERS_PREFIX.length()), method, actor);
        } else {
            sendError(ex, 404, FailureKind.NOT_FOUND.code(), "not found");
        }
    }

    // ---------- handlers ----------

    /** GET /api/maintenance/backup: fresh document as an attachment. */
    private void handleExport(HttpServerExchange ex, String actor) {
        Outcome<byte[]> outcome = gateway.export(actor);
        if (outcome instanceof Outcome.Success<byte[]> s) {
            sendAttachment(ex, BackupRecord.filenameFor(BackupSource.MANUAL, clock.instant()), s.value());
        } else {
            sendFailure(ex, (Outcome.Failure<byte[]>) outcome);
        }
    }

    private void handleHistory(HttpServerExchange ex) {
        int page;
        int pageSize;
        try {
            page = intParam(ex, "page", 1);
            pageSize = intParam(ex, "pageSize", DEFAULT_PAGE_SIZE);
        } catch (NumberFormatException nfe) {
            sendError(ex, 400, FailureKind.VALIDATION_FAILED.code(), "page and pageSize must be integers");
            return;
        }
        if (page < 1 || pageSize < 1) {
            sendError(ex, 400, FailureKind.VALIDATION_FAILED.code(), "page and pageSize must be >= 1");
            return;
        }
        respond(ex, 200, gateway.history(page, pageSize), this::historyDto);
    }

    private void handleDownload(HttpServerExchange ex, String id) {
        Outcome<Download> outcome = gateway.download(id);
        if (outcome instanceof Outcome.Success<Download> s) {
            sendAttachment(ex, s.value().record().filename(), s.value().bytes());
        } else {
            sendFailure(ex, (Outcome.Failure<Download>) outcome);
        }
    }

    /**
     * POST /api/maintenance/backup/upload
     * Accepts the backup document either as the raw JSON body or as the first
     * file part of a multipart/form-data request.
     */
    private void handleUpload(HttpServerExchange ex, String actor) throws IOException {
        if (!confirmed(ex, CONFIRM_HEADER)) {
            respond(ex, 200, gateway.uploadAndRestore(null, false, actor), WebServer::restoreDto);
            return;
        }

        ex.startBlocking();
        byte[] body = readUpload(ex);
        if (body == null) {
            sendError(ex, 413, "PayloadTooLarge", "backup document exceeds " + maxUploadBytes + " bytes");
            return;
        }
        respond(ex, 200, gateway.uploadAndRestore(body, true, actor), WebServer::restoreDto);
    }

    private void handleSettingsUpdate(HttpServerExchange ex, String actor) throws IOException {
        SettingsRequest req = readJson(ex, SettingsRequest.class);
        if (req == null) return;
        var update = new SettingsUpdate(req.enabled, req.intervalValue, req.intervalUnit);
        respond(ex, 200, gateway.updateSettings(update, actor), WebServer::settingsDto);
    }

    /** PATCH /api/admin/users/{id}/role | /status */
    private void handleUsers(HttpServerExchange ex, String rest, String method, String actor) throws IOException {
        // rest = "{id}/role" or "{id}/status"
        int slash = rest.indexOf('/');
        String userId = slash < 0 ? "" : rest.substring(0, slash);
        String action = slash < 0 ? "" : rest.substring(slash + 1);
        if (userId.isBlank() || !(action.equals("role") || action.equals("status"))) {
            sendError(ex, 404, FailureKind.NOT_FOUND.code(), "not found");
            return;
        }
        if (!"PATCH".equals(method)) {
            methodNotAllowed(ex);
            return;
        }
        if (action.equals("role")) {
            RoleRequest req = readJson(ex, RoleRequest.class);
            if (req == null) return;
            respond(ex, 200, gateway.changeUserRole(userId, req.role, actor), user -> user);
        } else {
            StatusRequest req = readJson(ex, StatusRequest.class);
            if (req == null) return;
            respond(ex, 200, gateway.changeUserStatus(userId, req.isActive, actor), user -> user);
        }
    }

    // ---------- outcome mapping ----------

    private <T> void respond(HttpServerExchange ex, int successStatus, Outcome<T> outcome,
                             Function<T, Object> toBody) {
        if (outcome instanceof Outcome.Success<T> s) {
            sendJson(ex, successStatus, toBody.apply(s.value()));
        } else {
            sendFailure(ex, (Outcome.Failure<T>) outcome);
        }
    }

    private void sendFailure(HttpServerExchange ex, Outcome.Failure<?> failure) {
        sendError(ex, statusFor(failure.kind()), failure.kind().code(), failure.message());
    }

    static int statusFor(FailureKind kind) {
        return switch (kind) {
            case MALFORMED_DOCUMENT, INVALID_SETTINGS -> 400;
            case NOT_FOUND -> 404;
            case LAST_ADMIN_INVARIANT_VIOLATION -> 409;
            case CONFIRMATION_REQUIRED -> 428;
            case UNSUPPORTED_VERSION, VALIDATION_FAILED -> 422;
            case STORAGE_FAILURE -> 500;
        };
    }

    private BackupRecordResponse recordDto(BackupRecord r) {
        var dto = new BackupRecordResponse();
        dto.id = r.id();
        dto.filename = r.filename();
        dto.sizeBytes = r.sizeBytes();
        dto.source = r.source().wireName();
        dto.createdBy = r.createdBy();
        dto.createdAt = r.createdAt();
        return dto;
    }

    private HistoryResponse historyDto(HistoryPage page) {
        var dto = new HistoryResponse();
        dto.history = new ArrayList<>(page.records().size());
        for (BackupRecord r : page.records()) {
            dto.history.add(recordDto(r));
        }
        dto.total = page.total();
        dto.page = page.page();
        dto.pageSize = page.pageSize();
        return dto;
    }

    private static SettingsResponse settingsDto(AutoBackupSettings s) {
        var dto = new SettingsResponse();
        dto.enabled = s.enabled();
        dto.intervalValue = s.intervalValue();
        dto.intervalUnit = s.intervalUnit().wireName();
        dto.lastRunAt = s.lastRunAt();
        dto.nextRunAt = s.nextRunAt();
        return dto;
    }

    private static RestoreResponse restoreDto(RestoreReport r) {
        var dto = new RestoreResponse();
        dto.message = "restore completed";
        dto.restoredAt = r.restoredAt();
        dto.schemaVersion = r.schemaVersion();
        dto.replaced = r.replaced();
        dto.ignoredCollections = r.ignoredCollections();
        return dto;
    }

    private static WipeResponse wipeDto(WipeReport r) {
        var dto = new WipeResponse();
        dto.message = "all data has been wiped";
        dto.wipedAt = r.wipedAt();
        dto.cleared = r.cleared();
        dto.preserved = r.preserved();
        dto.backupsDeleted = r.backupsDeleted();
        return dto;
    }

    // ---------- helpers ----------

    private static boolean confirmed(HttpServerExchange ex, String header) {
        return "true".equalsIgnoreCase(firstOrNull(ex.getQueryParameters().get("confirm")))
                || "true".equalsIgnoreCase(ex.getRequestHeaders().getFirst(header));
    }

    /** @return the document bytes, or null when the upload exceeds the size limit */
    private byte[] readUpload(HttpServerExchange ex) throws IOException {
        FormDataParser parser = MULTIPART_ONLY.createParser(ex);
        if (parser == null) {
            try (InputStream in = ex.getInputStream()) {
                byte[] data = in.readNBytes(maxUploadBytes + 1);
                return data.length > maxUploadBytes ? null : data;
            }
        }
        ex.setMaxEntitySize((long) maxUploadBytes + MULTIPART_OVERHEAD_BYTES);
        try (parser) {
            FormData form;
            try {
                form = parser.parseBlocking();
            } catch (RequestTooBigException tooBig) {
                return null;
            }
            for (String field : form) {
                for (FormData.FormValue value : form.get(field)) {
                    if (!value.isFileItem()) continue;
                    FormData.FileItem item = value.getFileItem();
                    if (item.getFileSize() > maxUploadBytes) return null;
                    try (InputStream in = item.getInputStream()) {
                        return in.readAllBytes();
                    }
                }
            }
        }
        return new byte[0];
    }

    /** Read a JSON body; on failure a 400 has already been sent and null is returned. */
    private <T> T readJson(HttpServerExchange ex, Class<T> type) throws IOException {
        ex.startBlocking();
        byte[] data;
        try (InputStream in = ex.getInputStream()) {
            data = in.readNBytes(MAX_JSON_BODY_BYTES + 1);
        }
        if (data.length > MAX_JSON_BODY_BYTES) {
            sendError(ex, 413, "PayloadTooLarge", "request body too large");
            return null;
        }
        try {
            T value = data.length == 0 ? null : json.readValue(data, type);
            if (value == null) {
                sendError(ex, 400, "InvalidRequest", "request body must be a JSON object");
            }
            return value;
        } catch (JsonProcessingException e) {
            sendError(ex, 400, "InvalidRequest", "invalid JSON: " + e.getOriginalMessage());
            return null;
        }
    }

    private static String actorOf(HttpServerExchange ex) {
        String actor = ex.getRequestHeaders().getFirst(ACTOR_HEADER);
        return actor == null || actor.isBlank() ? DEFAULT_ACTOR : actor.trim();
    }

    private static int intParam(HttpServerExchange ex, String name, int defaultValue) {
        String raw = firstOrNull(ex.getQueryParameters().get(name));
        return raw == null || raw.isBlank() ? defaultValue : Integer.parseInt(raw.trim());
    }

    private static String firstOrNull(Deque<String> deque) {
        return (deque == null || deque.isEmpty()) ? null : deque.getFirst();
    }

    private void methodNotAllowed(HttpServerExchange ex) {
        sendError(ex, 405, "MethodNotAllowed", "method not allowed");
    }

    private void sendError(HttpServerExchange ex, int code, String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        sendJson(ex, code, body);
    }

    private void sendAttachment(HttpServerExchange ex, String filename, byte[] bytes) {
        ex.setStatusCode(200);
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        ex.getResponseHeaders().put(Headers.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"");
        ex.getResponseSender().send(ByteBuffer.wrap(bytes));
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void sendJson(HttpServerExchange ex, int code, Object body) {
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        try {
            byte[] bytes = json.writeValueAsBytes(body);
            ex.setStatusCode(code);
            ex.getResponseSender().send(ByteBuffer.wrap(bytes));
        } catch (JsonProcessingException e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"InternalError\",\"message\":\"serialization\"}");
        }
    }
}
