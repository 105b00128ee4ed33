// file: client/src/main/java/io/backlite/client/Cli.java
package io.backlite.client;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Simple CLI for the maintenance API of a running backlite server.
 *
 * Usage:
 *   backlite-cli [--base-url http://host:port] [--actor name] backup
 *   backlite-cli ... export <file>
 *   backlite-cli ... history [page] [pageSize]
 *   backlite-cli ... download <id> <file>
 *   backlite-cli ... delete <id>
 *   backlite-cli ... restore <file> --yes
 *   backlite-cli ... trigger
 *   backlite-cli ... settings [--enable | --disable] [--every <n> <hours|days|weeks>]
 *   backlite-cli ... role <userId> <ADMIN|EMPLOYEE>
 *   backlite-cli ... status <userId> <active|inactive>
 *   backlite-cli ... wipe --yes
 *
 * Examples:
 *   backlite-cli backup
 *   backlite-cli settings --enable --every 12 hours
 *   backlite-cli restore ./backup-2024-03-01T10-00-00Z.json --yes
 */
public final class Cli {

    static final String DEFAULT_BASE_URL = "http://localhost:8080";
    static final String DEFAULT_ACTOR = "admin";

    private static final String BACKUP = "/api/maintenance/backup";
    private static final String SETTINGS = "/api/maintenance/auto-backup/settings";

    private final HttpClient http;
    private final String baseUrl;
    private final String actor;

    private Cli(String baseUrl, String actor) {
        this.http = HttpClient.newHttpClient();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.actor = actor;
    }

    /** Global options plus the remaining command words. */
    record Invocation(String baseUrl, String actor, List<String> command) {
    }

    public static void main(String[] args) {
        try {
            Invocation inv = parseGlobals(args);
            if (inv.command().isEmpty()) {
                usageAndExit("missing command");
            }
            new Cli(inv.baseUrl(), inv.actor()).run(inv.command());
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    static Invocation parseGlobals(String[] args) {
        String baseUrl = DEFAULT_BASE_URL;
        String actor = DEFAULT_ACTOR;
        int i = 0;
        while (i < args.length && args[i].startsWith("--")) {
            switch (args[i]) {
                case "--base-url" -> {
                    if (i + 1 >= args.length) throw new CliException("--base-url requires a value");
                    baseUrl = args[++i];
                }
                case "--actor" -> {
                    if (i + 1 >= args.length) throw new CliException("--actor requires a value");
                    actor = args[++i];
                }
                default -> {
                    // not a global option; leave it for the command
                    return new Invocation(baseUrl, actor, List.of(Arrays.copyOfRange(args, i, args.length)));
                }
            }
            i++;
        }
        return new Invocation(baseUrl, actor, List.of(Arrays.copyOfRange(args, i, args.length)));
    }

    private void run(List<String> command) throws Exception {
        String cmd = command.get(0);
        List<String> rest = command.subList(1, command.size());
        switch (cmd) {
            case "backup" -> {
                expectArgs(rest, 0, "backup takes no arguments");
                print(send(post(BACKUP), 201, "backup"));
            }
            case "export" -> {
                expectArgs(rest, 1, "export requires <file>");
                saveTo(Path.of(rest.get(0)), sendBytes(get(BACKUP), "export"));
            }
            case "history" -> {
                if (rest.size() > 2) usageAndExit("history takes [page] [pageSize]");
                String page = rest.size() > 0 ? rest.get(0) : "1";
                String pageSize = rest.size() > 1 ? rest.get(1) : "5";
                print(send(get(BACKUP + "/history?page=" + page + "&pageSize=" + pageSize), 200, "history"));
            }
            case "download" -> {
                expectArgs(rest, 2, "download requires <id> <file>");
                saveTo(Path.of(rest.get(1)), sendBytes(get(BACKUP + "/download/" + rest.get(0)), "download"));
            }
            case "delete" -> {
                expectArgs(rest, 1, "delete requires <id>");
                print(send(request(BACKUP + "/" + rest.get(0)).DELETE(), 200, "delete"));
            }
            case "restore" -> {
                if (rest.isEmpty() || rest.size() > 2) usageAndExit("restore requires <file> [--yes]");
                boolean confirmed = rest.size() == 2 && "--yes".equals(rest.get(1));
                if (rest.size() == 2 && !confirmed) usageAndExit("unknown restore option: " + rest.get(1));
                restore(Path.of(rest.get(0)), confirmed);
            }
            case "trigger" -> {
                expectArgs(rest, 0, "trigger takes no arguments");
                print(send(post("/api/maintenance/auto-backup/trigger"), 201, "trigger"));
            }
            case "settings" -> {
                String body = settingsBody(rest);
                HttpRequest.Builder req = body == null
                        ? get(SETTINGS)
                        : request(SETTINGS)
                            .header("Content-Type", "application/json")
                            .method("PATCH", HttpRequest.BodyPublishers.ofString(body));
                print(send(req, 200, "settings"));
            }
            case "role" -> {
                expectArgs(rest, 2, "role requires <userId> <ADMIN|EMPLOYEE>");
                String body = "{\"role\":\"" + rest.get(1) + "\"}";
                print(send(patch("/api/admin/users/" + rest.get(0) + "/role", body), 200, "role"));
            }
            case "status" -> {
                expectArgs(rest, 2, "status requires <userId> <active|inactive>");
                boolean active = switch (rest.get(1)) {
                    case "active" -> true;
                    case "inactive" -> false;
                    default -> throw new CliException("status must be active or inactive");
                };
                String body = "{\"isActive\":" + active + "}";
                print(send(patch("/api/admin/users/" + rest.get(0) + "/status", body), 200, "status"));
            }
            case "wipe" -> {
                if (!wipeConfirmed(rest)) {
                    throw new CliException("wipe deletes ALL data and every stored backup; re-run with --yes to confirm");
                }
                HttpRequest.Builder req = request("/api/maintenance/wipe")
                        .header("X-Confirm-Wipe", "true")
                        .POST(HttpRequest.BodyPublishers.noBody());
                print(send(req, 200, "wipe"));
            }
            default -> usageAndExit("unknown command: " + cmd);
        }
    }

    /** True only for exactly {@code --yes}; no options means unconfirmed. */
    static boolean wipeConfirmed(List<String> opts) {
        if (opts.isEmpty()) return false;
        if (opts.size() == 1 && "--yes".equals(opts.get(0))) return true;
        throw new CliException("wipe takes only --yes, got " + opts);
    }

    /**
     * JSON body for a settings change, or null when no option was given (plain read).
     */
    static String settingsBody(List<String> opts) {
        if (opts.isEmpty()) return null;
        List<String> fields = new ArrayList<>();
        for (int i = 0; i < opts.size(); i++) {
            switch (opts.get(i)) {
                case "--enable" -> fields.add("\"enabled\":true");
                case "--disable" -> fields.add("\"enabled\":false");
                case "--every" -> {
                    if (i + 2 >= opts.size()) throw new CliException("--every requires <n> <hours|days|weeks>");
                    String n = opts.get(++i);
                    try {
                        Integer.parseInt(n);
                    } catch (NumberFormatException e) {
                        throw new CliException("--every needs a whole number, got '" + n + "'");
                    }
                    fields.add("\"intervalValue\":" + n);
                    fields.add("\"intervalUnit\":\"" + opts.get(++i) + "\"");
                }
                default -> throw new CliException("unknown settings option: " + opts.get(i));
            }
        }
        return "{" + String.join(",", fields) + "}";
    }

    private void restore(Path file, boolean confirmed) throws Exception {
        if (!Files.isRegularFile(file)) throw new CliException("no such file: " + file);
        if (!confirmed) {
            throw new CliException("restore replaces ALL live data; re-run with --yes to confirm");
        }
        HttpRequest.Builder req = request(BACKUP + "/upload")
                .header("Content-Type", "application/json")
                .header("X-Confirm-Restore", "true")
                .POST(HttpRequest.BodyPublishers.ofFile(file));
        print(send(req, 200, "restore"));
    }

    // ---------- http helpers ----------

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .header("X-Actor", actor);
    }

    private HttpRequest.Builder get(String path) {
        return request(path).GET();
    }

    private HttpRequest.Builder post(String path) {
        return request(path).POST(HttpRequest.BodyPublishers.noBody());
    }

    private HttpRequest.Builder patch(String path, String json) {
        return request(path)
                .header("Content-Type", "application/json")
                .method("PATCH", HttpRequest.BodyPublishers.ofString(json));
    }

    private String send(HttpRequest.Builder req, int expected, String what) throws Exception {
        HttpResponse<String> resp = http.send(req.build(), HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != expected) {
            throw new CliException(what + " failed (" + resp.statusCode() + "): " + resp.body());
        }
        return resp.body();
    }

    private byte[] sendBytes(HttpRequest.Builder req, String what) throws Exception {
        HttpResponse<byte[]> resp = http.send(req.build(), HttpResponse.BodyHandlers.ofByteArray());
        if (resp.statusCode() != 200) {
            throw new CliException(what + " failed (" + resp.statusCode() + "): " + new String(resp.body(), StandardCharsets.UTF_8));
        }
        return resp.body();
    }

    private static void saveTo(Path file, byte[] bytes) throws IOException {
        Files.write(file, bytes);
        System.out.println("saved " + bytes.length + " bytes to " + file);
    }

    private static void print(String body) {
        System.out.println(body);
    }

    private static void expectArgs(List<String> rest, int n, String message) {
        if (rest.size() != n) usageAndExit(message);
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  backlite-cli [--base-url http://host:port] [--actor name] <command>

                Commands:
                  backup                               create a stored manual backup
                  export <file>                        download a fresh backup without storing it
                  history [page] [pageSize]            list stored backups, newest first
                  download <id> <file>                 save a stored backup
                  delete <id>                          delete a stored backup
                  restore <file> --yes                 replace ALL live data with a backup file
                  trigger                              run an auto-backup now
                  settings [--enable|--disable] [--every <n> <hours|days|weeks>]
                  role <userId> <ADMIN|EMPLOYEE>
                  status <userId> <active|inactive>
                  wipe --yes                           delete ALL data (accounts kept) and every stored backup
                """);
        System.exit(1);
    }

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
