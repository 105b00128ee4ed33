// file: server/src/main/java/io/backlite/server/ServerConfig.java
package io.backlite.server;

import io.backlite.server.restore.RestorePolicy;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Server configuration parsed from CLI args.
 *
 * Supports:
 *  - httpPort:            HTTP API port
 *  - dataDir:             root of wal/, checkpoints/, backups/ and settings/
 *  - collections:         registered collection names, in backup order
 *  - checkpointEvery:     mutations between datastore checkpoints
 *  - walRotateBytes:      WAL segment size before rotation
 *  - maxUploadBytes:      largest accepted restore upload
 *  - retainLatest:        keep only the newest N backups after each backup (0 = keep all)
 *  - unknownCollections:  restore policy for unregistered collection names
 *  - allowCollections:    unregistered names that are skipped even when the policy is REJECT
 */
public record ServerConfig(
        int httpPort,
        Path dataDir,
        List<String> collections,
        int checkpointEvery,
        long walRotateBytes,
        int maxUploadBytes,
        int retainLatest,
        RestorePolicy.UnknownCollections unknownCollections,
        Set<String> allowCollections
) {
    public static final List<String> DEFAULT_COLLECTIONS = List.of(
            "items", "customers", "orders", "payments", "inventoryLogs",
            "accounts", "ledger", "settings", "systemLogs", "users");

    private static final long MB = 1024L * 1024L;

    public Path walDir() {
        return dataDir.resolve("wal");
    }

    public Path checkpointDir() {
        return dataDir.resolve("checkpoints");
    }

    public Path backupDir() {
        return dataDir.resolve("backups");
    }

    public Path settingsFile() {
        return dataDir.resolve("settings").resolve("auto-backup.json");
    }

    public RestorePolicy restorePolicy() {
        return new RestorePolicy(unknownCollections, allowCollections);
    }

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --http-port,  -p   <port>
     *   --data-dir,   -d   <path>
     *   --collections      <a,b,c>
     *   --checkpoint-every <n>
     *   --wal-rotate-mb    <mb>
     *   --max-upload-mb    <mb>
     *   --retain-latest    <n>
     *   --unknown-collections ignore|reject
     *   --allow-collections <a,b>
     *   --help,       -h
     *
     * All flags are optional; defaults are reasonable for local dev.
     */
    public static ServerConfig fromArgs(String[] args) {
        int httpPort = 8080;
        String dataDir = "./data";
        List<String> collections = DEFAULT_COLLECTIONS;
        int checkpointEvery = 1000;
        long walRotateMb = 64;
        int maxUploadMb = 64;
        int retainLatest = 0;
        RestorePolicy.UnknownCollections unknown = RestorePolicy.UnknownCollections.IGNORE;
        Set<String> allow = Set.of();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--http-port", "-p" -> {
                    ensureValue(args, i);
                    httpPort = parseInt(args[i], args[++i], 1, 65535);
                }

                case "--data-dir", "-d" -> {
                    ensureValue(args, i);
                    dataDir = args[++i];
                }

                case "--collections" -> {
                    ensureValue(args, i);
                    collections = List.copyOf(splitList(args[++i]));
                    if (collections.isEmpty()) fail("--collections needs at least one name");
                }

                case "--checkpoint-every" -> {
                    ensureValue(args, i);
                    checkpointEvery = parseInt(args[i], args[++i], 1, Integer.MAX_VALUE);
                }

                case "--wal-rotate-mb" -> {
                    ensureValue(args, i);
                    walRotateMb = parseInt(args[i], args[++i], 1, 4096);
                }

                case "--max-upload-mb" -> {
                    ensureValue(args, i);
                    maxUploadMb = parseInt(args[i], args[++i], 1, 1024);
                }

                case "--retain-latest" -> {
                    ensureValue(args, i);
                    retainLatest = parseInt(args[i], args[++i], 0, Integer.MAX_VALUE);
                }

                case "--unknown-collections" -> {
                    ensureValue(args, i);
                    String v = args[++i].trim().toLowerCase();
                    switch (v) {
                        case "ignore" -> unknown = RestorePolicy.UnknownCollections.IGNORE;
                        case "reject" -> unknown = RestorePolicy.UnknownCollections.REJECT;
                        default -> fail("--unknown-collections must be ignore or reject");
                    }
                }

                case "--allow-collections" -> {
                    ensureValue(args, i);
                    allow = Set.copyOf(splitList(args[++i]));
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new ServerConfig(
                httpPort,
                Path.of(dataDir),
                collections,
                checkpointEvery,
                walRotateMb * MB,
                (int) (maxUploadMb * MB),
                retainLatest,
                unknown,
                allow
        );
    }

    private static LinkedHashSet<String> splitList(String raw) {
        LinkedHashSet<String> out = new LinkedHashSet<>();
        Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(out::add);
        return out;
    }

    private static int parseInt(String flag, String value, int min, int max) {
        try {
            int v = Integer.parseInt(value.trim());
            if (v < min || v > max) fail("Invalid " + flag + ": " + value + " (allowed " + min + ".." + max + ")");
            return v;
        } catch (NumberFormatException e) {
            fail("Invalid " + flag + ": " + value);
            return -1; // unreachable
        }
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            fail("Missing value for option: " + args[i]);
        }
    }

    private static void fail(String message) {
        System.err.println(message);
        System.exit(1);
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: server [options]

            Options:
              --http-port,   -p      HTTP port (default: 8080)
              --data-dir,    -d      Data directory (default: ./data)
              --collections          Comma-separated collection names, in backup order
                                     (default: items,customers,orders,payments,inventoryLogs,
                                      accounts,ledger,settings,systemLogs,users)
              --checkpoint-every     Mutations between datastore checkpoints (default: 1000)
              --wal-rotate-mb        WAL segment size in MB (default: 64)
              --max-upload-mb        Largest accepted restore upload in MB (default: 64)
              --retain-latest        Keep only the newest N backups, 0 keeps all (default: 0)
              --unknown-collections  ignore|reject unregistered collections on restore (default: ignore)
              --allow-collections    Comma-separated names skipped even with reject
              --help,        -h      Show this help message
            """);
        System.exit(0);
    }
}
