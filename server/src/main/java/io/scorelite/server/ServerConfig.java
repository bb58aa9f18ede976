// file: server/src/main/java/io/scorelite/server/ServerConfig.java
package io.scorelite.server;

/**
 * Server configuration parsed from CLI args.
 *
 * Supports:
 *  - httpPort:        external HTTP API port
 *  - dataDir:         root of wal/, snap/ and blobs/
 *  - storage:         "durable" (WAL + snapshots) or "memory" (lost on exit)
 *  - lockTimeoutMs:   how long a writer waits for the per-score lock
 *  - snapshotEvery:   full snapshot after this many logged mutations
 *  - walRotateBytes:  WAL segment size that triggers rotation
 *  - cacheSize:       number of materialized snapshots kept in memory
 */
public record ServerConfig(
        int httpPort,
        String dataDir,
        String storage,
        long lockTimeoutMs,
        int snapshotEvery,
        long walRotateBytes,
        int cacheSize
) {

    public static final String STORAGE_DURABLE = "durable";
    public static final String STORAGE_MEMORY = "memory";

    public ServerConfig {
        if (!STORAGE_DURABLE.equals(storage) && !STORAGE_MEMORY.equals(storage)) {
            throw new IllegalArgumentException("storage must be 'durable' or 'memory': " + storage);
        }
        if (lockTimeoutMs < 0) throw new IllegalArgumentException("lock-timeout-ms must be >= 0");
        if (snapshotEvery <= 0) throw new IllegalArgumentException("snapshot-every must be > 0");
        if (walRotateBytes <= 0) throw new IllegalArgumentException("wal-rotate-bytes must be > 0");
        if (cacheSize < 0) throw new IllegalArgumentException("cache-size must be >= 0");
    }

    /** Defaults for local dev. */
    public static ServerConfig defaults() {
        return new ServerConfig(8080, "./data", STORAGE_DURABLE, 2000, 50_000, 64L * 1024 * 1024, 256);
    }

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --http-port, -p   <port>
     *   --data-dir,  -d   <path>
     *   --storage,   -s   durable|memory
     *   --lock-timeout-ms <millis>
     *   --snapshot-every  <writes>
     *   --wal-rotate-bytes <bytes>
     *   --cache-size      <snapshots>
     *   --help,      -h
     *
     * All flags are optional.
     */
    public static ServerConfig fromArgs(String[] args) {
        ServerConfig d = defaults();
        int httpPort = d.httpPort();
        String dataDir = d.dataDir();
        String storage = d.storage();
        long lockTimeoutMs = d.lockTimeoutMs();
        int snapshotEvery = d.snapshotEvery();
        long walRotateBytes = d.walRotateBytes();
        int cacheSize = d.cacheSize();

        // CLIArg Parser
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--http-port", "-p" -> {
                    ensureValue(args, i);
                    httpPort = parseInt(args[i], args[++i]);
                }

                case "--data-dir", "-d" -> {
                    ensureValue(args, i);
                    dataDir = args[++i];
                }

                case "--storage", "-s" -> {
                    ensureValue(args, i);
                    storage = args[++i];
                }

                case "--lock-timeout-ms" -> {
                    ensureValue(args, i);
                    lockTimeoutMs = parseLong(args[i], args[++i]);
                }

                case "--snapshot-every" -> {
                    ensureValue(args, i);
                    snapshotEvery = parseInt(args[i], args[++i]);
                }

                case "--wal-rotate-bytes" -> {
                    ensureValue(args, i);
                    walRotateBytes = parseLong(args[i], args[++i]);
                }

                case "--cache-size" -> {
                    ensureValue(args, i);
                    cacheSize = parseInt(args[i], args[++i]);
                }

                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }
        return new ServerConfig(httpPort, dataDir, storage, lockTimeoutMs, snapshotEvery, walRotateBytes, cacheSize);
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[i]);
        }
    }

    private static int parseInt(String flag, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + flag + ": " + value, e);
        }
    }

    private static long parseLong(String flag, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + flag + ": " + value, e);
        }
    }

    static void printUsage() {
        System.out.println("""
            Usage: server [options]

            Options:
              --http-port,  -p      HTTP port (default: 8080)
              --data-dir,   -d      Data directory for wal/, snap/, blobs/ (default: ./data)
              --storage,    -s      durable | memory (default: durable)
              --lock-timeout-ms     Max wait for a score's write lock (default: 2000)
              --snapshot-every      Snapshot after N logged writes (default: 50000)
              --wal-rotate-bytes    WAL segment size (default: 67108864)
              --cache-size          Materialized snapshots kept in memory (default: 256)
              --help,       -h      Show this help message
            """);
    }

    private static void printHelpAndExit() {
        printUsage();
        System.exit(0);
    }
}
