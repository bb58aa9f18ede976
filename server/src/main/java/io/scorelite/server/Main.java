// file: server/src/main/java/io/scorelite/server/Main.java
package io.scorelite.server;

import io.scorelite.storage.BlobStore;
import io.scorelite.storage.DurableScoreStore;
import io.scorelite.storage.FileBlobStore;
import io.scorelite.storage.FileSnapshotter;
import io.scorelite.storage.FileWal;
import io.scorelite.storage.InMemoryBlobStore;
import io.scorelite.storage.InMemoryObjectStore;
import io.scorelite.storage.InMemoryRefStore;
import io.scorelite.storage.ObjectStore;
import io.scorelite.storage.RefStore;
import io.scorelite.storage.SnapshotPolicy;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point for a ScoreLite server.
 *
 * Responsibilities:
 *  - Parse configuration from CLI.
 *  - Load the logging configuration.
 *  - Wire storage: either one DurableScoreStore (WAL + snapshots) serving
 *    objects, heads and versions, or the in-memory stores.
 *  - Create the engines (ScoreService, PropertyService) sharing one lock table.
 *  - Start the HTTP server and stop it (and the WAL) on shutdown.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) throws IOException {
        ServerConfig cfg;
        try {
            cfg = ServerConfig.fromArgs(args);
        } catch (IllegalArgumentException bad) {
            System.err.println(bad.getMessage());
            ServerConfig.printUsage();
            System.exit(1);
            return;
        }
        configureLogging();

        // ------ Storage Layer -------
        ObjectStore objects;
        RefStore refs;
        BlobStore blobs;
        FileWal wal = null;

        if (ServerConfig.STORAGE_MEMORY.equals(cfg.storage())) {
            objects = new InMemoryObjectStore();
            refs = new InMemoryRefStore();
            blobs = new InMemoryBlobStore();
        } else {
            Path data = Path.of(cfg.dataDir());
            wal = new FileWal(data.resolve("wal"), cfg.walRotateBytes());
            var snaps = new FileSnapshotter(data.resolve("snap"));
            var store = new DurableScoreStore(wal, snaps, new SnapshotPolicy(cfg.snapshotEvery()));
            objects = store;
            refs = store;
            blobs = new FileBlobStore(data.resolve("blobs"));
        }

        // ------ Engines ------
        var locks = new ScoreLocks(cfg.lockTimeoutMs());
        var propertyService = new PropertyService(objects, refs, locks);
        var scoreService = new ScoreService(objects, refs, locks, propertyService, cfg.cacheSize());

        // ------ HTTP layer ------
        var web = new WebServer(cfg.httpPort(), scoreService, propertyService, blobs);
        web.start();

        log.info(String.format("ScoreLite listening on http://%s:%d (%s storage)",
                "localhost", cfg.httpPort(), cfg.storage()));

        // Shutdown hook
        final FileWal toClose = wal;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            web.stop();
            if (toClose != null) {
                try {
                    toClose.close();
                } catch (IOException e) {
                    log.log(Level.WARNING, "failed to close WAL", e);
                }
            }
        }));
    }

    /** Apply logging.properties from the classpath unless a config file was given explicitly. */
    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) return;
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) LogManager.getLogManager().readConfiguration(in);
        } catch (IOException e) {
            log.log(Level.WARNING, "could not load logging.properties", e);
        }
    }
}
