package io.scorelite.server;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ServerConfigTest {

    @Test
    void defaults_apply_when_no_flags_given() {
        ServerConfig cfg = ServerConfig.fromArgs(new String[0]);
        assertEquals(8080, cfg.httpPort());
        assertEquals("./data", cfg.dataDir());
        assertEquals(ServerConfig.STORAGE_DURABLE, cfg.storage());
        assertEquals(2000, cfg.lockTimeoutMs());
        assertEquals(256, cfg.cacheSize());
    }

    @Test
    void flags_override_defaults() {
        ServerConfig cfg = ServerConfig.fromArgs(new String[]{
                "-p", "9090", "--data-dir", "/tmp/scores", "-s", "memory",
                "--lock-timeout-ms", "50", "--snapshot-every", "10", "--cache-size", "0"});
        assertEquals(9090, cfg.httpPort());
        assertEquals("/tmp/scores", cfg.dataDir());
        assertEquals(ServerConfig.STORAGE_MEMORY, cfg.storage());
        assertEquals(50, cfg.lockTimeoutMs());
        assertEquals(10, cfg.snapshotEvery());
        assertEquals(0, cfg.cacheSize());
    }

    @Test
    void bad_values_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.fromArgs(new String[]{"-p", "http"}));
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.fromArgs(new String[]{"-s", "cloud"}));
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.fromArgs(new String[]{"--data-dir"}));
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.fromArgs(new String[]{"--bogus"}));
    }
}
