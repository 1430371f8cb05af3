package io.ledgersync.config;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Directory layout of one replica.
 */
public final class LedgerSyncConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "ledgersync-settings.json";

    private final Path rootDir;
    private final Path relayDir;

    public LedgerSyncConfig(Path rootDir, Path relayDir) {
        this.rootDir = rootDir;
        this.relayDir = relayDir;
    }

    public static LedgerSyncConfig fromRoot(String root) {
        return fromRoot(root, null);
    }

    public static LedgerSyncConfig fromRoot(String root, String relay) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        Path relayPath = relay == null || relay.isBlank()
                ? base.resolve("relay")
                : Paths.get(relay).toAbsolutePath().normalize();
        return new LedgerSyncConfig(base, relayPath);
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path relayDir() {
        return relayDir;
    }

    public Path dbFile() {
        return rootDir.resolve("ledger.db");
    }

    public Path metadataFile() {
        return rootDir.resolve("metadata.json");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }
}
