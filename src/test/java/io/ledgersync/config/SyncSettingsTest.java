package io.ledgersync.config;

import io.ledgersync.security.PayloadCrypto;
import io.ledgersync.support.TestDirs;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

final class SyncSettingsTest {

    @Test
    void missingFileGivesDefaults() {
        SyncSettings settings = SyncSettings.load(Path.of("does-not-exist", "ledgersync-settings.json"));
        Assertions.assertEquals(SyncSettings.defaults(), settings);
        Assertions.assertEquals(PayloadCrypto.DEFAULT_KDF_ITERATIONS, settings.kdfIterations());
        Assertions.assertEquals("Starting Balance", settings.startingBalancePayee());
    }

    @Test
    void fileOverridesOnlyValidFields() throws Exception {
        Path root = Files.createTempDirectory("ledgersync-settings-test-");
        try {
            LedgerSyncConfig config = LedgerSyncConfig.fromRoot(root.toString());
            Files.writeString(config.settingsFile(), """
                    {
                      "kdfIterations": 2000,
                      "fuzzyMatchWindowDays": 0,
                      "bankSyncLookbackDays": -5,
                      "startingBalancePayee": "  Opening Balance ",
                      "somethingElse": true
                    }
                    """, StandardCharsets.UTF_8);

            SyncSettings settings = SyncSettings.load(config.settingsFile());
            Assertions.assertEquals(2000, settings.kdfIterations());
            Assertions.assertEquals(0, settings.fuzzyMatchWindowDays());
            Assertions.assertEquals(SyncSettings.DEFAULT_BANK_SYNC_LOOKBACK_DAYS, settings.bankSyncLookbackDays());
            Assertions.assertEquals("Opening Balance", settings.startingBalancePayee());
            Assertions.assertEquals("", settings.auditSigningSecret());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void malformedFileIsAnError() throws Exception {
        Path root = Files.createTempDirectory("ledgersync-settings-test-");
        try {
            Path file = root.resolve(LedgerSyncConfig.SETTINGS_FILE);
            Files.writeString(file, "{ not json", StandardCharsets.UTF_8);
            Assertions.assertThrows(RuntimeException.class, () -> SyncSettings.load(file));
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void relayDefaultsUnderRoot() {
        LedgerSyncConfig config = LedgerSyncConfig.fromRoot("replica-x");
        Assertions.assertEquals(config.rootDir().resolve("relay"), config.relayDir());
        Assertions.assertEquals("ledger.db", config.dbFile().getFileName().toString());
        LedgerSyncConfig shared = LedgerSyncConfig.fromRoot("replica-x", "shared-relay");
        Assertions.assertTrue(shared.relayDir().endsWith("shared-relay"));
    }
}
