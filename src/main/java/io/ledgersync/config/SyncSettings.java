package io.ledgersync.config;

import io.ledgersync.security.PayloadCrypto;
import io.ledgersync.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tunables read from {@code ledgersync-settings.json}. Every field is optional in the file.
 */
public record SyncSettings(
        int kdfIterations,
        int fuzzyMatchWindowDays,
        int bankSyncLookbackDays,
        String startingBalancePayee,
        String auditSigningSecret
) {
    public static final int DEFAULT_FUZZY_MATCH_WINDOW_DAYS = 7;
    public static final int DEFAULT_BANK_SYNC_LOOKBACK_DAYS = 90;
    public static final String DEFAULT_STARTING_BALANCE_PAYEE = "Starting Balance";

    public static SyncSettings defaults() {
        return new SyncSettings(
                PayloadCrypto.DEFAULT_KDF_ITERATIONS,
                DEFAULT_FUZZY_MATCH_WINDOW_DAYS,
                DEFAULT_BANK_SYNC_LOOKBACK_DAYS,
                DEFAULT_STARTING_BALANCE_PAYEE,
                ""
        );
    }

    public static SyncSettings load(Path file) {
        SyncSettings defaults = defaults();
        if (file == null || !Files.isRegularFile(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read settings: " + file, e);
        }
    }

    static SyncSettings fromFile(SettingsFile file, SyncSettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new SyncSettings(
                positiveOr(file.kdfIterations(), defaults.kdfIterations()),
                nonNegativeOr(file.fuzzyMatchWindowDays(), defaults.fuzzyMatchWindowDays()),
                positiveOr(file.bankSyncLookbackDays(), defaults.bankSyncLookbackDays()),
                file.startingBalancePayee() == null || file.startingBalancePayee().isBlank()
                        ? defaults.startingBalancePayee()
                        : file.startingBalancePayee().trim(),
                file.auditSigningSecret() == null ? defaults.auditSigningSecret() : file.auditSigningSecret()
        );
    }

    private static int positiveOr(Integer value, int fallback) {
        return value == null || value <= 0 ? fallback : value;
    }

    private static int nonNegativeOr(Integer value, int fallback) {
        return value == null || value < 0 ? fallback : value;
    }

    record SettingsFile(
            Integer kdfIterations,
            Integer fuzzyMatchWindowDays,
            Integer bankSyncLookbackDays,
            String startingBalancePayee,
            String auditSigningSecret
    ) {
    }
}
