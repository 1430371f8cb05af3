package io.ledgersync.cli;

import io.ledgersync.model.Variant;
import io.ledgersync.support.TestDirs;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;

final class LedgerSyncCommandTest {

    @Test
    void parsesTypedValues() {
        Assertions.assertEquals(Variant.of("12"), LedgerSyncCommand.parseValue("12", null));
        Assertions.assertEquals(Variant.of(-1200L), LedgerSyncCommand.parseValue(" -1200 ", "integer"));
        Assertions.assertEquals(Variant.of(2.0d), LedgerSyncCommand.parseValue("2", "REAL"));
        Assertions.assertEquals(Variant.of(true), LedgerSyncCommand.parseValue("1", "bool"));
        Assertions.assertEquals(Variant.of(false), LedgerSyncCommand.parseValue("FALSE", "boolean"));
        Assertions.assertTrue(LedgerSyncCommand.parseValue("anything", "null").isNull());
        Assertions.assertThrows(IllegalArgumentException.class, () -> LedgerSyncCommand.parseValue("yes", "boolean"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> LedgerSyncCommand.parseValue("1", "date"));
        Assertions.assertThrows(NumberFormatException.class, () -> LedgerSyncCommand.parseValue("ten", "integer"));
    }

    @Test
    void initSetGetAndMigrationsThroughCommandLine() throws Exception {
        Path root = Files.createTempDirectory("ledgersync-cli-test-");
        try {
            String replica = root.resolve("replica").toString();
            CommandLine cmd = new CommandLine(new LedgerSyncCommand());
            Assertions.assertEquals(0, cmd.execute("--root", replica, "init", "--name", "Household"));
            Assertions.assertTrue(Files.isRegularFile(root.resolve("replica").resolve("ledger.db")));
            Assertions.assertTrue(Files.readString(root.resolve("replica").resolve("metadata.json")).contains("Household"));

            Assertions.assertEquals(0, cmd.execute("--root", replica, "set", "accounts", "a1", "balance_current", "5000", "--type", "integer"));
            Assertions.assertEquals(0, cmd.execute("--root", replica, "get", "accounts", "a1"));
            Assertions.assertEquals(1, cmd.execute("--root", replica, "get", "accounts", "missing"));
            Assertions.assertEquals(0, cmd.execute("--root", replica, "schema-migrations", "--limit", "5"));
            Assertions.assertEquals(0, cmd.execute("--root", replica, "audit-tail", "--lines", "3"));
            Assertions.assertNotEquals(0, cmd.execute("--root", replica, "join", "no-such-group"));
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }
}
