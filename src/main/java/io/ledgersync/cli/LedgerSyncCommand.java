package io.ledgersync.cli;

import io.ledgersync.config.LedgerSyncConfig;
import io.ledgersync.model.ChangeRecord;
import io.ledgersync.model.EntityRow;
import io.ledgersync.model.Variant;
import io.ledgersync.runtime.LedgerSyncRuntime;
import io.ledgersync.storage.Database;
import io.ledgersync.sync.SyncOutcome;
import io.ledgersync.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "ledgersync",
        mixinStandardHelpOptions = true,
        description = "LedgerSync replica CLI",
        subcommands = {
                LedgerSyncCommand.InitCommand.class,
                LedgerSyncCommand.RegisterCommand.class,
                LedgerSyncCommand.JoinCommand.class,
                LedgerSyncCommand.SetCommand.class,
                LedgerSyncCommand.GetCommand.class,
                LedgerSyncCommand.SyncCommand.class,
                LedgerSyncCommand.StatusCommand.class,
                LedgerSyncCommand.EncryptCommand.class,
                LedgerSyncCommand.CleanupCommand.class,
                LedgerSyncCommand.AuditTailCommand.class,
                LedgerSyncCommand.SchemaMigrationsCommand.class
        }
)
public final class LedgerSyncCommand implements Runnable {
    @Option(names = {"--root"}, description = "Replica data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--relay"}, description = "Relay directory shared by the replicas of a group")
    String relay;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | register | join | set | get | sync | status | encrypt | cleanup | audit-tail | schema-migrations");
    }

    LedgerSyncConfig config() {
        return LedgerSyncConfig.fromRoot(root, relay);
    }

    LedgerSyncRuntime runtime() {
        return new LedgerSyncRuntime(config());
    }

    static Variant parseValue(String raw, String type) {
        String kind = type == null ? "string" : type.trim().toLowerCase(Locale.ROOT);
        return switch (kind) {
            case "string", "text" -> Variant.of(raw);
            case "integer", "int", "long" -> Variant.of(Long.parseLong(raw.trim()));
            case "real", "double" -> Variant.of(Double.parseDouble(raw.trim()));
            case "boolean", "bool" -> {
                String value = raw.trim().toLowerCase(Locale.ROOT);
                if (!value.equals("true") && !value.equals("false") && !value.equals("1") && !value.equals("0")) {
                    throw new IllegalArgumentException("Not a boolean: " + raw);
                }
                yield Variant.of(value.equals("true") || value.equals("1"));
            }
            case "null" -> Variant.ofNull();
            default -> throw new IllegalArgumentException("Unknown value type: " + type);
        };
    }

    @Command(name = "init", description = "Initialize the replica directory and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        LedgerSyncCommand parent;

        @Option(names = {"--name"}, description = "Budget name stored in metadata")
        String name;

        @Override
        public Integer call() {
            LedgerSyncRuntime runtime = parent.runtime();
            System.out.println(Jsons.toJson(runtime.init(name)));
            return 0;
        }
    }

    @Command(name = "register", description = "Create a sync group on the relay and join it")
    static final class RegisterCommand implements Callable<Integer> {
        @ParentCommand
        LedgerSyncCommand parent;

        @Override
        public Integer call() {
            LedgerSyncRuntime runtime = parent.runtime();
            String groupId = runtime.registerGroup();
            System.out.println(Jsons.toJson(Map.of("groupId", groupId, "clientId", runtime.clientId())));
            return 0;
        }
    }

    @Command(name = "join", description = "Join an existing sync group")
    static final class JoinCommand implements Callable<Integer> {
        @ParentCommand
        LedgerSyncCommand parent;

        @Parameters(index = "0", description = "Group id")
        String groupId;

        @Override
        public Integer call() {
            LedgerSyncRuntime runtime = parent.runtime();
            runtime.joinGroup(groupId);
            System.out.println(Jsons.toJson(Map.of("groupId", groupId, "clientId", runtime.clientId())));
            return 0;
        }
    }

    @Command(name = "set", description = "Write one cell and commit it")
    static final class SetCommand implements Callable<Integer> {
        @ParentCommand
        LedgerSyncCommand parent;

        @Parameters(index = "0", description = "Dataset, e.g. accounts")
        String dataset;

        @Parameters(index = "1", description = "Row id")
        String row;

        @Parameters(index = "2", description = "Column name")
        String column;

        @Parameters(index = "3", description = "Value")
        String value;

        @Option(names = {"--type"}, defaultValue = "string", description = "Value type: string|integer|real|boolean|null")
        String type;

        @Option(names = {"--password"}, description = "Unlock an encrypted replica before committing")
        String password;

        @Override
        public Integer call() {
            LedgerSyncRuntime runtime = parent.runtime();
            if (password != null) {
                runtime.unlock(password);
            }
            List<ChangeRecord> records = runtime.set(dataset, row, column, parseValue(value, type));
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("records", records.size());
            out.put("timestamp", records.isEmpty() ? null : records.get(records.size() - 1).timestamp().toString());
            out.put("pendingOutgoing", runtime.status().pendingOutgoing());
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "get", description = "Print one row")
    static final class GetCommand implements Callable<Integer> {
        @ParentCommand
        LedgerSyncCommand parent;

        @Parameters(index = "0", description = "Dataset")
        String dataset;

        @Parameters(index = "1", description = "Row id")
        String row;

        @Override
        public Integer call() {
            LedgerSyncRuntime runtime = parent.runtime();
            Optional<EntityRow> found = runtime.get(dataset, row);
            if (found.isEmpty()) {
                System.out.println("Row not found: " + dataset + "/" + row);
                return 1;
            }
            System.out.println(Jsons.toJson(found.get()));
            return 0;
        }
    }

    @Command(name = "sync", description = "Send queued changes and apply the remote backlog")
    static final class SyncCommand implements Callable<Integer> {
        @ParentCommand
        LedgerSyncCommand parent;

        @Option(names = {"--password"}, description = "Unlock an encrypted replica first")
        String password;

        @Override
        public Integer call() {
            LedgerSyncRuntime runtime = parent.runtime();
            if (password != null) {
                runtime.unlock(password);
            }
            SyncOutcome outcome = runtime.sync();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("cancelled", outcome.cancelled());
            out.put("sentRecords", outcome.sent().records());
            out.put("payloadsReceived", outcome.payloadsReceived());
            out.put("recordsApplied", outcome.recordsApplied());
            out.put("skippedStale", outcome.applied().skippedStale());
            out.put("lastTimestamp", outcome.clock().lastTimestamp().toString());
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "status", description = "Show replica identity, clock and sync state")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        LedgerSyncCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().status()));
            return 0;
        }
    }

    @Command(name = "encrypt", description = "Enable end-to-end encryption for the sync group")
    static final class EncryptCommand implements Callable<Integer> {
        @ParentCommand
        LedgerSyncCommand parent;

        @Option(names = {"--password"}, required = true, interactive = true, arity = "0..1",
                description = "Encryption password")
        String password;

        @Override
        public Integer call() {
            LedgerSyncRuntime runtime = parent.runtime();
            String keyId = runtime.enableEncryption(password);
            System.out.println(Jsons.toJson(Map.of("groupId", runtime.groupId(), "encryptKeyId", keyId)));
            return 0;
        }
    }

    @Command(name = "cleanup", description = "Physically delete tombstoned rows")
    static final class CleanupCommand implements Callable<Integer> {
        @ParentCommand
        LedgerSyncCommand parent;

        @Override
        public Integer call() {
            int removed = parent.runtime().cleanup();
            System.out.println(Jsons.toJson(Map.of("removed", removed)));
            return 0;
        }
    }

    @Command(name = "audit-tail", description = "Print the latest audit log rows")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        LedgerSyncCommand parent;

        @Option(names = {"--lines"}, defaultValue = "50", description = "Number of latest lines")
        int lines;

        @Override
        public Integer call() {
            LedgerSyncRuntime runtime = parent.runtime();
            for (var row : runtime.auditLogger().tail(lines)) {
                System.out.println(Jsons.toCompactJson(row));
            }
            return 0;
        }
    }

    @Command(name = "schema-migrations", description = "List applied schema migrations")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        LedgerSyncCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows to print")
        int limit;

        @Override
        public Integer call() {
            Database database = new Database(parent.config());
            database.init();
            System.out.println(Jsons.toJson(database.listSchemaMigrations(limit)));
            return 0;
        }
    }
}
