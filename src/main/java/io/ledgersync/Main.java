package io.ledgersync;

import io.ledgersync.cli.LedgerSyncCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new LedgerSyncCommand()).execute(args);
        System.exit(code);
    }
}
