/**
 * LedgerSync source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.ledgersync.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.ledgersync.cli.LedgerSyncCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.ledgersync.sync.SyncSession} runs send/receive/apply rounds against the relay.</li>
 *   <li>{@code io.ledgersync.storage.SqliteLedgerStore} is the local replica store.</li>
 * </ul>
 */
package io.ledgersync;
