/**
 * Replica orchestration.
 *
 * <p>{@link io.ledgersync.runtime.LedgerSyncRuntime} wires the local store, metadata, relay and
 * sync session for one replica directory and is the API the CLI calls.
 */
package io.ledgersync.runtime;
