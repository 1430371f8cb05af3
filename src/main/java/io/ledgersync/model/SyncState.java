package io.ledgersync.model;

public enum SyncState {
    IDLE,
    SENDING,
    AWAITING_REMOTE,
    APPLYING,
    ERROR
}
