package io.ledgersync.model;

public record SendAck(String payloadId, long acceptedAtMs) {
}
