package io.ledgersync.sync;

import io.ledgersync.clock.LogicalTimestamp;
import io.ledgersync.model.RelayPayload;
import io.ledgersync.model.SendAck;

import java.util.Collection;
import java.util.List;

/**
 * Connection to the change-set relay of a sync group. Implementations throw
 * {@link TransportException} on failure and never retry.
 */
public interface RelayTransport {
    SendAck sendChangeSet(String groupId, String keyId, RelayPayload payload);

    /**
     * Change sets of other clients in the group that {@code clientId} has not acknowledged.
     * {@code since} is the highest timestamp the client has applied; a relay may use it to skip
     * older payloads it knows were delivered.
     */
    List<RelayPayload> fetchBacklog(String groupId, String clientId, LogicalTimestamp since);

    void acknowledge(String groupId, String clientId, Collection<String> payloadIds);
}
