package io.ledgersync.relay;

import com.fasterxml.jackson.core.type.TypeReference;
import io.ledgersync.clock.LogicalTimestamp;
import io.ledgersync.model.RelayPayload;
import io.ledgersync.model.SendAck;
import io.ledgersync.security.EncryptedPayload;
import io.ledgersync.security.EncryptionMeta;
import io.ledgersync.sync.KeyRegistry;
import io.ledgersync.sync.RelayTransport;
import io.ledgersync.sync.TransportException;
import io.ledgersync.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Relay and key registry kept in a shared directory.
 *
 * <pre>
 * relay/groups/&lt;groupId&gt;/group.json
 * relay/groups/&lt;groupId&gt;/key.json
 * relay/groups/&lt;groupId&gt;/changesets/&lt;seq&gt;_&lt;id&gt;.json
 * relay/groups/&lt;groupId&gt;/acks/&lt;clientId&gt;.json
 * </pre>
 */
public final class FileRelay implements RelayTransport, KeyRegistry {
    private static final TypeReference<TreeSet<String>> ID_SET = new TypeReference<>() {
    };

    private final Path root;
    private final Clock clock;

    public FileRelay(Path root) {
        this(root, Clock.systemUTC());
    }

    public FileRelay(Path root, Clock clock) {
        this.root = root;
        this.clock = clock;
    }

    public synchronized String registerGroup() {
        String groupId = UUID.randomUUID().toString();
        Path dir = groupDir(groupId);
        try {
            Files.createDirectories(dir.resolve("changesets"));
            Files.createDirectories(dir.resolve("acks"));
            writeAtomically(dir.resolve("group.json"), Jsons.toJson(new GroupFile(groupId, clock.millis())));
        } catch (IOException e) {
            throw new TransportException("Failed to register sync group", e);
        }
        return groupId;
    }

    public boolean groupExists(String groupId) {
        return groupId != null && Files.isRegularFile(groupDir(groupId).resolve("group.json"));
    }

    @Override
    public synchronized SendAck sendChangeSet(String groupId, String keyId, RelayPayload payload) {
        requireGroup(groupId);
        if (payload == null || payload.value() == null || payload.timestamp() == null) {
            throw new TransportException("Change set payload is incomplete");
        }
        String senderId;
        try {
            senderId = LogicalTimestamp.parse(payload.timestamp()).clientId();
        } catch (IllegalArgumentException e) {
            throw new TransportException("Change set timestamp is malformed: " + payload.timestamp(), e);
        }
        String payloadId = UUID.randomUUID().toString();
        long acceptedAt = clock.millis();
        Path dir = groupDir(groupId).resolve("changesets");
        StoredChangeSet stored = new StoredChangeSet(
                payloadId, groupId, senderId, payload.timestamp(), keyId, payload.value(), payload.meta(), acceptedAt
        );
        byte[] json = Jsons.toCompactJson(stored).getBytes(StandardCharsets.UTF_8);
        try {
            Files.createDirectories(dir);
            // readers only list *.json, so the staged file stays invisible until the move
            Path staged = dir.resolve(payloadId + ".tmp");
            Files.write(staged, json, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            try {
                long seq = listChangeSets(dir).size() + 1L;
                while (hasSequence(dir, seq)) {
                    seq++;
                }
                Path file = dir.resolve(String.format(Locale.ROOT, "%012d_%s.json", seq, payloadId));
                Files.move(staged, file, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(staged);
            }
        } catch (IOException e) {
            throw new TransportException("Failed to store change set in group " + groupId, e);
        }
        return new SendAck(payloadId, acceptedAt);
    }

    @Override
    public synchronized List<RelayPayload> fetchBacklog(String groupId, String clientId, LogicalTimestamp since) {
        requireGroup(groupId);
        TreeSet<String> acked = readAcks(groupId, clientId);
        List<RelayPayload> out = new ArrayList<>();
        try {
            for (Path file : listChangeSets(groupDir(groupId).resolve("changesets"))) {
                StoredChangeSet stored = Jsons.mapper().readValue(file.toFile(), StoredChangeSet.class);
                if (stored.clientId().equalsIgnoreCase(clientId) || acked.contains(stored.id())) {
                    continue;
                }
                out.add(new RelayPayload(
                        stored.id(), stored.groupId(), stored.timestamp(), stored.keyId(), stored.value(), stored.meta()
                ));
            }
        } catch (IOException e) {
            throw new TransportException("Failed to read backlog of group " + groupId, e);
        }
        return out;
    }

    @Override
    public synchronized void acknowledge(String groupId, String clientId, Collection<String> payloadIds) {
        requireGroup(groupId);
        if (payloadIds == null || payloadIds.isEmpty()) {
            return;
        }
        TreeSet<String> acked = readAcks(groupId, clientId);
        acked.addAll(payloadIds);
        try {
            Path dir = groupDir(groupId).resolve("acks");
            Files.createDirectories(dir);
            writeAtomically(dir.resolve(clientFile(clientId)), Jsons.toCompactJson(acked));
        } catch (IOException e) {
            throw new TransportException("Failed to record acknowledgement for " + clientId, e);
        }
    }

    @Override
    public synchronized void createKey(String groupId, String keyId, byte[] salt, EncryptedPayload testContent) {
        requireGroup(groupId);
        if (keyId == null || keyId.isBlank() || salt == null || testContent == null) {
            throw new TransportException("Key registration is incomplete");
        }
        try {
            writeAtomically(groupDir(groupId).resolve("key.json"),
                    Jsons.toJson(new KeyFile(keyId, salt, testContent.value(), testContent.meta())));
        } catch (IOException e) {
            throw new TransportException("Failed to register key for group " + groupId, e);
        }
    }

    @Override
    public synchronized Optional<KeyInfo> getKey(String groupId) {
        requireGroup(groupId);
        Path file = groupDir(groupId).resolve("key.json");
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            KeyFile key = Jsons.mapper().readValue(file.toFile(), KeyFile.class);
            return Optional.of(new KeyInfo(key.keyId(), key.salt(), new EncryptedPayload(key.testValue(), key.testMeta())));
        } catch (IOException e) {
            throw new TransportException("Failed to read key of group " + groupId, e);
        }
    }

    private void requireGroup(String groupId) {
        if (!groupExists(groupId)) {
            throw new TransportException("Unknown sync group: " + groupId);
        }
    }

    private TreeSet<String> readAcks(String groupId, String clientId) {
        Path file = groupDir(groupId).resolve("acks").resolve(clientFile(clientId));
        if (!Files.isRegularFile(file)) {
            return new TreeSet<>();
        }
        try {
            return Jsons.mapper().readValue(file.toFile(), ID_SET);
        } catch (IOException e) {
            throw new TransportException("Failed to read acknowledgements of " + clientId, e);
        }
    }

    private Path groupDir(String groupId) {
        if (groupId.contains("/") || groupId.contains("\\") || groupId.contains("..")) {
            throw new TransportException("Invalid sync group id: " + groupId);
        }
        return root.resolve("groups").resolve(groupId);
    }

    private static String clientFile(String clientId) {
        return clientId.toUpperCase(Locale.ROOT) + ".json";
    }

    private static List<Path> listChangeSets(Path dir) throws IOException {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*.json")) {
            for (Path path : stream) {
                files.add(path);
            }
        }
        files.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return files;
    }

    private static boolean hasSequence(Path dir, long seq) throws IOException {
        String prefix = String.format(Locale.ROOT, "%012d_", seq);
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, prefix + "*.json")) {
            return stream.iterator().hasNext();
        }
    }

    private static void writeAtomically(Path target, String content) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.writeString(tmp, content, StandardCharsets.UTF_8);
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    record GroupFile(String groupId, long createdAtMs) {
    }

    record StoredChangeSet(
            String id,
            String groupId,
            String clientId,
            String timestamp,
            String keyId,
            byte[] value,
            EncryptionMeta meta,
            long acceptedAtMs
    ) {
    }

    record KeyFile(String keyId, byte[] salt, byte[] testValue, EncryptionMeta testMeta) {
    }
}
