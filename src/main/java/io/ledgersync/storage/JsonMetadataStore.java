package io.ledgersync.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import io.ledgersync.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code metadata.json} backed {@link MetadataStore}. Writes go to a temp file and are moved into
 * place.
 */
public final class JsonMetadataStore implements MetadataStore {
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final Path file;

    public JsonMetadataStore(Path file) {
        this.file = file;
    }

    @Override
    public synchronized Map<String, Object> get() {
        if (!Files.isRegularFile(file)) {
            return new LinkedHashMap<>();
        }
        try {
            String raw = Files.readString(file, StandardCharsets.UTF_8);
            if (raw.isBlank()) {
                return new LinkedHashMap<>();
            }
            return Jsons.mapper().readValue(raw, MAP_TYPE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read metadata: " + file, e);
        }
    }

    @Override
    public synchronized void patch(Map<String, Object> patch) {
        if (patch == null || patch.isEmpty()) {
            return;
        }
        Map<String, Object> merged = get();
        merged.putAll(patch);
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            Files.writeString(tmp, Jsons.toCompactJson(merged), StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write metadata: " + file, e);
        }
    }
}
