package io.ledgersync.storage;

import java.util.Map;

/**
 * Flat key/value document kept next to the ledger database.
 */
public interface MetadataStore {
    Map<String, Object> get();

    /**
     * Merges {@code patch} into the document, overwriting existing keys.
     */
    void patch(Map<String, Object> patch);

    default String text(String key) {
        Object value = get().get(key);
        return value == null ? null : String.valueOf(value);
    }
}
