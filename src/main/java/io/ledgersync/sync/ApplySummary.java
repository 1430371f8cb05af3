package io.ledgersync.sync;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @param preferences {@code prefs} values to publish with the batch
 */
public record ApplySummary(
        int applied,
        int skippedStale,
        int groupsWritten,
        int prefsPatched,
        Map<String, Object> preferences
) {
    public ApplySummary {
        preferences = preferences == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(preferences));
    }

    public static ApplySummary empty() {
        return new ApplySummary(0, 0, 0, 0, Map.of());
    }
}
