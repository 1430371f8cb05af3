package io.ledgersync.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record EntityRow(String dataset, String id, Map<String, Object> attributes) {
    public EntityRow {
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public Object get(String column) {
        return attributes.get(column);
    }

    public String text(String column) {
        Object value = attributes.get(column);
        return value == null ? null : String.valueOf(value);
    }

    public long longValue(String column, long fallback) {
        Object value = attributes.get(column);
        if (value instanceof Number n) {
            return n.longValue();
        }
        if (value instanceof Boolean b) {
            return b ? 1L : 0L;
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException ignored) {
                return fallback;
            }
        }
        return fallback;
    }

    public boolean flag(String column) {
        return longValue(column, 0L) != 0L;
    }
}
