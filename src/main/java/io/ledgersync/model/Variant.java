package io.ledgersync.model;

import java.util.Objects;

/**
 * Value carried by a change record: null, boolean, 64-bit integer, double or string.
 */
public record Variant(Kind kind, Object value) {
    private static final Variant NULL = new Variant(Kind.NULL, null);
    private static final Variant TRUE = new Variant(Kind.BOOLEAN, Boolean.TRUE);
    private static final Variant FALSE = new Variant(Kind.BOOLEAN, Boolean.FALSE);

    public enum Kind {
        NULL,
        BOOLEAN,
        INTEGER,
        REAL,
        STRING
    }

    public Variant {
        Objects.requireNonNull(kind, "kind");
        boolean valid = switch (kind) {
            case NULL -> value == null;
            case BOOLEAN -> value instanceof Boolean;
            case INTEGER -> value instanceof Long;
            case REAL -> value instanceof Double;
            case STRING -> value instanceof String;
        };
        if (!valid) {
            throw new IllegalArgumentException("Value " + value + " does not match kind " + kind);
        }
    }

    public static Variant ofNull() {
        return NULL;
    }

    public static Variant of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static Variant of(long value) {
        return new Variant(Kind.INTEGER, value);
    }

    public static Variant of(double value) {
        return new Variant(Kind.REAL, value);
    }

    public static Variant of(String value) {
        return value == null ? NULL : new Variant(Kind.STRING, value);
    }

    /**
     * Wraps a plain Java value. Integral boxed types widen to {@link Kind#INTEGER}, floats to
     * {@link Kind#REAL}.
     */
    public static Variant from(Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof Variant v) {
            return v;
        }
        if (value instanceof Boolean b) {
            return of(b.booleanValue());
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return of(((Number) value).longValue());
        }
        if (value instanceof Double || value instanceof Float) {
            return of(((Number) value).doubleValue());
        }
        if (value instanceof CharSequence s) {
            return of(s.toString());
        }
        throw new IllegalArgumentException("Unsupported variant value type: " + value.getClass().getName());
    }

    /**
     * Inverse of {@link #asText()} for a known kind.
     */
    public static Variant parse(Kind kind, String text) {
        if (kind == Kind.NULL || text == null) {
            return NULL;
        }
        return switch (kind) {
            case NULL -> NULL;
            case BOOLEAN -> of(Boolean.parseBoolean(text));
            case INTEGER -> of(Long.parseLong(text));
            case REAL -> of(Double.parseDouble(text));
            case STRING -> of(text);
        };
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    public Long asLong() {
        return switch (kind) {
            case NULL -> null;
            case BOOLEAN -> ((Boolean) value) ? 1L : 0L;
            case INTEGER -> (Long) value;
            case REAL -> (long) ((Double) value).doubleValue();
            case STRING -> Long.parseLong((String) value);
        };
    }

    public String asText() {
        return value == null ? null : String.valueOf(value);
    }

    @Override
    public String toString() {
        return kind + ":" + value;
    }
}
