package io.ledgersync.clock;

import java.security.SecureRandom;
import java.util.Comparator;
import java.util.Locale;

/**
 * Hybrid logical timestamp: wall millis, a logical counter and the issuing client id.
 *
 * <p>The string form {@code <millis:15 digits>-<counter:4 hex>-<clientId>} sorts in the same order
 * as {@link #compareTo(LogicalTimestamp)}.
 */
public record LogicalTimestamp(long millis, int counter, String clientId) implements Comparable<LogicalTimestamp> {
    public static final int MAX_COUNTER = 0xFFFF;
    public static final long MAX_MILLIS = 999_999_999_999_999L;
    public static final int CLIENT_ID_LENGTH = 16;

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();
    private static final Comparator<LogicalTimestamp> ORDER = Comparator
            .comparingLong(LogicalTimestamp::millis)
            .thenComparingInt(LogicalTimestamp::counter)
            .thenComparing(LogicalTimestamp::clientId);

    public LogicalTimestamp {
        if (millis < 0L || millis > MAX_MILLIS) {
            throw new IllegalArgumentException("millis out of range: " + millis);
        }
        if (counter < 0 || counter > MAX_COUNTER) {
            throw new IllegalArgumentException("counter out of range: " + counter);
        }
        clientId = normalizeClientId(clientId);
    }

    public static LogicalTimestamp zero(String clientId) {
        return new LogicalTimestamp(0L, 0, clientId);
    }

    public static String randomClientId() {
        byte[] raw = new byte[CLIENT_ID_LENGTH / 2];
        RANDOM.nextBytes(raw);
        StringBuilder sb = new StringBuilder(CLIENT_ID_LENGTH);
        for (byte b : raw) {
            sb.append(HEX[(b >> 4) & 0x0F]).append(HEX[b & 0x0F]);
        }
        return sb.toString();
    }

    public static LogicalTimestamp parse(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("timestamp must not be null");
        }
        String value = raw.trim();
        int first = value.indexOf('-');
        int second = first < 0 ? -1 : value.indexOf('-', first + 1);
        if (first != 15 || second != 20 || value.length() != 21 + CLIENT_ID_LENGTH) {
            throw new IllegalArgumentException("Malformed logical timestamp: " + raw);
        }
        try {
            long millis = Long.parseLong(value.substring(0, first));
            int counter = Integer.parseInt(value.substring(first + 1, second), 16);
            return new LogicalTimestamp(millis, counter, value.substring(second + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed logical timestamp: " + raw, e);
        }
    }

    public static LogicalTimestamp max(LogicalTimestamp a, LogicalTimestamp b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.compareTo(b) >= 0 ? a : b;
    }

    public boolean isAfter(LogicalTimestamp other) {
        return other == null || compareTo(other) > 0;
    }

    @Override
    public int compareTo(LogicalTimestamp other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%015d-%04X-%s", millis, counter, clientId);
    }

    private static String normalizeClientId(String raw) {
        if (raw == null || raw.length() != CLIENT_ID_LENGTH) {
            throw new IllegalArgumentException("clientId must be " + CLIENT_ID_LENGTH + " hex chars: " + raw);
        }
        String upper = raw.toUpperCase(Locale.ROOT);
        for (int i = 0; i < upper.length(); i++) {
            char ch = upper.charAt(i);
            boolean hex = (ch >= '0' && ch <= '9') || (ch >= 'A' && ch <= 'F');
            if (!hex) {
                throw new IllegalArgumentException("clientId must be hex: " + raw);
            }
        }
        return upper;
    }
}
