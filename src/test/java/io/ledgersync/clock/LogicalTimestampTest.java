package io.ledgersync.clock;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

final class LogicalTimestampTest {
    private static final String CLIENT_A = "ABCDEF0123456789";
    private static final String CLIENT_B = "BBCDEF0123456789";

    @Test
    void formatsFixedWidthString() {
        LogicalTimestamp ts = new LogicalTimestamp(1_700_000_000_000L, 0x1A, "abcdef0123456789");
        Assertions.assertEquals("001700000000000-001A-ABCDEF0123456789", ts.toString());
        Assertions.assertEquals(ts, LogicalTimestamp.parse(ts.toString()));
    }

    @Test
    void stringOrderMatchesTotalOrder() {
        List<LogicalTimestamp> values = new ArrayList<>(List.of(
                new LogicalTimestamp(5L, 0, CLIENT_B),
                new LogicalTimestamp(5L, 0, CLIENT_A),
                new LogicalTimestamp(5L, 0xFFFF, CLIENT_A),
                new LogicalTimestamp(1_000_000L, 0, CLIENT_A),
                new LogicalTimestamp(4L, 2, CLIENT_B)
        ));
        List<LogicalTimestamp> byValue = new ArrayList<>(values);
        Collections.sort(byValue);
        List<String> byString = new ArrayList<>();
        for (LogicalTimestamp ts : values) {
            byString.add(ts.toString());
        }
        Collections.sort(byString);
        for (int i = 0; i < byValue.size(); i++) {
            Assertions.assertEquals(byValue.get(i).toString(), byString.get(i));
        }
        Assertions.assertEquals(new LogicalTimestamp(4L, 2, CLIENT_B), byValue.get(0));
        Assertions.assertEquals(new LogicalTimestamp(1_000_000L, 0, CLIENT_A), byValue.get(byValue.size() - 1));
    }

    @Test
    void equalOnlyForIdenticalTriples() {
        LogicalTimestamp a = new LogicalTimestamp(10L, 1, CLIENT_A);
        Assertions.assertEquals(0, a.compareTo(new LogicalTimestamp(10L, 1, CLIENT_A.toLowerCase())));
        Assertions.assertTrue(a.compareTo(new LogicalTimestamp(10L, 1, CLIENT_B)) < 0);
        Assertions.assertTrue(a.isAfter(new LogicalTimestamp(10L, 0, CLIENT_B)));
        Assertions.assertFalse(a.isAfter(a));
    }

    @Test
    void rejectsMalformedInput() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> LogicalTimestamp.parse("garbage"));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> LogicalTimestamp.parse("1700000000000-001A-ABCDEF0123456789"));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> LogicalTimestamp.parse("001700000000000-00ZZ-ABCDEF0123456789"));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> LogicalTimestamp.parse("001700000000000-001A-NOTHEXNOTHEX0000"));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new LogicalTimestamp(1L, 0x10000, CLIENT_A));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new LogicalTimestamp(-1L, 0, CLIENT_A));
    }

    @Test
    void randomClientIdsAreUpperHex() {
        String id = LogicalTimestamp.randomClientId();
        Assertions.assertEquals(LogicalTimestamp.CLIENT_ID_LENGTH, id.length());
        Assertions.assertTrue(id.matches("[0-9A-F]{16}"), id);
        Assertions.assertNotEquals(id, LogicalTimestamp.randomClientId());
    }
}
