package com.pg.wrapper.db;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Date;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ResultTest {

    private static Result result(List<String> names, Object[]... rows) {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < names.size(); i++) {
            index.putIfAbsent(names.get(i), i);
        }
        List<Row> list = new ArrayList<>();
        for (Object[] values : rows) {
            list.add(new Row(names, index, values));
        }
        return new Result(names, list, list.size());
    }

    private static Row row(Object... values) {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            names.add("c" + i);
        }
        return result(names, values).front();
    }

    // ========== Result ==========

    @Test
    @DisplayName("Should expose rows and columns")
    void testShape() {
        Result result = result(List.of("id", "name"),
                new Object[]{1, "ann"},
                new Object[]{2, "bob"});

        assertEquals(2, result.size());
        assertFalse(result.isEmpty());
        assertEquals(2, result.columns());
        assertEquals("name", result.columnName(1));
        assertEquals(2, result.affectedRows());
        assertEquals("bob", result.get(1).get("name", String.class));
    }

    @Test
    @DisplayName("front() on an empty result should fail")
    void testFrontOnEmpty() {
        Result empty = result(List.of("id"));

        assertTrue(empty.isEmpty());
        assertThrows(NoSuchElementException.class, empty::front);
        assertEquals(Optional.empty(), empty.frontOptional());
    }

    @Test
    @DisplayName("Out-of-range row and column indexes should fail")
    void testIndexBounds() {
        Result result = result(List.of("id"), new Object[]{1});

        assertThrows(IndexOutOfBoundsException.class, () -> result.get(1));
        assertThrows(IndexOutOfBoundsException.class, () -> result.get(-1));
        assertThrows(IndexOutOfBoundsException.class, () -> result.columnName(3));
    }

    @Test
    @DisplayName("Should map, stream and iterate rows")
    void testTraversal() {
        Result result = result(List.of("n"), new Object[]{1}, new Object[]{2}, new Object[]{3});

        assertEquals(List.of(1L, 2L, 3L), result.toList(r -> r.get(0, Long.class)));
        assertEquals(6, result.stream().mapToInt(r -> r.get(0, Integer.class)).sum());
        int count = 0;
        for (Row ignored : result) {
            count++;
        }
        assertEquals(3, count);
    }

    @Test
    @DisplayName("Duplicate column labels should resolve to the first occurrence")
    void testDuplicateLabels() {
        Result result = result(List.of("id", "id"), new Object[]{1, 2});

        assertEquals(1, result.front().get("id", Integer.class));
        assertEquals(2, result.front().get(1, Integer.class));
    }

    @Test
    @DisplayName("Rows should be read-only")
    void testImmutable() {
        Result result = result(List.of("id"), new Object[]{1});

        Iterator<Row> it = result.iterator();
        it.next();
        assertThrows(UnsupportedOperationException.class, it::remove);
    }

    // ========== Row ==========

    @Nested
    @DisplayName("Row access")
    class RowAccess {

        @Test
        @DisplayName("NULL should fail get() and be empty for getOptional()")
        void testNullHandling() {
            Row row = row(1, null);

            assertThrows(DatabaseException.class, () -> row.get(1, String.class));
            assertEquals(Optional.empty(), row.getOptional(1, String.class));
            assertEquals(Optional.empty(), row.getOptional("c1", String.class));
            assertTrue(row.isNull(1));
            assertTrue(row.isNull("c1"));
            assertFalse(row.isNull(0));
            assertNull(row.getObject(1));
        }

        @Test
        @DisplayName("isNull() with an out-of-range index should be false")
        void testIsNullOutOfRange() {
            Row row = row((Object) null);

            assertFalse(row.isNull(5));
            assertFalse(row.isNull(-1));
        }

        @Test
        @DisplayName("Unknown column names should fail")
        void testUnknownColumn() {
            Row row = row(1);

            assertThrows(IllegalArgumentException.class, () -> row.get("missing", Integer.class));
            assertThrows(IllegalArgumentException.class, () -> row.isNull("missing"));
        }

        @Test
        @DisplayName("Out-of-range column index should fail get()")
        void testGetOutOfRange() {
            Row row = row(1);

            assertThrows(IndexOutOfBoundsException.class, () -> row.get(1, Integer.class));
            assertThrows(IndexOutOfBoundsException.class, () -> row.getObject(-1));
        }

        @Test
        @DisplayName("Should report size and names")
        void testMetadata() {
            Row row = row(1, "x");

            assertEquals(2, row.size());
            assertEquals("c1", row.columnName(1));
        }
    }

    @Nested
    @DisplayName("Value conversion")
    class Conversion {

        @Test
        @DisplayName("Should widen and narrow numbers")
        void testNumbers() {
            Row row = row(42, 7L, new BigDecimal("12.50"));

            assertEquals(42L, row.get(0, Long.class));
            assertEquals(7, row.get(1, Integer.class));
            assertEquals(7, row.get(1, int.class));
            assertEquals(42.0, row.get(0, Double.class));
            assertEquals(new BigDecimal("12.50"), row.get(2, BigDecimal.class));
            assertEquals("42", row.get(0, String.class));
        }

        @Test
        @DisplayName("Should fail when a number does not fit")
        void testOverflow() {
            Row row = row(Long.MAX_VALUE);

            assertThrows(DatabaseException.class, () -> row.get(0, Integer.class));
        }

        @Test
        @DisplayName("Should fail when narrowing to short overflows")
        void testShortOverflow() {
            Row row = row(70000, 1200);

            assertThrows(DatabaseException.class, () -> row.get(0, Short.class));
            assertEquals((short) 1200, row.get(1, Short.class));
        }

        @Test
        @DisplayName("Should fail when an integral read would drop a fraction")
        void testFractionNotTruncated() {
            Row row = row(new BigDecimal("3.7"), 3.7d, new BigDecimal("4.00"), Double.NaN);

            assertThrows(DatabaseException.class, () -> row.get(0, Integer.class));
            assertThrows(DatabaseException.class, () -> row.get(1, Long.class));
            assertThrows(DatabaseException.class, () -> row.get(1, BigInteger.class));
            assertEquals(4, row.get(2, Integer.class));
            assertThrows(DatabaseException.class, () -> row.get(3, Long.class));
        }

        @Test
        @DisplayName("Should parse text into numbers and UUIDs")
        void testFromText() {
            UUID id = UUID.randomUUID();
            Row row = row("123", id.toString(), "2024-02-29");

            assertEquals(123, row.get(0, Integer.class));
            assertEquals(id, row.get(1, UUID.class));
            assertEquals(LocalDate.of(2024, 2, 29), row.get(2, LocalDate.class));
        }

        @Test
        @DisplayName("Should reject unparseable text")
        void testBadText() {
            Row row = row("abc");

            assertThrows(DatabaseException.class, () -> row.get(0, Integer.class));
        }

        @Test
        @DisplayName("Should read PostgreSQL boolean spellings")
        void testBooleans() {
            Row row = row("t", "no", true, 0);

            assertTrue(row.get(0, Boolean.class));
            assertFalse(row.get(1, Boolean.class));
            assertTrue(row.get(2, boolean.class));
            assertEquals(1, row.get(2, Integer.class));
            assertFalse(row.get(3, Boolean.class));
            assertThrows(DatabaseException.class, () -> row("maybe").get(0, Boolean.class));
        }

        @Test
        @DisplayName("Should convert JDBC temporal values")
        void testTemporal() {
            LocalDateTime at = LocalDateTime.of(2024, 5, 1, 12, 30);
            Row row = row(Timestamp.valueOf(at), Date.valueOf(LocalDate.of(2024, 5, 1)));

            assertEquals(at, row.get(0, LocalDateTime.class));
            assertEquals(LocalDate.of(2024, 5, 1), row.get(0, LocalDate.class));
            assertEquals(LocalDate.of(2024, 5, 1), row.get(1, LocalDate.class));
        }

        @Test
        @DisplayName("Should fail for unsupported conversions")
        void testUnsupported() {
            Row row = row(Date.valueOf(LocalDate.of(2024, 5, 1)));

            assertThrows(DatabaseException.class, () -> row.get(0, UUID.class));
        }
    }
}
