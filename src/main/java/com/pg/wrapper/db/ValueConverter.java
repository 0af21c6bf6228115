package com.pg.wrapper.db;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Date;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.UUID;

/**
 * Converts raw JDBC column values into the Java type a caller asks for.
 */
final class ValueConverter {

    private ValueConverter() {
    }

    private static final Map<Class<?>, Class<?>> PRIMITIVE_WRAPPERS = Map.of(
            int.class, Integer.class,
            long.class, Long.class,
            short.class, Short.class,
            double.class, Double.class,
            float.class, Float.class,
            boolean.class, Boolean.class
    );

    @SuppressWarnings("unchecked")
    static <T> T convert(Object value, Class<T> type) {
        Class<?> target = PRIMITIVE_WRAPPERS.getOrDefault(type, type);
        if (target.isInstance(value)) {
            return (T) value;
        }
        Object converted = doConvert(value, target);
        if (converted == null) {
            throw new DatabaseException("Cannot convert value of type " + value.getClass().getName()
                    + " to " + type.getName());
        }
        return (T) converted;
    }

    private static Object doConvert(Object value, Class<?> type) {
        if (type == String.class) {
            return value.toString();
        }
        if (value instanceof Number) {
            try {
                return fromNumber((Number) value, type);
            } catch (ArithmeticException e) {
                throw new DatabaseException("Value " + value + " does not fit in " + type.getSimpleName(), e);
            }
        }
        if (value instanceof String) {
            return fromString((String) value, type);
        }
        if (value instanceof Boolean) {
            boolean b = (Boolean) value;
            if (type == Integer.class) return b ? 1 : 0;
            if (type == Long.class) return b ? 1L : 0L;
            return null;
        }
        if (value instanceof Timestamp) {
            Timestamp ts = (Timestamp) value;
            if (type == LocalDateTime.class) return ts.toLocalDateTime();
            if (type == Instant.class) return ts.toInstant();
            if (type == LocalDate.class) return ts.toLocalDateTime().toLocalDate();
            if (type == OffsetDateTime.class) return ts.toInstant().atOffset(ZoneOffset.UTC);
            return null;
        }
        if (value instanceof Date) {
            if (type == LocalDate.class) return ((Date) value).toLocalDate();
            return null;
        }
        if (value instanceof Time) {
            if (type == LocalTime.class) return ((Time) value).toLocalTime();
            return null;
        }
        if (value instanceof OffsetDateTime) {
            OffsetDateTime odt = (OffsetDateTime) value;
            if (type == Instant.class) return odt.toInstant();
            if (type == LocalDateTime.class) return odt.toLocalDateTime();
            return null;
        }
        return null;
    }

    private static Object fromNumber(Number n, Class<?> type) {
        if (type == Double.class) return n.doubleValue();
        if (type == Float.class) return n.floatValue();
        if (type == Integer.class) return exact(n).intValueExact();
        if (type == Long.class) return exact(n).longValueExact();
        if (type == Short.class) return exact(n).shortValueExact();
        if (type == BigDecimal.class) return exact(n);
        if (type == BigInteger.class) return exact(n).toBigIntegerExact();
        if (type == Boolean.class) return exact(n).signum() != 0;
        return null;
    }

    private static BigDecimal exact(Number n) {
        if (n instanceof BigDecimal) return (BigDecimal) n;
        if (n instanceof BigInteger) return new BigDecimal((BigInteger) n);
        try {
            return new BigDecimal(n.toString());
        } catch (NumberFormatException e) {
            throw new DatabaseException("Value " + n + " is not a finite number", e);
        }
    }

    private static Object fromString(String s, Class<?> type) {
        try {
            if (type == Integer.class) return Integer.valueOf(s.trim());
            if (type == Long.class) return Long.valueOf(s.trim());
            if (type == Short.class) return Short.valueOf(s.trim());
            if (type == Double.class) return Double.valueOf(s.trim());
            if (type == Float.class) return Float.valueOf(s.trim());
            if (type == BigDecimal.class) return new BigDecimal(s.trim());
            if (type == BigInteger.class) return new BigInteger(s.trim());
            if (type == UUID.class) return UUID.fromString(s.trim());
            if (type == LocalDate.class) return LocalDate.parse(s.trim());
        } catch (RuntimeException e) {
            throw new DatabaseException("Cannot convert '" + s + "' to " + type.getSimpleName(), e);
        }
        if (type == Boolean.class) {
            return parseBoolean(s);
        }
        return null;
    }

    private static Boolean parseBoolean(String s) {
        switch (s.trim().toLowerCase()) {
            case "t":
            case "true":
            case "y":
            case "yes":
            case "on":
            case "1":
                return Boolean.TRUE;
            case "f":
            case "false":
            case "n":
            case "no":
            case "off":
            case "0":
                return Boolean.FALSE;
            default:
                throw new DatabaseException("Cannot convert '" + s + "' to Boolean");
        }
    }
}
