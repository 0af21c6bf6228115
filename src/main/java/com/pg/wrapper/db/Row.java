package com.pg.wrapper.db;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A single row of a {@link Result}. Values are addressed by zero-based column index or by column name.
 */
public final class Row {

    private final List<String> columnNames;
    private final Map<String, Integer> columnIndex;
    private final Object[] values;

    Row(List<String> columnNames, Map<String, Integer> columnIndex, Object[] values) {
        this.columnNames = columnNames;
        this.columnIndex = columnIndex;
        this.values = values;
    }

    /**
     * Returns the value at {@code col} converted to {@code type}.
     *
     * @throws IndexOutOfBoundsException if the column index is out of range
     * @throws DatabaseException         if the value is NULL or cannot be converted
     */
    public <T> T get(int col, Class<T> type) {
        checkIndex(col);
        Object value = values[col];
        if (value == null) {
            throw new DatabaseException("Column '" + columnNames.get(col) + "' is NULL");
        }
        return ValueConverter.convert(value, type);
    }

    public <T> T get(String columnName, Class<T> type) {
        return get(indexOf(columnName), type);
    }

    /**
     * Like {@link #get(int, Class)} but maps NULL to {@link Optional#empty()}.
     */
    public <T> Optional<T> getOptional(int col, Class<T> type) {
        checkIndex(col);
        Object value = values[col];
        return value == null ? Optional.empty() : Optional.of(ValueConverter.convert(value, type));
    }

    public <T> Optional<T> getOptional(String columnName, Class<T> type) {
        return getOptional(indexOf(columnName), type);
    }

    /**
     * Raw driver value, possibly null.
     */
    public Object getObject(int col) {
        checkIndex(col);
        return values[col];
    }

    /**
     * Returns true if the column holds NULL. An out-of-range index is reported as not NULL.
     */
    public boolean isNull(int col) {
        return col >= 0 && col < values.length && values[col] == null;
    }

    /**
     * @throws IllegalArgumentException if the row has no such column
     */
    public boolean isNull(String columnName) {
        return values[indexOf(columnName)] == null;
    }

    public int size() {
        return values.length;
    }

    public String columnName(int col) {
        checkIndex(col);
        return columnNames.get(col);
    }

    private int indexOf(String columnName) {
        Integer idx = columnIndex.get(columnName);
        if (idx == null) {
            throw new IllegalArgumentException("Unknown column: '" + columnName + "'");
        }
        return idx;
    }

    private void checkIndex(int col) {
        if (col < 0 || col >= values.length) {
            throw new IndexOutOfBoundsException("Column index out of range: " + col + " (size " + values.length + ")");
        }
    }

    @Override
    public String toString() {
        return "Row" + Arrays.toString(values);
    }
}
