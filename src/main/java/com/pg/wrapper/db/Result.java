package com.pg.wrapper.db;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Fully materialised outcome of a statement: column names, rows and the affected-row count.
 * A Result holds no driver resources and stays valid after its transaction ends.
 */
public final class Result implements Iterable<Row> {

    private final List<String> columnNames;
    private final List<Row> rows;
    private final long affectedRows;

    Result(List<String> columnNames, List<Row> rows, long affectedRows) {
        this.columnNames = Collections.unmodifiableList(columnNames);
        this.rows = Collections.unmodifiableList(rows);
        this.affectedRows = affectedRows;
    }

    /**
     * Reads the outcome of an executed statement.
     *
     * @param statement       the statement after {@code execute}
     * @param hasResultSet    the value {@code execute} returned
     */
    static Result from(Statement statement, boolean hasResultSet) throws SQLException {
        if (!hasResultSet) {
            long count = Math.max(statement.getUpdateCount(), 0);
            return new Result(List.of(), List.of(), count);
        }
        try (ResultSet rs = statement.getResultSet()) {
            return read(rs);
        }
    }

    static Result read(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columnCount = meta.getColumnCount();
        List<String> names = new ArrayList<>(columnCount);
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < columnCount; i++) {
            String name = meta.getColumnLabel(i + 1);
            names.add(name);
            // first occurrence wins for duplicate labels
            index.putIfAbsent(name, i);
        }
        List<String> frozenNames = Collections.unmodifiableList(names);
        Map<String, Integer> frozenIndex = Collections.unmodifiableMap(index);

        List<Row> rows = new ArrayList<>();
        while (rs.next()) {
            Object[] values = new Object[columnCount];
            for (int i = 0; i < columnCount; i++) {
                values[i] = rs.getObject(i + 1);
            }
            rows.add(new Row(frozenNames, frozenIndex, values));
        }
        return new Result(names, rows, rows.size());
    }

    /**
     * @throws IndexOutOfBoundsException if {@code rowNum} is out of range
     */
    public Row get(int rowNum) {
        if (rowNum < 0 || rowNum >= rows.size()) {
            throw new IndexOutOfBoundsException("Row index out of range: " + rowNum + " (size " + rows.size() + ")");
        }
        return rows.get(rowNum);
    }

    /**
     * @throws NoSuchElementException if the result is empty
     */
    public Row front() {
        if (rows.isEmpty()) {
            throw new NoSuchElementException("Result is empty");
        }
        return rows.get(0);
    }

    public Optional<Row> frontOptional() {
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int columns() {
        return columnNames.size();
    }

    public String columnName(int col) {
        if (col < 0 || col >= columnNames.size()) {
            throw new IndexOutOfBoundsException("Column index out of range: " + col);
        }
        return columnNames.get(col);
    }

    /**
     * Rows returned by a query, or rows changed by an INSERT/UPDATE/DELETE.
     */
    public long affectedRows() {
        return affectedRows;
    }

    public <T> List<T> toList(Function<Row, T> mapper) {
        List<T> list = new ArrayList<>(rows.size());
        for (Row row : rows) {
            list.add(mapper.apply(row));
        }
        return list;
    }

    public Stream<Row> stream() {
        return rows.stream();
    }

    @Override
    public Iterator<Row> iterator() {
        return rows.iterator();
    }
}
