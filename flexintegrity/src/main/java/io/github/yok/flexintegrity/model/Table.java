package io.github.yok.flexintegrity.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import lombok.Getter;

/**
 * Ordered sequence of rows, each row mapping a column name to a {@link CellValue}.
 *
 * <p>
 * The column set is the union of every declared column and every row key, kept in first-seen
 * order. A freshly parsed table may hold ragged rows (rows that lack some columns); a missing
 * entry reads as {@link CellValue#NULL}. Rows are padded to the full column set only when tables
 * are unified.
 * </p>
 *
 * <p>
 * Equality compares columns (in order) and rows; the {@linkplain #getName() name} is informative
 * only.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class Table {

    // Display name (source file name, connection id, "unified", ...)
    @Getter
    private final String name;

    // Columns in first-seen order
    private final Set<String> columns = new LinkedHashSet<>();

    // Rows in arrival order
    private final List<Map<String, CellValue>> rows = new ArrayList<>();

    // Set once the table is sealed by unification
    private final boolean immutable;

    /**
     * Creates an empty, mutable table.
     *
     * @param name display name
     */
    public Table(String name) {
        this(name, false);
    }

    private Table(String name, boolean immutable) {
        this.name = name;
        this.immutable = immutable;
    }

    /**
     * Creates a sealed table from already aligned columns and rows.
     *
     * @param name display name
     * @param columns column names in order
     * @param rows rows; each row is copied as-is
     * @return immutable table
     */
    public static Table sealed(String name, List<String> columns,
            List<Map<String, CellValue>> rows) {
        Table table = new Table(name, true);
        table.columns.addAll(columns);
        for (Map<String, CellValue> row : rows) {
            table.rows.add(ImmutableMap.copyOf(row));
        }
        return table;
    }

    /**
     * Declares a column without adding a row (used for header-only inputs).
     *
     * @param column column name
     */
    public void addColumn(String column) {
        checkMutable();
        Preconditions.checkNotNull(column, "column must not be null");
        columns.add(column);
    }

    /**
     * Appends a row. Keys not seen before are appended to the column set; a {@code null} value is
     * stored as {@link CellValue#NULL}.
     *
     * @param row column name to value mapping
     */
    public void addRow(Map<String, CellValue> row) {
        checkMutable();
        Preconditions.checkNotNull(row, "row must not be null");
        Map<String, CellValue> copy = new LinkedHashMap<>();
        row.forEach((column, value) -> {
            Preconditions.checkNotNull(column, "column must not be null");
            columns.add(column);
            copy.put(column, value == null ? CellValue.NULL : value);
        });
        rows.add(copy);
    }

    /**
     * Returns the column set in first-seen order.
     *
     * @return immutable column list
     */
    public List<String> getColumns() {
        return ImmutableList.copyOf(columns);
    }

    /**
     * Returns whether the column is part of this table.
     *
     * @param column column name
     * @return {@code true} if present
     */
    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    /**
     * Returns the rows in order. Rows of a parsed table may not cover every column.
     *
     * @return unmodifiable row list
     */
    public List<Map<String, CellValue>> getRows() {
        return Collections.unmodifiableList(rows);
    }

    /**
     * Returns the number of rows.
     *
     * @return row count
     */
    public int getRowCount() {
        return rows.size();
    }

    /**
     * Returns whether the given row carries an entry for the column.
     *
     * @param row zero-based row index
     * @param column column name
     * @return {@code true} if the row holds the key (even when its value is NULL)
     */
    public boolean containsValue(int row, String column) {
        return rows.get(row).containsKey(column);
    }

    /**
     * Returns one cell. A column missing from a ragged row reads as {@link CellValue#NULL}.
     *
     * @param row zero-based row index
     * @param column column name
     * @return cell value, never {@code null}
     */
    public CellValue getValue(int row, String column) {
        CellValue value = rows.get(row).get(column);
        return value == null ? CellValue.NULL : value;
    }

    /**
     * Returns whether this table was sealed by unification.
     *
     * @return {@code true} if no more rows or columns can be added
     */
    public boolean isImmutable() {
        return immutable;
    }

    private void checkMutable() {
        if (immutable) {
            throw new UnsupportedOperationException("Table [" + name + "] is sealed");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Table)) {
            return false;
        }
        Table other = (Table) o;
        return getColumns().equals(other.getColumns()) && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getColumns(), rows);
    }

    @Override
    public String toString() {
        return "Table[" + name + "] columns=" + columns + ", rows=" + rows.size();
    }
}
