package io.github.yok.flexintegrity.core;

import com.google.common.base.Preconditions;
import io.github.yok.flexintegrity.model.CellValue;
import io.github.yok.flexintegrity.model.Table;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Concatenates tables with heterogeneous columns into one rectangular table.
 *
 * <p>
 * The output columns are the union of the input columns in first-seen order. Rows are emitted
 * table by table, each keeping its original order, and every row carries every output column; a
 * column the row's table did not have (or a ragged row did not fill) is {@link CellValue#NULL}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class TableUnifier {

    /**
     * Name of the table produced by {@link #unify(List)}.
     */
    public static final String UNIFIED_TABLE_NAME = "unified";

    /**
     * Unifies the given tables. An empty input yields a table without columns or rows.
     *
     * @param tables tables in arrival order
     * @return sealed, rectangular table
     */
    public Table unify(List<Table> tables) {
        Preconditions.checkNotNull(tables, "tables must not be null");

        Set<String> union = new LinkedHashSet<>();
        for (Table table : tables) {
            union.addAll(table.getColumns());
        }
        List<String> columns = new ArrayList<>(union);

        List<Map<String, CellValue>> rows = new ArrayList<>();
        for (Table table : tables) {
            for (int r = 0; r < table.getRowCount(); r++) {
                Map<String, CellValue> row = new LinkedHashMap<>();
                for (String column : columns) {
                    row.put(column, table.getValue(r, column));
                }
                rows.add(row);
            }
        }

        log.info("Unified {} table(s): columns={}, rows={}", tables.size(), columns.size(),
                rows.size());
        return Table.sealed(UNIFIED_TABLE_NAME, columns, rows);
    }
}
