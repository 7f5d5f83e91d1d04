package io.github.yok.flexintegrity.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.flexintegrity.model.CellValue;
import io.github.yok.flexintegrity.model.Table;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TableUnifierTest {

    private final TableUnifier unifier = new TableUnifier();

    @Test
    void unify_正常ケース_列の異なる2テーブル_列が初出順に和集合化されnull補完されること() {
        Table left = new Table("left.csv");
        left.addRow(row("a", "1", "b", "2"));
        Table right = new Table("right.xlsx");
        right.addRow(row("b", "3", "c", "4"));

        Table unified = unifier.unify(List.of(left, right));

        assertEquals(List.of("a", "b", "c"), unified.getColumns());
        assertEquals(2, unified.getRowCount());
        assertEquals(CellValue.ofString("1"), unified.getValue(0, "a"));
        assertSame(CellValue.NULL, unified.getValue(0, "c"));
        assertTrue(unified.containsValue(0, "c"));
        assertSame(CellValue.NULL, unified.getValue(1, "a"));
        assertTrue(unified.containsValue(1, "a"));
        assertEquals(CellValue.ofString("4"), unified.getValue(1, "c"));
    }

    @Test
    void unify_正常ケース_空の入力_列も行もない封印済みテーブルが返ること() {
        Table unified = unifier.unify(List.of());

        assertTrue(unified.getColumns().isEmpty());
        assertEquals(0, unified.getRowCount());
        assertTrue(unified.isImmutable());
        assertEquals(TableUnifier.UNIFIED_TABLE_NAME, unified.getName());
    }

    @Test
    void unify_正常ケース_単一テーブル_元のテーブルと構造的に等しいこと() {
        Table table = new Table("only");
        table.addRow(row("x", "1", "y", "2"));
        table.addRow(row("x", "3", "y", null));

        assertEquals(table, unifier.unify(List.of(table)));
    }

    @Test
    void unify_正常ケース_不揃いな行を含む_全行が全列を持つこと() {
        Table ragged = new Table("ragged");
        ragged.addRow(row("a", "1"));
        ragged.addRow(row("b", "2"));

        Table unified = unifier.unify(List.of(ragged));

        for (int r = 0; r < unified.getRowCount(); r++) {
            for (String column : unified.getColumns()) {
                assertTrue(unified.containsValue(r, column));
            }
        }
    }

    @Test
    void unify_正常ケース_複数テーブル_行数が保存され入力順に連結されること() {
        Table first = new Table("first");
        first.addRow(row("a", "1"));
        first.addRow(row("a", "2"));
        Table empty = new Table("empty");
        empty.addColumn("z");
        Table second = new Table("second");
        second.addRow(row("a", "3"));

        Table unified = unifier.unify(List.of(first, empty, second));

        assertEquals(3, unified.getRowCount());
        assertEquals(List.of("a", "z"), unified.getColumns());
        assertEquals(CellValue.ofString("1"), unified.getValue(0, "a"));
        assertEquals(CellValue.ofString("2"), unified.getValue(1, "a"));
        assertEquals(CellValue.ofString("3"), unified.getValue(2, "a"));
    }

    private static Map<String, CellValue> row(String... keyValues) {
        Map<String, CellValue> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put(keyValues[i], CellValue.ofString(keyValues[i + 1]));
        }
        return row;
    }
}
