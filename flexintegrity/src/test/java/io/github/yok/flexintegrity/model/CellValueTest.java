package io.github.yok.flexintegrity.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.math.BigDecimal;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class CellValueTest {

    @Test
    void ofNumber_正常ケース_末尾ゼロ違いの数値を指定する_等価と判定されること() {
        assertEquals(CellValue.ofNumber(new BigDecimal("1")), CellValue.ofNumber(1.0));
        assertEquals(CellValue.ofNumber(new BigDecimal("1.00")).hashCode(),
                CellValue.ofNumber(new BigDecimal("1")).hashCode());
    }

    @Test
    void ofNumber_正常ケース_NaNを指定する_NULLが返ること() {
        assertSame(CellValue.NULL, CellValue.ofNumber(Double.NaN));
    }

    @Test
    void ofString_正常ケース_nullを指定する_NULLが返ること() {
        assertSame(CellValue.NULL, CellValue.ofString(null));
        assertTrue(CellValue.ofString(null).isNull());
    }

    @Test
    void of_正常ケース_各Java型を指定する_対応する型タグが返ること() {
        assertEquals(CellType.NUMBER, CellValue.of(5).getType());
        assertEquals(CellType.NUMBER, CellValue.of(5L).getType());
        assertEquals(CellType.NUMBER, CellValue.of(2.5d).getType());
        assertEquals(CellType.BOOLEAN, CellValue.of(Boolean.TRUE).getType());
        assertEquals(CellType.STRING, CellValue.of("x").getType());
        assertEquals(CellType.NULL, CellValue.of(null).getType());
        // 日付は文字列として保持される
        assertEquals(CellValue.ofString("2024-01-02"), CellValue.of(LocalDate.of(2024, 1, 2)));
    }

    @Test
    void equals_正常ケース_文字列と数値の同表記を比較する_非等価と判定されること() {
        assertNotEquals(CellValue.ofString("1"), CellValue.ofNumber(BigDecimal.ONE));
    }

    @Test
    void asNumber_異常ケース_文字列セルを指定する_IllegalStateExceptionが送出されること() {
        assertThrows(IllegalStateException.class, () -> CellValue.ofString("x").asNumber());
    }

    @Test
    void isTruthy_正常ケース_真偽値と数値を指定する_値どおりに判定されること() {
        assertTrue(CellValue.ofBoolean(true).isTruthy());
        assertFalse(CellValue.ofBoolean(false).isTruthy());
        assertTrue(CellValue.ofNumber(new BigDecimal("-2")).isTruthy());
        assertFalse(CellValue.ofNumber(0.0).isTruthy());
        assertFalse(CellValue.NULL.isTruthy());
    }

    @Test
    void isTruthy_正常ケース_文字列を指定する_数値や真偽値表記として判定されること() {
        assertTrue(CellValue.ofString("1").isTruthy());
        assertFalse(CellValue.ofString("0").isTruthy());
        assertFalse(CellValue.ofString("0.0").isTruthy());
        assertTrue(CellValue.ofString("TRUE").isTruthy());
        assertFalse(CellValue.ofString("False").isTruthy());
        assertFalse(CellValue.ofString("  ").isTruthy());
        assertTrue(CellValue.ofString("yes").isTruthy());
    }

    @Test
    void toString_正常ケース_数値セルを指定する_指数表記にならないこと() {
        assertEquals("100", CellValue.ofNumber(new BigDecimal("100.0")).toString());
        assertEquals("null", CellValue.NULL.toString());
    }
}
