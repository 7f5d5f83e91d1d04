package io.github.yok.flexintegrity.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.flexintegrity.model.CellValue;
import io.github.yok.flexintegrity.model.Source;
import io.github.yok.flexintegrity.model.Table;
import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.List;
import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

class SpreadsheetParserTest {

    private final SpreadsheetParser parser = new SpreadsheetParser();

    @Test
    void parse_正常ケース_先頭シートの各型セル_ネイティブ型のまま読み込まれること() throws Exception {
        byte[] payload;
        try (Workbook wb = new XSSFWorkbook()) {
            Sheet sheet = wb.createSheet("first");
            Row header = sheet.createRow(0);
            header.createCell(0).setCellValue("b");
            header.createCell(1).setCellValue("c");
            header.createCell(2).setCellValue("flag");
            Row row1 = sheet.createRow(1);
            row1.createCell(0).setCellValue(1.5);
            row1.createCell(1).setCellValue("text");
            row1.createCell(2).setCellValue(true);
            Row row2 = sheet.createRow(2);
            row2.createCell(0).setCellValue(2.0);
            payload = write(wb);
        }

        Table table = parser.parse(Source.ofFile("book.xlsx", payload));

        assertEquals(List.of("b", "c", "flag"), table.getColumns());
        assertEquals(2, table.getRowCount());
        assertEquals(CellValue.ofNumber(new BigDecimal("1.5")), table.getValue(0, "b"));
        assertEquals(CellValue.ofString("text"), table.getValue(0, "c"));
        assertEquals(CellValue.ofBoolean(true), table.getValue(0, "flag"));
        assertEquals(CellValue.ofNumber(new BigDecimal("2")), table.getValue(1, "b"));
        // 未入力セルはnull
        assertTrue(table.containsValue(1, "c"));
        assertSame(CellValue.NULL, table.getValue(1, "c"));
        assertSame(CellValue.NULL, table.getValue(1, "flag"));
    }

    @Test
    void parse_正常ケース_複数シート_先頭シートのみ読み込まれること() throws Exception {
        byte[] payload;
        try (Workbook wb = new XSSFWorkbook()) {
            Sheet first = wb.createSheet("first");
            first.createRow(0).createCell(0).setCellValue("a");
            first.createRow(1).createCell(0).setCellValue("x");
            Sheet second = wb.createSheet("second");
            second.createRow(0).createCell(0).setCellValue("z");
            second.createRow(1).createCell(0).setCellValue("y");
            second.createRow(2).createCell(0).setCellValue("y");
            payload = write(wb);
        }

        Table table = parser.parse(Source.ofFile("book.xlsx", payload));

        assertEquals(List.of("a"), table.getColumns());
        assertEquals(1, table.getRowCount());
    }

    @Test
    void parse_正常ケース_日付書式セルと欠落行_ISO文字列と全null行になること() throws Exception {
        byte[] payload;
        try (Workbook wb = new XSSFWorkbook()) {
            CellStyle dateStyle = wb.createCellStyle();
            dateStyle.setDataFormat(
                    wb.getCreationHelper().createDataFormat().getFormat("yyyy-mm-dd"));
            Sheet sheet = wb.createSheet("dates");
            sheet.createRow(0).createCell(0).setCellValue("day");
            Cell day = sheet.createRow(1).createCell(0);
            day.setCellValue(LocalDateTime.of(2024, 1, 2, 0, 0));
            day.setCellStyle(dateStyle);
            // 3行目は物理的に存在しない
            sheet.createRow(3).createCell(0).setCellValue("last");
            payload = write(wb);
        }

        Table table = parser.parse(Source.ofFile("dates.xlsx", payload));

        assertEquals(3, table.getRowCount());
        assertEquals(CellValue.ofString("2024-01-02T00:00"), table.getValue(0, "day"));
        assertSame(CellValue.NULL, table.getValue(1, "day"));
        assertEquals(CellValue.ofString("last"), table.getValue(2, "day"));
    }

    @Test
    void parse_正常ケース_ヘッダより右にデータがある_Unnamed列として読み込まれること() throws Exception {
        byte[] payload;
        try (Workbook wb = new HSSFWorkbook()) {
            Sheet sheet = wb.createSheet("legacy");
            sheet.createRow(0).createCell(0).setCellValue("a");
            Row row = sheet.createRow(1);
            row.createCell(0).setCellValue("x");
            row.createCell(1).setCellValue(3);
            payload = write(wb);
        }

        Table table = parser.parse(Source.ofFile("legacy.xls", payload));

        assertEquals(List.of("a", "Unnamed: 1"), table.getColumns());
        assertEquals(CellValue.ofNumber(new BigDecimal("3")), table.getValue(0, "Unnamed: 1"));
    }

    @Test
    void parse_正常ケース_空シート_列も行もないテーブルが返ること() throws Exception {
        byte[] payload;
        try (Workbook wb = new XSSFWorkbook()) {
            wb.createSheet("empty");
            payload = write(wb);
        }

        Table table = parser.parse(Source.ofFile("empty.xlsx", payload));

        assertTrue(table.getColumns().isEmpty());
        assertEquals(0, table.getRowCount());
    }

    @Test
    void parse_異常ケース_壊れたバイト列_SourceFormatExceptionが送出されること() {
        Source source = Source.ofFile("broken.xlsx",
                "definitely not a workbook".getBytes(StandardCharsets.UTF_8));

        SourceFormatException ex =
                assertThrows(SourceFormatException.class, () -> parser.parse(source));
        assertEquals(SourceKind.SPREADSHEET, ex.getKind());
        assertEquals("broken.xlsx", ex.getSourceName());
    }

    private static byte[] write(Workbook wb) throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        wb.write(out);
        return out.toByteArray();
    }
}
