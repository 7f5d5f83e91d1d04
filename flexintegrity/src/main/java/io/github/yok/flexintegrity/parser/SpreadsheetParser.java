package io.github.yok.flexintegrity.parser;

import io.github.yok.flexintegrity.model.CellValue;
import io.github.yok.flexintegrity.model.Source;
import io.github.yok.flexintegrity.model.Table;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

/**
 * Implementation of {@link SourceParser} that reads the first worksheet of an Excel workbook
 * ({@code .xlsx} or {@code .xls}) with Apache POI.
 *
 * <p>
 * The first physical row is the header. Cell values keep their native type:
 * </p>
 * <ul>
 * <li>numeric cells become numbers, date-formatted numeric cells become ISO-8601 text</li>
 * <li>text cells become strings (empty text is {@code null})</li>
 * <li>boolean cells become booleans</li>
 * <li>blank and error cells become {@code null}</li>
 * <li>formula cells take the type of their cached result</li>
 * </ul>
 *
 * <p>
 * Rows that are physically missing inside the used range are read as all-null rows.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SpreadsheetParser implements SourceParser {

    private final DataFormatter headerFormatter = new DataFormatter();

    /**
     * {@inheritDoc}
     */
    @Override
    public Table parse(Source source) throws SourceFormatException {
        String name = source.getLabel();
        try (Workbook workbook =
                WorkbookFactory.create(new ByteArrayInputStream(source.getPayload()))) {
            Table table = new Table(name);
            if (workbook.getNumberOfSheets() == 0) {
                log.debug("Workbook [{}] has no sheet", name);
                return table;
            }
            Sheet sheet = workbook.getSheetAt(0);
            if (sheet.getPhysicalNumberOfRows() == 0) {
                log.debug("Sheet [{}] of workbook [{}] is empty", sheet.getSheetName(), name);
                return table;
            }

            int headerRowNum = sheet.getFirstRowNum();
            List<String> columns = ColumnNames
                    .normalize(readHeader(sheet.getRow(headerRowNum), usedWidth(sheet)));
            columns.forEach(table::addColumn);

            for (int r = headerRowNum + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                Map<String, CellValue> values = new LinkedHashMap<>();
                for (int c = 0; c < columns.size(); c++) {
                    values.put(columns.get(c),
                            row == null ? CellValue.NULL : toCellValue(row.getCell(c)));
                }
                table.addRow(values);
            }
            log.debug("Parsed sheet [{}] of workbook [{}]: columns={}, rows={}",
                    sheet.getSheetName(), name, columns.size(), table.getRowCount());
            return table;
        } catch (IOException | RuntimeException e) {
            throw new SourceFormatException(SourceKind.SPREADSHEET, name,
                    "unreadable workbook: " + e.getMessage(), e);
        }
    }

    // Widest row in the sheet (header included)
    private static int usedWidth(Sheet sheet) {
        int width = 0;
        for (Row row : sheet) {
            width = Math.max(width, row.getLastCellNum());
        }
        return width;
    }

    private List<String> readHeader(Row header, int width) {
        List<String> raw = new ArrayList<>(width);
        for (int c = 0; c < width; c++) {
            Cell cell = header == null ? null : header.getCell(c);
            raw.add(cell == null ? null : headerFormatter.formatCellValue(cell));
        }
        return raw;
    }

    /**
     * Converts one POI cell into a {@link CellValue}.
     *
     * @param cell cell, may be {@code null}
     * @return converted value
     */
    static CellValue toCellValue(Cell cell) {
        if (cell == null) {
            return CellValue.NULL;
        }
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType()
                : cell.getCellType();
        switch (type) {
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return CellValue.ofString(cell.getLocalDateTimeCellValue().toString());
                }
                return CellValue.ofNumber(cell.getNumericCellValue());
            case STRING:
                String text = cell.getStringCellValue();
                return CellValue.ofString(text == null || text.isEmpty() ? null : text);
            case BOOLEAN:
                return CellValue.ofBoolean(cell.getBooleanCellValue());
            default:
                // BLANK, ERROR
                return CellValue.NULL;
        }
    }
}
