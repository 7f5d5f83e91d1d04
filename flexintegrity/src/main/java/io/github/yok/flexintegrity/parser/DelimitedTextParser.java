package io.github.yok.flexintegrity.parser;

import io.github.yok.flexintegrity.model.CellValue;
import io.github.yok.flexintegrity.model.Source;
import io.github.yok.flexintegrity.model.Table;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * Implementation of {@link SourceParser} that reads UTF-8 delimited text with Apache Commons CSV.
 *
 * <p>
 * The first record is the header. Every following record becomes one row; a record with fewer
 * fields than the header leaves the trailing columns {@code null}, a record with more fields is
 * rejected. Empty fields are read as {@code null}. Values are not type-converted.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DelimitedTextParser implements SourceParser {

    // Field delimiter
    @Getter
    private final char delimiter;

    /**
     * Creates a parser for the given delimiter.
     *
     * @param delimiter field delimiter (e.g. {@code ','} or {@code '\t'})
     */
    public DelimitedTextParser(char delimiter) {
        this.delimiter = delimiter;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Table parse(Source source) throws SourceFormatException {
        String name = source.getLabel();
        String text = ColumnNames.decodeUtf8(source.getPayload(), SourceKind.DELIMITED_TEXT, name);

        CSVFormat fmt = CSVFormat.DEFAULT.builder().setDelimiter(delimiter)
                .setIgnoreEmptyLines(true).get();
        try (CSVParser parser = CSVParser.parse(text, fmt)) {
            Iterator<CSVRecord> records = parser.iterator();
            if (!records.hasNext()) {
                throw new SourceFormatException(SourceKind.DELIMITED_TEXT, name,
                        "no header line found");
            }
            List<String> columns = ColumnNames.normalize(toList(records.next()));

            Table table = new Table(name);
            columns.forEach(table::addColumn);
            while (records.hasNext()) {
                CSVRecord record = records.next();
                if (record.size() > columns.size()) {
                    throw new SourceFormatException(SourceKind.DELIMITED_TEXT, name,
                            String.format("expected %d fields in line %d, saw %d", columns.size(),
                                    parser.getCurrentLineNumber(), record.size()));
                }
                Map<String, CellValue> row = new LinkedHashMap<>();
                for (int i = 0; i < columns.size(); i++) {
                    String field = i < record.size() ? record.get(i) : null;
                    row.put(columns.get(i),
                            CellValue.ofString(field == null || field.isEmpty() ? null : field));
                }
                table.addRow(row);
            }
            log.debug("Parsed delimited text [{}]: columns={}, rows={}", name, columns.size(),
                    table.getRowCount());
            return table;
        } catch (IOException | UncheckedIOException | IllegalStateException e) {
            throw new SourceFormatException(SourceKind.DELIMITED_TEXT, name,
                    "malformed delimited text: " + e.getMessage(), e);
        }
    }

    private static List<String> toList(CSVRecord record) {
        List<String> values = new ArrayList<>(record.size());
        record.forEach(values::add);
        return values;
    }
}
