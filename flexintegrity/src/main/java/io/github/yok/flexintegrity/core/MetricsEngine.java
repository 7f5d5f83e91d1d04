package io.github.yok.flexintegrity.core;

import com.google.common.base.Preconditions;
import io.github.yok.flexintegrity.model.CellValue;
import io.github.yok.flexintegrity.model.Metrics;
import io.github.yok.flexintegrity.model.Table;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Computes the data-integrity {@link Metrics} of a table.
 *
 * <p>
 * With {@code N} rows and {@code C} columns:
 * </p>
 * <ul>
 * <li><strong>completeness</strong>: share of non-null cells, averaged per column, in percent</li>
 * <li><strong>consistency</strong>: {@code 100 - duplicates / N * 100}, where a duplicate is a row
 * equal in every column (nulls included) to an earlier row</li>
 * <li><strong>overall integrity</strong>: {@code 0.6 * completeness + 0.4 * consistency}</li>
 * <li><strong>valid records</strong>: truthy cells of column {@value #VALID_COLUMN} if the table
 * has it, otherwise {@code floor(0.9 * N)}</li>
 * <li><strong>invalid records</strong>: {@code N - valid}</li>
 * </ul>
 *
 * <p>
 * Percentages are rounded to two decimals (HALF_EVEN); overall integrity is derived from the
 * unrounded values. An empty table yields {@link Metrics#EMPTY}. The table is only read.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class MetricsEngine {

    /**
     * Column that, when present, decides which records are valid.
     */
    public static final String VALID_COLUMN = "valid";

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal COMPLETENESS_WEIGHT = new BigDecimal("0.6");
    private static final BigDecimal CONSISTENCY_WEIGHT = new BigDecimal("0.4");
    private static final int SCALE = 2;

    /**
     * Scores the given table.
     *
     * @param table table to score
     * @return metrics
     */
    public Metrics score(Table table) {
        Preconditions.checkNotNull(table, "table must not be null");
        int n = table.getRowCount();
        if (n == 0) {
            log.info("No records to score; returning empty metrics");
            return Metrics.EMPTY;
        }

        BigDecimal completeness = completeness(table);
        BigDecimal consistency = consistency(table);
        BigDecimal overall = completeness.multiply(COMPLETENESS_WEIGHT)
                .add(consistency.multiply(CONSISTENCY_WEIGHT));
        long valid = validRecords(table);

        Metrics metrics = Metrics.builder().completeness(round(completeness))
                .consistency(round(consistency)).overallIntegrity(round(overall))
                .validRecords(valid).invalidRecords(n - valid).build();
        log.info("Scored {} record(s): {}", n, metrics);
        return metrics;
    }

    // Mean of per-column non-null ratios; every column has N rows, so this is nonNull / (N * C)
    private static BigDecimal completeness(Table table) {
        List<String> columns = table.getColumns();
        if (columns.isEmpty()) {
            return BigDecimal.ZERO;
        }
        long nonNull = 0;
        for (int r = 0; r < table.getRowCount(); r++) {
            for (String column : columns) {
                if (!table.getValue(r, column).isNull()) {
                    nonNull++;
                }
            }
        }
        long cells = (long) table.getRowCount() * columns.size();
        return BigDecimal.valueOf(nonNull).multiply(HUNDRED).divide(BigDecimal.valueOf(cells),
                MathContext.DECIMAL128);
    }

    private static BigDecimal consistency(Table table) {
        long duplicates = countDuplicateRows(table);
        BigDecimal ratio = BigDecimal.valueOf(duplicates).multiply(HUNDRED)
                .divide(BigDecimal.valueOf(table.getRowCount()), MathContext.DECIMAL128);
        return HUNDRED.subtract(ratio);
    }

    /**
     * Counts rows that repeat an earlier row in every column.
     *
     * @param table table to inspect
     * @return number of duplicate rows
     */
    static long countDuplicateRows(Table table) {
        List<String> columns = table.getColumns();
        Set<List<CellValue>> seen = new HashSet<>();
        long duplicates = 0;
        for (int r = 0; r < table.getRowCount(); r++) {
            List<CellValue> key = new ArrayList<>(columns.size());
            for (String column : columns) {
                key.add(table.getValue(r, column));
            }
            if (!seen.add(key)) {
                duplicates++;
            }
        }
        return duplicates;
    }

    // Placeholder heuristic when no validity column exists: 90% of the rows, rounded down
    private static long validRecords(Table table) {
        int n = table.getRowCount();
        if (!table.hasColumn(VALID_COLUMN)) {
            return (long) n * 9 / 10;
        }
        long valid = 0;
        for (int r = 0; r < n; r++) {
            if (table.getValue(r, VALID_COLUMN).isTruthy()) {
                valid++;
            }
        }
        return valid;
    }

    private static BigDecimal round(BigDecimal value) {
        return value.setScale(SCALE, RoundingMode.HALF_EVEN);
    }
}
