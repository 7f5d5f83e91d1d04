package io.github.yok.flexintegrity.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Data-integrity metrics of one pipeline run.
 *
 * <p>
 * Percentages carry two decimal places. {@code validRecords + invalidRecords} always equals the
 * number of rows that were scored.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class Metrics {

    /**
     * Metrics of an empty table.
     */
    public static final Metrics EMPTY = Metrics.builder().completeness(zero())
            .consistency(zero()).overallIntegrity(zero()).validRecords(0).invalidRecords(0)
            .build();

    // Average share of non-null cells per column, in percent
    BigDecimal completeness;

    // 100 minus the share of duplicated rows, in percent
    BigDecimal consistency;

    // 0.6 * completeness + 0.4 * consistency
    BigDecimal overallIntegrity;

    long validRecords;

    long invalidRecords;

    private static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(2);
    }

    /**
     * Returns the number of scored rows.
     *
     * @return valid + invalid
     */
    public long getTotalRecords() {
        return validRecords + invalidRecords;
    }
}
