package io.github.yok.flexintegrity.model;

/**
 * Type tag of a {@link CellValue}.
 *
 * @author Yasuharu.Okawauchi
 */
public enum CellType {

    // Text value
    STRING,

    // Numeric value (held as BigDecimal)
    NUMBER,

    // true / false
    BOOLEAN,

    // Missing value
    NULL
}
