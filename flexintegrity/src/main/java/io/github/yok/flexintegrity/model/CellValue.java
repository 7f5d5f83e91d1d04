package io.github.yok.flexintegrity.model;

import com.google.common.base.Preconditions;
import java.math.BigDecimal;
import java.util.Locale;
import java.util.Objects;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

/**
 * Immutable scalar held by one cell of a {@link Table}.
 *
 * <p>
 * A cell is exactly one of {@link CellType#STRING}, {@link CellType#NUMBER},
 * {@link CellType#BOOLEAN} or {@link CellType#NULL}. Numbers are normalized with
 * {@link BigDecimal#stripTrailingZeros()}, so {@code 1}, {@code 1.0} and {@code 1.00} compare
 * equal.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public final class CellValue {

    /**
     * The single NULL cell.
     */
    public static final CellValue NULL = new CellValue(CellType.NULL, null);

    private static final CellValue TRUE = new CellValue(CellType.BOOLEAN, Boolean.TRUE);
    private static final CellValue FALSE = new CellValue(CellType.BOOLEAN, Boolean.FALSE);

    // Type tag
    private final CellType type;

    // String, BigDecimal, Boolean or null depending on the type
    private final Object value;

    private CellValue(CellType type, Object value) {
        this.type = type;
        this.value = value;
    }

    /**
     * Creates a STRING cell, or NULL when {@code text} is {@code null}.
     *
     * @param text text value
     * @return cell value
     */
    public static CellValue ofString(String text) {
        return text == null ? NULL : new CellValue(CellType.STRING, text);
    }

    /**
     * Creates a NUMBER cell, or NULL when {@code number} is {@code null}.
     *
     * @param number numeric value
     * @return cell value
     */
    public static CellValue ofNumber(BigDecimal number) {
        if (number == null) {
            return NULL;
        }
        return new CellValue(CellType.NUMBER, number.stripTrailingZeros());
    }

    /**
     * Creates a NUMBER cell from a {@code double}. NaN is treated as a missing value.
     *
     * @param number numeric value
     * @return cell value
     */
    public static CellValue ofNumber(double number) {
        if (Double.isNaN(number) || Double.isInfinite(number)) {
            return NULL;
        }
        return ofNumber(BigDecimal.valueOf(number));
    }

    /**
     * Creates a BOOLEAN cell, or NULL when {@code flag} is {@code null}.
     *
     * @param flag boolean value
     * @return cell value
     */
    public static CellValue ofBoolean(Boolean flag) {
        if (flag == null) {
            return NULL;
        }
        return flag ? TRUE : FALSE;
    }

    /**
     * Wraps an arbitrary Java object as produced by JDBC drivers or spreadsheets.
     *
     * <p>
     * {@link Number} becomes NUMBER, {@link Boolean} becomes BOOLEAN and {@code null} becomes
     * NULL. Anything else is kept as its {@code toString()} text.
     * </p>
     *
     * @param raw raw value
     * @return cell value
     */
    public static CellValue of(Object raw) {
        if (raw == null) {
            return NULL;
        }
        if (raw instanceof CellValue) {
            return (CellValue) raw;
        }
        if (raw instanceof BigDecimal) {
            return ofNumber((BigDecimal) raw);
        }
        if (raw instanceof Double || raw instanceof Float) {
            return ofNumber(((Number) raw).doubleValue());
        }
        if (raw instanceof Number) {
            return ofNumber(new BigDecimal(raw.toString()));
        }
        if (raw instanceof Boolean) {
            return ofBoolean((Boolean) raw);
        }
        return ofString(raw.toString());
    }

    /**
     * Returns whether this cell holds a missing value.
     *
     * @return {@code true} for NULL
     */
    public boolean isNull() {
        return type == CellType.NULL;
    }

    /**
     * Returns the number held by a NUMBER cell.
     *
     * @return numeric value
     * @throws IllegalStateException if this cell is not a NUMBER
     */
    public BigDecimal asNumber() {
        Preconditions.checkState(type == CellType.NUMBER, "Not a NUMBER cell: %s", type);
        return (BigDecimal) value;
    }

    /**
     * Evaluates the cell as a flag.
     *
     * <p>
     * NULL is false, a BOOLEAN is its own value and a NUMBER is true when non-zero. A STRING that
     * reads as a number or as {@code true}/{@code false} is judged by that reading. Any other
     * non-blank text is true.
     * </p>
     *
     * @return truthiness of the cell
     */
    public boolean isTruthy() {
        switch (type) {
            case BOOLEAN:
                return (Boolean) value;
            case NUMBER:
                return ((BigDecimal) value).signum() != 0;
            case STRING:
                return isTruthyText((String) value);
            default:
                return false;
        }
    }

    private static boolean isTruthyText(String text) {
        String trimmed = StringUtils.trimToEmpty(text);
        if (trimmed.isEmpty()) {
            return false;
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if ("true".equals(lower)) {
            return true;
        }
        if ("false".equals(lower)) {
            return false;
        }
        try {
            return new BigDecimal(trimmed).signum() != 0;
        } catch (NumberFormatException e) {
            return true;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellValue)) {
            return false;
        }
        CellValue other = (CellValue) o;
        return type == other.type && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        if (type == CellType.NUMBER) {
            return ((BigDecimal) value).toPlainString();
        }
        return String.valueOf(value);
    }
}
