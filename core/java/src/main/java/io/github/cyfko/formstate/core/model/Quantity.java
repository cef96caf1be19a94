package io.github.cyfko.formstate.core.model;

import java.math.BigDecimal;

/**
 * Measured amount. A quantity without {@code value} only names a unit; it is used as an initial
 * value to preselect the unit of a quantity question.
 *
 * @param value  the amount, may be null
 * @param unit   unit as displayed
 * @param system unit system, may be null
 * @param code   coded unit, may be null
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Quantity(BigDecimal value, String unit, String system, String code) {

    public static Quantity of(BigDecimal value, String unit) {
        return new Quantity(value, unit, null, null);
    }

    public static Quantity unitOnly(String unit) {
        return new Quantity(null, unit, null, null);
    }

    public boolean hasValue() {
        return value != null;
    }
}
