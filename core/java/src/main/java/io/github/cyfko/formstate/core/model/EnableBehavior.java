package io.github.cyfko.formstate.core.model;

/**
 * How several declarative enable conditions of one item combine.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum EnableBehavior {
    /** Every condition must hold. */
    ALL,
    /** At least one condition must hold. */
    ANY
}
