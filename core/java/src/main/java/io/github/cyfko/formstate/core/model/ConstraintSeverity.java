package io.github.cyfko.formstate.core.model;

/**
 * Severity of a failed {@link Constraint}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum ConstraintSeverity {
    /** A failure makes the answer invalid. */
    ERROR,
    /** A failure is reported but the answer stays valid. */
    WARNING
}
