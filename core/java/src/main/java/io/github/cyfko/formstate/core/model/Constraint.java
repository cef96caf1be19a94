package io.github.cyfko.formstate.core.model;

import java.util.Objects;

/**
 * Expression based constraint of an item. The expression must evaluate to {@code true} for
 * the answers to satisfy it.
 *
 * @param key        identifier of the constraint, unique within its item
 * @param severity   what a failure means
 * @param expression boolean expression evaluated in the item's context
 * @param human      message shown when the constraint fails
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Constraint(String key, ConstraintSeverity severity, Expression expression, String human) {

    public Constraint {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(severity, "severity cannot be null");
        Objects.requireNonNull(expression, "expression cannot be null");
        if (human == null || human.isBlank()) {
            human = "Constraint '" + key + "' is not satisfied";
        }
    }

    public static Constraint error(String key, String expression, String human) {
        return new Constraint(key, ConstraintSeverity.ERROR, Expression.of(expression), human);
    }

    public static Constraint warning(String key, String expression, String human) {
        return new Constraint(key, ConstraintSeverity.WARNING, Expression.of(expression), human);
    }
}
