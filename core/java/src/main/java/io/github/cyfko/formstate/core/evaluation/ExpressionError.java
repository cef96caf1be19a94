package io.github.cyfko.formstate.core.evaluation;

import io.github.cyfko.formstate.core.dependency.ExpressionKind;

import java.util.Objects;

/**
 * An expression that could not be evaluated during a pass, either because the evaluator failed
 * or because the expression takes part in a dependency cycle.
 * <p>
 * Errors are values: they are recorded against the response node (or repeated group slot) the
 * expression was evaluated for and exposed in the snapshot, never thrown. The default of the
 * expression kind applies in the meantime.
 * </p>
 *
 * @param location   path of the node, {@code <form>} for form-level variables
 * @param linkId     declaring item, null for form-level variables
 * @param kind       expression kind
 * @param expression expression text, null for declarative enable conditions
 * @param message    what went wrong
 * @param cyclic     true when the expression was skipped because of a cycle
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ExpressionError(String location, String linkId, ExpressionKind kind, String expression,
                              String message, boolean cyclic) {

    public ExpressionError {
        Objects.requireNonNull(location, "location cannot be null");
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(message, "message cannot be null");
    }
}
