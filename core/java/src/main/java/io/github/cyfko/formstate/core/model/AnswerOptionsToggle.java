package io.github.cyfko.formstate.core.model;

import io.github.cyfko.formstate.core.exception.FormDefinitionException;

import java.util.List;
import java.util.Objects;

/**
 * Boolean expression deciding whether a set of answer options is offered.
 * <p>
 * An option listed by one or more toggles is offered only while at least one of those toggles
 * evaluates to {@code true}. Options never listed by a toggle are always offered.
 * </p>
 *
 * @param expression boolean expression
 * @param options    option values controlled by the expression, never empty
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record AnswerOptionsToggle(Expression expression, List<Object> options) {

    public AnswerOptionsToggle {
        Objects.requireNonNull(expression, "expression cannot be null");
        if (options == null || options.isEmpty()) {
            throw new FormDefinitionException(
                    "Answer options toggle '" + expression.expression() + "' must list at least one option");
        }
        options = List.copyOf(options);
    }
}
