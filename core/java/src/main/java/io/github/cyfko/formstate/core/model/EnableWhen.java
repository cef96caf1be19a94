package io.github.cyfko.formstate.core.model;

import java.util.Objects;

/**
 * Declarative enable condition: the item is enabled when the answer of {@code question}
 * compares to {@code answer} according to {@code operator}.
 * <p>
 * For {@link EnableWhenOperator#EXISTS}, {@code answer} must be a {@link Boolean} telling whether
 * the question is expected to be answered or not.
 * </p>
 *
 * @param question link id of the question whose answers are inspected
 * @param operator comparison operator
 * @param answer   value compared against
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record EnableWhen(String question, EnableWhenOperator operator, Object answer) {

    public EnableWhen {
        Objects.requireNonNull(question, "question cannot be null");
        Objects.requireNonNull(operator, "operator cannot be null");
        Objects.requireNonNull(answer, "answer cannot be null");
        if (operator == EnableWhenOperator.EXISTS && !(answer instanceof Boolean)) {
            throw new IllegalArgumentException("EXISTS condition on '" + question + "' requires a Boolean answer");
        }
    }

    public static EnableWhen exists(String question, boolean expected) {
        return new EnableWhen(question, EnableWhenOperator.EXISTS, expected);
    }

    public static EnableWhen equalTo(String question, Object answer) {
        return new EnableWhen(question, EnableWhenOperator.EQUAL, answer);
    }
}
