package io.github.cyfko.formstate.core.model;

import java.util.Objects;

/**
 * Permitted answer of a choice item.
 *
 * @param value           the option value, a {@link Coding} or a plain value
 * @param initialSelected whether the option is selected when the response is created
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record AnswerOption(Object value, boolean initialSelected) {

    public AnswerOption {
        Objects.requireNonNull(value, "value cannot be null");
    }

    public static AnswerOption of(Object value) {
        return new AnswerOption(value, false);
    }

    public static AnswerOption selected(Object value) {
        return new AnswerOption(value, true);
    }
}
