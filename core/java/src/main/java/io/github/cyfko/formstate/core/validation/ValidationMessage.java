package io.github.cyfko.formstate.core.validation;

import io.github.cyfko.formstate.core.model.ConstraintSeverity;

import java.util.Objects;

/**
 * One problem found on an answer.
 *
 * @param severity {@link ConstraintSeverity#ERROR} blocks submission, {@link ConstraintSeverity#WARNING} does not
 * @param text     human readable description
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ValidationMessage(ConstraintSeverity severity, String text) {

    public ValidationMessage {
        Objects.requireNonNull(severity, "severity cannot be null");
        Objects.requireNonNull(text, "text cannot be null");
    }

    public static ValidationMessage error(String text) {
        return new ValidationMessage(ConstraintSeverity.ERROR, text);
    }

    public static ValidationMessage warning(String text) {
        return new ValidationMessage(ConstraintSeverity.WARNING, text);
    }

    public boolean isError() {
        return severity == ConstraintSeverity.ERROR;
    }
}
