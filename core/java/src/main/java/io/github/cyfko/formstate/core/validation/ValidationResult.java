package io.github.cyfko.formstate.core.validation;

import java.util.List;

/**
 * Validation outcome of one response node (or repeated group slot).
 * <p>
 * A result is either {@link Status#VALID} (possibly with warnings), {@link Status#INVALID} with
 * at least one error, or {@link Status#NOT_VALIDATED} when the node has not been touched yet and
 * full validation was not requested.
 * </p>
 *
 * <p>Instances are immutable and created via the static methods {@link #valid(List)},
 * {@link #invalid(List, List)} and {@link #notValidated()}.</p>
 *
 * <p>Usage example:</p>
 * <pre>{@code
 * ValidationResult result = snapshot.validation("name");
 * if (result.isInvalid()) {
 *     result.getErrors().forEach(message -> show(message.text()));
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ValidationResult {

    public enum Status {
        VALID,
        INVALID,
        NOT_VALIDATED
    }

    private static final ValidationResult NOT_VALIDATED = new ValidationResult(Status.NOT_VALIDATED, List.of(), List.of());
    private static final ValidationResult VALID = new ValidationResult(Status.VALID, List.of(), List.of());

    private final Status status;
    private final List<ValidationMessage> errors;
    private final List<ValidationMessage> warnings;

    private ValidationResult(Status status, List<ValidationMessage> errors, List<ValidationMessage> warnings) {
        this.status = status;
        this.errors = List.copyOf(errors);
        this.warnings = List.copyOf(warnings);
    }

    /**
     * @param warnings non-blocking problems, may be empty
     * @return a valid result
     */
    public static ValidationResult valid(List<ValidationMessage> warnings) {
        return warnings.isEmpty() ? VALID : new ValidationResult(Status.VALID, List.of(), warnings);
    }

    public static ValidationResult valid() {
        return VALID;
    }

    /**
     * @param errors   blocking problems, at least one
     * @param warnings non-blocking problems
     * @return an invalid result
     * @throws IllegalArgumentException if {@code errors} is empty
     */
    public static ValidationResult invalid(List<ValidationMessage> errors, List<ValidationMessage> warnings) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("An invalid result needs at least one error");
        }
        return new ValidationResult(Status.INVALID, errors, warnings);
    }

    public static ValidationResult notValidated() {
        return NOT_VALIDATED;
    }

    /**
     * Builds the result matching a list of messages: invalid when any of them is an error.
     */
    static ValidationResult of(List<ValidationMessage> messages) {
        List<ValidationMessage> errors = messages.stream().filter(ValidationMessage::isError).toList();
        List<ValidationMessage> warnings = messages.stream().filter(m -> !m.isError()).toList();
        return errors.isEmpty() ? valid(warnings) : invalid(errors, warnings);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isValid() {
        return status == Status.VALID;
    }

    public boolean isInvalid() {
        return status == Status.INVALID;
    }

    public List<ValidationMessage> getErrors() {
        return errors;
    }

    public List<ValidationMessage> getWarnings() {
        return warnings;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidationResult that)) return false;
        return status == that.status && errors.equals(that.errors) && warnings.equals(that.warnings);
    }

    @Override
    public int hashCode() {
        return status.hashCode() * 31 + errors.hashCode() * 17 + warnings.hashCode();
    }

    @Override
    public String toString() {
        return switch (status) {
            case VALID -> warnings.isEmpty() ? "ValidationResult[valid]" : "ValidationResult[valid, warnings=" + warnings + "]";
            case INVALID -> "ValidationResult[invalid, errors=" + errors + "]";
            case NOT_VALIDATED -> "ValidationResult[not validated]";
        };
    }
}
