package io.github.cyfko.formstate.core.exception;

/**
 * Exception an {@link io.github.cyfko.formstate.core.spi.ExpressionEvaluator} may throw when an
 * expression cannot be evaluated.
 * <p>
 * The evaluation engine never lets it escape a pass: the failure is caught, recorded as an
 * {@link io.github.cyfko.formstate.core.evaluation.ExpressionError} against the node and the
 * expression kind, and the kind's default applies.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ExpressionEvaluationException extends RuntimeException {

    /**
     * @param message explanation of the failure
     */
    public ExpressionEvaluationException(String message) {
        super(message);
    }

    /**
     * @param message explanation of the failure
     * @param cause   underlying exception
     */
    public ExpressionEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
