package io.github.cyfko.formstate.core.exception;

/**
 * Exception thrown when a form definition is structurally invalid and cannot be loaded.
 * <p>
 * Raised while a {@link io.github.cyfko.formstate.core.model.FormDefinition} is built or handed to
 * {@link io.github.cyfko.formstate.core.FormEngine#load}. Loading aborts before any session exists,
 * so a session never runs against a broken definition.
 * </p>
 *
 * <p><strong>Common Failure Scenarios:</strong></p>
 * <ul>
 *   <li>Initial values declared together with initially selected answer options</li>
 *   <li>Initial values on a group or display item</li>
 *   <li>Several initial values on a non-repeating item</li>
 *   <li>Duplicate or blank link ids</li>
 *   <li>An answer options toggle listing no option, or a variable without a name</li>
 *   <li>Calculated or answer expressions on items that cannot hold answers</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * try {
 *     FormEngine engine = FormEngine.load(definition, config);
 * } catch (FormDefinitionException e) {
 *     logger.warning("Form rejected: " + e.getMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FormDefinitionException extends RuntimeException {

    /**
     * Creates a new FormDefinitionException with detailed message.
     *
     * @param message explanation of the structural problem
     */
    public FormDefinitionException(String message) {
        super(message);
    }

    /**
     * Creates a new FormDefinitionException with detailed message and cause.
     *
     * @param message explanation of the structural problem
     * @param cause   underlying exception
     */
    public FormDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
