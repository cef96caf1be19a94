package io.github.cyfko.formstate.core.exception;

/**
 * Exception thrown when a mutation addresses the response tree in a way the definition does not
 * allow.
 * <p>
 * Typical causes are a path that resolves to no node, an instance index out of range, adding an
 * instance to an item that is not a repeated group, or answering a group or display item.
 * Response data that merely has no counterpart in the definition is not an error: it is discarded
 * and reported as a {@link io.github.cyfko.formstate.core.sync.SyncIssue}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class SynchronizationException extends RuntimeException {

    public SynchronizationException(String message) {
        super(message);
    }

    public SynchronizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
