package io.github.cyfko.formstate.core.sync;

import java.util.Objects;

/**
 * Response data discarded while synchronizing a response tree with its definition.
 *
 * @param kind     what was wrong
 * @param location where it was found, as a link id path ({@code <root>} at the top level)
 * @param linkId   link id of the discarded node, or of the node whose answers were discarded
 * @param message  description
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record SyncIssue(Kind kind, String location, String linkId, String message) {

    public enum Kind {
        /** A node whose link id matches no item at its position. */
        ORPHAN,
        /** An extra node for an item that does not repeat. */
        DUPLICATE,
        /** Answers on a group or display item. */
        UNEXPECTED_ANSWER,
        /** Nested nodes where the definition allows none. */
        UNEXPECTED_CHILD
    }

    public SyncIssue {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(location, "location cannot be null");
    }
}
