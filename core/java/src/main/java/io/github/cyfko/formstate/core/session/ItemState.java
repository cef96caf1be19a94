package io.github.cyfko.formstate.core.session;

import io.github.cyfko.formstate.core.model.LinkIdPath;

import java.util.List;
import java.util.Objects;

/**
 * Evaluated state of one response node.
 *
 * @param path    path of the node
 * @param linkId  link id of its item
 * @param enabled whether the node is shown and counts for validation and submission
 * @param touched whether the user edited it
 * @param answers current answer values
 * @param options options currently offered, empty for non-choice items
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ItemState(LinkIdPath path, String linkId, boolean enabled, boolean touched,
                        List<Object> answers, List<Object> options) {

    public ItemState {
        Objects.requireNonNull(path, "path cannot be null");
        answers = List.copyOf(answers);
        options = List.copyOf(options);
    }
}
