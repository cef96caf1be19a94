package io.github.cyfko.formstate.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Immutable, serializable form of a response, used to resume a session and to hand the result
 * of a session over. Repeated groups appear as several items sharing a link id.
 *
 * @param formId id of the answered form
 * @param items  top-level items
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ResponseDocument(String formId, List<ResponseItem> items) {

    public ResponseDocument {
        Objects.requireNonNull(formId, "formId cannot be null");
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static ResponseDocument empty(String formId) {
        return new ResponseDocument(formId, List.of());
    }
}
