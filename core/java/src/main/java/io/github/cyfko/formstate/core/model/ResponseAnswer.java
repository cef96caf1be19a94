package io.github.cyfko.formstate.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Answer in a {@link ResponseDocument}.
 *
 * @param value      answer value
 * @param userEdited whether the value was entered manually over a calculated one
 * @param items      items nested under this answer
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ResponseAnswer(Object value, boolean userEdited, List<ResponseItem> items) {

    public ResponseAnswer {
        Objects.requireNonNull(value, "value cannot be null");
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static ResponseAnswer of(Object value) {
        return new ResponseAnswer(value, false, List.of());
    }
}
