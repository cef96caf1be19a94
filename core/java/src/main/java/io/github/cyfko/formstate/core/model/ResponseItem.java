package io.github.cyfko.formstate.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Response to one item in a {@link ResponseDocument}.
 *
 * @param linkId  link id of the answered item
 * @param answers answers, empty for groups
 * @param items   nested items of a group
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ResponseItem(String linkId, List<ResponseAnswer> answers, List<ResponseItem> items) {

    public ResponseItem {
        Objects.requireNonNull(linkId, "linkId cannot be null");
        answers = answers == null ? List.of() : List.copyOf(answers);
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static ResponseItem answered(String linkId, Object... values) {
        return new ResponseItem(linkId, Arrays.stream(values).map(ResponseAnswer::of).toList(), List.of());
    }

    public static ResponseItem group(String linkId, ResponseItem... items) {
        return new ResponseItem(linkId, List.of(), List.of(items));
    }
}
