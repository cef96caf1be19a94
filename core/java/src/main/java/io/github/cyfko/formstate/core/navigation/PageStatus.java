package io.github.cyfko.formstate.core.navigation;

/**
 * State of one page of a paginated form.
 *
 * @param index   page index among the top-level items
 * @param linkId  link id of the page group
 * @param enabled whether the page is shown
 * @param valid   false when a node on the page failed validation
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record PageStatus(int index, String linkId, boolean enabled, boolean valid) {
}
