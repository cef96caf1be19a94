package io.github.cyfko.formstate.core.config;

/**
 * Which pages of a paginated form the user may jump to.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum NavigationPolicy {
    /**
     * A page is reachable only when no enabled page before it holds an invalid answer.
     * Going back is always allowed.
     */
    LINEAR,
    /**
     * Any enabled page is reachable at any time.
     */
    NON_LINEAR
}
