package io.github.cyfko.formstate.core.navigation;

/**
 * Display mode of a form session.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum FormMode {
    /** Session created, not started yet. */
    INIT,
    /** Answers can be changed. */
    EDIT,
    /** Answers are shown for review before submission. */
    REVIEW
}
