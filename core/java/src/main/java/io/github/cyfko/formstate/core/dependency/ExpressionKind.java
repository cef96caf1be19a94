package io.github.cyfko.formstate.core.dependency;

/**
 * Kind of expression node in the dependency graph.
 * <p>
 * The declaration order is the tie-break priority when the graph leaves several nodes of one item
 * free to run: variables first, then the initial value, the enable condition, the calculated value,
 * the option set and finally the option toggles.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum ExpressionKind {
    VARIABLE,
    INITIAL,
    ENABLE_WHEN,
    CALCULATED,
    ANSWER_OPTIONS,
    ANSWER_OPTIONS_TOGGLE,
    /** Not part of the graph: constraints are evaluated by the validator once a pass is done. */
    CONSTRAINT;

    /**
     * @return true for kinds whose evaluation may change the answers of their item
     */
    public boolean producesAnswers() {
        return this == INITIAL || this == CALCULATED || this == ANSWER_OPTIONS || this == ANSWER_OPTIONS_TOGGLE;
    }
}
