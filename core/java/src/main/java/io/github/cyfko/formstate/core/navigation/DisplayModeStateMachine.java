package io.github.cyfko.formstate.core.navigation;

import io.github.cyfko.formstate.core.config.FormEngineConfig;

/**
 * Transitions between display modes.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>{@link FormMode#INIT} is left once, by {@link #start()}: read-only forms and forms
 *       configured to show the review first start in {@link FormMode#REVIEW}, others in
 *       {@link FormMode#EDIT}</li>
 *   <li>{@code EDIT -> REVIEW} requires the review to be enabled</li>
 *   <li>{@code REVIEW -> EDIT} is refused for read-only forms</li>
 *   <li>Nothing leads back to {@link FormMode#INIT}</li>
 * </ul>
 * <p>
 * Refused transitions throw {@link IllegalStateException}. A transition to the current mode is a no-op.
 * Not thread-safe: sessions only touch it from their mutation queue.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class DisplayModeStateMachine {

    private final boolean reviewEnabled;
    private final boolean reviewFirst;
    private final boolean readOnly;
    private FormMode mode = FormMode.INIT;

    public DisplayModeStateMachine(boolean reviewEnabled, boolean reviewFirst, boolean readOnly) {
        this.reviewEnabled = reviewEnabled;
        this.reviewFirst = reviewFirst;
        this.readOnly = readOnly;
    }

    public static DisplayModeStateMachine from(FormEngineConfig config) {
        return new DisplayModeStateMachine(config.isReviewEnabled(), config.isReviewFirst(), config.isReadOnly());
    }

    /**
     * Leaves {@link FormMode#INIT}.
     *
     * @return the starting mode
     * @throws IllegalStateException if already started
     */
    public FormMode start() {
        if (mode != FormMode.INIT) {
            throw new IllegalStateException("Display mode already started in " + mode);
        }
        mode = readOnly || (reviewEnabled && reviewFirst) ? FormMode.REVIEW : FormMode.EDIT;
        return mode;
    }

    public FormMode getMode() {
        return mode;
    }

    public boolean canTransitionTo(FormMode target) {
        if (target == mode) return true;
        return switch (target) {
            case INIT -> false;
            case REVIEW -> mode == FormMode.EDIT && reviewEnabled;
            case EDIT -> mode == FormMode.REVIEW && !readOnly;
        };
    }

    /**
     * @throws IllegalStateException if the transition is refused
     */
    public FormMode transitionTo(FormMode target) {
        if (!canTransitionTo(target)) {
            throw new IllegalStateException("Cannot switch from " + mode + " to " + target
                    + (readOnly ? " (read-only form)" : reviewEnabled ? "" : " (review disabled)"));
        }
        mode = target;
        return mode;
    }

    public boolean isEditable() {
        return mode == FormMode.EDIT;
    }
}
