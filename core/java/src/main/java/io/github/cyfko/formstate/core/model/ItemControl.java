package io.github.cyfko.formstate.core.model;

/**
 * Rendering hint attached to an item.
 * <p>
 * The engine only interprets {@link #PAGE} (top-level groups become pages); the other values are
 * carried through for the renderer.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum ItemControl {
    AUTO_COMPLETE,
    CHECK_BOX,
    DROP_DOWN,
    OPEN_CHOICE,
    RADIO_BUTTON,
    SLIDER,
    PHONE_NUMBER,
    PAGE,
    HELP,
    FLYOVER
}
