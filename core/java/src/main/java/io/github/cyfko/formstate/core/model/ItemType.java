package io.github.cyfko.formstate.core.model;

/**
 * Kind of a questionnaire item.
 * <p>
 * Groups and display items never carry answers. Every other kind is a question whose answers
 * must conform to the value class documented on the constant.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum ItemType {
    /** Container of other items. No answers. */
    GROUP,
    /** Static text. No answers. */
    DISPLAY,
    /** {@link Boolean} answers. */
    BOOLEAN,
    /** {@link java.math.BigDecimal} (or any {@link Number}) answers. */
    DECIMAL,
    /** Integral {@link Number} answers. */
    INTEGER,
    /** {@link java.time.LocalDate} answers. */
    DATE,
    /** {@link java.time.LocalDateTime} or {@link java.time.OffsetDateTime} answers. */
    DATE_TIME,
    /** {@link java.time.LocalTime} answers. */
    TIME,
    /** Single line {@link String} answers. */
    STRING,
    /** Multi line {@link String} answers. */
    TEXT,
    /** {@link String} answers holding a URL. */
    URL,
    /** {@link Coding} or {@link String} answers taken from the option list. */
    CHOICE,
    /** Like {@link #CHOICE} but free text answers are accepted too. */
    OPEN_CHOICE,
    /** {@link Attachment} answers. */
    ATTACHMENT,
    /** {@link String} answers holding a resource reference. */
    REFERENCE,
    /** {@link Quantity} answers. */
    QUANTITY;

    /**
     * @return true when items of this kind hold answers
     */
    public boolean isQuestion() {
        return this != GROUP && this != DISPLAY;
    }

    /**
     * @return true for the option based kinds
     */
    public boolean isChoice() {
        return this == CHOICE || this == OPEN_CHOICE;
    }

    /**
     * @return true for kinds whose answers are ordered (numbers, dates, times, quantities)
     */
    public boolean isOrdered() {
        return switch (this) {
            case DECIMAL, INTEGER, DATE, DATE_TIME, TIME, QUANTITY -> true;
            default -> false;
        };
    }
}
