package io.github.cyfko.formstate.core.model;

import java.util.Objects;

/**
 * Coded value, typically an answer option.
 * <p>
 * Two codings denote the same concept when their system and code match; the display text is
 * ignored by {@link #sameConcept(Coding)}.
 * </p>
 *
 * @param system  code system, may be null
 * @param code    the code
 * @param display human readable text, may be null
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Coding(String system, String code, String display) {

    public Coding {
        Objects.requireNonNull(code, "code cannot be null");
    }

    public static Coding of(String code) {
        return new Coding(null, code, null);
    }

    public static Coding of(String system, String code, String display) {
        return new Coding(system, code, display);
    }

    public boolean sameConcept(Coding other) {
        return other != null && code.equals(other.code) && Objects.equals(system, other.system);
    }
}
