package io.github.cyfko.formstate.core.dependency;

import java.util.Objects;

/**
 * Something an expression reads: the answers of an item or the value of a variable.
 *
 * @param type what is read
 * @param name link id or variable name
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Reference(Type type, String name) {

    public enum Type {
        /** Answers of the item with this link id. */
        ANSWER,
        /** A named variable. */
        VARIABLE
    }

    public Reference {
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(name, "name cannot be null");
    }

    public static Reference answer(String linkId) {
        return new Reference(Type.ANSWER, linkId);
    }

    public static Reference variable(String name) {
        return new Reference(Type.VARIABLE, name);
    }
}
