package io.github.cyfko.formstate.core.model;

import java.util.Objects;

/**
 * Opaque expression handed to the configured {@link io.github.cyfko.formstate.core.spi.ExpressionEvaluator}.
 * <p>
 * The engine never interprets the text itself. It only scans it for references to other items
 * and variables (see {@link io.github.cyfko.formstate.core.dependency.ReferenceScanner}).
 * </p>
 *
 * @param name       variable name, required for variables and ignored elsewhere
 * @param language   language tag of the expression, e.g. {@code text/fhirpath}
 * @param expression expression text
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Expression(String name, String language, String expression) {

    public static final String DEFAULT_LANGUAGE = "text/fhirpath";

    public Expression {
        Objects.requireNonNull(expression, "expression cannot be null");
        if (language == null || language.isBlank()) {
            language = DEFAULT_LANGUAGE;
        }
    }

    /**
     * Creates an unnamed expression in the default language.
     */
    public static Expression of(String expression) {
        return new Expression(null, DEFAULT_LANGUAGE, expression);
    }

    /**
     * Creates a named expression in the default language, as used for variables.
     */
    public static Expression variable(String name, String expression) {
        return new Expression(name, DEFAULT_LANGUAGE, expression);
    }

    public boolean isNamed() {
        return name != null && !name.isBlank();
    }
}
