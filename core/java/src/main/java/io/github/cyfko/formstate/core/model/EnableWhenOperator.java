package io.github.cyfko.formstate.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Comparison operator of a declarative {@link EnableWhen} condition.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum EnableWhenOperator {
    EXISTS("exists"),
    EQUAL("="),
    NOT_EQUAL("!="),
    GREATER_THAN(">"),
    LESS_THAN("<"),
    GREATER_OR_EQUAL(">="),
    LESS_OR_EQUAL("<=");

    private final String symbol;

    EnableWhenOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Looks an operator up by its symbol, e.g. {@code ">="}.
     *
     * @param symbol the symbol, surrounding whitespace ignored
     * @return the operator if the symbol is known
     */
    public static Optional<EnableWhenOperator> fromSymbol(String symbol) {
        if (symbol == null) return Optional.empty();
        String trimmed = symbol.trim();
        return Arrays.stream(values()).filter(op -> op.symbol.equalsIgnoreCase(trimmed)).findFirst();
    }
}
