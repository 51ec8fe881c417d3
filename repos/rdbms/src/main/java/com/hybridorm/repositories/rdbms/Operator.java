package com.hybridorm.repositories.rdbms;

import java.util.Locale;

public enum Operator {
    EQ("="),
    NE("!="),
    GT(">"),
    GTE(">="),
    LT("<"),
    LTE("<="),
    LIKE("LIKE"),
    IS_NULL("IS NULL"),
    IS_NOT_NULL("IS NOT NULL");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Null checks compile without a placeholder.
     */
    public boolean takesValue() {
        return this != IS_NULL && this != IS_NOT_NULL;
    }

    /**
     * Parses a comparison symbol. {@code <>} is accepted as {@link #NE}; keywords are
     * case-insensitive.
     *
     * @throws IllegalArgumentException for anything else
     */
    public static Operator fromSymbol(String symbol) {
        if (symbol == null) {
            throw new IllegalArgumentException("Operator must not be null");
        }
        String normalized = symbol.trim().toUpperCase(Locale.ROOT).replaceAll("\\s+", " ");
        if (normalized.equals("<>")) {
            return NE;
        }
        for (Operator operator : values()) {
            if (operator.symbol.equals(normalized)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unsupported where operator: " + symbol);
    }
}
