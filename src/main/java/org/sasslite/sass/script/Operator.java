package org.sasslite.sass.script;

/**
 * Script operators, keyed by their source symbol.
 */
public enum Operator {
    OR("or"),
    AND("and"),
    NOT("not"),
    EQUALS("=="),
    NOT_EQUALS("!="),
    LESS_THAN("<"),
    LESS_THAN_EQ("<="),
    GREATER_THAN(">"),
    GREATER_THAN_EQ(">="),
    PLUS("+"),
    MINUS("-"),
    TIMES("*"),
    DIV("/"),
    MOD("%");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static Operator fromSymbol(String symbol) {
        for (Operator op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown operator: " + symbol);
    }
}
