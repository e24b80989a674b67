package de.bsommerfeld.modelstore.db;

/**
 * Comparison operators accepted by predicate-scoped row operations. Keeping
 * them closed means operator text never comes from a caller-supplied string.
 * {@link #ALL} is the wildcard: column and value are ignored and the whole
 * table matches.
 */
public enum Operator {

    EQ("="),
    NE("<>"),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    LIKE("LIKE"),
    ALL("*");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isWildcard() {
        return this == ALL;
    }

    /**
     * Resolves an operator from its SQL symbol ({@code "="}, {@code ">"},
     * {@code "like"}, {@code "*"}, ...). {@code null} and blank resolve to
     * {@link #EQ}; {@code "!="} is accepted as {@link #NE}.
     *
     * @throws IllegalArgumentException for unknown symbols
     */
    public static Operator fromSymbol(String symbol) {
        if (symbol == null || symbol.isBlank())
            return EQ;
        String s = symbol.trim();
        if ("!=".equals(s))
            return NE;
        for (Operator op : values()) {
            if (op.symbol.equalsIgnoreCase(s))
                return op;
        }
        throw new IllegalArgumentException("Unsupported operator: " + symbol);
    }
}
