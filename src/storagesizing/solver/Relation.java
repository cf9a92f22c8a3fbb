package storagesizing.solver;

/**
 * Знак линейного ограничения: expression (rel) rhs.
 */
public enum Relation {
    EQUAL("="),
    LESS_OR_EQUAL("<="),
    GREATER_OR_EQUAL(">=");

    private final String symbol;

    Relation(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
