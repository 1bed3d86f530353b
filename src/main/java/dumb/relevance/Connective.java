package dumb.relevance;

public enum Connective {
    AND("∧", 2),
    OR("∨", 2),
    NOT("¬", 1),
    IMPLIES("→", 2),
    IFF("↔", 2),
    TIMES("⊗", 2),
    LOLLIPOP("⊸", 2),
    PAR("⅋", 2),
    ONE("I", 0),
    BOTTOM("⊥", 0),
    FORALL("∀", 1),
    EXISTS("∃", 1);

    public final String symbol;
    public final int arity;

    Connective(String symbol, int arity) {
        this.symbol = symbol;
        this.arity = arity;
    }

    public boolean quantifier() {
        return this == FORALL || this == EXISTS;
    }

    /** Relevant or linear implication, the two connectives modus ponens fires on. */
    public boolean implication() {
        return this == IMPLIES || this == LOLLIPOP;
    }

    public boolean multiplicative() {
        return this == TIMES || this == LOLLIPOP || this == PAR || this == ONE || this == BOTTOM;
    }
}
