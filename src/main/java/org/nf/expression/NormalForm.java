package org.nf.expression;

/**
 * Forme normali di destinazione.
 *
 * Ogni forma è descritta dal connettivo esterno (che unisce le clausole) e da quello
 * interno (che unisce i letterali di una clausola). La congiunzione vuota è vera,
 * la disgiunzione vuota è falsa.
 */
public enum NormalForm {

    /** Forma Normale Congiuntiva: AND di OR di letterali */
    CNF(Expression.Type.AND, Expression.Type.OR),

    /** Forma Normale Disgiuntiva: OR di AND di letterali */
    DNF(Expression.Type.OR, Expression.Type.AND);

    private final Expression.Type outer;
    private final Expression.Type inner;

    NormalForm(Expression.Type outer, Expression.Type inner) {
        this.outer = outer;
        this.inner = inner;
    }

    public Expression.Type outer() {
        return outer;
    }

    public Expression.Type inner() {
        return inner;
    }

    /**
     * Valore dell'insieme vuoto di clausole: TRUE per CNF, FALSE per DNF.
     */
    public Expression outerNeutral() {
        return neutralOf(outer);
    }

    /**
     * Valore che assorbe l'intera formula: FALSE per CNF, TRUE per DNF.
     */
    public Expression outerAbsorbing() {
        return neutralOf(inner);
    }

    /**
     * Costante che, comparendo in una clausola, la rende banale
     * (TRUE dentro una disgiunzione, FALSE dentro una congiunzione).
     */
    public Expression innerAbsorbing() {
        return neutralOf(outer);
    }

    /**
     * Costante che, comparendo in una clausola, può essere rimossa.
     */
    public Expression innerNeutral() {
        return neutralOf(inner);
    }

    private static Expression neutralOf(Expression.Type connective) {
        return connective == Expression.Type.AND ? Expression.TRUE : Expression.FALSE;
    }
}
