package org.nf.expression;

/**
 * LETTERALE - Termine con polarità
 *
 * Un letterale positivo corrisponde al termine stesso, uno negativo alla sua
 * negazione diretta. Due letterali sono complementari se condividono il nome
 * del termine e hanno polarità opposta.
 *
 * ORDINAMENTO: per nome del termine, a parità di nome il positivo precede il negativo.
 */
public final class Literal implements Comparable<Literal> {

    private final String name;
    private final boolean positive;

    /**
     * @param name nome del termine (non null, non vuoto)
     * @param positive true per il termine, false per la sua negazione
     * @throws IllegalArgumentException se il nome non è valido
     */
    public Literal(String name, boolean positive) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Nome del letterale non può essere null o vuoto");
        }
        this.name = name;
        this.positive = positive;
    }

    /**
     * Estrae il letterale da un nodo TERM o NOT(TERM).
     *
     * @throws IllegalArgumentException se l'espressione non è un letterale
     */
    public static Literal fromExpression(Expression expression) {
        if (!expression.isLiteral()) {
            throw new IllegalArgumentException("Espressione non è un letterale: " + expression);
        }
        if (expression.getType() == Expression.Type.TERM) {
            return new Literal(expression.getName(), true);
        }
        return new Literal(expression.getOperand().getName(), false);
    }

    public String getName() {
        return name;
    }

    public boolean isPositive() {
        return positive;
    }

    public Literal complement() {
        return new Literal(name, !positive);
    }

    public boolean isComplementOf(Literal other) {
        return name.equals(other.name) && positive != other.positive;
    }

    public Expression toExpression() {
        Expression term = Expression.term(name);
        return positive ? term : Expression.not(term);
    }

    @Override
    public int compareTo(Literal other) {
        int byName = name.compareTo(other.name);
        if (byName != 0) {
            return byName;
        }
        return Boolean.compare(other.positive, positive);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Literal other = (Literal) obj;
        return positive == other.positive && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + (positive ? 1 : 0);
    }

    @Override
    public String toString() {
        return positive ? name : "~" + name;
    }
}
