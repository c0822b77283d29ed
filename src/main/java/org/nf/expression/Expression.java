package org.nf.expression;

import org.nf.render.FormulaRenderer;

import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * ESPRESSIONE LOGICA - Albero immutabile di una formula proposizionale
 *
 * Rappresenta una formula come albero di nodi tipizzati. Ogni nodo possiede in modo
 * esclusivo i propri figli e non viene mai modificato: ogni passo di trasformazione
 * (normalizzazione, distribuzione, semplificazione) costruisce un nuovo albero.
 *
 * NODI SUPPORTATI:
 * • TERM: proposizione atomica identificata dal suo testo esatto (case-sensitive)
 * • NOT: negazione di un operando
 * • AND, OR: connettivi binari
 * • IMPLIES: implicazione, presente solo nell'albero prodotto dal parser
 * • TRUE, FALSE: costanti prodotte dal collasso in fase di semplificazione
 *
 * L'uguaglianza è strutturale e sensibile all'ordine degli operandi.
 */
public final class Expression {

    //region TIPI E STRUTTURA DATI

    /**
     * Tipi di nodi dell'albero.
     */
    public enum Type {
        TERM,
        NOT,
        AND,
        OR,
        IMPLIES,
        TRUE,
        FALSE
    }

    /** Costante vera (elemento neutro della congiunzione) */
    public static final Expression TRUE = new Expression(Type.TRUE, null, null, null);

    /** Costante falsa (elemento neutro della disgiunzione) */
    public static final Expression FALSE = new Expression(Type.FALSE, null, null, null);

    private final Type type;

    /** Nome del termine (solo per nodi TERM) */
    private final String name;

    /** Operando sinistro, oppure unico operando per i nodi NOT */
    private final Expression left;

    /** Operando destro (solo per nodi binari) */
    private final Expression right;

    //endregion

    //region COSTRUZIONE

    private Expression(Type type, String name, Expression left, Expression right) {
        this.type = type;
        this.name = name;
        this.left = left;
        this.right = right;
    }

    /**
     * Costruisce un termine atomico.
     *
     * @param name testo del termine (non null, non vuoto)
     * @throws IllegalArgumentException se il nome non è valido
     */
    public static Expression term(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Nome del termine non può essere null o vuoto");
        }
        return new Expression(Type.TERM, name, null, null);
    }

    public static Expression not(Expression operand) {
        return new Expression(Type.NOT, null, requireOperand(operand, "NOT"), null);
    }

    public static Expression and(Expression left, Expression right) {
        return binary(Type.AND, left, right);
    }

    public static Expression or(Expression left, Expression right) {
        return binary(Type.OR, left, right);
    }

    public static Expression implies(Expression left, Expression right) {
        return binary(Type.IMPLIES, left, right);
    }

    /**
     * Costruisce un nodo binario del tipo indicato.
     *
     * @param type AND, OR oppure IMPLIES
     * @throws IllegalArgumentException se il tipo non è binario o un operando è null
     */
    public static Expression binary(Type type, Expression left, Expression right) {
        if (type != Type.AND && type != Type.OR && type != Type.IMPLIES) {
            throw new IllegalArgumentException("Tipo non binario: " + type);
        }
        return new Expression(type, null,
                requireOperand(left, type.name()),
                requireOperand(right, type.name()));
    }

    /**
     * Restituisce la costante corrispondente al valore booleano.
     */
    public static Expression constant(boolean value) {
        return value ? TRUE : FALSE;
    }

    private static Expression requireOperand(Expression operand, String operator) {
        if (operand == null) {
            throw new IllegalArgumentException("Operando null per operatore " + operator);
        }
        return operand;
    }

    //endregion

    //region ACCESSO

    public Type getType() {
        return type;
    }

    /**
     * @return nome del termine
     * @throws IllegalStateException se il nodo non è un TERM
     */
    public String getName() {
        if (type != Type.TERM) {
            throw new IllegalStateException("Nodo " + type + " non ha un nome");
        }
        return name;
    }

    /**
     * @return operando di un nodo NOT
     * @throws IllegalStateException se il nodo non è un NOT
     */
    public Expression getOperand() {
        if (type != Type.NOT) {
            throw new IllegalStateException("Nodo " + type + " non è una negazione");
        }
        return left;
    }

    public Expression getLeft() {
        requireBinary();
        return left;
    }

    public Expression getRight() {
        requireBinary();
        return right;
    }

    private void requireBinary() {
        if (!isBinary()) {
            throw new IllegalStateException("Nodo " + type + " non è binario");
        }
    }

    //endregion

    //region INTERROGAZIONI STRUTTURALI

    public boolean isBinary() {
        return type == Type.AND || type == Type.OR || type == Type.IMPLIES;
    }

    public boolean isConstant() {
        return type == Type.TRUE || type == Type.FALSE;
    }

    /**
     * Un letterale è un termine o la negazione diretta di un termine.
     */
    public boolean isLiteral() {
        return type == Type.TERM || (type == Type.NOT && left.type == Type.TERM);
    }

    /**
     * Verifica la forma normale negata: NOT solo su termini, nessuna implicazione.
     */
    public boolean isNegationNormalForm() {
        return switch (type) {
            case TERM, TRUE, FALSE -> true;
            case NOT -> left.type == Type.TERM;
            case AND, OR -> left.isNegationNormalForm() && right.isNegationNormalForm();
            case IMPLIES -> false;
        };
    }

    /**
     * Raccoglie i nomi dei termini presenti nella formula, in ordine alfabetico.
     */
    public Set<String> collectTermNames() {
        Set<String> names = new TreeSet<>();
        collectTermNames(names);
        return names;
    }

    private void collectTermNames(Set<String> names) {
        switch (type) {
            case TERM -> names.add(name);
            case NOT -> left.collectTermNames(names);
            case AND, OR, IMPLIES -> {
                left.collectTermNames(names);
                right.collectTermNames(names);
            }
            case TRUE, FALSE -> { /* nessun termine */ }
        }
    }

    /**
     * Calcola la profondità massima dell'albero.
     */
    public int depth() {
        return switch (type) {
            case TERM, TRUE, FALSE -> 0;
            case NOT -> 1 + left.depth();
            case AND, OR, IMPLIES -> 1 + Math.max(left.depth(), right.depth());
        };
    }

    //endregion

    //region UGUAGLIANZA E RAPPRESENTAZIONE

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Expression other = (Expression) obj;
        return type == other.type
                && Objects.equals(name, other.name)
                && Objects.equals(left, other.left)
                && Objects.equals(right, other.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, name, left, right);
    }

    /**
     * Rappresentazione testuale nella stessa sintassi accettata dal parser.
     */
    @Override
    public String toString() {
        return FormulaRenderer.render(this);
    }

    //endregion
}
