package org.nf.parser;

/**
 * Errore di analisi sintattica con posizione e motivo classificato.
 */
public class FormulaParseException extends FormulaSyntaxException {

    /**
     * Motivi di rifiuto di una sequenza di token.
     */
    public enum Reason {
        EMPTY_EXPRESSION,
        UNBALANCED_PARENTHESES,
        MISSING_OPERAND,
        MISSING_OPERATOR,
        TRAILING_TOKENS,
        SYNTAX
    }

    private final Reason reason;

    public FormulaParseException(Reason reason, int position, String message) {
        super(message, position);
        this.reason = reason;
    }

    public FormulaParseException(Reason reason, int position, String message, Throwable cause) {
        super(message, position, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
