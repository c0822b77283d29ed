package org.nf.parser;

/**
 * Errore di analisi lessicale: input vuoto o sequenza di caratteri non classificabile.
 */
public class FormulaLexException extends FormulaSyntaxException {

    public FormulaLexException(String message, int position) {
        super(message, position);
    }
}
