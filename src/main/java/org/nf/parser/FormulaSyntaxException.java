package org.nf.parser;

/**
 * Errore sintattico rilevato durante l'analisi di una formula.
 *
 * Ogni errore è terminale per la conversione: una formula malformata non ha
 * una forma normale parziale significativa. La posizione è l'offset (0-based)
 * del carattere incriminato nel testo di input, oppure -1 se non nota.
 */
public class FormulaSyntaxException extends RuntimeException {

    public static final int UNKNOWN_POSITION = -1;

    private final int position;

    public FormulaSyntaxException(String message, int position) {
        super(message);
        this.position = position;
    }

    public FormulaSyntaxException(String message, int position, Throwable cause) {
        super(message, cause);
        this.position = position;
    }

    /**
     * @return offset del carattere incriminato, oppure {@link #UNKNOWN_POSITION}
     */
    public int getPosition() {
        return position;
    }

    public boolean hasPosition() {
        return position != UNKNOWN_POSITION;
    }
}
