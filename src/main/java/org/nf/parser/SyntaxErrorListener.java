package org.nf.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.LexerNoViableAltException;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.nf.antlr.LogicFormulaParser;

import java.util.logging.Logger;

/**
 * Listener ANTLR che trasforma il primo errore segnalato in un'eccezione.
 *
 * Sostituisce il listener di default (che stampa su console e lascia proseguire
 * il recupero degli errori): la conversione si interrompe al primo errore.
 */
final class SyntaxErrorListener extends BaseErrorListener {

    private static final Logger LOGGER = Logger.getLogger(SyntaxErrorListener.class.getName());

    private final boolean lexical;

    private SyntaxErrorListener(boolean lexical) {
        this.lexical = lexical;
    }

    static SyntaxErrorListener forLexer() {
        return new SyntaxErrorListener(true);
    }

    static SyntaxErrorListener forParser() {
        return new SyntaxErrorListener(false);
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                            int line, int charPositionInLine, String msg, RecognitionException e) {
        LOGGER.fine(String.format("Errore %s segnalato da ANTLR [%d:%d]: %s",
                lexical ? "lessicale" : "sintattico", line, charPositionInLine, msg));

        if (lexical) {
            int position = e instanceof LexerNoViableAltException
                    ? ((LexerNoViableAltException) e).getStartIndex()
                    : charPositionInLine;
            throw new FormulaLexException("Carattere non riconosciuto: " + msg, position);
        }

        int position = offendingSymbol instanceof Token
                ? ((Token) offendingSymbol).getStartIndex()
                : FormulaSyntaxException.UNKNOWN_POSITION;

        throw new FormulaParseException(classify(recognizer, offendingSymbol), position,
                "Sintassi non valida: " + msg, e);
    }

    /**
     * Un token diverso da EOF rifiutato al livello della regola radice è un avanzo
     * dopo un'espressione completa.
     */
    private static FormulaParseException.Reason classify(Recognizer<?, ?> recognizer, Object offendingSymbol) {
        if (recognizer instanceof Parser
                && offendingSymbol instanceof Token
                && ((Token) offendingSymbol).getType() != Token.EOF
                && ((Parser) recognizer).getContext() instanceof LogicFormulaParser.FormulaContext) {
            return FormulaParseException.Reason.TRAILING_TOKENS;
        }
        return FormulaParseException.Reason.SYNTAX;
    }
}
