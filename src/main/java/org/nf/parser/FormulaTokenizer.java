package org.nf.parser;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.Token;
import org.nf.antlr.LogicFormulaLexer;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * TOKENIZER - Scansione del testo di una formula in token
 *
 * Usa il lexer generato dalla grammatica LogicFormula. I sei simboli riservati
 * ({@code &&}, {@code ||}, {@code ~}, {@code (}, {@code )}, {@code =>}) vengono
 * riconosciuti con la corrispondenza più lunga in ogni posizione; ogni sequenza
 * massimale di caratteri che non sono spazi e non aprono un simbolo diventa un
 * termine, letteralmente. Gli spazi separano i token e vengono scartati.
 *
 * ESEMPI:
 * • "a && b"   → TERM(a) AND TERM(b)
 * • "a&&b"     → TERM(a) AND TERM(b)
 * • "a&b"      → TERM(a&b)
 * • "x=>~y"    → TERM(x) IMPLIES NOT TERM(y)
 */
public final class FormulaTokenizer {

    private static final Logger LOGGER = Logger.getLogger(FormulaTokenizer.class.getName());

    private FormulaTokenizer() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Suddivide il testo in token.
     *
     * @param input testo della formula
     * @return sequenza non vuota di token, in ordine di apparizione
     * @throws FormulaLexException se l'input è vuoto o contiene caratteri non classificabili
     */
    public static List<FormulaToken> tokenize(String input) {
        if (input == null || input.isBlank()) {
            throw new FormulaLexException("Formula vuota", 0);
        }

        LogicFormulaLexer lexer = new LogicFormulaLexer(CharStreams.fromString(input));
        lexer.removeErrorListeners();
        lexer.addErrorListener(SyntaxErrorListener.forLexer());

        List<FormulaToken> tokens = new ArrayList<>();
        for (Token token : lexer.getAllTokens()) {
            FormulaToken.Kind kind = FormulaToken.Kind.fromAntlrType(token.getType());
            tokens.add(new FormulaToken(kind, token.getText(), token.getStartIndex()));
        }

        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest("Token riconosciuti: " + tokens);
        }
        return tokens;
    }
}
