package org.nf.parser;

import org.antlr.v4.runtime.CommonToken;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ListTokenSource;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.nf.antlr.LogicFormulaParser;
import org.nf.expression.Expression;
import org.nf.parser.FormulaParseException.Reason;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;

/**
 * PARSER FORMULE LOGICHE - Da sequenza di token ad albero {@link Expression}
 *
 * Grammatica (dalla precedenza più debole alla più forte):
 * <pre>
 * implication : disjunction ('=>' implication)?     associativa a destra
 * disjunction : conjunction ('||' conjunction)*      associativa a sinistra
 * conjunction : negation ('&&' negation)*            associativa a sinistra
 * negation    : '~' negation | atom
 * atom        : '(' implication ')' | TERM
 * </pre>
 *
 * PIPELINE:
 * 1. Validazione strutturale della sequenza di token, con motivo e posizione precisi
 *    per parentesi non bilanciate, operandi mancanti e operatori mancanti
 * 2. Parsing ANTLR sui token già prodotti (nessuna seconda scansione del testo)
 * 3. Visita dell'albero sintattico con {@link ExpressionBuilder}
 */
public final class FormulaParser {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    private FormulaParser() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region INTERFACCIA PUBBLICA

    /**
     * Analizza il testo di una formula.
     *
     * @throws FormulaLexException se il testo è vuoto
     * @throws FormulaParseException se la formula è malformata
     */
    public static Expression parse(String input) {
        return parse(FormulaTokenizer.tokenize(input));
    }

    /**
     * Costruisce l'albero dell'espressione da una sequenza di token.
     *
     * @param tokens token prodotti da {@link FormulaTokenizer#tokenize(String)}
     * @return albero grezzo, implicazioni comprese
     * @throws FormulaParseException se la sequenza non è una formula ben formata
     */
    public static Expression parse(List<FormulaToken> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            throw new FormulaParseException(Reason.EMPTY_EXPRESSION, 0, "Espressione vuota");
        }

        validate(tokens);

        LogicFormulaParser parser = new LogicFormulaParser(
                new CommonTokenStream(new ListTokenSource(toAntlrTokens(tokens))));
        parser.removeErrorListeners();
        parser.addErrorListener(SyntaxErrorListener.forParser());

        ParseTree tree = parser.formula();
        return new ExpressionBuilder().visit(tree);
    }

    //endregion

    //region VALIDAZIONE STRUTTURALE

    /**
     * Verifica l'alternanza operando/operatore e il bilanciamento delle parentesi.
     *
     * REGOLE:
     * • All'inizio, dopo un operatore binario, dopo '~' e dopo '(' serve un operando
     *   (un termine, '~' oppure '(')
     * • Dopo un termine o ')' serve un operatore binario, ')' oppure la fine
     * • Ogni ')' chiude una '(' aperta e ogni '(' viene chiusa
     */
    private static void validate(List<FormulaToken> tokens) {
        Deque<FormulaToken> openParentheses = new ArrayDeque<>();
        boolean expectOperand = true;

        for (FormulaToken token : tokens) {
            FormulaToken.Kind kind = token.getKind();

            if (expectOperand) {
                switch (kind) {
                    case TERM -> expectOperand = false;
                    case NOT -> { /* resta in attesa di un operando */ }
                    case LPAREN -> openParentheses.push(token);
                    case RPAREN -> {
                        if (openParentheses.isEmpty()) {
                            throw unbalanced(token, "')' senza '(' corrispondente");
                        }
                        throw new FormulaParseException(Reason.MISSING_OPERAND, token.getPosition(),
                                "Operando mancante prima di ')'");
                    }
                    case AND, OR, IMPLIES -> throw new FormulaParseException(Reason.MISSING_OPERAND,
                            token.getPosition(), "Operando mancante prima di '" + token.getText() + "'");
                }
            } else {
                switch (kind) {
                    case AND, OR, IMPLIES -> expectOperand = true;
                    case RPAREN -> {
                        if (openParentheses.isEmpty()) {
                            throw unbalanced(token, "')' senza '(' corrispondente");
                        }
                        openParentheses.pop();
                    }
                    case TERM, NOT, LPAREN -> throw new FormulaParseException(Reason.MISSING_OPERATOR,
                            token.getPosition(), "Operatore mancante prima di '" + token.getText() + "'");
                }
            }
        }

        if (expectOperand) {
            FormulaToken last = tokens.get(tokens.size() - 1);
            throw new FormulaParseException(Reason.MISSING_OPERAND, last.getEndPosition(),
                    "Operando mancante dopo '" + last.getText() + "'");
        }
        if (!openParentheses.isEmpty()) {
            throw unbalanced(openParentheses.peek(), "'(' senza ')' corrispondente");
        }

        LOGGER.finest("Sequenza di " + tokens.size() + " token valida");
    }

    private static FormulaParseException unbalanced(FormulaToken token, String message) {
        return new FormulaParseException(Reason.UNBALANCED_PARENTHESES, token.getPosition(),
                "Parentesi non bilanciate: " + message);
    }

    //endregion

    //region CONVERSIONE TOKEN ANTLR

    private static List<Token> toAntlrTokens(List<FormulaToken> tokens) {
        List<Token> antlrTokens = new ArrayList<>(tokens.size());
        for (int i = 0; i < tokens.size(); i++) {
            FormulaToken token = tokens.get(i);
            CommonToken antlrToken = new CommonToken(token.getKind().antlrType(), token.getText());
            antlrToken.setStartIndex(token.getPosition());
            antlrToken.setStopIndex(token.getEndPosition() - 1);
            antlrToken.setLine(1);
            antlrToken.setCharPositionInLine(token.getPosition());
            antlrToken.setTokenIndex(i);
            antlrTokens.add(antlrToken);
        }
        return antlrTokens;
    }

    //endregion
}
