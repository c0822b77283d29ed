package org.nf.transform;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.nf.expression.Expression;
import org.nf.parser.FormulaParser;
import org.nf.support.TruthTable;

import static org.junit.jupiter.api.Assertions.*;
import static org.nf.expression.Expression.and;
import static org.nf.expression.Expression.not;
import static org.nf.expression.Expression.or;
import static org.nf.expression.Expression.term;

/**
 * Verifica le regole di De Morgan, la doppia negazione e l'eliminazione delle implicazioni.
 */
@DisplayName("NegationNormalizer Tests")
class NegationNormalizerTest {

    private static final Expression A = term("a");
    private static final Expression B = term("b");
    private static final Expression C = term("c");

    private static Expression nnf(String formula) {
        return NegationNormalizer.toNNF(FormulaParser.parse(formula));
    }

    @Test
    @DisplayName("Should rewrite a => b as ~a || b")
    void testImplicationElimination() {
        assertEquals(or(not(A), B), nnf("a => b"));
    }

    @Test
    @DisplayName("Should apply De Morgan to a negated conjunction")
    void testDeMorganAnd() {
        assertEquals(or(not(A), not(B)), nnf("~(a && b)"));
    }

    @Test
    @DisplayName("Should apply De Morgan to a negated disjunction")
    void testDeMorganOr() {
        assertEquals(and(not(A), B), nnf("~(a || ~b)"));
    }

    @Test
    @DisplayName("Should rewrite ~(a => b) as a && ~b")
    void testNegatedImplication() {
        assertEquals(and(A, not(B)), nnf("~(a => b)"));
        assertEquals(and(A, and(not(B), C)), nnf("~(a => (b || ~c))"));
    }

    @Test
    @DisplayName("Should eliminate double negations")
    void testDoubleNegation() {
        assertEquals(A, nnf("~~a"));
        assertEquals(not(A), nnf("~~~a"));
    }

    @Test
    @DisplayName("Should leave negated terms unchanged")
    void testNegatedTermUnchanged() {
        assertEquals(not(A), nnf("~a"));
        assertEquals(and(not(A), or(B, not(C))), nnf("~a && (b || ~c)"));
    }

    @Test
    @DisplayName("Should flip negated constants")
    void testNegatedConstants() {
        assertEquals(Expression.FALSE, NegationNormalizer.toNNF(not(Expression.TRUE)));
        assertEquals(Expression.TRUE, NegationNormalizer.toNNF(not(not(Expression.TRUE))));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "a => b => c",
            "~(a && (b => ~c))",
            "~((a || b) && ~(c => a))",
            "(p => q) => ~(r || ~s)",
            "~~(x && ~~y) || ~(z => w)"
    })
    @DisplayName("Should produce an equivalent formula in negation normal form")
    void testEquivalentNegationNormalForm(String formula) {
        Expression parsed = FormulaParser.parse(formula);
        Expression result = NegationNormalizer.toNNF(parsed);

        assertTrue(result.isNegationNormalForm(), () -> "Non in NNF: " + result);
        TruthTable.assertEquivalent(parsed, result);
    }
}
