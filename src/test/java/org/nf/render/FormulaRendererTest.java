package org.nf.render;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.nf.expression.Expression;
import org.nf.parser.FormulaParser;

import static org.junit.jupiter.api.Assertions.*;
import static org.nf.expression.Expression.and;
import static org.nf.expression.Expression.implies;
import static org.nf.expression.Expression.not;
import static org.nf.expression.Expression.or;
import static org.nf.expression.Expression.term;

@DisplayName("FormulaRenderer Tests")
class FormulaRendererTest {

    private static final Expression A = term("a");
    private static final Expression B = term("b");
    private static final Expression C = term("c");
    private static final Expression D = term("d");

    @Test
    @DisplayName("Should render atoms and constants")
    void testAtoms() {
        assertEquals("x.y", FormulaRenderer.render(term("x.y")));
        assertEquals("true", FormulaRenderer.render(Expression.TRUE));
        assertEquals("false", FormulaRenderer.render(Expression.FALSE));
    }

    @Test
    @DisplayName("Should add parentheses only where precedence requires them")
    void testMinimalParentheses() {
        assertEquals("(a || b) && c", FormulaRenderer.render(and(or(A, B), C)));
        assertEquals("a || b && c", FormulaRenderer.render(or(A, and(B, C))));
        assertEquals("a && b && c", FormulaRenderer.render(and(and(A, B), C)));
        assertEquals("a && (b && c)", FormulaRenderer.render(and(A, and(B, C))));
    }

    @Test
    @DisplayName("Should respect the right associativity of =>")
    void testImpliesAssociativity() {
        assertEquals("a => b => c", FormulaRenderer.render(implies(A, implies(B, C))));
        assertEquals("(a => b) => c", FormulaRenderer.render(implies(implies(A, B), C)));
        assertEquals("a || b => c", FormulaRenderer.render(implies(or(A, B), C)));
    }

    @Test
    @DisplayName("Should wrap binary operands of ~")
    void testNegation() {
        assertEquals("~a", FormulaRenderer.render(not(A)));
        assertEquals("~~a", FormulaRenderer.render(not(not(A))));
        assertEquals("~(a && b)", FormulaRenderer.render(not(and(A, B))));
        assertEquals("~a && ~(b || c)", FormulaRenderer.render(and(not(A), not(or(B, C)))));
    }

    @Test
    @DisplayName("Should delimit every nested clause in grouped mode")
    void testGrouped() {
        assertEquals("~a || (b && c)", FormulaRenderer.renderGrouped(or(not(A), and(B, C))));
        assertEquals("(a || b) && (c || d)", FormulaRenderer.renderGrouped(and(or(A, B), or(C, D))));
        assertEquals("a && b && c", FormulaRenderer.renderGrouped(and(and(A, B), C)));
        assertEquals("a => (b && c)", FormulaRenderer.renderGrouped(implies(A, and(B, C))));
    }

    @Test
    @DisplayName("Should use toString as the minimal rendering")
    void testToString() {
        Expression expression = or(A, and(B, C));

        assertEquals(FormulaRenderer.render(expression), expression.toString());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "a => b => c",
            "(a => b) => c",
            "a && (b && c)",
            "~(a || b) && c",
            "(a || b) && (c || ~d) || e",
            "~~(p => q) => r || s && t",
            "x.y=1 && (a&b || p|q)"
    })
    @DisplayName("Should render text that parses back to the same tree")
    void testRoundTrip(String formula) {
        Expression parsed = FormulaParser.parse(formula);

        assertEquals(parsed, FormulaParser.parse(FormulaRenderer.render(parsed)));
        assertEquals(parsed, FormulaParser.parse(FormulaRenderer.renderGrouped(parsed)));
    }
}
