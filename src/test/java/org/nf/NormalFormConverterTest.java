package org.nf;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.nf.expression.Clause;
import org.nf.expression.Expression;
import org.nf.expression.Literal;
import org.nf.expression.NormalForm;
import org.nf.parser.FormulaParseException;
import org.nf.parser.FormulaParser;
import org.nf.support.TruthTable;
import org.nf.transform.ClauseSimplifier;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NormalFormConverter Tests")
class NormalFormConverterTest {

    private final NormalFormConverter converter = new NormalFormConverter();

    @Nested
    @DisplayName("Text conversion")
    class ScenarioTests {

        @ParameterizedTest(name = "[{index}] {0} -> {1}")
        @CsvSource(delimiterString = "::", value = {
                "a => b && c :: (~a || b) && (~a || c)",
                "a => b && ~c :: (~a || b) && (~a || ~c)",
                "a && a :: a",
                "a && ~a :: false",
                "a || ~a :: true",
                "~(a => b) :: a && ~b",
                "(a && b) || (c && d) :: (a || c) && (a || d) && (b || c) && (b || d)",
                "b || a || b :: a || b",
                "~~Rain :: Rain"
        })
        @DisplayName("Should convert to CNF")
        void testCnf(String input, String expected) {
            assertEquals(expected, converter.convert(input, NormalForm.CNF));
        }

        @ParameterizedTest(name = "[{index}] {0} -> {1}")
        @CsvSource(delimiterString = "::", value = {
                "a => b && c :: ~a || (b && c)",
                "a && ~a :: false",
                "a || ~a :: true",
                "(a || b) && c :: (a && c) || (b && c)",
                "~(a || b) :: ~a && ~b"
        })
        @DisplayName("Should convert to DNF")
        void testDnf(String input, String expected) {
            assertEquals(expected, converter.convert(input, NormalForm.DNF));
        }

        @Test
        @DisplayName("Should drop subsumed clauses only when requested")
        void testSubsumption() {
            assertEquals("a && (a || b)", converter.convert("a && (a || b)", NormalForm.CNF));
            assertEquals("a", new NormalFormConverter(true).convert("a && (a || b)", NormalForm.CNF));
            assertTrue(new NormalFormConverter(true).isUsingSubsumption());
            assertFalse(converter.isUsingSubsumption());
        }

        @Test
        @DisplayName("Should propagate syntax errors with their position")
        void testSyntaxError() {
            FormulaParseException exception = assertThrows(FormulaParseException.class,
                    () -> converter.convert("a &&", NormalForm.CNF));

            assertEquals(FormulaParseException.Reason.MISSING_OPERAND, exception.getReason());
            assertEquals(4, exception.getPosition());
        }
    }

    @Nested
    @DisplayName("Properties of the result")
    class PropertyTests {

        @ParameterizedTest
        @ValueSource(strings = {
                "a => b && c",
                "~(a && b) => (c || ~d)",
                "(a => b) && (b => c) && (c => a)",
                "~((p || q) && ~(r => s))",
                "(x && y) || (~x && z) || (y && ~z)",
                "a => b => c => d",
                "(a || b) && (a || ~b) && (~a || c)"
        })
        @DisplayName("Should produce an equivalent, clean and stable two-level formula")
        void testProperties(String formula) {
            Expression parsed = FormulaParser.parse(formula);

            for (NormalForm form : NormalForm.values()) {
                for (boolean subsumption : new boolean[]{false, true}) {
                    NormalFormConverter current = new NormalFormConverter(subsumption);
                    Expression result = current.convert(parsed, form);

                    TruthTable.assertEquivalent(parsed, result);
                    assertTrue(ClauseSimplifier.isTwoLevel(result, form));
                    assertNoComplementaryClause(result, form);
                    assertEquals(result, current.convert(result, form));
                    if (!result.isConstant()) {
                        assertEquals(result, FormulaParser.parse(current.convert(formula, form)));
                    }
                }
            }
        }

        private void assertNoComplementaryClause(Expression result, NormalForm form) {
            for (Expression clause : split(result, form.outer())) {
                if (clause.isConstant()) {
                    continue;
                }
                List<Literal> literals = new ArrayList<>();
                for (Expression leaf : split(clause, form.inner())) {
                    literals.add(Literal.fromExpression(leaf));
                }
                assertFalse(new Clause(literals).isComplementary(), () -> "Clausola complementare: " + clause);
            }
        }

        private List<Expression> split(Expression expression, Expression.Type connective) {
            List<Expression> parts = new ArrayList<>();
            if (expression.getType() == connective) {
                parts.addAll(split(expression.getLeft(), connective));
                parts.addAll(split(expression.getRight(), connective));
            } else {
                parts.add(expression);
            }
            return parts;
        }
    }
}
