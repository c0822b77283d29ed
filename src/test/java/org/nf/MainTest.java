package org.nf;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.nf.parser.FormulaLexException;
import org.nf.parser.FormulaParseException;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Main command line Tests")
class MainTest {

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private int run(String... args) {
        return Main.run(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return out.toString(StandardCharsets.UTF_8).strip();
    }

    private String errors() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Should convert to CNF by default")
    void testDefaultCnf() {
        assertEquals(Main.EXIT_OK, run("a => b && c"));
        assertEquals("(~a || b) && (~a || c)", output());
        assertEquals("", errors());
    }

    @ParameterizedTest
    @ValueSource(strings = {"dnf", "DNF", "Dnf"})
    @DisplayName("Should accept the DNF mode in any case")
    void testDnfMode(String mode) {
        assertEquals(Main.EXIT_OK, run("a => b && c", mode));
        assertEquals("~a || (b && c)", output());
    }

    @Test
    @DisplayName("Should accept options before the formula")
    void testOptionOrder() {
        assertEquals(Main.EXIT_OK, run("-opt=s", "a && (a || b)", "cnf"));
        assertEquals("a", output());
    }

    @Test
    @DisplayName("Should report syntax errors with reason and position")
    void testSyntaxError() {
        assertEquals(Main.EXIT_SYNTAX_ERROR, run("a &&"));
        assertEquals("", output());
        assertTrue(errors().contains("MISSING_OPERAND"));
        assertTrue(errors().contains("posizione 4"));
    }

    @Test
    @DisplayName("Should report an empty formula as a lexical error")
    void testEmptyFormula() {
        assertEquals(Main.EXIT_SYNTAX_ERROR, run("  "));
        assertTrue(errors().contains("Errore lessicale"));
    }

    @Test
    @DisplayName("Should print the help page")
    void testHelp() {
        assertEquals(Main.EXIT_OK, run("a", "-h"));
        assertTrue(output().contains("UTILIZZO:"));
    }

    @Test
    @DisplayName("Should accept the verbose flag")
    void testVerbose() {
        assertEquals(Main.EXIT_OK, run("-v", "a || a"));
        assertEquals("a", output());
    }

    @Test
    @DisplayName("Should reject a missing formula")
    void testMissingFormula() {
        assertEquals(Main.EXIT_USAGE_ERROR, run());
        assertTrue(errors().contains("Nessuna formula fornita"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"xnf", "-opt=x", "-opt="})
    @DisplayName("Should reject unsupported parameters")
    void testInvalidParameters(String parameter) {
        assertEquals(Main.EXIT_USAGE_ERROR, run("a", parameter));
        assertTrue(errors().startsWith("[E] Errore nella validazione dei parametri"));
    }

    @Test
    @DisplayName("Should reject extra positional parameters")
    void testExtraParameter() {
        assertEquals(Main.EXIT_USAGE_ERROR, run("a", "cnf", "b"));
        assertTrue(errors().contains("Parametro sconosciuto: b"));
    }

    @Test
    @DisplayName("Should describe syntax errors for the user")
    void testDescribeSyntaxError() {
        assertEquals("[E] Errore di sintassi (TRAILING_TOKENS) alla posizione 3: msg",
                Main.describeSyntaxError(new FormulaParseException(FormulaParseException.Reason.TRAILING_TOKENS, 3, "msg")));
        assertEquals("[E] Errore lessicale alla posizione 0: Formula vuota",
                Main.describeSyntaxError(new FormulaLexException("Formula vuota", 0)));
    }
}
