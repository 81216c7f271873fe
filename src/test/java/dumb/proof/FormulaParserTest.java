package dumb.proof;

import dumb.proof.Formula.Const;
import dumb.proof.FormulaParser.ParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FormulaParserTest extends AbstractTest {

    @ParameterizedTest
    @ValueSource(strings = {"→ ¬ A ∨ B ∧ C T", "> ~ A | B & C T", "-> ! A | B & C T", "  →¬A ∨B ∧C T  "})
    void alternativeSpellings(String text) throws ParseException {
        assertEquals(A.neg().imp(B.or(C.and(Const.TRUE))), FormulaParser.parse(text));
    }

    @Test
    void constantsAndVariables() throws ParseException {
        assertSame(Const.TRUE, FormulaParser.parse("T"));
        assertSame(Const.FALSE, FormulaParser.parse("F"));
        assertEquals(Formula.var("TA"), FormulaParser.parse("TA"));
        assertEquals(Formula.var("Foo_2"), FormulaParser.parse("Foo_2"));
    }

    @Test
    void commentsAreSkipped() throws ParseException {
        var text = """
                ; modus ponens
                → A ; antecedent
                  B
                """;
        assertEquals(A.imp(B), FormulaParser.parse(text));
    }

    @Test
    void parseAllReadsSequence() throws ParseException {
        assertEquals(List.of(A, A.imp(B), Const.FALSE), FormulaParser.parseAll("A → A B\nF"));
        assertTrue(FormulaParser.parseAll("  ; nothing here").isEmpty());
    }

    @Test
    void printedFormulaReparsesFromPolish() throws ParseException {
        var x = f("→ ∧ A ¬ B ∨ C F");
        assertEquals("((A∧¬B)→(C∨F))", x.toString());
        assertEquals(x, FormulaParser.parse("-> & A ~B | C F"));
    }

    @Test
    void lowercaseVariableIsRejected() {
        var e = assertThrows(ParseException.class, () -> FormulaParser.parse("∧ A b"));
        assertEquals(1, e.line());
        assertTrue(e.getMessage().contains("b"), e.getMessage());
    }

    @Test
    void unexpectedEnd() {
        var e = assertThrows(ParseException.class, () -> FormulaParser.parse("→ A"));
        assertTrue(e.getMessage().contains("EOF"), e.getMessage());
    }

    @Test
    void positionIsReported() {
        var e = assertThrows(ParseException.class, () -> FormulaParser.parse("∧ A\n  ( B"));
        assertEquals(2, e.line());
        assertEquals(2, e.col());
    }

    @Test
    void danglingDash() {
        assertThrows(ParseException.class, () -> FormulaParser.parse("- A B"));
    }

    @Test
    void exactlyOneFormula() {
        var e = assertThrows(ParseException.class, () -> FormulaParser.parse("A B"));
        assertTrue(e.getMessage().contains("found 2"), e.getMessage());
        assertThrows(ParseException.class, () -> FormulaParser.parse(""));
    }
}
