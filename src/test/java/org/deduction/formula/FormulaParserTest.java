package org.deduction.formula;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FormulaParserTest {

    //region PRECEDENZA E ASSOCIATIVITÀ

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource(delimiter = ';', value = {
            "P; P",
            "~P; ~P",
            "~~P; ~(~P)",
            "P & Q; (P & Q)",
            "~P & Q | R -> S; (((~P & Q) | R) -> S)",
            "A -> B -> C; (A -> (B -> C))",
            "A & B & C; ((A & B) & C)",
            "A | B | C; ((A | B) | C)",
            "A | B & C; (A | (B & C))",
            "~(P & Q); ~((P & Q))",
            "((P)); P",
            "(P | Q) -> R; ((P | Q) -> R)"
    })
    @DisplayName("Precedenza ~ > & > | > -> con -> associativo a destra")
    void shouldRespectPrecedenceAndAssociativity(String input, String canonical) {
        assertEquals(canonical, FormulaParser.parse(input).canonical());
    }

    @Test
    @DisplayName("La struttura dell'albero rispecchia la grammatica")
    void shouldBuildExpectedTree() {
        Expression expression = FormulaParser.parse("~P & Q -> R");

        assertTrue(expression.isImplication());
        assertTrue(expression.getLeft().isConjunction());
        assertTrue(expression.getLeft().getLeft().isNegation());
        assertEquals("P", expression.getLeft().getLeft().getOperand().getName());
        assertEquals(Expression.variable("R"), expression.getRight());
    }

    @ParameterizedTest(name = "U+{0}")
    @ValueSource(ints = {0x0B, 0x1C, 0x1E, 0x2003, 0x3000})
    @DisplayName("Spaziature non ASCII accettate tra i token")
    void shouldParseWithUnicodeWhitespace(int code) {
        String separator = String.valueOf((char) code);
        assertEquals("(P & Q)", FormulaParser.parse("P" + separator + "&" + separator + "Q").canonical());
        assertEquals("(A -> B)", FormulaParser.parse(separator + "A" + separator + "->B" + separator).canonical());
    }

    //endregion

    //region FORMA CANONICA

    @ParameterizedTest
    @ValueSource(strings = {"~P & Q | R -> S", "A -> B -> C", "~(P & Q)", "~~P", "(A | B) & ~(C -> D)", "x-y -> z"})
    @DisplayName("Riparsare la forma canonica restituisce la stessa forma canonica")
    void shouldRoundTripCanonicalForm(String input) {
        String canonical = FormulaParser.parse(input).canonical();
        Expression reparsed = FormulaParser.parse(canonical);

        assertEquals(canonical, reparsed.canonical());
        assertEquals(FormulaParser.parse(input), reparsed);
    }

    @Test
    @DisplayName("Formule strutturalmente diverse hanno forme canoniche diverse")
    void shouldDistinguishStructurallyDifferentFormulas() {
        assertNotEquals(FormulaParser.parse("(A -> B) -> C"), FormulaParser.parse("A -> B -> C"));
        assertNotEquals(FormulaParser.parse("A & B"), FormulaParser.parse("B & A"));
    }

    //endregion

    //region ERRORI

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "P &", "P ->", "~", "(P | Q) ->", "(P &"})
    @DisplayName("Input terminato prematuramente")
    void shouldReportUnexpectedEndOfInput(String input) {
        ParseException exception = assertThrows(ParseException.class, () -> FormulaParser.parse(input));
        assertEquals(ParseException.UNEXPECTED_END_OF_INPUT, exception.getMessage());
        assertTrue(exception.isAtEndOfInput());
        assertEquals(input, exception.getInput());
    }

    @ParameterizedTest
    @ValueSource(strings = {"(P & Q", "((P)", "(P Q)", "(P -> Q"})
    @DisplayName("Parentesi aperta senza chiusura")
    void shouldReportMissingClosingParenthesis(String input) {
        ParseException exception = assertThrows(ParseException.class, () -> FormulaParser.parse(input));
        assertEquals(ParseException.MISSING_CLOSING_PARENTHESIS, exception.getMessage());
    }

    @ParameterizedTest(name = "{0} -> token {1}")
    @CsvSource(delimiter = ';', value = {
            "P Q; Q",
            "P); )",
            "-> P; ->",
            "P & & Q; &",
            "(); )",
            "P ~ Q; ~"
    })
    @DisplayName("Token inatteso riportato nel messaggio")
    void shouldReportUnexpectedToken(String input, String token) {
        ParseException exception = assertThrows(ParseException.class, () -> FormulaParser.parse(input));
        assertEquals(ParseException.UNEXPECTED_TOKEN + token, exception.getMessage());
        assertEquals(token, exception.getOffendingToken());
    }

    @Test
    @DisplayName("La posizione indica l'inizio del token inatteso")
    void shouldReportOffendingPosition() {
        ParseException exception = assertThrows(ParseException.class, () -> FormulaParser.parse("P Q"));
        assertEquals(2, exception.getPosition());
    }

    @Test
    @DisplayName("parseAll si ferma alla prima formula non valida")
    void shouldFailParseAllOnFirstInvalidFormula() {
        ParseException exception = assertThrows(ParseException.class,
                () -> FormulaParser.parseAll(List.of("P -> Q", "P &", "Q Q")));
        assertEquals("P &", exception.getInput());
    }

    //endregion
}
