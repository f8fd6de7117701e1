package org.deduction.formula;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FormulaTokenizerTest {

    @Test
    @DisplayName("Operatori e parentesi diventano token singoli")
    void shouldSplitOperatorsAndParentheses() {
        assertEquals(List.of("(", "P", "|", "Q", ")", "->", "R"), FormulaTokenizer.tokenize("(P | Q) -> R"));
    }

    @Test
    @DisplayName("Gli spazi sono facoltativi tra i token")
    void shouldTokenizeWithoutWhitespace() {
        assertEquals(List.of("~", "(", "P", "&", "Q", ")", "->", "R"), FormulaTokenizer.tokenize("~(P&Q)->R"));
    }

    @Test
    @DisplayName("La freccia non viene mai assorbita in un nome di variabile")
    void shouldNeverSplitArrow() {
        assertEquals(List.of("A", "->", "B"), FormulaTokenizer.tokenize("A->B"));
        assertEquals(List.of("A", "->", "->", "B"), FormulaTokenizer.tokenize("A->->B"));
    }

    @Test
    @DisplayName("I nomi di variabile sono sequenze massimali di caratteri non speciali")
    void shouldReadMaximalVariableNames() {
        assertEquals(List.of("rain_1", "&", "x-y", "|", "Città"), FormulaTokenizer.tokenize("rain_1 & x-y | Città"));
    }

    @Test
    @DisplayName("Input vuoto o bianco produce una lista vuota")
    void shouldReturnEmptyListForBlankInput() {
        assertTrue(FormulaTokenizer.tokenize("").isEmpty());
        assertTrue(FormulaTokenizer.tokenize(" \t\n ").isEmpty());
    }

    @ParameterizedTest(name = "U+{0}")
    @ValueSource(ints = {0x0B, 0x1C, 0x1F, 0x1680, 0x2003, 0x200A, 0x2028, 0x2029, 0x205F, 0x3000})
    @DisplayName("Ogni carattere di spaziatura Java separa i token")
    void shouldTreatEveryJavaWhitespaceAsSeparator(int code) {
        String separator = String.valueOf((char) code);
        assertTrue(Character.isWhitespace(code));

        assertEquals(List.of("P", "&", "Q"), FormulaTokenizer.tokenize("P" + separator + "&" + separator + "Q"));
        assertEquals(List.of("A", "B"), FormulaTokenizer.tokenize("A" + separator + "B"));
    }

    @Test
    @DisplayName("Lo spazio non separabile resta parte del nome")
    void shouldKeepNonBreakingSpaceInsideName() {
        assertFalse(Character.isWhitespace('\u00A0'));
        assertEquals(List.of("A\u00A0B"), FormulaTokenizer.tokenize("A\u00A0B"));
    }

    @Test
    @DisplayName("Input null viene rifiutato")
    void shouldRejectNullInput() {
        TokenizeException exception = assertThrows(TokenizeException.class, () -> FormulaTokenizer.tokenize(null));
        assertEquals("input is not text", exception.getMessage());
    }
}
