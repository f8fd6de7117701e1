package org.deduction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReportFormatterTest {

    private final ArgumentAnalyzer analyzer = new ArgumentAnalyzer();
    private final ReportFormatter formatter = new ReportFormatter();

    @Test
    @DisplayName("Tavola con intestazioni, separatore e celle T/F")
    void shouldFormatTruthTable() {
        ArgumentReport report = analyzer.analyze(List.of("P -> Q", "P"), "Q");

        String[] lines = formatter.formatTruthTable(report).split("\n");

        assertEquals(6, lines.length);
        assertEquals("P | Q | P -> Q | P | Q", lines[0]);
        assertEquals("--+---+--------+---+--", lines[1]);
        assertEquals("F | F | T      | F | F", lines[2]);
        assertEquals("T | T | T      | T | T", lines[5]);
    }

    @Test
    @DisplayName("Argomento valido con prova diretta")
    void shouldFormatValidArgument() {
        String text = formatter.format(analyzer.analyze(List.of("P -> Q", "P"), "Q"));

        assertTrue(text.contains("Conclusion \"Q\" is VALID (truth-table confirmed)."));
        assertFalse(text.contains("Counterexample"));
        assertTrue(text.contains("Proof (direct derivation)\n"
                + "1. (P -> Q)    — Premise 1\n"
                + "2. P    — Premise 2\n"
                + "3. Q    — Modus Ponens from (P -> Q) and P\n"));
    }

    @Test
    @DisplayName("Argomento invalido con controesempio")
    void shouldFormatInvalidArgument() {
        String text = formatter.format(analyzer.analyze(List.of("P -> Q", "Q"), "P"));

        assertTrue(text.contains("Conclusion \"P\" is INVALID (truth-table confirmed)."));
        assertTrue(text.contains("Counterexample: P=F, Q=T"));
        assertTrue(text.endsWith("No natural-deduction derivation found. Truth-table shows the argument is invalid.\n"));
    }

    @Test
    @DisplayName("Premesse inconsistenti senza derivazione")
    void shouldFormatInconsistentArgument() {
        String text = formatter.format(analyzer.analyze(Argument.example()));

        assertTrue(text.contains("Premises are inconsistent (unsatisfiable). Any conclusion follows."));
        assertTrue(text.endsWith("No direct natural-deduction derivation found with the current simple rules, "
                + "but truth-table confirms validity.\n"));
    }

    @Test
    @DisplayName("Prova condizionale con assunzione")
    void shouldFormatConditionalProof() {
        String proof = formatter.formatProof(analyzer.analyze(List.of(), "P -> P"));

        assertEquals("Proof (→-intro)\n"
                + "Assume P\n"
                + "1. P    — Assumption\n"
                + "2. (P -> P)    — →-Introduction (discharge assumption)\n", proof);
    }

    @Test
    @DisplayName("Solo passi rilevanti su richiesta")
    void shouldFormatRelevantStepsOnly() {
        ArgumentReport report = analyzer.analyze(List.of("S", "P -> Q", "P"), "Q");

        String full = formatter.formatProof(report);
        String relevant = new ReportFormatter(true).formatProof(report);

        assertTrue(full.contains("1. S    — Premise 1"));
        assertFalse(relevant.contains("S    —"));
        assertTrue(relevant.contains("3. Q    — Modus Ponens from (P -> Q) and P"));
    }
}
