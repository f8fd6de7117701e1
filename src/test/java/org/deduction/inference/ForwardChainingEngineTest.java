package org.deduction.inference;

import org.deduction.formula.Expression;
import org.deduction.formula.FormulaParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ForwardChainingEngineTest {

    private final ForwardChainingEngine engine = new ForwardChainingEngine();

    private ProofRun run(List<String> premises, String goal) {
        return engine.run(FormulaParser.parseAll(premises), FormulaParser.parse(goal));
    }

    private static String justificationOf(ProofRun run, String key) {
        Fact fact = run.getFact(key);
        assertNotNull(fact, "fatto mancante: " + key);
        return fact.getJustification();
    }

    //region REGOLE

    @Test
    @DisplayName("Semplificazione estrae entrambi i congiunti")
    void shouldApplySimplification() {
        ProofRun result = run(List.of("P & Q"), "Q");

        assertTrue(result.isGoalFound());
        assertEquals(List.of("(P & Q)", "P", "Q"), result.getOrder());
        assertEquals("Simplification from (P & Q)", justificationOf(result, "P"));
        assertEquals(InferenceRule.SIMPLIFICATION, result.getFact("Q").getRule());
        assertEquals(List.of("(P & Q)"), result.getFact("Q").getDerivedFrom());
    }

    @Test
    @DisplayName("Modus Ponens")
    void shouldApplyModusPonens() {
        ProofRun result = run(List.of("P -> Q", "P"), "Q");

        assertTrue(result.isGoalFound());
        assertEquals(1, result.getPasses());
        assertEquals("Modus Ponens from (P -> Q) and P", justificationOf(result, "Q"));
        assertEquals(List.of("(P -> Q)", "P"), result.getFact("Q").getDerivedFrom());
    }

    @Test
    @DisplayName("Modus Tollens")
    void shouldApplyModusTollens() {
        ProofRun result = run(List.of("P -> Q", "~Q"), "~P");

        assertTrue(result.isGoalFound());
        assertEquals(List.of("(P -> Q)", "~Q", "~P"), result.getOrder());
        assertEquals("Premise 1", justificationOf(result, "(P -> Q)"));
        assertEquals("Premise 2", justificationOf(result, "~Q"));
        assertEquals("Modus Tollens from (P -> Q) and ~Q", justificationOf(result, "~P"));
    }

    @Test
    @DisplayName("Sillogismo ipotetico")
    void shouldApplyHypotheticalSyllogism() {
        ProofRun result = run(List.of("P -> Q", "Q -> R"), "P -> R");

        assertTrue(result.isGoalFound());
        assertEquals("Hypothetical Syllogism from (P -> Q) and (Q -> R)", justificationOf(result, "(P -> R)"));
    }

    @Test
    @DisplayName("Sillogismo disgiuntivo su entrambi i lati")
    void shouldApplyDisjunctiveSyllogism() {
        ProofRun right = run(List.of("P | Q", "~P"), "Q");
        assertTrue(right.isGoalFound());
        assertEquals("Disjunctive Syllogism from (P | Q) and ~P", justificationOf(right, "Q"));

        ProofRun left = run(List.of("P | Q", "~Q"), "P");
        assertTrue(left.isGoalFound());
        assertEquals("Disjunctive Syllogism from (P | Q) and ~Q", justificationOf(left, "P"));
    }

    @Test
    @DisplayName("Introduzione della congiunzione nell'ordine dell'obiettivo")
    void shouldIntroduceConjunctionInGoalOrder() {
        ProofRun result = run(List.of("Q", "P"), "P & Q");

        assertTrue(result.isGoalFound());
        assertEquals(InferenceRule.CONJUNCTION_INTRODUCTION, result.getFact("(P & Q)").getRule());
        assertEquals("Conjunction Introduction from P and Q", justificationOf(result, "(P & Q)"));
        assertFalse(result.contains("(Q & P)"));
    }

    @Test
    @DisplayName("Nessuna congiunzione introdotta se l'obiettivo non è una congiunzione")
    void shouldNotIntroduceConjunctionForOtherGoals() {
        ProofRun result = run(List.of("P", "Q"), "R");

        assertFalse(result.isGoalFound());
        assertEquals(TerminationReason.FIXED_POINT, result.getTerminationReason());
        assertEquals(List.of("P", "Q"), result.getOrder());
        assertEquals(1, result.getPasses());
    }

    //endregion

    //region TERMINAZIONE

    @Test
    @DisplayName("Argomento di esempio: Modus Tollens poi punto fisso senza obiettivo")
    void shouldReachFixedPointOnExampleArgument() {
        ProofRun result = run(List.of("(P | Q) -> R", "P", "~R"), "~Q");

        assertFalse(result.isGoalFound());
        assertEquals(TerminationReason.FIXED_POINT, result.getTerminationReason());
        assertTrue(result.contains("~((P | Q))"));
        assertEquals("Modus Tollens from ((P | Q) -> R) and ~R", justificationOf(result, "~((P | Q))"));
        assertFalse(result.contains("R"));
        assertFalse(result.contains(FormulaParser.parse("~Q")));
        assertEquals(4, result.getOrder().size());
        assertEquals(2, result.getPasses());
    }

    @Test
    @DisplayName("Obiettivo già tra le premesse: successo senza passi")
    void shouldStopWhenGoalIsAPremise() {
        ProofRun result = run(List.of("P", "Q"), "P");

        assertTrue(result.isGoalFound());
        assertEquals(0, result.getPasses());
        assertEquals(List.of("P"), result.getOrder());
    }

    @Test
    @DisplayName("Limite di sicurezza sui passi")
    void shouldStopAtSafetyBound() {
        List<Expression> premises = FormulaParser.parseAll(List.of("B -> C", "A & B"));
        Expression goal = FormulaParser.parse("C");

        ProofRun bounded = new ForwardChainingEngine(1).run(premises, goal);
        assertFalse(bounded.isGoalFound());
        assertEquals(TerminationReason.SAFETY_BOUND, bounded.getTerminationReason());
        assertEquals(1, bounded.getPasses());
        assertTrue(bounded.contains("B"));

        ProofRun unbounded = engine.run(premises, goal);
        assertTrue(unbounded.isGoalFound());
        assertEquals(2, unbounded.getPasses());
        assertEquals("Modus Ponens from (B -> C) and B", justificationOf(unbounded, "C"));
    }

    @Test
    @DisplayName("Thread interrotto: esecuzione terminata senza passi")
    void shouldStopWhenThreadIsInterrupted() {
        Thread.currentThread().interrupt();
        try {
            ProofRun result = run(List.of("P -> Q", "P"), "Q");

            assertFalse(result.isGoalFound());
            assertEquals(TerminationReason.INTERRUPTED, result.getTerminationReason());
            assertEquals(0, result.getPasses());
            assertEquals(List.of("(P -> Q)", "P"), result.getOrder());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    @DisplayName("Limite di passi non positivo rifiutato")
    void shouldRejectNonPositiveBound() {
        assertThrows(IllegalArgumentException.class, () -> new ForwardChainingEngine(0));
    }

    //endregion

    //region FATTI

    @Test
    @DisplayName("Assunzioni registrate dopo le premesse")
    void shouldRecordAssumptions() {
        ProofRun result = engine.run(FormulaParser.parseAll(List.of("P -> Q")), FormulaParser.parse("Q"),
                List.of(FormulaParser.parse("P")));

        assertTrue(result.isGoalFound());
        assertEquals("Assumption", justificationOf(result, "P"));
        assertEquals(InferenceRule.ASSUMPTION, result.getFact("P").getRule());
    }

    @Test
    @DisplayName("Deduplicazione: resta la prima giustificazione")
    void shouldKeepFirstJustification() {
        ProofRun result = run(List.of("P & Q", "Q & P"), "R");

        assertEquals("Simplification from (P & Q)", justificationOf(result, "Q"));
        assertEquals(List.of("(P & Q)", "(Q & P)", "P", "Q"), result.getOrder());
        assertEquals(TerminationReason.FIXED_POINT, result.getTerminationReason());
    }

    @Test
    @DisplayName("Esecuzioni ripetute producono lo stesso ordine")
    void shouldBeDeterministic() {
        List<String> premises = List.of("A -> B", "B -> C", "C -> D", "A | E", "~E");

        ProofRun first = run(premises, "D");
        ProofRun second = run(premises, "D");

        assertTrue(first.isGoalFound());
        assertEquals(first.getOrder(), second.getOrder());
        List<Fact> facts = first.orderedFacts();
        for (int i = 0; i < facts.size(); i++) {
            assertEquals(i + 1, facts.get(i).getSequenceNumber());
        }
    }

    //endregion
}
