package org.deduction.inference;

/**
 * Insieme chiuso delle giustificazioni ammesse.
 *
 * Le cinque regole di derivazione sono fisse e non estensibili: il motore non è completo
 * rispetto alla deduzione naturale proposizionale (nessuna riduzione all'assurdo, nessuna
 * legge di De Morgan), quindi una derivazione non trovata non prova l'invalidità.
 */
public enum InferenceRule {

    PREMISE("Premise"),
    ASSUMPTION("Assumption"),
    SIMPLIFICATION("Simplification"),
    MODUS_PONENS("Modus Ponens"),
    MODUS_TOLLENS("Modus Tollens"),
    HYPOTHETICAL_SYLLOGISM("Hypothetical Syllogism"),
    DISJUNCTIVE_SYLLOGISM("Disjunctive Syllogism"),
    CONJUNCTION_INTRODUCTION("Conjunction Introduction"),
    IMPLICATION_INTRODUCTION("→-Introduction");

    private final String displayName;

    InferenceRule(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
