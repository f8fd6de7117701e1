package org.deduction.proof;

import org.deduction.inference.InferenceRule;

import java.util.List;

/**
 * Passo numerato di una prova: formula in forma canonica e relativa giustificazione.
 */
public final class ProofStep {

    private final int number;
    private final String text;
    private final String justification;
    private final InferenceRule rule;

    /** Chiavi canoniche dei passi da cui dipende */
    private final List<String> derivedFrom;

    public ProofStep(int number, String text, String justification, InferenceRule rule, List<String> derivedFrom) {
        this.number = number;
        this.text = text;
        this.justification = justification;
        this.rule = rule;
        this.derivedFrom = List.copyOf(derivedFrom);
    }

    public int getNumber() {
        return number;
    }

    public String getText() {
        return text;
    }

    public String getJustification() {
        return justification;
    }

    public InferenceRule getRule() {
        return rule;
    }

    public List<String> getDerivedFrom() {
        return derivedFrom;
    }

    ProofStep renumber(int newNumber) {
        return new ProofStep(newNumber, text, justification, rule, derivedFrom);
    }

    @Override
    public String toString() {
        return number + ". " + text + "    — " + justification;
    }
}
