package org.deduction.inference;

import org.deduction.formula.Expression;

import java.util.List;

/**
 * Fatto immutabile registrato dal motore di inferenza.
 *
 * Il numero di sequenza è l'ordine di inserimento e serve solo alla presentazione.
 */
public final class Fact {

    private final Expression expression;
    private final InferenceRule rule;
    private final String justification;

    /** Chiavi canoniche dei fatti da cui deriva, in ordine */
    private final List<String> derivedFrom;

    private final int sequenceNumber;

    public Fact(Expression expression, InferenceRule rule, String justification,
                List<String> derivedFrom, int sequenceNumber) {
        if (expression == null || rule == null || justification == null) {
            throw new IllegalArgumentException("Espressione, regola e giustificazione sono obbligatorie");
        }
        this.expression = expression;
        this.rule = rule;
        this.justification = justification;
        this.derivedFrom = List.copyOf(derivedFrom);
        this.sequenceNumber = sequenceNumber;
    }

    public Expression getExpression() {
        return expression;
    }

    public String getKey() {
        return expression.canonical();
    }

    public InferenceRule getRule() {
        return rule;
    }

    public String getJustification() {
        return justification;
    }

    public List<String> getDerivedFrom() {
        return derivedFrom;
    }

    public int getSequenceNumber() {
        return sequenceNumber;
    }

    @Override
    public String toString() {
        return sequenceNumber + ". " + getKey() + "    — " + justification;
    }
}
