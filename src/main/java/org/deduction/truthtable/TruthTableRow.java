package org.deduction.truthtable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Riga immutabile della tavola di verità: un assegnamento e i valori calcolati.
 */
public final class TruthTableRow {

    /** Assegnamento nell'ordine delle variabili della tavola */
    private final Map<String, Boolean> assignment;

    /** Valore di ciascuna premessa, nell'ordine di input */
    private final List<Boolean> premiseValues;

    private final boolean premisesSatisfied;
    private final boolean conclusionTrue;

    public TruthTableRow(Map<String, Boolean> assignment, List<Boolean> premiseValues, boolean conclusionTrue) {
        this.assignment = Collections.unmodifiableMap(new LinkedHashMap<>(assignment));
        this.premiseValues = List.copyOf(premiseValues);
        this.premisesSatisfied = !premiseValues.contains(Boolean.FALSE);
        this.conclusionTrue = conclusionTrue;
    }

    public Map<String, Boolean> getAssignment() {
        return assignment;
    }

    public boolean valueOf(String variable) {
        Boolean value = assignment.get(variable);
        if (value == null) {
            throw new IllegalArgumentException("Variabile non presente nella tavola: " + variable);
        }
        return value;
    }

    public List<Boolean> getPremiseValues() {
        return premiseValues;
    }

    public boolean isPremisesSatisfied() {
        return premisesSatisfied;
    }

    public boolean isConclusionTrue() {
        return conclusionTrue;
    }

    /**
     * @return true se le premesse sono vere e la conclusione falsa
     */
    public boolean isCounterexample() {
        return premisesSatisfied && !conclusionTrue;
    }

    @Override
    public String toString() {
        return assignment + " premesse=" + premisesSatisfied + " conclusione=" + conclusionTrue;
    }
}
