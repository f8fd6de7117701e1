package org.deduction.evaluation;

/**
 * Variabile priva di valore durante una valutazione in modalità {@link MissingVariablePolicy#STRICT}.
 */
public class UnassignedVariableException extends RuntimeException {

    private final String variable;

    public UnassignedVariableException(String variable) {
        super("Variabile senza valore nell'assegnamento: " + variable);
        this.variable = variable;
    }

    public String getVariable() {
        return variable;
    }
}
