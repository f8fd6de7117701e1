package org.deduction.evaluation;

/**
 * Comportamento del valutatore quando una variabile manca dall'assegnamento.
 */
public enum MissingVariablePolicy {

    /** La variabile mancante è un errore: {@link UnassignedVariableException} */
    STRICT,

    /** La variabile mancante vale false */
    DEFAULT_FALSE
}
