package org.deduction.inference;

/**
 * Motivo di arresto di una esecuzione del motore.
 */
public enum TerminationReason {

    /** L'obiettivo è stato aggiunto all'insieme dei fatti */
    GOAL_REACHED,

    /** Un passo completo non ha aggiunto fatti nuovi */
    FIXED_POINT,

    /** Raggiunto il limite di sicurezza sul numero di passi */
    SAFETY_BOUND,

    /** Thread interrotto dall'esterno, tipicamente per timeout */
    INTERRUPTED
}
