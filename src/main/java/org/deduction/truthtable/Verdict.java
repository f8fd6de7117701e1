package org.deduction.truthtable;

/**
 * Esito della verifica per tavola di verità.
 */
public enum Verdict {

    /** Nessun assegnamento soddisfa tutte le premesse: argomento valido solo in modo vacuo */
    INCONSISTENT,

    /** Ogni assegnamento che soddisfa le premesse soddisfa anche la conclusione */
    VALID,

    /** Esiste almeno un controesempio */
    INVALID
}
