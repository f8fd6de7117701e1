package org.deduction.proof;

/**
 * Modalità con cui è stata ottenuta una prova.
 */
public enum ProofMethod {

    /** Derivazione diretta dalle premesse */
    DIRECT("Proof (direct derivation)"),

    /** Prova condizionale: si assume l'antecedente, si deriva il conseguente, si scarica l'assunzione */
    CONDITIONAL("Proof (→-intro)"),

    /** Nessuna derivazione trovata con le regole disponibili */
    NONE("No derivation found");

    private final String title;

    ProofMethod(String title) {
        this.title = title;
    }

    public String getTitle() {
        return title;
    }
}
