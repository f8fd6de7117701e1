package org.deduction.formula;

/**
 * Errore di input su una formula testuale.
 *
 * Base comune per errori di tokenizzazione e di parsing: il testo originale viene
 * conservato e restituito al chiamante senza alcun tentativo di correzione.
 */
public abstract class InvalidFormulaException extends RuntimeException {

    /** Testo della formula che ha causato l'errore (può essere null) */
    private final String input;

    protected InvalidFormulaException(String message, String input) {
        super(message);
        this.input = input;
    }

    protected InvalidFormulaException(String message, String input, Throwable cause) {
        super(message, cause);
        this.input = input;
    }

    public String getInput() {
        return input;
    }
}
