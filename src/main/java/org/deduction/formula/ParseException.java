package org.deduction.formula;

/**
 * Violazione della grammatica delle formule.
 *
 * MESSAGGI POSSIBILI:
 * - "unexpected end of input": manca un operando o l'input è vuoto
 * - "missing closing parenthesis": era attesa ")" ma non è stata trovata
 * - "unexpected token: &lt;t&gt;": token in posizione non ammessa o token in eccesso
 */
public class ParseException extends InvalidFormulaException {

    public static final String UNEXPECTED_END_OF_INPUT = "unexpected end of input";
    public static final String MISSING_CLOSING_PARENTHESIS = "missing closing parenthesis";
    public static final String UNEXPECTED_TOKEN = "unexpected token: ";

    /** Testo del token incriminato, null se l'errore è a fine input */
    private final String offendingToken;

    /** Offset in caratteri del token incriminato nell'input */
    private final int position;

    public ParseException(String message, String input, String offendingToken, int position) {
        super(message, input);
        this.offendingToken = offendingToken;
        this.position = position;
    }

    public String getOffendingToken() {
        return offendingToken;
    }

    public int getPosition() {
        return position;
    }

    public boolean isAtEndOfInput() {
        return offendingToken == null;
    }
}
