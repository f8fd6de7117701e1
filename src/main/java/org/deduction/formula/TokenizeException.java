package org.deduction.formula;

/**
 * Input non tokenizzabile. Il lexer accetta qualsiasi sequenza di caratteri non
 * vuoti, quindi in pratica l'errore nasce solo da input null.
 */
public class TokenizeException extends InvalidFormulaException {

    public TokenizeException(String message, String input) {
        super(message, input);
    }
}
