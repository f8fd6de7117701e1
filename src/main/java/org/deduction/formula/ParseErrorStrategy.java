package org.deduction.formula;

import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.IntervalSet;
import org.deduction.antlr.LogicFormulaParser;

/**
 * Strategia di errore senza recupero: al primo errore sintattico il parsing si interrompe
 * con una {@link ParseException} dal messaggio stabile.
 *
 * CLASSIFICAZIONE:
 * 1. era attesa ")" e non è arrivata -> "missing closing parenthesis"
 * 2. l'input è finito -> "unexpected end of input"
 * 3. altrimenti -> "unexpected token: &lt;t&gt;"
 */
final class ParseErrorStrategy extends DefaultErrorStrategy {

    private final String input;

    ParseErrorStrategy(String input) {
        this.input = input;
    }

    @Override
    public void reportError(Parser recognizer, RecognitionException e) {
        throw toParseException(e.getOffendingToken(), e.getExpectedTokens());
    }

    @Override
    public void recover(Parser recognizer, RecognitionException e) {
        throw toParseException(e.getOffendingToken(), e.getExpectedTokens());
    }

    @Override
    public Token recoverInline(Parser recognizer) {
        throw toParseException(recognizer.getCurrentToken(), recognizer.getExpectedTokens());
    }

    @Override
    public void sync(Parser recognizer) {
        // La grammatica è LL(1): gli errori emergono in match() o nelle alternative
    }

    private ParseException toParseException(Token offending, IntervalSet expected) {
        boolean atEnd = offending == null || offending.getType() == Token.EOF;
        String tokenText = atEnd ? null : offending.getText();
        int position = atEnd ? input.length() : offending.getStartIndex();

        if (expected != null && expected.contains(LogicFormulaParser.RPAR)
                && (atEnd || offending.getType() != LogicFormulaParser.RPAR)) {
            return new ParseException(ParseException.MISSING_CLOSING_PARENTHESIS, input, tokenText, position);
        }
        if (atEnd) {
            return new ParseException(ParseException.UNEXPECTED_END_OF_INPUT, input, null, position);
        }
        return new ParseException(ParseException.UNEXPECTED_TOKEN + tokenText, input, tokenText, position);
    }
}
