package org.deduction.formula;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.deduction.antlr.LogicFormulaLexer;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * TOKENIZER FORMULE - Suddivisione del testo in token atomici tramite lexer ANTLR
 *
 * TOKEN RICONOSCIUTI:
 * - "->" implicazione (riconosciuto prima degli altri simboli, non viene mai spezzato)
 * - "(" ")" "~" "&amp;" "|" simboli a un carattere
 * - qualsiasi altra sequenza massimale di caratteri non bianchi come nome di variabile
 *
 * Gli spazi separano i token e non hanno altro significato.
 */
public final class FormulaTokenizer {

    private static final Logger LOGGER = Logger.getLogger(FormulaTokenizer.class.getName());

    private FormulaTokenizer() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Suddivide il testo in token.
     *
     * @param text formula testuale
     * @return testi dei token nell'ordine di apparizione (vuota per input bianco)
     * @throws TokenizeException se il testo è null
     */
    public static List<String> tokenize(String text) {
        LogicFormulaLexer lexer = createLexer(text);

        List<String> tokens = new ArrayList<>();
        for (Token token : lexer.getAllTokens()) {
            tokens.add(token.getText());
        }

        LOGGER.finest("Token estratti da \"" + text + "\": " + tokens);
        return tokens;
    }

    /**
     * Crea il flusso di token consumato dal parser.
     *
     * @param text formula testuale
     * @return stream bufferizzato sul lexer configurato
     * @throws TokenizeException se il testo è null
     */
    static CommonTokenStream createTokenStream(String text) {
        return new CommonTokenStream(createLexer(text));
    }

    private static LogicFormulaLexer createLexer(String text) {
        if (text == null) {
            throw new TokenizeException("input is not text", null);
        }

        LogicFormulaLexer lexer = new LogicFormulaLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(new BaseErrorListener() {
            @Override
            public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                    int charPositionInLine, String msg, RecognitionException e) {
                throw new TokenizeException("unrecognized input at position " + charPositionInLine + ": " + msg, text);
            }
        });
        return lexer;
    }
}
