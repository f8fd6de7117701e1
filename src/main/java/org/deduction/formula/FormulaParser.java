package org.deduction.formula;

import org.antlr.v4.runtime.CommonTokenStream;
import org.deduction.antlr.LogicFormulaParser;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * PARSER FORMULE - Dal testo all'albero {@link Expression}
 *
 * Pipeline: lexer ANTLR -> parser ANTLR (discesa ricorsiva) -> {@link ExpressionBuilder}.
 *
 * GRAMMATICA (precedenza crescente):
 * <pre>
 * implication := disjunction ( '->' implication )?
 * disjunction := conjunction ( '|' conjunction )*
 * conjunction := negation ( '&amp;' negation )*
 * negation    := '~' negation | primary
 * primary     := VAR | '(' implication ')'
 * </pre>
 *
 * Tutti i token devono essere consumati: il primo errore interrompe il parsing con
 * {@link ParseException}, senza recupero.
 */
public final class FormulaParser {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    private FormulaParser() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Analizza una formula.
     *
     * @param text formula testuale
     * @return albero dell'espressione
     * @throws TokenizeException se il testo è null
     * @throws ParseException se il testo viola la grammatica
     */
    public static Expression parse(String text) {
        CommonTokenStream tokens = FormulaTokenizer.createTokenStream(text);

        LogicFormulaParser parser = new LogicFormulaParser(tokens);
        parser.removeErrorListeners();
        parser.setErrorHandler(new ParseErrorStrategy(text));

        Expression expression = new ExpressionBuilder().visit(parser.formula());
        LOGGER.fine("Parsing completato: \"" + text + "\" -> " + expression);
        return expression;
    }

    /**
     * Analizza una lista di formule preservandone l'ordine.
     *
     * @param texts formule testuali
     * @return alberi nello stesso ordine
     * @throws ParseException alla prima formula non valida
     */
    public static List<Expression> parseAll(List<String> texts) {
        List<Expression> expressions = new ArrayList<>(texts.size());
        for (String text : texts) {
            expressions.add(parse(text));
        }
        return expressions;
    }
}
