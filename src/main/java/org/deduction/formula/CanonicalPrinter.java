package org.deduction.formula;

/**
 * Stampa canonica delle espressioni.
 *
 * REGOLE:
 * - VARIABLE: il nome
 * - NOT: ~P se l'operando è una variabile, altrimenti ~(operando)
 * - AND / OR / IMPLIES: sempre (sinistro OP destro)
 *
 * La parentesizzazione totale rende la stampa iniettiva: due alberi distinti non
 * producono mai la stessa stringa. Il motore di inferenza usa questa stringa come
 * unica chiave di deduplicazione.
 */
public final class CanonicalPrinter {

    private CanonicalPrinter() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Produce la forma canonica di un nodo. Gli operandi hanno già la propria forma
     * canonica in cache, quindi il costo è lineare nella lunghezza del risultato.
     *
     * @param expression nodo da stampare
     * @return forma canonica
     */
    public static String render(Expression expression) {
        return switch (expression.getType()) {
            case VARIABLE -> expression.getName();
            case NOT -> renderNegation(expression.getOperand());
            case AND -> renderBinary(expression, "&");
            case OR -> renderBinary(expression, "|");
            case IMPLIES -> renderBinary(expression, "->");
        };
    }

    private static String renderNegation(Expression operand) {
        if (operand.isVariable()) {
            return "~" + operand.canonical();
        }
        return "~(" + operand.canonical() + ")";
    }

    private static String renderBinary(Expression expression, String operator) {
        return "(" + expression.getLeft().canonical() + " " + operator + " " + expression.getRight().canonical() + ")";
    }
}
