package org.deduction.evaluation;

import org.deduction.formula.Expression;

import java.util.Map;

/**
 * VALUTATORE BOOLEANO - Valore di verità di un'espressione sotto un assegnamento
 *
 * SEMANTICA:
 * - VARIABLE: valore dall'assegnamento (variabili mancanti secondo la {@link MissingVariablePolicy})
 * - NOT, AND, OR: connettivi booleani standard
 * - IMPLIES: implicazione materiale, falsa solo con antecedente vero e conseguente falso
 *
 * Valutazione pura e ricorsiva: nessuno stato condiviso, istanze riutilizzabili tra thread.
 */
public final class ExpressionEvaluator {

    private final MissingVariablePolicy missingVariablePolicy;

    /**
     * Valutatore rigoroso: ogni variabile deve comparire nell'assegnamento.
     */
    public ExpressionEvaluator() {
        this(MissingVariablePolicy.STRICT);
    }

    public ExpressionEvaluator(MissingVariablePolicy missingVariablePolicy) {
        if (missingVariablePolicy == null) {
            throw new IllegalArgumentException("Politica variabili mancanti non può essere null");
        }
        this.missingVariablePolicy = missingVariablePolicy;
    }

    /**
     * @param expression espressione da valutare
     * @param assignment mappa nome variabile -> valore
     * @return valore di verità dell'espressione
     * @throws UnassignedVariableException in modalità STRICT se manca una variabile
     */
    public boolean evaluate(Expression expression, Map<String, Boolean> assignment) {
        return switch (expression.getType()) {
            case VARIABLE -> lookup(expression.getName(), assignment);
            case NOT -> !evaluate(expression.getOperand(), assignment);
            case AND -> evaluate(expression.getLeft(), assignment) && evaluate(expression.getRight(), assignment);
            case OR -> evaluate(expression.getLeft(), assignment) || evaluate(expression.getRight(), assignment);
            case IMPLIES -> !evaluate(expression.getLeft(), assignment) || evaluate(expression.getRight(), assignment);
        };
    }

    private boolean lookup(String variable, Map<String, Boolean> assignment) {
        Boolean value = assignment.get(variable);
        if (value != null) {
            return value;
        }
        if (missingVariablePolicy == MissingVariablePolicy.STRICT) {
            throw new UnassignedVariableException(variable);
        }
        return false;
    }

    public MissingVariablePolicy getMissingVariablePolicy() {
        return missingVariablePolicy;
    }
}
