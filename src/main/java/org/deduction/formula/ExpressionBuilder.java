package org.deduction.formula;

import org.deduction.antlr.LogicFormulaBaseVisitor;
import org.deduction.antlr.LogicFormulaParser.AndContext;
import org.deduction.antlr.LogicFormulaParser.FormulaContext;
import org.deduction.antlr.LogicFormulaParser.ImpliesContext;
import org.deduction.antlr.LogicFormulaParser.NotContext;
import org.deduction.antlr.LogicFormulaParser.OrContext;
import org.deduction.antlr.LogicFormulaParser.ParContext;
import org.deduction.antlr.LogicFormulaParser.PrimContext;
import org.deduction.antlr.LogicFormulaParser.VarContext;

import java.util.logging.Logger;

/**
 * COSTRUTTORE ESPRESSIONI - Visitor dall'albero sintattico ANTLR a {@link Expression}
 *
 * ASSOCIATIVITÀ:
 * - Implicazione: a destra, A -> B -> C diventa A -> (B -> C)
 * - Disgiunzione e congiunzione: a sinistra, A | B | C diventa (A | B) | C
 * - Negazione: prefissa e impilabile, ~~A diventa ~(~A)
 *
 * Le parentesi servono solo a raggruppare e non lasciano traccia nell'albero.
 */
final class ExpressionBuilder extends LogicFormulaBaseVisitor<Expression> {

    private static final Logger LOGGER = Logger.getLogger(ExpressionBuilder.class.getName());

    //region PUNTO DI INGRESSO

    @Override
    public Expression visitFormula(FormulaContext ctx) {
        Expression expression = visit(ctx.implication());
        LOGGER.fine("Formula costruita: " + expression);
        return expression;
    }

    //endregion

    //region OPERATORI BINARI

    /**
     * Implicazione, associativa a destra: il conseguente è a sua volta un'implicazione
     * e viene visitato ricorsivamente.
     */
    @Override
    public Expression visitImplies(ImpliesContext ctx) {
        Expression antecedent = visit(ctx.disjunction());
        if (ctx.IMPLIES() == null) {
            return antecedent;
        }

        Expression consequent = visit(ctx.implication());
        return Expression.implies(antecedent, consequent);
    }

    /**
     * Disgiunzione, ripiegata a sinistra.
     */
    @Override
    public Expression visitOr(OrContext ctx) {
        Expression result = visit(ctx.conjunction(0));
        for (int i = 1; i < ctx.conjunction().size(); i++) {
            result = Expression.or(result, visit(ctx.conjunction(i)));
        }
        return result;
    }

    /**
     * Congiunzione, ripiegata a sinistra.
     */
    @Override
    public Expression visitAnd(AndContext ctx) {
        Expression result = visit(ctx.negation(0));
        for (int i = 1; i < ctx.negation().size(); i++) {
            result = Expression.and(result, visit(ctx.negation(i)));
        }
        return result;
    }

    //endregion

    //region NEGAZIONI, PARENTESI E VARIABILI

    @Override
    public Expression visitNot(NotContext ctx) {
        return Expression.not(visit(ctx.negation()));
    }

    @Override
    public Expression visitPrim(PrimContext ctx) {
        return visit(ctx.primary());
    }

    @Override
    public Expression visitPar(ParContext ctx) {
        return visit(ctx.implication());
    }

    @Override
    public Expression visitVar(VarContext ctx) {
        String variableName = ctx.VARIABLE().getText();
        LOGGER.finest("Variabile atomica: " + variableName);
        return Expression.variable(variableName);
    }

    //endregion
}
