package org.deduction.formula;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionTest {

    private static final Expression P = Expression.variable("P");
    private static final Expression Q = Expression.variable("Q");
    private static final Expression R = Expression.variable("R");

    @Test
    @DisplayName("Forma canonica completamente parentesizzata")
    void shouldRenderFullyParenthesizedCanonicalForm() {
        assertEquals("P", P.canonical());
        assertEquals("~P", Expression.not(P).canonical());
        assertEquals("((P & Q) | R)", Expression.or(Expression.and(P, Q), R).canonical());
        assertEquals("(P -> (Q -> R))", Expression.implies(P, Expression.implies(Q, R)).canonical());
    }

    @Test
    @DisplayName("La negazione di un composto mantiene le parentesi dell'operando")
    void shouldKeepOperandParenthesesUnderNegation() {
        assertEquals("~((P & Q))", Expression.not(Expression.and(P, Q)).canonical());
        assertEquals("~(~P)", Expression.not(Expression.not(P)).canonical());
        assertEquals(Expression.not(Expression.and(P, Q)).canonical(),
                CanonicalPrinter.render(Expression.not(Expression.and(P, Q))));
    }

    @Test
    @DisplayName("Uguaglianza strutturale basata sulla forma canonica")
    void shouldCompareStructurally() {
        Expression first = Expression.implies(Expression.or(P, Q), R);
        Expression second = Expression.implies(Expression.or(Expression.variable("P"), Q), R);

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(Expression.and(P, Q), Expression.and(Q, P));
        assertEquals(first.canonical(), first.toString());
    }

    @Test
    @DisplayName("Variabili in ordine di prima apparizione, senza duplicati")
    void shouldCollectVariablesInFirstAppearanceOrder() {
        Expression expression = Expression.implies(Expression.and(Q, P), Expression.or(P, R));
        assertEquals(List.of("Q", "P", "R"), List.copyOf(expression.getVariables()));
    }

    @Test
    @DisplayName("Conteggio nodi e profondità")
    void shouldMeasureTree() {
        Expression expression = Expression.not(Expression.and(P, Q));
        assertEquals(4, expression.countNodes());
        assertEquals(2, expression.depth());
        assertEquals(0, P.depth());
    }

    @Test
    @DisplayName("Accessori non applicabili al tipo di nodo")
    void shouldRejectAccessorOnWrongNodeType() {
        assertThrows(IllegalStateException.class, P::getLeft);
        assertThrows(IllegalStateException.class, () -> Expression.and(P, Q).getName());
        assertThrows(IllegalStateException.class, () -> Expression.and(P, Q).getOperand());
        assertEquals(P, Expression.not(P).getOperand());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "A B", "A(", "~A", "A&B", "A|B", "A->B", "x)"})
    @DisplayName("Nomi di variabile non rappresentabili vengono rifiutati")
    void shouldRejectInvalidVariableNames(String name) {
        assertThrows(IllegalArgumentException.class, () -> Expression.variable(name));
    }

    @Test
    @DisplayName("Operandi null vengono rifiutati")
    void shouldRejectNullOperands() {
        assertThrows(IllegalArgumentException.class, () -> Expression.variable(null));
        assertThrows(IllegalArgumentException.class, () -> Expression.not(null));
        assertThrows(IllegalArgumentException.class, () -> Expression.and(P, null));
    }

    @Test
    @DisplayName("Nomi con trattino singolo sono ammessi")
    void shouldAcceptHyphenatedNames() {
        assertEquals(Set.of("x-y"), Expression.variable("x-y").getVariables());
    }
}
