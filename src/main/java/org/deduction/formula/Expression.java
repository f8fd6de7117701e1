package org.deduction.formula;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * FORMULA PROPOSIZIONALE - Albero immutabile di espressioni logiche
 *
 * Rappresenta una formula della logica proposizionale come albero binario con cinque
 * tipi di nodo. Ogni nodo è immutabile e calcola una sola volta la propria forma
 * canonica, usata come chiave di uguaglianza strutturale in tutto il sistema.
 *
 * TIPI DI NODO:
 * - VARIABLE: proposizione atomica (P, Q, piove, ...)
 * - NOT: negazione unaria ~A
 * - AND: congiunzione (A & B)
 * - OR: disgiunzione (A | B)
 * - IMPLIES: implicazione materiale (A -> B)
 *
 * UGUAGLIANZA:
 * Due espressioni sono uguali se e solo se le loro forme canoniche coincidono.
 * La parentesizzazione totale di {@link CanonicalPrinter} rende la forma canonica
 * iniettiva rispetto alla forma dell'albero.
 */
public final class Expression {

    //region TIPI E STRUTTURA DATI

    /**
     * Tipi di nodo supportati.
     */
    public enum Type {
        VARIABLE,   // Variabile atomica: P, Q, R, ...
        NOT,        // Negazione: ~A
        AND,        // Congiunzione: A & B
        OR,         // Disgiunzione: A | B
        IMPLIES     // Implicazione: A -> B
    }

    private final Type type;

    /** Nome della variabile (solo per nodi VARIABLE) */
    private final String name;

    /** Operando sinistro, oppure unico operando per NOT */
    private final Expression left;

    /** Operando destro (solo per nodi binari) */
    private final Expression right;

    /** Forma canonica calcolata alla costruzione */
    private final String canonical;

    //endregion

    //region COSTRUZIONE

    private Expression(Type type, String name, Expression left, Expression right) {
        this.type = type;
        this.name = name;
        this.left = left;
        this.right = right;
        this.canonical = CanonicalPrinter.render(this);
    }

    /**
     * Crea una variabile proposizionale.
     *
     * @param name nome della variabile: non vuoto, senza spazi, parentesi, operatori o "->"
     * @return nodo VARIABLE
     * @throws IllegalArgumentException se il nome non è un identificatore valido
     */
    public static Expression variable(String name) {
        validateVariableName(name);
        return new Expression(Type.VARIABLE, name, null, null);
    }

    /**
     * Crea la negazione di un'espressione.
     *
     * @param operand espressione da negare (non null)
     * @return nodo NOT
     */
    public static Expression not(Expression operand) {
        requireOperand(operand, "negazione");
        return new Expression(Type.NOT, null, operand, null);
    }

    public static Expression and(Expression left, Expression right) {
        return binary(Type.AND, left, right);
    }

    public static Expression or(Expression left, Expression right) {
        return binary(Type.OR, left, right);
    }

    public static Expression implies(Expression left, Expression right) {
        return binary(Type.IMPLIES, left, right);
    }

    private static Expression binary(Type type, Expression left, Expression right) {
        requireOperand(left, type.name());
        requireOperand(right, type.name());
        return new Expression(type, null, left, right);
    }

    private static void requireOperand(Expression operand, String operatorName) {
        if (operand == null) {
            throw new IllegalArgumentException("Operando null per operatore " + operatorName);
        }
    }

    /**
     * Un nome ammesso dal tokenizer non contiene spazi, "(", ")", "~", "&", "|" né la sequenza "->".
     * Lo stesso vincolo vale per gli alberi costruiti da codice, altrimenti la forma canonica
     * perderebbe l'iniettività.
     */
    private static void validateVariableName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Nome variabile non può essere null o vuoto");
        }
        if (name.contains("->")) {
            throw new IllegalArgumentException("Nome variabile non valido: " + name);
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isWhitespace(c) || "()~&|".indexOf(c) >= 0) {
                throw new IllegalArgumentException("Nome variabile non valido: " + name);
            }
        }
    }

    //endregion

    //region ACCESSO AI NODI

    public Type getType() {
        return type;
    }

    public boolean isVariable() {
        return type == Type.VARIABLE;
    }

    public boolean isNegation() {
        return type == Type.NOT;
    }

    public boolean isConjunction() {
        return type == Type.AND;
    }

    public boolean isDisjunction() {
        return type == Type.OR;
    }

    public boolean isImplication() {
        return type == Type.IMPLIES;
    }

    /**
     * @return nome della variabile
     * @throws IllegalStateException se il nodo non è una variabile
     */
    public String getName() {
        requireType(type == Type.VARIABLE, "getName");
        return name;
    }

    /**
     * @return operando della negazione
     * @throws IllegalStateException se il nodo non è una negazione
     */
    public Expression getOperand() {
        requireType(type == Type.NOT, "getOperand");
        return left;
    }

    /**
     * @return operando sinistro (antecedente per le implicazioni)
     * @throws IllegalStateException se il nodo non è binario
     */
    public Expression getLeft() {
        requireType(isBinary(), "getLeft");
        return left;
    }

    /**
     * @return operando destro (conseguente per le implicazioni)
     * @throws IllegalStateException se il nodo non è binario
     */
    public Expression getRight() {
        requireType(isBinary(), "getRight");
        return right;
    }

    private boolean isBinary() {
        return type == Type.AND || type == Type.OR || type == Type.IMPLIES;
    }

    private void requireType(boolean condition, String accessor) {
        if (!condition) {
            throw new IllegalStateException(accessor + "() non applicabile a nodo " + type + ": " + canonical);
        }
    }

    //endregion

    //region ANALISI STRUTTURALE

    /**
     * Raccoglie le variabili in ordine di prima apparizione (visita da sinistra a destra).
     *
     * @param into insieme di destinazione; un {@link LinkedHashSet} preserva l'ordine
     */
    public void collectVariables(Set<String> into) {
        switch (type) {
            case VARIABLE -> into.add(name);
            case NOT -> left.collectVariables(into);
            case AND, OR, IMPLIES -> {
                left.collectVariables(into);
                right.collectVariables(into);
            }
        }
    }

    /**
     * @return variabili distinte in ordine di prima apparizione
     */
    public Set<String> getVariables() {
        Set<String> variables = new LinkedHashSet<>();
        collectVariables(variables);
        return variables;
    }

    public int countNodes() {
        return switch (type) {
            case VARIABLE -> 1;
            case NOT -> 1 + left.countNodes();
            case AND, OR, IMPLIES -> 1 + left.countNodes() + right.countNodes();
        };
    }

    public int depth() {
        return switch (type) {
            case VARIABLE -> 0;
            case NOT -> 1 + left.depth();
            case AND, OR, IMPLIES -> 1 + Math.max(left.depth(), right.depth());
        };
    }

    //endregion

    //region FORMA CANONICA E UGUAGLIANZA

    /**
     * @return forma canonica completamente parentesizzata, chiave di identità dell'espressione
     */
    public String canonical() {
        return canonical;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof Expression)) return false;
        return canonical.equals(((Expression) other).canonical);
    }

    @Override
    public int hashCode() {
        return canonical.hashCode();
    }

    @Override
    public String toString() {
        return canonical;
    }

    //endregion
}
