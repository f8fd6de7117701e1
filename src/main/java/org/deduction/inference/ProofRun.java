package org.deduction.inference;

import org.deduction.formula.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * RISULTATO DEL MOTORE - Fatti derivati, ordine di derivazione ed esito
 *
 * Valore immutabile restituito al chiamante al termine di una esecuzione; lo stato
 * interno del motore viene scartato.
 */
public final class ProofRun {

    private final Expression goal;

    /** Fatti indicizzati per chiave canonica, nell'ordine di inserimento */
    private final Map<String, Fact> facts;

    private final List<String> order;
    private final TerminationReason terminationReason;
    private final int passes;

    public ProofRun(Expression goal, Map<String, Fact> facts, List<String> order,
                    TerminationReason terminationReason, int passes) {
        this.goal = goal;
        this.facts = Collections.unmodifiableMap(new LinkedHashMap<>(facts));
        this.order = List.copyOf(order);
        this.terminationReason = terminationReason;
        this.passes = passes;
    }

    public Expression getGoal() {
        return goal;
    }

    public boolean isGoalFound() {
        return terminationReason == TerminationReason.GOAL_REACHED;
    }

    public Map<String, Fact> getFacts() {
        return facts;
    }

    /**
     * @return chiavi canoniche nell'ordine di derivazione
     */
    public List<String> getOrder() {
        return order;
    }

    /**
     * @return fatti nell'ordine di derivazione
     */
    public List<Fact> orderedFacts() {
        List<Fact> ordered = new ArrayList<>(order.size());
        for (String key : order) {
            ordered.add(facts.get(key));
        }
        return ordered;
    }

    public boolean contains(String key) {
        return facts.containsKey(key);
    }

    public boolean contains(Expression expression) {
        return facts.containsKey(expression.canonical());
    }

    public Fact getFact(String key) {
        return facts.get(key);
    }

    public TerminationReason getTerminationReason() {
        return terminationReason;
    }

    public int getPasses() {
        return passes;
    }

    @Override
    public String toString() {
        return "ProofRun[goal=" + goal + ", facts=" + order.size() + ", passes=" + passes
                + ", termination=" + terminationReason + "]";
    }
}
