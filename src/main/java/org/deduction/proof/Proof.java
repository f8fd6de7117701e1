package org.deduction.proof;

import org.deduction.formula.Expression;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * PROVA - Sequenza ordinata di passi giustificati, oppure esito negativo
 *
 * FORME:
 * - DIRECT: i fatti del motore dall'inizializzazione fino all'obiettivo
 * - CONDITIONAL: come sopra con l'antecedente assunto, più il passo finale di scarico
 * - NONE: nessun passo; non è un verdetto di invalidità
 */
public final class Proof {

    /** Nota per l'esito negativo: la tavola di verità resta l'unico verdetto */
    public static final String NO_DERIVATION_NOTE =
            "No derivation found with the current rule set; the truth table is authoritative.";

    private final ProofMethod method;
    private final Expression goal;
    private final Expression assumption;
    private final List<ProofStep> steps;

    private Proof(ProofMethod method, Expression goal, Expression assumption, List<ProofStep> steps) {
        this.method = method;
        this.goal = goal;
        this.assumption = assumption;
        this.steps = List.copyOf(steps);
    }

    //region FACTORY METHODS

    public static Proof direct(Expression goal, List<ProofStep> steps) {
        requireSteps(steps);
        return new Proof(ProofMethod.DIRECT, goal, null, steps);
    }

    /**
     * @param goal implicazione dimostrata
     * @param steps passi della derivazione condizionale, passo di scarico incluso
     */
    public static Proof conditional(Expression goal, List<ProofStep> steps) {
        requireSteps(steps);
        if (!goal.isImplication()) {
            throw new IllegalArgumentException("Una prova condizionale richiede un'implicazione: " + goal);
        }
        return new Proof(ProofMethod.CONDITIONAL, goal, goal.getLeft(), steps);
    }

    public static Proof notFound(Expression goal) {
        return new Proof(ProofMethod.NONE, goal, null, List.of());
    }

    private static void requireSteps(List<ProofStep> steps) {
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("Una prova richiede almeno un passo");
        }
    }

    //endregion

    //region ACCESSO

    public boolean isDerived() {
        return method != ProofMethod.NONE;
    }

    public ProofMethod getMethod() {
        return method;
    }

    public Expression getGoal() {
        return goal;
    }

    /**
     * @return antecedente assunto e poi scaricato, solo per prove condizionali
     */
    public Optional<Expression> getAssumption() {
        return Optional.ofNullable(assumption);
    }

    public List<ProofStep> getSteps() {
        return steps;
    }

    //endregion

    //region PASSI RILEVANTI

    /**
     * Riduce la prova ai soli passi da cui l'ultimo passo dipende, seguendo a ritroso le
     * dipendenze, e rinumera il risultato mantenendo l'ordine originale.
     *
     * @return passi rilevanti (vuota per una prova non trovata)
     */
    public List<ProofStep> relevantSteps() {
        if (steps.isEmpty()) {
            return List.of();
        }

        ProofStep last = steps.get(steps.size() - 1);
        List<ProofStep> derivationSteps = steps.subList(0, steps.size() - 1);

        Map<String, ProofStep> byText = new HashMap<>();
        for (ProofStep step : derivationSteps) {
            byText.put(step.getText(), step);
        }

        Set<ProofStep> needed = new HashSet<>();
        needed.add(last);
        Deque<ProofStep> pending = new ArrayDeque<>();
        pending.push(last);
        while (!pending.isEmpty()) {
            for (String dependency : pending.pop().getDerivedFrom()) {
                ProofStep source = byText.get(dependency);
                if (source != null && needed.add(source)) {
                    pending.push(source);
                }
            }
        }

        List<ProofStep> relevant = new ArrayList<>();
        for (ProofStep step : steps) {
            if (needed.contains(step)) {
                relevant.add(step.renumber(relevant.size() + 1));
            }
        }
        return relevant;
    }

    //endregion

    @Override
    public String toString() {
        if (!isDerived()) {
            return method.getTitle() + " for " + goal + ". " + NO_DERIVATION_NOTE;
        }
        return method.getTitle() + " of " + goal + " (" + steps.size() + " steps)";
    }
}
