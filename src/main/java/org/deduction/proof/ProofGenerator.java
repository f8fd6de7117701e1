package org.deduction.proof;

import org.deduction.formula.Expression;
import org.deduction.inference.Fact;
import org.deduction.inference.ForwardChainingEngine;
import org.deduction.inference.InferenceRule;
import org.deduction.inference.ProofRun;
import org.deduction.inference.TerminationReason;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.logging.Logger;

/**
 * GENERATORE PROVE - Orchestrazione dei tentativi di derivazione
 *
 * STRATEGIA:
 * 1. Derivazione diretta dell'obiettivo dalle premesse
 * 2. Se l'obiettivo è A -> B: si assume A, si cerca B, e in caso di successo si aggiunge
 *    il passo di scarico "A -> B" (introduzione dell'implicazione, un solo livello)
 * 3. Altrimenti nessuna prova: l'insieme di regole è incompleto, quindi l'esito non
 *    dice nulla sulla validità dell'argomento
 */
public class ProofGenerator {

    private static final Logger LOGGER = Logger.getLogger(ProofGenerator.class.getName());

    /** Giustificazione del passo di scarico nelle prove condizionali */
    public static final String DISCHARGE_JUSTIFICATION =
            InferenceRule.IMPLICATION_INTRODUCTION.getDisplayName() + " (discharge assumption)";

    private final ForwardChainingEngine engine;

    public ProofGenerator() {
        this(new ForwardChainingEngine());
    }

    public ProofGenerator(ForwardChainingEngine engine) {
        if (engine == null) {
            throw new IllegalArgumentException("Motore di inferenza non può essere null");
        }
        this.engine = engine;
    }

    /**
     * Cerca una prova dell'obiettivo.
     *
     * @param premises premesse nell'ordine di input
     * @param goal conclusione da derivare
     * @return prova diretta, condizionale, oppure {@link Proof#notFound(Expression)}
     * @throws java.util.concurrent.CancellationException se il thread viene interrotto durante la ricerca
     */
    public Proof prove(List<Expression> premises, Expression goal) {
        LOGGER.fine("Ricerca prova per " + goal);

        ProofRun directRun = engine.run(premises, goal);
        requireNotInterrupted(directRun);
        if (directRun.isGoalFound()) {
            LOGGER.info("Derivazione diretta trovata per " + goal + " in " + directRun.getPasses() + " passi");
            return Proof.direct(goal, toSteps(directRun));
        }

        if (goal.isImplication()) {
            Expression antecedent = goal.getLeft();
            Expression consequent = goal.getRight();

            ProofRun conditionalRun = engine.run(premises, consequent, List.of(antecedent));
            requireNotInterrupted(conditionalRun);
            if (conditionalRun.isGoalFound()) {
                List<ProofStep> steps = toSteps(conditionalRun);
                steps.add(new ProofStep(steps.size() + 1, goal.canonical(), DISCHARGE_JUSTIFICATION,
                        InferenceRule.IMPLICATION_INTRODUCTION, List.of(antecedent.canonical(), consequent.canonical())));

                LOGGER.info("Prova condizionale trovata per " + goal + " assumendo " + antecedent);
                return Proof.conditional(goal, steps);
            }
        }

        LOGGER.info("Nessuna derivazione trovata per " + goal);
        return Proof.notFound(goal);
    }

    /**
     * Un'esecuzione interrotta non dice nulla sulla derivabilità: la ricerca viene abbandonata.
     *
     * @throws CancellationException se il motore è stato interrotto
     */
    private static void requireNotInterrupted(ProofRun run) {
        if (run.getTerminationReason() == TerminationReason.INTERRUPTED) {
            throw new CancellationException("Ricerca prova interrotta per " + run.getGoal());
        }
    }

    private static List<ProofStep> toSteps(ProofRun run) {
        List<ProofStep> steps = new ArrayList<>();
        for (Fact fact : run.orderedFacts()) {
            steps.add(new ProofStep(fact.getSequenceNumber(), fact.getKey(), fact.getJustification(),
                    fact.getRule(), fact.getDerivedFrom()));
        }
        return steps;
    }
}
