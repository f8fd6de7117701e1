package org.deduction.inference;

import org.deduction.formula.Expression;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * MOTORE DI INFERENZA IN AVANTI - Ricerca di derivazioni per deduzione naturale
 *
 * Parte dalle premesse (ed eventuali assunzioni temporanee) e applica ripetutamente un
 * insieme fisso di regole finché l'obiettivo compare tra i fatti, oppure finché un passo
 * completo non aggiunge nulla (punto fisso), oppure finché si raggiunge il limite di passi.
 *
 * INIZIALIZZAZIONE:
 * - ogni premessa diventa un fatto "Premise k" (k da 1, ordine di input)
 * - ogni assunzione diventa un fatto "Assumption"
 *
 * PASSO:
 * Ogni passo scorre una fotografia delle chiavi presa all'inizio del passo; i fatti aggiunti
 * durante il passo diventano soggetti solo dal passo successivo. Per ogni fatto F:
 * - Semplificazione: F = A &amp; B produce A e B
 * - per ogni altro fatto G della fotografia (coppie ordinate, G diverso da F), nell'ordine:
 *   Modus Ponens, Modus Tollens, Sillogismo ipotetico, Sillogismo disgiuntivo,
 *   Introduzione della congiunzione (solo se l'obiettivo è una congiunzione)
 *
 * INTERRUZIONE:
 * Il flag di interruzione del thread è controllato prima di ogni passo e prima di ogni
 * soggetto: l'esecuzione termina con {@link TerminationReason#INTERRUPTED}.
 *
 * DEDUPLICAZIONE:
 * Un fatto entra solo se la sua forma canonica non è già presente: il primo inserimento
 * fissa la giustificazione registrata.
 *
 * Ogni invocazione alloca solo stato locale: il motore è privo di stato e riutilizzabile.
 */
public final class ForwardChainingEngine {

    private static final Logger LOGGER = Logger.getLogger(ForwardChainingEngine.class.getName());

    /** Limite di sicurezza predefinito sul numero di passi */
    public static final int DEFAULT_MAX_PASSES = 5000;

    //region TABELLA DELLE REGOLE

    /**
     * Esito di un tentativo di derivazione, ordinato per priorità crescente.
     */
    private enum Outcome {
        NOTHING_NEW,
        NEW_FACT,
        GOAL_REACHED;

        Outcome merge(Outcome other) {
            return other.ordinal() > this.ordinal() ? other : this;
        }
    }

    /**
     * Regola applicata a una coppia ordinata (soggetto, altro fatto).
     */
    @FunctionalInterface
    private interface PairRule {
        Outcome apply(FactBase base, String subjectKey, Expression subject, String otherKey, Expression other);
    }

    /** Regole su coppie, nell'ordine in cui vengono tentate */
    private static final List<PairRule> PAIR_RULES = List.of(
            ForwardChainingEngine::applyModusPonens,
            ForwardChainingEngine::applyModusTollens,
            ForwardChainingEngine::applyHypotheticalSyllogism,
            ForwardChainingEngine::applyDisjunctiveSyllogism,
            ForwardChainingEngine::applyConjunctionIntroduction
    );

    //endregion

    private final int maxPasses;

    public ForwardChainingEngine() {
        this(DEFAULT_MAX_PASSES);
    }

    /**
     * @param maxPasses limite di sicurezza sul numero di passi (almeno 1)
     * @throws IllegalArgumentException se il limite non è positivo
     */
    public ForwardChainingEngine(int maxPasses) {
        if (maxPasses < 1) {
            throw new IllegalArgumentException("Il limite di passi deve essere positivo: " + maxPasses);
        }
        this.maxPasses = maxPasses;
    }

    //region ESECUZIONE

    /**
     * Cerca una derivazione dell'obiettivo dalle sole premesse.
     */
    public ProofRun run(List<Expression> premises, Expression goal) {
        return run(premises, goal, List.of());
    }

    /**
     * Cerca una derivazione dell'obiettivo da premesse e assunzioni temporanee.
     *
     * @param premises premesse nell'ordine di input
     * @param goal obiettivo da derivare
     * @param assumptions assunzioni temporanee (vuota per una derivazione diretta)
     * @return fatti derivati, ordine di derivazione e motivo di arresto
     */
    public ProofRun run(List<Expression> premises, Expression goal, List<Expression> assumptions) {
        if (premises == null || goal == null || assumptions == null) {
            throw new IllegalArgumentException("Premesse, obiettivo e assunzioni non possono essere null");
        }

        LOGGER.fine("Avvio motore: obiettivo " + goal + ", " + premises.size() + " premesse, "
                + assumptions.size() + " assunzioni");

        FactBase base = new FactBase(goal);

        for (int i = 0; i < premises.size(); i++) {
            if (base.add(premises.get(i), InferenceRule.PREMISE, "Premise " + (i + 1), List.of()) == Outcome.GOAL_REACHED) {
                return finish(base, TerminationReason.GOAL_REACHED, 0);
            }
        }
        for (Expression assumption : assumptions) {
            if (base.add(assumption, InferenceRule.ASSUMPTION, "Assumption", List.of()) == Outcome.GOAL_REACHED) {
                return finish(base, TerminationReason.GOAL_REACHED, 0);
            }
        }

        int passes = 0;
        boolean changed = true;
        while (changed && passes < maxPasses) {
            if (isInterrupted()) {
                return interrupted(base, passes);
            }
            passes++;
            Outcome pass = executePass(base);
            if (pass == Outcome.GOAL_REACHED) {
                return finish(base, TerminationReason.GOAL_REACHED, passes);
            }
            changed = pass == Outcome.NEW_FACT;
        }

        if (isInterrupted()) {
            return interrupted(base, passes);
        }

        TerminationReason reason = changed ? TerminationReason.SAFETY_BOUND : TerminationReason.FIXED_POINT;
        if (reason == TerminationReason.SAFETY_BOUND) {
            LOGGER.warning("Limite di sicurezza raggiunto dopo " + passes + " passi per obiettivo " + goal);
        }
        return finish(base, reason, passes);
    }

    /**
     * Un passo completo sulla fotografia delle chiavi presa all'inizio del passo.
     */
    private static Outcome executePass(FactBase base) {
        List<String> snapshot = base.snapshot();
        Outcome pass = Outcome.NOTHING_NEW;

        for (String subjectKey : snapshot) {
            if (isInterrupted()) return pass;
            Expression subject = base.expressionOf(subjectKey);

            pass = pass.merge(applySimplification(base, subjectKey, subject));
            if (pass == Outcome.GOAL_REACHED) return pass;

            for (String otherKey : snapshot) {
                if (subjectKey.equals(otherKey)) continue;
                Expression other = base.expressionOf(otherKey);

                for (PairRule rule : PAIR_RULES) {
                    pass = pass.merge(rule.apply(base, subjectKey, subject, otherKey, other));
                    if (pass == Outcome.GOAL_REACHED) return pass;
                }
            }
        }
        return pass;
    }

    private static boolean isInterrupted() {
        return Thread.currentThread().isInterrupted();
    }

    private ProofRun interrupted(FactBase base, int passes) {
        LOGGER.warning("Motore interrotto dopo " + passes + " passi, " + base.order.size() + " fatti");
        return finish(base, TerminationReason.INTERRUPTED, passes);
    }

    private ProofRun finish(FactBase base, TerminationReason reason, int passes) {
        ProofRun run = new ProofRun(base.goal, base.facts, base.order, reason, passes);
        LOGGER.fine("Motore terminato: " + run);
        return run;
    }

    //endregion

    //region REGOLE DI INFERENZA

    /**
     * A &amp; B |- A, B
     */
    private static Outcome applySimplification(FactBase base, String subjectKey, Expression subject) {
        if (!subject.isConjunction()) {
            return Outcome.NOTHING_NEW;
        }
        String justification = InferenceRule.SIMPLIFICATION.getDisplayName() + " from " + subjectKey;
        Outcome outcome = base.add(subject.getLeft(), InferenceRule.SIMPLIFICATION, justification, List.of(subjectKey));
        if (outcome == Outcome.GOAL_REACHED) return outcome;
        return outcome.merge(base.add(subject.getRight(), InferenceRule.SIMPLIFICATION, justification, List.of(subjectKey)));
    }

    /**
     * A -> B, A |- B
     */
    private static Outcome applyModusPonens(FactBase base, String subjectKey, Expression subject,
                                            String otherKey, Expression other) {
        if (!subject.isImplication()) {
            return Outcome.NOTHING_NEW;
        }
        String antecedentKey = subject.getLeft().canonical();
        if (!base.contains(antecedentKey)) {
            return Outcome.NOTHING_NEW;
        }
        return base.add(subject.getRight(), InferenceRule.MODUS_PONENS,
                justify(InferenceRule.MODUS_PONENS, subjectKey, antecedentKey), List.of(subjectKey, antecedentKey));
    }

    /**
     * A -> B, ~B |- ~A
     */
    private static Outcome applyModusTollens(FactBase base, String subjectKey, Expression subject,
                                             String otherKey, Expression other) {
        if (!subject.isImplication()) {
            return Outcome.NOTHING_NEW;
        }
        String negatedConsequentKey = Expression.not(subject.getRight()).canonical();
        if (!base.contains(negatedConsequentKey)) {
            return Outcome.NOTHING_NEW;
        }
        return base.add(Expression.not(subject.getLeft()), InferenceRule.MODUS_TOLLENS,
                justify(InferenceRule.MODUS_TOLLENS, subjectKey, negatedConsequentKey),
                List.of(subjectKey, negatedConsequentKey));
    }

    /**
     * A -> B, B -> C |- A -> C
     */
    private static Outcome applyHypotheticalSyllogism(FactBase base, String subjectKey, Expression subject,
                                                      String otherKey, Expression other) {
        if (!subject.isImplication() || !other.isImplication()) {
            return Outcome.NOTHING_NEW;
        }
        if (!subject.getRight().equals(other.getLeft())) {
            return Outcome.NOTHING_NEW;
        }
        return base.add(Expression.implies(subject.getLeft(), other.getRight()), InferenceRule.HYPOTHETICAL_SYLLOGISM,
                justify(InferenceRule.HYPOTHETICAL_SYLLOGISM, subjectKey, otherKey), List.of(subjectKey, otherKey));
    }

    /**
     * A | B, ~A |- B  e  A | B, ~B |- A
     */
    private static Outcome applyDisjunctiveSyllogism(FactBase base, String subjectKey, Expression subject,
                                                     String otherKey, Expression other) {
        if (!subject.isDisjunction()) {
            return Outcome.NOTHING_NEW;
        }

        Outcome outcome = Outcome.NOTHING_NEW;
        String negatedLeftKey = Expression.not(subject.getLeft()).canonical();
        if (base.contains(negatedLeftKey)) {
            outcome = base.add(subject.getRight(), InferenceRule.DISJUNCTIVE_SYLLOGISM,
                    justify(InferenceRule.DISJUNCTIVE_SYLLOGISM, subjectKey, negatedLeftKey),
                    List.of(subjectKey, negatedLeftKey));
            if (outcome == Outcome.GOAL_REACHED) return outcome;
        }

        String negatedRightKey = Expression.not(subject.getRight()).canonical();
        if (base.contains(negatedRightKey)) {
            outcome = outcome.merge(base.add(subject.getLeft(), InferenceRule.DISJUNCTIVE_SYLLOGISM,
                    justify(InferenceRule.DISJUNCTIVE_SYLLOGISM, subjectKey, negatedRightKey),
                    List.of(subjectKey, negatedRightKey)));
        }
        return outcome;
    }

    /**
     * A, B |- A &amp; B, tentata solo quando l'obiettivo è proprio una congiunzione A &amp; B.
     * La congiunzione viene costruita nell'ordine degli operandi dell'obiettivo.
     */
    private static Outcome applyConjunctionIntroduction(FactBase base, String subjectKey, Expression subject,
                                                        String otherKey, Expression other) {
        Expression goal = base.goal;
        if (!goal.isConjunction()) {
            return Outcome.NOTHING_NEW;
        }

        Expression goalLeft = goal.getLeft();
        Expression goalRight = goal.getRight();
        String leftKey;
        String rightKey;
        if (subject.equals(goalLeft) && other.equals(goalRight)) {
            leftKey = subjectKey;
            rightKey = otherKey;
        } else if (other.equals(goalLeft) && subject.equals(goalRight)) {
            leftKey = otherKey;
            rightKey = subjectKey;
        } else {
            return Outcome.NOTHING_NEW;
        }

        return base.add(Expression.and(base.expressionOf(leftKey), base.expressionOf(rightKey)),
                InferenceRule.CONJUNCTION_INTRODUCTION,
                justify(InferenceRule.CONJUNCTION_INTRODUCTION, leftKey, rightKey), List.of(leftKey, rightKey));
    }

    private static String justify(InferenceRule rule, String firstKey, String secondKey) {
        return rule.getDisplayName() + " from " + firstKey + " and " + secondKey;
    }

    //endregion

    //region BASE DEI FATTI

    /**
     * Insieme dei fatti di una singola esecuzione, indicizzato per forma canonica.
     */
    private static final class FactBase {

        private final Expression goal;
        private final String goalKey;
        private final Map<String, Fact> facts = new LinkedHashMap<>();
        private final List<String> order = new ArrayList<>();

        FactBase(Expression goal) {
            this.goal = goal;
            this.goalKey = goal.canonical();
        }

        Outcome add(Expression expression, InferenceRule rule, String justification, List<String> derivedFrom) {
            String key = expression.canonical();
            if (facts.containsKey(key)) {
                return Outcome.NOTHING_NEW;
            }

            Fact fact = new Fact(expression, rule, justification, derivedFrom, order.size() + 1);
            facts.put(key, fact);
            order.add(key);
            LOGGER.finest("Nuovo fatto " + fact);

            return key.equals(goalKey) ? Outcome.GOAL_REACHED : Outcome.NEW_FACT;
        }

        boolean contains(String key) {
            return facts.containsKey(key);
        }

        Expression expressionOf(String key) {
            return facts.get(key).getExpression();
        }

        List<String> snapshot() {
            return List.copyOf(order);
        }
    }

    //endregion
}
