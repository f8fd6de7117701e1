package org.deduction.truthtable;

import org.deduction.evaluation.ExpressionEvaluator;
import org.deduction.formula.Expression;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.logging.Logger;

/**
 * VERIFICATORE PER TAVOLA DI VERITÀ - Validità di un argomento per enumerazione esaustiva
 *
 * ALGORITMO:
 * 1. Raccolta variabili distinte (premesse poi conclusione, ordine di prima apparizione)
 * 2. Enumerazione dei 2^k assegnamenti: la riga r assegna true alla variabile i se il bit i di r è 1
 * 3. Per ogni riga: valore di ciascuna premessa e della conclusione
 * 4. Verdetto: INCONSISTENT se nessuna riga soddisfa le premesse, VALID se nessun controesempio,
 *    altrimenti INVALID
 *
 * LIMITI:
 * Il costo è esponenziale nel numero di variabili. Oltre {@code maxVariables} la verifica
 * viene rifiutata prima di costruire qualsiasi riga.
 */
public final class TruthTableChecker {

    private static final Logger LOGGER = Logger.getLogger(TruthTableChecker.class.getName());

    /** Limite predefinito di variabili: 2^16 righe */
    public static final int DEFAULT_MAX_VARIABLES = 16;

    /** Limite assoluto imposto dall'indice di riga a 31 bit */
    private static final int HARD_MAX_VARIABLES = 30;

    private final ExpressionEvaluator evaluator;
    private final int maxVariables;

    public TruthTableChecker() {
        this(DEFAULT_MAX_VARIABLES);
    }

    /**
     * @param maxVariables numero massimo di variabili accettate (1..30)
     * @throws IllegalArgumentException se il limite è fuori intervallo
     */
    public TruthTableChecker(int maxVariables) {
        if (maxVariables < 1 || maxVariables > HARD_MAX_VARIABLES) {
            throw new IllegalArgumentException("Limite variabili deve essere tra 1 e " + HARD_MAX_VARIABLES + ": " + maxVariables);
        }
        this.evaluator = new ExpressionEvaluator();
        this.maxVariables = maxVariables;
    }

    /**
     * Costruisce la tavola di verità completa dell'argomento.
     *
     * @param premises premesse (anche vuota: le premesse sono allora vacuamente vere)
     * @param conclusion conclusione
     * @return tavola con righe e verdetto
     * @throws IllegalArgumentException se le variabili superano il limite configurato
     * @throws CancellationException se il thread viene interrotto durante l'enumerazione
     */
    public TruthTable check(List<Expression> premises, Expression conclusion) {
        if (premises == null || conclusion == null) {
            throw new IllegalArgumentException("Premesse e conclusione non possono essere null");
        }

        List<String> variables = collectVariables(premises, conclusion);
        if (variables.size() > maxVariables) {
            throw new IllegalArgumentException("Troppe variabili per la tavola di verità: "
                    + variables.size() + " (massimo " + maxVariables + ")");
        }

        LOGGER.fine("Tavola di verità su " + variables.size() + " variabili: " + variables);

        int totalRows = 1 << variables.size();
        List<TruthTableRow> rows = new ArrayList<>(totalRows);
        boolean consistent = false;
        boolean valid = true;

        for (int mask = 0; mask < totalRows; mask++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Tavola di verità interrotta alla riga " + mask + " di " + totalRows);
            }
            Map<String, Boolean> assignment = buildAssignment(variables, mask);

            List<Boolean> premiseValues = new ArrayList<>(premises.size());
            for (Expression premise : premises) {
                premiseValues.add(evaluator.evaluate(premise, assignment));
            }
            boolean conclusionTrue = evaluator.evaluate(conclusion, assignment);

            TruthTableRow row = new TruthTableRow(assignment, premiseValues, conclusionTrue);
            if (row.isPremisesSatisfied()) {
                consistent = true;
                if (!conclusionTrue) {
                    valid = false;
                }
            }
            rows.add(row);
        }

        Verdict verdict = !consistent ? Verdict.INCONSISTENT : valid ? Verdict.VALID : Verdict.INVALID;
        LOGGER.info("Verdetto tavola di verità: " + verdict + " (" + totalRows + " righe)");

        return new TruthTable(variables, rows, verdict);
    }

    /**
     * Variabili distinte in ordine di prima apparizione: prima le premesse, poi la conclusione.
     */
    public static List<String> collectVariables(List<Expression> premises, Expression conclusion) {
        Set<String> variables = new LinkedHashSet<>();
        for (Expression premise : premises) {
            premise.collectVariables(variables);
        }
        conclusion.collectVariables(variables);
        return new ArrayList<>(variables);
    }

    private static Map<String, Boolean> buildAssignment(List<String> variables, int mask) {
        Map<String, Boolean> assignment = new LinkedHashMap<>();
        for (int i = 0; i < variables.size(); i++) {
            assignment.put(variables.get(i), (mask & (1 << i)) != 0);
        }
        return assignment;
    }
}
