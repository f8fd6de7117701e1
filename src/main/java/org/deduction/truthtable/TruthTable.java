package org.deduction.truthtable;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * RISULTATO TAVOLA DI VERITÀ - Contenitore immutabile per variabili, righe e verdetto
 *
 * VERDETTO:
 * - INCONSISTENT: nessuna riga soddisfa tutte le premesse
 * - VALID: nessuna riga con premesse vere e conclusione falsa
 * - INVALID: almeno un controesempio, disponibile tramite {@link #firstCounterexample()}
 */
public final class TruthTable {

    private final List<String> variables;
    private final List<TruthTableRow> rows;
    private final Verdict verdict;

    public TruthTable(List<String> variables, List<TruthTableRow> rows, Verdict verdict) {
        if (variables == null || rows == null || verdict == null) {
            throw new IllegalArgumentException("Variabili, righe e verdetto sono obbligatori");
        }
        this.variables = List.copyOf(variables);
        this.rows = List.copyOf(rows);
        this.verdict = verdict;
    }

    /**
     * @return variabili distinte in ordine di prima apparizione
     */
    public List<String> getVariables() {
        return variables;
    }

    public List<TruthTableRow> getRows() {
        return rows;
    }

    public Verdict getVerdict() {
        return verdict;
    }

    public boolean isValid() {
        return verdict == Verdict.VALID;
    }

    public boolean isInconsistent() {
        return verdict == Verdict.INCONSISTENT;
    }

    /**
     * @return righe in cui le premesse sono vere e la conclusione è falsa
     */
    public List<TruthTableRow> counterexamples() {
        List<TruthTableRow> counterexamples = new ArrayList<>();
        for (TruthTableRow row : rows) {
            if (row.isCounterexample()) {
                counterexamples.add(row);
            }
        }
        return counterexamples;
    }

    public Optional<TruthTableRow> firstCounterexample() {
        for (TruthTableRow row : rows) {
            if (row.isCounterexample()) {
                return Optional.of(row);
            }
        }
        return Optional.empty();
    }

    /**
     * @return numero di righe che soddisfano tutte le premesse
     */
    public int countSatisfyingRows() {
        int count = 0;
        for (TruthTableRow row : rows) {
            if (row.isPremisesSatisfied()) count++;
        }
        return count;
    }
}
