package org.deduction;

import org.deduction.proof.Proof;
import org.deduction.proof.ProofStep;
import org.deduction.truthtable.TruthTable;
import org.deduction.truthtable.TruthTableRow;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rendering testuale di un {@link ArgumentReport}: tavola di verità, verdetto e prova.
 */
public final class ReportFormatter {

    private static final String COLUMN_SEPARATOR = " | ";

    private final boolean relevantStepsOnly;

    public ReportFormatter() {
        this(false);
    }

    /**
     * @param relevantStepsOnly true per mostrare solo i passi da cui dipende la conclusione
     */
    public ReportFormatter(boolean relevantStepsOnly) {
        this.relevantStepsOnly = relevantStepsOnly;
    }

    public String format(ArgumentReport report) {
        StringBuilder out = new StringBuilder();
        out.append(formatTruthTable(report)).append('\n');
        out.append(formatVerdict(report)).append('\n');
        report.getTruthTable().firstCounterexample()
                .ifPresent(row -> out.append("Counterexample: ").append(formatAssignment(row.getAssignment())).append('\n'));
        out.append('\n');
        out.append(formatProof(report));
        return out.toString();
    }

    //region TAVOLA DI VERITÀ

    /**
     * Una colonna per variabile, una per premessa e una per la conclusione; celle T/F.
     */
    public String formatTruthTable(ArgumentReport report) {
        TruthTable table = report.getTruthTable();

        List<String> headers = new ArrayList<>(table.getVariables());
        headers.addAll(report.getArgument().getPremises());
        headers.add(report.getArgument().getConclusion());

        StringBuilder out = new StringBuilder();
        appendRow(out, headers, headers);
        appendSeparator(out, headers);

        for (TruthTableRow row : table.getRows()) {
            List<String> cells = new ArrayList<>(headers.size());
            for (String variable : table.getVariables()) {
                cells.add(symbol(row.valueOf(variable)));
            }
            for (Boolean premiseValue : row.getPremiseValues()) {
                cells.add(symbol(premiseValue));
            }
            cells.add(symbol(row.isConclusionTrue()));
            appendRow(out, cells, headers);
        }
        return out.toString();
    }

    private static void appendRow(StringBuilder out, List<String> cells, List<String> headers) {
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) out.append(COLUMN_SEPARATOR);
            out.append(pad(cells.get(i), headers.get(i).length()));
        }
        out.append('\n');
    }

    private static void appendSeparator(StringBuilder out, List<String> headers) {
        for (int i = 0; i < headers.size(); i++) {
            if (i > 0) out.append("-+-");
            out.append("-".repeat(Math.max(1, headers.get(i).length())));
        }
        out.append('\n');
    }

    private static String pad(String text, int width) {
        if (text.length() >= width) return text;
        return text + " ".repeat(width - text.length());
    }

    private static String symbol(boolean value) {
        return value ? "T" : "F";
    }

    private static String formatAssignment(Map<String, Boolean> assignment) {
        List<String> parts = new ArrayList<>();
        for (Map.Entry<String, Boolean> entry : assignment.entrySet()) {
            parts.add(entry.getKey() + "=" + symbol(entry.getValue()));
        }
        return String.join(", ", parts);
    }

    //endregion

    //region VERDETTO E PROVA

    public String formatVerdict(ArgumentReport report) {
        String conclusion = report.getArgument().getConclusion();
        return switch (report.getVerdict()) {
            case INCONSISTENT -> "Premises are inconsistent (unsatisfiable). Any conclusion follows.";
            case VALID -> "Conclusion \"" + conclusion + "\" is VALID (truth-table confirmed).";
            case INVALID -> "Conclusion \"" + conclusion + "\" is INVALID (truth-table confirmed).";
        };
    }

    public String formatProof(ArgumentReport report) {
        Proof proof = report.getProof();
        if (!proof.isDerived()) {
            return switch (report.getVerdict()) {
                case VALID, INCONSISTENT ->
                        "No direct natural-deduction derivation found with the current simple rules, but truth-table confirms validity.\n";
                case INVALID -> "No natural-deduction derivation found. Truth-table shows the argument is invalid.\n";
            };
        }

        StringBuilder out = new StringBuilder();
        out.append(proof.getMethod().getTitle()).append('\n');
        proof.getAssumption().ifPresent(a -> out.append("Assume ").append(a).append('\n'));

        List<ProofStep> steps = relevantStepsOnly ? proof.relevantSteps() : proof.getSteps();
        for (ProofStep step : steps) {
            out.append(step).append('\n');
        }
        return out.toString();
    }

    //endregion
}
