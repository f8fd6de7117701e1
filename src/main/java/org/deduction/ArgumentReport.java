package org.deduction;

import org.deduction.formula.Expression;
import org.deduction.proof.Proof;
import org.deduction.truthtable.TruthTable;
import org.deduction.truthtable.Verdict;

import java.util.List;

/**
 * Esito completo dell'analisi di un argomento: formule analizzate, tavola di verità e prova.
 *
 * La tavola di verità fornisce l'unico verdetto; la prova è solo una spiegazione aggiuntiva.
 */
public final class ArgumentReport {

    private final Argument argument;
    private final List<Expression> premises;
    private final Expression conclusion;
    private final TruthTable truthTable;
    private final Proof proof;

    public ArgumentReport(Argument argument, List<Expression> premises, Expression conclusion,
                          TruthTable truthTable, Proof proof) {
        this.argument = argument;
        this.premises = List.copyOf(premises);
        this.conclusion = conclusion;
        this.truthTable = truthTable;
        this.proof = proof;
    }

    public Argument getArgument() {
        return argument;
    }

    public List<Expression> getPremises() {
        return premises;
    }

    public Expression getConclusion() {
        return conclusion;
    }

    public TruthTable getTruthTable() {
        return truthTable;
    }

    public Verdict getVerdict() {
        return truthTable.getVerdict();
    }

    public Proof getProof() {
        return proof;
    }
}
