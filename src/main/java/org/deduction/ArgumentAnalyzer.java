package org.deduction;

import org.deduction.formula.Expression;
import org.deduction.formula.FormulaParser;
import org.deduction.proof.Proof;
import org.deduction.proof.ProofGenerator;
import org.deduction.truthtable.TruthTable;
import org.deduction.truthtable.TruthTableChecker;

import java.util.List;
import java.util.logging.Logger;

/**
 * ANALIZZATORE ARGOMENTI - Punto di ingresso unico del nucleo logico
 *
 * PIPELINE:
 * 1. Parsing di premesse e conclusione ({@link FormulaParser})
 * 2. Verdetto per tavola di verità ({@link TruthTableChecker})
 * 3. Tentativo di prova per deduzione naturale ({@link ProofGenerator})
 *
 * Ogni chiamata è indipendente e usa solo stato locale.
 */
public class ArgumentAnalyzer {

    private static final Logger LOGGER = Logger.getLogger(ArgumentAnalyzer.class.getName());

    private final TruthTableChecker truthTableChecker;
    private final ProofGenerator proofGenerator;

    public ArgumentAnalyzer() {
        this(new TruthTableChecker(), new ProofGenerator());
    }

    public ArgumentAnalyzer(TruthTableChecker truthTableChecker, ProofGenerator proofGenerator) {
        if (truthTableChecker == null || proofGenerator == null) {
            throw new IllegalArgumentException("Verificatore e generatore prove sono obbligatori");
        }
        this.truthTableChecker = truthTableChecker;
        this.proofGenerator = proofGenerator;
    }

    /**
     * @param premiseTexts premesse testuali, l'ordine determina l'indice "Premise k"
     * @param conclusionText conclusione testuale
     * @return report con tavola di verità e prova
     * @throws org.deduction.formula.ParseException se una formula non è valida
     */
    public ArgumentReport analyze(List<String> premiseTexts, String conclusionText) {
        return analyze(new Argument(premiseTexts, conclusionText));
    }

    public ArgumentReport analyze(Argument argument) {
        LOGGER.fine("Analisi argomento: " + argument.getPremises() + " |- " + argument.getConclusion());

        List<Expression> premises = FormulaParser.parseAll(argument.getPremises());
        Expression conclusion = FormulaParser.parse(argument.getConclusion());

        TruthTable truthTable = truthTableChecker.check(premises, conclusion);
        Proof proof = proofGenerator.prove(premises, conclusion);

        LOGGER.info("Argomento analizzato: verdetto " + truthTable.getVerdict() + ", prova " + proof.getMethod());
        return new ArgumentReport(argument, premises, conclusion, truthTable, proof);
    }
}
