package org.deduction;

import java.util.List;

/**
 * Argomento testuale: premesse nell'ordine di input e una conclusione.
 */
public final class Argument {

    private final List<String> premises;
    private final String conclusion;

    /**
     * @param premises premesse testuali, l'ordine determina l'indice "Premise k"
     * @param conclusion conclusione testuale
     * @throws IllegalArgumentException se premesse o conclusione sono null
     */
    public Argument(List<String> premises, String conclusion) {
        if (premises == null || conclusion == null) {
            throw new IllegalArgumentException("Premesse e conclusione non possono essere null");
        }
        this.premises = List.copyOf(premises);
        this.conclusion = conclusion;
    }

    /**
     * Argomento di esempio: ((P | Q) -> R), P, ~R quindi ~Q.
     */
    public static Argument example() {
        return new Argument(List.of("(P | Q) -> R", "P", "~R"), "~Q");
    }

    public List<String> getPremises() {
        return premises;
    }

    public String getConclusion() {
        return conclusion;
    }

    @Override
    public String toString() {
        return premises + " |- " + conclusion;
    }
}
