package org.deduction;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * LETTORE FILE ARGOMENTO - Formato testuale a righe
 *
 * FORMATO:
 * <pre>
 * # commento
 * (P | Q) -> R
 * P
 * ~R
 * |- ~Q
 * </pre>
 * - una premessa per riga, spazi iniziali e finali rimossi
 * - la conclusione è l'unica riga che inizia con "|-"
 * - righe vuote e righe che iniziano con "#" ignorate
 */
public final class ArgumentFileReader {

    public static final String CONCLUSION_PREFIX = "|-";
    private static final String COMMENT_PREFIX = "#";

    private ArgumentFileReader() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @param path file dell'argomento (UTF-8)
     * @return argomento letto
     * @throws IOException se il file non è leggibile
     * @throws IllegalArgumentException se manca la conclusione o ne compare più di una
     */
    public static Argument read(Path path) throws IOException {
        return parse(Files.readAllLines(path, StandardCharsets.UTF_8));
    }

    /**
     * @param lines righe del file
     * @return argomento letto
     * @throws IllegalArgumentException se manca la conclusione o ne compare più di una
     */
    public static Argument parse(List<String> lines) {
        List<String> premises = new ArrayList<>();
        String conclusion = null;

        for (String rawLine : lines) {
            String line = rawLine.trim();
            if (line.isEmpty() || line.startsWith(COMMENT_PREFIX)) {
                continue;
            }

            if (line.startsWith(CONCLUSION_PREFIX)) {
                if (conclusion != null) {
                    throw new IllegalArgumentException("Più di una conclusione nel file: \"" + line + "\"");
                }
                conclusion = line.substring(CONCLUSION_PREFIX.length()).trim();
            } else {
                premises.add(line);
            }
        }

        if (conclusion == null) {
            throw new IllegalArgumentException("Conclusione mancante: aggiungere una riga che inizia con " + CONCLUSION_PREFIX);
        }
        return new Argument(premises, conclusion);
    }
}
