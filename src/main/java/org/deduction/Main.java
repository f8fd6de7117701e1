package org.deduction;

import org.deduction.formula.InvalidFormulaException;
import org.deduction.formula.ParseException;
import org.deduction.inference.ForwardChainingEngine;
import org.deduction.proof.ProofGenerator;
import org.deduction.truthtable.TruthTableChecker;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * SOLUTORE DEDUZIONE PROPOSIZIONALE
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: argomento da file, da directory, da linea di comando o esempio integrato
 * 2. PARSING: formule infisse -> alberi di espressione (ANTLR)
 * 3. TAVOLA DI VERITÀ: verdetto INCONSISTENT / VALID / INVALID
 * 4. DEDUZIONE NATURALE: derivazione diretta o condizionale con regole fisse
 * 5. OUTPUT: report testuale a console ed eventualmente in RESULT/
 *
 * MODALITÀ OPERATIVE:
 * - File singolo (-f), directory batch (-d), esempio (-e), formule inline (-p ... -c ...)
 * - Timeout configurabile per argomento (-t secondi)
 * - Limiti su variabili della tavola (-max-vars) e passi del motore (-max-passes)
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     */
    private static final String HELP_PARAM = "-h";
    private static final String FILE_PARAM = "-f";
    private static final String DIR_PARAM = "-d";
    private static final String EXAMPLE_PARAM = "-e";
    private static final String PREMISE_PARAM = "-p";
    private static final String CONCLUSION_PARAM = "-c";
    private static final String OUTPUT_PARAM = "-o";
    private static final String TIMEOUT_PARAM = "-t";
    private static final String MAX_VARIABLES_PARAM = "-max-vars";
    private static final String MAX_PASSES_PARAM = "-max-passes";
    private static final String RELEVANT_PARAM = "-relevant";
    private static final String VERBOSE_PARAM = "-v";

    /**
     * Timeout di default e limiti
     */
    private static final int DEFAULT_TIMEOUT_SECONDS = 10;
    private static final int MIN_TIMEOUT_SECONDS = 1;

    private static final String ARGUMENT_EXTENSION = ".txt";
    private static final String RESULT_EXTENSION = ".result";
    private static final String RESULT_DIRECTORY = "RESULT";
    private static final String LOGGING_CONFIGURATION = "/logging.properties";

    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    public static void main(String[] args) {
        configureLogging();
        System.out.println("---> AVVIO SOLUTORE DEDUZIONE <---");

        try {
            if (args.length == 0) {
                System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return;
            }

            DeductionConfiguration config = parseAndValidateArguments(args);
            if (config == null) return;

            if (config.verbose) {
                Logger.getLogger("org.deduction").setLevel(Level.FINE);
            }
            executeMainPipeline(config);

        } catch (Exception e) {
            handleGlobalError(e);
        } finally {
            System.out.println("---> FINE ESECUZIONE SOLUTORE DEDUZIONE <---");
        }
    }

    private static void executeMainPipeline(DeductionConfiguration config) {
        ArgumentAnalyzer analyzer = createAnalyzer(config);

        switch (config.mode) {
            case FILE -> {
                System.out.println("[I] Modalità: Elaborazione file singolo");
                processFile(Paths.get(config.inputPath), analyzer, config);
            }
            case DIRECTORY -> {
                System.out.println("[I] Modalità: Elaborazione della directory");
                processDirectoryBatch(analyzer, config);
            }
            case EXAMPLE -> {
                System.out.println("[I] Modalità: Argomento di esempio");
                processArgument("example", Argument.example(), analyzer, config);
            }
            case INLINE -> {
                System.out.println("[I] Modalità: Formule da linea di comando");
                processArgument("inline", new Argument(config.premises, config.conclusion), analyzer, config);
            }
        }
    }

    private static ArgumentAnalyzer createAnalyzer(DeductionConfiguration config) {
        TruthTableChecker checker = new TruthTableChecker(config.maxVariables);
        ProofGenerator generator = new ProofGenerator(new ForwardChainingEngine(config.maxPasses));
        return new ArgumentAnalyzer(checker, generator);
    }

    private static void handleGlobalError(Exception e) {
        LOGGER.log(Level.SEVERE, "Errore critico", e);
        System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
        System.out.println("Controllare i log per dettagli completi.");
        System.exit(1);
    }

    /**
     * Carica la configurazione di logging dal classpath; in assenza resta quella della JVM.
     */
    private static void configureLogging() {
        try (InputStream stream = Main.class.getResourceAsStream(LOGGING_CONFIGURATION)) {
            if (stream != null) {
                LogManager.getLogManager().readConfiguration(stream);
            }
        } catch (IOException e) {
            System.err.println("[W] Configurazione logging non caricata: " + e.getMessage());
        }
    }

    //endregion

    //region ELABORAZIONE ARGOMENTI

    private static void processDirectoryBatch(ArgumentAnalyzer analyzer, DeductionConfiguration config) {
        List<File> files = findAllArgumentFiles(config.inputPath);
        if (files.isEmpty()) {
            System.out.println("[W] Nessun file " + ARGUMENT_EXTENSION + " trovato in " + config.inputPath);
            return;
        }

        int processed = 0;
        int failed = 0;
        for (File file : files) {
            if (processFile(file.toPath(), analyzer, config)) {
                processed++;
            } else {
                failed++;
            }
        }

        System.out.println("\n-->> RIEPILOGO BATCH <<--");
        System.out.println("File elaborati: " + processed);
        System.out.println("File con errori: " + failed);
    }

    private static List<File> findAllArgumentFiles(String dirPath) {
        File[] files = new File(dirPath).listFiles((dir, name) -> name.endsWith(ARGUMENT_EXTENSION));
        if (files == null) {
            return List.of();
        }
        Arrays.sort(files);
        return Arrays.asList(files);
    }

    /**
     * @return true se l'argomento è stato analizzato
     */
    private static boolean processFile(Path path, ArgumentAnalyzer analyzer, DeductionConfiguration config) {
        System.out.println("\n-->> ELABORAZIONE FILE <<--");
        System.out.println("File: " + path.getFileName());

        Argument argument;
        try {
            argument = ArgumentFileReader.read(path);
        } catch (IOException | IllegalArgumentException e) {
            System.out.println("[E] File non valido " + path + ": " + e.getMessage());
            return false;
        }
        return processArgument(getBaseFileName(path), argument, analyzer, config);
    }

    /**
     * Analizza un argomento con timeout, stampa il report e lo salva se richiesto.
     *
     * @return true se l'analisi è terminata
     */
    private static boolean processArgument(String name, Argument argument, ArgumentAnalyzer analyzer,
                                           DeductionConfiguration config) {
        ArgumentReport report = analyzeWithTimeout(argument, analyzer, config);
        if (report == null) {
            return false;
        }

        String text = new ReportFormatter(config.relevantStepsOnly).format(report);
        System.out.println(text);

        if (config.outputPath != null) {
            try {
                saveReport(name, text, config);
            } catch (IOException e) {
                System.out.println("[E] Salvataggio report fallito: " + e.getMessage());
                return false;
            }
        }
        return true;
    }

    /**
     * Esegue l'analisi su un thread dedicato per poterla interrompere allo scadere del timeout.
     *
     * @return report, oppure null per timeout o formula non valida
     */
    private static ArgumentReport analyzeWithTimeout(Argument argument, ArgumentAnalyzer analyzer,
                                                     DeductionConfiguration config) {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<ArgumentReport> future = executor.submit(() -> analyzer.analyze(argument));
            return future.get(config.timeoutSeconds, TimeUnit.SECONDS);

        } catch (TimeoutException e) {
            System.out.println("[W] Timeout raggiunto dopo " + config.timeoutSeconds + " secondi");
            return null;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof InvalidFormulaException) {
                reportInputError(argument, (InvalidFormulaException) cause);
                return null;
            }
            if (cause instanceof IllegalArgumentException) {
                System.out.println("[E] " + cause.getMessage());
                return null;
            }
            throw new IllegalStateException("Errore durante l'analisi dell'argomento", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Analisi interrotta", e);
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Indica quale formula dell'argomento ha causato l'errore, riportando il messaggio invariato.
     */
    private static void reportInputError(Argument argument, InvalidFormulaException e) {
        String location = "conclusione";
        int premiseIndex = e.getInput() == null ? -1 : argument.getPremises().indexOf(e.getInput());
        if (premiseIndex >= 0) {
            location = "premessa " + (premiseIndex + 1);
        }

        System.out.println("[E] Errore di parsing nella " + location + " \"" + e.getInput() + "\": " + e.getMessage());
        if (e instanceof ParseException && !((ParseException) e).isAtEndOfInput()) {
            System.out.println("    posizione " + ((ParseException) e).getPosition());
        }
    }

    private static void saveReport(String name, String text, DeductionConfiguration config) throws IOException {
        Path directory = Paths.get(config.outputPath, RESULT_DIRECTORY);
        Files.createDirectories(directory);
        Path target = directory.resolve(name + RESULT_EXTENSION);
        Files.writeString(target, text, StandardCharsets.UTF_8);
        System.out.println("[I] Report salvato in " + target);
    }

    private static String getBaseFileName(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    private static void printApplicationHelp() {
        System.out.println("\n::>> SOLUTORE DEDUZIONE PROPOSIZIONALE <<::");
        System.out.println("Verifica di argomenti con tavola di verità e deduzione naturale in avanti\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar solutore-deduzione.jar [opzioni]\n");

        System.out.println("MODALITÀ OPERATIVE:");
        System.out.println("  -f <file>          Analizza un file argomento");
        System.out.println("  -d <directory>     Analizza tutti i file .txt di una directory");
        System.out.println("  -e                 Analizza l'argomento di esempio");
        System.out.println("  -p <formula>       Premessa inline (ripetibile), da usare con -c");
        System.out.println("  -c <formula>       Conclusione inline");
        System.out.println();
        System.out.println("OPZIONI:");
        System.out.println("  -o <directory>     Salva i report in <directory>/RESULT");
        System.out.println("  -t <secondi>       Timeout per argomento (min: 1, default: 10)");
        System.out.println("  -max-vars <n>      Variabili massime per la tavola (default: " + TruthTableChecker.DEFAULT_MAX_VARIABLES + ")");
        System.out.println("  -max-passes <n>    Passi massimi del motore (default: " + ForwardChainingEngine.DEFAULT_MAX_PASSES + ")");
        System.out.println("  -relevant          Mostra solo i passi da cui dipende la conclusione");
        System.out.println("  -v                 Logging dettagliato");
        System.out.println("  -h                 Mostra questa guida\n");

        System.out.println("FORMATO FILE ARGOMENTO:");
        System.out.println("  Una premessa per riga, conclusione sulla riga che inizia con |-");
        System.out.println("  Righe vuote e righe che iniziano con # ignorate\n");

        System.out.println("SINTASSI FORMULE:");
        System.out.println("  ~ (not), & (and), | (or), -> (implica, associativo a destra), parentesi");
        System.out.println("  Precedenza: ~ poi & poi | poi ->\n");

        System.out.println("ESEMPI DI UTILIZZO:");
        System.out.println("  java -jar solutore-deduzione.jar -e");
        System.out.println("  java -jar solutore-deduzione.jar -p \"P -> Q\" -p \"~Q\" -c \"~P\"");
        System.out.println("  java -jar solutore-deduzione.jar -d ./argomenti/ -o ./output/ -relevant\n");

        System.out.println("NOTE OPERATIVE:");
        System.out.println("  - Il verdetto è sempre quello della tavola di verità");
        System.out.println("  - Una derivazione non trovata non implica invalidità: le regole sono incomplete");
        System.out.println("  - La tavola cresce come 2^k nel numero k di variabili\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    private enum Mode { FILE, DIRECTORY, EXAMPLE, INLINE }

    /**
     * Configurazione validata dell'applicazione.
     */
    private static class DeductionConfiguration {
        final Mode mode;
        final String inputPath;
        final List<String> premises;
        final String conclusion;
        final String outputPath;
        final int timeoutSeconds;
        final int maxVariables;
        final int maxPasses;
        final boolean relevantStepsOnly;
        final boolean verbose;

        DeductionConfiguration(Mode mode, String inputPath, List<String> premises, String conclusion,
                               String outputPath, int timeoutSeconds, int maxVariables, int maxPasses,
                               boolean relevantStepsOnly, boolean verbose) {
            this.mode = mode;
            this.inputPath = inputPath;
            this.premises = premises;
            this.conclusion = conclusion;
            this.outputPath = outputPath;
            this.timeoutSeconds = timeoutSeconds;
            this.maxVariables = maxVariables;
            this.maxPasses = maxPasses;
            this.relevantStepsOnly = relevantStepsOnly;
            this.verbose = verbose;
        }
    }

    private static DeductionConfiguration parseAndValidateArguments(String[] args) {
        try {
            return new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    /**
     * Parser dei parametri da linea di comando.
     */
    private static class ArgumentParser {

        /**
         * @return configurazione validata, null se è stato richiesto l'help
         * @throws IllegalArgumentException se i parametri sono invalidi o in conflitto
         */
        DeductionConfiguration parse(String[] args) {
            Mode mode = null;
            String inputPath = null;
            List<String> premises = new ArrayList<>();
            String conclusion = null;
            String outputPath = null;
            int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
            int maxVariables = TruthTableChecker.DEFAULT_MAX_VARIABLES;
            int maxPasses = ForwardChainingEngine.DEFAULT_MAX_PASSES;
            boolean relevantStepsOnly = false;
            boolean verbose = false;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }
                    case FILE_PARAM -> {
                        mode = selectMode(mode, Mode.FILE);
                        inputPath = getNextArgument(args, ++i, "file");
                        if (!Files.isRegularFile(Paths.get(inputPath))) {
                            throw new IllegalArgumentException("File non trovato: " + inputPath);
                        }
                    }
                    case DIR_PARAM -> {
                        mode = selectMode(mode, Mode.DIRECTORY);
                        inputPath = getNextArgument(args, ++i, "directory");
                        if (!Files.isDirectory(Paths.get(inputPath))) {
                            throw new IllegalArgumentException("Directory non trovata: " + inputPath);
                        }
                    }
                    case EXAMPLE_PARAM -> mode = selectMode(mode, Mode.EXAMPLE);
                    case PREMISE_PARAM -> {
                        mode = mode == Mode.INLINE ? mode : selectMode(mode, Mode.INLINE);
                        premises.add(getNextArgument(args, ++i, "premessa"));
                    }
                    case CONCLUSION_PARAM -> {
                        mode = mode == Mode.INLINE ? mode : selectMode(mode, Mode.INLINE);
                        if (conclusion != null) {
                            throw new IllegalArgumentException("Conclusione già specificata");
                        }
                        conclusion = getNextArgument(args, ++i, "conclusione");
                    }
                    case OUTPUT_PARAM -> outputPath = getNextArgument(args, ++i, "directory output");
                    case TIMEOUT_PARAM -> timeoutSeconds = parseBoundedInt(args, ++i, "timeout", MIN_TIMEOUT_SECONDS);
                    case MAX_VARIABLES_PARAM -> maxVariables = parseBoundedInt(args, ++i, "variabili massime", 1);
                    case MAX_PASSES_PARAM -> maxPasses = parseBoundedInt(args, ++i, "passi massimi", 1);
                    case RELEVANT_PARAM -> relevantStepsOnly = true;
                    case VERBOSE_PARAM -> verbose = true;
                    default -> throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                }
            }

            if (mode == null) {
                throw new IllegalArgumentException("Specificare una modalità: -f, -d, -e oppure -p/-c");
            }
            if (mode == Mode.INLINE && conclusion == null) {
                throw new IllegalArgumentException("Le premesse inline richiedono una conclusione (-c)");
            }

            return new DeductionConfiguration(mode, inputPath, premises, conclusion, outputPath,
                    timeoutSeconds, maxVariables, maxPasses, relevantStepsOnly, verbose);
        }

        private Mode selectMode(Mode current, Mode requested) {
            if (current != null && current != requested) {
                throw new IllegalArgumentException("Modalità " + current + " e " + requested + " sono mutualmente esclusive");
            }
            if (current == requested && requested != Mode.INLINE) {
                throw new IllegalArgumentException("Modalità " + requested + " specificata più volte");
            }
            return requested;
        }

        private String getNextArgument(String[] args, int index, String paramName) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Valore mancante per " + paramName);
            }
            return args[index];
        }

        private int parseBoundedInt(String[] args, int index, String paramName, int minimum) {
            String value = getNextArgument(args, index, paramName);
            try {
                int parsed = Integer.parseInt(value);
                if (parsed < minimum) {
                    throw new IllegalArgumentException("Valore per " + paramName + " deve essere almeno " + minimum + ": " + parsed);
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valore numerico non valido per " + paramName + ": " + value, e);
            }
        }
    }

    //endregion
}
