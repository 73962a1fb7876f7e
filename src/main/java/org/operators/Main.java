package org.operators;

import org.operators.formula.Formula;
import org.operators.parser.FormulaParser;
import org.operators.parser.FormulaSyntaxException;
import org.operators.reduction.OperatorBasis;
import org.operators.reduction.OperatorReducer;
import org.operators.semantics.TruthTable;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * RIDUTTORE DI OPERATORI - Riscrittura di formule su basi complete
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: Formula da linea di comando, file di testo o directory di file
 * 2. PARSING: Conversione notazione infissa -> albero {@link Formula} (ANTLR)
 * 3. RIDUZIONE: Riscrittura verso una o più basi tra {~,&,|}, {~,&}, {-&}, {->,~}, {->,F}
 * 4. VERIFICA (facoltativa): Confronto delle tavole di verità e controllo dell'alfabeto
 * 5. OUTPUT: Formule ridotte su console o in un file per ogni base
 *
 * MODALITÀ OPERATIVE SUPPORTATE:
 * - Espressione (-e): Riduzione di una singola formula, risultati su console
 * - File singolo (-f): Una formula per riga, righe vuote e commenti (#) ignorati
 * - Directory batch (-d): Elaborazione di tutti i file .txt di una cartella
 * - Selezione basi (-b=nao,na,nand,in,if oppure -b=all)
 * - Output directory personalizzabile (-o directory)
 *
 * ORGANIZZAZIONE DEGLI OUTPUT:
 * - <nome>_NOT_AND_OR.txt, <nome>_NAND.txt, ...: una formula ridotta per riga,
 *   nello stesso ordine del file di input
 *
 * @author Amos Lo Verde
 * @version 1.0.0
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String EXPRESSION_PARAM = "-e";
    private static final String FILE_PARAM = "-f";
    private static final String DIR_PARAM = "-d";
    private static final String OUTPUT_PARAM = "-o";
    private static final String BASIS_PARAM = "-b=";
    private static final String VERIFY_PARAM = "-verify";
    private static final String VERBOSE_PARAM = "-v";

    private static final String BASIS_ALL = "all";
    private static final String FORMULA_EXTENSION = ".txt";
    private static final String COMMENT_PREFIX = "#";

    /**
     * Codici di uscita
     * */
    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;

    /**
     * Previene istanziazione - classe utility
     * */
    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Coordina l'intero flusso: analisi dei parametri, configurazione del logging,
     * elaborazione nella modalità richiesta.
     *
     * @param args parametri linea di comando
     * @return codice di uscita, {@link #EXIT_OK} se tutte le formule sono state elaborate
     */
    static int run(String[] args) {
        System.out.println("---> AVVIO RIDUTTORE DI OPERATORI <---");

        try {
            if (args.length == 0) {
                System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return EXIT_ERROR;
            }

            ReducerConfiguration config = parseAndValidateArguments(args);
            if (config == null) {
                return Arrays.asList(args).contains(HELP_PARAM) ? EXIT_OK : EXIT_ERROR;
            }

            if (config.verbose) {
                enableVerboseLogging();
            }

            displayConfigurationSummary(config);
            BatchResult result = executeMainPipeline(config);
            displayBatchSummary(result);
            return result.isSuccessful() ? EXIT_OK : EXIT_ERROR;

        } catch (Exception e) {
            return handleGlobalError(e);
        } finally {
            System.out.println("---> FINE ESECUZIONE RIDUTTORE <---");
        }
    }

    private static BatchResult executeMainPipeline(ReducerConfiguration config) throws IOException {
        if (config.expression != null) {
            System.out.println("[I] Modalità: Espressione singola");
            return processExpression(config);
        } else if (config.isFileMode) {
            System.out.println("[I] Modalità: Elaborazione file singolo");
            return processSingleFile(Path.of(config.inputPath), config);
        } else {
            System.out.println("[I] Modalità: Elaborazione della directory");
            return processDirectoryBatch(config);
        }
    }

    private static int handleGlobalError(Exception e) {
        LOGGER.log(Level.SEVERE, "Errore critico nel riduttore", e);
        System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
        return EXIT_ERROR;
    }

    /**
     * Porta il logger del progetto a livello FINE con un handler dedicato su console.
     */
    private static void enableVerboseLogging() {
        Logger projectLogger = Logger.getLogger("org.operators");
        projectLogger.setLevel(Level.FINE);

        for (Handler handler : projectLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                return;
            }
        }
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        projectLogger.addHandler(handler);
        projectLogger.setUseParentHandlers(false);
    }

    //endregion

    //region PARSING E VALIDAZIONE PARAMETRI

    private static ReducerConfiguration parseAndValidateArguments(String[] args) {
        try {
            return new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    private static void displayConfigurationSummary(ReducerConfiguration config) {
        System.out.println("\n-->> CONFIGURAZIONE RIDUTTORE <<--");

        if (config.expression != null) {
            System.out.println("Formula: " + config.expression);
        } else {
            System.out.println("Modalità: " + (config.isFileMode ? "File singolo" : "Directory"));
            System.out.println("Input: " + config.inputPath);
            System.out.println("Output: " + (config.outputPath != null ? config.outputPath : "Directory input"));
        }

        String bases = config.bases.stream().map(Enum::name).collect(Collectors.joining(", "));
        System.out.println("Basi: " + bases);
        System.out.println("Verifica: " + (config.verify ? "Attiva" : "Non attiva"));
        System.out.println("====================================\n");
    }

    private static void printApplicationHelp() {
        System.out.println("""
                USO: java -jar riduttore-operatori.jar [modalità] [opzioni]

                MODALITÀ (mutualmente esclusive):
                  -e <formula>    Riduce una formula e stampa i risultati
                  -f <file>       Riduce ogni formula del file (una per riga)
                  -d <directory>  Riduce tutti i file .txt della directory

                OPZIONI:
                  -b=<basi>       Basi di arrivo separate da virgola, oppure 'all' (default)
                                  nao = {~,&,|}   na = {~,&}   nand = {-&}
                                  in  = {->,~}    if = {->,F}
                  -o <directory>  Directory dei risultati (default: quella dell'input)
                  -verify         Verifica tavola di verità e alfabeto di ogni risultato
                  -v              Log dettagliato
                  -h              Mostra questo help

                SINTASSI FORMULE:
                  variabili p, q, r1 ...   costanti T, F
                  ~a  a & b  a | b  a -> b  a + b  a <-> b  a -& b  a -| b
                """);
    }

    //endregion

    //region ELABORAZIONE ESPRESSIONE SINGOLA

    private static BatchResult processExpression(ReducerConfiguration config) {
        BatchResult batchResult = new BatchResult(1);
        Formula formula = FormulaParser.parse(config.expression);
        OperatorReducer reducer = new OperatorReducer();

        System.out.println("[I] Formula letta: " + formula);
        boolean verified = true;
        for (OperatorBasis basis : config.bases) {
            Formula reduced = reducer.reduce(formula, basis);
            System.out.println("[I] " + basis.name() + ": " + reduced);

            if (config.verify && !verifyReduction(formula, reduced, basis)) {
                verified = false;
            }
        }

        if (config.verify && verified) {
            System.out.println("[I] Verifica superata per tutte le basi");
            if (formula.getVariables().size() <= 4) {
                System.out.println(TruthTable.format(formula));
            }
        }

        if (verified) {
            batchResult.incrementSuccess();
        } else {
            batchResult.incrementError();
        }
        return batchResult;
    }

    //endregion

    //region ELABORAZIONE FILE

    /**
     * Riduce tutte le formule di un file e scrive un file di risultati per ogni base.
     *
     * Le righe non interpretabili vengono segnalate e saltate, senza interrompere
     * l'elaborazione delle successive.
     */
    private static BatchResult processSingleFile(Path inputFile, ReducerConfiguration config) throws IOException {
        System.out.println("-->> ELABORAZIONE FILE <<--");
        System.out.println("File: " + inputFile.getFileName());

        List<String> formulaLines = readFormulaLines(inputFile);
        BatchResult batchResult = new BatchResult(formulaLines.size());
        OperatorReducer reducer = new OperatorReducer();

        Map<OperatorBasis, List<String>> outputs = new EnumMap<>(OperatorBasis.class);
        for (OperatorBasis basis : config.bases) {
            outputs.put(basis, new ArrayList<>());
        }

        for (String line : formulaLines) {
            Formula formula;
            try {
                formula = FormulaParser.parse(line);
            } catch (FormulaSyntaxException e) {
                LOGGER.warning("Formula scartata '" + line + "': " + e.getMessage());
                System.out.println("[W] Formula non valida, saltata: " + line + " (" + e.getMessage() + ")");
                batchResult.incrementError();
                continue;
            }

            boolean verified = true;
            for (OperatorBasis basis : config.bases) {
                Formula reduced = reducer.reduce(formula, basis);
                outputs.get(basis).add(reduced.toString());

                if (config.verify && !verifyReduction(formula, reduced, basis)) {
                    verified = false;
                }
            }

            if (verified) {
                batchResult.incrementSuccess();
            } else {
                batchResult.incrementError();
            }
        }

        writeResults(inputFile, outputs, config);
        System.out.println("[I] Formule elaborate: " + batchResult.successCount + "/" + batchResult.totalFormulas);
        return batchResult;
    }

    private static List<String> readFormulaLines(Path inputFile) throws IOException {
        try (Stream<String> lines = Files.lines(inputFile)) {
            return lines.map(String::trim)
                    .filter(line -> !line.isEmpty() && !line.startsWith(COMMENT_PREFIX))
                    .collect(Collectors.toList());
        }
    }

    private static void writeResults(Path inputFile, Map<OperatorBasis, List<String>> outputs,
                                     ReducerConfiguration config) throws IOException {
        Path outputDir = config.outputPath != null
                ? Path.of(config.outputPath)
                : inputFile.toAbsolutePath().getParent();
        String baseName = stripExtension(inputFile.getFileName().toString());

        for (Map.Entry<OperatorBasis, List<String>> entry : outputs.entrySet()) {
            Path outputFile = outputDir.resolve(baseName + "_" + entry.getKey().name() + FORMULA_EXTENSION);
            Files.write(outputFile, entry.getValue());
            LOGGER.fine(() -> "Risultati scritti in " + outputFile);
        }
    }

    private static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    //endregion

    //region ELABORAZIONE DELLA DIRECTORY

    /**
     * Elabora tutti i file .txt di una directory, esclusi i risultati di
     * elaborazioni precedenti (file che terminano con _BASE.txt).
     */
    private static BatchResult processDirectoryBatch(ReducerConfiguration config) throws IOException {
        System.out.println("[I] Inizio elaborazione directory: " + config.inputPath);

        List<Path> files = findFormulaFiles(Path.of(config.inputPath));
        if (files.isEmpty()) {
            System.out.println("[W] Nessun file .txt trovato nella directory specificata.");
            return new BatchResult(0);
        }

        BatchResult total = new BatchResult(0);
        for (Path file : files) {
            try {
                total.merge(processSingleFile(file, config));
            } catch (IOException e) {
                LOGGER.log(Level.SEVERE, "Errore durante l'elaborazione di " + file, e);
                System.out.println("[E] Errore elaborazione " + file.getFileName() + ": " + e.getMessage());
                total.incrementError();
            }
        }
        return total;
    }

    private static List<Path> findFormulaFiles(Path directory) throws IOException {
        try (Stream<Path> entries = Files.list(directory)) {
            return entries.filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(FORMULA_EXTENSION))
                    .filter(path -> !isResultFile(path))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private static boolean isResultFile(Path path) {
        String name = path.getFileName().toString();
        for (OperatorBasis basis : OperatorBasis.values()) {
            if (name.endsWith("_" + basis.name() + FORMULA_EXTENSION)) {
                return true;
            }
        }
        return false;
    }

    private static void displayBatchSummary(BatchResult result) {
        System.out.println("\n-->> RIEPILOGO <<--");
        System.out.println("Formule: " + result.totalFormulas);
        System.out.println("Successi: " + result.successCount);
        System.out.println("Errori: " + result.errorCount);
    }

    //endregion

    //region VERIFICA

    /**
     * Controlla che la formula ridotta abbia la stessa tavola di verità
     * dell'originale e usi solo gli operatori della base.
     */
    private static boolean verifyReduction(Formula original, Formula reduced, OperatorBasis basis) {
        boolean equivalent = TruthTable.isEquivalent(original, reduced);
        boolean admitted = basis.admits(reduced);

        if (!equivalent) {
            System.out.println("[E] " + basis.name() + ": tavola di verità diversa per " + original);
        }
        if (!admitted) {
            System.out.println("[E] " + basis.name() + ": operatori fuori base in " + reduced);
        }
        return equivalent && admitted;
    }

    //endregion

    //region CLASSI DI SUPPORTO

    /**
     * Configurazione immutabile del riduttore costruita dai parametri.
     */
    private static class ReducerConfiguration {
        final String expression;
        final String inputPath;
        final String outputPath;
        final boolean isFileMode;
        final Set<OperatorBasis> bases;
        final boolean verify;
        final boolean verbose;

        ReducerConfiguration(String expression, String inputPath, String outputPath, boolean isFileMode,
                             Set<OperatorBasis> bases, boolean verify, boolean verbose) {
            this.expression = expression;
            this.inputPath = inputPath;
            this.outputPath = outputPath;
            this.isFileMode = isFileMode;
            this.bases = bases;
            this.verify = verify;
            this.verbose = verbose;
        }
    }

    /**
     * Parser per parametri linea di comando.
     */
    private static class ArgumentParser {

        /**
         * PARAMETRI SUPPORTATI:
         * -h: Mostra help e termina
         * -e <formula>: Formula singola (esclusivo con -f e -d)
         * -f <file>: Input file singolo (esclusivo con -e e -d)
         * -d <dir>: Input directory per batch (esclusivo con -e e -f)
         * -o <dir>: Directory output personalizzata
         * -b=<basi>: Basi di arrivo
         * -verify: Verifica dei risultati
         * -v: Log dettagliato
         *
         * @return configurazione validata (null se help richiesto)
         * @throws IllegalArgumentException se parametri invalidi
         */
        public ReducerConfiguration parse(String[] args) {
            String expression = null;
            String inputPath = null;
            String outputPath = null;
            boolean isFileMode = false;
            boolean isDirectoryMode = false;
            Set<OperatorBasis> bases = EnumSet.allOf(OperatorBasis.class);
            boolean verify = false;
            boolean verbose = false;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }

                    case EXPRESSION_PARAM -> {
                        validateExclusiveMode(isFileMode || isDirectoryMode, "espressione");
                        expression = getNextArgument(args, ++i, "formula");
                    }

                    case FILE_PARAM -> {
                        validateExclusiveMode(expression != null || isDirectoryMode, "file");
                        inputPath = getNextArgument(args, ++i, "file");
                        validateFileExists(inputPath);
                        isFileMode = true;
                    }

                    case DIR_PARAM -> {
                        validateExclusiveMode(expression != null || isFileMode, "directory");
                        inputPath = getNextArgument(args, ++i, "directory");
                        validateDirectoryExists(inputPath);
                        isDirectoryMode = true;
                    }

                    case OUTPUT_PARAM -> {
                        outputPath = getNextArgument(args, ++i, "directory output");
                        validateOrCreateOutputDirectory(outputPath);
                    }

                    case VERIFY_PARAM -> verify = true;

                    case VERBOSE_PARAM -> verbose = true;

                    default -> {
                        if (args[i].startsWith(BASIS_PARAM)) {
                            bases = parseBases(args[i].substring(BASIS_PARAM.length()));
                        } else {
                            throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                        }
                    }
                }
            }

            if (expression == null && inputPath == null) {
                throw new IllegalArgumentException("Specificare una formula con -e, un file con -f o una directory con -d");
            }

            return new ReducerConfiguration(expression, inputPath, outputPath, isFileMode,
                    bases, verify, verbose);
        }

        private void validateExclusiveMode(boolean otherModeActive, String currentMode) {
            if (otherModeActive) {
                throw new IllegalArgumentException("Modalità " + currentMode +
                        " non può essere combinata con altre modalità (espressione/file/directory sono mutualmente esclusive)");
            }
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] +
                        " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        /**
         * Converte l'elenco di chiavi separate da virgola nelle basi corrispondenti.
         */
        private Set<OperatorBasis> parseBases(String value) {
            if (value == null || value.trim().isEmpty()) {
                throw new IllegalArgumentException("Valore -b vuoto");
            }
            if (value.trim().equalsIgnoreCase(BASIS_ALL)) {
                return EnumSet.allOf(OperatorBasis.class);
            }

            Set<OperatorBasis> bases = EnumSet.noneOf(OperatorBasis.class);
            Arrays.stream(value.split(","))
                    .map(OperatorBasis::fromKey)
                    .forEach(bases::add);
            return bases;
        }

        private void validateFileExists(String filePath) {
            File file = new File(filePath);
            if (!file.exists()) {
                throw new IllegalArgumentException("File non esistente: " + filePath);
            }
            if (!file.isFile()) {
                throw new IllegalArgumentException("Non è un file: " + filePath);
            }
            if (!file.canRead()) {
                throw new IllegalArgumentException("File non leggibile: " + filePath);
            }
        }

        private void validateDirectoryExists(String dirPath) {
            File dir = new File(dirPath);
            if (!dir.exists()) {
                throw new IllegalArgumentException("Directory non esistente: " + dirPath);
            }
            if (!dir.isDirectory()) {
                throw new IllegalArgumentException("Non è una directory: " + dirPath);
            }
        }

        private void validateOrCreateOutputDirectory(String dirPath) {
            File dir = new File(dirPath);
            if (!dir.exists()) {
                System.out.println("Creazione directory output: " + dirPath);
                if (!dir.mkdirs()) {
                    throw new IllegalArgumentException("Impossibile creare directory: " + dirPath);
                }
            } else if (!dir.isDirectory()) {
                throw new IllegalArgumentException("Percorso non è una directory: " + dirPath);
            }
        }
    }

    /**
     * Conteggio delle formule elaborate con successo o scartate.
     */
    private static class BatchResult {
        int totalFormulas;
        int successCount = 0;
        int errorCount = 0;

        BatchResult(int totalFormulas) {
            this.totalFormulas = totalFormulas;
        }

        void incrementSuccess() { successCount++; }
        void incrementError() { errorCount++; }

        void merge(BatchResult other) {
            totalFormulas += other.totalFormulas;
            successCount += other.successCount;
            errorCount += other.errorCount;
        }

        boolean isSuccessful() {
            return errorCount == 0;
        }
    }

    //endregion
}
