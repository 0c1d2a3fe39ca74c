package org.props;

import org.props.formula.Assignment;
import org.props.formula.Formula;
import org.props.formula.MissingVariableException;
import org.props.normalform.NormalFormConverter;
import org.props.parser.FormulaParser;
import org.props.parser.FormulaSyntaxException;
import org.props.semantics.EquivalenceChecker;
import org.props.semantics.TruthTable;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * STRUMENTO A RIGA DI COMANDO PER FORMULE PROPOSIZIONALI
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: Formula in linea (-e) oppure file con una formula per riga (-f)
 * 2. PARSING: Notazione infissa -> albero Formula (ANTLR)
 * 3. OPERAZIONI RICHIESTE:
 *    - Forme normali: -cnf, -dnf, -nnf
 *    - Tavola di verità: -table
 *    - Valutazione sotto assegnamento JSON: -eval {"p": true, "q": false}
 *    - Equivalenza con un'altra formula: -eq "NOT(p) OR q"
 * 4. OUTPUT: Risultati su standard output, messaggi [I]/[W]/[E]
 *
 * Senza operazioni esplicite viene stampata la classificazione della formula
 * (tautologia, soddisfacibile, contraddizione).
 *
 * Le operazioni per enumerazione esaustiva sono limitate da un timeout (-t secondi).
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
    private static final String CNF_PARAM = "-cnf";
    private static final String DNF_PARAM = "-dnf";
    private static final String NNF_PARAM = "-nnf";
    private static final String TABLE_PARAM = "-table";
    private static final String EVAL_PARAM = "-eval";
    private static final String EQUIVALENT_PARAM = "-eq";
    private static final String TIMEOUT_PARAM = "-t";
    private static final String PARALLEL_PARAM = "-par";

    /**
     * Configurazioni timeout di default e limiti
     * */
    private static final int DEFAULT_TIMEOUT_SECONDS = 10;
    private static final int MIN_TIMEOUT_SECONDS = 1;

    /**
     * Thread di elaborazione e attesa massima della sua terminazione dopo un timeout
     * */
    static final String WORKER_THREAD_NAME = "valutazione-formule";
    private static final int TERMINATION_GRACE_SECONDS = 5;

    /** Codici di uscita */
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

    /**
     * Punto principale dell'applicazione.
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        int status = run(args, System.out);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    /**
     * Esegue l'intero flusso scrivendo su {@code out}.
     *
     * FLUSSO ESECUZIONE:
     * 1. Parsing e validazione parametri linea di comando
     * 2. Lettura e analisi delle formule
     * 3. Esecuzione delle operazioni richieste su ciascuna formula
     * 4. Gestione errori globali
     *
     * @return codice di uscita: 0 in caso di successo, 1 in caso di errore
     */
    static int run(String[] args, PrintStream out) {
        try {
            // Validazione input utente
            if (args == null || args.length == 0) {
                out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return EXIT_ERROR;
            }

            // Parsing e validazione parametri
            CliConfiguration config;
            try {
                config = new ArgumentParser().parse(args);
            } catch (IllegalArgumentException e) {
                out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
                out.println("Usa -h per visualizzare l'help completo.");
                return EXIT_ERROR;
            }

            if (config == null) {
                printApplicationHelp(out);
                return EXIT_OK;
            }

            executeMainPipeline(config, out);
            return EXIT_OK;

        } catch (FormulaSyntaxException e) {
            out.println("[E] Errore di sintassi: " + e.getMessage());
            return EXIT_ERROR;
        } catch (MissingVariableException e) {
            out.println("[E] " + e.getMessage());
            return EXIT_ERROR;
        } catch (IllegalArgumentException e) {
            // Limiti di enumerazione superati
            out.println("[E] " + e.getMessage());
            return EXIT_ERROR;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            out.println("[E] Elaborazione interrotta");
            return EXIT_ERROR;
        } catch (Exception e) {
            return handleGlobalError(e, out);
        }
    }

    /**
     * Legge le formule ed esegue le operazioni richieste su ognuna.
     */
    private static void executeMainPipeline(CliConfiguration config, PrintStream out)
            throws IOException, InterruptedException {
        List<Formula> formulas = loadFormulas(config, out);
        if (formulas.isEmpty()) {
            out.println("[W] Nessuna formula da elaborare");
            return;
        }

        Formula other = config.otherFormula == null ? null : FormulaParser.parse(config.otherFormula);
        EquivalenceChecker checker = new EquivalenceChecker(config.parallel);

        for (Formula formula : formulas) {
            out.println("[I] Formula: " + formula.render());
            processFormula(formula, other, checker, config, out);
        }
    }

    /**
     * Gestisce errori critici dell'applicazione con logging completo.
     *
     * @param e eccezione critica che ha causato il fallimento
     * @return codice di uscita di errore
     */
    private static int handleGlobalError(Exception e, PrintStream out) {
        LOGGER.log(Level.SEVERE, "Errore critico nell'applicazione", e);
        out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
        out.println("Controllare i log per dettagli completi.");
        return EXIT_ERROR;
    }

    //endregion

    //region ELABORAZIONE FORMULE

    private static List<Formula> loadFormulas(CliConfiguration config, PrintStream out) throws IOException {
        if (config.expression != null) {
            return List.of(FormulaParser.parse(config.expression));
        }
        out.println("Lettura formule da " + config.inputPath + "...");
        List<String> lines = Files.readAllLines(Path.of(config.inputPath));
        List<Formula> formulas = FormulaParser.parseAll(lines);
        out.println("[I] Formule lette: " + formulas.size());
        return formulas;
    }

    private static void processFormula(Formula formula, Formula other, EquivalenceChecker checker,
                                       CliConfiguration config, PrintStream out) throws InterruptedException {
        if (!config.hasOperations()) {
            printSummary(formula, checker, config, out);
            return;
        }

        if (config.nnf) {
            out.println("NNF: " + NormalFormConverter.toNnf(formula));
        }
        if (config.cnf) {
            out.println("CNF: " + NormalFormConverter.toCnf(formula));
        }
        if (config.dnf) {
            out.println("DNF: " + NormalFormConverter.toDnf(formula));
        }
        if (config.assignment != null) {
            out.println("Valore sotto " + config.assignment.toJson() + ": " + formula.evaluate(config.assignment));
        }
        if (config.table) {
            TruthTable table = executeWithTimeout(() -> TruthTable.of(formula), config, out);
            if (table != null) {
                out.print(table.render());
            }
        }
        if (other != null) {
            Optional<Assignment> counterexample =
                    executeWithTimeout(() -> checker.counterexample(formula, other), config, out);
            if (counterexample != null) {
                if (counterexample.isEmpty()) {
                    out.println("Equivalente a " + other + ": true");
                } else {
                    out.println("Equivalente a " + other + ": false (controesempio "
                            + counterexample.get().toJson() + ")");
                }
            }
        }
    }

    private static void printSummary(Formula formula, EquivalenceChecker checker,
                                     CliConfiguration config, PrintStream out) throws InterruptedException {
        out.println("Variabili: " + formula.variables());
        out.println("Connettivi: " + formula.connectiveCount() + ", profondità: " + formula.depth());

        String classification = executeWithTimeout(() -> {
            if (checker.isTautology(formula)) {
                return "tautologia";
            }
            return checker.isSatisfiable(formula) ? "soddisfacibile" : "contraddizione";
        }, config, out);
        if (classification != null) {
            out.println("Classificazione: " + classification);
        }
    }

    /**
     * Esegue un'operazione per enumerazione con controllo del timeout.
     *
     * Utilizza ExecutorService per controllo temporale e interruzione
     * dell'elaborazione in caso di superamento del timeout configurato.
     * L'enumerazione degli assegnamenti si ferma all'interruzione del thread: dopo il
     * timeout si attende la terminazione del thread prima di proseguire.
     *
     * @return risultato, o null se il timeout è scaduto
     */
    private static <T> T executeWithTimeout(Callable<T> task, CliConfiguration config, PrintStream out)
            throws InterruptedException {
        ExecutorService executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread worker = new Thread(runnable, WORKER_THREAD_NAME);
            worker.setDaemon(true);
            return worker;
        });
        try {
            Future<T> future = executor.submit(task);
            return future.get(config.timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            out.println("[W] Timeout raggiunto dopo " + config.timeoutSeconds + " secondi");
            return null;
        } catch (ExecutionException e) {
            // Propaga l'errore originale dell'operazione
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Errore durante l'elaborazione", cause);
        } finally {
            executor.shutdownNow();
            if (!executor.awaitTermination(TERMINATION_GRACE_SECONDS, TimeUnit.SECONDS)) {
                LOGGER.warning("Thread di elaborazione non terminato dopo l'interruzione");
            }
        }
    }

    //endregion

    //region HELP

    private static void printApplicationHelp(PrintStream out) {
        out.println("Uso: java -jar logica-proposizionale.jar (-e <formula> | -f <file>) [opzioni]");
        out.println();
        out.println("INPUT:");
        out.println("  -e <formula>   Formula in linea, ad esempio \"(p AND q) IMPLIES r\"");
        out.println("  -f <file>      File con una formula per riga (# per i commenti)");
        out.println();
        out.println("OPERAZIONI:");
        out.println("  -cnf           Forma Normale Congiuntiva");
        out.println("  -dnf           Forma Normale Disgiuntiva");
        out.println("  -nnf           Forma Normale Negata");
        out.println("  -table         Tavola di verità");
        out.println("  -eval <json>   Valutazione, ad esempio {\"p\": true, \"q\": false}");
        out.println("  -eq <formula>  Verifica di equivalenza con un'altra formula");
        out.println();
        out.println("OPZIONI:");
        out.println("  -t <sec>       Timeout per tavole ed equivalenze (default " + DEFAULT_TIMEOUT_SECONDS + ")");
        out.println("  -par           Enumerazione parallela degli assegnamenti");
        out.println("  -h             Mostra questo messaggio");
        out.println();
        out.println("GRAMMATICA: connettivi NOT, AND, OR, IMPLIES, IFF (maiuscoli); NOT(p) richiede");
        out.println("le parentesi; connettivi diversi allo stesso livello richiedono parentesi.");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Configurazione validata dell'applicazione.
     *
     * Contiene tutti i parametri di esecuzione in forma immutabile
     * per garantire consistenza durante l'elaborazione.
     */
    static final class CliConfiguration {
        final String expression;
        final String inputPath;
        final boolean cnf;
        final boolean dnf;
        final boolean nnf;
        final boolean table;
        final Assignment assignment;
        final String otherFormula;
        final int timeoutSeconds;
        final boolean parallel;

        CliConfiguration(String expression, String inputPath, boolean cnf, boolean dnf, boolean nnf,
                         boolean table, Assignment assignment, String otherFormula,
                         int timeoutSeconds, boolean parallel) {
            this.expression = expression;
            this.inputPath = inputPath;
            this.cnf = cnf;
            this.dnf = dnf;
            this.nnf = nnf;
            this.table = table;
            this.assignment = assignment;
            this.otherFormula = otherFormula;
            this.timeoutSeconds = timeoutSeconds;
            this.parallel = parallel;
        }

        boolean hasOperations() {
            return cnf || dnf || nnf || table || assignment != null || otherFormula != null;
        }
    }

    /**
     * Parser per parametri linea di comando.
     *
     * Gestisce validazione completa di tutti i parametri con
     * messaggi di errore informativi per l'utente.
     */
    static final class ArgumentParser {

        /**
         * Processa sequenzialmente tutti i parametri della command line e costruisce
         * una configurazione validata.
         *
         * @param args parametri da linea comando forniti dall'utente
         * @return configurazione validata (null se help richiesto)
         * @throws IllegalArgumentException se parametri sintatticamente o semanticamente invalidi
         */
        CliConfiguration parse(String[] args) {
            String expression = null;
            String inputPath = null;
            boolean cnf = false;
            boolean dnf = false;
            boolean nnf = false;
            boolean table = false;
            Assignment assignment = null;
            String otherFormula = null;
            int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
            boolean parallel = false;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    // Mostra documentazione e termina senza configurazione
                    case HELP_PARAM -> {
                        return null;
                    }

                    // Formula in linea (mutualmente esclusiva con file)
                    case EXPRESSION_PARAM -> {
                        validateExclusiveInput(inputPath);
                        expression = getNextArgument(args, ++i, "formula");
                    }

                    // Input da file
                    case FILE_PARAM -> {
                        validateExclusiveInput(expression);
                        inputPath = getNextArgument(args, ++i, "file");
                        validateFileExists(inputPath);
                    }

                    case CNF_PARAM -> cnf = true;
                    case DNF_PARAM -> dnf = true;
                    case NNF_PARAM -> nnf = true;
                    case TABLE_PARAM -> table = true;
                    case PARALLEL_PARAM -> parallel = true;

                    // Assegnamento validato subito: JSON malformato è un errore dei parametri
                    case EVAL_PARAM -> assignment = Assignment.fromJson(getNextArgument(args, ++i, "assegnamento JSON"));
                    case EQUIVALENT_PARAM -> otherFormula = getNextArgument(args, ++i, "formula da confrontare");
                    case TIMEOUT_PARAM -> timeoutSeconds = parseAndValidateTimeout(getNextArgument(args, ++i, "timeout"));

                    default -> throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                }
            }

            if (expression == null && inputPath == null) {
                throw new IllegalArgumentException("Specificare una formula con -e oppure un file con -f");
            }

            return new CliConfiguration(expression, inputPath, cnf, dnf, nnf, table,
                    assignment, otherFormula, timeoutSeconds, parallel);
        }

        private void validateExclusiveInput(String otherInput) {
            if (otherInput != null) {
                throw new IllegalArgumentException("Le opzioni -e e -f sono mutualmente esclusive");
            }
        }

        private String getNextArgument(String[] args, int index, String description) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Valore mancante per il parametro: " + description);
            }
            return args[index];
        }

        private void validateFileExists(String path) {
            if (!Files.isRegularFile(Path.of(path))) {
                throw new IllegalArgumentException("File non trovato: " + path);
            }
        }

        private int parseAndValidateTimeout(String value) {
            int timeout;
            try {
                timeout = Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Timeout non numerico: " + value, e);
            }
            if (timeout < MIN_TIMEOUT_SECONDS) {
                throw new IllegalArgumentException("Timeout minimo " + MIN_TIMEOUT_SECONDS + " secondi, ricevuto: " + timeout);
            }
            return timeout;
        }
    }

    //endregion
}
