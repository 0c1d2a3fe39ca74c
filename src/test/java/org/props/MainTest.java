package org.props;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Main - riga di comando")
class MainTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    private int run(String... args) {
        return Main.run(args, out);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private static String chain(String connective, int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> "x" + i)
                .collect(Collectors.joining(" " + connective + " "));
    }

    private static boolean workerAlive() {
        return Thread.getAllStackTraces().keySet().stream()
                .anyMatch(thread -> thread.getName().equals(Main.WORKER_THREAD_NAME) && thread.isAlive());
    }

    // ========== Parametri ==========

    @Test
    @DisplayName("Senza parametri: errore")
    void failsWithoutArguments() {
        assertEquals(Main.EXIT_ERROR, run());
        assertTrue(output().startsWith("[E] Nessun parametro fornito"));
    }

    @Test
    @DisplayName("-h stampa l'help")
    void printsHelp() {
        assertEquals(Main.EXIT_OK, run("-h"));
        assertTrue(output().startsWith("Uso: "));
        assertTrue(output().contains("-cnf"));
    }

    @Test
    @DisplayName("Parametri non validi producono un errore di validazione")
    void rejectsInvalidArguments() {
        assertEquals(Main.EXIT_ERROR, run("-x"));
        assertTrue(output().contains("Parametro sconosciuto: -x"));

        assertEquals(Main.EXIT_ERROR, run("-e", "p", "-t", "0"));
        assertEquals(Main.EXIT_ERROR, run("-e", "p", "-t", "abc"));
        assertEquals(Main.EXIT_ERROR, run("-e"));
        assertEquals(Main.EXIT_ERROR, run("-cnf"));
        assertEquals(Main.EXIT_ERROR, run("-f", "file-inesistente.txt"));
        assertTrue(output().contains("[E] Errore nella validazione dei parametri"));
    }

    @Test
    @DisplayName("-e e -f sono mutualmente esclusivi")
    void rejectsBothInputs(@TempDir Path directory) throws IOException {
        Path file = Files.writeString(directory.resolve("formule.txt"), "p\n");
        assertEquals(Main.EXIT_ERROR, run("-e", "p", "-f", file.toString()));
        assertTrue(output().contains("mutualmente esclusive"));
    }

    // ========== Operazioni ==========

    @Test
    @DisplayName("Forme normali richieste in ordine NNF, CNF, DNF")
    void printsNormalForms() {
        assertEquals(Main.EXIT_OK, run("-e", "p OR (q AND r)", "-dnf", "-cnf", "-nnf"));

        List<String> lines = output().lines().toList();
        assertEquals(List.of(
                "[I] Formula: p OR (q AND r)",
                "NNF: p OR (q AND r)",
                "CNF: (p OR q) AND (p OR r)",
                "DNF: p OR (q AND r)"), lines);
    }

    @Test
    @DisplayName("Valutazione sotto assegnamento JSON")
    void evaluatesUnderAssignment() {
        assertEquals(Main.EXIT_OK, run("-e", "NOT(p) OR q", "-eval", "{\"p\": 1}", "-eval", "{\"p\": true, \"q\": 0}"));
        assertTrue(output().contains(": false"));
    }

    @Test
    @DisplayName("Assegnamento JSON malformato segnalato come errore dei parametri")
    void rejectsMalformedAssignment() {
        assertEquals(Main.EXIT_ERROR, run("-e", "p", "-eval", "{\"p\": "));
        assertTrue(output().startsWith("[E] Errore nella validazione dei parametri: Assegnamento JSON non valido"));

        assertEquals(Main.EXIT_ERROR, run("-e", "p", "-eval", "{\"p\": \"si\"}"));
        assertFalse(output().contains("Errore critico"));
    }

    @Test
    @DisplayName("Variabile mancante nell'assegnamento: errore con il nome")
    void reportsMissingVariable() {
        assertEquals(Main.EXIT_ERROR, run("-e", "p AND q", "-eval", "{\"p\": true}"));
        assertTrue(output().contains("[E] Assegnamento privo della variabile: q"));
    }

    @Test
    @DisplayName("Tavola di verità")
    void printsTruthTable() {
        assertEquals(Main.EXIT_OK, run("-e", "p IMPLIES q", "-table"));
        assertTrue(output().contains("p q | p IMPLIES q\nT T | T\nT F | F\nF T | T\nF F | T\n"));
    }

    @Test
    @DisplayName("Tavola di verità troppo grande rifiutata con un messaggio di errore")
    void rejectsOversizedTruthTable() {
        assertEquals(Main.EXIT_ERROR, run("-e", chain("AND", 21), "-table"));
        assertTrue(output().contains("[E] Troppe variabili per la tavola di verità: 21"));
        assertFalse(output().contains("Errore critico"));
    }

    @Test
    @DisplayName("Timeout: l'enumerazione viene interrotta e il thread di lavoro termina")
    void stopsEnumerationOnTimeout() throws InterruptedException {
        long start = System.nanoTime();
        assertEquals(Main.EXIT_OK, run("-e", chain("OR", 28), "-t", "1"));
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(output().contains("[W] Timeout raggiunto dopo 1 secondi"));
        assertFalse(output().contains("Classificazione"));
        assertTrue(elapsedMillis < 10_000, "durata " + elapsedMillis + " ms");

        // Il thread può impiegare un istante a uscire dopo la terminazione dell'executor
        long deadline = System.currentTimeMillis() + 2_000;
        while (workerAlive() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertFalse(workerAlive());
    }

    @Test
    @DisplayName("Equivalenza con controesempio")
    void checksEquivalence() {
        assertEquals(Main.EXIT_OK, run("-e", "p IMPLIES q", "-eq", "NOT(p) OR q"));
        assertTrue(output().contains("Equivalente a NOT(p) OR q: true"));

        assertEquals(Main.EXIT_OK, run("-e", "p AND q", "-eq", "p OR q", "-par"));
        assertTrue(output().contains("Equivalente a p OR q: false (controesempio "));
    }

    @Test
    @DisplayName("Senza operazioni viene stampata la classificazione")
    void printsSummary() {
        assertEquals(Main.EXIT_OK, run("-e", "p OR NOT(p)"));
        assertTrue(output().contains("Variabili: [p]"));
        assertTrue(output().contains("Connettivi: 2, profondità: 2"));
        assertTrue(output().contains("Classificazione: tautologia"));
    }

    @Test
    @DisplayName("Errore di sintassi con posizione")
    void reportsSyntaxError() {
        assertEquals(Main.EXIT_ERROR, run("-e", "p AND q OR r"));
        assertTrue(output().startsWith("[E] Errore di sintassi: "));
        assertTrue(output().contains("posizione 8"));
    }

    // ========== Input da file ==========

    @Test
    @DisplayName("Formule lette da file, commenti e righe vuote ignorati")
    void readsFormulasFromFile(@TempDir Path directory) throws IOException {
        Path file = directory.resolve("formule.txt");
        Files.write(file, List.of("# esempi", "p AND NOT(p)", "", "p IMPLIES q"), StandardCharsets.UTF_8);

        assertEquals(Main.EXIT_OK, run("-f", file.toString()));
        assertTrue(output().contains("[I] Formule lette: 2"));
        assertTrue(output().contains("Classificazione: contraddizione"));
        assertTrue(output().contains("Classificazione: soddisfacibile"));
    }
}
