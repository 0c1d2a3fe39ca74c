package org.props.semantics;

import org.props.formula.Assignment;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.TreeSet;
import java.util.concurrent.CancellationException;
import java.util.stream.LongStream;
import java.util.stream.Stream;

/**
 * ENUMERATORE DI ASSEGNAMENTI - Tutte le 2^n combinazioni di valori di verità
 *
 * Le variabili sono ordinate alfabeticamente; la riga di indice i assegna alla variabile
 * in posizione k il valore falso se il bit (n-1-k) di i vale 1, vero altrimenti.
 * La prima riga è quindi tutta vera e l'ultima tutta falsa.
 *
 * Con zero variabili esiste esattamente un assegnamento, quello vuoto.
 *
 * INTERRUZIONE:
 * Flussi e iteratori controllano lo stato di interruzione del thread che li ha creati
 * prima di produrre ogni riga; se il thread è stato interrotto (ad esempio da un timeout)
 * l'enumerazione termina con {@link CancellationException}.
 */
public final class AssignmentEnumerator implements Iterable<Assignment> {

    /** Massimo numero di variabili per cui l'indice di riga (long) rappresenta 2^n */
    public static final int MAX_VARIABLES = 62;

    private final List<String> variables;

    /**
     * @param variables nomi di variabile (duplicati ignorati)
     * @throws IllegalArgumentException se null o con più di {@value #MAX_VARIABLES} variabili
     */
    public AssignmentEnumerator(Collection<String> variables) {
        if (variables == null) {
            throw new IllegalArgumentException("Insieme di variabili non può essere null");
        }
        List<String> sorted = new ArrayList<>(new TreeSet<>(variables));
        if (sorted.size() > MAX_VARIABLES) {
            throw new IllegalArgumentException("Troppe variabili per l'enumerazione esaustiva: "
                    + sorted.size() + " (massimo " + MAX_VARIABLES + ")");
        }
        this.variables = Collections.unmodifiableList(sorted);
    }

    public List<String> variables() {
        return variables;
    }

    /** Numero di assegnamenti: 2^n */
    public long size() {
        return 1L << variables.size();
    }

    /**
     * Assegnamento alla riga indicata.
     *
     * @throws IndexOutOfBoundsException se l'indice è fuori da [0, 2^n)
     */
    public Assignment assignmentAt(long index) {
        if (index < 0 || index >= size()) {
            throw new IndexOutOfBoundsException("Indice assegnamento fuori intervallo: " + index);
        }
        int n = variables.size();
        Assignment.Builder builder = Assignment.builder();
        for (int k = 0; k < n; k++) {
            long bit = (index >> (n - 1 - k)) & 1L;
            builder.put(variables.get(k), bit == 0);
        }
        return builder.build();
    }

    /**
     * Flusso ordinato di tutti gli assegnamenti, eventualmente parallelo.
     * L'ordine di incontro resta quello delle righe anche in parallelo.
     */
    public Stream<Assignment> stream(boolean parallel) {
        Thread owner = Thread.currentThread();
        LongStream indexes = LongStream.range(0, size());
        if (parallel) {
            indexes = indexes.parallel();
        }
        // In parallelo le righe sono prodotte anche da altri thread: si controlla il creatore
        return indexes.mapToObj(index -> {
            checkInterrupted(owner);
            return assignmentAt(index);
        });
    }

    public Stream<Assignment> stream() {
        return stream(false);
    }

    @Override
    public Iterator<Assignment> iterator() {
        Thread owner = Thread.currentThread();
        return new Iterator<>() {
            private long next = 0;

            @Override
            public boolean hasNext() {
                return next < size();
            }

            @Override
            public Assignment next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                checkInterrupted(owner);
                return assignmentAt(next++);
            }
        };
    }

    private static void checkInterrupted(Thread owner) {
        if (owner.isInterrupted()) {
            throw new CancellationException("Enumerazione interrotta");
        }
    }
}
