package org.props.semantics;

import org.props.formula.Assignment;
import org.props.formula.Formula;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * VERIFICATORE DI EQUIVALENZA - Interrogazioni semantiche per enumerazione esaustiva
 *
 * Decide equivalenza, implicazione logica, tautologia, soddisfacibilità e
 * contraddizione valutando le formule su tutti i 2^n assegnamenti delle variabili
 * coinvolte. Il costo esponenziale è intrinseco al problema: lo strumento è pensato
 * per formule piccole.
 *
 * MODALITÀ PARALLELA:
 * L'enumerazione non ha dipendenze tra righe; con {@code parallel = true} le righe
 * vengono valutate su un flusso parallelo. I risultati, controesempi compresi, sono
 * identici a quelli della modalità sequenziale.
 */
public class EquivalenceChecker {

    private static final Logger LOGGER = Logger.getLogger(EquivalenceChecker.class.getName());

    private final boolean parallel;

    public EquivalenceChecker() {
        this(false);
    }

    public EquivalenceChecker(boolean parallel) {
        this.parallel = parallel;
    }

    public boolean isParallel() {
        return parallel;
    }

    //region EQUIVALENZA E IMPLICAZIONE

    /**
     * Due formule sono equivalenti se assumono lo stesso valore sotto ogni assegnamento
     * dell'unione delle loro variabili. Senza variabili confronta i due valori costanti.
     *
     * @throws IllegalArgumentException se una formula è null o le variabili sono troppe
     */
    public boolean equivalent(Formula first, Formula second) {
        return counterexample(first, second).isEmpty();
    }

    /**
     * Primo assegnamento, nell'ordine di enumerazione, sotto cui le formule differiscono.
     * Formule sintatticamente uguali sono equivalenti senza enumerazione, qualunque sia
     * il numero di variabili.
     *
     * @return assegnamento distintivo, vuoto se le formule sono equivalenti
     */
    public Optional<Assignment> counterexample(Formula first, Formula second) {
        requireFormula(first);
        requireFormula(second);

        if (first.equals(second)) {
            return Optional.empty();
        }

        AssignmentEnumerator enumerator = new AssignmentEnumerator(union(first, second));
        LOGGER.fine("Verifica equivalenza su " + enumerator.variables().size()
                + " variabili (" + enumerator.size() + " assegnamenti)");

        Optional<Assignment> result = enumerator.stream(parallel)
                .filter(assignment -> first.evaluate(assignment) != second.evaluate(assignment))
                .findFirst();

        result.ifPresent(assignment -> LOGGER.fine("Controesempio trovato: " + assignment));
        return result;
    }

    /**
     * La prima formula implica logicamente la seconda se ogni assegnamento che rende
     * vera la prima rende vera anche la seconda.
     */
    public boolean implies(Formula premise, Formula conclusion) {
        requireFormula(premise);
        requireFormula(conclusion);

        if (premise.equals(conclusion)) {
            return true;
        }

        AssignmentEnumerator enumerator = new AssignmentEnumerator(union(premise, conclusion));
        return enumerator.stream(parallel)
                .noneMatch(assignment -> premise.evaluate(assignment) && !conclusion.evaluate(assignment));
    }

    //endregion

    //region CLASSIFICAZIONE

    /** Vera sotto ogni assegnamento */
    public boolean isTautology(Formula formula) {
        requireFormula(formula);
        return enumerate(formula).allMatch(formula::evaluate);
    }

    /** Vera sotto almeno un assegnamento */
    public boolean isSatisfiable(Formula formula) {
        requireFormula(formula);
        return enumerate(formula).anyMatch(formula::evaluate);
    }

    /** Falsa sotto ogni assegnamento */
    public boolean isContradiction(Formula formula) {
        return !isSatisfiable(formula);
    }

    private Stream<Assignment> enumerate(Formula formula) {
        return new AssignmentEnumerator(formula.variables()).stream(parallel);
    }

    //endregion

    //region COSTRUZIONE DI FORMULE DA ASSEGNAMENTI

    /**
     * Congiunzione di letterali vera esattamente sotto l'assegnamento dato, ristretto
     * alle sue variabili: {p: true, q: false} -> p AND NOT(q).
     *
     * @param assignment assegnamento non vuoto
     * @throws IllegalArgumentException se l'assegnamento è null o vuoto
     */
    public static Formula minterm(Assignment assignment) {
        if (assignment == null || assignment.isEmpty()) {
            throw new IllegalArgumentException("Assegnamento non può essere null o vuoto");
        }
        List<Formula> literals = new ArrayList<>();
        for (Map.Entry<String, Boolean> entry : assignment.asMap().entrySet()) {
            Formula variable = Formula.var(entry.getKey());
            literals.add(entry.getValue() ? variable : Formula.not(variable));
        }
        return Formula.and(literals);
    }

    //endregion

    private static Set<String> union(Formula first, Formula second) {
        Set<String> variables = new TreeSet<>(first.variables());
        variables.addAll(second.variables());
        return variables;
    }

    private static void requireFormula(Formula formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula non può essere null");
        }
    }
}
