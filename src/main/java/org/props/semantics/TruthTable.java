package org.props.semantics;

import org.props.formula.Assignment;
import org.props.formula.Formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tavola di verità di una formula: una riga per ogni assegnamento delle sue variabili,
 * nell'ordine di {@link AssignmentEnumerator}.
 */
public final class TruthTable {

    /** La tavola conserva tutte le righe in memoria: 2^20 righe al massimo */
    public static final int MAX_VARIABLES = 20;

    private final Formula formula;
    private final List<String> variables;
    private final List<Row> rows;

    private TruthTable(Formula formula, List<String> variables, List<Row> rows) {
        this.formula = formula;
        this.variables = variables;
        this.rows = Collections.unmodifiableList(rows);
    }

    /**
     * Costruisce la tavola enumerando tutti gli assegnamenti delle variabili della formula.
     *
     * @throws IllegalArgumentException se la formula è null o ha più di
     *         {@value #MAX_VARIABLES} variabili
     */
    public static TruthTable of(Formula formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula non può essere null");
        }
        int variableCount = formula.variables().size();
        if (variableCount > MAX_VARIABLES) {
            throw new IllegalArgumentException("Troppe variabili per la tavola di verità: "
                    + variableCount + " (massimo " + MAX_VARIABLES + ")");
        }
        AssignmentEnumerator enumerator = new AssignmentEnumerator(formula.variables());
        List<Row> rows = new ArrayList<>();
        for (Assignment assignment : enumerator) {
            rows.add(new Row(assignment, formula.evaluate(assignment)));
        }
        return new TruthTable(formula, enumerator.variables(), rows);
    }

    public Formula formula() {
        return formula;
    }

    public List<String> variables() {
        return variables;
    }

    public List<Row> rows() {
        return rows;
    }

    /** Assegnamenti che rendono vera la formula */
    public List<Assignment> models() {
        List<Assignment> models = new ArrayList<>();
        for (Row row : rows) {
            if (row.value()) {
                models.add(row.assignment());
            }
        }
        return models;
    }

    public int countModels() {
        return models().size();
    }

    /**
     * Tabella testuale con celle T/F, colonne allineate al nome di variabile.
     *
     * <pre>
     * p q | p IMPLIES q
     * T T | T
     * T F | F
     * </pre>
     */
    public String render() {
        StringBuilder builder = new StringBuilder();
        for (String variable : variables) {
            builder.append(variable).append(' ');
        }
        builder.append("| ").append(formula.render()).append('\n');

        for (Row row : rows) {
            for (String variable : variables) {
                String cell = row.assignment().valueOf(variable) ? "T" : "F";
                builder.append(cell).append(" ".repeat(variable.length()));
            }
            builder.append("| ").append(row.value() ? "T" : "F").append('\n');
        }
        return builder.toString();
    }

    @Override
    public String toString() {
        return render();
    }

    /**
     * Riga della tavola: assegnamento e valore risultante.
     */
    public static final class Row {

        private final Assignment assignment;
        private final boolean value;

        Row(Assignment assignment, boolean value) {
            this.assignment = assignment;
            this.value = value;
        }

        public Assignment assignment() {
            return assignment;
        }

        public boolean value() {
            return value;
        }

        @Override
        public String toString() {
            return assignment + " -> " + value;
        }
    }
}
