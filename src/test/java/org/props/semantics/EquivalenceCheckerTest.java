package org.props.semantics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.props.RandomFormulas;
import org.props.formula.Assignment;
import org.props.formula.Formula;
import org.props.normalform.NormalFormConverter;
import org.props.parser.FormulaParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EquivalenceChecker - equivalenza per tavola di verità")
class EquivalenceCheckerTest {

    private final EquivalenceChecker checker = new EquivalenceChecker();

    private static Formula parse(String text) {
        return FormulaParser.parse(text);
    }

    // ========== Equivalenza ==========

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "p IMPLIES q          | NOT(p) OR q",
            "NOT(p AND q)         | NOT(p) OR NOT(q)",
            "NOT(p OR q)          | NOT(p) AND NOT(q)",
            "p IFF q              | (p IMPLIES q) AND (q IMPLIES p)",
            "p AND (q OR r)       | (p AND q) OR (p AND r)",
            "NOT(NOT(p))          | p",
            "p IMPLIES q          | NOT(q) IMPLIES NOT(p)"
    })
    @DisplayName("Coppie di formule equivalenti")
    void recognisesEquivalentPairs(String first, String second) {
        assertTrue(checker.equivalent(parse(first), parse(second)));
        assertTrue(checker.equivalent(parse(second), parse(first)));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "p AND q              | p OR q",
            "p IMPLIES q          | q IMPLIES p",
            "p                    | q",
            "p IFF q              | p AND q"
    })
    @DisplayName("Coppie di formule non equivalenti")
    void recognisesDifferentPairs(String first, String second) {
        assertFalse(checker.equivalent(parse(first), parse(second)));
    }

    @Test
    @DisplayName("Variabili diverse: p AND (q OR NOT(q)) equivale a p")
    void comparesOverUnionOfVariables() {
        assertTrue(checker.equivalent(parse("p AND (q OR NOT(q))"), parse("p")));
        assertFalse(checker.equivalent(parse("p AND q"), parse("p")));
    }

    @Test
    @DisplayName("Ogni formula è equivalente a se stessa")
    void isReflexive() {
        for (Formula formula : RandomFormulas.generate(3L, 50, 4)) {
            assertTrue(checker.equivalent(formula, formula), formula::render);
        }
    }

    @Test
    @DisplayName("Formule uguali con più variabili di quante se ne possano enumerare in pratica")
    void comparesIdenticalLargeFormulas() {
        List<Formula> variables = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            variables.add(Formula.var("x" + i));
        }
        Formula conjunction = Formula.and(variables);
        Formula same = Formula.and(new ArrayList<>(variables));

        assertTrue(checker.equivalent(conjunction, same));
        assertTrue(checker.counterexample(conjunction, same).isEmpty());
        assertTrue(checker.implies(conjunction, same));
        assertTrue(new EquivalenceChecker(true).equivalent(conjunction, conjunction));
    }

    @Test
    @DisplayName("Oltre 30 variabili l'enumerazione resta ammessa")
    void enumeratesBeyondThirtyVariables() {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < 31; i++) {
            names.add("x" + i);
        }
        AssignmentEnumerator enumerator = new AssignmentEnumerator(names);
        assertEquals(1L << 31, enumerator.size());
        assertTrue(enumerator.stream().findFirst().isPresent());
    }

    @Test
    @DisplayName("Controesempio: primo assegnamento distintivo in ordine di enumerazione")
    void findsFirstCounterexample() {
        Optional<Assignment> counterexample = checker.counterexample(parse("p AND q"), parse("p OR q"));

        assertTrue(counterexample.isPresent());
        assertEquals(Assignment.of(Map.of("p", true, "q", false)), counterexample.get());
        assertTrue(checker.counterexample(parse("p"), parse("NOT(NOT(p))")).isEmpty());
    }

    @Test
    @DisplayName("Modalità parallela con gli stessi risultati della sequenziale")
    void parallelMatchesSequential() {
        EquivalenceChecker parallel = new EquivalenceChecker(true);
        assertTrue(parallel.isParallel());
        assertFalse(checker.isParallel());

        List<Formula> formulas = RandomFormulas.generate(5L, 40, 4);
        for (int i = 0; i + 1 < formulas.size(); i += 2) {
            Formula first = formulas.get(i);
            Formula second = formulas.get(i + 1);
            assertEquals(checker.counterexample(first, second), parallel.counterexample(first, second));
            assertEquals(checker.isTautology(first), parallel.isTautology(first));
        }
        for (Formula formula : formulas) {
            assertTrue(parallel.equivalent(formula, NormalFormConverter.toCnf(formula)), formula::render);
        }
    }

    @Test
    @DisplayName("Formula null rifiutata")
    void rejectsNull() {
        assertThrows(IllegalArgumentException.class, () -> checker.equivalent(null, parse("p")));
        assertThrows(IllegalArgumentException.class, () -> checker.isTautology(null));
    }

    // ========== Implicazione e classificazione ==========

    @Test
    @DisplayName("Implicazione logica")
    void checksEntailment() {
        assertTrue(checker.implies(parse("p AND q"), parse("p")));
        assertTrue(checker.implies(parse("p"), parse("p OR q")));
        assertTrue(checker.implies(parse("(p IMPLIES q) AND p"), parse("q")));
        assertFalse(checker.implies(parse("p OR q"), parse("p")));
    }

    @ParameterizedTest
    @ValueSource(strings = {"p OR NOT(p)", "p IMPLIES p", "(p AND q) IMPLIES p", "p IFF NOT(NOT(p))"})
    @DisplayName("Tautologie")
    void recognisesTautologies(String text) {
        Formula formula = parse(text);
        assertTrue(checker.isTautology(formula));
        assertTrue(checker.isSatisfiable(formula));
        assertFalse(checker.isContradiction(formula));
    }

    @ParameterizedTest
    @ValueSource(strings = {"p AND NOT(p)", "p IFF NOT(p)", "NOT(p IMPLIES p)"})
    @DisplayName("Contraddizioni")
    void recognisesContradictions(String text) {
        Formula formula = parse(text);
        assertTrue(checker.isContradiction(formula));
        assertFalse(checker.isSatisfiable(formula));
        assertFalse(checker.isTautology(formula));
    }

    @Test
    @DisplayName("Formula soddisfacibile ma non tautologica")
    void recognisesContingentFormula() {
        Formula formula = parse("p IMPLIES q");
        assertTrue(checker.isSatisfiable(formula));
        assertFalse(checker.isTautology(formula));
        assertFalse(checker.isContradiction(formula));
    }

    // ========== Minterm ==========

    @Test
    @DisplayName("Minterm vero solo sotto l'assegnamento di partenza")
    void buildsMinterm() {
        Assignment assignment = Assignment.of(Map.of("p", true, "q", false, "r", true));
        Formula minterm = EquivalenceChecker.minterm(assignment);

        assertEquals("(p AND NOT(q)) AND r", minterm.render());
        assertEquals(1, TruthTable.of(minterm).countModels());
        assertEquals(List.of(assignment), TruthTable.of(minterm).models());

        assertThrows(IllegalArgumentException.class, () -> EquivalenceChecker.minterm(Assignment.empty()));
    }
}
