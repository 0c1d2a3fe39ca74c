package org.props.semantics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.props.formula.Assignment;
import org.props.formula.Formula;
import org.props.parser.FormulaParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TruthTable - righe, modelli e rappresentazione")
class TruthTableTest {

    @Test
    @DisplayName("Tavola di p IMPLIES q")
    void rendersImplication() {
        TruthTable table = TruthTable.of(FormulaParser.parse("p IMPLIES q"));

        assertEquals("p q | p IMPLIES q\n"
                + "T T | T\n"
                + "T F | F\n"
                + "F T | T\n"
                + "F F | T\n", table.render());
        assertEquals(List.of("p", "q"), table.variables());
        assertEquals(4, table.rows().size());
        assertEquals(3, table.countModels());
    }

    @Test
    @DisplayName("Colonne allineate alla lunghezza del nome")
    void alignsCellsToVariableNames() {
        TruthTable table = TruthTable.of(FormulaParser.parse("alpha OR b"));
        String[] lines = table.render().split("\n");

        assertEquals("alpha b | alpha OR b", lines[0]);
        assertEquals("T     T | T", lines[1]);
        assertEquals("F     F | F", lines[4]);
    }

    @Test
    @DisplayName("Valore di ogni riga coerente con la valutazione diretta")
    void rowsMatchEvaluation() {
        Formula formula = FormulaParser.parse("(p IFF q) OR NOT(r)");
        TruthTable table = TruthTable.of(formula);

        assertEquals(8, table.rows().size());
        for (TruthTable.Row row : table.rows()) {
            assertEquals(formula.evaluate(row.assignment()), row.value());
        }
        assertSame(formula, table.formula());
    }

    @Test
    @DisplayName("Modelli nell'ordine delle righe")
    void listsModels() {
        TruthTable table = TruthTable.of(FormulaParser.parse("p AND NOT(q)"));
        assertEquals(List.of(Assignment.of(Map.of("p", true, "q", false))), table.models());
        assertEquals(0, TruthTable.of(FormulaParser.parse("p AND NOT(p)")).countModels());
    }

    @Test
    @DisplayName("Formula null rifiutata")
    void rejectsNull() {
        assertThrows(IllegalArgumentException.class, () -> TruthTable.of(null));
    }

    @Test
    @DisplayName("Oltre il limite di variabili la tavola viene rifiutata")
    void rejectsTooManyVariables() {
        List<Formula> variables = new ArrayList<>();
        for (int i = 0; i <= TruthTable.MAX_VARIABLES; i++) {
            variables.add(Formula.var("x" + i));
        }
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                () -> TruthTable.of(Formula.or(variables)));
        assertTrue(exception.getMessage().contains("tavola di verità"));

        Formula largest = Formula.or(variables.subList(0, 12));
        assertEquals(4095, TruthTable.of(largest).countModels());
    }
}
