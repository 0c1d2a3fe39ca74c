package org.props.parser;

import org.props.formula.Formula;
import org.props.parser.PropositionalFormulaParser.AndChainContext;
import org.props.parser.PropositionalFormulaParser.BiconditionalContext;
import org.props.parser.PropositionalFormulaParser.FormulaContext;
import org.props.parser.PropositionalFormulaParser.GroupContext;
import org.props.parser.PropositionalFormulaParser.ImplicationContext;
import org.props.parser.PropositionalFormulaParser.NegationContext;
import org.props.parser.PropositionalFormulaParser.OperandContext;
import org.props.parser.PropositionalFormulaParser.OrChainContext;
import org.props.parser.PropositionalFormulaParser.SingleContext;
import org.props.parser.PropositionalFormulaParser.VariableContext;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * COSTRUTTORE ALBERO FORMULA - Da albero sintattico ANTLR a {@link Formula}
 *
 * Implementa il visitor generato dalla grammatica PropositionalFormula trasformando
 * ogni costrutto grammaticale nel nodo corrispondente, dalle foglie verso la radice.
 * A differenza di una conversione verso una forma normale, qui IMPLIES e IFF vengono
 * conservati: l'albero risultante rispecchia esattamente il testo letto.
 *
 * CATENE DELLO STESSO CONNETTIVO:
 * - p AND q AND r -> (p AND q) AND r (associatività a sinistra)
 * - p OR q OR r -> (p OR q) OR r
 * - IMPLIES e IFF hanno sempre esattamente due operandi (garantito dalla grammatica)
 */
public class FormulaTreeBuilder extends PropositionalFormulaBaseVisitor<Formula> {

    private static final Logger LOGGER = Logger.getLogger(FormulaTreeBuilder.class.getName());

    //region PUNTO DI INGRESSO

    @Override
    public Formula visitFormula(FormulaContext ctx) {
        LOGGER.finest("Inizio costruzione albero da contesto ANTLR");
        return visit(ctx.expression());
    }

    //endregion

    //region CATENE E CONNETTIVI BINARI

    /**
     * Gestisce catene di congiunzioni: A AND B AND C.
     * Gli operandi vengono ripiegati a sinistra in nodi binari.
     */
    @Override
    public Formula visitAndChain(AndChainContext ctx) {
        LOGGER.finest("Elaborazione congiunzione con " + ctx.operand().size() + " operandi");
        return Formula.and(visitOperands(ctx.operand()));
    }

    /**
     * Gestisce catene di disgiunzioni: A OR B OR C.
     */
    @Override
    public Formula visitOrChain(OrChainContext ctx) {
        LOGGER.finest("Elaborazione disgiunzione con " + ctx.operand().size() + " operandi");
        return Formula.or(visitOperands(ctx.operand()));
    }

    @Override
    public Formula visitImplication(ImplicationContext ctx) {
        return Formula.implies(visit(ctx.operand(0)), visit(ctx.operand(1)));
    }

    @Override
    public Formula visitBiconditional(BiconditionalContext ctx) {
        return Formula.iff(visit(ctx.operand(0)), visit(ctx.operand(1)));
    }

    @Override
    public Formula visitSingle(SingleContext ctx) {
        return visit(ctx.operand());
    }

    //endregion

    //region OPERANDI

    @Override
    public Formula visitNegation(NegationContext ctx) {
        return Formula.not(visit(ctx.expression()));
    }

    /**
     * Le parentesi di raggruppamento non producono nodi.
     */
    @Override
    public Formula visitGroup(GroupContext ctx) {
        return visit(ctx.expression());
    }

    @Override
    public Formula visitVariable(VariableContext ctx) {
        String variableName = ctx.IDENTIFIER().getText();
        LOGGER.finest("Elaborazione variabile: " + variableName);
        return Formula.var(variableName);
    }

    //endregion

    private List<Formula> visitOperands(List<OperandContext> operands) {
        List<Formula> result = new ArrayList<>();
        for (OperandContext operand : operands) {
            result.add(visit(operand));
        }
        return result;
    }
}
