package org.props.normalform;

import org.props.formula.Formula;
import org.props.formula.Formula.Type;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * CONVERTITORE FORME NORMALI - Riscrittura di formule in NNF, CNF e DNF
 *
 * Ogni conversione produce un albero nuovo, logicamente equivalente all'originale;
 * la formula in ingresso non viene mai modificata.
 *
 * PIPELINE TRASFORMAZIONE CNF:
 * 1. Eliminazione implicazioni e biimplicazioni
 * 2. Normalizzazione negazioni con leggi di De Morgan (forma NNF)
 * 3. Distribuzione OR su AND fino a quando nessun OR contiene un AND
 *
 * La DNF segue la stessa pipeline con la distribuzione duale (AND su OR).
 * La distribuzione può far crescere la formula in modo esponenziale: è il costo
 * accettato della conversione diretta, senza variabili ausiliarie.
 */
public final class NormalFormConverter {

    private static final Logger LOGGER = Logger.getLogger(NormalFormConverter.class.getName());

    private NormalFormConverter() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region INTERFACCIA PUBBLICA CONVERSIONI

    /**
     * Converte la formula in Forma Normale Congiuntiva (CNF).
     *
     * Il risultato non contiene IMPLIES né IFF, applica NOT solo a variabili e nessun
     * OR ha un AND come figlio.
     *
     * @param formula formula da convertire (non null)
     * @return formula in CNF logicamente equivalente all'originale
     */
    public static Formula toCnf(Formula formula) {
        requireFormula(formula);
        LOGGER.fine("Inizio conversione CNF per: " + formula);

        // Fase 1 e 2: eliminazione implicazioni e normalizzazione negazioni
        Formula result = toNnf(formula);
        LOGGER.finest("Dopo normalizzazione negazioni: " + result);

        // Fase 3: distribuzione OR su AND
        result = distribute(result, Type.AND);
        LOGGER.fine("Conversione CNF completata: " + result.connectiveCount() + " connettivi");

        return result;
    }

    /**
     * Converte la formula in Forma Normale Disgiuntiva (DNF): disgiunzione di
     * congiunzioni di letterali.
     *
     * @param formula formula da convertire (non null)
     * @return formula in DNF logicamente equivalente all'originale
     */
    public static Formula toDnf(Formula formula) {
        requireFormula(formula);
        LOGGER.fine("Inizio conversione DNF per: " + formula);

        Formula result = distribute(toNnf(formula), Type.OR);
        LOGGER.fine("Conversione DNF completata: " + result.connectiveCount() + " connettivi");

        return result;
    }

    /**
     * Converte la formula in Forma Normale Negata (NNF): solo AND, OR e NOT, con NOT
     * applicato esclusivamente alle variabili.
     *
     * @param formula formula da convertire (non null)
     * @return formula in NNF logicamente equivalente all'originale
     */
    public static Formula toNnf(Formula formula) {
        requireFormula(formula);
        Formula withoutImplications = eliminateImplications(formula);
        LOGGER.finest("Dopo eliminazione implicazioni: " + withoutImplications);
        return normalizeNegations(withoutImplications);
    }

    //endregion

    //region ELIMINAZIONE IMPLICAZIONI

    /**
     * Riscrive implicazioni e biimplicazioni con NOT, AND e OR.
     *
     * TRASFORMAZIONI APPLICATE:
     * • A IMPLIES B -> NOT(A) OR B
     * • A IFF B -> (NOT(A) OR B) AND (NOT(B) OR A)
     *
     * @param formula formula da riscrivere (non null)
     * @return formula equivalente priva di IMPLIES e IFF
     */
    public static Formula eliminateImplications(Formula formula) {
        requireFormula(formula);
        return switch (formula.type()) {
            case VAR -> formula;

            case NOT -> Formula.not(eliminateImplications(formula.operand()));

            case AND, OR -> Formula.binary(formula.type(),
                    eliminateImplications(formula.left()),
                    eliminateImplications(formula.right()));

            case IMPLIES -> Formula.or(
                    Formula.not(eliminateImplications(formula.left())),
                    eliminateImplications(formula.right()));

            case IFF -> {
                Formula left = eliminateImplications(formula.left());
                Formula right = eliminateImplications(formula.right());

                // Direzione 1: A -> B ~ NOT(A) OR B
                Formula leftToRight = Formula.or(Formula.not(left), right);
                // Direzione 2: B -> A ~ NOT(B) OR A
                Formula rightToLeft = Formula.or(Formula.not(right), left);

                yield Formula.and(leftToRight, rightToLeft);
            }
        };
    }

    //endregion

    //region NORMALIZZAZIONE NEGAZIONI (LEGGI DE MORGAN)

    /**
     * Spinge le negazioni verso le foglie usando le leggi di De Morgan.
     *
     * TRASFORMAZIONI APPLICATE:
     * • NOT(A OR B) -> NOT(A) AND NOT(B)
     * • NOT(A AND B) -> NOT(A) OR NOT(B)
     * • NOT(NOT(A)) -> A
     * • Negazioni atomiche preservate: NOT(p) rimane NOT(p)
     */
    private static Formula normalizeNegations(Formula formula) {
        return switch (formula.type()) {
            case VAR -> formula;

            case NOT -> applyNegationTransformation(formula.operand());

            case AND, OR -> Formula.binary(formula.type(),
                    normalizeNegations(formula.left()),
                    normalizeNegations(formula.right()));

            case IMPLIES, IFF -> {
                // Dovrebbe essere già risolto da eliminateImplications
                LOGGER.warning("Implicazione trovata durante normalizzazione negazioni: " + formula);
                yield normalizeNegations(eliminateImplications(formula));
            }
        };
    }

    /**
     * Restituisce la forma normalizzata di NOT(inner).
     */
    private static Formula applyNegationTransformation(Formula inner) {
        return switch (inner.type()) {
            // NOT(p) rimane NOT(p)
            case VAR -> Formula.not(inner);

            // NOT(NOT(A)) -> A
            case NOT -> normalizeNegations(inner.operand());

            // NOT(A AND B) -> NOT(A) OR NOT(B)
            case AND -> Formula.or(
                    applyNegationTransformation(inner.left()),
                    applyNegationTransformation(inner.right()));

            // NOT(A OR B) -> NOT(A) AND NOT(B)
            case OR -> Formula.and(
                    applyNegationTransformation(inner.left()),
                    applyNegationTransformation(inner.right()));

            case IMPLIES, IFF -> {
                LOGGER.warning("Implicazione negata trovata durante normalizzazione: " + inner);
                yield applyNegationTransformation(eliminateImplications(inner));
            }
        };
    }

    //endregion

    //region DISTRIBUZIONE

    /**
     * Distribuisce il connettivo interno su quello esterno fino alla forma canonica.
     *
     * PROPRIETÀ DISTRIBUTIVA APPLICATA (outer = AND, caso CNF):
     * • A OR (B AND C) -> (A OR B) AND (A OR C)
     * • (A AND B) OR C -> (A OR C) AND (B OR C)
     * Il caso DNF (outer = OR) è il duale.
     *
     * @param formula formula in NNF
     * @param outer connettivo di primo livello della forma cercata (AND per CNF, OR per DNF)
     */
    private static Formula distribute(Formula formula, Type outer) {
        return switch (formula.type()) {
            // In NNF le negazioni sono solo su variabili: nulla da distribuire
            case VAR, NOT -> formula;

            case AND, OR -> {
                Formula left = distribute(formula.left(), outer);
                Formula right = distribute(formula.right(), outer);
                if (formula.type() == outer) {
                    yield Formula.binary(outer, left, right);
                }
                yield distributeOver(left, right, outer);
            }

            case IMPLIES, IFF -> {
                LOGGER.warning("Implicazione trovata durante distribuzione: " + formula);
                yield distribute(toNnf(formula), outer);
            }
        };
    }

    /**
     * Combina due operandi già in forma normale con il connettivo interno, spostando
     * verso l'alto ogni occorrenza del connettivo esterno.
     */
    private static Formula distributeOver(Formula left, Formula right, Type outer) {
        if (left.type() == outer) {
            return Formula.binary(outer,
                    distributeOver(left.left(), right, outer),
                    distributeOver(left.right(), right, outer));
        }
        if (right.type() == outer) {
            return Formula.binary(outer,
                    distributeOver(left, right.left(), outer),
                    distributeOver(left, right.right(), outer));
        }
        return Formula.binary(dual(outer), left, right);
    }

    private static Type dual(Type type) {
        return type == Type.AND ? Type.OR : Type.AND;
    }

    //endregion

    //region VERIFICA DELLA FORMA

    /**
     * Verifica che la formula sia in NNF: niente IMPLIES/IFF, NOT solo su variabili.
     */
    public static boolean isNnf(Formula formula) {
        requireFormula(formula);
        return switch (formula.type()) {
            case VAR -> true;
            case NOT -> formula.operand().type() == Type.VAR;
            case AND, OR -> isNnf(formula.left()) && isNnf(formula.right());
            case IMPLIES, IFF -> false;
        };
    }

    /**
     * Verifica che la formula sia una congiunzione di clausole (disgiunzioni di letterali).
     */
    public static boolean isCnf(Formula formula) {
        requireFormula(formula);
        return isNormalForm(formula, Type.AND);
    }

    /**
     * Verifica che la formula sia una disgiunzione di congiunzioni di letterali.
     */
    public static boolean isDnf(Formula formula) {
        requireFormula(formula);
        return isNormalForm(formula, Type.OR);
    }

    private static boolean isNormalForm(Formula formula, Type outer) {
        if (formula.type() == outer) {
            return isNormalForm(formula.left(), outer) && isNormalForm(formula.right(), outer);
        }
        return isTerm(formula, dual(outer));
    }

    /**
     * Verifica se un nodo è un termine valido: letterale o catena del connettivo interno
     * composta solo da letterali.
     */
    private static boolean isTerm(Formula formula, Type inner) {
        if (formula.isLiteral()) {
            return true;
        }
        return formula.type() == inner
                && isTerm(formula.left(), inner)
                && isTerm(formula.right(), inner);
    }

    //endregion

    //region CLAUSOLE E SEMPLIFICAZIONE

    /**
     * Estrae le clausole di una formula già in CNF, da sinistra a destra.
     * Ogni clausola è la lista dei suoi letterali.
     *
     * @param cnf formula in CNF
     * @throws IllegalArgumentException se la formula non è in CNF
     */
    public static List<List<Formula>> clauses(Formula cnf) {
        requireFormula(cnf);
        if (!isCnf(cnf)) {
            throw new IllegalArgumentException("Formula non in CNF: " + cnf);
        }
        List<Formula> conjuncts = new ArrayList<>();
        flatten(cnf, Type.AND, conjuncts);

        List<List<Formula>> clauses = new ArrayList<>();
        for (Formula conjunct : conjuncts) {
            List<Formula> literals = new ArrayList<>();
            flatten(conjunct, Type.OR, literals);
            clauses.add(literals);
        }
        return clauses;
    }

    /**
     * Semplifica una formula in CNF eliminando ridondanze strutturali.
     *
     * OTTIMIZZAZIONI APPLICATE:
     * • Eliminazione letterali duplicati: (p OR p OR q) -> (p OR q)
     * • Eliminazione clausole duplicate, anche con letterali in ordine diverso
     * • Ricostruzione di catene associate a sinistra preservando l'ordine di apparizione
     *
     * @param cnf formula in CNF
     * @return formula in CNF equivalente, senza duplicati
     * @throws IllegalArgumentException se la formula non è in CNF
     */
    public static Formula simplifyCnf(Formula cnf) {
        List<List<Formula>> clauses = clauses(cnf);

        Set<Set<Formula>> seen = new LinkedHashSet<>();
        List<Formula> uniqueClauses = new ArrayList<>();

        for (List<Formula> clause : clauses) {
            // Eliminazione duplicati preservando ordine
            Set<Formula> uniqueLiterals = new LinkedHashSet<>(clause);
            if (seen.add(uniqueLiterals)) {
                uniqueClauses.add(Formula.or(new ArrayList<>(uniqueLiterals)));
            }
        }

        Formula result = Formula.and(uniqueClauses);
        LOGGER.fine("Semplificazione CNF: " + clauses.size() + " -> " + uniqueClauses.size() + " clausole");
        return result;
    }

    private static void flatten(Formula formula, Type type, List<Formula> collected) {
        if (formula.type() == type) {
            flatten(formula.left(), type, collected);
            flatten(formula.right(), type, collected);
        } else {
            collected.add(formula);
        }
    }

    //endregion

    private static void requireFormula(Formula formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula non può essere null");
        }
    }
}
