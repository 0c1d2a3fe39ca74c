package org.props.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.props.formula.Formula;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * PARSER FORMULE PROPOSIZIONALI - Da testo a {@link Formula}
 *
 * Pipeline ANTLR completa: Lexing -> Parsing -> Visitor -> albero Formula.
 *
 * REGOLE DELLA GRAMMATICA:
 * - Connettivi maiuscoli: NOT, AND, OR, IMPLIES, IFF
 * - NOT richiede sempre le parentesi: NOT(p)
 * - Catene dello stesso connettivo ammesse senza parentesi per AND e OR,
 *   associate a sinistra
 * - Connettivi diversi allo stesso livello richiedono parentesi: "p AND q OR r" è rifiutata
 * - IMPLIES e IFF collegano esattamente due operandi
 *
 * Nessun recupero dagli errori: il primo errore lessicale o sintattico interrompe
 * l'analisi con una {@link FormulaSyntaxException}.
 *
 * Le istanze non hanno stato e possono essere condivise tra thread.
 */
public final class FormulaParser {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    /** Prefisso delle righe di commento nei file di formule */
    private static final String COMMENT_PREFIX = "#";

    private FormulaParser() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region PUNTO DI INGRESSO

    /**
     * Analizza il testo di una formula.
     *
     * @param text formula in notazione infissa
     * @return albero della formula
     * @throws IllegalArgumentException se text è null
     * @throws FormulaSyntaxException se il testo è vuoto o malformato
     */
    public static Formula parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Testo della formula non può essere null");
        }
        if (text.isBlank()) {
            throw new FormulaSyntaxException("Formula vuota", 0, 1, 0, "");
        }

        LOGGER.fine("Analisi formula: " + text);

        // Setup pipeline ANTLR con listener che interrompe al primo errore
        ThrowingErrorListener errorListener = new ThrowingErrorListener(text);

        CharStream input = CharStreams.fromString(text);
        PropositionalFormulaLexer lexer = new PropositionalFormulaLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorListener);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        PropositionalFormulaParser parser = new PropositionalFormulaParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(errorListener);

        ParseTree tree = parser.formula();
        Formula formula = new FormulaTreeBuilder().visit(tree);

        LOGGER.fine("Formula analizzata: " + formula);
        return formula;
    }

    /**
     * Analizza più formule, una per elemento, ignorando elementi vuoti e commenti (#).
     * Tipicamente usato sulle righe di un file.
     *
     * @throws FormulaSyntaxException alla prima formula malformata
     */
    public static List<Formula> parseAll(List<String> lines) {
        if (lines == null) {
            throw new IllegalArgumentException("Lista di righe non può essere null");
        }
        List<Formula> formulas = new ArrayList<>();
        for (String line : lines) {
            String trimmed = line == null ? "" : line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith(COMMENT_PREFIX)) {
                continue;
            }
            formulas.add(parse(trimmed));
        }
        LOGGER.fine("Formule analizzate: " + formulas.size());
        return formulas;
    }

    //endregion

    //region GESTIONE ERRORI

    /**
     * Converte il primo errore di lexer o parser in {@link FormulaSyntaxException}.
     */
    private static final class ThrowingErrorListener extends BaseErrorListener {

        private final String text;

        ThrowingErrorListener(String text) {
            this.text = text;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg, RecognitionException e) {
            int position;
            String fragment;

            if (offendingSymbol instanceof Token) {
                // Errore del parser: il token responsabile è noto
                Token token = (Token) offendingSymbol;
                position = token.getType() == Token.EOF ? text.length() : token.getStartIndex();
                fragment = token.getType() == Token.EOF ? "<EOF>" : token.getText();
            } else {
                // Errore del lexer: carattere non riconosciuto
                position = toOffset(line, charPositionInLine);
                fragment = position < text.length() ? String.valueOf(text.charAt(position)) : "";
            }

            throw new FormulaSyntaxException("Formula non valida: " + msg,
                    position, line, charPositionInLine, fragment);
        }

        /**
         * Converte riga (da 1) e colonna (da 0) in indice assoluto del carattere.
         */
        private int toOffset(int line, int column) {
            int offset = 0;
            int currentLine = 1;
            while (currentLine < line && offset < text.length()) {
                if (text.charAt(offset) == '\n') {
                    currentLine++;
                }
                offset++;
            }
            return Math.min(offset + column, text.length());
        }
    }

    //endregion
}
