package org.props.parser;

/**
 * Testo di formula malformato: parentesi sbilanciate, simboli sconosciuti, connettivi
 * misti senza parentesi, nomi di variabile riservati, input vuoto.
 *
 * Riporta posizione (indice del carattere, a partire da 0), riga, colonna e il
 * frammento di testo che ha causato l'errore.
 */
public class FormulaSyntaxException extends RuntimeException {

    private final int position;
    private final int line;
    private final int column;
    private final String fragment;

    public FormulaSyntaxException(String message, int position, int line, int column, String fragment) {
        super(buildMessage(message, position, fragment));
        this.position = position;
        this.line = line;
        this.column = column;
        this.fragment = fragment;
    }

    private static String buildMessage(String message, int position, String fragment) {
        if (position < 0) {
            return message;
        }
        return message + " (posizione " + position + ", vicino a '" + fragment + "')";
    }

    /** Indice del carattere nel testo, -1 se non applicabile */
    public int getPosition() {
        return position;
    }

    /** Riga dell'errore, a partire da 1 */
    public int getLine() {
        return line;
    }

    /** Colonna dell'errore nella riga, a partire da 0 */
    public int getColumn() {
        return column;
    }

    /** Frammento di testo responsabile dell'errore */
    public String getFragment() {
        return fragment;
    }
}
