package org.props.formula;

/**
 * Sollevata quando una formula viene valutata con un assegnamento che non contiene
 * una delle variabili referenziate. Le chiavi in eccesso non la provocano mai.
 */
public class MissingVariableException extends RuntimeException {

    private final String variableName;

    public MissingVariableException(String variableName) {
        super("Assegnamento privo della variabile: " + variableName);
        this.variableName = variableName;
    }

    /** Nome della variabile assente dall'assegnamento */
    public String getVariableName() {
        return variableName;
    }
}
