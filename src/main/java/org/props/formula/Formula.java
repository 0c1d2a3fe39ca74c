package org.props.formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * FORMULA PROPOSIZIONALE - Albero sintattico immutabile
 *
 * Rappresenta una formula della logica proposizionale come albero binario i cui nodi
 * sono etichettati da {@link Type}. Ogni nodo composto possiede in modo esclusivo i
 * propri figli: l'albero è finito, aciclico e non viene mai modificato dopo la
 * costruzione. Le trasformazioni (forme normali, negazione) producono sempre alberi nuovi.
 *
 * OPERAZIONI PRINCIPALI:
 * - Valutazione sotto un {@link Assignment}
 * - Rappresentazione testuale canonica accettata dal parser ({@link #render()})
 * - Raccolta delle variabili proposizionali
 * - Navigazione nodo per nodo ({@link #children()}) per strumenti esterni
 *
 * UGUAGLIANZA:
 * Due formule sono uguali (sintatticamente) se e solo se le loro rappresentazioni
 * canoniche coincidono carattere per carattere. L'equivalenza semantica è un concetto
 * distinto, verificato da {@code org.props.semantics.EquivalenceChecker}.
 */
public final class Formula {

    //region TIPI E STRUTTURA DATI

    /**
     * Tipi di nodi supportati nella rappresentazione ad albero.
     * L'insieme è chiuso: ogni switch sul tipo è esaustivo.
     */
    public enum Type {
        VAR(null),              // Variabile proposizionale: p, q, r, ...
        NOT("NOT"),             // Negazione: NOT(A)
        AND("AND"),             // Congiunzione: A AND B
        OR("OR"),               // Disgiunzione: A OR B
        IMPLIES("IMPLIES"),     // Implicazione: A IMPLIES B
        IFF("IFF");             // Biimplicazione: A IFF B

        private final String keyword;

        Type(String keyword) {
            this.keyword = keyword;
        }

        /** Parola chiave maiuscola del connettivo, null per le variabili. */
        public String keyword() {
            return keyword;
        }

        public boolean isBinary() {
            return this != VAR && this != NOT;
        }
    }

    /** Parole chiave riservate, mai utilizzabili come nomi di variabile */
    public static final Set<String> KEYWORDS = Set.of("NOT", "AND", "OR", "IMPLIES", "IFF");

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /** Tipo del nodo corrente nell'albero */
    private final Type type;

    /** Nome della variabile (solo per nodi VAR) */
    private final String name;

    /** Operando sinistro, oppure unico operando per i nodi NOT */
    private final Formula left;

    /** Operando destro (solo per nodi binari) */
    private final Formula right;

    /** Rappresentazione canonica calcolata al primo utilizzo */
    private String rendered;

    //endregion

    //region COSTRUTTORI E FABBRICHE

    private Formula(Type type, String name, Formula left, Formula right) {
        this.type = type;
        this.name = name;
        this.left = left;
        this.right = right;
    }

    /**
     * Costruisce una variabile proposizionale.
     *
     * @param name nome della variabile (identificatore, non parola chiave)
     * @throws IllegalArgumentException se il nome è null, vuoto, contiene spazi o è riservato
     */
    public static Formula var(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Nome variabile non può essere null o vuoto");
        }
        if (KEYWORDS.contains(name)) {
            throw new IllegalArgumentException("Nome variabile riservato: " + name);
        }
        if (!IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Nome variabile non valido: '" + name + "'");
        }
        return new Formula(Type.VAR, name, null, null);
    }

    /**
     * Costruisce la negazione di una formula.
     *
     * @param operand formula da negare (non null)
     * @throws IllegalArgumentException se operand null
     */
    public static Formula not(Formula operand) {
        requireOperand(operand, Type.NOT);
        return new Formula(Type.NOT, null, operand, null);
    }

    public static Formula and(Formula left, Formula right) {
        return binary(Type.AND, left, right);
    }

    public static Formula or(Formula left, Formula right) {
        return binary(Type.OR, left, right);
    }

    public static Formula implies(Formula antecedent, Formula consequent) {
        return binary(Type.IMPLIES, antecedent, consequent);
    }

    public static Formula iff(Formula left, Formula right) {
        return binary(Type.IFF, left, right);
    }

    /**
     * Costruisce un nodo binario del tipo indicato.
     *
     * @param type connettivo binario (AND, OR, IMPLIES, IFF)
     * @throws IllegalArgumentException se il tipo non è binario o un operando è null
     */
    public static Formula binary(Type type, Formula left, Formula right) {
        if (type == null || !type.isBinary()) {
            throw new IllegalArgumentException("Tipo deve essere un connettivo binario: " + type);
        }
        requireOperand(left, type);
        requireOperand(right, type);
        return new Formula(type, null, left, right);
    }

    /**
     * Costruisce una congiunzione associata a sinistra:
     * [A, B, C] -> (A AND B) AND C. Un solo elemento viene restituito invariato.
     *
     * @throws IllegalArgumentException se la lista è null, vuota o contiene null
     */
    public static Formula and(List<Formula> operands) {
        return chain(Type.AND, operands);
    }

    /**
     * Costruisce una disgiunzione associata a sinistra:
     * [A, B, C] -> (A OR B) OR C. Un solo elemento viene restituito invariato.
     *
     * @throws IllegalArgumentException se la lista è null, vuota o contiene null
     */
    public static Formula or(List<Formula> operands) {
        return chain(Type.OR, operands);
    }

    private static Formula chain(Type type, List<Formula> operands) {
        if (operands == null || operands.isEmpty()) {
            throw new IllegalArgumentException("Lista operandi non può essere null o vuota");
        }
        Formula result = operands.get(0);
        requireOperand(result, type);
        for (int i = 1; i < operands.size(); i++) {
            result = binary(type, result, operands.get(i));
        }
        return result;
    }

    private static void requireOperand(Formula operand, Type type) {
        if (operand == null) {
            throw new IllegalArgumentException("Operando per " + type + " non può essere null");
        }
    }

    /**
     * Verifica se una stringa è utilizzabile come nome di variabile.
     */
    public static boolean isValidVariableName(String name) {
        return name != null && !KEYWORDS.contains(name) && IDENTIFIER.matcher(name).matches();
    }

    //endregion

    //region ACCESSO ALLA STRUTTURA

    public Type type() {
        return type;
    }

    /**
     * @return nome della variabile
     * @throws IllegalStateException se il nodo non è una variabile
     */
    public String name() {
        if (type != Type.VAR) {
            throw new IllegalStateException("Nodo " + type + " non ha un nome di variabile");
        }
        return name;
    }

    /**
     * @return operando di un nodo NOT
     * @throws IllegalStateException se il nodo non è una negazione
     */
    public Formula operand() {
        if (type != Type.NOT) {
            throw new IllegalStateException("Nodo " + type + " non è una negazione");
        }
        return left;
    }

    /**
     * @return operando sinistro (antecedente per IMPLIES)
     * @throws IllegalStateException se il nodo non è binario
     */
    public Formula left() {
        if (!type.isBinary()) {
            throw new IllegalStateException("Nodo " + type + " non è binario");
        }
        return left;
    }

    /**
     * @return operando destro (conseguente per IMPLIES)
     * @throws IllegalStateException se il nodo non è binario
     */
    public Formula right() {
        if (!type.isBinary()) {
            throw new IllegalStateException("Nodo " + type + " non è binario");
        }
        return right;
    }

    /**
     * Figli diretti del nodo, da sinistra a destra: nessuno per VAR, uno per NOT,
     * due per i connettivi binari.
     */
    public List<Formula> children() {
        return switch (type) {
            case VAR -> Collections.emptyList();
            case NOT -> List.of(left);
            case AND, OR, IMPLIES, IFF -> List.of(left, right);
        };
    }

    /** Vero per VAR e per NOT applicato direttamente a una VAR. */
    public boolean isLiteral() {
        return type == Type.VAR || (type == Type.NOT && left.type == Type.VAR);
    }

    //endregion

    //region VALUTAZIONE

    /**
     * Calcola il valore di verità della formula sotto l'assegnamento dato.
     *
     * Entrambi gli operandi dei connettivi binari vengono sempre valutati, così una
     * variabile mancante emerge indipendentemente dai valori delle altre.
     *
     * @param assignment assegnamento che copre tutte le variabili della formula
     * @return valore di verità
     * @throws MissingVariableException se manca una variabile referenziata
     */
    public boolean evaluate(Assignment assignment) {
        if (assignment == null) {
            throw new IllegalArgumentException("Assegnamento non può essere null");
        }
        return switch (type) {
            case VAR -> assignment.valueOf(name);
            case NOT -> !left.evaluate(assignment);
            case AND -> left.evaluate(assignment) & right.evaluate(assignment);
            case OR -> left.evaluate(assignment) | right.evaluate(assignment);
            case IMPLIES -> !left.evaluate(assignment) | right.evaluate(assignment);
            case IFF -> left.evaluate(assignment) == right.evaluate(assignment);
        };
    }

    /**
     * Variante di {@link #evaluate(Assignment)} per mappe con valori boolean o interi.
     *
     * @throws IllegalArgumentException se la mappa contiene valori di tipo non ammesso
     * @throws MissingVariableException se manca una variabile referenziata
     */
    public boolean evaluate(Map<String, ?> values) {
        return evaluate(Assignment.of(values));
    }

    //endregion

    //region TRASFORMAZIONI ELEMENTARI

    /**
     * Restituisce una formula equivalente a NOT(this), spingendo la negazione di un
     * solo livello verso le foglie.
     *
     * TRASFORMAZIONI APPLICATE:
     * • NOT(A) -> A
     * • p -> NOT(p)
     * • A AND B -> NOT(A) OR NOT(B) (negazioni ricorsive sugli operandi)
     * • A OR B -> NOT(A) AND NOT(B)
     * • A IMPLIES B -> A AND NOT(B)
     * • A IFF B -> (A AND NOT(B)) OR (NOT(A) AND B)
     */
    public Formula negation() {
        return switch (type) {
            case VAR -> not(this);
            case NOT -> left;
            case AND -> or(left.negation(), right.negation());
            case OR -> and(left.negation(), right.negation());
            case IMPLIES -> and(left, right.negation());
            case IFF -> or(and(left, right.negation()), and(left.negation(), right));
        };
    }

    //endregion

    //region RAPPRESENTAZIONE TESTUALE

    /**
     * Genera la rappresentazione canonica della formula.
     *
     * FORMATO OUTPUT:
     * • Variabili: nome (p, q, r)
     * • Negazioni: NOT(operando)
     * • Connettivi binari: sinistro OP destro, con parentesi attorno a ogni operando
     *   che non sia una variabile o una negazione
     *
     * Il risultato è sempre accettato dal parser e ricostruisce la stessa formula.
     */
    public String render() {
        if (rendered == null) {
            StringBuilder builder = new StringBuilder();
            appendTo(builder);
            rendered = builder.toString();
        }
        return rendered;
    }

    private void appendTo(StringBuilder builder) {
        switch (type) {
            case VAR -> builder.append(name);
            case NOT -> {
                builder.append("NOT(");
                left.appendTo(builder);
                builder.append(')');
            }
            case AND, OR, IMPLIES, IFF -> {
                left.appendOperandTo(builder);
                builder.append(' ').append(type.keyword()).append(' ');
                right.appendOperandTo(builder);
            }
        }
    }

    private void appendOperandTo(StringBuilder builder) {
        if (type == Type.VAR || type == Type.NOT) {
            appendTo(builder);
        } else {
            builder.append('(');
            appendTo(builder);
            builder.append(')');
        }
    }

    @Override
    public String toString() {
        return render();
    }

    //endregion

    //region UGUAGLIANZA E HASH

    /**
     * Uguaglianza sintattica: stesse rappresentazioni canoniche.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Formula other = (Formula) obj;
        return this.type == other.type && this.render().equals(other.render());
    }

    @Override
    public int hashCode() {
        return render().hashCode();
    }

    //endregion

    //region UTILITÀ E ANALISI

    /**
     * Insieme ordinato dei nomi di variabile distinti raggiungibili dalla radice.
     */
    public SortedSet<String> variables() {
        SortedSet<String> variables = new TreeSet<>();
        collectVariables(variables);
        return variables;
    }

    private void collectVariables(Set<String> variables) {
        switch (type) {
            case VAR -> variables.add(name);
            case NOT -> left.collectVariables(variables);
            case AND, OR, IMPLIES, IFF -> {
                left.collectVariables(variables);
                right.collectVariables(variables);
            }
        }
    }

    /**
     * Conta i connettivi presenti nella formula (ogni nodo diverso da VAR).
     */
    public int connectiveCount() {
        return switch (type) {
            case VAR -> 0;
            case NOT -> 1 + left.connectiveCount();
            case AND, OR, IMPLIES, IFF -> 1 + left.connectiveCount() + right.connectiveCount();
        };
    }

    /**
     * Calcola la profondità massima dell'albero (0 per una variabile).
     */
    public int depth() {
        return switch (type) {
            case VAR -> 0;
            case NOT -> 1 + left.depth();
            case AND, OR, IMPLIES, IFF -> 1 + Math.max(left.depth(), right.depth());
        };
    }

    /**
     * Elenca i nodi dell'albero in pre-ordine (radice, poi figli da sinistra a destra).
     */
    public List<Formula> nodes() {
        List<Formula> nodes = new ArrayList<>();
        collectNodes(nodes);
        return nodes;
    }

    private void collectNodes(List<Formula> nodes) {
        nodes.add(this);
        for (Formula child : children()) {
            child.collectNodes(nodes);
        }
    }

    //endregion
}
