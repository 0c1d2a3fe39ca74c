package org.props.formula;

import org.json.JSONException;
import org.json.JSONObject;

import java.math.BigInteger;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * ASSEGNAMENTO DI VERITÀ - Mappa immutabile da nome di variabile a valore booleano
 *
 * I valori entrano esclusivamente come boolean o come intero; per gli interi vale
 * l'unica regola di conversione 0 -> falso, diverso da 0 -> vero, applicata una sola
 * volta al momento dell'inserimento. Nessun altro tipo raggiunge la valutazione.
 *
 * INVARIANTI MANTENUTE:
 * - Chiavi non null e non vuote
 * - Mappa immutabile dopo costruzione
 * - Chiavi in eccesso rispetto a una formula sono ammesse e ignorate
 *
 * FORMATO DI SCAMBIO:
 * Oggetto JSON da nome a letterale booleano, ad esempio {"p": true, "q": false}.
 */
public final class Assignment {

    private static final Assignment EMPTY = new Assignment(new TreeMap<>());

    /** Valori già convertiti a boolean, ordinati per nome */
    private final SortedMap<String, Boolean> values;

    private Assignment(SortedMap<String, Boolean> values) {
        this.values = Collections.unmodifiableSortedMap(values);
    }

    //region COSTRUZIONE

    public static Assignment empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Costruisce un assegnamento da una mappa con valori boolean o interi.
     *
     * @param values mappa nome -> Boolean | Integer | Long | Short | Byte | BigInteger
     * @throws IllegalArgumentException se la mappa è null, contiene chiavi non valide
     *         o valori di tipo non ammesso
     */
    public static Assignment of(Map<String, ?> values) {
        if (values == null) {
            throw new IllegalArgumentException("Mappa dei valori non può essere null");
        }
        Builder builder = builder();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            builder.put(entry.getKey(), coerce(entry.getKey(), entry.getValue()));
        }
        return builder.build();
    }

    /**
     * Legge un assegnamento dal formato di scambio JSON.
     * Accetta letterali booleani e, come in memoria, numeri interi.
     *
     * @param json oggetto JSON, ad esempio {"p": true, "q": false}
     * @throws IllegalArgumentException se il testo non è un oggetto JSON valido o
     *         contiene valori diversi da boolean e interi
     */
    public static Assignment fromJson(String json) {
        if (json == null) {
            throw new IllegalArgumentException("Testo JSON non può essere null");
        }
        try {
            JSONObject object = new JSONObject(json);
            Map<String, Object> raw = new LinkedHashMap<>();
            for (String key : object.keySet()) {
                raw.put(key, object.get(key));
            }
            return of(raw);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Assegnamento JSON non valido: " + e.getMessage(), e);
        }
    }

    /**
     * Unica regola di conversione dei valori ammessi.
     */
    private static boolean coerce(String name, Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue() != 0;
        }
        if (value instanceof BigInteger) {
            return ((BigInteger) value).signum() != 0;
        }
        String typeName = value == null ? "null" : value.getClass().getSimpleName();
        throw new IllegalArgumentException("Valore non ammesso per la variabile '" + name
                + "': " + typeName + " (ammessi boolean o intero)");
    }

    /**
     * Restituisce una copia con la variabile impostata al valore dato.
     */
    public Assignment with(String name, boolean value) {
        return builder().putAll(this).put(name, value).build();
    }

    public Assignment with(String name, int value) {
        return with(name, value != 0);
    }

    //endregion

    //region INTERROGAZIONE

    /**
     * Valore di verità della variabile.
     *
     * @throws MissingVariableException se la variabile non è assegnata
     */
    public boolean valueOf(String name) {
        Boolean value = values.get(name);
        if (value == null) {
            throw new MissingVariableException(name);
        }
        return value;
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    /**
     * Verifica che tutte le variabili indicate siano assegnate.
     */
    public boolean covers(Collection<String> variables) {
        return values.keySet().containsAll(variables);
    }

    public SortedSet<String> variables() {
        return new TreeSet<>(values.keySet());
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /** Vista immutabile, ordinata per nome */
    public SortedMap<String, Boolean> asMap() {
        return values;
    }

    //endregion

    //region RAPPRESENTAZIONE

    /**
     * Serializza nel formato di scambio: letterali booleani minuscoli.
     */
    public String toJson() {
        JSONObject object = new JSONObject();
        values.forEach((name, value) -> object.put(name, value.booleanValue()));
        return object.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return values.equals(((Assignment) obj).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }

    //endregion

    /**
     * Costruttore incrementale di assegnamenti.
     */
    public static final class Builder {

        private final SortedMap<String, Boolean> values = new TreeMap<>();

        private Builder() {
        }

        public Builder put(String name, boolean value) {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Nome variabile non può essere null o vuoto");
            }
            values.put(name, value);
            return this;
        }

        /** Interi: 0 -> falso, qualsiasi altro valore -> vero */
        public Builder put(String name, int value) {
            return put(name, value != 0);
        }

        public Builder putAll(Assignment other) {
            values.putAll(other.values);
            return this;
        }

        public Assignment build() {
            return new Assignment(new TreeMap<>(values));
        }
    }
}
