package org.contagio.experiment;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * One point of a {@link ParameterGrid}: its position in grid order and the value of every
 * parameter.
 */
public final class ParameterCombination {

    private final int index;
    private final Map<String, Object> values;

    /**
     * @param index the position in grid order.
     * @param values the parameter values; normalized to Double, String or Boolean.
     */
    public ParameterCombination(int index, Map<String, ?> values) {
        this.index = index;
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            copy.put(entry.getKey(), ParameterValues.normalize(entry.getKey(), entry.getValue()));
        }
        this.values = Collections.unmodifiableMap(copy);
    }

    public int getIndex() {
        return index;
    }

    /**
     * @return the parameter values in grid order.
     */
    public Map<String, Object> asMap() {
        return values;
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public Object get(String name) {
        Object value = values.get(name);
        if (value == null) {
            throw new IllegalArgumentException("No parameter named '" + name + "' in combination " + key());
        }
        return value;
    }

    public double getDouble(String name) {
        return asType(name, Double.class);
    }

    public int getInt(String name) {
        return (int) Math.round(getDouble(name));
    }

    public String getString(String name) {
        return String.valueOf(get(name));
    }

    public boolean getBoolean(String name) {
        return asType(name, Boolean.class);
    }

    /**
     * Returns the canonical identity of this combination, independent of its index:
     * {@code name=value} pairs in grid order, joined by {@code ;}.
     *
     * @return the key.
     */
    public String key() {
        StringJoiner joiner = new StringJoiner(";");
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            joiner.add(entry.getKey() + "=" + entry.getValue());
        }
        return joiner.toString();
    }

    private <T> T asType(String name, Class<T> type) {
        Object value = get(name);
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException("Parameter '" + name + "' is " + value.getClass().getSimpleName()
                    + ", not " + type.getSimpleName());
        }
        return type.cast(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParameterCombination that)) return false;
        return index == that.index && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, values);
    }

    @Override
    public String toString() {
        return "#" + index + " {" + key() + "}";
    }
}
