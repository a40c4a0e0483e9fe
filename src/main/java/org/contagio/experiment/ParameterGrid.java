package org.contagio.experiment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.contagio.runtime.api.ConfigurationException;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigUtil;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;

/**
 * A Cartesian grid of named parameter value lists.
 * <p>
 * Combinations are enumerated in row-major order: the last parameter varies fastest. The grid
 * holds its own copies of the value lists, so later changes to the caller's collections never
 * affect it, and it never changes them.
 */
public final class ParameterGrid {

    private final Map<String, List<Object>> parameters;

    private ParameterGrid(Map<String, List<Object>> parameters) {
        this.parameters = parameters;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param parameters value lists by parameter name, in enumeration order.
     * @return the grid.
     */
    public static ParameterGrid of(Map<String, ? extends List<?>> parameters) {
        Builder builder = builder();
        parameters.forEach(builder::add);
        return builder.build();
    }

    /**
     * Reads a grid from a HOCON block. Each leaf is a parameter path (for example
     * {@code network.size} or {@code adoption-rate}) mapped to a list of values, or to a single
     * value. Parameters are ordered by name so the combination indices do not depend on the
     * order of the file.
     *
     * @param grid the grid block.
     * @return the grid.
     */
    public static ParameterGrid fromConfig(Config grid) {
        Map<String, List<Object>> sorted = new TreeMap<>();
        for (Map.Entry<String, ConfigValue> entry : grid.entrySet()) {
            String name = String.join(".", ConfigUtil.splitPath(entry.getKey()));
            ConfigValue value = entry.getValue();
            List<Object> values = new ArrayList<>();
            if (value.valueType() == ConfigValueType.LIST) {
                for (Object element : (List<?>) value.unwrapped()) {
                    values.add(element);
                }
            } else {
                values.add(value.unwrapped());
            }
            sorted.put(name, values);
        }
        Builder builder = builder();
        sorted.forEach(builder::add);
        return builder.build();
    }

    /**
     * @return the parameter names in enumeration order.
     */
    public List<String> names() {
        return List.copyOf(parameters.keySet());
    }

    /**
     * @param name a parameter name.
     * @return its values.
     */
    public List<Object> values(String name) {
        List<Object> values = parameters.get(name);
        if (values == null) {
            throw new IllegalArgumentException("Unknown parameter: " + name);
        }
        return values;
    }

    /**
     * @return the number of combinations; 1 for a grid without parameters.
     */
    public int size() {
        long size = 1;
        for (List<Object> values : parameters.values()) {
            size *= values.size();
            if (size > Integer.MAX_VALUE) {
                throw new ConfigurationException("Parameter grid has more than " + Integer.MAX_VALUE + " combinations");
            }
        }
        return (int) size;
    }

    /**
     * @param index a combination index in [0, size).
     * @return the combination at this index.
     */
    public ParameterCombination combination(int index) {
        int size = size();
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("Combination index " + index + " outside [0, " + size + ")");
        }
        List<String> names = names();
        Object[] chosen = new Object[names.size()];
        int remainder = index;
        for (int p = names.size() - 1; p >= 0; p--) {
            List<Object> values = parameters.get(names.get(p));
            chosen[p] = values.get(remainder % values.size());
            remainder /= values.size();
        }
        Map<String, Object> combination = new LinkedHashMap<>();
        for (int p = 0; p < names.size(); p++) {
            combination.put(names.get(p), chosen[p]);
        }
        return new ParameterCombination(index, combination);
    }

    /**
     * @return every combination in grid order.
     */
    public List<ParameterCombination> combinations() {
        int size = size();
        List<ParameterCombination> combinations = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            combinations.add(combination(i));
        }
        return combinations;
    }

    @Override
    public String toString() {
        return "ParameterGrid" + parameters;
    }

    /**
     * Builder for {@link ParameterGrid}.
     */
    public static final class Builder {

        private final Map<String, List<Object>> parameters = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder add(String name, Object... values) {
            return add(name, List.of(values));
        }

        /**
         * @param name the parameter name.
         * @param values the values; copied and normalized.
         * @return this builder.
         * @throws ConfigurationException if the list is empty, repeats a name, repeats a value after
         *         normalization or holds an unsupported value.
         */
        public Builder add(String name, List<?> values) {
            if (parameters.containsKey(name)) {
                throw new ConfigurationException("Parameter '" + name + "' is defined twice");
            }
            if (values.isEmpty()) {
                throw new ConfigurationException("Parameter '" + name + "' has no values");
            }
            List<Object> copy = new ArrayList<>(values.size());
            for (Object value : values) {
                Object normalized = ParameterValues.normalize(name, value);
                // Equal values would yield equal combination keys and collide in the checkpoint
                if (copy.contains(normalized)) {
                    throw new ConfigurationException("Parameter '" + name + "' lists the value " + normalized + " twice");
                }
                copy.add(normalized);
            }
            parameters.put(name, Collections.unmodifiableList(copy));
            return this;
        }

        public ParameterGrid build() {
            return new ParameterGrid(Collections.unmodifiableMap(new LinkedHashMap<>(parameters)));
        }
    }
}
