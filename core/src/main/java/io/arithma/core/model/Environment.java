package io.arithma.core.model;

import io.arithma.core.error.UndefinedVariableException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Variable bindings for one call chain. Mutated only by its owner between evaluations and never
 * shared across concurrent calls; not thread-safe.
 */
public final class Environment {

    private final Map<String, Double> values;

    public Environment() {
        this.values = new LinkedHashMap<>();
    }

    private Environment(Map<String, Double> values) {
        this.values = new LinkedHashMap<>(values);
    }

    /** Creates an environment holding a single binding. */
    public static Environment of(String name, double value) {
        return new Environment().set(name, value);
    }

    /** Creates an environment holding two bindings. */
    public static Environment of(String name1, double value1, String name2, double value2) {
        return new Environment().set(name1, value1).set(name2, value2);
    }

    /** Creates an environment from an existing name to value map. */
    public static Environment of(Map<String, Double> bindings) {
        Objects.requireNonNull(bindings, "bindings must not be null");
        return new Environment(bindings);
    }

    /**
     * Binds {@code name} to {@code value}, replacing any previous binding.
     *
     * @return this environment, for chaining
     */
    public Environment set(String name, double value) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("variable name must not be null or empty");
        }
        values.put(name, value);
        return this;
    }

    public OptionalDouble get(String name) {
        Double value = values.get(name);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    /**
     * Returns the value bound to {@code name}.
     *
     * @throws UndefinedVariableException if the variable is not bound
     */
    public double require(String name) {
        Double value = values.get(name);
        if (value == null) {
            throw new UndefinedVariableException(name);
        }
        return value;
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    /**
     * Returns a copy of this environment with one extra binding. The receiver is left untouched, so
     * a caller's bindings survive a nested scope such as a summation index.
     */
    public Environment with(String name, double value) {
        return new Environment(values).set(name, value);
    }

    /** Returns a copy of this environment without the binding for {@code name}. */
    public Environment without(String name) {
        Environment copy = new Environment(values);
        copy.values.remove(name);
        return copy;
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public Map<String, Double> asMap() {
        return Collections.unmodifiableMap(values);
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return "Environment" + values;
    }
}
