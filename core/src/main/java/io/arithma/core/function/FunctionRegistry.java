package io.arithma.core.function;

import io.arithma.core.error.ArityException;
import io.arithma.core.error.UnknownFunctionException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only table of named math functions. Built once through {@link #builder()} and never mutated
 * afterwards, so a single instance can be shared by concurrent evaluations. The tokenizer, parser
 * and evaluator receive it explicitly.
 */
public final class FunctionRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(FunctionRegistry.class);

    private final Map<String, MathFunction> functions;

    private FunctionRegistry(Map<String, MathFunction> functions) {
        this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
    }

    /**
     * Returns the shared registry holding the built-in functions. Initialised lazily on first use.
     */
    public static FunctionRegistry standard() {
        return StandardHolder.INSTANCE;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Looks up a function by name.
     *
     * @param name canonical function name (e.g. "sin")
     * @return the function, or empty if not registered
     */
    public Optional<MathFunction> get(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    /**
     * Looks up a function by name, throwing if not found.
     *
     * @throws UnknownFunctionException if no function is registered under the name
     */
    public MathFunction require(String name) {
        return get(name).orElseThrow(() -> new UnknownFunctionException(name));
    }

    /** Returns {@code true} if a function with the given name is registered. */
    public boolean contains(String name) {
        return functions.containsKey(name);
    }

    /**
     * Checks the argument count and applies the named function.
     *
     * @throws UnknownFunctionException if the function is not registered
     * @throws ArityException if the argument count violates the function's arity
     */
    public double apply(String name, double[] args) {
        MathFunction function = require(name);
        if (!function.arity().accepts(args.length)) {
            throw new ArityException(name, function.arity().describe(), args.length, null);
        }
        return function.apply(args);
    }

    /** Returns the number of registered functions. */
    public int size() {
        return functions.size();
    }

    public Set<String> names() {
        return functions.keySet();
    }

    /** Collects functions before the registry is frozen. Later registrations replace earlier ones. */
    public static final class Builder {

        private final Map<String, MathFunction> functions = new LinkedHashMap<>();

        private Builder() {}

        /** Adds every built-in function. */
        public Builder withStandardFunctions() {
            StandardFunctions.all().forEach(this::register);
            return this;
        }

        public Builder register(MathFunction function) {
            if (function == null) {
                throw new NullPointerException("function must not be null");
            }
            String name = function.name();
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("function name must not be null or empty");
            }
            functions.put(name, function);
            return this;
        }

        public FunctionRegistry build() {
            FunctionRegistry registry = new FunctionRegistry(functions);
            LOG.debug("Function registry built with {} functions", registry.size());
            return registry;
        }
    }

    private static final class StandardHolder {
        private static final FunctionRegistry INSTANCE =
                builder().withStandardFunctions().build();
    }
}
