package io.arithma.core.function;

import java.util.Objects;
import java.util.function.DoubleUnaryOperator;

/**
 * A named numeric function that can be registered in a {@link FunctionRegistry}. Implementations
 * must be stateless and thread-safe; the registry hands the same instance to every caller.
 */
public interface MathFunction {

    /** Canonical name, without the LaTeX backslash (e.g. {@code "sin"}). */
    String name();

    Arity arity();

    /**
     * Computes the function value. The caller has already checked the argument count against
     * {@link #arity()}. Soft domain errors return {@link Double#NaN}; hard ones throw.
     */
    double apply(double[] args);

    /** Body of a function defined inline. */
    @FunctionalInterface
    interface Body {
        double apply(double[] args);
    }

    /** Creates a function from a name, an arity and a body. */
    static MathFunction of(String name, Arity arity, Body body) {
        return new Simple(name, arity, body);
    }

    /** Convenience for single-argument functions. */
    static MathFunction unary(String name, DoubleUnaryOperator body) {
        Objects.requireNonNull(body, "body must not be null");
        return new Simple(name, Arity.fixed(1), args -> body.applyAsDouble(args[0]));
    }

    /** Default implementation backing {@link #of} and {@link #unary}. */
    record Simple(String name, Arity arity, Body body) implements MathFunction {
        public Simple {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("function name must not be null or empty");
            }
            Objects.requireNonNull(arity, "arity must not be null");
            Objects.requireNonNull(body, "body must not be null");
        }

        @Override
        public double apply(double[] args) {
            return body.apply(args);
        }
    }
}
