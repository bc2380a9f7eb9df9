package io.arithma.core.function;

import io.arithma.core.error.DomainException;
import java.util.List;

/** The built-in function table. */
final class StandardFunctions {

    private static final double POLE_EPSILON = 1e-10;

    private StandardFunctions() {
        // utility class
    }

    static List<MathFunction> all() {
        return List.of(
                // trigonometric and hyperbolic
                MathFunction.unary("sin", Math::sin),
                MathFunction.unary("cos", Math::cos),
                MathFunction.unary("tan", Math::tan),
                MathFunction.unary("sinh", Math::sinh),
                MathFunction.unary("cosh", Math::cosh),
                MathFunction.unary("tanh", Math::tanh),
                MathFunction.unary("arcsin", Math::asin),
                MathFunction.unary("arccos", Math::acos),
                MathFunction.unary("arctan", Math::atan),
                MathFunction.unary("arg", Math::atan),
                MathFunction.unary("sec", x -> reciprocal(Math.cos(x))),
                MathFunction.unary("csc", x -> reciprocal(Math.sin(x))),
                MathFunction.unary("cot", StandardFunctions::cot),
                MathFunction.unary("coth", x -> reciprocal(Math.tanh(x))),

                // logarithms, roots, division
                MathFunction.unary("ln", Math::log),
                MathFunction.unary("log", Math::log10),
                MathFunction.unary("lg", x -> Math.log(x) / Math.log(2)),
                MathFunction.unary("sqrt", StandardFunctions::sqrt),
                MathFunction.unary("exp", Math::exp),
                MathFunction.unary("abs", Math::abs),
                MathFunction.of("frac", Arity.fixed(2), args -> args[1] == 0.0 ? Double.NaN : args[0] / args[1]),

                // aggregates
                MathFunction.of("min", Arity.variadic(1), StandardFunctions::min),
                MathFunction.of("max", Arity.variadic(1), StandardFunctions::max),
                MathFunction.of("inf", Arity.variadic(1), StandardFunctions::min),
                MathFunction.of("sup", Arity.variadic(1), StandardFunctions::max),
                MathFunction.of("liminf", Arity.variadic(1), StandardFunctions::min),
                MathFunction.of("limsup", Arity.variadic(1), StandardFunctions::max),
                MathFunction.of("det", Arity.variadic(1), StandardFunctions::product),
                MathFunction.of("gcd", Arity.variadic(2), StandardFunctions::gcd),

                // constant-returning stubs
                MathFunction.of("dim", Arity.fixed(0), args -> 1.0),
                MathFunction.of("ker", Arity.fixed(0), args -> 0.0),
                MathFunction.of("deg", Arity.fixed(0), args -> 1.0),
                // lim(value, point) returns the value it was given
                MathFunction.of("lim", Arity.fixed(2), args -> args[0]));
    }

    private static double reciprocal(double denominator) {
        return denominator == 0.0 ? Double.NaN : 1.0 / denominator;
    }

    private static double cot(double x) {
        double tan = Math.tan(x);
        return Math.abs(tan) < POLE_EPSILON ? Double.NaN : 1.0 / tan;
    }

    private static double sqrt(double x) {
        if (x < 0) {
            throw new DomainException("Square root of negative number: " + x);
        }
        return Math.sqrt(x);
    }

    private static double min(double[] args) {
        double result = Double.POSITIVE_INFINITY;
        for (double arg : args) {
            result = Math.min(result, arg);
        }
        return result;
    }

    private static double max(double[] args) {
        double result = Double.NEGATIVE_INFINITY;
        for (double arg : args) {
            result = Math.max(result, arg);
        }
        return result;
    }

    private static double product(double[] args) {
        double result = 1.0;
        for (double arg : args) {
            result *= arg;
        }
        return result;
    }

    /** Greatest common divisor of the arguments truncated towards zero. */
    private static double gcd(double[] args) {
        long result = Math.abs((long) args[0]);
        for (int i = 1; i < args.length; i++) {
            long b = Math.abs((long) args[i]);
            while (b != 0) {
                long t = b;
                b = result % b;
                result = t;
            }
        }
        return result;
    }
}
