package io.arithma.core.engine;

import io.arithma.core.config.EngineConfig;
import io.arithma.core.error.DomainException;
import io.arithma.core.error.UnsupportedRuleException;
import io.arithma.core.function.FunctionRegistry;
import io.arithma.core.model.Environment;
import io.arithma.core.model.LatexRenderer;
import io.arithma.core.model.Node;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Numeric evaluation of a tree against an {@link Environment}.
 *
 * <p>Division by exactly zero and a zero-denominator {@link Node.Rational} evaluate to NaN, while a
 * square root of a negative number throws {@link DomainException}. Comparisons yield 1.0 or 0.0.
 * Evaluation is pure: the environment is only read, and a summation binds its index in a copy.
 */
public final class Evaluator {

    private static final Logger LOG = LoggerFactory.getLogger(Evaluator.class);

    /** Largest summation bound magnitude; every integer up to 2^53 is exact as a double. */
    static final double MAX_EXACT_BOUND = 0x1p53;

    private final FunctionRegistry registry;
    private final EngineConfig config;

    public Evaluator(FunctionRegistry registry) {
        this(registry, EngineConfig.DEFAULT);
    }

    public Evaluator(FunctionRegistry registry, EngineConfig config) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Evaluates {@code node}.
     *
     * @throws io.arithma.core.error.UndefinedVariableException if a free variable is not bound
     * @throws DomainException for the square root of a negative number, non-integer summation
     *     bounds or a piecewise expression with no matching branch
     * @throws UnsupportedRuleException when asked to evaluate an equation
     */
    public double evaluate(Node node, Environment env) {
        if (node instanceof Node.Number n) {
            return n.value();
        }
        if (node instanceof Node.Variable v) {
            return env.require(v.name());
        }
        if (node instanceof Node.Rational r) {
            return r.denominator() == 0 ? Double.NaN : (double) r.numerator() / r.denominator();
        }
        if (node instanceof Node.Equation) {
            throw new UnsupportedRuleException(
                    "evaluate", "An equation has no numeric value; solve it for a variable instead");
        }
        if (node instanceof Node.Binary b) {
            double left = evaluate(b.left(), env);
            double right = evaluate(b.right(), env);
            return applyBinary(b, left, right);
        }
        if (node instanceof Node.Sqrt s) {
            double value = evaluate(s.operand(), env);
            if (value < 0) {
                throw new DomainException("Square root of negative number: " + LatexRenderer.formatNumber(value));
            }
            return Math.sqrt(value);
        }
        if (node instanceof Node.Abs a) {
            return Math.abs(evaluate(a.operand(), env));
        }
        if (node instanceof Node.Negate neg) {
            return -evaluate(neg.operand(), env);
        }
        if (node instanceof Node.Piecewise p) {
            for (Node.Piecewise.Case c : p.cases()) {
                if (evaluate(c.guard(), env) == 1.0) {
                    return evaluate(c.value(), env);
                }
            }
            throw new DomainException("No piecewise branch matched");
        }
        if (node instanceof Node.Summation s) {
            return evaluateSummation(s, env);
        }
        if (node instanceof Node.Function f) {
            List<Node> args = f.args();
            double[] values = new double[args.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = evaluate(args.get(i), env);
            }
            return registry.apply(f.name(), values);
        }
        throw new IllegalStateException("Unhandled node type: " + node.getClass().getSimpleName());
    }

    private static double applyBinary(Node.Binary node, double left, double right) {
        if (node instanceof Node.Add) {
            return left + right;
        }
        if (node instanceof Node.Subtract) {
            return left - right;
        }
        if (node instanceof Node.Multiply) {
            return left * right;
        }
        if (node instanceof Node.Divide) {
            return right == 0.0 ? Double.NaN : left / right;
        }
        if (node instanceof Node.Power) {
            return Math.pow(left, right);
        }
        if (node instanceof Node.Greater) {
            return truth(left > right);
        }
        if (node instanceof Node.Less) {
            return truth(left < right);
        }
        if (node instanceof Node.GreaterEqual) {
            return truth(left >= right);
        }
        if (node instanceof Node.LessEqual) {
            return truth(left <= right);
        }
        if (node instanceof Node.Equal) {
            return truth(left == right);
        }
        throw new IllegalStateException("Unhandled binary node: " + node.getClass().getSimpleName());
    }

    private double evaluateSummation(Node.Summation s, Environment env) {
        long start = integerBound(evaluate(s.start(), env), "lower");
        long end = integerBound(evaluate(s.end(), env), "upper");
        if (end < start) {
            return 0.0;
        }
        if (end - start + 1 > config.summationMaxTerms()) {
            throw new DomainException(String.format(
                    "Summation over %d terms exceeds the limit of %d", end - start + 1, config.summationMaxTerms()));
        }
        LOG.debug("Evaluating summation over '{}' from {} to {}", s.index(), start, end);
        double total = 0.0;
        for (long k = start; k <= end; k++) {
            total += evaluate(s.body(), env.with(s.index(), k));
        }
        return total;
    }

    private static long integerBound(double value, String which) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value != Math.rint(value)) {
            throw new DomainException("Summation " + which + " bound must be an integer, got: " + value);
        }
        if (Math.abs(value) > MAX_EXACT_BOUND) {
            throw new DomainException("Summation " + which + " bound is out of range, got: " + value);
        }
        return (long) value;
    }

    private static double truth(boolean condition) {
        return condition ? 1.0 : 0.0;
    }
}
