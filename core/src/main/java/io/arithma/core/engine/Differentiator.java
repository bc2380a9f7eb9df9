package io.arithma.core.engine;

import io.arithma.core.error.UnsupportedRuleException;
import io.arithma.core.model.Node;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Symbolic differentiation by structural recursion.
 *
 * <p>Implements the constant, sum, product, quotient, power and chain rules plus rules for
 * {@code sqrt}, absolute value, negation and the functions sin, cos, tan, ln, log, exp, abs and
 * frac. The result is not simplified. Shapes without a rule, such as a variable exponent, fail
 * with {@link UnsupportedRuleException}.
 */
public final class Differentiator {

    private static final Logger LOG = LoggerFactory.getLogger(Differentiator.class);

    private static final String OPERATION = "differentiate";

    /**
     * Differentiates {@code node} with respect to {@code var}.
     *
     * @throws UnsupportedRuleException if no rule covers a subtree that depends on {@code var}
     */
    public Node differentiate(Node node, String var) {
        if (!node.dependsOn(var)) {
            return zero();
        }
        if (node instanceof Node.Variable) {
            // dependsOn: this is the variable itself
            return one();
        }
        if (node instanceof Node.Add a) {
            return new Node.Add(differentiate(a.left(), var), differentiate(a.right(), var));
        }
        if (node instanceof Node.Subtract s) {
            return new Node.Subtract(differentiate(s.left(), var), differentiate(s.right(), var));
        }
        if (node instanceof Node.Multiply m) {
            return productRule(m.left(), m.right(), var);
        }
        if (node instanceof Node.Divide d) {
            return quotientRule(d.left(), d.right(), var);
        }
        if (node instanceof Node.Power p) {
            return powerRule(p, var);
        }
        if (node instanceof Node.Sqrt s) {
            return sqrtRule(s.operand(), var);
        }
        if (node instanceof Node.Abs a) {
            return absRule(a.operand(), var);
        }
        if (node instanceof Node.Negate n) {
            return new Node.Negate(differentiate(n.operand(), var));
        }
        if (node instanceof Node.Function f) {
            return functionRule(f, var);
        }
        if (node instanceof Node.Summation s) {
            return summationRule(s, var);
        }
        if (node instanceof Node.Piecewise p) {
            List<Node.Piecewise.Case> cases = new ArrayList<>(p.cases().size());
            for (Node.Piecewise.Case c : p.cases()) {
                cases.add(new Node.Piecewise.Case(differentiate(c.value(), var), c.guard()));
            }
            return new Node.Piecewise(cases);
        }
        throw unsupported(
                "No differentiation rule for %s: %s", node.getClass().getSimpleName(), node.toLatex());
    }

    /** Partial derivative with respect to {@code var}; other variables are held constant. */
    public Node partial(Node node, String var) {
        return differentiate(node, var);
    }

    // (f g)' = f g' + g f'
    private Node productRule(Node f, Node g, String var) {
        return new Node.Add(
                new Node.Multiply(f, differentiate(g, var)), new Node.Multiply(g, differentiate(f, var)));
    }

    // (f / g)' = (g f' - f g') / g^2
    private Node quotientRule(Node f, Node g, String var) {
        Node numerator = new Node.Subtract(
                new Node.Multiply(g, differentiate(f, var)), new Node.Multiply(f, differentiate(g, var)));
        return new Node.Divide(numerator, new Node.Power(g, new Node.Number(2)));
    }

    private Node powerRule(Node.Power power, String var) {
        Node base = power.base();
        Node exponent = power.exponent();
        if (exponent.dependsOn(var)) {
            throw unsupported(
                    "Differentiation of a power whose exponent depends on '%s' is not supported: %s",
                    var, power.toLatex());
        }
        OptionalDouble literal = numericLiteral(exponent);
        if (base instanceof Node.Variable && literal.isPresent()) {
            // d/dx x^n = n x^(n-1)
            double n = literal.getAsDouble();
            LOG.debug("Power rule for {}", power.toLatex());
            if (n - 1 == 0) {
                return new Node.Number(n);
            }
            if (n - 1 == 1) {
                return new Node.Multiply(new Node.Number(n), base);
            }
            return new Node.Multiply(new Node.Number(n), new Node.Power(base, new Node.Number(n - 1)));
        }
        // chain rule: d/dx f^e = e f^(e-1) f'
        LOG.debug("Chain rule for {}", power.toLatex());
        Node reduced = literal.isPresent()
                ? new Node.Number(literal.getAsDouble() - 1)
                : new Node.Subtract(exponent, new Node.Number(1));
        return new Node.Multiply(
                new Node.Multiply(exponent, new Node.Power(base, reduced)), differentiate(base, var));
    }

    // (sqrt f)' = 0.5 f' / sqrt f
    private Node sqrtRule(Node f, String var) {
        return new Node.Divide(new Node.Multiply(new Node.Number(0.5), differentiate(f, var)), new Node.Sqrt(f));
    }

    // |f|' = f / |f| * f'
    private Node absRule(Node f, String var) {
        return new Node.Multiply(new Node.Divide(f, new Node.Abs(f)), differentiate(f, var));
    }

    private Node functionRule(Node.Function function, String var) {
        String name = function.name();
        List<Node> args = function.args();
        if ("frac".equals(name) && args.size() == 2) {
            return quotientRule(args.get(0), args.get(1), var);
        }
        if (args.size() != 1) {
            throw unsupported("No differentiation rule for function '%s' with %d arguments", name, args.size());
        }
        Node f = args.get(0);
        Node inner = differentiate(f, var);
        return switch (name) {
            case "sqrt" -> sqrtRule(f, var);
            case "abs" -> absRule(f, var);
            case "sin" -> new Node.Multiply(new Node.Function("cos", f), inner);
            case "cos" -> new Node.Multiply(new Node.Negate(new Node.Function("sin", f)), inner);
            // sec^2 f = 1 / cos^2 f
            case "tan" -> new Node.Multiply(
                    new Node.Divide(
                            new Node.Number(1), new Node.Power(new Node.Function("cos", f), new Node.Number(2))),
                    inner);
            case "ln" -> new Node.Divide(inner, f);
            case "log" -> new Node.Divide(inner, new Node.Multiply(f, new Node.Number(Math.log(10))));
            case "exp" -> new Node.Multiply(new Node.Function("exp", f), inner);
            default -> throw unsupported("No differentiation rule for function '%s'", name);
        };
    }

    private Node summationRule(Node.Summation s, String var) {
        if (s.index().equals(var)) {
            return zero();
        }
        if (s.start().dependsOn(var) || s.end().dependsOn(var)) {
            throw unsupported(
                    "Differentiation of a summation whose bounds depend on '%s' is not supported: %s",
                    var, s.toLatex());
        }
        return new Node.Summation(s.index(), s.start(), s.end(), differentiate(s.body(), var));
    }

    /** Value of a number written as a literal: a number, a rational or a negated number. */
    static OptionalDouble numericLiteral(Node node) {
        if (node instanceof Node.Number n) {
            return OptionalDouble.of(n.value());
        }
        if (node instanceof Node.Rational r && r.denominator() != 0) {
            return OptionalDouble.of((double) r.numerator() / r.denominator());
        }
        if (node instanceof Node.Negate neg && neg.operand() instanceof Node.Number n) {
            return OptionalDouble.of(-n.value());
        }
        return OptionalDouble.empty();
    }

    private static Node zero() {
        return new Node.Number(0);
    }

    private static Node one() {
        return new Node.Number(1);
    }

    private static UnsupportedRuleException unsupported(String format, Object... args) {
        return new UnsupportedRuleException(OPERATION, String.format(format, args));
    }
}
