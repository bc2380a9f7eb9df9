package io.arithma.core.engine;

import io.arithma.core.error.UnsupportedRuleException;
import io.arithma.core.model.Environment;
import io.arithma.core.model.Node;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Indefinite and definite integration for a deliberately small set of shapes: constants, the
 * variable itself, sums and differences, negation, {@code x^n} (including {@code n = -1}),
 * constant factors, {@code k/x} and division by a constant. Anything else fails with {@link
 * UnsupportedRuleException}.
 *
 * <p>The antiderivative carries no integration constant; renderers append one when producing
 * text.
 */
public final class Integrator {

    private static final Logger LOG = LoggerFactory.getLogger(Integrator.class);

    private static final String OPERATION = "integrate";

    private final Evaluator evaluator;

    public Integrator(Evaluator evaluator) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
    }

    /**
     * Returns an antiderivative of {@code node} with respect to {@code var}.
     *
     * @throws UnsupportedRuleException if no rule covers the expression
     */
    public Node integrate(Node node, String var) {
        Node x = new Node.Variable(var);
        if (!node.dependsOn(var)) {
            // k dx = k x, including foreign variables
            return new Node.Multiply(node, x);
        }
        if (node instanceof Node.Variable) {
            return new Node.Divide(new Node.Power(x, new Node.Number(2)), new Node.Number(2));
        }
        if (node instanceof Node.Add a) {
            return new Node.Add(integrate(a.left(), var), integrate(a.right(), var));
        }
        if (node instanceof Node.Subtract s) {
            return new Node.Subtract(integrate(s.left(), var), integrate(s.right(), var));
        }
        if (node instanceof Node.Negate n) {
            return new Node.Negate(integrate(n.operand(), var));
        }
        if (node instanceof Node.Power p && p.base() instanceof Node.Variable) {
            return powerRule(p, var);
        }
        if (node instanceof Node.Multiply m) {
            return constantFactor(m, var);
        }
        if (node instanceof Node.Divide d) {
            return quotient(d.left(), d.right(), var, node);
        }
        if (node instanceof Node.Function f && "frac".equals(f.name()) && f.args().size() == 2) {
            return quotient(f.args().get(0), f.args().get(1), var, node);
        }
        throw unsupported(node);
    }

    /**
     * Evaluates the definite integral of {@code node} from {@code lower} to {@code upper} as
     * F(upper) - F(lower).
     *
     * @throws UnsupportedRuleException if no antiderivative rule applies
     * @throws io.arithma.core.error.UndefinedVariableException if the antiderivative has other free
     *     variables
     */
    public double definiteIntegral(Node node, String var, double lower, double upper) {
        Node antiderivative = integrate(node, var);
        double atUpper = evaluator.evaluate(antiderivative, Environment.of(var, upper));
        double atLower = evaluator.evaluate(antiderivative, Environment.of(var, lower));
        LOG.debug("Definite integral of {} from {} to {}: {} - {}", node.toLatex(), lower, upper, atUpper, atLower);
        return atUpper - atLower;
    }

    private Node powerRule(Node.Power power, String var) {
        OptionalDouble exponent = Differentiator.numericLiteral(power.exponent());
        if (exponent.isEmpty() || power.exponent().dependsOn(var)) {
            throw unsupported(power);
        }
        Node x = power.base();
        double n = exponent.getAsDouble();
        if (n == -1) {
            return logAbs(x);
        }
        // x^n dx = x^(n+1) / (n+1)
        return new Node.Divide(new Node.Power(x, new Node.Number(n + 1)), new Node.Number(n + 1));
    }

    private Node constantFactor(Node.Multiply m, String var) {
        boolean leftConstant = !m.left().dependsOn(var);
        boolean rightConstant = !m.right().dependsOn(var);
        if (leftConstant && !rightConstant) {
            return new Node.Multiply(m.left(), integrate(m.right(), var));
        }
        if (rightConstant && !leftConstant) {
            return new Node.Multiply(m.right(), integrate(m.left(), var));
        }
        throw unsupported(m);
    }

    private Node quotient(Node numerator, Node denominator, String var, Node original) {
        if (!denominator.dependsOn(var)) {
            return new Node.Divide(integrate(numerator, var), denominator);
        }
        if (!numerator.dependsOn(var) && denominator instanceof Node.Variable x) {
            // k/x dx = k ln|x|
            Node log = logAbs(x);
            return isOne(numerator) ? log : new Node.Multiply(numerator, log);
        }
        throw unsupported(original);
    }

    private static Node logAbs(Node x) {
        return new Node.Function("ln", List.of(new Node.Abs(x)));
    }

    private static boolean isOne(Node node) {
        OptionalDouble value = Differentiator.numericLiteral(node);
        return value.isPresent() && value.getAsDouble() == 1.0;
    }

    private static UnsupportedRuleException unsupported(Node node) {
        return new UnsupportedRuleException(
                OPERATION,
                String.format("No integration rule for %s: %s", node.getClass().getSimpleName(), node.toLatex()));
    }
}
