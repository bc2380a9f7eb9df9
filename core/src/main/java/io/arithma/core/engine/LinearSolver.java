package io.arithma.core.engine;

import io.arithma.core.error.UnsupportedRuleException;
import io.arithma.core.model.Environment;
import io.arithma.core.model.Node;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Solves equations that are linear in one variable. Subtrees free of the target variable are
 * evaluated numerically against the environment, so other variables must be bound there.
 */
public final class LinearSolver {

    private static final Logger LOG = LoggerFactory.getLogger(LinearSolver.class);

    private static final String OPERATION = "solve";

    private final Evaluator evaluator;

    public LinearSolver(Evaluator evaluator) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
    }

    /** {@code coefficient * x + constant}. */
    private record Linear(double coefficient, double constant) {
        Linear plus(Linear other) {
            return new Linear(coefficient + other.coefficient, constant + other.constant);
        }

        Linear times(double factor) {
            return new Linear(coefficient * factor, constant * factor);
        }
    }

    /**
     * Solves {@code node} for {@code variable}. An {@link Node.Equation} is solved as {@code left -
     * right = 0}; any other expression is solved as {@code expression = 0}.
     *
     * @throws UnsupportedRuleException if the equation is not linear in {@code variable} or the
     *     variable's coefficient is zero
     * @throws io.arithma.core.error.UndefinedVariableException if another variable is not bound
     */
    public double solve(Node node, String variable, Environment env) {
        Node expression = node instanceof Node.Equation eq ? new Node.Subtract(eq.left(), eq.right()) : node;
        Linear linear = linearize(expression, variable, env);
        if (linear.coefficient() == 0.0) {
            throw new UnsupportedRuleException(
                    OPERATION, String.format("Coefficient of variable '%s' is zero, can't solve", variable));
        }
        double solution = -linear.constant() / linear.coefficient();
        LOG.debug("Solved {} for {}: {}", node.toLatex(), variable, solution);
        return solution;
    }

    private Linear linearize(Node node, String variable, Environment env) {
        if (!node.dependsOn(variable)) {
            return new Linear(0.0, evaluator.evaluate(node, env));
        }
        if (node instanceof Node.Variable) {
            return new Linear(1.0, 0.0);
        }
        if (node instanceof Node.Add a) {
            return linearize(a.left(), variable, env).plus(linearize(a.right(), variable, env));
        }
        if (node instanceof Node.Subtract s) {
            return linearize(s.left(), variable, env).plus(linearize(s.right(), variable, env).times(-1.0));
        }
        if (node instanceof Node.Negate n) {
            return linearize(n.operand(), variable, env).times(-1.0);
        }
        if (node instanceof Node.Multiply m) {
            if (!m.left().dependsOn(variable)) {
                return linearize(m.right(), variable, env).times(evaluator.evaluate(m.left(), env));
            }
            if (!m.right().dependsOn(variable)) {
                return linearize(m.left(), variable, env).times(evaluator.evaluate(m.right(), env));
            }
        }
        if (node instanceof Node.Divide d && !d.right().dependsOn(variable)) {
            double divisor = evaluator.evaluate(d.right(), env);
            if (divisor == 0.0) {
                throw new UnsupportedRuleException(OPERATION, "Division by zero while solving for " + variable);
            }
            return linearize(d.left(), variable, env).times(1.0 / divisor);
        }
        throw new UnsupportedRuleException(
                OPERATION,
                String.format("Expression is not linear in '%s': %s", variable, node.toLatex()));
    }
}
