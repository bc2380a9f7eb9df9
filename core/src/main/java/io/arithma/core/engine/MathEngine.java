package io.arithma.core.engine;

import io.arithma.core.config.EngineConfig;
import io.arithma.core.function.FunctionRegistry;
import io.arithma.core.model.Environment;
import io.arithma.core.model.Node;
import io.arithma.core.parse.Parser;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point wiring the parser and the symbolic passes together, with text-in/text-out variants
 * of each operation for front ends that only deal in LaTeX strings.
 *
 * <p>Every failure surfaces as an {@link io.arithma.core.error.ArithmaException} whose message is
 * meant to be shown to the user; a failure only aborts the call that raised it.
 *
 * <p>Thread-safe as long as each call gets its own {@link Environment}.
 */
public final class MathEngine {

    private static final Logger LOG = LoggerFactory.getLogger(MathEngine.class);

    private final EngineConfig config;
    private final FunctionRegistry registry;
    private final Parser parser;
    private final Evaluator evaluator;
    private final Simplifier simplifier;
    private final Differentiator differentiator;
    private final Integrator integrator;
    private final LinearSolver solver;

    public MathEngine() {
        this(FunctionRegistry.standard(), EngineConfig.DEFAULT);
    }

    public MathEngine(EngineConfig config) {
        this(FunctionRegistry.standard(), config);
    }

    public MathEngine(FunctionRegistry registry, EngineConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.parser = new Parser(registry);
        this.evaluator = new Evaluator(registry, config);
        this.simplifier = new Simplifier(config);
        this.differentiator = new Differentiator();
        this.integrator = new Integrator(evaluator);
        this.solver = new LinearSolver(evaluator);
        LOG.debug("Math engine created with {} functions and {}", registry.size(), config);
    }

    public Node parse(String latex) {
        return parser.parse(latex);
    }

    public String render(Node node) {
        return node.toLatex();
    }

    public double evaluate(Node node, Environment env) {
        return evaluator.evaluate(node, env);
    }

    public double evaluate(String latex, Environment env) {
        return evaluator.evaluate(parse(latex), env);
    }

    public Node simplify(Node node, Environment env) {
        return simplifier.simplify(node, env);
    }

    public String simplify(String latex, Environment env) {
        return render(simplifier.simplify(parse(latex), env));
    }

    public Node differentiate(Node node, String var) {
        return differentiator.differentiate(node, var);
    }

    /** Differentiates and simplifies, returning the rendered derivative. */
    public String differentiate(String latex, String var) {
        Node derivative = simplifier.simplify(differentiator.differentiate(parse(latex), var));
        String result = render(derivative);
        LOG.debug("d/d{} {} = {}", var, latex, result);
        return result;
    }

    public Node integrate(Node node, String var) {
        return integrator.integrate(node, var);
    }

    /** Integrates and simplifies, returning the rendered antiderivative with the constant suffix. */
    public String integrate(String latex, String var) {
        Node antiderivative = simplifier.simplify(integrator.integrate(parse(latex), var));
        return render(antiderivative) + config.integrationConstant();
    }

    public double definiteIntegral(Node node, String var, double lower, double upper) {
        return integrator.definiteIntegral(node, var, lower, upper);
    }

    public double definiteIntegral(String latex, String var, double lower, double upper) {
        return integrator.definiteIntegral(parse(latex), var, lower, upper);
    }

    /** Returns outer(inner), rendered. */
    public String compose(String outerLatex, String outerVar, String innerLatex) {
        return render(Composition.compose(parse(outerLatex), outerVar, parse(innerLatex)));
    }

    /** Applies the substitutions in order; each replacement is parsed from LaTeX. */
    public String substitute(String latex, List<Map.Entry<String, String>> substitutions) {
        List<Map.Entry<String, Node>> parsed = new ArrayList<>(substitutions.size());
        for (Map.Entry<String, String> substitution : substitutions) {
            parsed.add(Map.entry(substitution.getKey(), parse(substitution.getValue())));
        }
        return render(Substitution.substitute(parse(latex), parsed));
    }

    public double solve(Node equation, String var, Environment env) {
        return solver.solve(equation, var, env);
    }

    public double solve(String latex, String var, Environment env) {
        return solver.solve(parse(latex), var, env);
    }

    public EngineConfig config() {
        return config;
    }

    public FunctionRegistry registry() {
        return registry;
    }

    public Parser parser() {
        return parser;
    }
}
