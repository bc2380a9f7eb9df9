package io.arithma.core.engine;

import io.arithma.core.config.EngineConfig;
import io.arithma.core.model.Environment;
import io.arithma.core.model.Node;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites a tree into a reduced, equivalent form.
 *
 * <p>Sums and differences are flattened into like terms keyed by variable name (or by the
 * rendering of any other term) and rebuilt in key order with the constant first. Products fold
 * literal factors and put the coefficient on the left, powers drop exponents 0 and 1, division by 1
 * disappears, rationals are reduced and small integer-bounded summations are unrolled.
 *
 * <p>The pass is idempotent: simplifying a simplified tree returns an equal tree.
 */
public final class Simplifier {

    private static final Logger LOG = LoggerFactory.getLogger(Simplifier.class);

    private final EngineConfig config;

    public Simplifier() {
        this(EngineConfig.DEFAULT);
    }

    public Simplifier(EngineConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public Node simplify(Node node) {
        return simplify(node, new Environment());
    }

    /**
     * Simplifies {@code node}. The environment is only consulted when bound variables are inlined
     * (see {@link EngineConfig#inlineBoundVariables()}).
     */
    public Node simplify(Node node, Environment env) {
        if (node instanceof Node.Number) {
            return node;
        }
        if (node instanceof Node.Variable v) {
            if (config.inlineBoundVariables() && env.contains(v.name())) {
                return new Node.Number(env.require(v.name()));
            }
            return v;
        }
        if (node instanceof Node.Rational r) {
            return rational(r.numerator(), r.denominator());
        }
        if (node instanceof Node.Add || node instanceof Node.Subtract || node instanceof Node.Negate) {
            return simplifySum(node, env);
        }
        if (node instanceof Node.Multiply m) {
            return simplifyProduct(simplify(m.left(), env), simplify(m.right(), env));
        }
        if (node instanceof Node.Power p) {
            return simplifyPower(simplify(p.base(), env), simplify(p.exponent(), env));
        }
        if (node instanceof Node.Divide d) {
            Node left = simplify(d.left(), env);
            Node right = simplify(d.right(), env);
            return isLiteral(right, 1) ? left : new Node.Divide(left, right);
        }
        if (node instanceof Node.Summation s) {
            return simplifySummation(s, env);
        }
        if (node instanceof Node.Binary b) {
            return b.with(simplify(b.left(), env), simplify(b.right(), env));
        }
        if (node instanceof Node.Unary u) {
            return u.with(simplify(u.operand(), env));
        }
        if (node instanceof Node.Function f) {
            List<Node> args = new ArrayList<>(f.args().size());
            for (Node arg : f.args()) {
                args.add(simplify(arg, env));
            }
            return new Node.Function(f.name(), args);
        }
        if (node instanceof Node.Piecewise p) {
            List<Node.Piecewise.Case> cases = new ArrayList<>(p.cases().size());
            for (Node.Piecewise.Case c : p.cases()) {
                cases.add(new Node.Piecewise.Case(simplify(c.value(), env), simplify(c.guard(), env)));
            }
            return new Node.Piecewise(cases);
        }
        throw new IllegalStateException("Unhandled node type: " + node.getClass().getSimpleName());
    }

    // ── Sums ──

    /** A collected term and its accumulated coefficient. */
    private record Term(Node node, double coefficient) {}

    private Node simplifySum(Node node, Environment env) {
        Map<String, Term> terms = new TreeMap<>();
        collectTerms(node, 1.0, env, terms);
        return rebuildSum(terms);
    }

    private void collectTerms(Node node, double sign, Environment env, Map<String, Term> terms) {
        if (node instanceof Node.Add a) {
            collectTerms(a.left(), sign, env, terms);
            collectTerms(a.right(), sign, env, terms);
            return;
        }
        if (node instanceof Node.Subtract s) {
            collectTerms(s.left(), sign, env, terms);
            collectTerms(s.right(), -sign, env, terms);
            return;
        }
        if (node instanceof Node.Negate n) {
            collectTerms(n.operand(), -sign, env, terms);
            return;
        }
        Node term = simplify(node, env);
        if (term instanceof Node.Add || term instanceof Node.Subtract || term instanceof Node.Negate) {
            // e.g. an unrolled summation
            collectTerms(term, sign, env, terms);
            return;
        }
        if (term instanceof Node.Number n) {
            addTerm(terms, "", term, sign * n.value());
        } else if (term instanceof Node.Rational r) {
            addTerm(terms, "", term, sign * r.numerator() / r.denominator());
        } else if (term instanceof Node.Multiply m && m.left() instanceof Node.Number c) {
            addTerm(terms, termKey(m.right()), m.right(), sign * c.value());
        } else {
            addTerm(terms, termKey(term), term, sign);
        }
    }

    private static void addTerm(Map<String, Term> terms, String key, Node node, double coefficient) {
        terms.merge(
                key, new Term(node, coefficient), (a, b) -> new Term(a.node(), a.coefficient() + b.coefficient()));
    }

    private static String termKey(Node term) {
        return term instanceof Node.Variable v ? v.name() : term.toLatex();
    }

    private static Node rebuildSum(Map<String, Term> terms) {
        Node result = null;
        for (Map.Entry<String, Term> entry : terms.entrySet()) {
            double coefficient = entry.getValue().coefficient();
            if (coefficient == 0.0) {
                continue;
            }
            boolean constant = entry.getKey().isEmpty();
            Node node = entry.getValue().node();
            if (result == null) {
                result = constant ? new Node.Number(coefficient) : scaled(node, coefficient);
            } else if (coefficient < 0) {
                Node magnitude = constant ? new Node.Number(-coefficient) : scaled(node, -coefficient);
                result = new Node.Subtract(result, magnitude);
            } else {
                Node magnitude = constant ? new Node.Number(coefficient) : scaled(node, coefficient);
                result = new Node.Add(result, magnitude);
            }
        }
        return result == null ? new Node.Number(0) : result;
    }

    private static Node scaled(Node node, double coefficient) {
        if (coefficient == 1.0) {
            return node;
        }
        if (coefficient == -1.0) {
            return new Node.Negate(node);
        }
        return new Node.Multiply(new Node.Number(coefficient), node);
    }

    // ── Products and powers ──

    private static Node simplifyProduct(Node left, Node right) {
        if (isLiteral(left, 0) || isLiteral(right, 0)) {
            return new Node.Number(0);
        }
        if (isLiteral(left, 1)) {
            return right;
        }
        if (isLiteral(right, 1)) {
            return left;
        }
        if (left instanceof Node.Rational a && right instanceof Node.Rational b) {
            return multiplyRationals(a, b);
        }
        if (left instanceof Node.Number a && right instanceof Node.Number b) {
            return new Node.Number(a.value() * b.value());
        }
        if (left instanceof Node.Number a
                && right instanceof Node.Multiply m
                && m.left() instanceof Node.Number b) {
            return simplifyProduct(new Node.Number(a.value() * b.value()), m.right());
        }
        if (right instanceof Node.Number b
                && left instanceof Node.Multiply m
                && m.left() instanceof Node.Number a) {
            return simplifyProduct(new Node.Number(a.value() * b.value()), m.right());
        }
        if (right instanceof Node.Number) {
            // coefficient first: x \cdot 3 becomes 3x
            return new Node.Multiply(right, left);
        }
        return new Node.Multiply(left, right);
    }

    private static Node multiplyRationals(Node.Rational a, Node.Rational b) {
        try {
            return rational(
                    Math.multiplyExact(a.numerator(), b.numerator()),
                    Math.multiplyExact(a.denominator(), b.denominator()));
        } catch (ArithmeticException e) {
            LOG.debug("Rational product overflows long, folding to a floating-point number");
            return new Node.Number(((double) a.numerator() / a.denominator())
                    * ((double) b.numerator() / b.denominator()));
        }
    }

    private static Node simplifyPower(Node base, Node exponent) {
        if (isLiteral(exponent, 0)) {
            return new Node.Number(1);
        }
        if (isLiteral(exponent, 1)) {
            return base;
        }
        if (base instanceof Node.Number b && exponent instanceof Node.Number e) {
            return new Node.Number(Math.pow(b.value(), e.value()));
        }
        return new Node.Power(base, exponent);
    }

    /**
     * Reduces a fraction: zero denominator becomes NaN, zero numerator becomes 0, and a unit
     * denominator becomes a plain number. The sign is carried by the numerator.
     */
    static Node rational(long numerator, long denominator) {
        if (denominator == 0) {
            return new Node.Number(Double.NaN);
        }
        if (numerator == 0) {
            return new Node.Number(0);
        }
        long gcd = gcd(Math.abs(numerator), Math.abs(denominator));
        long n = numerator / gcd;
        long d = denominator / gcd;
        if (d < 0) {
            n = -n;
            d = -d;
        }
        return d == 1 ? new Node.Number(n) : new Node.Rational(n, d);
    }

    private static long gcd(long a, long b) {
        while (b != 0) {
            long t = b;
            b = a % b;
            a = t;
        }
        return a;
    }

    // ── Summations ──

    private Node simplifySummation(Node.Summation s, Environment env) {
        Node start = simplify(s.start(), env);
        Node end = simplify(s.end(), env);
        if (isBound(start) && isBound(end)) {
            long from = (long) ((Node.Number) start).value();
            long to = (long) ((Node.Number) end).value();
            if (to < from) {
                return new Node.Number(0);
            }
            // bounds are within 2^53, so the count cannot overflow
            long count = to - from + 1;
            if (count <= config.maxUnrollTerms()) {
                LOG.debug("Unrolling summation over '{}' from {} to {}", s.index(), from, to);
                Node chain = null;
                for (long k = from; k <= to; k++) {
                    Node term = Substitution.substituteVariable(s.body(), s.index(), new Node.Number(k));
                    chain = chain == null ? term : new Node.Add(chain, term);
                }
                return simplify(chain, env);
            }
        }
        Node body = simplify(s.body(), config.inlineBoundVariables() ? env.without(s.index()) : env);
        return new Node.Summation(s.index(), start, end, body);
    }

    private static boolean isBound(Node node) {
        return node instanceof Node.Number n
                && Math.abs(n.value()) <= Evaluator.MAX_EXACT_BOUND
                && n.value() == Math.rint(n.value());
    }

    private static boolean isLiteral(Node node, double value) {
        return node instanceof Node.Number n && n.value() == value;
    }
}
