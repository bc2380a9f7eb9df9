package io.arithma.core.engine;

import io.arithma.core.model.Node;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Structural replacement of variables by subtrees.
 *
 * <p>A summation index is bound inside the summation body: substituting the index name only
 * touches the bounds, never the body.
 */
public final class Substitution {

    private Substitution() {
        // utility class
    }

    /** Replaces every free occurrence of {@code name} in {@code node} with {@code replacement}. */
    public static Node substituteVariable(Node node, String name, Node replacement) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(replacement, "replacement must not be null");
        return replace(node, name, replacement);
    }

    /**
     * Applies the substitutions one after another, in list order. Later substitutions see the
     * result of earlier ones: substituting {@code x -> y} then {@code y -> 2} turns {@code x} into
     * {@code 2}.
     */
    public static Node substitute(Node node, List<Map.Entry<String, Node>> substitutions) {
        Node result = node;
        for (Map.Entry<String, Node> substitution : substitutions) {
            result = substituteVariable(result, substitution.getKey(), substitution.getValue());
        }
        return result;
    }

    private static Node replace(Node node, String name, Node replacement) {
        if (node instanceof Node.Variable v) {
            return v.name().equals(name) ? replacement : v;
        }
        if (node instanceof Node.Binary b) {
            return b.with(replace(b.left(), name, replacement), replace(b.right(), name, replacement));
        }
        if (node instanceof Node.Unary u) {
            return u.with(replace(u.operand(), name, replacement));
        }
        if (node instanceof Node.Function f) {
            List<Node> args = new ArrayList<>(f.args().size());
            for (Node arg : f.args()) {
                args.add(replace(arg, name, replacement));
            }
            return new Node.Function(f.name(), args);
        }
        if (node instanceof Node.Summation s) {
            Node start = replace(s.start(), name, replacement);
            Node end = replace(s.end(), name, replacement);
            Node body = s.index().equals(name) ? s.body() : replace(s.body(), name, replacement);
            return new Node.Summation(s.index(), start, end, body);
        }
        if (node instanceof Node.Piecewise p) {
            List<Node.Piecewise.Case> cases = new ArrayList<>(p.cases().size());
            for (Node.Piecewise.Case c : p.cases()) {
                cases.add(new Node.Piecewise.Case(
                        replace(c.value(), name, replacement), replace(c.guard(), name, replacement)));
            }
            return new Node.Piecewise(cases);
        }
        // numbers and rationals
        return node;
    }
}
