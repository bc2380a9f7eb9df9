package io.arithma.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Expression tree produced by the parser and consumed by every downstream pass.
 *
 * <p>The variant set is closed. Children are exclusively owned and immutable; every pass builds a
 * new tree rather than mutating the one it was given. Binary variants share the {@link Binary}
 * view and unary variants the {@link Unary} view so that passes which only rebuild children can
 * treat them uniformly.
 */
public sealed interface Node {

    /** Renders this tree back to LaTeX-flavoured text that parses to an equivalent tree. */
    default String toLatex() {
        return LatexRenderer.render(this);
    }

    /** Direct children in left to right order. */
    default List<Node> children() {
        if (this instanceof Binary b) {
            return List.of(b.left(), b.right());
        }
        if (this instanceof Unary u) {
            return List.of(u.operand());
        }
        if (this instanceof Function f) {
            return f.args();
        }
        if (this instanceof Summation s) {
            return List.of(s.start(), s.end(), s.body());
        }
        if (this instanceof Piecewise p) {
            List<Node> all = new ArrayList<>();
            for (Piecewise.Case c : p.cases()) {
                all.add(c.value());
                all.add(c.guard());
            }
            return all;
        }
        return List.of();
    }

    /**
     * Names of the variables that occur free in this tree. A summation index is bound inside the
     * body but still free in the bounds.
     */
    default Set<String> freeVariables() {
        Set<String> names = new LinkedHashSet<>();
        collectFreeVariables(this, names);
        return Collections.unmodifiableSet(names);
    }

    /** Returns {@code true} if {@code variable} occurs free in this tree. */
    default boolean dependsOn(String variable) {
        return freeVariables().contains(variable);
    }

    private static void collectFreeVariables(Node node, Set<String> names) {
        if (node instanceof Variable v) {
            names.add(v.name());
        } else if (node instanceof Summation s) {
            collectFreeVariables(s.start(), names);
            collectFreeVariables(s.end(), names);
            Set<String> inBody = new LinkedHashSet<>();
            collectFreeVariables(s.body(), inBody);
            inBody.remove(s.index());
            names.addAll(inBody);
        } else {
            for (Node child : node.children()) {
                collectFreeVariables(child, names);
            }
        }
    }

    // ── Views ──

    /** Variants with exactly two children. */
    sealed interface Binary extends Node {
        Node left();

        Node right();

        /** Same variant with new children. */
        Binary with(Node left, Node right);
    }

    /** Variants with exactly one child. */
    sealed interface Unary extends Node {
        Node operand();

        /** Same variant with a new child. */
        Unary with(Node operand);
    }

    // ── Leaves ──

    record Number(double value) implements Node {}

    record Variable(String name) implements Node {
        public Variable {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("variable name must not be null or empty");
            }
        }
    }

    /** Exact fraction; a zero denominator is representable and evaluates to NaN. */
    record Rational(long numerator, long denominator) implements Node {}

    // ── Arithmetic ──

    record Add(Node left, Node right) implements Binary {
        public Add {
            requireChildren(left, right);
        }

        @Override
        public Add with(Node left, Node right) {
            return new Add(left, right);
        }
    }

    record Subtract(Node left, Node right) implements Binary {
        public Subtract {
            requireChildren(left, right);
        }

        @Override
        public Subtract with(Node left, Node right) {
            return new Subtract(left, right);
        }
    }

    record Multiply(Node left, Node right) implements Binary {
        public Multiply {
            requireChildren(left, right);
        }

        @Override
        public Multiply with(Node left, Node right) {
            return new Multiply(left, right);
        }
    }

    record Divide(Node left, Node right) implements Binary {
        public Divide {
            requireChildren(left, right);
        }

        @Override
        public Divide with(Node left, Node right) {
            return new Divide(left, right);
        }
    }

    record Power(Node left, Node right) implements Binary {
        public Power {
            requireChildren(left, right);
        }

        public Node base() {
            return left;
        }

        public Node exponent() {
            return right;
        }

        @Override
        public Power with(Node left, Node right) {
            return new Power(left, right);
        }
    }

    // ── Comparisons (evaluate to 1.0 or 0.0) ──

    record Greater(Node left, Node right) implements Binary {
        public Greater {
            requireChildren(left, right);
        }

        @Override
        public Greater with(Node left, Node right) {
            return new Greater(left, right);
        }
    }

    record Less(Node left, Node right) implements Binary {
        public Less {
            requireChildren(left, right);
        }

        @Override
        public Less with(Node left, Node right) {
            return new Less(left, right);
        }
    }

    record GreaterEqual(Node left, Node right) implements Binary {
        public GreaterEqual {
            requireChildren(left, right);
        }

        @Override
        public GreaterEqual with(Node left, Node right) {
            return new GreaterEqual(left, right);
        }
    }

    record LessEqual(Node left, Node right) implements Binary {
        public LessEqual {
            requireChildren(left, right);
        }

        @Override
        public LessEqual with(Node left, Node right) {
            return new LessEqual(left, right);
        }
    }

    /** Equality test written {@code ==}. */
    record Equal(Node left, Node right) implements Binary {
        public Equal {
            requireChildren(left, right);
        }

        @Override
        public Equal with(Node left, Node right) {
            return new Equal(left, right);
        }
    }

    /** Equation written with a single {@code =}; solved, never evaluated. */
    record Equation(Node left, Node right) implements Binary {
        public Equation {
            requireChildren(left, right);
        }

        @Override
        public Equation with(Node left, Node right) {
            return new Equation(left, right);
        }
    }

    // ── Unary ──

    record Sqrt(Node operand) implements Unary {
        public Sqrt {
            Objects.requireNonNull(operand, "operand must not be null");
        }

        @Override
        public Sqrt with(Node operand) {
            return new Sqrt(operand);
        }
    }

    record Abs(Node operand) implements Unary {
        public Abs {
            Objects.requireNonNull(operand, "operand must not be null");
        }

        @Override
        public Abs with(Node operand) {
            return new Abs(operand);
        }
    }

    record Negate(Node operand) implements Unary {
        public Negate {
            Objects.requireNonNull(operand, "operand must not be null");
        }

        @Override
        public Negate with(Node operand) {
            return new Negate(operand);
        }
    }

    // ── Composite ──

    /**
     * Branches tried in order; the first whose guard evaluates to exactly 1.0 wins.
     *
     * @param cases the branches (must not be empty)
     */
    record Piecewise(List<Case> cases) implements Node {
        public Piecewise {
            Objects.requireNonNull(cases, "cases must not be null");
            if (cases.isEmpty()) {
                throw new IllegalArgumentException("Piecewise requires at least one case");
            }
            cases = List.copyOf(cases);
        }

        public record Case(Node value, Node guard) {
            public Case {
                requireChildren(value, guard);
            }
        }
    }

    /**
     * {@code \sum_{index=start}^{end} body}. The index is bound inside {@code body} only.
     */
    record Summation(String index, Node start, Node end, Node body) implements Node {
        public Summation {
            if (index == null || index.isEmpty()) {
                throw new IllegalArgumentException("summation index must not be null or empty");
            }
            Objects.requireNonNull(start, "start must not be null");
            Objects.requireNonNull(end, "end must not be null");
            Objects.requireNonNull(body, "body must not be null");
        }
    }

    /** Call of a registry function by canonical name. */
    record Function(String name, List<Node> args) implements Node {
        public Function {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("function name must not be null or empty");
            }
            Objects.requireNonNull(args, "args must not be null");
            args = List.copyOf(args);
        }

        public Function(String name, Node... args) {
            this(name, List.of(args));
        }
    }

    private static void requireChildren(Node left, Node right) {
        Objects.requireNonNull(left, "left operand must not be null");
        Objects.requireNonNull(right, "right operand must not be null");
    }
}
