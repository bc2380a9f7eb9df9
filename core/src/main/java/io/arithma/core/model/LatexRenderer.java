package io.arithma.core.model;

import java.math.BigDecimal;
import java.util.StringJoiner;

/**
 * Pretty-prints a {@link Node} as LaTeX-flavoured text.
 *
 * <p>Operands are parenthesised from operator precedence, matching the parser's table, so that
 * parsing the output yields a tree equivalent to the input. Multiplication by a literal 0 or 1 is
 * collapsed and a non-negative coefficient times a variable is juxtaposed ({@code 5x}).
 *
 * <p>Summations are only re-parseable at the root of an expression or on the left of an equation,
 * and {@link Node.Piecewise} output is for display only.
 */
public final class LatexRenderer {

    private static final int PREC_EQUATION = -1;
    private static final int PREC_COMPARISON = 0;
    private static final int PREC_ADDITIVE = 1;
    private static final int PREC_MULTIPLICATIVE = 2;
    private static final int PREC_POWER = 3;
    private static final int PREC_PREFIX = 4;
    private static final int PREC_ATOM = 10;

    private LatexRenderer() {
        // utility class
    }

    public static String render(Node node) {
        return renderNode(displayForm(node));
    }

    /**
     * Formats a number the way the tokenizer reads numbers back: integral values without a fraction
     * part and never in exponent notation.
     */
    public static String formatNumber(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "\\infty" : "-\\infty";
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static String renderNode(Node node) {
        if (node instanceof Node.Number n) {
            return formatNumber(n.value());
        }
        if (node instanceof Node.Variable v) {
            return v.name();
        }
        if (node instanceof Node.Rational r) {
            return "\\frac{" + r.numerator() + "}{" + r.denominator() + "}";
        }
        if (node instanceof Node.Multiply m && isJuxtaposedCoefficient(m)) {
            return formatNumber(((Node.Number) m.left()).value()) + ((Node.Variable) m.right()).name();
        }
        if (node instanceof Node.Power p) {
            return operand(p.base(), PREC_POWER, true) + "^{" + render(p.exponent()) + "}";
        }
        if (node instanceof Node.Binary b) {
            int prec = precedence(b);
            return operand(b.left(), prec, false) + " " + symbol(b) + " " + operand(b.right(), prec, true);
        }
        if (node instanceof Node.Negate neg) {
            return "-" + operand(neg.operand(), PREC_PREFIX, true);
        }
        if (node instanceof Node.Sqrt s) {
            return "\\sqrt{" + render(s.operand()) + "}";
        }
        if (node instanceof Node.Abs a) {
            return "\\left|" + render(a.operand()) + "\\right|";
        }
        if (node instanceof Node.Summation s) {
            return "\\sum_{" + s.index() + "=" + render(s.start()) + "}^{" + render(s.end()) + "}{"
                    + render(s.body()) + "}";
        }
        if (node instanceof Node.Function f) {
            if ("frac".equals(f.name()) && f.args().size() == 2) {
                return "\\frac{" + render(f.args().get(0)) + "}{" + render(f.args().get(1)) + "}";
            }
            StringJoiner args = new StringJoiner(", ", "\\" + f.name() + "(", ")");
            for (Node arg : f.args()) {
                args.add(render(arg));
            }
            return args.toString();
        }
        if (node instanceof Node.Piecewise p) {
            StringBuilder sb = new StringBuilder("\\begin{cases}");
            for (int i = 0; i < p.cases().size(); i++) {
                Node.Piecewise.Case c = p.cases().get(i);
                if (i > 0) {
                    sb.append(" \\\\ ");
                }
                sb.append(render(c.value())).append(" & ").append(render(c.guard()));
            }
            return sb.append("\\end{cases}").toString();
        }
        throw new IllegalStateException("Unhandled node type: " + node.getClass().getSimpleName());
    }

    /** Renders a child, wrapping it in parentheses when its precedence would otherwise bind wrongly. */
    private static String operand(Node child, int parentPrec, boolean rightSide) {
        Node shown = displayForm(child);
        int childPrec = precedence(shown);
        boolean wrap = rightSide ? childPrec <= parentPrec : childPrec < parentPrec;
        if (parentPrec == PREC_POWER && !rightSide) {
            // the power operator is right-associative, so a power base must bind tighter
            wrap = childPrec <= PREC_POWER;
        }
        if (parentPrec == PREC_PREFIX) {
            wrap = childPrec < PREC_ATOM && !(shown instanceof Node.Number n && n.value() >= 0);
        }
        if (shown instanceof Node.Number n && n.value() < 0) {
            wrap = true;
        }
        String text = renderNode(shown);
        return wrap ? "(" + text + ")" : text;
    }

    /** Collapses multiplication by a literal 0 or 1 before precedence is decided. */
    private static Node displayForm(Node node) {
        if (node instanceof Node.Multiply m) {
            if (isLiteral(m.left(), 0) || isLiteral(m.right(), 0)) {
                return new Node.Number(0);
            }
            if (isLiteral(m.left(), 1)) {
                return displayForm(m.right());
            }
            if (isLiteral(m.right(), 1)) {
                return displayForm(m.left());
            }
        }
        return node;
    }

    private static int precedence(Node node) {
        if (node instanceof Node.Number n) {
            return n.value() < 0 || Double.isNaN(n.value()) ? PREC_PREFIX : PREC_ATOM;
        }
        if (node instanceof Node.Add || node instanceof Node.Subtract) {
            return PREC_ADDITIVE;
        }
        if (node instanceof Node.Multiply || node instanceof Node.Divide) {
            return PREC_MULTIPLICATIVE;
        }
        if (node instanceof Node.Power) {
            return PREC_POWER;
        }
        if (node instanceof Node.Negate) {
            return PREC_PREFIX;
        }
        if (node instanceof Node.Equation) {
            return PREC_EQUATION;
        }
        if (node instanceof Node.Binary) {
            return PREC_COMPARISON;
        }
        if (node instanceof Node.Summation) {
            return PREC_EQUATION;
        }
        return PREC_ATOM;
    }

    private static String symbol(Node.Binary node) {
        if (node instanceof Node.Add) {
            return "+";
        }
        if (node instanceof Node.Subtract) {
            return "-";
        }
        if (node instanceof Node.Multiply) {
            return "\\cdot";
        }
        if (node instanceof Node.Divide) {
            return "/";
        }
        if (node instanceof Node.Greater) {
            return ">";
        }
        if (node instanceof Node.Less) {
            return "<";
        }
        if (node instanceof Node.GreaterEqual) {
            return ">=";
        }
        if (node instanceof Node.LessEqual) {
            return "<=";
        }
        if (node instanceof Node.Equal) {
            return "==";
        }
        if (node instanceof Node.Equation) {
            return "=";
        }
        return "^";
    }

    private static boolean isJuxtaposedCoefficient(Node.Multiply m) {
        return m.left() instanceof Node.Number n
                && n.value() >= 0
                && !Double.isInfinite(n.value())
                && m.right() instanceof Node.Variable;
    }

    private static boolean isLiteral(Node node, double value) {
        return node instanceof Node.Number n && n.value() == value;
    }
}
