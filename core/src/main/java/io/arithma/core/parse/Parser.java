package io.arithma.core.parse;

import io.arithma.core.error.ArityException;
import io.arithma.core.error.StructuralParseException;
import io.arithma.core.function.Arity;
import io.arithma.core.function.FunctionRegistry;
import io.arithma.core.function.MathFunction;
import io.arithma.core.model.Node;
import io.arithma.core.model.Token;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns tokens into a single {@link Node}.
 *
 * <p>Parsing runs in two stages: {@link #toPostfix} reorders infix tokens by precedence
 * (shunting-yard, with argument tracking for registry functions) and {@link #buildTree} folds the
 * postfix stream into a tree. Input containing {@code \sum} bypasses both and goes through a
 * dedicated summation reader which re-parses its bounds and body recursively.
 *
 * <p>Any error aborts the whole parse with a {@link StructuralParseException} or an {@link
 * ArityException}. Thread-safe.
 */
public final class Parser {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    private static final Token ABS = new Token(Token.Type.ABS, "ABS");
    private static final Token ARGS = new Token(Token.Type.ARGS, "ARGS");

    private final FunctionRegistry registry;
    private final Tokenizer tokenizer;

    public Parser(FunctionRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.tokenizer = new Tokenizer(registry);
    }

    /** Tokenizes and parses an expression. */
    public Node parse(String input) {
        return parseTokens(tokenizer.tokenize(input), input);
    }

    /** Parses an already tokenized expression. */
    public Node parse(List<Token> tokens) {
        return parseTokens(tokens, null);
    }

    private Node parseTokens(List<Token> tokens, String source) {
        for (Token token : tokens) {
            if (token.is(Token.Type.SUM)) {
                return new SummationReader(tokens, source).read();
            }
        }
        return buildTree(toPostfix(tokens, source), source);
    }

    // ── Stage A: precedence reordering ──

    /**
     * Reorders infix tokens into postfix.
     *
     * @throws StructuralParseException on mismatched brackets, misplaced separators or unknown tokens
     * @throws ArityException if a function's argument groups do not match its arity
     */
    public List<Token> toPostfix(List<Token> tokens) {
        return toPostfix(tokens, null);
    }

    private List<Token> toPostfix(List<Token> tokens, String source) {
        List<Token> output = new ArrayList<>();
        Deque<Token> ops = new ArrayDeque<>();
        Deque<CallFrame> frames = new ArrayDeque<>();

        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            Token next = i + 1 < tokens.size() ? tokens.get(i + 1) : null;
            switch (token.type()) {
                case NUMBER, IDENTIFIER -> output.add(token);
                case FUNCTION -> pushFunction(token, next, ops, output, source);
                case NEG, ABS_START -> ops.push(token);
                case OPERATOR -> pushOperator(token, ops, output, source);
                case OPEN -> openGroup(token, ops, frames, output);
                case COMMA -> separateArgument(ops, frames, output, source);
                case CLOSE -> closeGroup(token, next, ops, frames, output, source);
                case ABS_END -> {
                    popUntilOpener(ops, output);
                    if (ops.isEmpty() || !ops.peek().is(Token.Type.ABS_START)) {
                        throw new StructuralParseException("Mismatched absolute value delimiters", source);
                    }
                    ops.pop();
                    output.add(ABS);
                }
                default -> throw new StructuralParseException(
                        String.format("Unknown token '%s'", token.text()), source);
            }
        }

        while (!ops.isEmpty()) {
            Token top = ops.pop();
            if (top.is(Token.Type.OPEN) || top.is(Token.Type.ABS_START)) {
                throw new StructuralParseException("Mismatched parentheses or braces", source);
            }
            if (top.is(Token.Type.FUNCTION)) {
                throw new StructuralParseException(
                        String.format("Missing argument list for function '%s'", top.text()), source);
            }
            output.add(top);
        }
        LOG.debug("Postfix: {}", output);
        return output;
    }

    private void pushFunction(Token token, Token next, Deque<Token> ops, List<Token> output, String source) {
        Optional<MathFunction> function = registry.get(token.text());
        if (function.isEmpty()) {
            // tagged by a tokenizer with a different registry
            output.add(new Token(Token.Type.IDENTIFIER, token.text()));
            return;
        }
        if (next != null && next.is(Token.Type.OPEN)) {
            ops.push(token);
        } else if (function.get().arity().equals(Arity.fixed(0))) {
            output.add(token);
        } else {
            throw new StructuralParseException(
                    String.format("Function '%s' must be followed by a bracketed argument list", token.text()),
                    source);
        }
    }

    private static void pushOperator(Token token, Deque<Token> ops, List<Token> output, String source) {
        int precedence = precedence(token, source);
        boolean rightAssociative = "^".equals(token.text());
        while (!ops.isEmpty() && (ops.peek().is(Token.Type.OPERATOR) || ops.peek().is(Token.Type.NEG))) {
            int top = precedence(ops.peek(), source);
            if (top > precedence || (top == precedence && !rightAssociative)) {
                output.add(ops.pop());
            } else {
                break;
            }
        }
        ops.push(token);
    }

    private void openGroup(Token token, Deque<Token> ops, Deque<CallFrame> frames, List<Token> output) {
        if (!ops.isEmpty() && ops.peek().is(Token.Type.FUNCTION)) {
            CallFrame frame = frames.peek();
            if (frame == null || frame.depth != ops.size() || !frame.awaitingGroup) {
                Arity arity = registry.require(ops.peek().text()).arity();
                frame = new CallFrame(ops.peek().text(), arity, ops.size());
                frames.push(frame);
                if (arity instanceof Arity.Variadic) {
                    output.add(ARGS);
                }
            }
            frame.awaitingGroup = false;
            frame.sawComma = false;
            frame.mark = output.size();
        }
        ops.push(token);
    }

    private static void separateArgument(
            Deque<Token> ops, Deque<CallFrame> frames, List<Token> output, String source) {
        popUntilOpener(ops, output);
        if (!isFunctionGroup(ops, frames)) {
            throw new StructuralParseException("Unexpected ',' outside a function argument list", source);
        }
        CallFrame frame = frames.peek();
        if (output.size() == frame.mark) {
            throw new StructuralParseException(
                    String.format("Empty argument in call to function '%s'", frame.name), source);
        }
        frame.args++;
        frame.mark = output.size();
        frame.sawComma = true;
    }

    private static void closeGroup(
            Token token,
            Token next,
            Deque<Token> ops,
            Deque<CallFrame> frames,
            List<Token> output,
            String source) {
        popUntilOpener(ops, output);
        if (ops.isEmpty() || !ops.peek().is(Token.Type.OPEN) || !matches(ops.peek(), token)) {
            throw new StructuralParseException("Mismatched parentheses or braces", source);
        }
        ops.pop();
        if (ops.isEmpty() || !ops.peek().is(Token.Type.FUNCTION)) {
            return;
        }
        CallFrame frame = frames.peek();
        if (frame == null || frame.depth != ops.size()) {
            return;
        }
        if (output.size() > frame.mark) {
            frame.args++;
        } else if (frame.sawComma) {
            throw new StructuralParseException(
                    String.format("Empty argument in call to function '%s'", frame.name), source);
        }
        if (frame.arity instanceof Arity.Fixed fixed
                && frame.args < fixed.count()
                && next != null
                && next.is(Token.Type.OPEN)) {
            // \frac{a}{b}: the next group supplies the remaining arguments
            frame.awaitingGroup = true;
            return;
        }
        if (!frame.arity.accepts(frame.args)) {
            throw new ArityException(frame.name, frame.arity.describe(), frame.args, source);
        }
        frames.pop();
        output.add(ops.pop());
    }

    /** Moves operators to the output until an opening delimiter (or the bottom) is on top. */
    private static void popUntilOpener(Deque<Token> ops, List<Token> output) {
        while (!ops.isEmpty()
                && !ops.peek().is(Token.Type.OPEN)
                && !ops.peek().is(Token.Type.ABS_START)
                && !ops.peek().is(Token.Type.FUNCTION)) {
            output.add(ops.pop());
        }
    }

    /** True if the opener on top of {@code ops} is the argument group of the innermost call. */
    private static boolean isFunctionGroup(Deque<Token> ops, Deque<CallFrame> frames) {
        if (ops.isEmpty() || !ops.peek().is(Token.Type.OPEN) || frames.isEmpty()) {
            return false;
        }
        Iterator<Token> it = ops.iterator();
        it.next();
        return it.hasNext() && it.next().is(Token.Type.FUNCTION) && frames.peek().depth == ops.size() - 1;
    }

    private static boolean matches(Token open, Token close) {
        return ("(".equals(open.text()) && ")".equals(close.text()))
                || ("{".equals(open.text()) && "}".equals(close.text()));
    }

    static int precedence(Token token, String source) {
        if (token.is(Token.Type.NEG)) {
            return 4;
        }
        return switch (token.text()) {
            case "^" -> 3;
            case "*", "/" -> 2;
            case "+", "-" -> 1;
            case ">", "<", ">=", "<=", "==" -> 0;
            case "=" -> -1;
            default -> throw new StructuralParseException(
                    String.format("Unsupported operator '%s'", token.text()), source);
        };
    }

    /** Argument bookkeeping for one function call whose groups are being read. */
    private static final class CallFrame {
        private final String name;
        private final Arity arity;
        /** Size of the operator stack while the function token is on top. */
        private final int depth;

        private int args;
        private int mark;
        private boolean sawComma;
        private boolean awaitingGroup;

        CallFrame(String name, Arity arity, int depth) {
            this.name = name;
            this.arity = arity;
            this.depth = depth;
        }
    }

    // ── Stage B: tree construction ──

    /**
     * Folds a postfix stream into a tree.
     *
     * @throws StructuralParseException if operands are missing or left over
     */
    public Node buildTree(List<Token> postfix) {
        return buildTree(postfix, null);
    }

    private Node buildTree(List<Token> postfix, String source) {
        Deque<Node> stack = new ArrayDeque<>();
        Deque<Integer> argMarks = new ArrayDeque<>();

        for (Token token : postfix) {
            switch (token.type()) {
                case NUMBER -> stack.push(new Node.Number(parseNumber(token.text(), source)));
                case IDENTIFIER -> stack.push(identifier(token.text()));
                case NEG -> stack.push(new Node.Negate(popOperand(stack, "unary minus", source)));
                case ABS -> stack.push(new Node.Abs(popOperand(stack, "absolute value", source)));
                case OPERATOR -> {
                    Node right = popOperand(stack, "operator '" + token.text() + "'", source);
                    Node left = popOperand(stack, "operator '" + token.text() + "'", source);
                    stack.push(binary(token.text(), left, right, source));
                }
                case ARGS -> argMarks.push(stack.size());
                case FUNCTION -> stack.push(call(token.text(), stack, argMarks, source));
                default -> throw new StructuralParseException(
                        String.format("Unknown token '%s'", token.text()), source);
            }
        }

        if (stack.size() != 1) {
            throw new StructuralParseException("The expression did not resolve into a single tree", source);
        }
        Node root = stack.pop();
        LOG.debug("Parsed tree: {}", root);
        return root;
    }

    private Node call(String name, Deque<Node> stack, Deque<Integer> argMarks, String source) {
        Arity arity = registry.require(name).arity();
        int count;
        if (arity instanceof Arity.Fixed fixed) {
            count = fixed.count();
            if (stack.size() < count) {
                throw new ArityException(name, arity.describe(), stack.size(), source);
            }
        } else {
            if (argMarks.isEmpty()) {
                throw new StructuralParseException(
                        String.format("Missing argument list for function '%s'", name), source);
            }
            count = stack.size() - argMarks.pop();
            if (!arity.accepts(count)) {
                throw new ArityException(name, arity.describe(), count, source);
            }
        }
        Node[] args = new Node[count];
        for (int i = count - 1; i >= 0; i--) {
            args[i] = stack.pop();
        }
        if ("sqrt".equals(name)) {
            return new Node.Sqrt(args[0]);
        }
        return new Node.Function(name, args);
    }

    private static Node binary(String op, Node left, Node right, String source) {
        return switch (op) {
            case "+" -> new Node.Add(left, right);
            case "-" -> new Node.Subtract(left, right);
            case "*" -> new Node.Multiply(left, right);
            case "/" -> new Node.Divide(left, right);
            case "^" -> new Node.Power(left, right);
            case ">" -> new Node.Greater(left, right);
            case "<" -> new Node.Less(left, right);
            case ">=" -> new Node.GreaterEqual(left, right);
            case "<=" -> new Node.LessEqual(left, right);
            case "==" -> new Node.Equal(left, right);
            case "=" -> new Node.Equation(left, right);
            default -> throw new StructuralParseException(String.format("Unsupported operator '%s'", op), source);
        };
    }

    /** Reserved names for Euler's number and pi; everything else is a variable. */
    private static Node identifier(String name) {
        return switch (name) {
            case "e", "EULER" -> new Node.Number(Math.E);
            case "PI" -> new Node.Number(Math.PI);
            default -> new Node.Variable(name);
        };
    }

    private static double parseNumber(String text, String source) {
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new StructuralParseException(String.format("Invalid number '%s'", text), e, source);
        }
    }

    private static Node popOperand(Deque<Node> stack, String what, String source) {
        if (stack.isEmpty()) {
            throw new StructuralParseException("Not enough operands for " + what, source);
        }
        return stack.pop();
    }

    // ── Stage C: summation ──

    /**
     * Reads {@code \sum_{i=<lower>}^{<upper>} <body>}, optionally followed by {@code = <rhs>}. The
     * upper bound may be a single bare token and the body may be unbraced, in which case it runs
     * up to the first top-level {@code =} or nested {@code \sum}.
     */
    private final class SummationReader {
        private final List<Token> tokens;
        private final String source;
        private int pos;

        SummationReader(List<Token> tokens, String source) {
            this.tokens = tokens;
            this.source = source;
        }

        Node read() {
            if (!tokens.get(0).is(Token.Type.SUM)) {
                throw new StructuralParseException("Unexpected tokens before \\sum", source);
            }
            pos = 1;
            expect(Token.Type.SUBSCRIPT, "_", "Expected '_' after \\sum");
            expect(Token.Type.OPEN, "{", "Expected '{' after '_'");
            if (pos >= tokens.size() || !tokens.get(pos).is(Token.Type.IDENTIFIER)) {
                throw new StructuralParseException("Expected index variable after '{'", source);
            }
            String index = tokens.get(pos++).text();
            expect(Token.Type.OPERATOR, "=", "Expected '=' after index variable");
            List<Token> lower = readBraced("lower bound");
            expect(Token.Type.OPERATOR, "^", "Expected '^' after lower bound");

            List<Token> upper;
            if (pos >= tokens.size()) {
                throw new StructuralParseException("Expected upper bound after '^'", source);
            } else if (tokens.get(pos).is(Token.Type.OPEN, "{")) {
                pos++;
                upper = readBraced("upper bound");
            } else {
                upper = List.of(tokens.get(pos++));
                if (pos < tokens.size() && tokens.get(pos).is(Token.Type.OPERATOR, "*")) {
                    if (!tokens.get(pos).implicit()) {
                        throw new StructuralParseException("Summation body can't start with '*'", source);
                    }
                    // \sum_{i=1}^3 i reads as "3 * i" after implicit multiplication
                    pos++;
                }
            }

            List<Token> body;
            if (pos < tokens.size() && tokens.get(pos).is(Token.Type.OPEN, "{")) {
                pos++;
                body = readBraced("body");
            } else {
                body = readUnbracedBody();
            }
            if (body.isEmpty()) {
                throw new StructuralParseException("Missing summation body", source);
            }

            Node summation = new Node.Summation(
                    index, part(lower, "lower bound"), part(upper, "upper bound"), part(body, "body"));
            LOG.debug("Summation over '{}' with body tokens {}", index, body);

            if (pos >= tokens.size()) {
                return summation;
            }
            if (tokens.get(pos).is(Token.Type.OPERATOR, "=") && pos + 1 < tokens.size()) {
                Node right = parseTokens(tokens.subList(pos + 1, tokens.size()), source);
                return new Node.Equation(summation, right);
            }
            throw new StructuralParseException(
                    String.format("Unexpected tokens after summation: %s", tokens.subList(pos, tokens.size())),
                    source);
        }

        private void expect(Token.Type type, String text, String message) {
            if (pos >= tokens.size() || !tokens.get(pos).is(type, text)) {
                throw new StructuralParseException(message, source);
            }
            pos++;
        }

        /** Collects tokens up to the bracket closing an already consumed opener. */
        private List<Token> readBraced(String what) {
            List<Token> span = new ArrayList<>();
            int depth = 1;
            while (pos < tokens.size()) {
                Token token = tokens.get(pos++);
                if (token.is(Token.Type.OPEN)) {
                    depth++;
                } else if (token.is(Token.Type.CLOSE) && --depth == 0) {
                    return span;
                }
                span.add(token);
            }
            throw new StructuralParseException("Unclosed summation " + what + " brace", source);
        }

        private List<Token> readUnbracedBody() {
            List<Token> span = new ArrayList<>();
            int depth = 0;
            while (pos < tokens.size()) {
                Token token = tokens.get(pos);
                if (depth == 0
                        && (token.is(Token.Type.SUM)
                                || token.is(Token.Type.OPERATOR, "=")
                                || token.is(Token.Type.CLOSE))) {
                    break;
                }
                if (token.is(Token.Type.OPEN) || token.is(Token.Type.ABS_START)) {
                    depth++;
                } else if (token.is(Token.Type.CLOSE) || token.is(Token.Type.ABS_END)) {
                    depth--;
                }
                span.add(token);
                pos++;
            }
            return span;
        }

        private Node part(List<Token> span, String what) {
            try {
                return parseTokens(span, source);
            } catch (StructuralParseException e) {
                throw new StructuralParseException("Error in summation " + what + ": " + e.getMessage(), e, source);
            }
        }
    }
}
