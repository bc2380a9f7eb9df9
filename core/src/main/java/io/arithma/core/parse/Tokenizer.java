package io.arithma.core.parse;

import io.arithma.core.function.FunctionRegistry;
import io.arithma.core.model.Token;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits LaTeX-flavoured input into {@link Token}s.
 *
 * <p>The tokenizer is context-sensitive: it decides between unary and binary minus from the
 * previous token, inserts {@code *} between a number and a following name ({@code 2x}), expands
 * LaTeX commands ({@code \pi}, {@code \cdot}, shorthand {@code \frac34}, {@code \left|}) and tags
 * names the registry knows as {@link Token.Type#FUNCTION}. It never throws: characters it cannot
 * classify become {@link Token.Type#UNKNOWN} tokens which the parser rejects.
 *
 * <p>Thread-safe; holds no per-call state.
 */
public final class Tokenizer {

    private static final Logger LOG = LoggerFactory.getLogger(Tokenizer.class);

    private final FunctionRegistry registry;

    public Tokenizer(FunctionRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * Tokenizes the given input.
     *
     * @param input raw expression text
     * @return tokens in input order; empty for blank input
     */
    public List<Token> tokenize(String input) {
        Objects.requireNonNull(input, "input must not be null");
        Scan scan = new Scan(input);
        while (scan.hasMore()) {
            char c = scan.peek();
            if (Character.isWhitespace(c)) {
                scan.advance();
            } else if (isDigit(c) || c == '.') {
                readNumber(scan);
            } else if (c == '\\') {
                scan.advance();
                readCommand(scan);
            } else if (Character.isLetter(c)) {
                readName(scan);
            } else if (c == '-') {
                scan.advance();
                scan.add(isUnaryPosition(scan.tokens) ? new Token(Token.Type.NEG, Token.NEG) : Token.operator("-"));
            } else {
                scan.advance();
                readSymbol(scan, c);
            }
        }
        LOG.debug("Tokenized '{}' into {}", input, scan.tokens);
        return scan.tokens;
    }

    private void readNumber(Scan scan) {
        int start = scan.pos;
        while (scan.hasMore() && (isDigit(scan.peek()) || scan.peek() == '.')) {
            scan.advance();
        }
        scan.add(Token.number(scan.input.substring(start, scan.pos)));
    }

    private void readName(Scan scan) {
        int start = scan.pos;
        scan.advance();
        while (scan.hasMore() && Character.isLetterOrDigit(scan.peek())) {
            scan.advance();
        }
        addName(scan, scan.input.substring(start, scan.pos));
    }

    private void readCommand(Scan scan) {
        int start = scan.pos;
        while (scan.hasMore() && Character.isLetter(scan.peek())) {
            scan.advance();
        }
        String command = scan.input.substring(start, scan.pos);
        if (command.isEmpty()) {
            readEscapedSymbol(scan);
            return;
        }
        switch (command) {
            case "pi" -> addValue(scan, Double.toString(Math.PI));
            case "infty" -> addValue(scan, Double.toString(Double.POSITIVE_INFINITY));
            case "mathrm" -> readRoman(scan);
            case "cdot", "times" -> scan.add(Token.operator("*"));
            case "div" -> scan.add(Token.operator("/"));
            case "le", "leq" -> scan.add(Token.operator("<="));
            case "ge", "geq" -> scan.add(Token.operator(">="));
            case "left" -> readDelimiter(scan, true);
            case "right" -> readDelimiter(scan, false);
            case "frac" -> readFraction(scan);
            case "sum" -> scan.add(new Token(Token.Type.SUM, Token.SUM));
            default -> addName(scan, command);
        }
    }

    /** {@code \mathrm{e}} is Euler's number; any other upright text is read as a plain name. */
    private void readRoman(Scan scan) {
        if (!scan.hasMore() || scan.peek() != '{') {
            addName(scan, "mathrm");
            return;
        }
        int close = scan.input.indexOf('}', scan.pos);
        if (close < 0) {
            addName(scan, "mathrm");
            return;
        }
        String text = scan.input.substring(scan.pos + 1, close).trim();
        if (text.isEmpty() || !text.chars().allMatch(Character::isLetter)) {
            addName(scan, "mathrm");
            return;
        }
        scan.pos = close + 1;
        if ("e".equals(text)) {
            addValue(scan, Double.toString(Math.E));
        } else {
            addName(scan, text);
        }
    }

    /** {@code \left|}/{@code \right|} delimit an absolute value; other sizes delimit a group. */
    private void readDelimiter(Scan scan, boolean opening) {
        if (scan.hasMore() && scan.peek() == '|') {
            scan.advance();
            scan.add(opening
                    ? new Token(Token.Type.ABS_START, Token.ABS_START)
                    : new Token(Token.Type.ABS_END, Token.ABS_END));
            return;
        }
        if (scan.hasMore()) {
            char next = scan.peek();
            if (opening ? next == '(' || next == '[' : next == ')' || next == ']') {
                scan.advance();
            }
        }
        scan.add(opening ? new Token(Token.Type.OPEN, "(") : new Token(Token.Type.CLOSE, ")"));
    }

    /** Shorthand {@code \frac34} expands to {@code 3 / 4}; any other form is a function call. */
    private void readFraction(Scan scan) {
        if (scan.remaining() >= 2 && isDigit(scan.peek()) && isDigit(scan.peekAt(1))) {
            String numerator = String.valueOf(scan.peek());
            String denominator = String.valueOf(scan.peekAt(1));
            scan.pos += 2;
            addValue(scan, numerator);
            scan.add(Token.operator("/"));
            scan.add(Token.number(denominator));
            return;
        }
        addName(scan, "frac");
    }

    private void readEscapedSymbol(Scan scan) {
        if (!scan.hasMore()) {
            scan.add(new Token(Token.Type.UNKNOWN, "\\"));
            return;
        }
        char c = scan.peek();
        scan.advance();
        // \, \; \: \! and "\ " are spacing commands
        if (",;:! ".indexOf(c) < 0) {
            scan.add(new Token(Token.Type.UNKNOWN, "\\" + c));
        }
    }

    private void readSymbol(Scan scan, char c) {
        Token token = switch (c) {
            case '+', '*', '/', '^' -> Token.operator(String.valueOf(c));
            case '(', '{' -> new Token(Token.Type.OPEN, String.valueOf(c));
            case ')', '}' -> new Token(Token.Type.CLOSE, String.valueOf(c));
            case ',' -> new Token(Token.Type.COMMA, ",");
            case '_' -> new Token(Token.Type.SUBSCRIPT, "_");
            case '>', '<' -> Token.operator(scan.consumeIf('=') ? c + "=" : String.valueOf(c));
            case '=' -> Token.operator(scan.consumeIf('=') ? "==" : "=");
            case '&' -> Token.operator(scan.consumeIf('&') ? "&&" : "&");
            default -> new Token(Token.Type.UNKNOWN, String.valueOf(c));
        };
        scan.add(token);
    }

    /** Adds a name, tagging it as a function when the registry knows it. */
    private void addName(Scan scan, String name) {
        insertImplicitMultiplication(scan);
        Token.Type type = registry.contains(name) ? Token.Type.FUNCTION : Token.Type.IDENTIFIER;
        scan.add(new Token(type, name));
    }

    private static void addValue(Scan scan, String number) {
        insertImplicitMultiplication(scan);
        scan.add(Token.number(number));
    }

    /** A name or constant directly after a number multiplies it: {@code 2x}, {@code 2\pi}. */
    private static void insertImplicitMultiplication(Scan scan) {
        if (!scan.tokens.isEmpty() && scan.last().is(Token.Type.NUMBER)) {
            scan.add(Token.implicitTimes());
        }
    }

    /** Minus is unary at the start and after an operator, an opening bracket or a separator. */
    private static boolean isUnaryPosition(List<Token> tokens) {
        if (tokens.isEmpty()) {
            return true;
        }
        return switch (tokens.get(tokens.size() - 1).type()) {
            case OPERATOR, NEG, OPEN, ABS_START, COMMA, SUBSCRIPT -> true;
            default -> false;
        };
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    /** Cursor over one input string plus the tokens produced so far. */
    private static final class Scan {
        private final String input;
        private final List<Token> tokens = new ArrayList<>();
        private int pos;

        Scan(String input) {
            this.input = input;
        }

        boolean hasMore() {
            return pos < input.length();
        }

        int remaining() {
            return input.length() - pos;
        }

        char peek() {
            return input.charAt(pos);
        }

        char peekAt(int offset) {
            return input.charAt(pos + offset);
        }

        void advance() {
            pos++;
        }

        boolean consumeIf(char expected) {
            if (hasMore() && peek() == expected) {
                pos++;
                return true;
            }
            return false;
        }

        void add(Token token) {
            tokens.add(token);
        }

        Token last() {
            return tokens.get(tokens.size() - 1);
        }
    }
}
