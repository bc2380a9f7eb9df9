package io.arithma.core.model;

import java.util.Objects;

/**
 * One lexical token. Tokens only live between a tokenize call and the parse that consumes them.
 *
 * @param type classification assigned by the tokenizer
 * @param text canonical text of the token; numbers hold their literal digits, LaTeX commands are
 *     stored without the leading backslash
 * @param implicit whether the tokenizer synthesized the token rather than reading it from the input
 */
public record Token(Type type, String text, boolean implicit) {

    /** Marker text of the unary minus token. */
    public static final String NEG = "NEG";

    /** Marker text of the bracketed absolute-value delimiters. */
    public static final String ABS_START = "ABS_START";

    public static final String ABS_END = "ABS_END";

    /** Marker text of the summation command. */
    public static final String SUM = "sum";

    public enum Type {
        NUMBER,
        /** A name that is not a registered function: a variable or a reserved constant. */
        IDENTIFIER,
        /** A name the function registry knows. */
        FUNCTION,
        /** Binary arithmetic, comparison and equation operators. */
        OPERATOR,
        /** Unary minus. */
        NEG,
        /** {@code (} or {@code {}. */
        OPEN,
        /** {@code )} or {@code }}. */
        CLOSE,
        ABS_START,
        ABS_END,
        COMMA,
        /** {@code _}, only meaningful inside summation bounds. */
        SUBSCRIPT,
        SUM,
        /** Anything the tokenizer could not classify; rejected by the parser. */
        UNKNOWN,
        /** Postfix only: absolute value of the operand below. */
        ABS,
        /** Postfix only: marks where the arguments of a variadic call begin. */
        ARGS
    }

    public Token {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }

    public Token(Type type, String text) {
        this(type, text, false);
    }

    public static Token number(String text) {
        return new Token(Type.NUMBER, text);
    }

    public static Token operator(String text) {
        return new Token(Type.OPERATOR, text);
    }

    /** The {@code *} inserted between a number and a following name, as in {@code 2x}. */
    public static Token implicitTimes() {
        return new Token(Type.OPERATOR, "*", true);
    }

    public boolean is(Type expected) {
        return type == expected;
    }

    public boolean is(Type expected, String expectedText) {
        return type == expected && text.equals(expectedText);
    }

    @Override
    public String toString() {
        return text;
    }
}
