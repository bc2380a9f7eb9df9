package io.arithma.core.error;

/**
 * Thrown when the token stream cannot be assembled into a single tree: mismatched brackets, missing
 * operands, leftover operands, an unknown token or a malformed summation.
 */
public final class StructuralParseException extends ArithmaParseException {

    private static final long serialVersionUID = 1L;

    public StructuralParseException(String message, String expression) {
        super(message, expression);
    }

    public StructuralParseException(String message, Throwable cause, String expression) {
        super(message, cause, expression);
    }
}
