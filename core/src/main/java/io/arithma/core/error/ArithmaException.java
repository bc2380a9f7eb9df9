package io.arithma.core.error;

/**
 * Abstract base for all arithma exceptions. Never thrown directly; use the concrete subclasses under
 * {@link ArithmaParseException} or {@link ArithmaEvalException}.
 */
public abstract class ArithmaException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        PARSE,
        EVALUATION
    }

    private final String expression;
    private final Phase phase;

    protected ArithmaException(String message, String expression, Phase phase) {
        super(message);
        this.expression = expression;
        this.phase = phase;
    }

    protected ArithmaException(String message, Throwable cause, String expression, Phase phase) {
        super(message, cause);
        this.expression = expression;
        this.phase = phase;
    }

    /** The expression text that triggered the error, or {@code null} if not known. */
    public String expression() {
        return expression;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
