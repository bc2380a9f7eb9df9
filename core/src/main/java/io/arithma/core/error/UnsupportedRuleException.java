package io.arithma.core.error;

/**
 * Thrown when a symbolic pass has no rule for the shape it was given. The message names the missing
 * rule; the passes never fall back to an approximation.
 */
public final class UnsupportedRuleException extends ArithmaEvalException {

    private static final long serialVersionUID = 1L;

    private final String operation;

    public UnsupportedRuleException(String operation, String message) {
        super(message);
        this.operation = operation;
    }

    /** The pass that gave up, e.g. {@code "differentiate"} or {@code "integrate"}. */
    public String operation() {
        return operation;
    }
}
