package io.arithma.core.error;

/**
 * Abstract parent for errors raised by the passes that consume a parsed tree: numeric evaluation,
 * simplification, calculus and solving.
 */
public abstract class ArithmaEvalException extends ArithmaException {

    private static final long serialVersionUID = 1L;

    protected ArithmaEvalException(String message) {
        super(message, null, Phase.EVALUATION);
    }

    protected ArithmaEvalException(String message, Throwable cause) {
        super(message, cause, null, Phase.EVALUATION);
    }
}
