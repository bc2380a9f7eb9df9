package io.arithma.core.error;

/** Thrown when a variable is read that the environment does not bind. */
public final class UndefinedVariableException extends ArithmaEvalException {

    private static final long serialVersionUID = 1L;

    private final String variable;

    public UndefinedVariableException(String variable) {
        super("Undefined variable: " + variable);
        this.variable = variable;
    }

    public String variable() {
        return variable;
    }
}
