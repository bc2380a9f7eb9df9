package io.arithma.core.error;

/** Thrown when a function node names a function the registry does not know. */
public final class UnknownFunctionException extends ArithmaEvalException {

    private static final long serialVersionUID = 1L;

    private final String functionName;

    public UnknownFunctionException(String functionName) {
        super("Unknown function: " + functionName);
        this.functionName = functionName;
    }

    public String functionName() {
        return functionName;
    }
}
