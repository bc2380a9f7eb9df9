package io.arithma.core.error;

/** Thrown when a function call does not match the argument count its registry entry declares. */
public final class ArityException extends ArithmaParseException {

    private static final long serialVersionUID = 1L;

    private final String functionName;
    private final String expected;
    private final int actual;

    public ArityException(String functionName, String expected, int actual, String expression) {
        super(
                String.format(
                        "Function '%s' expects %s but got %d argument%s",
                        functionName, expected, actual, actual == 1 ? "" : "s"),
                expression);
        this.functionName = functionName;
        this.expected = expected;
        this.actual = actual;
    }

    public String functionName() {
        return functionName;
    }

    /** Description of the accepted argument count, e.g. {@code "2 arguments"}. */
    public String expected() {
        return expected;
    }

    public int actual() {
        return actual;
    }
}
