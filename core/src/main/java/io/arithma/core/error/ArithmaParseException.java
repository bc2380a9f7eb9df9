package io.arithma.core.error;

/**
 * Abstract parent for errors raised while turning text into a tree. A parse error aborts the whole
 * parse; there is no partial recovery.
 */
public abstract class ArithmaParseException extends ArithmaException {

    private static final long serialVersionUID = 1L;

    protected ArithmaParseException(String message, String expression) {
        super(message, expression, Phase.PARSE);
    }

    protected ArithmaParseException(String message, Throwable cause, String expression) {
        super(message, cause, expression, Phase.PARSE);
    }
}
