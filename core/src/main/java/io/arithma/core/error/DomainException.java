package io.arithma.core.error;

/**
 * Thrown for hard domain errors, currently the square root of a negative number and non-integer
 * summation bounds. Division by zero and trigonometric poles are not errors; they evaluate to NaN.
 */
public final class DomainException extends ArithmaEvalException {

    private static final long serialVersionUID = 1L;

    public DomainException(String message) {
        super(message);
    }
}
