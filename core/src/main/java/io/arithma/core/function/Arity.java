package io.arithma.core.function;

/**
 * Argument-count contract of a registry function. Sealed: a function either takes exactly
 * {@code n} arguments or any number from a minimum upwards.
 */
public sealed interface Arity {

    /** Returns {@code true} if a call with {@code count} arguments satisfies this contract. */
    boolean accepts(int count);

    /** Human-readable description used in arity error messages, e.g. {@code "2 arguments"}. */
    String describe();

    static Arity fixed(int count) {
        return new Fixed(count);
    }

    static Arity variadic(int min) {
        return new Variadic(min);
    }

    /** Exactly {@code count} arguments. */
    record Fixed(int count) implements Arity {
        public Fixed {
            if (count < 0) {
                throw new IllegalArgumentException("Fixed arity must not be negative, got: " + count);
            }
        }

        @Override
        public boolean accepts(int argCount) {
            return argCount == count;
        }

        @Override
        public String describe() {
            return count == 1 ? "1 argument" : count + " arguments";
        }
    }

    /** {@code min} or more arguments. */
    record Variadic(int min) implements Arity {
        public Variadic {
            if (min < 0) {
                throw new IllegalArgumentException("Variadic minimum must not be negative, got: " + min);
            }
        }

        @Override
        public boolean accepts(int argCount) {
            return argCount >= min;
        }

        @Override
        public String describe() {
            return "at least " + (min == 1 ? "1 argument" : min + " arguments");
        }
    }
}
