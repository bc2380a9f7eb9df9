package io.arithma.core.engine;

import io.arithma.core.error.UndefinedVariableException;
import io.arithma.core.model.Node;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/** Function composition built on {@link Substitution}. */
public final class Composition {

    private Composition() {
        // utility class
    }

    /** Returns {@code outer} with {@code outerVar} replaced by {@code inner}, i.e. outer(inner). */
    public static Node compose(Node outer, String outerVar, Node inner) {
        return Substitution.substituteVariable(outer, outerVar, inner);
    }

    /**
     * Composes a chain of functions. The first entry is the innermost function; each later
     * function is applied around the result so far, substituting the variable named by the
     * previous entry. For {@code [(h, x), (g, x), (f, x)]} the result is f(g(h(x))).
     *
     * @throws IllegalArgumentException if {@code functions} is empty
     */
    public static Node composeMultiple(List<Map.Entry<Node, String>> functions) {
        if (functions.isEmpty()) {
            throw new IllegalArgumentException("Cannot compose an empty list of functions");
        }
        Node result = functions.get(0).getKey();
        for (int i = 0; i < functions.size() - 1; i++) {
            String var = functions.get(i).getValue();
            Node outer = functions.get(i + 1).getKey();
            result = compose(outer, var, result);
        }
        return result;
    }

    /**
     * Checks that every free variable of {@code inner}, other than {@code outerVar}, is among
     * {@code availableVars}.
     *
     * @throws UndefinedVariableException naming the first variable that is not available
     */
    public static void validateComposition(
            Node outer, String outerVar, Node inner, Collection<String> availableVars) {
        for (String var : inner.freeVariables()) {
            if (!var.equals(outerVar) && !availableVars.contains(var)) {
                throw new UndefinedVariableException(var);
            }
        }
    }
}
