package com.dmn.feel.function;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Signature of a callable FEEL function.
 * <p>
 * Parameter order drives positional binding. A variadic signature accepts extra
 * arguments after the formal list.
 *
 * @param name       Function name
 * @param parameters Formal parameters in positional order, names unique
 * @param variadic   Whether extra arguments are accepted
 */
public record FunctionSignature(String name, List<FormalParameter> parameters, boolean variadic) {

    public FunctionSignature {
        Objects.requireNonNull(name, "name");
        parameters = List.copyOf(parameters);
        Set<String> seen = new HashSet<>();
        for (FormalParameter parameter : parameters) {
            if (!seen.add(parameter.name())) {
                throw new IllegalArgumentException(
                        "Duplicate parameter '" + parameter.name() + "' in signature of '" + name + "'");
            }
        }
    }

    public static FunctionSignature of(String name, FormalParameter... parameters) {
        return new FunctionSignature(name, List.of(parameters), false);
    }

    public static FunctionSignature variadic(String name, FormalParameter... parameters) {
        return new FunctionSignature(name, List.of(parameters), true);
    }

    public int arity() {
        return parameters.size();
    }

    /**
     * Position of the named formal parameter.
     */
    public Optional<Integer> indexOf(String parameterName) {
        for (int i = 0; i < parameters.size(); i++) {
            if (parameters.get(i).name().equals(parameterName)) {
                return Optional.of(i);
            }
        }
        return Optional.empty();
    }
}
