package com.dmn.feel.function;

import java.util.Objects;

/**
 * Formal parameter of a function signature.
 *
 * @param name     Parameter name as used in named calls (may contain spaces)
 * @param optional Whether a call may omit it, in which case it binds to null
 */
public record FormalParameter(String name, boolean optional) {

    public FormalParameter {
        Objects.requireNonNull(name, "name");
    }

    public static FormalParameter required(String name) {
        return new FormalParameter(name, false);
    }

    public static FormalParameter optional(String name) {
        return new FormalParameter(name, true);
    }
}
