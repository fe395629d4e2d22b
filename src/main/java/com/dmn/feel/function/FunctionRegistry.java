package com.dmn.feel.function;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only table of function signatures, keyed by function name.
 */
public final class FunctionRegistry {

    private final Map<String, FunctionSignature> signatures;

    FunctionRegistry(Map<String, FunctionSignature> signatures) {
        this.signatures = Collections.unmodifiableMap(new LinkedHashMap<>(signatures));
    }

    /**
     * Signatures of the standard built-in functions.
     */
    public static FunctionRegistry standard() {
        return FunctionLibrary.standard().registry();
    }

    public Optional<FunctionSignature> lookup(String name) {
        return Optional.ofNullable(signatures.get(name));
    }

    public boolean contains(String name) {
        return signatures.containsKey(name);
    }

    public Set<String> names() {
        return signatures.keySet();
    }

    public int size() {
        return signatures.size();
    }
}
