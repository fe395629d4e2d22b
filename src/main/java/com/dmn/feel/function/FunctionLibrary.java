package com.dmn.feel.function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Built-in FEEL functions together with their signatures.
 * <p>
 * Built once and read concurrently afterwards. {@link #standard()} is the shared
 * instance holding every built-in function.
 */
public final class FunctionLibrary {

    private static final Logger log = LoggerFactory.getLogger(FunctionLibrary.class);

    private final Map<String, FeelFunction> functions;
    private final FunctionRegistry registry;

    private FunctionLibrary(Map<String, FeelFunction> functions, Map<String, FunctionSignature> signatures) {
        this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
        this.registry = new FunctionRegistry(signatures);
    }

    public static FunctionLibrary standard() {
        return StandardHolder.INSTANCE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<FeelFunction> lookup(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public boolean contains(String name) {
        return functions.containsKey(name);
    }

    public FunctionRegistry registry() {
        return registry;
    }

    private static final class StandardHolder {
        private static final FunctionLibrary INSTANCE = createStandard();

        private static FunctionLibrary createStandard() {
            Builder builder = builder();
            BooleanFunctions.register(builder);
            MathFunctions.register(builder);
            StringFunctions.register(builder);
            ListFunctions.register(builder);
            ConversionFunctions.register(builder);
            ContextFunctions.register(builder);
            FunctionLibrary library = builder.build();
            log.info("Initialized FEEL function library with {} built-in functions", library.registry().size());
            return library;
        }
    }

    /**
     * Collects signatures and bodies before freezing them into a library.
     */
    public static final class Builder {

        private final Map<String, FeelFunction> functions = new LinkedHashMap<>();
        private final Map<String, FunctionSignature> signatures = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder define(FunctionSignature signature, FeelFunction function) {
            if (signatures.containsKey(signature.name())) {
                throw new IllegalArgumentException("Function '" + signature.name() + "' is already defined");
            }
            signatures.put(signature.name(), signature);
            functions.put(signature.name(), function);
            return this;
        }

        public FunctionLibrary build() {
            return new FunctionLibrary(functions, signatures);
        }
    }
}
