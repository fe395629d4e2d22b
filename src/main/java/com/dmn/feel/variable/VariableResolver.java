package com.dmn.feel.variable;

import com.dmn.feel.value.ObjectValue;
import com.dmn.feel.value.Value;

import java.util.Optional;

/**
 * Resolves FEEL names against a context, applying DMN naming flexibility.
 */
public interface VariableResolver {

    /**
     * Resolve a variable name in the evaluation context.
     *
     * @param name    Variable name as written in the expression (may contain spaces)
     * @param context Variable bindings
     * @return Bound value, or empty if no spelling variant is bound
     */
    Optional<Value> resolveVariable(String name, ObjectValue context);

    /**
     * Resolve a property on a context value.
     *
     * @param property Property name as written in the expression
     * @param object   Context value the property is read from
     * @return Property value, or empty if no spelling variant is present
     */
    Optional<Value> resolveProperty(String property, ObjectValue object);

    /**
     * Resolve a label that may be a direct key or a dotted path ({@code Applicant.Age}).
     *
     * @param label   Key or dotted path
     * @param context Variable bindings
     * @return Value, or empty if neither the key nor the full path resolves
     */
    Optional<Value> resolvePath(String label, ObjectValue context);
}
