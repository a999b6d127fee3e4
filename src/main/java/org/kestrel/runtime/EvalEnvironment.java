package org.kestrel.runtime;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A scope of variable bindings for the {@link Evaluator}. A scope may be enclosed by an
 * outer scope; lookups that miss in the inner scope fall through to the outer one.
 * Bindings are always created in the innermost scope and may shadow outer ones.
 */
public class EvalEnvironment {

    private final Map<String, Value> store = new HashMap<>();
    private final EvalEnvironment outer;

    /**
     * Creates an outermost scope.
     */
    public EvalEnvironment() {
        this(null);
    }

    private EvalEnvironment(EvalEnvironment outer) {
        this.outer = outer;
    }

    /**
     * Creates a new scope nested in the given one.
     * @param outer The enclosing scope.
     * @return The new, empty scope.
     */
    public static EvalEnvironment enclosedBy(EvalEnvironment outer) {
        return new EvalEnvironment(outer);
    }

    /**
     * Looks a name up in this scope and then in the enclosing scopes.
     * @param name The name.
     * @return The bound value, or empty if the name is unbound.
     */
    public Optional<Value> get(String name) {
        Value value = store.get(name);
        if (value == null && outer != null) {
            return outer.get(name);
        }
        return Optional.ofNullable(value);
    }

    /**
     * Binds a name in this scope.
     * @param name The name.
     * @param value The value.
     * @return The value.
     */
    public Value set(String name, Value value) {
        store.put(name, value);
        return value;
    }

    /**
     * Describes the type of every visible binding. Inner bindings shadow outer ones.
     * @return A type environment for all names visible from this scope.
     */
    public TypeEnvironment types() {
        Deque<EvalEnvironment> scopes = new ArrayDeque<>();
        for (EvalEnvironment scope = this; scope != null; scope = scope.outer) {
            scopes.push(scope);
        }
        TypeEnvironment types = new TypeEnvironment();
        for (EvalEnvironment scope : scopes) {
            scope.store.forEach((name, value) -> types.set(name, value.type()));
        }
        return types;
    }
}
