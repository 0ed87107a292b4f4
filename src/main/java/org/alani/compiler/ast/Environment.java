package org.alani.compiler.ast;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Variable bindings shared by every step of a single compilation.
 *
 * <p>Not thread safe; each compilation owns its own instance.
 */
public final class Environment {
    private final Map<String, AlaniAst> variables = new HashMap<>();

    public void define(String name, AlaniAst value) {
        variables.put(name, value);
    }

    public Optional<AlaniAst> lookup(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    public boolean contains(String name) {
        return variables.containsKey(name);
    }

    public int size() {
        return variables.size();
    }
}
