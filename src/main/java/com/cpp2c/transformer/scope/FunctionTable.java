package com.cpp2c.transformer.scope;

import com.cpp2c.transformer.ast.FunctionDefinition;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable snapshot of the function table. The transformer only ever grows it,
 * by swapping its current handle for {@link #with(FunctionDefinition)}.
 */
public final class FunctionTable {

    private static final FunctionTable EMPTY = new FunctionTable(new LinkedHashMap<>());

    private final Map<String, FunctionDefinition> functions;

    private FunctionTable(LinkedHashMap<String, FunctionDefinition> functions) {
        this.functions = Collections.unmodifiableMap(functions);
    }

    public static FunctionTable empty() {
        return EMPTY;
    }

    public static FunctionTable of(FunctionDefinition... definitions) {
        FunctionTable t = EMPTY;
        for (FunctionDefinition d : definitions) t = t.with(d);
        return t;
    }

    public static FunctionTable of(Collection<FunctionDefinition> definitions) {
        FunctionTable t = EMPTY;
        for (FunctionDefinition d : definitions) t = t.with(d);
        return t;
    }

    /** @throws IllegalArgumentException if a function of that name already exists */
    public FunctionTable with(FunctionDefinition definition) {
        if (functions.containsKey(definition.name)) {
            throw new IllegalArgumentException("Function already defined: " + definition.name);
        }
        LinkedHashMap<String, FunctionDefinition> copy = new LinkedHashMap<>(functions);
        copy.put(definition.name, definition);
        return new FunctionTable(copy);
    }

    public FunctionTable without(String name) {
        if (!functions.containsKey(name)) return this;
        LinkedHashMap<String, FunctionDefinition> copy = new LinkedHashMap<>(functions);
        copy.remove(name);
        return new FunctionTable(copy);
    }

    public FunctionDefinition get(String name) {
        return functions.get(name);
    }

    public boolean contains(String name) {
        return functions.containsKey(name);
    }

    public Set<String> names() {
        return functions.keySet();
    }

    public Collection<FunctionDefinition> definitions() {
        return functions.values();
    }

    public int size() {
        return functions.size();
    }
}
