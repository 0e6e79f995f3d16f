package com.cpp2c.transformer.scope;

import com.cpp2c.transformer.ast.MacroDefinition;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable snapshot of the preprocessor's macro table at one point of the
 * translation unit. {@link #without(String)} derives the child handle used while a
 * macro's own body is analysed or expanded, which breaks recursive expansion.
 */
public final class MacroTable {

    private static final MacroTable EMPTY = new MacroTable(new LinkedHashMap<>());

    private final Map<String, MacroDefinition> macros;

    private MacroTable(LinkedHashMap<String, MacroDefinition> macros) {
        this.macros = Collections.unmodifiableMap(macros);
    }

    public static MacroTable empty() {
        return EMPTY;
    }

    public static MacroTable of(MacroDefinition... definitions) {
        MacroTable t = EMPTY;
        for (MacroDefinition d : definitions) t = t.with(d);
        return t;
    }

    public static MacroTable of(Collection<MacroDefinition> definitions) {
        MacroTable t = EMPTY;
        for (MacroDefinition d : definitions) t = t.with(d);
        return t;
    }

    /** A redefinition replaces the previous entry, as {@code #define} after {@code #undef} does. */
    public MacroTable with(MacroDefinition definition) {
        LinkedHashMap<String, MacroDefinition> copy = new LinkedHashMap<>(macros);
        copy.put(definition.name, definition);
        return new MacroTable(copy);
    }

    public MacroTable without(String name) {
        if (!macros.containsKey(name)) return this;
        LinkedHashMap<String, MacroDefinition> copy = new LinkedHashMap<>(macros);
        copy.remove(name);
        return new MacroTable(copy);
    }

    public MacroDefinition get(String name) {
        return macros.get(name);
    }

    public boolean contains(String name) {
        return macros.containsKey(name);
    }

    public Set<String> names() {
        return macros.keySet();
    }

    public Collection<MacroDefinition> definitions() {
        return macros.values();
    }

    public int size() {
        return macros.size();
    }
}
