package com.cpp2c.transformer.eval;

import com.cpp2c.transformer.scope.CallerScope;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Two-level name to location binding. Locals strictly shadow globals. A call frame
 * is always built fresh over the same globals; frames are never merged.
 */
public final class Environment {

    private final Map<String, Long> globals;
    private final Map<String, Long> locals = new LinkedHashMap<>();

    public Environment(Map<String, Long> globals) {
        this.globals = globals == null ? new LinkedHashMap<>() : globals;
    }

    /** New frame with no locals and the same global bindings. */
    public Environment childFrame() {
        return new Environment(globals);
    }

    public void defineGlobal(String name, long location) {
        if (globals.containsKey(name)) {
            throw new EvaluationException("Global already defined: " + name);
        }
        globals.put(name, location);
    }

    public void defineLocal(String name, long location) {
        if (locals.containsKey(name)) {
            throw new EvaluationException("Variable already defined: " + name);
        }
        locals.put(name, location);
    }

    public long lookup(String name) {
        Long loc = locals.get(name);
        if (loc != null) return loc;
        loc = globals.get(name);
        if (loc != null) return loc;
        throw new EvaluationException("Undefined variable: " + name);
    }

    /** Names-only shape of this environment, as the static checks see it. */
    public CallerScope shape() {
        return CallerScope.of(locals.keySet(), globals.keySet());
    }
}
