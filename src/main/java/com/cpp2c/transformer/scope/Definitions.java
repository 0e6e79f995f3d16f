package com.cpp2c.transformer.scope;

import com.cpp2c.transformer.ast.FunctionDefinition;
import com.cpp2c.transformer.ast.MacroDefinition;

/**
 * Pair of table snapshots used for two-level lookup: a macro shadows a function of
 * the same name. Instances are immutable; derive children instead of mutating.
 */
public final class Definitions {

    public final MacroTable macros;
    public final FunctionTable functions;

    public Definitions(MacroTable macros, FunctionTable functions) {
        this.macros = macros == null ? MacroTable.empty() : macros;
        this.functions = functions == null ? FunctionTable.empty() : functions;
    }

    public static Definitions of(MacroTable macros, FunctionTable functions) {
        return new Definitions(macros, functions);
    }

    public Resolution resolve(String name) {
        MacroDefinition m = macros.get(name);
        if (m != null) return Resolution.macro(m);
        FunctionDefinition f = functions.get(name);
        if (f != null) return Resolution.function(f);
        return Resolution.unbound(name);
    }

    /** Handle to use while analysing or expanding the body of macro {@code name}. */
    public Definitions withoutMacro(String name) {
        MacroTable child = macros.without(name);
        return child == macros ? this : new Definitions(child, functions);
    }

    public Definitions withFunctions(FunctionTable newFunctions) {
        return new Definitions(macros, newFunctions);
    }
}
