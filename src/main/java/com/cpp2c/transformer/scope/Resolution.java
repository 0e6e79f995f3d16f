package com.cpp2c.transformer.scope;

import com.cpp2c.transformer.ast.FunctionDefinition;
import com.cpp2c.transformer.ast.MacroDefinition;

/** What an {@code Invocation} name denotes at one point of the analysis. */
public final class Resolution {

    public enum Kind { MACRO, FUNCTION, UNBOUND }

    public final Kind kind;
    public final String name;
    public final MacroDefinition macro;
    public final FunctionDefinition function;

    private Resolution(Kind kind, String name, MacroDefinition macro, FunctionDefinition function) {
        this.kind = kind;
        this.name = name;
        this.macro = macro;
        this.function = function;
    }

    static Resolution macro(MacroDefinition m) { return new Resolution(Kind.MACRO, m.name, m, null); }
    static Resolution function(FunctionDefinition f) { return new Resolution(Kind.FUNCTION, f.name, null, f); }
    static Resolution unbound(String name) { return new Resolution(Kind.UNBOUND, name, null, null); }

    public boolean isMacro() { return kind == Kind.MACRO; }
    public boolean isFunction() { return kind == Kind.FUNCTION; }
    public boolean isUnbound() { return kind == Kind.UNBOUND; }

    @Override
    public String toString() {
        return kind + ":" + name;
    }
}
