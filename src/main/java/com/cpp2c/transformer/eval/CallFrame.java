package com.cpp2c.transformer.eval;

import java.util.List;
import java.util.stream.Collectors;

/** One active function call or macro expansion, innermost on top of the interpreter's stack. */
public final class CallFrame {
    public final String name;
    public final boolean macroExpansion;
    public final List<Long> arguments;

    CallFrame(String name, boolean macroExpansion, List<Long> arguments) {
        this.name = name;
        this.macroExpansion = macroExpansion;
        this.arguments = arguments;
    }

    /** {@code macro NAME} or {@code name(1, 2)} with the bound argument values. */
    public String describe() {
        if (macroExpansion) return "macro " + name;
        return arguments.stream().map(String::valueOf).collect(Collectors.joining(", ", name + "(", ")"));
    }
}
