package com.cpp2c.transformer.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A preprocessor macro whose replacement list parsed as a single expression.
 * Object-like macros have no parameter list at all; a function-like macro may
 * still have zero parameters ({@code #define F() 1}).
 */
public final class MacroDefinition {
    public final String name;
    public final List<String> parameters;
    public final boolean functionLike;
    public final Expr.ExprInterface body;
    public final SourceLocation location;

    public MacroDefinition(String name, List<String> parameters, boolean functionLike,
                           Expr.ExprInterface body, SourceLocation location) {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("Macro name is null or empty");
        if (body == null) throw new IllegalArgumentException("Macro " + name + " has no body expression");
        if (!functionLike && parameters != null && !parameters.isEmpty()) {
            throw new IllegalArgumentException("Object-like macro " + name + " cannot declare parameters");
        }
        this.name = name;
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters == null ? List.of() : parameters));
        this.functionLike = functionLike;
        this.body = body;
        this.location = location == null ? SourceLocation.UNKNOWN : location;
    }

    public static MacroDefinition objectLike(String name, Expr.ExprInterface body) {
        return new MacroDefinition(name, List.of(), false, body, SourceLocation.UNKNOWN);
    }

    public static MacroDefinition functionLike(String name, List<String> parameters, Expr.ExprInterface body) {
        return new MacroDefinition(name, parameters, true, body, SourceLocation.UNKNOWN);
    }

    public MacroDefinition at(SourceLocation where) {
        return new MacroDefinition(name, parameters, functionLike, body, where);
    }

    public boolean hasDuplicateParameters() {
        Set<String> seen = new HashSet<>();
        for (String p : parameters) {
            if (!seen.add(p)) return true;
        }
        return false;
    }

    /** {@code NAME(a, b) body} or {@code NAME body}. */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name);
        if (functionLike) sb.append('(').append(String.join(", ", parameters)).append(')');
        return sb.append(' ').append(ExprPrinter.print(body)).toString();
    }
}
