package com.cpp2c.transformer.ast;

import com.cpp2c.transformer.ast.Statement.Stmt;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A function: parameters are bound by value, {@link #body} runs first and
 * {@link #returnExpr} is evaluated afterwards to produce the result.
 */
public final class FunctionDefinition {
    public final String name;
    public final List<String> parameters;
    public final Stmt body;
    public final Expr.ExprInterface returnExpr;

    public FunctionDefinition(String name, List<String> parameters, Stmt body, Expr.ExprInterface returnExpr) {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("Function name is null or empty");
        if (returnExpr == null) throw new IllegalArgumentException("Function " + name + " has no return expression");
        List<String> params = new ArrayList<>(parameters == null ? List.of() : parameters);
        Set<String> seen = new HashSet<>();
        for (String p : params) {
            if (!seen.add(p)) throw new IllegalArgumentException("Duplicate parameter '" + p + "' in function " + name);
        }
        this.name = name;
        this.parameters = Collections.unmodifiableList(params);
        this.body = body == null ? Statement.skip() : body;
        this.returnExpr = returnExpr;
    }

    /**
     * C-style signature. All values in the model are integers, so every
     * parameter and the result are typed {@code int}.
     */
    public String signature(boolean omitName) {
        StringBuilder sb = new StringBuilder("int ");
        if (!omitName) sb.append(name);
        sb.append('(');
        if (parameters.isEmpty()) {
            sb.append("void");
        } else {
            for (int i = 0; i < parameters.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append("int ").append(parameters.get(i));
            }
        }
        return sb.append(')').toString();
    }

    @Override
    public String toString() {
        String prefix = body instanceof Statement.Skip ? "" : ExprPrinter.print(body) + " ";
        return signature(false) + " { " + prefix + "return " + ExprPrinter.print(returnExpr) + "; }";
    }
}
