package com.cpp2c.transformer.analysis;

import com.cpp2c.transformer.ast.Expr.Assign;
import com.cpp2c.transformer.ast.Expr.Binary;
import com.cpp2c.transformer.ast.Expr.ExprInterface;
import com.cpp2c.transformer.ast.Expr.ExprVisitor;
import com.cpp2c.transformer.ast.Expr.Invocation;
import com.cpp2c.transformer.ast.Expr.Num;
import com.cpp2c.transformer.ast.Expr.Paren;
import com.cpp2c.transformer.ast.Expr.Unary;
import com.cpp2c.transformer.ast.Expr.Var;
import com.cpp2c.transformer.scope.Definitions;

/**
 * Finds invocations that resolve to a macro, anywhere inside an expression including
 * argument lists. Invocations resolving to functions (or nothing) are ignored.
 */
public final class NestedInvocationAnalyzer implements ExprVisitor<Invocation> {

    private final Definitions definitions;

    private NestedInvocationAnalyzer(Definitions definitions) {
        this.definitions = definitions;
    }

    public static boolean noMacroInvocations(ExprInterface expr, Definitions definitions) {
        return firstMacroInvocation(expr, definitions) == null;
    }

    /** The first macro invocation in evaluation order, or {@code null}. */
    public static Invocation firstMacroInvocation(ExprInterface expr, Definitions definitions) {
        return expr.accept(new NestedInvocationAnalyzer(definitions));
    }

    @Override
    public Invocation visitNumExpr(Num expr) {
        return null;
    }

    @Override
    public Invocation visitVarExpr(Var expr) {
        return null;
    }

    @Override
    public Invocation visitParenExpr(Paren expr) {
        return expr.inner.accept(this);
    }

    @Override
    public Invocation visitUnaryExpr(Unary expr) {
        return expr.operand.accept(this);
    }

    @Override
    public Invocation visitBinaryExpr(Binary expr) {
        Invocation l = expr.left.accept(this);
        return l != null ? l : expr.right.accept(this);
    }

    @Override
    public Invocation visitAssignExpr(Assign expr) {
        return expr.value.accept(this);
    }

    @Override
    public Invocation visitInvocationExpr(Invocation expr) {
        for (ExprInterface a : expr.arguments) {
            Invocation found = a.accept(this);
            if (found != null) return found;
        }
        return definitions.macros.contains(expr.name) ? expr : null;
    }
}
