package com.cpp2c.transformer.ast;

import com.cpp2c.transformer.ast.Expr.Assign;
import com.cpp2c.transformer.ast.Expr.Binary;
import com.cpp2c.transformer.ast.Expr.ExprInterface;
import com.cpp2c.transformer.ast.Expr.ExprVisitor;
import com.cpp2c.transformer.ast.Expr.Invocation;
import com.cpp2c.transformer.ast.Expr.Num;
import com.cpp2c.transformer.ast.Expr.Paren;
import com.cpp2c.transformer.ast.Expr.Unary;
import com.cpp2c.transformer.ast.Expr.Var;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One level of macro-argument substitution: every {@code Var(param)} in the body is
 * replaced by the argument expression bound to that parameter. Arguments are not
 * rescanned.
 */
public final class Substitution implements ExprVisitor<ExprInterface> {

    private final Map<String, ExprInterface> bindings;
    private final boolean strict;

    private Substitution(Map<String, ExprInterface> bindings, boolean strict) {
        this.bindings = bindings;
        this.strict = strict;
    }

    /**
     * @throws IllegalArgumentException if the counts differ, or a parameter used as an
     *         assignment target is bound to something that is not a variable
     */
    public static ExprInterface substitute(ExprInterface body, List<String> params, List<? extends ExprInterface> args) {
        return body.accept(new Substitution(bind(params, args), true));
    }

    /**
     * Like {@link #substitute} but leaves assignment targets alone when the argument
     * is not a variable. Only for static analysis, where any assignment is already
     * disqualifying.
     */
    public static ExprInterface substituteForAnalysis(ExprInterface body, List<String> params, List<? extends ExprInterface> args) {
        return body.accept(new Substitution(bind(params, args), false));
    }

    private static Map<String, ExprInterface> bind(List<String> params, List<? extends ExprInterface> args) {
        if (params.size() != args.size()) {
            throw new IllegalArgumentException("Expected " + params.size() + " arguments, got " + args.size());
        }
        Map<String, ExprInterface> m = new HashMap<>();
        for (int i = 0; i < params.size(); i++) m.put(params.get(i), args.get(i));
        return m;
    }

    @Override
    public ExprInterface visitNumExpr(Num expr) {
        return expr;
    }

    @Override
    public ExprInterface visitVarExpr(Var expr) {
        ExprInterface replacement = bindings.get(expr.name);
        return replacement == null ? expr : replacement;
    }

    @Override
    public ExprInterface visitParenExpr(Paren expr) {
        return new Paren(expr.inner.accept(this));
    }

    @Override
    public ExprInterface visitUnaryExpr(Unary expr) {
        return new Unary(expr.operator, expr.operand.accept(this));
    }

    @Override
    public ExprInterface visitBinaryExpr(Binary expr) {
        return new Binary(expr.operator, expr.left.accept(this), expr.right.accept(this));
    }

    @Override
    public ExprInterface visitAssignExpr(Assign expr) {
        ExprInterface value = expr.value.accept(this);
        ExprInterface target = bindings.get(expr.name);
        if (target == null) return new Assign(expr.name, value);
        ExprInterface unwrapped = target;
        while (unwrapped instanceof Paren) unwrapped = ((Paren) unwrapped).inner;
        if (unwrapped instanceof Var) return new Assign(((Var) unwrapped).name, value);
        if (strict) {
            throw new IllegalArgumentException("Argument for '" + expr.name + "' is not assignable: " + ExprPrinter.print(target));
        }
        return new Assign(expr.name, value);
    }

    @Override
    public ExprInterface visitInvocationExpr(Invocation expr) {
        List<ExprInterface> args = new ArrayList<>(expr.arguments.size());
        for (ExprInterface a : expr.arguments) args.add(a.accept(this));
        return new Invocation(expr.name, args);
    }
}
