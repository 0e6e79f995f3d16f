package com.cpp2c.transformer.codegen;

import com.cpp2c.transformer.ast.Expr.Assign;
import com.cpp2c.transformer.ast.Expr.Binary;
import com.cpp2c.transformer.ast.Expr.ExprInterface;
import com.cpp2c.transformer.ast.Expr.ExprVisitor;
import com.cpp2c.transformer.ast.Expr.Invocation;
import com.cpp2c.transformer.ast.Expr.Num;
import com.cpp2c.transformer.ast.Expr.Paren;
import com.cpp2c.transformer.ast.Expr.Unary;
import com.cpp2c.transformer.ast.Expr.Var;
import com.cpp2c.transformer.ast.Statement.Compound;
import com.cpp2c.transformer.ast.Statement.ExprStmt;
import com.cpp2c.transformer.ast.Statement.IfElse;
import com.cpp2c.transformer.ast.Statement.Skip;
import com.cpp2c.transformer.ast.Statement.Stmt;
import com.cpp2c.transformer.ast.Statement.StmtVisitor;
import com.cpp2c.transformer.ast.Statement.While;

import java.util.ArrayList;
import java.util.List;

/**
 * Replaces one invocation node, found by identity, with a call to the generated
 * function. Argument nodes are carried over as they are; untouched subtrees are
 * shared with the input.
 */
public final class CallSiteRewriter implements ExprVisitor<ExprInterface>, StmtVisitor<Stmt> {

    private final Invocation target;
    private final Invocation replacement;
    private int replaced;

    private CallSiteRewriter(Invocation target, String functionName) {
        this.target = target;
        this.replacement = target.withName(functionName);
    }

    /** The rewritten invocation on its own. */
    public static Invocation rewrite(Invocation site, String functionName) {
        return site.withName(functionName);
    }

    /**
     * @return the rewritten statement, or {@code null} if {@code site} does not occur in {@code enclosing}
     */
    public static Stmt rewrite(Stmt enclosing, Invocation site, String functionName) {
        CallSiteRewriter r = new CallSiteRewriter(site, functionName);
        Stmt out = enclosing.accept(r);
        return r.replaced == 0 ? null : out;
    }

    /**
     * @return the rewritten expression, or {@code null} if {@code site} does not occur in {@code enclosing}
     */
    public static ExprInterface rewrite(ExprInterface enclosing, Invocation site, String functionName) {
        CallSiteRewriter r = new CallSiteRewriter(site, functionName);
        ExprInterface out = enclosing.accept(r);
        return r.replaced == 0 ? null : out;
    }

    // expressions

    @Override
    public ExprInterface visitNumExpr(Num expr) {
        return expr;
    }

    @Override
    public ExprInterface visitVarExpr(Var expr) {
        return expr;
    }

    @Override
    public ExprInterface visitParenExpr(Paren expr) {
        ExprInterface inner = expr.inner.accept(this);
        return inner == expr.inner ? expr : new Paren(inner);
    }

    @Override
    public ExprInterface visitUnaryExpr(Unary expr) {
        ExprInterface operand = expr.operand.accept(this);
        return operand == expr.operand ? expr : new Unary(expr.operator, operand);
    }

    @Override
    public ExprInterface visitBinaryExpr(Binary expr) {
        ExprInterface l = expr.left.accept(this);
        ExprInterface r = expr.right.accept(this);
        return l == expr.left && r == expr.right ? expr : new Binary(expr.operator, l, r);
    }

    @Override
    public ExprInterface visitAssignExpr(Assign expr) {
        ExprInterface v = expr.value.accept(this);
        return v == expr.value ? expr : new Assign(expr.name, v);
    }

    @Override
    public ExprInterface visitInvocationExpr(Invocation expr) {
        if (expr == target) {
            replaced++;
            return replacement;
        }
        boolean changed = false;
        List<ExprInterface> args = new ArrayList<>(expr.arguments.size());
        for (ExprInterface a : expr.arguments) {
            ExprInterface na = a.accept(this);
            changed |= na != a;
            args.add(na);
        }
        return changed ? new Invocation(expr.name, args) : expr;
    }

    // statements

    @Override
    public Stmt visitSkipStmt(Skip stmt) {
        return stmt;
    }

    @Override
    public Stmt visitExprStmt(ExprStmt stmt) {
        ExprInterface e = stmt.expression.accept(this);
        return e == stmt.expression ? stmt : new ExprStmt(e);
    }

    @Override
    public Stmt visitIfElseStmt(IfElse stmt) {
        ExprInterface c = stmt.condition.accept(this);
        Stmt t = stmt.thenBranch.accept(this);
        Stmt e = stmt.elseBranch.accept(this);
        return c == stmt.condition && t == stmt.thenBranch && e == stmt.elseBranch ? stmt : new IfElse(c, t, e);
    }

    @Override
    public Stmt visitWhileStmt(While stmt) {
        ExprInterface c = stmt.condition.accept(this);
        Stmt b = stmt.body.accept(this);
        return c == stmt.condition && b == stmt.body ? stmt : new While(c, b);
    }

    @Override
    public Stmt visitCompoundStmt(Compound stmt) {
        boolean changed = false;
        List<Stmt> out = new ArrayList<>(stmt.statements.size());
        for (Stmt s : stmt.statements) {
            Stmt ns = s.accept(this);
            changed |= ns != s;
            out.add(ns);
        }
        return changed ? new Compound(out) : stmt;
    }
}
