package com.cpp2c.transformer.analysis;

import com.cpp2c.transformer.ast.Expr.Assign;
import com.cpp2c.transformer.ast.Expr.Binary;
import com.cpp2c.transformer.ast.Expr.ExprInterface;
import com.cpp2c.transformer.ast.Expr.ExprVisitor;
import com.cpp2c.transformer.ast.Expr.Invocation;
import com.cpp2c.transformer.ast.Expr.Num;
import com.cpp2c.transformer.ast.Expr.Paren;
import com.cpp2c.transformer.ast.Expr.Unary;
import com.cpp2c.transformer.ast.Expr.UnaryOp;
import com.cpp2c.transformer.ast.Expr.Var;
import com.cpp2c.transformer.scope.CallerScope;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Hygiene check: which caller locals an expression would read (or write) if it were
 * expanded in place. Globals never count, since a function sees the same globals.
 */
public final class ScopeAnalyzer {

    private ScopeAnalyzer() {}

    /** True iff no variable in {@code expr} names a local of {@code scope}. */
    public static boolean noVarsInEnvironment(ExprInterface expr, CallerScope scope) {
        return capturedLocals(expr, scope, Set.of()).isEmpty();
    }

    /**
     * Caller locals referenced by {@code expr}, in order of first occurrence.
     * Names in {@code bound} (macro parameters) are not free and are skipped.
     */
    public static Set<String> capturedLocals(ExprInterface expr, CallerScope scope, Collection<String> bound) {
        Set<String> out = new LinkedHashSet<>();
        expr.accept(new Collector(scope, bound, out));
        return out;
    }

    /** Names from {@code candidates} that appear as the operand of {@code &}, in order of first occurrence. */
    public static Set<String> addressTaken(ExprInterface expr, Collection<String> candidates) {
        Set<String> out = new LinkedHashSet<>();
        expr.accept(new AddressCollector(candidates, out));
        return out;
    }

    private static final class Collector implements ExprVisitor<Void> {
        private final CallerScope scope;
        private final Collection<String> bound;
        private final Set<String> out;

        Collector(CallerScope scope, Collection<String> bound, Set<String> out) {
            this.scope = scope;
            this.bound = bound;
            this.out = out;
        }

        private void name(String n) {
            if (!bound.contains(n) && scope.isLocal(n)) out.add(n);
        }

        @Override
        public Void visitNumExpr(Num expr) {
            return null;
        }

        @Override
        public Void visitVarExpr(Var expr) {
            name(expr.name);
            return null;
        }

        @Override
        public Void visitParenExpr(Paren expr) {
            return expr.inner.accept(this);
        }

        @Override
        public Void visitUnaryExpr(Unary expr) {
            return expr.operand.accept(this);
        }

        @Override
        public Void visitBinaryExpr(Binary expr) {
            expr.left.accept(this);
            return expr.right.accept(this);
        }

        @Override
        public Void visitAssignExpr(Assign expr) {
            name(expr.name);
            return expr.value.accept(this);
        }

        @Override
        public Void visitInvocationExpr(Invocation expr) {
            for (ExprInterface a : expr.arguments) a.accept(this);
            return null;
        }
    }

    private static final class AddressCollector implements ExprVisitor<Void> {
        private final Collection<String> candidates;
        private final Set<String> out;

        AddressCollector(Collection<String> candidates, Set<String> out) {
            this.candidates = candidates;
            this.out = out;
        }

        @Override
        public Void visitNumExpr(Num expr) {
            return null;
        }

        @Override
        public Void visitVarExpr(Var expr) {
            return null;
        }

        @Override
        public Void visitParenExpr(Paren expr) {
            return expr.inner.accept(this);
        }

        @Override
        public Void visitUnaryExpr(Unary expr) {
            if (expr.operator == UnaryOp.ADDRESS_OF) {
                ExprInterface e = expr.operand;
                while (e instanceof Paren) e = ((Paren) e).inner;
                if (e instanceof Var && candidates.contains(((Var) e).name)) out.add(((Var) e).name);
            }
            return expr.operand.accept(this);
        }

        @Override
        public Void visitBinaryExpr(Binary expr) {
            expr.left.accept(this);
            return expr.right.accept(this);
        }

        @Override
        public Void visitAssignExpr(Assign expr) {
            return expr.value.accept(this);
        }

        @Override
        public Void visitInvocationExpr(Invocation expr) {
            for (ExprInterface a : expr.arguments) a.accept(this);
            return null;
        }
    }
}
