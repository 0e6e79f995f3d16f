package com.cpp2c.transformer.analysis;

import com.cpp2c.transformer.ast.Expr.Assign;
import com.cpp2c.transformer.ast.Expr.Binary;
import com.cpp2c.transformer.ast.Expr.BinaryOp;
import com.cpp2c.transformer.ast.Expr.ExprInterface;
import com.cpp2c.transformer.ast.Expr.ExprVisitor;
import com.cpp2c.transformer.ast.Expr.Invocation;
import com.cpp2c.transformer.ast.Expr.Num;
import com.cpp2c.transformer.ast.Expr.Paren;
import com.cpp2c.transformer.ast.Expr.Unary;
import com.cpp2c.transformer.ast.Expr.UnaryOp;
import com.cpp2c.transformer.ast.Expr.Var;
import com.cpp2c.transformer.ast.FunctionDefinition;
import com.cpp2c.transformer.ast.Statement.Compound;
import com.cpp2c.transformer.ast.Statement.ExprStmt;
import com.cpp2c.transformer.ast.Statement.IfElse;
import com.cpp2c.transformer.ast.Statement.Skip;
import com.cpp2c.transformer.ast.Statement.Stmt;
import com.cpp2c.transformer.ast.Statement.StmtVisitor;
import com.cpp2c.transformer.ast.Statement.While;
import com.cpp2c.transformer.scope.Definitions;
import com.cpp2c.transformer.scope.Resolution;

import java.util.HashSet;
import java.util.Set;

/**
 * Structural check for whether evaluating an expression (or running a statement) can
 * change the store. No evaluation takes place.
 *
 * An invocation is side-effecting if any argument is, or if its name resolves to a
 * definition that is. Unresolved names are side-effecting. A definition that is
 * reached again while it is still being analysed (recursion) is side-effecting too.
 * Under {@link SideEffectPolicy#EAGER_EVALUATION_SAFE} so is any loop, since neither
 * recursion nor a loop is known to terminate.
 */
public final class SideEffectAnalyzer implements ExprVisitor<Boolean>, StmtVisitor<Boolean> {

    private final Definitions definitions;
    private final SideEffectPolicy policy;
    private final Set<String> inProgress;

    public SideEffectAnalyzer(Definitions definitions, SideEffectPolicy policy) {
        this(definitions, policy, new HashSet<>());
    }

    private SideEffectAnalyzer(Definitions definitions, SideEffectPolicy policy, Set<String> inProgress) {
        this.definitions = definitions;
        this.policy = policy == null ? SideEffectPolicy.ASSIGNMENT_ONLY : policy;
        this.inProgress = inProgress;
    }

    public boolean hasSideEffects(ExprInterface expr) {
        return expr.accept(this);
    }

    public boolean hasSideEffects(Stmt stmt) {
        return stmt.accept(this);
    }

    public boolean hasSideEffects(FunctionDefinition function) {
        return function.body.accept(this) || function.returnExpr.accept(this);
    }

    @Override
    public Boolean visitNumExpr(Num expr) {
        return false;
    }

    @Override
    public Boolean visitVarExpr(Var expr) {
        return false;
    }

    @Override
    public Boolean visitParenExpr(Paren expr) {
        return expr.inner.accept(this);
    }

    @Override
    public Boolean visitUnaryExpr(Unary expr) {
        if (policy == SideEffectPolicy.EAGER_EVALUATION_SAFE) {
            if (expr.operator == UnaryOp.DEREF) return true;
            if (expr.operator == UnaryOp.ADDRESS_OF && !isVariable(expr.operand)) return true;
        }
        return expr.operand.accept(this);
    }

    @Override
    public Boolean visitBinaryExpr(Binary expr) {
        if (policy == SideEffectPolicy.EAGER_EVALUATION_SAFE) {
            if ((expr.operator == BinaryOp.DIV || expr.operator == BinaryOp.MOD) && !isNonZeroNumeral(expr.right)) {
                return true;
            }
            if ((expr.operator == BinaryOp.SHL || expr.operator == BinaryOp.SHR) && !isShiftAmount(expr.right)) {
                return true;
            }
        }
        return expr.left.accept(this) || expr.right.accept(this);
    }

    @Override
    public Boolean visitAssignExpr(Assign expr) {
        return true;
    }

    @Override
    public Boolean visitInvocationExpr(Invocation expr) {
        for (ExprInterface a : expr.arguments) {
            if (a.accept(this)) return true;
        }

        Resolution r = definitions.resolve(expr.name);
        if (r.isUnbound()) return true;

        if (policy == SideEffectPolicy.EAGER_EVALUATION_SAFE && r.isFunction()
                && r.function.parameters.size() != expr.arguments.size()) {
            return true;
        }

        String guard = r.kind + ":" + r.name;
        if (!inProgress.add(guard)) return true;
        try {
            if (r.isMacro()) {
                SideEffectAnalyzer child = new SideEffectAnalyzer(definitions.withoutMacro(r.name), policy, inProgress);
                return r.macro.body.accept(child);
            }
            return hasSideEffects(r.function);
        } finally {
            inProgress.remove(guard);
        }
    }

    // statements

    @Override
    public Boolean visitSkipStmt(Skip stmt) {
        return false;
    }

    @Override
    public Boolean visitExprStmt(ExprStmt stmt) {
        return stmt.expression.accept(this);
    }

    @Override
    public Boolean visitIfElseStmt(IfElse stmt) {
        return stmt.condition.accept(this) || stmt.thenBranch.accept(this) || stmt.elseBranch.accept(this);
    }

    @Override
    public Boolean visitWhileStmt(While stmt) {
        // a loop may never exit; evaluated early it can hang where the macro would not
        if (policy == SideEffectPolicy.EAGER_EVALUATION_SAFE) return true;
        return stmt.condition.accept(this) || stmt.body.accept(this);
    }

    @Override
    public Boolean visitCompoundStmt(Compound stmt) {
        for (Stmt s : stmt.statements) {
            if (s.accept(this)) return true;
        }
        return false;
    }

    private static boolean isNonZeroNumeral(ExprInterface e) {
        while (e instanceof Paren) e = ((Paren) e).inner;
        return e instanceof Num && ((Num) e).value != 0;
    }

    private static boolean isVariable(ExprInterface e) {
        while (e instanceof Paren) e = ((Paren) e).inner;
        return e instanceof Var;
    }

    private static boolean isShiftAmount(ExprInterface e) {
        while (e instanceof Paren) e = ((Paren) e).inner;
        return e instanceof Num && ((Num) e).value >= 0 && ((Num) e).value < Long.SIZE;
    }
}
