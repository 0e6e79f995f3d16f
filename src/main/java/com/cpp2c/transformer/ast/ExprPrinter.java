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
import com.cpp2c.transformer.ast.Statement.Compound;
import com.cpp2c.transformer.ast.Statement.ExprStmt;
import com.cpp2c.transformer.ast.Statement.IfElse;
import com.cpp2c.transformer.ast.Statement.Skip;
import com.cpp2c.transformer.ast.Statement.Stmt;
import com.cpp2c.transformer.ast.Statement.StmtVisitor;
import com.cpp2c.transformer.ast.Statement.While;

/**
 * C-like rendering for messages and debug output. Nested binary operands that are
 * not explicitly parenthesised get parentheses so the text stays unambiguous.
 */
public final class ExprPrinter implements ExprVisitor<String>, StmtVisitor<String> {

    private static final ExprPrinter INSTANCE = new ExprPrinter();

    private ExprPrinter() {}

    public static String print(ExprInterface expr) {
        return expr.accept(INSTANCE);
    }

    public static String print(Stmt stmt) {
        return stmt.accept(INSTANCE);
    }

    @Override
    public String visitNumExpr(Num expr) {
        return Long.toString(expr.value);
    }

    @Override
    public String visitVarExpr(Var expr) {
        return expr.name;
    }

    @Override
    public String visitParenExpr(Paren expr) {
        return "(" + expr.inner.accept(this) + ")";
    }

    @Override
    public String visitUnaryExpr(Unary expr) {
        return expr.operator.symbol + operand(expr.operand);
    }

    @Override
    public String visitBinaryExpr(Binary expr) {
        return operand(expr.left) + " " + expr.operator.symbol + " " + operand(expr.right);
    }

    @Override
    public String visitAssignExpr(Assign expr) {
        return expr.name + " = " + expr.value.accept(this);
    }

    @Override
    public String visitInvocationExpr(Invocation expr) {
        StringBuilder sb = new StringBuilder(expr.name).append('(');
        for (int i = 0; i < expr.arguments.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(expr.arguments.get(i).accept(this));
        }
        return sb.append(')').toString();
    }

    private String operand(ExprInterface e) {
        String s = e.accept(this);
        if (e instanceof Binary || e instanceof Assign) return "(" + s + ")";
        return s;
    }

    // statements, single line

    @Override
    public String visitSkipStmt(Skip stmt) {
        return ";";
    }

    @Override
    public String visitExprStmt(ExprStmt stmt) {
        return stmt.expression.accept(this) + ";";
    }

    @Override
    public String visitIfElseStmt(IfElse stmt) {
        return "if (" + stmt.condition.accept(this) + ") " + stmt.thenBranch.accept(this)
                + " else " + stmt.elseBranch.accept(this);
    }

    @Override
    public String visitWhileStmt(While stmt) {
        return "while (" + stmt.condition.accept(this) + ") " + stmt.body.accept(this);
    }

    @Override
    public String visitCompoundStmt(Compound stmt) {
        StringBuilder sb = new StringBuilder("{");
        for (Stmt s : stmt.statements) sb.append(' ').append(s.accept(this));
        return sb.append(" }").toString();
    }
}
