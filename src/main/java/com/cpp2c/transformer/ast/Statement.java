package com.cpp2c.transformer.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class Statement {

    public interface Stmt {
        <R> R accept(StmtVisitor<R> visitor);
    }

    public interface StmtVisitor<R> {
        R visitSkipStmt(Skip stmt);
        R visitExprStmt(ExprStmt stmt);
        R visitIfElseStmt(IfElse stmt);
        R visitWhileStmt(While stmt);
        R visitCompoundStmt(Compound stmt);
    }

    public static final class Skip implements Stmt {
        public static final Skip INSTANCE = new Skip();

        private Skip() {}

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitSkipStmt(this); }
    }

    public static final class ExprStmt implements Stmt {
        public final Expr.ExprInterface expression;

        public ExprStmt(Expr.ExprInterface expression) {
            if (expression == null) throw new IllegalArgumentException("Expression statement without expression");
            this.expression = expression;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitExprStmt(this); }
    }

    public static final class IfElse implements Stmt {
        public final Expr.ExprInterface condition;
        public final Stmt thenBranch;
        public final Stmt elseBranch;

        public IfElse(Expr.ExprInterface condition, Stmt thenBranch, Stmt elseBranch) {
            if (condition == null) throw new IllegalArgumentException("if without condition");
            this.condition = condition;
            this.thenBranch = thenBranch == null ? Skip.INSTANCE : thenBranch;
            this.elseBranch = elseBranch == null ? Skip.INSTANCE : elseBranch;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitIfElseStmt(this); }
    }

    public static final class While implements Stmt {
        public final Expr.ExprInterface condition;
        public final Stmt body;

        public While(Expr.ExprInterface condition, Stmt body) {
            if (condition == null) throw new IllegalArgumentException("while without condition");
            this.condition = condition;
            this.body = body == null ? Skip.INSTANCE : body;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitWhileStmt(this); }
    }

    public static final class Compound implements Stmt {
        public final List<Stmt> statements;

        public Compound(List<? extends Stmt> statements) {
            List<Stmt> copy = new ArrayList<>();
            if (statements != null) {
                for (Stmt s : statements) copy.add(s == null ? Skip.INSTANCE : s);
            }
            this.statements = Collections.unmodifiableList(copy);
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitCompoundStmt(this); }
    }

    public static Skip skip() { return Skip.INSTANCE; }
    public static ExprStmt expr(Expr.ExprInterface e) { return new ExprStmt(e); }
    public static IfElse ifElse(Expr.ExprInterface c, Stmt t, Stmt e) { return new IfElse(c, t, e); }
    public static While loop(Expr.ExprInterface c, Stmt body) { return new While(c, body); }
    public static Compound block(Stmt... statements) { return new Compound(List.of(statements)); }
}
