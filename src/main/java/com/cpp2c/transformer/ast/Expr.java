package com.cpp2c.transformer.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Expression nodes shared by macro bodies, function bodies and call sites.
 * Nodes are immutable; rewriting produces new nodes.
 */
public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
    }

    public interface ExprVisitor<R> {
        R visitNumExpr(Num expr);
        R visitVarExpr(Var expr);
        R visitParenExpr(Paren expr);
        R visitUnaryExpr(Unary expr);
        R visitBinaryExpr(Binary expr);
        R visitAssignExpr(Assign expr);
        R visitInvocationExpr(Invocation expr);
    }

    public enum UnaryOp {
        PLUS("+"),
        MINUS("-"),
        NOT("!"),
        BIT_NOT("~"),
        DEREF("*"),
        ADDRESS_OF("&");

        public final String symbol;

        UnaryOp(String symbol) { this.symbol = symbol; }
    }

    public enum BinaryOp {
        MUL("*"),
        DIV("/"),
        MOD("%"),
        ADD("+"),
        SUB("-"),
        SHL("<<"),
        SHR(">>"),
        LT("<"),
        LE("<="),
        GT(">"),
        GE(">="),
        EQ("=="),
        NE("!="),
        BIT_AND("&"),
        BIT_XOR("^"),
        BIT_OR("|"),
        AND("&&"),
        OR("||");

        public final String symbol;

        BinaryOp(String symbol) { this.symbol = symbol; }
    }

    // -------------------------
    // Leaves
    // -------------------------

    public static final class Num implements ExprInterface {
        public final long value;

        public Num(long value) {
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitNumExpr(this);
        }
    }

    public static final class Var implements ExprInterface {
        public final String name;

        public Var(String name) {
            this.name = requireName(name);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVarExpr(this);
        }
    }

    // -------------------------
    // Composite nodes
    // -------------------------

    public static final class Paren implements ExprInterface {
        public final ExprInterface inner;

        public Paren(ExprInterface inner) {
            this.inner = requireExpr(inner);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitParenExpr(this);
        }
    }

    public static final class Unary implements ExprInterface {
        public final UnaryOp operator;
        public final ExprInterface operand;

        public Unary(UnaryOp operator, ExprInterface operand) {
            if (operator == null) throw new IllegalArgumentException("Unary operator is null");
            this.operator = operator;
            this.operand = requireExpr(operand);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }
    }

    public static final class Binary implements ExprInterface {
        public final BinaryOp operator;
        public final ExprInterface left;
        public final ExprInterface right;

        public Binary(BinaryOp operator, ExprInterface left, ExprInterface right) {
            if (operator == null) throw new IllegalArgumentException("Binary operator is null");
            this.operator = operator;
            this.left = requireExpr(left);
            this.right = requireExpr(right);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }
    }

    public static final class Assign implements ExprInterface {
        public final String name;
        public final ExprInterface value;

        public Assign(String name, ExprInterface value) {
            this.name = requireName(name);
            this.value = requireExpr(value);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitAssignExpr(this);
        }
    }

    /**
     * Either a function call or a macro expansion. Which one applies is decided by
     * resolving {@link #name} against the macro table first, then the function table.
     */
    public static final class Invocation implements ExprInterface {
        public final String name;
        public final List<ExprInterface> arguments;

        public Invocation(String name, List<? extends ExprInterface> arguments) {
            this.name = requireName(name);
            List<ExprInterface> copy = new ArrayList<>();
            if (arguments != null) {
                for (ExprInterface a : arguments) copy.add(requireExpr(a));
            }
            this.arguments = Collections.unmodifiableList(copy);
        }

        /** Same arguments (by reference), different callee. */
        public Invocation withName(String newName) {
            return new Invocation(newName, arguments);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitInvocationExpr(this);
        }
    }

    // -------------------------
    // Factories (used heavily by tests and the front-end adapter)
    // -------------------------

    public static Num num(long value) { return new Num(value); }
    public static Var var(String name) { return new Var(name); }
    public static Paren paren(ExprInterface inner) { return new Paren(inner); }
    public static Unary unary(UnaryOp op, ExprInterface operand) { return new Unary(op, operand); }
    public static Binary binary(BinaryOp op, ExprInterface left, ExprInterface right) { return new Binary(op, left, right); }
    public static Assign assign(String name, ExprInterface value) { return new Assign(name, value); }
    public static Invocation invoke(String name, ExprInterface... args) { return new Invocation(name, List.of(args)); }

    private static String requireName(String name) {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("Identifier is null or empty");
        return name;
    }

    private static ExprInterface requireExpr(ExprInterface e) {
        if (e == null) throw new IllegalArgumentException("Sub-expression is null");
        return e;
    }
}
