package com.cpp2c.transformer.eval;

import com.cpp2c.transformer.ast.Expr.Assign;
import com.cpp2c.transformer.ast.Expr.Binary;
import com.cpp2c.transformer.ast.Expr.ExprInterface;
import com.cpp2c.transformer.ast.Expr.ExprVisitor;
import com.cpp2c.transformer.ast.Expr.Invocation;
import com.cpp2c.transformer.ast.Expr.Num;
import com.cpp2c.transformer.ast.Expr.Paren;
import com.cpp2c.transformer.ast.Expr.Unary;
import com.cpp2c.transformer.ast.Expr.Var;
import com.cpp2c.transformer.ast.FunctionDefinition;
import com.cpp2c.transformer.ast.MacroDefinition;
import com.cpp2c.transformer.ast.Statement.Compound;
import com.cpp2c.transformer.ast.Statement.ExprStmt;
import com.cpp2c.transformer.ast.Statement.IfElse;
import com.cpp2c.transformer.ast.Statement.Skip;
import com.cpp2c.transformer.ast.Statement.Stmt;
import com.cpp2c.transformer.ast.Statement.StmtVisitor;
import com.cpp2c.transformer.ast.Statement.While;
import com.cpp2c.transformer.ast.Substitution;
import com.cpp2c.transformer.scope.Definitions;
import com.cpp2c.transformer.scope.Resolution;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Reference semantics for the expression/statement model.
 *
 * - Macro invocation is call-by-name: arguments are substituted into the body and the
 *   result is evaluated in the caller's environment, with the macro itself removed
 *   from the table while its body runs.
 * - Function invocation is call-by-value: arguments are evaluated left to right,
 *   bound to fresh locations in a fresh frame over the same globals, the body runs,
 *   then the return expression gives the result.
 * - {@code &&} and {@code ||} short-circuit; truth is "non-zero".
 */
public class Interpreter implements ExprVisitor<Long>, StmtVisitor<Void> {

    public static final int DEFAULT_MAX_DEPTH = 64;
    public static final long DEFAULT_MAX_STEPS = 1_000_000L;

    private Environment env;
    private Definitions definitions;
    private final Store store;
    private final int maxDepth;
    private final long maxSteps;
    private long steps;
    private final Deque<CallFrame> callStack = new ArrayDeque<>();

    public Interpreter(Environment env, Definitions definitions, Store store) {
        this(env, definitions, store, DEFAULT_MAX_DEPTH);
    }

    public Interpreter(Environment env, Definitions definitions, Store store, int maxDepth) {
        this(env, definitions, store, maxDepth, DEFAULT_MAX_STEPS);
    }

    /**
     * @param maxSteps loop iterations allowed over the interpreter's lifetime; one more
     *                 throws {@link StepLimitExceededException}
     */
    public Interpreter(Environment env, Definitions definitions, Store store, int maxDepth, long maxSteps) {
        this.env = env;
        this.definitions = definitions;
        this.store = store;
        this.maxDepth = maxDepth;
        this.maxSteps = maxSteps;
    }

    public long eval(ExprInterface expr) {
        return expr.accept(this);
    }

    public void execute(Stmt stmt) {
        stmt.accept(this);
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public Void visitSkipStmt(Skip stmt) {
        return null;
    }

    @Override
    public Void visitExprStmt(ExprStmt stmt) {
        eval(stmt.expression);
        return null;
    }

    @Override
    public Void visitIfElseStmt(IfElse stmt) {
        if (isTruthy(eval(stmt.condition))) stmt.thenBranch.accept(this);
        else stmt.elseBranch.accept(this);
        return null;
    }

    @Override
    public Void visitWhileStmt(While stmt) {
        while (isTruthy(eval(stmt.condition))) {
            if (++steps > maxSteps) {
                throw new StepLimitExceededException("Loop iteration limit exceeded (" + maxSteps + ")" + where());
            }
            stmt.body.accept(this);
        }
        return null;
    }

    @Override
    public Void visitCompoundStmt(Compound stmt) {
        for (Stmt s : stmt.statements) s.accept(this);
        return null;
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public Long visitNumExpr(Num expr) {
        return expr.value;
    }

    @Override
    public Long visitVarExpr(Var expr) {
        return store.read(env.lookup(expr.name));
    }

    @Override
    public Long visitParenExpr(Paren expr) {
        return eval(expr.inner);
    }

    @Override
    public Long visitUnaryExpr(Unary expr) {
        switch (expr.operator) {
            case ADDRESS_OF:
                return addressOf(expr.operand);
            case DEREF: {
                long address = eval(expr.operand);
                if (address == 0) throw new UndefinedBehaviorException("Null pointer dereference");
                return store.read(address);
            }
            default:
                break;
        }
        long v = eval(expr.operand);
        switch (expr.operator) {
            case PLUS: return v;
            case MINUS: return -v;
            case NOT: return v == 0 ? 1L : 0L;
            case BIT_NOT: return ~v;
            default:
                throw new EvaluationException("Unsupported unary operator: " + expr.operator);
        }
    }

    @Override
    public Long visitBinaryExpr(Binary expr) {
        switch (expr.operator) {
            case AND:
                if (!isTruthy(eval(expr.left))) return 0L;
                return isTruthy(eval(expr.right)) ? 1L : 0L;
            case OR:
                if (isTruthy(eval(expr.left))) return 1L;
                return isTruthy(eval(expr.right)) ? 1L : 0L;
            default:
                break;
        }

        long l = eval(expr.left);
        long r = eval(expr.right);
        switch (expr.operator) {
            case MUL: return l * r;
            case DIV:
                if (r == 0) throw new UndefinedBehaviorException("Division by zero");
                return l / r;
            case MOD:
                if (r == 0) throw new UndefinedBehaviorException("Modulo by zero");
                return l % r;
            case ADD: return l + r;
            case SUB: return l - r;
            case SHL:
                requireShift(r);
                return l << r;
            case SHR:
                requireShift(r);
                return l >> r;
            case LT: return l < r ? 1L : 0L;
            case LE: return l <= r ? 1L : 0L;
            case GT: return l > r ? 1L : 0L;
            case GE: return l >= r ? 1L : 0L;
            case EQ: return l == r ? 1L : 0L;
            case NE: return l != r ? 1L : 0L;
            case BIT_AND: return l & r;
            case BIT_XOR: return l ^ r;
            case BIT_OR: return l | r;
            default:
                throw new EvaluationException("Unsupported binary operator: " + expr.operator);
        }
    }

    @Override
    public Long visitAssignExpr(Assign expr) {
        long value = eval(expr.value);
        store.write(env.lookup(expr.name), value);
        return value;
    }

    @Override
    public Long visitInvocationExpr(Invocation expr) {
        Resolution r = definitions.resolve(expr.name);
        switch (r.kind) {
            case MACRO:
                return expand(r.macro, expr.arguments);
            case FUNCTION:
                return call(r.function, expr.arguments);
            default:
                throw new EvaluationException("Undefined function or macro: " + expr.name);
        }
    }

    // -------------------------
    // Call-by-name / call-by-value
    // -------------------------

    private long expand(MacroDefinition macro, List<ExprInterface> args) {
        if (args.size() != macro.parameters.size()) {
            throw new EvaluationException(macro.name + " expects " + macro.parameters.size() + " arguments, got " + args.size());
        }
        ExprInterface expanded;
        try {
            expanded = Substitution.substitute(macro.body, macro.parameters, args);
        } catch (IllegalArgumentException e) {
            throw new EvaluationException("Cannot expand " + macro.name + ": " + e.getMessage(), e);
        }

        Definitions previous = definitions;
        enter(new CallFrame(macro.name, true, List.of()));
        definitions = definitions.withoutMacro(macro.name);
        try {
            return eval(expanded);
        } finally {
            definitions = previous;
            callStack.pop();
        }
    }

    private long call(FunctionDefinition function, List<ExprInterface> args) {
        if (args.size() != function.parameters.size()) {
            throw new EvaluationException(function.name + "() expects " + function.parameters.size() + " arguments, got " + args.size());
        }
        List<Long> values = new ArrayList<>(args.size());
        for (ExprInterface a : args) values.add(eval(a));

        Environment previous = env;
        enter(new CallFrame(function.name, false, values));
        env = previous.childFrame();
        try {
            for (int i = 0; i < function.parameters.size(); i++) {
                env.defineLocal(function.parameters.get(i), store.allocate(values.get(i)));
            }
            function.body.accept(this);
            return eval(function.returnExpr);
        } finally {
            env = previous;
            callStack.pop();
        }
    }

    private void enter(CallFrame frame) {
        if (callStack.size() >= maxDepth) {
            throw new UndefinedBehaviorException("Maximum call depth exceeded (" + maxDepth + ") in " + frame.describe());
        }
        callStack.push(frame);
    }

    private String where() {
        CallFrame top = callStack.peek();
        return top == null ? "" : " in " + top.describe();
    }

    private long addressOf(ExprInterface operand) {
        ExprInterface e = operand;
        while (e instanceof Paren) e = ((Paren) e).inner;
        if (!(e instanceof Var)) throw new EvaluationException("Cannot take the address of a non-lvalue");
        return env.lookup(((Var) e).name);
    }

    private static void requireShift(long amount) {
        if (amount < 0 || amount >= Long.SIZE) throw new UndefinedBehaviorException("Shift amount out of range: " + amount);
    }

    public static boolean isTruthy(long v) {
        return v != 0;
    }
}
