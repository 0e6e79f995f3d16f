import static com.cpp2c.transformer.ast.Expr.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

import org.junit.jupiter.api.Test;

import com.cpp2c.transformer.analysis.SideEffectPolicy;
import com.cpp2c.transformer.analysis.TransformabilityDecider;
import com.cpp2c.transformer.analysis.Verdict;
import com.cpp2c.transformer.ast.ExprPrinter;
import com.cpp2c.transformer.ast.FunctionDefinition;
import com.cpp2c.transformer.ast.MacroDefinition;
import com.cpp2c.transformer.ast.Statement;
import com.cpp2c.transformer.codegen.CodeGenerator;
import com.cpp2c.transformer.codegen.NameAllocator;
import com.cpp2c.transformer.eval.Environment;
import com.cpp2c.transformer.eval.EvaluationException;
import com.cpp2c.transformer.eval.Interpreter;
import com.cpp2c.transformer.eval.Store;
import com.cpp2c.transformer.eval.UndefinedBehaviorException;
import com.cpp2c.transformer.scope.CallerScope;
import com.cpp2c.transformer.scope.Definitions;
import com.cpp2c.transformer.scope.FunctionTable;
import com.cpp2c.transformer.scope.MacroTable;

/**
 * Randomised check that a transformable verdict means the macro expansion and the
 * call to the generated function behave the same: same value (or same failure), and
 * the same contents for every location that existed before the call. An expansion
 * that runs into undefined behaviour constrains nothing. Evaluation is bounded, so a
 * call that spins where the expansion finished fails with a different outcome.
 */
public class SoundnessPropertyTest {

    private static final int TRIALS = 3000;

    private static final List<String> PARAMS = List.of("a", "b");
    private static final List<String> ARG_VARS = List.of("g", "h", "x", "p", "q");

    private static final UnaryOp[] UNARY = UnaryOp.values();
    private static final BinaryOp[] BINARY = BinaryOp.values();

    // int twice(int a) { return a * 2; }
    private static final FunctionDefinition TWICE = new FunctionDefinition("twice", List.of("a"), Statement.skip(),
            binary(BinaryOp.MUL, var("a"), num(2)));
    // int tick(void) { h = h + 1; return h; }
    private static final FunctionDefinition TICK = new FunctionDefinition("tick", List.of(),
            Statement.expr(assign("h", binary(BinaryOp.ADD, var("h"), num(1)))), var("h"));
    // int over_g(int a) { return a / g; }
    private static final FunctionDefinition OVER_G = new FunctionDefinition("over_g", List.of("a"), Statement.skip(),
            binary(BinaryOp.DIV, var("a"), var("g")));

    // int sign(int a) { if (a < 0) ; else { ; } return (a > 0) - (a < 0); }
    private static final FunctionDefinition SIGN = new FunctionDefinition("sign", List.of("a"),
            Statement.ifElse(binary(BinaryOp.LT, var("a"), num(0)), Statement.skip(), Statement.block(Statement.skip())),
            binary(BinaryOp.SUB, binary(BinaryOp.GT, var("a"), num(0)), binary(BinaryOp.LT, var("a"), num(0))));
    // int count_down(int a) { while (a > 0) a = a - 1; return a; }
    private static final FunctionDefinition COUNT_DOWN = new FunctionDefinition("count_down", List.of("a"),
            Statement.loop(binary(BinaryOp.GT, var("a"), num(0)),
                    Statement.expr(assign("a", binary(BinaryOp.SUB, var("a"), num(1))))),
            var("a"));
    // int wait_g(void) { while (g) ; return 1; }
    private static final FunctionDefinition WAIT_G = new FunctionDefinition("wait_g", List.of(),
            Statement.loop(var("g"), Statement.skip()), num(1));
    // int small(int a) { while (a > 4) ; return a; }
    private static final FunctionDefinition SMALL = new FunctionDefinition("small", List.of("a"),
            Statement.loop(binary(BinaryOp.GT, var("a"), num(4)), Statement.skip()), var("a"));
    // int raise_h(int a) { if (a > h) { h = a; } return h; }
    private static final FunctionDefinition RAISE_H = new FunctionDefinition("raise_h", List.of("a"),
            Statement.ifElse(binary(BinaryOp.GT, var("a"), var("h")), Statement.block(Statement.expr(assign("h", var("a")))), null),
            var("h"));

    private static final FunctionTable LIBRARY = FunctionTable.of(TWICE, TICK, OVER_G, SIGN, COUNT_DOWN, WAIT_G, SMALL, RAISE_H);

    /** Loop iterations allowed per run; {@code wait_g} and {@code small} can spin forever. */
    private static final long STEP_LIMIT = 2_000;

    /** Globals g = 3, h = 0, q = &g; locals p = 0 (null), x = 5. */
    private static final class World {
        final Store store = new Store();
        final Environment env = new Environment(new LinkedHashMap<>());

        World() {
            long g = store.allocate(3);
            env.defineGlobal("g", g);
            env.defineGlobal("h", store.allocate(0));
            env.defineGlobal("q", store.allocate(g));
            env.defineLocal("p", store.allocate(0));
            env.defineLocal("x", store.allocate(5));
        }
    }

    private static final class Outcome {
        final Long value;
        final Class<? extends RuntimeException> failure;
        final Map<Long, Long> store;

        Outcome(Long value, Class<? extends RuntimeException> failure, Map<Long, Long> store) {
            this.value = value;
            this.failure = failure;
            this.store = store;
        }

        @Override
        public String toString() {
            return (failure != null ? failure.getSimpleName() : "value " + value) + ", store " + store;
        }
    }

    // ---------------- generators ----------------

    private static ExprInterface body(Random rnd, List<String> params, int depth) {
        if (depth == 0 || rnd.nextInt(10) < 3) {
            int pick = rnd.nextInt(20);
            if (pick < 8) return num(rnd.nextInt(8) - 2);
            if (pick < 15 && !params.isEmpty()) return var(params.get(rnd.nextInt(params.size())));
            if (pick < 19) return var(rnd.nextBoolean() ? "g" : "q");
            return var("x");
        }
        int shape = rnd.nextInt(20);
        if (shape < 3) return paren(body(rnd, params, depth - 1));
        if (shape < 7) return unary(UNARY[rnd.nextInt(UNARY.length)], body(rnd, params, depth - 1));
        if (shape < 17) return binary(BINARY[rnd.nextInt(BINARY.length)], body(rnd, params, depth - 1), body(rnd, params, depth - 1));
        if (shape < 18) return assign("h", body(rnd, params, depth - 1));
        return call(rnd, params, depth);
    }

    private static ExprInterface argument(Random rnd, int depth) {
        if (depth == 0 || rnd.nextInt(10) < 4) {
            return rnd.nextBoolean() ? num(rnd.nextInt(8) - 2) : var(ARG_VARS.get(rnd.nextInt(ARG_VARS.size())));
        }
        int shape = rnd.nextInt(20);
        if (shape < 2) return paren(argument(rnd, depth - 1));
        if (shape < 4) return unary(UnaryOp.MINUS, argument(rnd, depth - 1));
        if (shape < 5) return unary(UnaryOp.DEREF, argument(rnd, depth - 1));
        if (shape < 6) return unary(UnaryOp.ADDRESS_OF, var(ARG_VARS.get(rnd.nextInt(ARG_VARS.size()))));
        if (shape < 17) return binary(BINARY[rnd.nextInt(BINARY.length)], argument(rnd, depth - 1), argument(rnd, depth - 1));
        if (shape < 18) return assign("h", argument(rnd, depth - 1));
        return call(rnd, List.of(), depth);
    }

    private static ExprInterface call(Random rnd, List<String> params, int depth) {
        switch (rnd.nextInt(8)) {
            case 0: return invoke("twice", body(rnd, params, depth - 1));
            case 1: return invoke("tick");
            case 2: return invoke("over_g", body(rnd, params, depth - 1));
            case 3: return invoke("sign", body(rnd, params, depth - 1));
            case 4: return invoke("count_down", body(rnd, params, depth - 1));
            case 5: return invoke("wait_g");
            case 6: return invoke("small", body(rnd, params, depth - 1));
            default: return invoke("raise_h", body(rnd, params, depth - 1));
        }
    }

    // ---------------- evaluation ----------------

    private static Outcome run(World world, Definitions defs, ExprInterface expr) {
        Store store = world.store.copy();
        long lastExisting = world.store.snapshot().keySet().stream().mapToLong(Long::longValue).max().orElse(0);
        Long value = null;
        Class<? extends RuntimeException> failure = null;
        try {
            value = new Interpreter(world.env, defs, store, Interpreter.DEFAULT_MAX_DEPTH, STEP_LIMIT).eval(expr);
        } catch (EvaluationException e) {
            failure = e.getClass();
        }
        Map<Long, Long> before = new TreeMap<>(store.snapshot());
        before.keySet().removeIf(loc -> loc > lastExisting);
        return new Outcome(value, failure, before);
    }

    // ---------------- properties ----------------

    @Test
    void transformableImpliesEquivalent() {
        Random rnd = new Random(0xC0FFEEL);
        World world = new World();
        CallerScope scope = world.env.shape();
        TransformabilityDecider decider = new TransformabilityDecider(SideEffectPolicy.EAGER_EVALUATION_SAFE);

        int transformed = 0;
        int compared = 0;
        for (int i = 0; i < TRIALS; i++) {
            boolean functionLike = rnd.nextInt(4) != 0;
            List<String> params = functionLike ? PARAMS : List.of();
            MacroDefinition macro = functionLike
                    ? MacroDefinition.functionLike("M", params, body(rnd, params, 3))
                    : MacroDefinition.objectLike("M", body(rnd, params, 3));
            List<ExprInterface> args = new ArrayList<>();
            for (int k = 0; k < params.size(); k++) args.add(argument(rnd, 2));

            Definitions defs = Definitions.of(MacroTable.of(macro), LIBRARY);
            Verdict verdict = decider.decide(macro, args, scope, defs);
            if (!verdict.isTransformable()) continue;
            transformed++;

            CodeGenerator gen = new CodeGenerator(LIBRARY, new NameAllocator("cpp2c_"));
            String fn = gen.generate(macro, verdict).definition.emittedName();
            Definitions after = defs.withFunctions(gen.functions());

            Invocation site = new Invocation("M", args);
            Outcome expanded = run(world, after, site);
            if (expanded.failure == UndefinedBehaviorException.class) continue;
            compared++;

            Outcome called = run(world, after, site.withName(fn));
            String context = "trial " + i + ": " + macro + " with " + args.stream().map(ExprPrinter::print).toList();
            assertEquals(expanded.failure, called.failure, context);
            assertEquals(expanded.value, called.value, context);
            assertEquals(expanded.store, called.store, context);
        }

        assertTrue(transformed >= 100, "only " + transformed + " transformable trials");
        assertTrue(compared >= 50, "only " + compared + " comparable trials");
    }

    @Test
    void assignmentOnlyPolicy_acceptsTheNullDereferenceCounterexample() {
        // #define A_THEN_B(a,b) ((a) && (b)) at A_THEN_B(p, *p) with p == 0
        MacroDefinition aThenB = MacroDefinition.functionLike("A_THEN_B", PARAMS,
                paren(binary(BinaryOp.AND, paren(var("a")), paren(var("b")))));
        List<ExprInterface> args = List.of(var("p"), unary(UnaryOp.DEREF, var("p")));
        World world = new World();
        Definitions defs = Definitions.of(MacroTable.of(aThenB), FunctionTable.empty());

        Verdict legacy = new TransformabilityDecider(SideEffectPolicy.ASSIGNMENT_ONLY)
                .decide(aThenB, args, world.env.shape(), defs);
        assertTrue(legacy.isTransformable());

        CodeGenerator gen = new CodeGenerator(FunctionTable.empty(), new NameAllocator("cpp2c_"));
        String fn = gen.generate(aThenB, legacy).definition.emittedName();
        Definitions after = defs.withFunctions(gen.functions());

        Outcome expanded = run(world, after, new Invocation("A_THEN_B", args));
        Outcome called = run(world, after, new Invocation(fn, args));
        assertEquals(0L, expanded.value);
        assertEquals(UndefinedBehaviorException.class, called.failure);

        Verdict safe = new TransformabilityDecider(SideEffectPolicy.EAGER_EVALUATION_SAFE)
                .decide(aThenB, args, world.env.shape(), defs);
        assertFalse(safe.isTransformable());
    }
}
