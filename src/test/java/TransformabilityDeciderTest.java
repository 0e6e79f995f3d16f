import static com.cpp2c.transformer.ast.Expr.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.cpp2c.transformer.analysis.RejectionReason;
import com.cpp2c.transformer.analysis.SideEffectPolicy;
import com.cpp2c.transformer.analysis.TransformabilityDecider;
import com.cpp2c.transformer.analysis.TransformationStrategy;
import com.cpp2c.transformer.analysis.Verdict;
import com.cpp2c.transformer.ast.FunctionDefinition;
import com.cpp2c.transformer.ast.MacroDefinition;
import com.cpp2c.transformer.ast.Statement;
import com.cpp2c.transformer.scope.CallerScope;
import com.cpp2c.transformer.scope.Definitions;
import com.cpp2c.transformer.scope.FunctionTable;
import com.cpp2c.transformer.scope.MacroTable;

public class TransformabilityDeciderTest {

    // #define A_THEN_B(a, b) ((a) && (b))
    private static final MacroDefinition A_THEN_B = MacroDefinition.functionLike("A_THEN_B", List.of("a", "b"),
            paren(binary(BinaryOp.AND, paren(var("a")), paren(var("b")))));

    // #define X x
    private static final MacroDefinition X = MacroDefinition.objectLike("X", var("x"));

    private static final CallerScope MAIN = CallerScope.of(List.of("p", "x"), List.of("g"));

    private final TransformabilityDecider decider = new TransformabilityDecider(SideEffectPolicy.EAGER_EVALUATION_SAFE);

    private static Definitions defs(MacroDefinition... macros) {
        return Definitions.of(MacroTable.of(macros), FunctionTable.empty());
    }

    private Verdict decide(MacroDefinition m, List<ExprInterface> args, CallerScope scope, Definitions d) {
        return decider.decide(m, args, scope, d);
    }

    @Test
    void aThenB_onNumerals_isTransformable() {
        Verdict v = decide(A_THEN_B, List.of(num(1), num(2)), MAIN, defs(A_THEN_B));
        assertTrue(v.isTransformable(), v.toString());
        assertEquals(TransformationStrategy.FUNCTION_LIKE_TO_FUNCTION, v.strategy());
    }

    @Test
    void aThenB_withDereferencedArgument_isUnsafeArgument() {
        Verdict v = decide(A_THEN_B, List.of(var("p"), unary(UnaryOp.DEREF, var("p"))), MAIN, defs(A_THEN_B));
        assertFalse(v.isTransformable());
        assertEquals(RejectionReason.UNSAFE_ARGUMENT, v.reason());
        assertTrue(v.detail().contains("argument 2"), v.detail());
    }

    @Test
    void aThenB_withDereferencedArgument_passesUnderAssignmentOnlyPolicy() {
        TransformabilityDecider legacy = new TransformabilityDecider(SideEffectPolicy.ASSIGNMENT_ONLY);
        Verdict v = legacy.decide(A_THEN_B, List.of(var("p"), unary(UnaryOp.DEREF, var("p"))), MAIN, defs(A_THEN_B));
        assertTrue(v.isTransformable());
    }

    @Test
    void aThenB_withArgumentCallingNonTerminatingFunction_isUnsafeArgument() {
        // int spin(void) { while (1); return 0; }
        FunctionDefinition spin = new FunctionDefinition("spin", List.of(), Statement.loop(num(1), Statement.skip()), num(0));
        Definitions d = Definitions.of(MacroTable.of(A_THEN_B), FunctionTable.of(spin));
        List<ExprInterface> args = List.of(num(0), invoke("spin"));

        Verdict v = decide(A_THEN_B, args, MAIN, d);
        assertFalse(v.isTransformable());
        assertEquals(RejectionReason.UNSAFE_ARGUMENT, v.reason());
        assertTrue(v.detail().contains("argument 2"), v.detail());

        assertTrue(new TransformabilityDecider(SideEffectPolicy.ASSIGNMENT_ONLY).decide(A_THEN_B, args, MAIN, d).isTransformable());
    }

    @Test
    void objectLikeMacroOfLocal_capturesCallerScope() {
        Verdict v = decide(X, List.of(), MAIN, defs(X));
        assertEquals(RejectionReason.CAPTURES_CALLER_SCOPE, v.reason());
    }

    @Test
    void objectLikeMacroOfGlobal_isTransformedToNullaryFunction() {
        CallerScope globalOnly = CallerScope.of(List.of("p"), List.of("x"));
        Verdict v = decide(X, List.of(), globalOnly, defs(X));
        assertTrue(v.isTransformable());
        assertEquals(TransformationStrategy.OBJECT_LIKE_TO_NULLARY_FUNCTION, v.strategy());
    }

    @Test
    void functionLikeBody_readingCallerLocalThroughFreeVariable_isRejected() {
        MacroDefinition addX = MacroDefinition.functionLike("ADD_X", List.of("a"), binary(BinaryOp.ADD, var("a"), var("x")));
        assertEquals(RejectionReason.CAPTURES_CALLER_SCOPE,
                decide(addX, List.of(num(1)), MAIN, defs(addX)).reason());
        // parameter named like a caller local is bound, not captured
        MacroDefinition idX = MacroDefinition.functionLike("ID", List.of("x"), paren(var("x")));
        assertTrue(decide(idX, List.of(var("p")), MAIN, defs(idX)).isTransformable());
    }

    @Test
    void arityMismatch_isCheckedFirst() {
        MacroDefinition dup = MacroDefinition.functionLike("DUP", List.of("a", "a"), assign("x", var("a")));
        assertEquals(RejectionReason.ARITY_MISMATCH, decide(dup, List.of(num(1)), MAIN, defs(dup)).reason());
        assertEquals(RejectionReason.MALFORMED_MACRO, decide(dup, List.of(num(1), num(2)), MAIN, defs(dup)).reason());
    }

    @Test
    void bodyInvokingAnotherMacro_isNestedMacro() {
        MacroDefinition one = MacroDefinition.objectLike("ONE", num(1));
        MacroDefinition two = MacroDefinition.objectLike("TWO", binary(BinaryOp.ADD, invoke("ONE"), invoke("ONE")));
        assertEquals(RejectionReason.NESTED_MACRO, decide(two, List.of(), MAIN, defs(one, two)).reason());
    }

    @Test
    void argumentWithAssignmentOrMacro_isUnsafeArgument() {
        MacroDefinition inc = MacroDefinition.functionLike("INC", List.of("a"), paren(binary(BinaryOp.ADD, paren(var("a")), num(1))));
        MacroDefinition one = MacroDefinition.objectLike("ONE", num(1));
        Definitions d = defs(inc, one);

        assertEquals(RejectionReason.UNSAFE_ARGUMENT, decide(inc, List.of(assign("g", num(2))), MAIN, d).reason());
        assertEquals(RejectionReason.UNSAFE_ARGUMENT, decide(inc, List.of(invoke("ONE")), MAIN, d).reason());
        assertEquals(RejectionReason.UNSAFE_ARGUMENT, decide(inc, List.of(invoke("undeclared")), MAIN, d).reason());
    }

    @Test
    void assigningBody_isSideEffectingBody() {
        MacroDefinition set = MacroDefinition.functionLike("SET", List.of("v"), assign("g", var("v")));
        assertEquals(RejectionReason.SIDE_EFFECTING_BODY, decide(set, List.of(num(3)), MAIN, defs(set)).reason());

        MacroDefinition touch = MacroDefinition.objectLike("TOUCH", paren(assign("g", num(0))));
        assertEquals(RejectionReason.SIDE_EFFECTING_BODY, decide(touch, List.of(), MAIN, defs(touch)).reason());
    }

    @Test
    void bodyCallingImpureFunction_isSideEffectingBody() {
        FunctionDefinition tick = new FunctionDefinition("tick", List.of(), Statement.expr(assign("g", num(1))), var("g"));
        MacroDefinition t = MacroDefinition.objectLike("T", invoke("tick"));
        Definitions d = Definitions.of(MacroTable.of(t), FunctionTable.of(tick));
        assertEquals(RejectionReason.SIDE_EFFECTING_BODY, decide(t, List.of(), MAIN, d).reason());
    }

    @Test
    void bareParameterBody_isTransformable() {
        MacroDefinition id = MacroDefinition.functionLike("ID", List.of("a"), paren(var("a")));
        assertTrue(decide(id, List.of(binary(BinaryOp.ADD, var("p"), num(1))), MAIN, defs(id)).isTransformable());
    }

    @Test
    void divisionByVariableInArgument_isUnsafe_butInBodyIsFine() {
        MacroDefinition div = MacroDefinition.functionLike("DIV", List.of("a", "b"), paren(binary(BinaryOp.DIV, var("a"), var("b"))));
        assertTrue(decide(div, List.of(var("p"), num(2)), MAIN, defs(div)).isTransformable());
        assertEquals(RejectionReason.UNSAFE_ARGUMENT,
                decide(div, List.of(binary(BinaryOp.DIV, num(1), var("p")), num(2)), MAIN, defs(div)).reason());
    }

    @Test
    void bodyTakingAddressOfParameter_isUnsafeArgument() {
        MacroDefinition addr = MacroDefinition.functionLike("ADDR", List.of("v"), paren(unary(UnaryOp.ADDRESS_OF, var("v"))));
        Verdict v = decide(addr, List.of(var("g")), MAIN, defs(addr));
        assertEquals(RejectionReason.UNSAFE_ARGUMENT, v.reason());
        assertTrue(v.detail().contains("[v]"), v.detail());
    }

    @Test
    void bodyInvokingItsOwnName_isNestedMacro() {
        FunctionDefinition f = new FunctionDefinition("f", List.of("a"), Statement.skip(), var("a"));
        MacroDefinition m = MacroDefinition.functionLike("f", List.of("a"), paren(binary(BinaryOp.ADD, invoke("f", var("a")), num(1))));
        Definitions d = Definitions.of(MacroTable.of(m), FunctionTable.of(f));
        assertEquals(RejectionReason.NESTED_MACRO, decide(m, List.of(num(1)), MAIN, d).reason());
    }

    @Test
    void sameInputs_giveSameVerdict() {
        List<ExprInterface> args = List.of(num(1), var("g"));
        Verdict first = decide(A_THEN_B, args, MAIN, defs(A_THEN_B));
        Verdict second = decide(A_THEN_B, List.of(num(1), var("g")), CallerScope.of(List.of("p", "x"), List.of("g")), defs(A_THEN_B));
        assertEquals(first, second);

        Verdict r1 = decide(X, List.of(), MAIN, defs(X));
        Verdict r2 = decide(X, List.of(), MAIN, defs(X));
        assertEquals(r1, r2);
    }

    @Test
    void structurallyIdenticalMacros_shareDefinitionKey() {
        MacroDefinition inc = MacroDefinition.functionLike("INC", List.of("a"), paren(binary(BinaryOp.ADD, paren(var("a")), num(1))));
        MacroDefinition add1 = MacroDefinition.functionLike("ADD1", List.of("n"), paren(binary(BinaryOp.ADD, paren(var("n")), num(1))));
        MacroDefinition add2 = MacroDefinition.functionLike("ADD2", List.of("a"), paren(binary(BinaryOp.ADD, paren(var("a")), num(2))));

        String k1 = decide(inc, List.of(num(1)), MAIN, defs(inc)).definitionKey();
        String k2 = decide(add1, List.of(var("g")), MAIN, defs(add1)).definitionKey();
        String k3 = decide(add2, List.of(num(1)), MAIN, defs(add2)).definitionKey();
        assertEquals(k1, k2);
        assertNotEquals(k1, k3);
    }

    @Test
    void rejectedVerdict_hasNoStrategy() {
        Verdict v = decide(X, List.of(), MAIN, defs(X));
        assertThrows(IllegalStateException.class, v::strategy);
        assertThrows(IllegalStateException.class, v::definitionKey);
    }
}
