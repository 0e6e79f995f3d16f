package com.cpp2c.transformer.analysis;

import com.cpp2c.debug.Debug;
import com.cpp2c.transformer.ast.Expr.ExprInterface;
import com.cpp2c.transformer.ast.Expr.Invocation;
import com.cpp2c.transformer.ast.Expr.Paren;
import com.cpp2c.transformer.ast.Expr.Var;
import com.cpp2c.transformer.ast.ExprPrinter;
import com.cpp2c.transformer.ast.Fingerprint;
import com.cpp2c.transformer.ast.MacroDefinition;
import com.cpp2c.transformer.ast.Substitution;
import com.cpp2c.transformer.scope.CallerScope;
import com.cpp2c.transformer.scope.Definitions;

import java.util.List;
import java.util.Set;

/**
 * Decides whether one macro expansion can be replaced by a call to a generated
 * function. Conditions are checked in a fixed order and the first failure wins:
 *
 *   1. argument count equals parameter count        ARITY_MISMATCH
 *   2. no duplicate parameter names                 MALFORMED_MACRO
 *   3. the body invokes no macro                    NESTED_MACRO
 *   4. the body reads no caller local               CAPTURES_CALLER_SCOPE
 *      (object-like: any variable; function-like: any non-parameter variable)
 *   5. every argument is safe to evaluate once,
 *      before the call, and invokes no macro; the
 *      body takes no parameter's address             UNSAFE_ARGUMENT
 *   6. the substituted body has no side effects,
 *      unless it is a bare parameter                SIDE_EFFECTING_BODY
 *
 * The result depends only on its inputs, so repeated calls agree.
 */
public final class TransformabilityDecider {

    private static final String TAG = "decide";

    private final SideEffectPolicy argumentPolicy;

    public TransformabilityDecider(SideEffectPolicy argumentPolicy) {
        this.argumentPolicy = argumentPolicy == null ? SideEffectPolicy.EAGER_EVALUATION_SAFE : argumentPolicy;
    }

    public Verdict decide(MacroDefinition macro, List<? extends ExprInterface> args, CallerScope caller, Definitions definitions) {
        Verdict v = check(macro, args, caller, definitions);
        Debug.get().d(TAG, macro.name + " " + args.size() + " arg(s) -> " + v);
        return v;
    }

    private Verdict check(MacroDefinition macro, List<? extends ExprInterface> args, CallerScope caller, Definitions definitions) {
        // 1
        if (args.size() != macro.parameters.size()) {
            return Verdict.notTransformable(RejectionReason.ARITY_MISMATCH,
                    macro.name + " expects " + macro.parameters.size() + " argument(s), got " + args.size());
        }

        // 2
        if (macro.hasDuplicateParameters()) {
            return Verdict.notTransformable(RejectionReason.MALFORMED_MACRO,
                    macro.name + " declares a parameter more than once: " + macro.parameters);
        }

        // 3: a body that names the macro itself counts too
        Invocation nested = NestedInvocationAnalyzer.firstMacroInvocation(macro.body, definitions);
        if (nested != null) {
            return Verdict.notTransformable(RejectionReason.NESTED_MACRO,
                    "body invokes macro " + nested.name);
        }

        // 4
        Set<String> captured = ScopeAnalyzer.capturedLocals(macro.body, caller, macro.parameters);
        if (!captured.isEmpty()) {
            return Verdict.notTransformable(RejectionReason.CAPTURES_CALLER_SCOPE,
                    "body references caller local(s) " + captured);
        }

        // 5
        if (macro.functionLike) {
            if (argumentPolicy == SideEffectPolicy.EAGER_EVALUATION_SAFE) {
                Set<String> addressed = ScopeAnalyzer.addressTaken(macro.body, macro.parameters);
                if (!addressed.isEmpty()) {
                    return Verdict.notTransformable(RejectionReason.UNSAFE_ARGUMENT,
                            "body takes the address of parameter(s) " + addressed);
                }
            }
            SideEffectAnalyzer argumentEffects = new SideEffectAnalyzer(definitions, argumentPolicy);
            for (int i = 0; i < args.size(); i++) {
                ExprInterface arg = args.get(i);
                if (!NestedInvocationAnalyzer.noMacroInvocations(arg, definitions)) {
                    return Verdict.notTransformable(RejectionReason.UNSAFE_ARGUMENT,
                            "argument " + (i + 1) + " (" + ExprPrinter.print(arg) + ") invokes a macro");
                }
                if (argumentEffects.hasSideEffects(arg)) {
                    return Verdict.notTransformable(RejectionReason.UNSAFE_ARGUMENT,
                            "argument " + (i + 1) + " (" + ExprPrinter.print(arg) + ") is not safe to evaluate eagerly");
                }
            }
        }

        // 6
        if (!isBareParameter(macro)) {
            ExprInterface substituted = macro.functionLike
                    ? Substitution.substituteForAnalysis(macro.body, macro.parameters, args)
                    : macro.body;
            SideEffectAnalyzer bodyEffects = new SideEffectAnalyzer(definitions, SideEffectPolicy.ASSIGNMENT_ONLY);
            if (bodyEffects.hasSideEffects(substituted)) {
                return Verdict.notTransformable(RejectionReason.SIDE_EFFECTING_BODY,
                        "body " + ExprPrinter.print(macro.body) + " may modify the store");
            }
        }

        TransformationStrategy strategy = macro.functionLike
                ? TransformationStrategy.FUNCTION_LIKE_TO_FUNCTION
                : TransformationStrategy.OBJECT_LIKE_TO_NULLARY_FUNCTION;
        return Verdict.transformable(strategy, Fingerprint.structuralKey(macro.parameters, macro.body));
    }

    private static boolean isBareParameter(MacroDefinition macro) {
        ExprInterface e = macro.body;
        while (e instanceof Paren) e = ((Paren) e).inner;
        return e instanceof Var && macro.parameters.contains(((Var) e).name);
    }
}
