package com.cpp2c.transformer.analysis;

/**
 * Closed set of reasons an expansion site is left untransformed. Declaration order
 * is the order in which the decision procedure checks them.
 */
public enum RejectionReason {
    ARITY_MISMATCH("ArityMismatch", "Arity"),
    MALFORMED_MACRO("MalformedMacro", "Syntactic"),
    NESTED_MACRO("NestedMacro", "Nesting"),
    CAPTURES_CALLER_SCOPE("CapturesCallerScope", "Hygiene"),
    UNSAFE_ARGUMENT("UnsafeArgument", "Side-effects"),
    SIDE_EFFECTING_BODY("SideEffectingBody", "Side-effects");

    /** Reason code as it appears in emitted records. */
    public final String code;
    public final String category;

    RejectionReason(String code, String category) {
        this.code = code;
        this.category = category;
    }
}
