package com.cpp2c.transformer.analysis;

/**
 * How broadly "unsafe to evaluate eagerly" is read when judging macro arguments.
 */
public enum SideEffectPolicy {

    /**
     * Only mutation counts: assignments, and calls to definitions that assign.
     * A dereference such as {@code *p} passes even when {@code p} may be null, so an
     * argument the macro would have skipped through short-circuiting can fault once
     * it is evaluated before the call.
     */
    ASSIGNMENT_ONLY,

    /**
     * Mutation, plus any operation whose result depends on when it is evaluated:
     * dereference, division or modulo by anything but a non-zero numeral, a shift by
     * anything but a numeral in range, {@code &} of something that is not a variable,
     * and a call with the wrong number of arguments. A call to a function whose body
     * contains a {@code while} loop counts as well: the loop may never exit, so the
     * call could hang where the macro would have skipped the argument.
     */
    EAGER_EVALUATION_SAFE
}
