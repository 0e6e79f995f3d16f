package com.cpp2c.transformer.eval;

/**
 * The program performed an operation C leaves undefined: invalid dereference,
 * division or modulo by zero, an out-of-range shift, unbounded recursion.
 */
public class UndefinedBehaviorException extends EvaluationException {
    private static final long serialVersionUID = 1L;

    public UndefinedBehaviorException(String message) {
        super(message);
    }
}
