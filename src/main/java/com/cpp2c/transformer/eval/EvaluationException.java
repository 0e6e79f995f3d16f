package com.cpp2c.transformer.eval;

/** Evaluation cannot proceed: unbound name, wrong argument count, not an lvalue. */
public class EvaluationException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
