package com.cpp2c.transformer.eval;

/**
 * Evaluation ran more loop iterations than the interpreter allows. Treated as "does not
 * terminate"; it is not undefined behaviour.
 */
public class StepLimitExceededException extends EvaluationException {
    private static final long serialVersionUID = 1L;

    public StepLimitExceededException(String message) {
        super(message);
    }
}
