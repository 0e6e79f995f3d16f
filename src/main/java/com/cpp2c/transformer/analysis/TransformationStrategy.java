package com.cpp2c.transformer.analysis;

public enum TransformationStrategy {
    /** {@code #define X body} becomes {@code int f(void) { return body; }}. */
    OBJECT_LIKE_TO_NULLARY_FUNCTION,
    /** {@code #define F(a, b) body} becomes {@code int f(int a, int b) { return body; }}. */
    FUNCTION_LIKE_TO_FUNCTION
}
