package com.cpp2c.transformer.emit;

/** Write-only destination for facts. Implementations must not throw on well-formed facts. */
public interface FactSink {
    void emit(Fact fact);

    /** Flushes buffered output, if any. */
    default void flush() {}
}
