package com.cpp2c.transformer.codegen;

import com.cpp2c.transformer.analysis.TransformationStrategy;
import com.cpp2c.transformer.ast.FunctionDefinition;
import com.cpp2c.transformer.ast.MacroDefinition;

/** A generated function together with the macro it was first generated for. Immutable. */
public final class TransformedDefinition {
    public final String key;
    public final TransformationStrategy strategy;
    public final MacroDefinition origin;
    public final FunctionDefinition function;

    TransformedDefinition(String key, TransformationStrategy strategy, MacroDefinition origin, FunctionDefinition function) {
        this.key = key;
        this.strategy = strategy;
        this.origin = origin;
        this.function = function;
    }

    public String emittedName() {
        return function.name;
    }

    /** Signature with the name left out, as reported in transformed-definition records. */
    public String signatureWithoutName() {
        return function.signature(true);
    }

    @Override
    public String toString() {
        return function + " /* from " + origin.name + ", key " + key + " */";
    }
}
