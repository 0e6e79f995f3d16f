package com.cpp2c.transformer.emit;

public enum FactKind {
    MACRO_DEFINITION("Macro Definition"),
    MACRO_EXPANSION("Macro Expansion"),
    TRANSFORMED_DEFINITION("Transformed Definition"),
    TRANSFORMED_EXPANSION("Transformed Expansion"),
    UNTRANSFORMED_EXPANSION("Untransformed Expansion");

    /** Label used in the text record format. */
    public final String label;

    FactKind(String label) {
        this.label = label;
    }
}
