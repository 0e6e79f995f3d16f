package com.cpp2c.transformer.emit;

import com.cpp2c.transformer.ast.SourceLocation;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One append-only record. Which optional fields are set depends on {@link #kind}:
 *
 *   MACRO_DEFINITION         location
 *   MACRO_EXPANSION          location
 *   TRANSFORMED_DEFINITION   signature, emittedName
 *   TRANSFORMED_EXPANSION    location, enclosingDeclaration, emittedName
 *   UNTRANSFORMED_EXPANSION  location, enclosingDeclaration, category, reason
 */
public final class Fact {
    public final FactKind kind;
    public final String macroHash;
    public final SourceLocation location;
    public final String enclosingDeclaration;
    public final String category;
    public final String reason;
    public final String signature;
    public final String emittedName;

    private Fact(FactKind kind, String macroHash, SourceLocation location, String enclosingDeclaration,
                 String category, String reason, String signature, String emittedName) {
        this.kind = Objects.requireNonNull(kind);
        this.macroHash = Objects.requireNonNull(macroHash);
        this.location = location;
        this.enclosingDeclaration = enclosingDeclaration;
        this.category = category;
        this.reason = reason;
        this.signature = signature;
        this.emittedName = emittedName;
    }

    public static Fact macroDefinition(String hash, SourceLocation definedAt) {
        return new Fact(FactKind.MACRO_DEFINITION, hash, definedAt, null, null, null, null, null);
    }

    public static Fact macroExpansion(String hash, SourceLocation spelledAt) {
        return new Fact(FactKind.MACRO_EXPANSION, hash, spelledAt, null, null, null, null, null);
    }

    public static Fact transformedDefinition(String hash, String signatureWithoutName, String emittedName) {
        return new Fact(FactKind.TRANSFORMED_DEFINITION, hash, null, null, null, null, signatureWithoutName, emittedName);
    }

    public static Fact transformedExpansion(String hash, SourceLocation spelledAt, String enclosingDeclaration, String emittedName) {
        return new Fact(FactKind.TRANSFORMED_EXPANSION, hash, spelledAt, nullToEmpty(enclosingDeclaration), null, null, null, emittedName);
    }

    public static Fact untransformedExpansion(String hash, SourceLocation spelledAt, String enclosingDeclaration,
                                              String category, String reason) {
        return new Fact(FactKind.UNTRANSFORMED_EXPANSION, hash, spelledAt, nullToEmpty(enclosingDeclaration), category, reason, null, null);
    }

    /** Only the fields that are set, in a stable order. */
    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("kind", kind.name());
        m.put("macroHash", macroHash);
        if (location != null) m.put("location", location.toString());
        if (enclosingDeclaration != null) m.put("enclosingDeclaration", enclosingDeclaration);
        if (category != null) m.put("category", category);
        if (reason != null) m.put("reason", reason);
        if (signature != null) m.put("signature", signature);
        if (emittedName != null) m.put("emittedName", emittedName);
        return m;
    }

    @Override
    public String toString() {
        return toMap().toString();
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
