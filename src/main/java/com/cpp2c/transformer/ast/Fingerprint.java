package com.cpp2c.transformer.ast;

import com.cpp2c.transformer.ast.Expr.Assign;
import com.cpp2c.transformer.ast.Expr.Binary;
import com.cpp2c.transformer.ast.Expr.ExprInterface;
import com.cpp2c.transformer.ast.Expr.ExprVisitor;
import com.cpp2c.transformer.ast.Expr.Invocation;
import com.cpp2c.transformer.ast.Expr.Num;
import com.cpp2c.transformer.ast.Expr.Paren;
import com.cpp2c.transformer.ast.Expr.Unary;
import com.cpp2c.transformer.ast.Expr.Var;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * MD5 fingerprints over a canonical token stream.
 *
 * - {@link #macroHash} identifies a macro definition by its content (name, shape, parameters, body).
 * - {@link #structuralKey} identifies the shape of a generated function: parameters are
 *   replaced by their position, so {@code INC(a) ((a)+1)} and {@code ADD1(x) ((x)+1)} agree.
 */
public final class Fingerprint {

    private Fingerprint() {}

    // ---------- public API (no trace) ----------

    public static String macroHash(MacroDefinition macro) {
        return macroHash(macro, null);
    }

    public static String structuralKey(List<String> params, ExprInterface body) {
        return structuralKey(params, body, null);
    }

    // ---------- public API (with trace) ----------

    public static String macroHash(MacroDefinition macro, FingerprintTrace trace) {
        MessageDigest md = md5();
        put(md, trace, "macro:");
        put(md, trace, macro.name);
        put(md, trace, macro.functionLike ? "(" : "#");
        for (String p : macro.parameters) {
            put(md, trace, "p:");
            put(md, trace, p);
            put(md, trace, ";");
        }
        put(md, trace, macro.functionLike ? ")" : "#");
        macro.body.accept(new Feeder(md, trace, Map.of()));
        return toHex(md.digest());
    }

    public static String structuralKey(List<String> params, ExprInterface body, FingerprintTrace trace) {
        MessageDigest md = md5();
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < params.size(); i++) positions.putIfAbsent(params.get(i), i);
        put(md, trace, "arity:");
        put(md, trace, Integer.toString(params.size()));
        put(md, trace, ";");
        body.accept(new Feeder(md, trace, positions));
        return toHex(md.digest());
    }

    // ---------------- normalized traversal ----------------

    private static final class Feeder implements ExprVisitor<Void> {
        private final MessageDigest md;
        private final FingerprintTrace trace;
        private final Map<String, Integer> positions;

        Feeder(MessageDigest md, FingerprintTrace trace, Map<String, Integer> positions) {
            this.md = md;
            this.trace = trace;
            this.positions = positions;
        }

        @Override
        public Void visitNumExpr(Num expr) {
            put(md, trace, "n:");
            put(md, trace, Long.toString(expr.value));
            return null;
        }

        @Override
        public Void visitVarExpr(Var expr) {
            name(expr.name);
            return null;
        }

        @Override
        public Void visitParenExpr(Paren expr) {
            put(md, trace, "(");
            expr.inner.accept(this);
            put(md, trace, ")");
            return null;
        }

        @Override
        public Void visitUnaryExpr(Unary expr) {
            put(md, trace, "u:");
            put(md, trace, expr.operator.name());
            put(md, trace, "[");
            expr.operand.accept(this);
            put(md, trace, "]");
            return null;
        }

        @Override
        public Void visitBinaryExpr(Binary expr) {
            put(md, trace, "b:");
            put(md, trace, expr.operator.name());
            put(md, trace, "[");
            expr.left.accept(this);
            put(md, trace, ",");
            expr.right.accept(this);
            put(md, trace, "]");
            return null;
        }

        @Override
        public Void visitAssignExpr(Assign expr) {
            put(md, trace, "a:");
            name(expr.name);
            put(md, trace, "[");
            expr.value.accept(this);
            put(md, trace, "]");
            return null;
        }

        @Override
        public Void visitInvocationExpr(Invocation expr) {
            put(md, trace, "c:");
            put(md, trace, expr.name);
            put(md, trace, "[");
            for (int i = 0; i < expr.arguments.size(); i++) {
                put(md, trace, "i:");
                put(md, trace, Integer.toString(i));
                put(md, trace, "=");
                expr.arguments.get(i).accept(this);
                put(md, trace, ";");
            }
            put(md, trace, "]");
            return null;
        }

        private void name(String n) {
            Integer pos = positions.get(n);
            if (pos != null) {
                put(md, trace, "$");
                put(md, trace, Integer.toString(pos));
            } else {
                put(md, trace, "v:");
                put(md, trace, n);
            }
        }
    }

    // ---------------- digest helpers ----------------

    private static MessageDigest md5() {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    private static void put(MessageDigest md, FingerprintTrace trace, String token) {
        if (trace != null) trace.step(token);
        byte[] b = token.getBytes(StandardCharsets.UTF_8);
        // length prefix keeps adjacent tokens from merging
        md.update((byte) (b.length >>> 8));
        md.update((byte) b.length);
        md.update(b);
    }

    private static String toHex(byte[] bytes) {
        final char[] HEX = "0123456789abcdef".toCharArray();
        char[] out = new char[bytes.length * 2];
        int j = 0;
        for (byte bb : bytes) {
            int v = bb & 0xFF;
            out[j++] = HEX[v >>> 4];
            out[j++] = HEX[v & 0x0F];
        }
        return new String(out);
    }
}
