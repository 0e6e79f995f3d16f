package com.cpp2c.transformer.analysis;

import java.util.Objects;

/**
 * Outcome of the decision procedure for one expansion site: either transformable with
 * a strategy and the structural key of the function to generate, or rejected with a
 * reason and a human readable detail.
 */
public final class Verdict {

    private final TransformationStrategy strategy;
    private final String definitionKey;
    private final RejectionReason reason;
    private final String detail;

    private Verdict(TransformationStrategy strategy, String definitionKey, RejectionReason reason, String detail) {
        this.strategy = strategy;
        this.definitionKey = definitionKey;
        this.reason = reason;
        this.detail = detail;
    }

    public static Verdict transformable(TransformationStrategy strategy, String definitionKey) {
        return new Verdict(Objects.requireNonNull(strategy), Objects.requireNonNull(definitionKey), null, null);
    }

    public static Verdict notTransformable(RejectionReason reason, String detail) {
        return new Verdict(null, null, Objects.requireNonNull(reason), detail == null ? "" : detail);
    }

    public boolean isTransformable() {
        return strategy != null;
    }

    /** @throws IllegalStateException on a rejection */
    public TransformationStrategy strategy() {
        if (strategy == null) throw new IllegalStateException("Rejected verdict has no strategy: " + this);
        return strategy;
    }

    /** @throws IllegalStateException on a rejection */
    public String definitionKey() {
        if (definitionKey == null) throw new IllegalStateException("Rejected verdict has no definition key: " + this);
        return definitionKey;
    }

    /** @throws IllegalStateException on a transformable verdict */
    public RejectionReason reason() {
        if (reason == null) throw new IllegalStateException("Transformable verdict has no rejection reason");
        return reason;
    }

    public String detail() {
        return detail == null ? "" : detail;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Verdict)) return false;
        Verdict v = (Verdict) o;
        return strategy == v.strategy && reason == v.reason
                && Objects.equals(definitionKey, v.definitionKey)
                && Objects.equals(detail, v.detail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(strategy, definitionKey, reason, detail);
    }

    @Override
    public String toString() {
        if (isTransformable()) return "Transformable(" + strategy + ", " + definitionKey + ")";
        return "NotTransformable(" + reason.code + (detail.isEmpty() ? "" : ": " + detail) + ")";
    }
}
