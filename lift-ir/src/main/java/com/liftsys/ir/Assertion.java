package com.liftsys.ir;

import java.util.Objects;

/**
 * 关于输入/输出的布尔断言
 */
public final class Assertion {
    private final String predicate;
    private final String rationale;

    public Assertion(String predicate) {
        this(predicate, null);
    }

    public Assertion(String predicate, String rationale) {
        this.predicate = Objects.requireNonNull(predicate, "predicate");
        this.rationale = rationale;
    }

    public String getPredicate() { return predicate; }
    public String getRationale() { return rationale; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Assertion)) return false;
        Assertion other = (Assertion) o;
        return predicate.equals(other.predicate) && Objects.equals(rationale, other.rationale);
    }

    @Override
    public int hashCode() {
        return Objects.hash(predicate, rationale);
    }

    @Override
    public String toString() {
        return predicate;
    }
}
