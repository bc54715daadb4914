package com.liftsys.compiler.verify;

import com.liftsys.ir.constraint.Constraint;

import java.util.Objects;

/**
 * 单个约束的校验结果
 */
public final class ConstraintResult {

    private final Constraint constraint;
    private final boolean passed;
    private final String detail;

    public ConstraintResult(Constraint constraint, boolean passed, String detail) {
        this.constraint = Objects.requireNonNull(constraint, "constraint");
        this.passed = passed;
        this.detail = detail;
    }

    public static ConstraintResult pass(Constraint constraint, String detail) {
        return new ConstraintResult(constraint, true, detail);
    }

    public static ConstraintResult fail(Constraint constraint, String detail) {
        return new ConstraintResult(constraint, false, detail);
    }

    public Constraint getConstraint() { return constraint; }
    public boolean isPassed() { return passed; }
    public String getDetail() { return detail; }

    @Override
    public String toString() {
        return (passed ? "PASS " : "FAIL ") + constraint.getTypeTag() + ": " + detail;
    }
}
