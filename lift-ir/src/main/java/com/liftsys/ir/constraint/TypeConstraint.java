package com.liftsys.ir.constraint;

import java.util.Objects;

/**
 * 类型约束：函数结果必须是期望类型
 */
public final class TypeConstraint extends Constraint {

    public static final String TYPE_TAG = "type_constraint";

    private final String expectedType;

    public TypeConstraint(String expectedType) {
        this(expectedType, null);
    }

    public TypeConstraint(String expectedType, String description) {
        super(description);
        if (expectedType == null || expectedType.trim().isEmpty()) {
            throw new IllegalArgumentException("类型约束的期望类型不能为空");
        }
        this.expectedType = expectedType.trim();
    }

    public String getExpectedType() { return expectedType; }

    @Override
    public String getTypeTag() { return TYPE_TAG; }

    @Override
    public <R, C> R accept(ConstraintVisitor<R, C> visitor, C context) {
        return visitor.visitType(this, context);
    }

    @Override
    protected String defaultDescription() {
        return "结果类型必须是 '" + expectedType + "'";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeConstraint)) return false;
        TypeConstraint other = (TypeConstraint) o;
        return expectedType.equals(other.expectedType)
                && getDescription().equals(other.getDescription());
    }

    @Override
    public int hashCode() {
        return Objects.hash(TYPE_TAG, expectedType, getDescription());
    }
}
