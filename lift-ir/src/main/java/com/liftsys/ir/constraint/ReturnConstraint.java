package com.liftsys.ir.constraint;

import java.util.Objects;

/**
 * 返回约束：计算出的值必须被显式返回
 */
public final class ReturnConstraint extends Constraint {

    public static final String TYPE_TAG = "return_constraint";

    private final boolean mustReturn;
    private final String valueName;

    public ReturnConstraint(boolean mustReturn) {
        this(mustReturn, null, null);
    }

    public ReturnConstraint(boolean mustReturn, String valueName, String description) {
        super(description);
        this.mustReturn = mustReturn;
        this.valueName = valueName;
    }

    public boolean isMustReturn() { return mustReturn; }

    /** 需要返回的值名称，可为 null */
    public String getValueName() { return valueName; }

    @Override
    public String getTypeTag() { return TYPE_TAG; }

    @Override
    public <R, C> R accept(ConstraintVisitor<R, C> visitor, C context) {
        return visitor.visitReturn(this, context);
    }

    @Override
    protected String defaultDescription() {
        if (!mustReturn) return "函数可以不返回值";
        return valueName != null
                ? "函数必须显式返回 '" + valueName + "'"
                : "函数必须在所有路径上显式返回值";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReturnConstraint)) return false;
        ReturnConstraint other = (ReturnConstraint) o;
        return mustReturn == other.mustReturn
                && Objects.equals(valueName, other.valueName)
                && getDescription().equals(other.getDescription());
    }

    @Override
    public int hashCode() {
        return Objects.hash(TYPE_TAG, mustReturn, valueName, getDescription());
    }
}
