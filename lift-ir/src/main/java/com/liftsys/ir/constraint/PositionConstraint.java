package com.liftsys.ir.constraint;

import java.util.Objects;

/**
 * 位置约束：两个主体 (A, B) 在代码中是否相邻
 */
public final class PositionConstraint extends Constraint {

    public static final String TYPE_TAG = "position_constraint";

    private final PositionRelation relation;
    private final String first;
    private final String second;

    public PositionConstraint(PositionRelation relation, String first, String second) {
        this(relation, first, second, null);
    }

    public PositionConstraint(PositionRelation relation, String first, String second, String description) {
        super(description);
        this.relation = Objects.requireNonNull(relation, "relation");
        this.first = requireSubject(first, "first");
        this.second = requireSubject(second, "second");
    }

    private static String requireSubject(String subject, String what) {
        if (subject == null || subject.isEmpty()) {
            throw new IllegalArgumentException("位置约束的主体 " + what + " 不能为空");
        }
        return subject;
    }

    public PositionRelation getRelation() { return relation; }
    public String getFirst() { return first; }
    public String getSecond() { return second; }

    @Override
    public String getTypeTag() { return TYPE_TAG; }

    @Override
    public <R, C> R accept(ConstraintVisitor<R, C> visitor, C context) {
        return visitor.visitPosition(this, context);
    }

    @Override
    protected String defaultDescription() {
        return relation == PositionRelation.ADJACENT
                ? "'" + first + "' 与 '" + second + "' 必须相邻"
                : "'" + first + "' 与 '" + second + "' 不能相邻";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PositionConstraint)) return false;
        PositionConstraint other = (PositionConstraint) o;
        return relation == other.relation
                && first.equals(other.first)
                && second.equals(other.second)
                && getDescription().equals(other.getDescription());
    }

    @Override
    public int hashCode() {
        return Objects.hash(TYPE_TAG, relation, first, second, getDescription());
    }
}
