package com.liftsys.ir.constraint;

import java.util.Objects;

/**
 * 循环行为约束：规定循环是命中即返回，还是遍历后聚合返回。
 *
 * <p>{@code earlyReturn} 只对 {@link LoopPattern#FIRST_MATCH} 有意义；
 * LAST_MATCH / ALL_MATCHES 总是要求完整遍历。</p>
 */
public final class LoopBehaviorConstraint extends Constraint {

    public static final String TYPE_TAG = "loop_constraint";

    private final LoopPattern pattern;
    private final boolean earlyReturn;
    private final String loopVariable;

    public LoopBehaviorConstraint(LoopPattern pattern, boolean earlyReturn) {
        this(pattern, earlyReturn, null, null);
    }

    public LoopBehaviorConstraint(LoopPattern pattern, boolean earlyReturn, String loopVariable, String description) {
        super(description);
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.earlyReturn = earlyReturn;
        this.loopVariable = loopVariable;
    }

    public LoopPattern getPattern() { return pattern; }
    public boolean isEarlyReturn() { return earlyReturn; }
    public String getLoopVariable() { return loopVariable; }

    /** 是否要求循环体内提前返回 */
    public boolean requiresEarlyReturn() {
        return pattern == LoopPattern.FIRST_MATCH && earlyReturn;
    }

    @Override
    public String getTypeTag() { return TYPE_TAG; }

    @Override
    public <R, C> R accept(ConstraintVisitor<R, C> visitor, C context) {
        return visitor.visitLoopBehavior(this, context);
    }

    @Override
    protected String defaultDescription() {
        switch (pattern) {
            case FIRST_MATCH:
                return earlyReturn
                        ? "循环必须在第一次命中时立即返回（不能继续遍历到最后）"
                        : "循环查找第一个命中";
            case LAST_MATCH:
                return "循环必须遍历到结束后返回最后一个命中";
            default:
                return "循环必须遍历到结束后返回全部命中";
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LoopBehaviorConstraint)) return false;
        LoopBehaviorConstraint other = (LoopBehaviorConstraint) o;
        return pattern == other.pattern
                && earlyReturn == other.earlyReturn
                && Objects.equals(loopVariable, other.loopVariable)
                && getDescription().equals(other.getDescription());
    }

    @Override
    public int hashCode() {
        return Objects.hash(TYPE_TAG, pattern, earlyReturn, loopVariable, getDescription());
    }
}
