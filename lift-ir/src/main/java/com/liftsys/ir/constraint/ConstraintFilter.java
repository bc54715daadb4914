package com.liftsys.ir.constraint;

import com.liftsys.ir.Effect;
import com.liftsys.ir.EffectKind;
import com.liftsys.ir.IntermediateRepresentation;

import java.util.ArrayList;
import java.util.List;

/**
 * 约束适用性过滤：只保留对给定 IR 有意义的约束。
 *
 * <ul>
 *   <li>ReturnConstraint、TypeConstraint：总是适用</li>
 *   <li>LoopBehaviorConstraint：IR 中存在 loop Effect 时才适用</li>
 *   <li>PositionConstraint：两个主体都是代码实体（而非描述性短语）时才适用</li>
 * </ul>
 * <p>不适用的约束既不参与语义检查，也不参与生成代码的校验与评分。</p>
 */
public final class ConstraintFilter {

    /** 超过该长度的主体视为描述性短语 */
    static final int MAX_ENTITY_LENGTH = 20;

    private ConstraintFilter() {}

    /** IR 上全部适用的约束，保持声明顺序 */
    public static List<Constraint> applicable(IntermediateRepresentation ir) {
        List<Constraint> result = new ArrayList<>();
        for (Constraint c : ir.getConstraints()) {
            if (isApplicable(ir, c)) result.add(c);
        }
        return result;
    }

    /** 按类型取适用的约束 */
    public static <T extends Constraint> List<T> applicable(IntermediateRepresentation ir, Class<T> type) {
        List<T> result = new ArrayList<>();
        for (Constraint c : ir.getConstraints()) {
            if (type.isInstance(c) && isApplicable(ir, c)) result.add(type.cast(c));
        }
        return result;
    }

    public static boolean isApplicable(final IntermediateRepresentation ir, Constraint constraint) {
        return constraint.accept(new ConstraintVisitor<Boolean, Void>() {
            @Override
            public Boolean visitReturn(ReturnConstraint c, Void unused) {
                return true;
            }

            @Override
            public Boolean visitLoopBehavior(LoopBehaviorConstraint c, Void unused) {
                return hasLoop(ir);
            }

            @Override
            public Boolean visitPosition(PositionConstraint c, Void unused) {
                return isCodeEntity(c.getFirst()) && isCodeEntity(c.getSecond());
            }

            @Override
            public Boolean visitType(TypeConstraint c, Void unused) {
                return true;
            }
        }, null);
    }

    /**
     * 主体是否像代码实体（变量名、运算符、关键字）：
     * 非空、不含空白且不超过 {@value #MAX_ENTITY_LENGTH} 个字符。
     */
    public static boolean isCodeEntity(String subject) {
        if (subject == null || subject.isEmpty()) return false;
        for (int i = 0; i < subject.length(); i++) {
            if (Character.isWhitespace(subject.charAt(i))) return false;
        }
        return subject.length() <= MAX_ENTITY_LENGTH;
    }

    private static boolean hasLoop(IntermediateRepresentation ir) {
        for (Effect e : ir.getEffects()) {
            if (e.getKind() == EffectKind.LOOP) return true;
        }
        return false;
    }
}
