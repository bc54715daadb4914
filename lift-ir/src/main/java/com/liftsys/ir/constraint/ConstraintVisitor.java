package com.liftsys.ir.constraint;

/**
 * 约束访问者接口，每种约束一个 visit 方法。
 *
 * @param <R> 返回类型
 * @param <C> 上下文类型
 */
public interface ConstraintVisitor<R, C> {
    R visitReturn(ReturnConstraint constraint, C context);
    R visitLoopBehavior(LoopBehaviorConstraint constraint, C context);
    R visitPosition(PositionConstraint constraint, C context);
    R visitType(TypeConstraint constraint, C context);
}
