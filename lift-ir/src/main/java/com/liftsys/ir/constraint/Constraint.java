package com.liftsys.ir.constraint;

/**
 * 声明式约束基类。
 *
 * <p>约束集合是封闭的：构造器仅包内可见，所有分析器通过
 * {@link ConstraintVisitor} 穷举处理。约束既用于检查 IR 的完整性，
 * 也用于检查生成代码是否保留了该约束。</p>
 */
public abstract class Constraint {

    private final String description;

    Constraint(String description) {
        this.description = description;
    }

    /** JSON 类型标签 */
    public abstract String getTypeTag();

    public abstract <R, C> R accept(ConstraintVisitor<R, C> visitor, C context);

    /** 缺省描述（未显式给出描述时使用） */
    protected abstract String defaultDescription();

    public String getDescription() {
        return description != null && !description.trim().isEmpty() ? description : defaultDescription();
    }

    /** 是否显式给出了描述（序列化时只写出显式描述） */
    public boolean hasExplicitDescription() {
        return description != null && !description.trim().isEmpty();
    }

    @Override
    public String toString() {
        return getTypeTag() + "(" + getDescription() + ")";
    }
}
