package com.liftsys.compiler.analysis;

import java.util.Objects;

/**
 * 符号值：参数或 Effect 计算出的命名值
 */
public final class SymbolicValue {

    /** 参数的来源位置 */
    public static final int PARAMETER = -1;

    private final String name;
    private final String type;
    private final int origin;

    public SymbolicValue(String name, String type, int origin) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = type;
        this.origin = origin;
    }

    public String getName() { return name; }
    /** 声明类型，未知为 null */
    public String getType() { return type; }
    /** 产生该值的 Effect 位置，参数为 {@link #PARAMETER} */
    public int getOrigin() { return origin; }

    public boolean isParameter() {
        return origin == PARAMETER;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SymbolicValue)) return false;
        SymbolicValue other = (SymbolicValue) o;
        return origin == other.origin && name.equals(other.name) && Objects.equals(type, other.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, origin);
    }

    @Override
    public String toString() {
        return name + (type != null ? ":" + type : "") + (isParameter() ? "<param>" : "@" + origin);
    }
}
