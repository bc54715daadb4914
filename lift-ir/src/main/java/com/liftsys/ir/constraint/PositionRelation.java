package com.liftsys.ir.constraint;

/**
 * 两个主体之间的位置关系
 */
public enum PositionRelation {
    ADJACENT,
    NOT_ADJACENT;

    public static PositionRelation fromName(String name) {
        if (name == null) return null;
        for (PositionRelation r : values()) {
            if (r.name().equalsIgnoreCase(name.trim())) return r;
        }
        return null;
    }
}
