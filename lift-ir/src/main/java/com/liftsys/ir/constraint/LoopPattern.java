package com.liftsys.ir.constraint;

/**
 * 循环搜索模式
 */
public enum LoopPattern {
    /** 命中第一个即返回 */
    FIRST_MATCH,
    /** 遍历结束后返回最后一个命中 */
    LAST_MATCH,
    /** 遍历结束后返回全部命中 */
    ALL_MATCHES;

    /** 该模式是否要求完整遍历（结果在循环之后聚合返回） */
    public boolean requiresFullIteration() {
        return this != FIRST_MATCH;
    }

    public static LoopPattern fromName(String name) {
        if (name == null) return null;
        for (LoopPattern p : values()) {
            if (p.name().equalsIgnoreCase(name.trim())) return p;
        }
        return null;
    }
}
