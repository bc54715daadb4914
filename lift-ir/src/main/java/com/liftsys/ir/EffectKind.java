package com.liftsys.ir;

/**
 * Effect 种类（封闭集合，新增种类需要所有分析器显式处理）
 */
public enum EffectKind {
    ASSIGNMENT("assignment"),
    LOOP("loop"),
    CONDITIONAL("conditional"),
    CALL("call"),
    RETURN("return"),
    OTHER("other");

    private final String tag;

    EffectKind(String tag) {
        this.tag = tag;
    }

    /** JSON 中使用的小写标签 */
    public String getTag() { return tag; }

    /** 是否开启一个分支作用域（循环体 / 条件分支） */
    public boolean isBlockOpener() {
        return this == LOOP || this == CONDITIONAL;
    }

    /**
     * 按标签查找，大小写不敏感。
     *
     * @return 匹配的种类，未识别返回 null
     */
    public static EffectKind fromTag(String tag) {
        if (tag == null) return null;
        String t = tag.trim();
        for (EffectKind kind : values()) {
            if (kind.tag.equalsIgnoreCase(t)) return kind;
        }
        return null;
    }
}
