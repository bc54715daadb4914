package com.liftsys.compiler.verify;

import java.util.HashMap;
import java.util.Map;

/**
 * 语句种类，由首个关键字决定
 */
public enum StatementKind {
    DEF("def", true),
    CLASS("class", true),
    IF("if", true),
    ELIF("elif", true),
    ELSE("else", true),
    FOR("for", true),
    WHILE("while", true),
    TRY("try", true),
    EXCEPT("except", true),
    FINALLY("finally", true),
    WITH("with", true),
    MATCH("match", true),
    CASE("case", true),
    RETURN("return", false),
    RAISE("raise", false),
    BREAK("break", false),
    CONTINUE("continue", false),
    PASS("pass", false),
    SIMPLE(null, false);

    private static final Map<String, StatementKind> BY_KEYWORD = new HashMap<>();

    static {
        for (StatementKind k : values()) {
            if (k.keyword != null) BY_KEYWORD.put(k.keyword, k);
        }
    }

    private final String keyword;
    private final boolean compound;

    StatementKind(String keyword, boolean compound) {
        this.keyword = keyword;
        this.compound = compound;
    }

    public String getKeyword() { return keyword; }

    /** 复合语句：以冒号结束头部并带缩进体 */
    public boolean isCompound() { return compound; }

    public boolean isLoop() {
        return this == FOR || this == WHILE;
    }

    /**
     * 按语句文本归类。{@code async def/for/with} 与对应的同步形式同类。
     */
    public static StatementKind classify(String text) {
        String t = text;
        if (t.startsWith("async ")) t = t.substring(6).trim();
        int end = 0;
        while (end < t.length() && (Character.isLetter(t.charAt(end)) || t.charAt(end) == '_')) end++;
        StatementKind kind = BY_KEYWORD.get(t.substring(0, end));
        if (kind == null) return SIMPLE;
        // match/case 是软关键字：只有以冒号结尾时才是语句头
        if ((kind == MATCH || kind == CASE) && !t.endsWith(":")) return SIMPLE;
        return kind;
    }
}
