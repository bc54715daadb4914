package com.liftsys.compiler.verify;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 大纲中的一条逻辑语句；复合语句带有子语句体
 */
public final class Statement {

    private final StatementKind kind;
    private final String text;
    private final int indent;
    private final int line;
    private final List<Statement> body = new ArrayList<>();

    Statement(StatementKind kind, String text, int indent, int line) {
        this.kind = kind;
        this.text = text;
        this.indent = indent;
        this.line = line;
    }

    public StatementKind getKind() { return kind; }
    /** 去掉注释、续行合并后的语句文本 */
    public String getText() { return text; }
    public int getIndent() { return indent; }
    /** 起始行号（从 1 开始） */
    public int getLine() { return line; }
    public List<Statement> getBody() { return Collections.unmodifiableList(body); }

    void addChild(Statement child) {
        body.add(child);
    }

    /** 语句体的最后一行（含嵌套） */
    public int getEndLine() {
        return body.isEmpty() ? line : body.get(body.size() - 1).getEndLine();
    }

    /** return 是否带有值（{@code return} 与 {@code return None} 不算） */
    public boolean isValueReturn() {
        if (kind != StatementKind.RETURN) return false;
        String value = text.substring("return".length()).trim();
        return !value.isEmpty() && !"None".equals(value);
    }

    /** 前序遍历的子树（含自身），不进入嵌套的 def/class */
    public List<Statement> subtree() {
        List<Statement> out = new ArrayList<>();
        collect(this, out, true);
        return out;
    }

    static void collect(Statement s, List<Statement> out, boolean root) {
        out.add(s);
        if (!root && (s.kind == StatementKind.DEF || s.kind == StatementKind.CLASS)) return;
        for (Statement child : s.body) {
            collect(child, out, false);
        }
    }

    @Override
    public String toString() {
        return line + ": " + kind + " " + text;
    }
}
