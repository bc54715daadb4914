package com.liftsys.compiler.verify;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 源码的语句大纲：按缩进还原的语句树
 */
public final class SourceOutline {

    private final List<Statement> statements;

    SourceOutline(List<Statement> statements) {
        this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
    }

    public List<Statement> getStatements() { return statements; }

    /** 第一个函数定义（前序，可位于类体内），没有时返回 null */
    public Statement findFunction() {
        return findFunction(statements);
    }

    private static Statement findFunction(List<Statement> sequence) {
        for (Statement s : sequence) {
            if (s.getKind() == StatementKind.DEF) return s;
            Statement nested = findFunction(s.getBody());
            if (nested != null) return nested;
        }
        return null;
    }

    /** 第一个函数的函数体；源码只是片段时返回顶层语句 */
    public List<Statement> functionBody() {
        Statement def = findFunction();
        return def != null ? def.getBody() : statements;
    }

    /**
     * 第一个函数头上的 {@code -> T} 返回注解，没有时返回 null
     */
    public String getReturnAnnotation() {
        Statement def = findFunction();
        if (def == null) return null;
        String header = def.getText();
        int close = header.lastIndexOf(')');
        int arrow = header.indexOf("->", Math.max(close, 0));
        if (arrow < 0) return null;
        String annotation = header.substring(arrow + 2).trim();
        if (annotation.endsWith(":")) annotation = annotation.substring(0, annotation.length() - 1).trim();
        return annotation.isEmpty() ? null : annotation;
    }

    /** 前序展开语句序列，不进入嵌套的 def/class */
    public static List<Statement> flatten(List<Statement> sequence) {
        List<Statement> out = new ArrayList<>();
        for (Statement s : sequence) {
            Statement.collect(s, out, false);
        }
        return out;
    }
}
