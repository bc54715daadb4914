package com.liftsys.compiler.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * IR 解释结果：去重后的问题列表、执行轨迹与生成闸门决策。
 */
public final class InterpretationResult {

    private final List<SemanticIssue> issues;
    private final ExecutionTrace trace;
    private final boolean shouldGenerate;

    public InterpretationResult(List<SemanticIssue> issues, ExecutionTrace trace) {
        this.issues = Collections.unmodifiableList(new ArrayList<>(issues));
        this.trace = trace;
        boolean blocked = false;
        for (SemanticIssue issue : issues) {
            if (issue.isError()) {
                blocked = true;
                break;
            }
        }
        this.shouldGenerate = !blocked;
    }

    /** 按分析器执行顺序、再按位置排列 */
    public List<SemanticIssue> getIssues() { return issues; }
    public ExecutionTrace getTrace() { return trace; }

    /** 无 ERROR 时才允许进入代码生成 */
    public boolean isShouldGenerate() { return shouldGenerate; }

    public List<SemanticIssue> getErrors() {
        return filter(SemanticIssue.Severity.ERROR);
    }

    public List<SemanticIssue> getWarnings() {
        return filter(SemanticIssue.Severity.WARNING);
    }

    public boolean hasErrors() {
        return !shouldGenerate;
    }

    private List<SemanticIssue> filter(SemanticIssue.Severity severity) {
        List<SemanticIssue> result = new ArrayList<>();
        for (SemanticIssue issue : issues) {
            if (issue.getSeverity() == severity) result.add(issue);
        }
        return result;
    }

    /** 多行摘要 */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append(shouldGenerate ? "可以生成" : "已阻断生成")
                .append(": ").append(getErrors().size()).append(" 个错误, ")
                .append(getWarnings().size()).append(" 个警告");
        for (SemanticIssue issue : issues) {
            sb.append("\n  ").append(issue);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "InterpretationResult{shouldGenerate=" + shouldGenerate + ", issues=" + issues.size() + "}";
    }
}
