package com.liftsys.compiler.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Effect 链分析结果：执行轨迹 + 链分析器自身发现的问题
 */
public final class ChainAnalysis {

    private final ExecutionTrace trace;
    private final List<SemanticIssue> issues;

    public ChainAnalysis(ExecutionTrace trace, List<SemanticIssue> issues) {
        this.trace = trace;
        this.issues = Collections.unmodifiableList(new ArrayList<>(issues));
    }

    public ExecutionTrace getTrace() { return trace; }
    public List<SemanticIssue> getIssues() { return issues; }
}
