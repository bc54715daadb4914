package com.liftsys.compiler.verify;

import com.liftsys.ir.constraint.Constraint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 生成代码的约束校验报告
 */
public final class VerificationReport {

    private final boolean compiles;
    private final List<ConstraintResult> results;
    private final String parseError;

    public VerificationReport(boolean compiles, List<ConstraintResult> results, String parseError) {
        this.compiles = compiles;
        this.results = Collections.unmodifiableList(new ArrayList<>(results));
        this.parseError = parseError;
    }

    /**
     * 源码能否被大纲解析器接受：结构合法且没有明显不完整的语句。
     * 不检查表达式内部语法，也不执行代码。
     */
    public boolean isCompiles() { return compiles; }

    /** 每个声明的约束一条结果，按声明顺序 */
    public List<ConstraintResult> getResults() { return results; }

    /** 解析失败的原因；可解析时为 null */
    public String getParseError() { return parseError; }

    public int getSatisfiedCount() {
        int count = 0;
        for (ConstraintResult r : results) {
            if (r.isPassed()) count++;
        }
        return count;
    }

    public boolean allPassed() {
        return compiles && getSatisfiedCount() == results.size();
    }

    /** 约束 → 是否通过；相等的约束以最后一条为准 */
    public Map<Constraint, Boolean> asMap() {
        Map<Constraint, Boolean> map = new LinkedHashMap<>();
        for (ConstraintResult r : results) {
            map.put(r.getConstraint(), r.isPassed());
        }
        return map;
    }

    public List<ConstraintResult> getFailures() {
        List<ConstraintResult> failures = new ArrayList<>();
        for (ConstraintResult r : results) {
            if (!r.isPassed()) failures.add(r);
        }
        return failures;
    }

    @Override
    public String toString() {
        return "VerificationReport{compiles=" + compiles + ", satisfied=" + getSatisfiedCount()
                + "/" + results.size() + "}";
    }
}
