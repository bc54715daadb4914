package com.liftsys.compiler.synthesis;

import com.liftsys.compiler.verify.ConstraintResult;
import com.liftsys.compiler.verify.VerificationReport;
import com.liftsys.ir.constraint.Constraint;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 一次合成尝试得到的候选代码及其校验结果
 */
public final class GeneratedCandidate {

    private final int index;
    private final String sourceText;
    private final VerificationReport report;
    private final double score;

    public GeneratedCandidate(int index, String sourceText, VerificationReport report) {
        this.index = index;
        this.sourceText = Objects.requireNonNull(sourceText, "sourceText");
        this.report = Objects.requireNonNull(report, "report");
        this.score = CandidateScorer.score(report);
    }

    /** 在本批候选中的下标，供调用方按先到者打破平局 */
    public int getIndex() { return index; }
    public String getSourceText() { return sourceText; }
    public VerificationReport getReport() { return report; }
    public double getScore() { return score; }

    public boolean isCompiles() {
        return report.isCompiles();
    }

    public Map<Constraint, Boolean> getConstraintResults() {
        return report.asMap();
    }

    public List<ConstraintResult> getResults() {
        return report.getResults();
    }

    @Override
    public String toString() {
        return "GeneratedCandidate{#" + index + ", compiles=" + isCompiles() + ", score=" + score + "}";
    }
}
