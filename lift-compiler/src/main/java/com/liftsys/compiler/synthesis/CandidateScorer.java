package com.liftsys.compiler.synthesis;

import com.liftsys.compiler.verify.VerificationReport;

/**
 * 候选评分：可解析时为满足的约束数 / 约束总数，否则为 0。
 * 没有声明任何约束且可解析时记满分。
 */
public final class CandidateScorer {

    private CandidateScorer() {}

    public static double score(VerificationReport report) {
        if (!report.isCompiles()) return 0.0;
        int total = report.getResults().size();
        if (total == 0) return 1.0;
        return (double) report.getSatisfiedCount() / total;
    }

    public static double score(GeneratedCandidate candidate) {
        return score(candidate.getReport());
    }
}
