package com.liftsys.compiler.synthesis;

import com.liftsys.compiler.analysis.InterpretationResult;

/**
 * 合成结果：要么被语义校验阻断，要么得到一个候选
 */
public final class SynthesisOutcome {

    private final InterpretationResult interpretation;
    private final GeneratedCandidate candidate;

    private SynthesisOutcome(InterpretationResult interpretation, GeneratedCandidate candidate) {
        this.interpretation = interpretation;
        this.candidate = candidate;
    }

    public static SynthesisOutcome blocked(InterpretationResult interpretation) {
        return new SynthesisOutcome(interpretation, null);
    }

    public static SynthesisOutcome generated(InterpretationResult interpretation, GeneratedCandidate candidate) {
        return new SynthesisOutcome(interpretation, candidate);
    }

    public boolean isBlocked() {
        return candidate == null;
    }

    public InterpretationResult getInterpretation() { return interpretation; }

    /** 被阻断时为 null */
    public GeneratedCandidate getCandidate() { return candidate; }
}
