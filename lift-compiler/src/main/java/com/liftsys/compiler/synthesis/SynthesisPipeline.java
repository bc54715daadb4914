package com.liftsys.compiler.synthesis;

import com.liftsys.compiler.analysis.InterpretationResult;
import com.liftsys.compiler.analysis.IrInterpreter;
import com.liftsys.compiler.assembly.CodeAssembler;
import com.liftsys.compiler.assembly.Fragment;
import com.liftsys.compiler.assembly.StructureNode;
import com.liftsys.compiler.verify.ConstraintVerifier;
import com.liftsys.compiler.verify.VerificationReport;
import com.liftsys.ir.IntermediateRepresentation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.logging.Logger;

/**
 * 校验 → 组装 → 验证 管线。
 * 串联完整流程：IR 解释（闸门）→ 代码组装 → 约束校验 → 评分。
 *
 * <p>所有组件都是无状态的纯函数，同一管线可被多个线程同时使用。</p>
 */
public class SynthesisPipeline {

    private static final Logger LOG = Logger.getLogger(SynthesisPipeline.class.getName());

    private final IrInterpreter interpreter;
    private final CodeAssembler assembler;
    private final ConstraintVerifier verifier;

    public SynthesisPipeline(IrInterpreter interpreter, CodeAssembler assembler, ConstraintVerifier verifier) {
        this.interpreter = interpreter;
        this.assembler = assembler;
        this.verifier = verifier;
    }

    /**
     * 创建默认管线。
     */
    public static SynthesisPipeline createDefault() {
        return new SynthesisPipeline(IrInterpreter.createDefault(), new CodeAssembler(), new ConstraintVerifier());
    }

    public InterpretationResult interpret(IntermediateRepresentation ir) {
        return interpreter.interpret(ir);
    }

    public SynthesisOutcome synthesize(IntermediateRepresentation ir, StructureNode tree, Map<String, Fragment> fragments) {
        return synthesize(ir, new CandidateInput(tree, fragments));
    }

    /**
     * 先过语义闸门，通过后组装并校验一份候选。
     */
    public SynthesisOutcome synthesize(IntermediateRepresentation ir, CandidateInput input) {
        InterpretationResult interpretation = interpreter.interpret(ir);
        if (!interpretation.isShouldGenerate()) {
            LOG.info(ir.getSignature().getName() + ": 语义校验未通过，跳过生成\n" + interpretation.describe());
            return SynthesisOutcome.blocked(interpretation);
        }
        return SynthesisOutcome.generated(interpretation, evaluate(ir, input, 0));
    }

    /** 组装并校验单个候选，不经过语义闸门；只校验对该 IR 适用的约束 */
    public GeneratedCandidate evaluate(IntermediateRepresentation ir, CandidateInput input, int index) {
        String source = input.getSkeleton() != null
                ? assembler.assembleFunction(input.getSkeleton(), input.getStructure(), input.getFragments())
                : assembler.assemble(input.getStructure(), input.getFragments());
        VerificationReport report = verifier.verify(source, ir);
        return new GeneratedCandidate(index, source, report);
    }

    /**
     * 在调用方提供的线程池上并行评估多份候选，结果按输入顺序返回。
     *
     * @throws IllegalStateException IR 未通过语义校验，或等待期间线程被中断
     */
    public List<GeneratedCandidate> evaluateCandidates(final IntermediateRepresentation ir,
                                                       List<CandidateInput> inputs,
                                                       ExecutorService executor) {
        InterpretationResult interpretation = interpreter.interpret(ir);
        if (!interpretation.isShouldGenerate()) {
            LOG.info(ir.getSignature().getName() + ": 语义校验未通过，拒绝评估候选");
            throw new IllegalStateException("IR 未通过语义校验: " + interpretation.getErrors());
        }

        List<Future<GeneratedCandidate>> futures = new ArrayList<>(inputs.size());
        for (int i = 0; i < inputs.size(); i++) {
            final CandidateInput input = inputs.get(i);
            final int index = i;
            futures.add(executor.submit(new Callable<GeneratedCandidate>() {
                @Override
                public GeneratedCandidate call() {
                    return evaluate(ir, input, index);
                }
            }));
        }

        List<GeneratedCandidate> candidates = new ArrayList<>(futures.size());
        for (Future<GeneratedCandidate> future : futures) {
            try {
                candidates.add(future.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("候选评估被中断", e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException) throw (RuntimeException) cause;
                if (cause instanceof Error) throw (Error) cause;
                throw new IllegalStateException("候选评估失败", cause);
            }
        }
        LOG.fine(ir.getSignature().getName() + ": 评估了 " + candidates.size() + " 份候选");
        return candidates;
    }
}
