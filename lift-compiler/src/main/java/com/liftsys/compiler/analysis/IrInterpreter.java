package com.liftsys.compiler.analysis;

import com.liftsys.ir.IntermediateRepresentation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * IR 解释器：按固定顺序运行各项检查，合并去重后给出生成闸门决策。
 *
 * <p>无状态，可在多线程间共享；每次调用都重新构建执行轨迹。</p>
 */
public final class IrInterpreter {

    private static final Logger LOG = Logger.getLogger(IrInterpreter.class.getName());

    private final EffectChainAnalyzer chainAnalyzer;
    private final List<IrCheck> checks = new ArrayList<>();

    public IrInterpreter(EffectChainAnalyzer chainAnalyzer) {
        this.chainAnalyzer = Objects.requireNonNull(chainAnalyzer, "chainAnalyzer");
    }

    /**
     * 默认解释器：Effect 链分析 → 语义校验 → 逻辑错误检测。
     */
    public static IrInterpreter createDefault() {
        EffectChainAnalyzer chain = new EffectChainAnalyzer();
        IrInterpreter interpreter = new IrInterpreter(chain);
        interpreter.addCheck(chain);
        interpreter.addCheck(new SemanticValidator());
        interpreter.addCheck(new LogicErrorDetector());
        return interpreter;
    }

    public IrInterpreter addCheck(IrCheck check) {
        checks.add(Objects.requireNonNull(check, "check"));
        return this;
    }

    public InterpretationResult interpret(IntermediateRepresentation ir) {
        Objects.requireNonNull(ir, "ir");
        ExecutionTrace trace = chainAnalyzer.buildTrace(ir);

        // Trace dump（设置 LIFT_DUMP_TRACE=1 环境变量启用）
        if ("1".equals(System.getenv("LIFT_DUMP_TRACE"))) {
            LOG.info("=== Trace: " + ir.getSignature().getName() + " ===\n" + trace.dump());
        }

        // 以 (kind, location) 去重，保留最高严重级别，位置沿用首次出现的顺序
        Map<SemanticIssue, SemanticIssue> merged = new LinkedHashMap<>();
        for (IrCheck check : checks) {
            List<SemanticIssue> found = new ArrayList<>(check.run(ir, trace));
            LOG.fine(check.getName() + ": " + found.size() + " issues");
            found.sort(SemanticIssue.BY_LOCATION);
            for (SemanticIssue issue : found) {
                SemanticIssue seen = merged.get(issue);
                if (seen == null || issue.getSeverity().isMoreSevereThan(seen.getSeverity())) {
                    merged.put(issue, issue);
                }
            }
        }

        InterpretationResult result = new InterpretationResult(new ArrayList<>(merged.values()), trace);
        LOG.fine(ir.getSignature().getName() + ": " + (result.isShouldGenerate() ? "可以生成" : "阻断生成")
                + " (" + result.getIssues().size() + " issues)");
        if (result.hasErrors()) {
            for (SemanticIssue error : result.getErrors()) {
                LOG.info(ir.getSignature().getName() + ": " + error);
            }
        }
        return result;
    }
}
