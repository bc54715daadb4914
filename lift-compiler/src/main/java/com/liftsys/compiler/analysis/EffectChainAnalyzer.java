package com.liftsys.compiler.analysis;

import com.liftsys.ir.Effect;
import com.liftsys.ir.EffectKind;
import com.liftsys.ir.IntermediateRepresentation;
import com.liftsys.ir.Parameter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Effect 链分析器。
 *
 * <p>单次遍历 Effect 序列，维护模拟的可达标记并记录每步的状态变化：</p>
 * <ul>
 *   <li>不在任何分支内的 return 之后的所有 Effect 不可达 → UNREACHABLE_CODE (WARNING)</li>
 *   <li>引用了此前从未引入的名称 → DANGLING_REFERENCE (WARNING)，上游生成可能省略了琐碎绑定</li>
 * </ul>
 */
public final class EffectChainAnalyzer implements IrCheck {

    @Override
    public String getName() {
        return "effect-chain";
    }

    /** 构建执行轨迹并给出链上的问题 */
    public ChainAnalysis analyze(IntermediateRepresentation ir) {
        ExecutionTrace trace = buildTrace(ir);
        return new ChainAnalysis(trace, issuesOf(trace));
    }

    @Override
    public List<SemanticIssue> run(IntermediateRepresentation ir, ExecutionTrace trace) {
        return issuesOf(trace);
    }

    /** 模拟执行 Effect 链 */
    public ExecutionTrace buildTrace(IntermediateRepresentation ir) {
        Map<String, SymbolicValue> values = new LinkedHashMap<>();
        for (Parameter p : ir.getSignature().getParameters()) {
            values.put(p.getName(), new SymbolicValue(p.getName(), p.getTypeHint(), SymbolicValue.PARAMETER));
        }

        List<TraceRecord> records = new ArrayList<>();
        SymbolicValue returnValue = null;
        boolean reachable = true;
        List<Effect> effects = ir.getEffects();
        for (int i = 0; i < effects.size(); i++) {
            Effect e = effects.get(i);
            Set<String> unresolved = new LinkedHashSet<>();
            for (String ref : e.getAllReferences()) {
                if (!values.containsKey(ref)) unresolved.add(ref);
            }

            boolean terminates = e.getKind() == EffectKind.RETURN && !e.isBranched();
            StateDelta delta = new StateDelta(e.getBinding(), e.getValueType(), e.getAllReferences(), terminates);
            records.add(new TraceRecord(i, e, delta, reachable, unresolved));

            if (e.getBinding() != null) {
                values.put(e.getBinding(), new SymbolicValue(e.getBinding(), e.getValueType(), e.getPosition()));
            }
            if (reachable && returnValue == null && e.carriesValue()) {
                returnValue = new SymbolicValue("<return>", returnedType(e, values), e.getPosition());
            }
            if (terminates) reachable = false;
        }
        return new ExecutionTrace(records, values, returnValue);
    }

    /**
     * return 的值类型：显式声明优先，否则取唯一引用的已知类型。
     */
    static String returnedType(Effect e, Map<String, SymbolicValue> values) {
        if (e.getValueType() != null) return e.getValueType();
        if (e.getAllReferences().size() == 1) {
            SymbolicValue v = values.get(e.getAllReferences().iterator().next());
            return v != null ? v.getType() : null;
        }
        return null;
    }

    private static List<SemanticIssue> issuesOf(ExecutionTrace trace) {
        List<SemanticIssue> issues = new ArrayList<>();
        for (TraceRecord r : trace.getRecords()) {
            if (!r.isReachable()) {
                issues.add(SemanticIssue.warning(SemanticIssue.Kind.UNREACHABLE_CODE, r.getPosition(),
                        "Effect 位于无条件 return 之后，永远不会执行: " + r.getEffect().getText())
                        .withSuggestion("删除该 Effect，或将前面的 return 移入条件分支"));
            }
            if (!r.getUnresolved().isEmpty()) {
                issues.add(SemanticIssue.warning(SemanticIssue.Kind.DANGLING_REFERENCE, r.getPosition(),
                        "引用了未定义的名称 " + r.getUnresolved())
                        .withSuggestion("在此之前添加引入这些名称的 Effect"));
            }
        }
        return issues;
    }
}
