package com.liftsys.compiler.analysis;

import com.liftsys.compiler.analysis.BranchStructure.Block;
import com.liftsys.ir.BranchPath;
import com.liftsys.ir.Effect;
import com.liftsys.ir.EffectKind;
import com.liftsys.ir.IntermediateRepresentation;
import com.liftsys.ir.Parameter;
import com.liftsys.ir.constraint.Constraint;
import com.liftsys.ir.constraint.ConstraintFilter;
import com.liftsys.ir.constraint.ConstraintVisitor;
import com.liftsys.ir.constraint.LoopBehaviorConstraint;
import com.liftsys.ir.constraint.PositionConstraint;
import com.liftsys.ir.constraint.ReturnConstraint;
import com.liftsys.ir.constraint.TypeConstraint;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * 逻辑错误检测器：变量遮蔽、循环行为、可达性交叉检查。
 */
public final class LogicErrorDetector implements IrCheck {

    @Override
    public String getName() {
        return "logic-error-detector";
    }

    @Override
    public List<SemanticIssue> run(IntermediateRepresentation ir, ExecutionTrace trace) {
        return detect(ir, trace);
    }

    /** 自行构建执行轨迹后检测 */
    public List<SemanticIssue> detect(IntermediateRepresentation ir) {
        return detect(ir, new EffectChainAnalyzer().buildTrace(ir));
    }

    public List<SemanticIssue> detect(IntermediateRepresentation ir, ExecutionTrace trace) {
        List<SemanticIssue> issues = new ArrayList<>();
        BranchStructure structure = BranchStructure.of(ir.getEffects());
        checkShadowing(ir, structure, issues);
        // 没有 loop Effect 的 IR 不适用循环约束
        for (LoopBehaviorConstraint c : ConstraintFilter.applicable(ir, LoopBehaviorConstraint.class)) {
            checkLoopBehavior(ir, structure, c, issues);
        }
        checkDeadConstraints(ir, trace, issues);
        issues.sort(SemanticIssue.BY_LOCATION);
        return issues;
    }

    // ============ 变量遮蔽 ============

    /**
     * 每个名称维护一个作用域栈；后续 Effect 离开某作用域时该作用域关闭。
     * 在仍存活绑定的严格子作用域中重新绑定同名变量即为遮蔽。
     */
    private void checkShadowing(IntermediateRepresentation ir, BranchStructure structure, List<SemanticIssue> issues) {
        Map<String, Deque<String>> live = new HashMap<>();
        for (Parameter p : ir.getSignature().getParameters()) {
            live.computeIfAbsent(p.getName(), k -> new ArrayDeque<>()).push("");
        }

        for (Effect e : ir.getEffects()) {
            BranchPath path = e.getBranchPath();
            boolean opener = isOpener(structure, e);
            // 开头本身位于父作用域，它引入的绑定（循环变量）属于块内
            String current = opener ? path.parent().scopeKey() : path.scopeKey();
            String bindScope = path.scopeKey();

            for (Iterator<Deque<String>> it = live.values().iterator(); it.hasNext(); ) {
                Deque<String> scopes = it.next();
                while (!scopes.isEmpty() && !BranchPath.encloses(scopes.peek(), current)) {
                    scopes.pop();
                }
                if (scopes.isEmpty()) it.remove();
            }

            String name = e.getBinding();
            if (name == null) continue;
            Deque<String> scopes = live.computeIfAbsent(name, k -> new ArrayDeque<>());
            String top = scopes.peek();
            if (top != null && top.equals(bindScope)) continue;
            if (top != null && BranchPath.encloses(top, bindScope)) {
                issues.add(SemanticIssue.warning(SemanticIssue.Kind.VARIABLE_SHADOWING, e.getPosition(),
                        "绑定 '" + name + "' 遮蔽了外层作用域中仍然存活的同名变量")
                        .withSuggestion("为内层变量换一个名字"));
            }
            scopes.push(bindScope);
        }
    }

    private static boolean isOpener(BranchStructure structure, Effect e) {
        if (e.getBranchPath().isTopLevel()) return false;
        Block block = structure.getBlock(e.getBranchPath().blockKey());
        return block != null && e.equals(block.getOpener());
    }

    // ============ 循环行为 ============

    private void checkLoopBehavior(IntermediateRepresentation ir, BranchStructure structure,
                                   LoopBehaviorConstraint c, List<SemanticIssue> issues) {
        Block loop = findLoop(structure, c);
        if (loop == null) {
            issues.add(SemanticIssue.error(SemanticIssue.Kind.LOOP_BEHAVIOR_MISMATCH, null,
                    "声明了循环行为约束，但 loop Effect 没有构成循环块: " + c.getDescription())
                    .withSuggestion("为 loop Effect 及其循环体设置 branch_id"));
            return;
        }

        if (c.requiresEarlyReturn()) {
            if (!loop.containsReturn()) {
                issues.add(SemanticIssue.error(SemanticIssue.Kind.LOOP_BEHAVIOR_MISMATCH, loop.getPosition(),
                        "约束要求命中即返回，但循环 " + loop.getKey() + " 内没有 return")
                        .withSuggestion("将命中时的 return 放入循环体（branch_id 设为 " + loop.getKey() + "）"));
            }
            return;
        }
        if (!c.getPattern().requiresFullIteration()) return;

        if (loop.containsReturn()) {
            issues.add(SemanticIssue.error(SemanticIssue.Kind.LOOP_BEHAVIOR_MISMATCH, loop.getPosition(),
                    c.getPattern() + " 要求完整遍历，但循环 " + loop.getKey() + " 内存在提前 return")
                    .withSuggestion("在循环内累积结果，循环结束后再 return"));
        } else if (!ir.getSignature().isVoid() && !hasReturnAfter(ir, loop)) {
            issues.add(SemanticIssue.error(SemanticIssue.Kind.LOOP_BEHAVIOR_MISMATCH, loop.getPosition(),
                    c.getPattern() + " 要求在循环 " + loop.getKey() + " 结束后返回聚合结果，但其后没有 return")
                    .withSuggestion("在循环之后添加 return"));
        }
    }

    private static Block findLoop(BranchStructure structure, LoopBehaviorConstraint c) {
        List<Block> loops = structure.getLoops();
        if (loops.isEmpty()) return null;
        if (c.getLoopVariable() != null) {
            for (Block loop : loops) {
                if (c.getLoopVariable().equals(loop.getOpener().getBinding())) return loop;
            }
        }
        return loops.get(0);
    }

    private static boolean hasReturnAfter(IntermediateRepresentation ir, Block loop) {
        for (Effect e : ir.getEffects()) {
            if (e.getKind() == EffectKind.RETURN && e.getPosition() > loop.getPosition() && !loop.contains(e)) {
                return true;
            }
        }
        return false;
    }

    // ============ 可达性交叉检查 ============

    private void checkDeadConstraints(IntermediateRepresentation ir, ExecutionTrace trace, List<SemanticIssue> issues) {
        List<Constraint> constraints = ConstraintFilter.applicable(ir);
        if (constraints.isEmpty()) return;
        for (TraceRecord r : trace.getUnreachable()) {
            for (Constraint c : constraints) {
                if (c.accept(RELEVANCE, r.getEffect())) {
                    issues.add(SemanticIssue.error(SemanticIssue.Kind.UNREACHABLE_CODE, r.getPosition(),
                            "不可达的 Effect 承载了约束，该约束永远无法被满足: " + c.getDescription())
                            .withSuggestion("调整 Effect 顺序，使其位于无条件 return 之前"));
                    break;
                }
            }
        }
    }

    /** 判断某个 Effect 是否与约束相关 */
    private static final ConstraintVisitor<Boolean, Effect> RELEVANCE = new ConstraintVisitor<Boolean, Effect>() {
        @Override
        public Boolean visitReturn(ReturnConstraint c, Effect e) {
            return e.getKind() == EffectKind.RETURN;
        }

        @Override
        public Boolean visitLoopBehavior(LoopBehaviorConstraint c, Effect e) {
            return e.getKind() == EffectKind.LOOP;
        }

        @Override
        public Boolean visitPosition(PositionConstraint c, Effect e) {
            return mentions(e, c.getFirst()) && mentions(e, c.getSecond());
        }

        @Override
        public Boolean visitType(TypeConstraint c, Effect e) {
            return e.getKind() == EffectKind.RETURN && e.getValueType() != null;
        }

        private boolean mentions(Effect e, String subject) {
            return e.getText().contains(subject) || e.getAllReferences().contains(subject);
        }
    };
}
