package com.liftsys.compiler.analysis;

import com.liftsys.compiler.analysis.BranchStructure.Block;
import com.liftsys.compiler.analysis.BranchStructure.BlockKind;
import com.liftsys.compiler.analysis.BranchStructure.Item;
import com.liftsys.ir.Assertion;
import com.liftsys.ir.Effect;
import com.liftsys.ir.EffectKind;
import com.liftsys.ir.IntermediateRepresentation;
import com.liftsys.ir.Parameter;
import com.liftsys.ir.Signature;
import com.liftsys.ir.constraint.ReturnConstraint;
import com.liftsys.ir.constraint.TypeConstraint;
import com.liftsys.ir.types.TypeCompatibility;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 语义校验器：结构完整性检查。
 *
 * <ol>
 *   <li>返回完整性：非 void 函数的每条终止路径都要有 return</li>
 *   <li>类型一致性：Effect 产出的值类型与后续消费方的类型要求相容</li>
 *   <li>约束完整性：ReturnConstraint / TypeConstraint 与 IR 本身不矛盾</li>
 *   <li>未使用参数、无法检查的断言（WARNING）</li>
 * </ol>
 */
public final class SemanticValidator implements IrCheck {

    private static final Pattern RESULT_WORD = Pattern.compile("\\b(result|output|return(s|ed)?)\\b",
            Pattern.CASE_INSENSITIVE);

    @Override
    public String getName() {
        return "semantic-validator";
    }

    @Override
    public List<SemanticIssue> run(IntermediateRepresentation ir, ExecutionTrace trace) {
        return validate(ir);
    }

    public List<SemanticIssue> validate(IntermediateRepresentation ir) {
        List<SemanticIssue> issues = new ArrayList<>();
        checkReturnCompleteness(ir, issues);
        checkTypeConsistency(ir, issues);
        checkConstraintCompleteness(ir, issues);
        checkUnusedParameters(ir, issues);
        checkAssertions(ir, issues);
        issues.sort(SemanticIssue.BY_LOCATION);
        return issues;
    }

    // ============ 返回完整性 ============

    private void checkReturnCompleteness(IntermediateRepresentation ir, List<SemanticIssue> issues) {
        Signature sig = ir.getSignature();
        if (sig.isVoid()) {
            for (Effect e : ir.getEffects()) {
                if (e.carriesValue()) {
                    issues.add(SemanticIssue.warning(SemanticIssue.Kind.VOID_RETURN_VALUE, e.getPosition(),
                            "函数 " + sig.getName() + " 声明为无返回值，但 return 携带了值")
                            .withSuggestion("去掉返回值，或为签名声明返回类型"));
                }
            }
            return;
        }

        if (!hasReturn(ir)) {
            issues.add(SemanticIssue.error(SemanticIssue.Kind.MISSING_RETURN, null,
                    "函数 " + sig.getName() + " 声明返回 " + sig.getReturnType() + "，但没有任何 return Effect")
                    .withSuggestion("在 Effect 链末尾添加 return"));
            return;
        }

        BranchStructure structure = BranchStructure.of(ir.getEffects());
        if (structure.alwaysReturns()) return;

        // return 只出现在分支里：每个含 return 的顶层块都是一条不完整路径
        for (Item item : structure.getTopLevel()) {
            if (!item.isBlock() || !item.getBlock().containsReturn()) continue;
            Block block = item.getBlock();
            if (block.getKind() == BlockKind.LOOP) {
                issues.add(SemanticIssue.error(SemanticIssue.Kind.MISSING_RETURN, block.getPosition(),
                        "return 只出现在循环 " + block.getKey() + " 内，循环未命中时没有返回值")
                        .withSuggestion("在循环之后添加兜底 return"));
            } else {
                issues.add(SemanticIssue.error(SemanticIssue.Kind.MISSING_BRANCH, block.getPosition(),
                        "条件 " + block.getKey() + " 并非所有分支都返回，且其后没有 return")
                        .withSuggestion("补全 else 分支的 return，或在条件之后添加 return"));
            }
        }
    }

    private static boolean hasReturn(IntermediateRepresentation ir) {
        for (Effect e : ir.getEffects()) {
            if (e.getKind() == EffectKind.RETURN) return true;
        }
        return false;
    }

    // ============ 类型一致性 ============

    private void checkTypeConsistency(IntermediateRepresentation ir, List<SemanticIssue> issues) {
        Map<String, String> types = new HashMap<>();
        for (Parameter p : ir.getSignature().getParameters()) {
            types.put(p.getName(), p.getTypeHint());
        }
        Signature sig = ir.getSignature();

        for (Effect e : ir.getEffects()) {
            if (e.getExpectedType() != null) {
                for (String ref : e.getAllReferences()) {
                    String actual = types.get(ref);
                    if (actual != null && !TypeCompatibility.isCompatible(e.getExpectedType(), actual)) {
                        issues.add(SemanticIssue.error(SemanticIssue.Kind.TYPE_MISMATCH, e.getPosition(),
                                "'" + ref + "' 的类型为 " + actual + "，但此处需要 " + e.getExpectedType())
                                .withSuggestion("在使用前转换 '" + ref + "' 的类型"));
                        break;
                    }
                }
            }

            if (e.getKind() == EffectKind.RETURN && e.carriesValue() && !sig.isVoid()) {
                String returned = e.getValueType();
                if (returned == null && e.getAllReferences().size() == 1) {
                    returned = types.get(e.getAllReferences().iterator().next());
                }
                if (returned != null && !TypeCompatibility.isCompatible(sig.getReturnType(), returned)) {
                    issues.add(SemanticIssue.error(SemanticIssue.Kind.TYPE_MISMATCH, e.getPosition(),
                            "返回值类型 " + returned + " 与签名声明的 " + sig.getReturnType() + " 不兼容")
                            .withSuggestion("返回 " + sig.getReturnType() + " 类型的值"));
                }
            }

            if (e.getBinding() != null) {
                types.put(e.getBinding(), e.getValueType());
            }
        }
    }

    // ============ 约束完整性 ============

    private void checkConstraintCompleteness(IntermediateRepresentation ir, List<SemanticIssue> issues) {
        // 非 void 函数缺少 return 已在返回完整性检查中报告
        for (ReturnConstraint c : ir.constraintsOf(ReturnConstraint.class)) {
            if (c.isMustReturn() && ir.getSignature().isVoid() && !hasReturn(ir)) {
                issues.add(SemanticIssue.error(SemanticIssue.Kind.MISSING_RETURN, null,
                        "约束要求返回值，但没有任何 return Effect: " + c.getDescription())
                        .withSuggestion("在 Effect 链末尾添加 return"));
                break;
            }
        }
        String declared = ir.getSignature().getReturnType();
        if (declared == null) return;
        for (TypeConstraint c : ir.constraintsOf(TypeConstraint.class)) {
            if (!TypeCompatibility.isCompatible(c.getExpectedType(), declared)) {
                issues.add(SemanticIssue.error(SemanticIssue.Kind.TYPE_MISMATCH, null,
                        "签名返回类型 " + declared + " 与约束要求的 " + c.getExpectedType() + " 不兼容")
                        .withSuggestion("将返回类型改为 " + c.getExpectedType()));
                break;
            }
        }
    }

    // ============ 提示 ============

    private void checkUnusedParameters(IntermediateRepresentation ir, List<SemanticIssue> issues) {
        List<String> unused = new ArrayList<>();
        for (Parameter p : ir.getSignature().getParameters()) {
            Pattern word = Pattern.compile("\\b" + Pattern.quote(p.getName()) + "\\b");
            boolean used = false;
            for (Effect e : ir.getEffects()) {
                if (e.getAllReferences().contains(p.getName()) || word.matcher(e.getText()).find()) {
                    used = true;
                    break;
                }
            }
            if (!used) unused.add(p.getName());
        }
        if (!unused.isEmpty() && !ir.isNoOp()) {
            issues.add(SemanticIssue.warning(SemanticIssue.Kind.UNUSED_PARAMETER, null,
                    "参数未被任何 Effect 使用: " + unused)
                    .withSuggestion("删除无用参数，或补充使用它们的 Effect"));
        }
    }

    private void checkAssertions(IntermediateRepresentation ir, List<SemanticIssue> issues) {
        boolean producesValue = false;
        for (Effect e : ir.getEffects()) {
            if (e.carriesValue()) {
                producesValue = true;
                break;
            }
        }
        if (producesValue) return;
        List<String> uncheckable = new ArrayList<>();
        for (Assertion a : ir.getAssertions()) {
            if (RESULT_WORD.matcher(a.getPredicate()).find()) uncheckable.add(a.getPredicate());
        }
        if (!uncheckable.isEmpty()) {
            issues.add(SemanticIssue.warning(SemanticIssue.Kind.UNCHECKABLE_ASSERTION, null,
                    "断言引用了返回值，但 Effect 链不产生返回值: " + uncheckable));
        }
    }
}
