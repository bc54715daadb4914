package com.liftsys.compiler.analysis;

import com.liftsys.ir.Effect;
import com.liftsys.ir.EffectKind;
import com.liftsys.ir.IntermediateRepresentation;
import com.liftsys.ir.Parameter;
import com.liftsys.ir.Signature;
import com.liftsys.ir.constraint.ReturnConstraint;
import com.liftsys.ir.constraint.TypeConstraint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * 语义校验器测试：返回完整性、类型一致性、约束完整性与提示类检查。
 */
class SemanticValidatorTest {

    private final SemanticValidator validator = new SemanticValidator();

    // ============ 测试辅助方法 ============

    private static IntermediateRepresentation.Builder function(String returns, Parameter... params) {
        return IntermediateRepresentation.builder(new Signature("f", Arrays.asList(params), returns));
    }

    private static Effect effect(EffectKind kind, String text, String branch) {
        return Effect.builder(kind, text).branch(branch).build();
    }

    private static SemanticIssue only(List<SemanticIssue> issues, SemanticIssue.Kind kind) {
        assertThat(issues).extracting(SemanticIssue::getKind).containsOnlyOnce(kind);
        for (SemanticIssue issue : issues) {
            if (issue.getKind() == kind) return issue;
        }
        throw new AssertionError(kind);
    }

    // ============ 返回完整性 ============

    @Nested
    @DisplayName("返回完整性")
    class ReturnCompleteness {

        @Test
        @DisplayName("非 void 函数没有 return")
        void testMissingReturn() {
            List<SemanticIssue> issues = validator.validate(function("int", new Parameter("x", "int"))
                    .effect(Effect.of(EffectKind.CALL, "compute {x}"))
                    .build());

            SemanticIssue issue = only(issues, SemanticIssue.Kind.MISSING_RETURN);
            assertThat(issue.isError()).isTrue();
            assertThat(issue.getLocation()).isNull();
            assertThat(issue.getSuggestion()).isNotNull();
        }

        @Test
        @DisplayName("只有 then 分支返回的条件")
        void testIfWithoutElse() {
            List<SemanticIssue> issues = validator.validate(function("int", new Parameter("x", "int"))
                    .effect(effect(EffectKind.CONDITIONAL, "if {x} > 0", "C1"))
                    .effect(Effect.builder(EffectKind.RETURN, "return x").branch("C1").reads("x").build())
                    .build());

            SemanticIssue issue = only(issues, SemanticIssue.Kind.MISSING_BRANCH);
            assertThat(issue.isError()).isTrue();
            assertThat(issue.getLocation()).isEqualTo(0);
        }

        @Test
        @DisplayName("then/else 两臂都返回即完整")
        void testIfElseComplete() {
            List<SemanticIssue> issues = validator.validate(function("int", new Parameter("x", "int"))
                    .effect(effect(EffectKind.CONDITIONAL, "if {x} > 0", "C1"))
                    .effect(Effect.builder(EffectKind.RETURN, "return x").branch("C1").reads("x").build())
                    .effect(Effect.builder(EffectKind.RETURN, "return -x").branch("C1:else").reads("x").build())
                    .build());

            assertThat(issues).isEmpty();
        }

        @Test
        @DisplayName("嵌套条件的 else 臂缺少 return")
        void testNestedIncomplete() {
            List<SemanticIssue> issues = validator.validate(function("str", new Parameter("x", "int"))
                    .effect(effect(EffectKind.CONDITIONAL, "if {x} > 0", "C1"))
                    .effect(Effect.builder(EffectKind.RETURN, "return 'pos'").branch("C1").valueType("str").build())
                    .effect(effect(EffectKind.CONDITIONAL, "if {x} < 0", "C1:else/C2"))
                    .effect(Effect.builder(EffectKind.RETURN, "return 'neg'").branch("C1:else/C2").valueType("str").build())
                    .build());

            assertThat(only(issues, SemanticIssue.Kind.MISSING_BRANCH).getLocation()).isEqualTo(0);
        }

        @Test
        @DisplayName("return 只在循环内")
        void testReturnOnlyInLoop() {
            List<SemanticIssue> issues = validator.validate(function("int", new Parameter("items", "list"), new Parameter("target", "int"))
                    .effect(Effect.builder(EffectKind.LOOP, "for i in {items}").branch("L1").binds("i", "int").build())
                    .effect(effect(EffectKind.CONDITIONAL, "if i == {target}", "L1"))
                    .effect(Effect.builder(EffectKind.RETURN, "return i").branch("L1").reads("i").build())
                    .build());

            SemanticIssue issue = only(issues, SemanticIssue.Kind.MISSING_RETURN);
            assertThat(issue.isError()).isTrue();
            assertThat(issue.getLocation()).isEqualTo(0);
        }

        @Test
        @DisplayName("void 函数返回值只是 WARNING")
        void testVoidReturnValue() {
            List<SemanticIssue> issues = validator.validate(function("None", new Parameter("x", "int"))
                    .effect(Effect.builder(EffectKind.RETURN, "return {x}").build())
                    .build());

            SemanticIssue issue = only(issues, SemanticIssue.Kind.VOID_RETURN_VALUE);
            assertThat(issue.getSeverity()).isEqualTo(SemanticIssue.Severity.WARNING);
            assertThat(issue.getLocation()).isEqualTo(0);
        }

        @Test
        @DisplayName("void 函数的裸 return 没有问题")
        void testVoidBareReturn() {
            assertThat(validator.validate(function(null, new Parameter("x", "int"))
                    .effect(Effect.of(EffectKind.CALL, "print {x}"))
                    .effect(Effect.of(EffectKind.RETURN, "return"))
                    .build())).isEmpty();
        }
    }

    // ============ 类型一致性 ============

    @Nested
    @DisplayName("类型一致性")
    class TypeConsistency {

        @Test
        @DisplayName("字符串被送入只接受数值的 Effect")
        void testConsumerMismatch() {
            List<SemanticIssue> issues = validator.validate(function("int", new Parameter("name", "str"))
                    .effect(Effect.builder(EffectKind.ASSIGNMENT, "doubled = {name} * 2").expects("int").binds("doubled", "int").build())
                    .effect(Effect.builder(EffectKind.RETURN, "return doubled").reads("doubled").build())
                    .build());

            SemanticIssue issue = only(issues, SemanticIssue.Kind.TYPE_MISMATCH);
            assertThat(issue.isError()).isTrue();
            assertThat(issue.getLocation()).isEqualTo(0);
            assertThat(issue.getMessage()).contains("name");
        }

        @Test
        @DisplayName("计算出的绑定类型沿链传播")
        void testBindingTypePropagates() {
            List<SemanticIssue> issues = validator.validate(function("int", new Parameter("x", "int"))
                    .effect(Effect.builder(EffectKind.ASSIGNMENT, "label = str(x)").reads("x").binds("label", "str").build())
                    .effect(Effect.builder(EffectKind.RETURN, "return label").reads("label").build())
                    .build());

            assertThat(only(issues, SemanticIssue.Kind.TYPE_MISMATCH).getLocation()).isEqualTo(1);
        }

        @Test
        @DisplayName("int 可以返回给 float 签名")
        void testNumericWidening() {
            assertThat(validator.validate(function("float", new Parameter("n", "int"))
                    .effect(Effect.builder(EffectKind.RETURN, "return n").reads("n").build())
                    .build())).isEmpty();
        }

        @Test
        @DisplayName("类型未知时不报告")
        void testUnknownTypes() {
            assertThat(validator.validate(function("int", new Parameter("data", null))
                    .effect(Effect.builder(EffectKind.ASSIGNMENT, "n = len({data})").expects("list").binds("n").build())
                    .effect(Effect.builder(EffectKind.RETURN, "return n").reads("n").build())
                    .build())).isEmpty();
        }
    }

    // ============ 约束完整性 ============

    @Nested
    @DisplayName("约束完整性")
    class ConstraintCompleteness {

        @Test
        @DisplayName("void 签名但约束要求返回")
        void testReturnConstraintOnVoid() {
            List<SemanticIssue> issues = validator.validate(function(null, new Parameter("x", "int"))
                    .effect(Effect.of(EffectKind.CALL, "print {x}"))
                    .constraint(new ReturnConstraint(true))
                    .build());

            SemanticIssue issue = only(issues, SemanticIssue.Kind.MISSING_RETURN);
            assertThat(issue.isError()).isTrue();
            assertThat(issue.getLocation()).isNull();
        }

        @Test
        @DisplayName("类型约束与签名不兼容")
        void testTypeConstraintMismatch() {
            List<SemanticIssue> issues = validator.validate(function("int", new Parameter("x", "int"))
                    .effect(Effect.builder(EffectKind.RETURN, "return x").reads("x").build())
                    .constraint(new TypeConstraint("str"))
                    .build());

            SemanticIssue issue = only(issues, SemanticIssue.Kind.TYPE_MISMATCH);
            assertThat(issue.getLocation()).isNull();
            assertThat(issue.isError()).isTrue();
        }

        @Test
        @DisplayName("类型约束与签名兼容")
        void testTypeConstraintCompatible() {
            assertThat(validator.validate(function("Integer", new Parameter("x", "int"))
                    .effect(Effect.builder(EffectKind.RETURN, "return x").reads("x").build())
                    .constraint(new TypeConstraint("int"))
                    .build())).isEmpty();
        }
    }

    // ============ 提示 ============

    @Test
    @DisplayName("未使用的参数合并为一条 WARNING")
    void testUnusedParameters() {
        List<SemanticIssue> issues = validator.validate(function("int",
                new Parameter("items", "list"), new Parameter("verbose", "bool"), new Parameter("limit", "int"))
                .effect(Effect.builder(EffectKind.RETURN, "return len(items)").valueType("int").build())
                .build());

        SemanticIssue issue = only(issues, SemanticIssue.Kind.UNUSED_PARAMETER);
        assertThat(issue.getSeverity()).isEqualTo(SemanticIssue.Severity.WARNING);
        assertThat(issue.getMessage()).contains("verbose").contains("limit").doesNotContain("items");
    }

    @Test
    @DisplayName("断言引用返回值但链不产生返回值")
    void testUncheckableAssertion() {
        List<SemanticIssue> issues = validator.validate(function(null, new Parameter("items", "list"))
                .effect(Effect.of(EffectKind.CALL, "sort {items} in place"))
                .assertion("result is sorted")
                .assertion("len(items) is unchanged")
                .build());

        SemanticIssue issue = only(issues, SemanticIssue.Kind.UNCHECKABLE_ASSERTION);
        assertThat(issue.getSeverity()).isEqualTo(SemanticIssue.Severity.WARNING);
        assertThat(issue.getMessage()).contains("result is sorted").doesNotContain("unchanged");
    }

    @Test
    @DisplayName("结果按位置排序，无位置的在前")
    void testOrdering() {
        List<SemanticIssue> issues = validator.validate(function("int", new Parameter("name", "str"), new Parameter("unused", "int"))
                .effect(Effect.builder(EffectKind.ASSIGNMENT, "n = {name} + 1").expects("int").binds("n", "int").build())
                .effect(effect(EffectKind.CONDITIONAL, "if n > 0", "C1"))
                .effect(Effect.builder(EffectKind.RETURN, "return n").branch("C1").reads("n").build())
                .build());

        assertThat(issues).extracting(SemanticIssue::getKind).containsExactly(
                SemanticIssue.Kind.UNUSED_PARAMETER,
                SemanticIssue.Kind.TYPE_MISMATCH,
                SemanticIssue.Kind.MISSING_BRANCH);
    }
}
