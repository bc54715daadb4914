package com.liftsys.compiler.verify;

import com.liftsys.ir.Effect;
import com.liftsys.ir.EffectKind;
import com.liftsys.ir.IntermediateRepresentation;
import com.liftsys.ir.Parameter;
import com.liftsys.ir.Signature;
import com.liftsys.ir.constraint.Constraint;
import com.liftsys.ir.constraint.LoopBehaviorConstraint;
import com.liftsys.ir.constraint.LoopPattern;
import com.liftsys.ir.constraint.PositionConstraint;
import com.liftsys.ir.constraint.PositionRelation;
import com.liftsys.ir.constraint.ReturnConstraint;
import com.liftsys.ir.constraint.TypeConstraint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.*;

/**
 * 约束校验器测试
 */
class ConstraintVerifierTest {

    private final ConstraintVerifier verifier = new ConstraintVerifier();

    // ============ 测试辅助方法 ============

    private static String src(String... lines) {
        return String.join("\n", lines);
    }

    private boolean passes(String source, Constraint constraint) {
        VerificationReport report = verifier.verify(source, Collections.singletonList(constraint));
        assertThat(report.isCompiles()).as("源码应可解析").isTrue();
        return report.getResults().get(0).isPassed();
    }

    private static final String FIND_INDEX_WRONG = src(
            "def find_index(items, target):",
            "    for i in range(len(items)):",
            "        if items[i] == target:",
            "            return i",
            "        else:",
            "            return -1");

    private static final String FIND_INDEX = src(
            "def find_index(items, target):",
            "    for i in range(len(items)):",
            "        if items[i] == target:",
            "            return i",
            "    return -1");

    private static final String LAST_INDEX = src(
            "def last_index(items, target):",
            "    idx = -1",
            "    for i, x in enumerate(items):",
            "        if x == target:",
            "            idx = i",
            "    return idx");

    // ============ 返回约束 ============

    @Nested
    @DisplayName("return_constraint")
    class Returns {

        private final ReturnConstraint mustReturn = new ReturnConstraint(true);

        @Test
        @DisplayName("if/else 两个分支都返回")
        void testIfElse() {
            assertThat(passes(src(
                    "def sign(x):",
                    "    if x >= 0:",
                    "        return 1",
                    "    else:",
                    "        return -1"), mustReturn)).isTrue();
        }

        @Test
        @DisplayName("缺少 else 的 if 不覆盖所有路径")
        void testIfWithoutElse() {
            assertThat(passes(src(
                    "def sign(x):",
                    "    if x >= 0:",
                    "        return 1"), mustReturn)).isFalse();
        }

        @Test
        @DisplayName("elif 链中任一分支不返回即失败")
        void testElifChain() {
            assertThat(passes(src(
                    "def grade(x):",
                    "    if x > 90:",
                    "        return 'A'",
                    "    elif x > 60:",
                    "        print(x)",
                    "    else:",
                    "        return 'C'"), mustReturn)).isFalse();
        }

        @Test
        @DisplayName("raise 算作终止路径")
        void testRaise() {
            assertThat(passes(src(
                    "def parse(s):",
                    "    if s.isdigit():",
                    "        return int(s)",
                    "    else:",
                    "        raise ValueError(s)"), mustReturn)).isTrue();
        }

        @Test
        @DisplayName("裸 return 不返回值")
        void testBareReturn() {
            assertThat(passes(src("def f():", "    return"), mustReturn)).isFalse();
            assertThat(passes(src("def f():", "    return None"), mustReturn)).isFalse();
        }

        @Test
        @DisplayName("try/except 各分支都返回")
        void testTryExcept() {
            assertThat(passes(src(
                    "def to_int(s):",
                    "    try:",
                    "        return int(s)",
                    "    except ValueError:",
                    "        return 0"), mustReturn)).isTrue();
            assertThat(passes(src(
                    "def to_int(s):",
                    "    try:",
                    "        return int(s)",
                    "    except ValueError:",
                    "        pass"), mustReturn)).isFalse();
        }

        @Test
        @DisplayName("没有 break 的 while True 循环")
        void testInfiniteLoop() {
            assertThat(passes(src(
                    "def poll(queue):",
                    "    while True:",
                    "        item = queue.get()",
                    "        if item:",
                    "            return item"), mustReturn)).isTrue();
        }

        @Test
        @DisplayName("不要求返回时总是通过")
        void testNotRequired() {
            assertThat(passes(src("def log(x):", "    print(x)"), new ReturnConstraint(false))).isTrue();
        }

        @Test
        @DisplayName("循环之后的兜底返回")
        void testFallbackAfterLoop() {
            assertThat(passes(FIND_INDEX, mustReturn)).isTrue();
        }
    }

    // ============ 循环约束 ============

    @Nested
    @DisplayName("loop_constraint")
    class Loops {

        private final LoopBehaviorConstraint firstMatch = new LoopBehaviorConstraint(LoopPattern.FIRST_MATCH, true);
        private final LoopBehaviorConstraint lastMatch = new LoopBehaviorConstraint(LoopPattern.LAST_MATCH, false);

        @Test
        @DisplayName("在条件分支内返回 -1 的候选失败")
        void testFallbackInsideConditional() {
            assertThat(passes(FIND_INDEX_WRONG, firstMatch)).isFalse();
        }

        @Test
        @DisplayName("循环后兜底返回的候选通过")
        void testProperFallback() {
            assertThat(passes(FIND_INDEX, firstMatch)).isTrue();
        }

        @Test
        @DisplayName("raise 也可以作为兜底")
        void testRaiseFallback() {
            assertThat(passes(src(
                    "def first_even(xs):",
                    "    for x in xs:",
                    "        if x % 2 == 0:",
                    "            return x",
                    "    raise LookupError()"), firstMatch)).isTrue();
        }

        @Test
        @DisplayName("循环后的 return None 与裸 return 都是兜底")
        void testNoneFallback() {
            assertThat(passes(src(
                    "def find(xs):",
                    "    for x in xs:",
                    "        if x > 0:",
                    "            return x",
                    "    return None"), firstMatch)).isTrue();
            assertThat(passes(src(
                    "def find(xs):",
                    "    for x in xs:",
                    "        if x > 0:",
                    "            return x",
                    "    return"), firstMatch)).isTrue();
        }

        @Test
        @DisplayName("循环内没有 return 时无法命中即返回")
        void testNoEarlyReturn() {
            assertThat(passes(LAST_INDEX, firstMatch)).isFalse();
        }

        @Test
        @DisplayName("完整遍历后返回")
        void testLastMatch() {
            assertThat(passes(LAST_INDEX, lastMatch)).isTrue();
        }

        @Test
        @DisplayName("完整遍历模式下循环内的 return 失败")
        void testLastMatchWithEarlyReturn() {
            assertThat(passes(FIND_INDEX, lastMatch)).isFalse();
        }

        @Test
        @DisplayName("只有循环之前的守卫返回时失败")
        void testGuardOnly() {
            assertThat(passes(src(
                    "def collect(xs):",
                    "    if not xs:",
                    "        return []",
                    "    out = []",
                    "    for x in xs:",
                    "        out.append(x)"), new LoopBehaviorConstraint(LoopPattern.ALL_MATCHES, false))).isFalse();
        }

        @Test
        @DisplayName("没有循环")
        void testNoLoop() {
            assertThat(passes(src("def f(x):", "    return x"), lastMatch)).isFalse();
        }
    }

    // ============ 位置约束 ============

    @Nested
    @DisplayName("position_constraint")
    class Positions {

        private final String sumSource = src(
                "def total(xs):",
                "    total = 0",
                "    for x in xs:",
                "        total += x",
                "    return total");

        @Test
        void adjacent() {
            assertThat(passes(sumSource,
                    new PositionConstraint(PositionRelation.ADJACENT, "total = 0", "for x"))).isTrue();
            assertThat(passes(sumSource,
                    new PositionConstraint(PositionRelation.ADJACENT, "total = 0", "return"))).isFalse();
        }

        @Test
        void notAdjacent() {
            assertThat(passes(sumSource,
                    new PositionConstraint(PositionRelation.NOT_ADJACENT, "total = 0", "return"))).isTrue();
        }

        @Test
        @DisplayName("找不到主体时失败")
        void missingSubject() {
            VerificationReport report = verifier.verify(sumSource, Collections.<Constraint>singletonList(
                    new PositionConstraint(PositionRelation.NOT_ADJACENT, "total", "sorted(")));
            assertThat(report.getResults().get(0).isPassed()).isFalse();
            assertThat(report.getResults().get(0).getDetail()).contains("sorted(");
        }
    }

    // ============ 类型约束 ============

    @Nested
    @DisplayName("type_constraint")
    class Types {

        @Test
        @DisplayName("依据返回注解")
        void testAnnotation() {
            String source = src("def count(xs) -> int:", "    return len(xs)");

            assertThat(passes(source, new TypeConstraint("int"))).isTrue();
            assertThat(passes(source, new TypeConstraint("integer"))).isTrue();
            assertThat(passes(source, new TypeConstraint("float"))).isTrue();
            assertThat(passes(source, new TypeConstraint("str"))).isFalse();
        }

        @Test
        @DisplayName("没有注解时比较是否返回值")
        void testWithoutAnnotation() {
            String returnsValue = src("def count(xs):", "    return len(xs)");
            String returnsNothing = src("def show(xs):", "    print(xs)");

            assertThat(passes(returnsValue, new TypeConstraint("int"))).isTrue();
            assertThat(passes(returnsValue, new TypeConstraint("None"))).isFalse();
            assertThat(passes(returnsNothing, new TypeConstraint("None"))).isTrue();
            assertThat(passes(returnsNothing, new TypeConstraint("int"))).isFalse();
        }
    }

    // ============ 报告 ============

    @Nested
    @DisplayName("报告")
    class Reports {

        @Test
        @DisplayName("无法解析的源码：compiles=false 且所有约束失败，不抛异常")
        void testUnparseable() {
            VerificationReport report = verifier.verify("def f(:\n    return 1",
                    Arrays.<Constraint>asList(new ReturnConstraint(true), new TypeConstraint("int")));

            assertThat(report.isCompiles()).isFalse();
            assertThat(report.getParseError()).isNotNull();
            assertThat(report.getSatisfiedCount()).isZero();
            assertThat(report.getFailures()).hasSize(2);
            assertThat(report.allPassed()).isFalse();
        }

        @Test
        @DisplayName("不完整的语句视为无法解析")
        void testIncompleteStatement() {
            VerificationReport report = verifier.verify(src("def f(x):", "    return x +"),
                    Collections.<Constraint>emptyList());

            assertThat(report.isCompiles()).isFalse();
            assertThat(report.getParseError()).contains("line 2");
        }

        @Test
        @DisplayName("按 IR 校验时跳过不适用的约束")
        void testApplicableOnly() {
            PositionConstraint phrase = new PositionConstraint(PositionRelation.ADJACENT,
                    "the fallback value", "the loop");
            LoopBehaviorConstraint loop = new LoopBehaviorConstraint(LoopPattern.FIRST_MATCH, true);
            TypeConstraint type = new TypeConstraint("bool");
            IntermediateRepresentation ir = IntermediateRepresentation
                    .builder(new Signature("is_even", Arrays.asList(new Parameter("n", "int")), "bool"))
                    .effect(Effect.builder(EffectKind.RETURN, "return {n} % 2 == 0").valueType("bool").build())
                    .constraint(phrase)
                    .constraint(loop)
                    .constraint(type)
                    .build();

            VerificationReport report = verifier.verify(src("def is_even(n) -> bool:", "    return n % 2 == 0"), ir);

            assertThat(report.getResults()).extracting(ConstraintResult::getConstraint).containsExactly(type);
            assertThat(report.allPassed()).isTrue();
        }

        @Test
        @DisplayName("空源码与 null")
        void testNullSource() {
            assertThatCode(() -> verifier.verify(null, Collections.<Constraint>emptyList())).doesNotThrowAnyException();
            assertThat(verifier.verify("   ", Collections.<Constraint>emptyList()).isCompiles()).isFalse();
        }

        @Test
        @DisplayName("每个约束一条结果，按声明顺序")
        void testResultOrder() {
            ReturnConstraint ret = new ReturnConstraint(true);
            LoopBehaviorConstraint loop = new LoopBehaviorConstraint(LoopPattern.FIRST_MATCH, true);
            TypeConstraint type = new TypeConstraint("None");

            VerificationReport report = verifier.verify(FIND_INDEX, Arrays.<Constraint>asList(ret, loop, type));

            assertThat(report.isCompiles()).isTrue();
            assertThat(report.getResults()).extracting(ConstraintResult::getConstraint)
                    .containsExactly(ret, loop, type);
            assertThat(report.getSatisfiedCount()).isEqualTo(2);
            assertThat(report.asMap()).containsEntry(ret, true).containsEntry(loop, true).containsEntry(type, false);
            assertThat(report.getFailures()).extracting(ConstraintResult::getConstraint).containsExactly(type);
        }

        @Test
        @DisplayName("没有约束时全部通过")
        void testNoConstraints() {
            VerificationReport report = verifier.verify(FIND_INDEX, Collections.<Constraint>emptyList());

            assertThat(report.allPassed()).isTrue();
            assertThat(report.getResults()).isEmpty();
        }
    }
}
