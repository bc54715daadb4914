package com.liftsys.ir.json;

import com.liftsys.ir.Effect;
import com.liftsys.ir.EffectKind;
import com.liftsys.ir.IntermediateRepresentation;
import com.liftsys.ir.Metadata;
import com.liftsys.ir.Parameter;
import com.liftsys.ir.Signature;
import com.liftsys.ir.constraint.LoopBehaviorConstraint;
import com.liftsys.ir.constraint.LoopPattern;
import com.liftsys.ir.constraint.PositionConstraint;
import com.liftsys.ir.constraint.PositionRelation;
import com.liftsys.ir.constraint.ReturnConstraint;
import com.liftsys.ir.constraint.TypeConstraint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

@DisplayName("IrJsonCodec 测试")
class IrJsonCodecTest {

    private final IrJsonCodec codec = new IrJsonCodec();

    private static IntermediateRepresentation findIndex() {
        return IntermediateRepresentation
                .builder(new Signature("find_index",
                        Arrays.asList(new Parameter("items", "list[int]", "待搜索的列表"), new Parameter("target", "int")),
                        "int"))
                .intent("返回 target 第一次出现的下标，找不到返回 -1")
                .effect(Effect.builder(EffectKind.LOOP, "for i, item in enumerate({items})").branch("L1").binds("i", "int").build())
                .effect(Effect.builder(EffectKind.CONDITIONAL, "if item == {target}").branch("L1").build())
                .effect(Effect.builder(EffectKind.RETURN, "return i").branch("L1").reads("i").build())
                .effect(Effect.builder(EffectKind.RETURN, "return -1").valueType("int").build())
                .assertion("result >= -1")
                .constraint(new ReturnConstraint(true))
                .constraint(new LoopBehaviorConstraint(LoopPattern.FIRST_MATCH, true, "i", null))
                .constraint(new PositionConstraint(PositionRelation.NOT_ADJACENT, "return -1", "return i", "兜底返回在循环外"))
                .constraint(new TypeConstraint("int"))
                .patternExample("for i, x in enumerate(xs): ...")
                .metadata(new Metadata("search.py", "python", "unit-test"))
                .build();
    }

    @Test
    @DisplayName("往返编解码得到相等的 IR")
    void testRoundTrip() {
        IntermediateRepresentation ir = findIndex();
        String json = codec.write(ir);
        assertThat(codec.read(json)).isEqualTo(ir);
        assertThat(new IrJsonCodec(true).read(new StringReader(new IrJsonCodec(true).write(ir)))).isEqualTo(ir);
    }

    @Test
    @DisplayName("使用 snake_case 字段与约束类型标签")
    void testFieldNames() {
        String json = codec.write(findIndex());
        assertThat(json).contains("\"type_hint\":\"list[int]\"")
                .contains("\"branch_id\":\"L1\"")
                .contains("\"value_type\":\"int\"")
                .contains("\"type\":\"loop_constraint\"")
                .contains("\"pattern\":\"FIRST_MATCH\"")
                .contains("\"early_return\":true")
                .contains("\"pattern_example\"");
    }

    @Test
    @DisplayName("位置缺省为列表下标，可选字段缺省")
    void testMinimalInput() {
        IntermediateRepresentation ir = codec.read("{"
                + "\"signature\":{\"name\":\"count_words\",\"parameters\":[{\"name\":\"text\",\"type_hint\":\"str\"}],\"returns\":\"int\"},"
                + "\"effects\":[{\"kind\":\"call\",\"text\":\"split {text}\"},{\"kind\":\"RETURN\",\"text\":\"return count\",\"references\":[\"count\"]}],"
                + "\"constraints\":[{\"type\":\"return_constraint\"}]"
                + "}");
        assertThat(ir.getEffects()).extracting(Effect::getPosition).containsExactly(0, 1);
        assertThat(ir.getEffects().get(1).getKind()).isEqualTo(EffectKind.RETURN);
        assertThat(ir.getConstraints()).containsExactly(new ReturnConstraint(true));
        assertThat(ir.getIntent().getSummary()).isEmpty();
        assertThat(ir.getMetadata()).isEqualTo(Metadata.EMPTY);
    }

    @Nested
    @DisplayName("格式错误")
    class Malformed {

        @Test
        @DisplayName("不是合法 JSON")
        void testNotJson() {
            assertThatThrownBy(() -> codec.read("{not json"))
                    .isInstanceOf(IrFormatException.class);
        }

        @Test
        @DisplayName("缺少 signature")
        void testMissingSignature() {
            assertThatThrownBy(() -> codec.read("{\"effects\":[]}"))
                    .isInstanceOf(IrFormatException.class)
                    .extracting(e -> ((IrFormatException) e).getPath())
                    .isEqualTo("$.signature");
        }

        @Test
        @DisplayName("未知的 effect 种类")
        void testUnknownKind() {
            assertThatThrownBy(() -> codec.read("{\"signature\":{\"name\":\"f\"},"
                    + "\"effects\":[{\"kind\":\"call\",\"text\":\"a\"},{\"kind\":\"jump\",\"text\":\"b\"}]}"))
                    .isInstanceOf(IrFormatException.class)
                    .hasMessageContaining("jump")
                    .extracting(e -> ((IrFormatException) e).getPath())
                    .isEqualTo("$.effects[1].kind");
        }

        @Test
        @DisplayName("未知的约束类型")
        void testUnknownConstraint() {
            assertThatThrownBy(() -> codec.read("{\"signature\":{\"name\":\"f\"},"
                    + "\"constraints\":[{\"type\":\"purity_constraint\"}]}"))
                    .isInstanceOf(IrFormatException.class)
                    .extracting(e -> ((IrFormatException) e).getPath())
                    .isEqualTo("$.constraints[0].type");
        }

        @Test
        @DisplayName("字段类型错误")
        void testWrongType() {
            assertThatThrownBy(() -> codec.read("{\"signature\":{\"name\":\"f\"},\"effects\":{}}"))
                    .isInstanceOf(IrFormatException.class)
                    .extracting(e -> ((IrFormatException) e).getPath())
                    .isEqualTo("$.effects");
            assertThatThrownBy(() -> codec.read("{\"signature\":{\"name\":\"f\"},"
                    + "\"effects\":[{\"kind\":\"call\",\"text\":\"a\",\"position\":\"x\"}]}"))
                    .isInstanceOf(IrFormatException.class)
                    .extracting(e -> ((IrFormatException) e).getPath())
                    .isEqualTo("$.effects[0].position");
        }

        @Test
        @DisplayName("非整数的 position 不截断")
        void testFractionalPosition() {
            assertThatThrownBy(() -> codec.read("{\"signature\":{\"name\":\"f\"},"
                    + "\"effects\":[{\"kind\":\"call\",\"text\":\"a\",\"position\":1.5}]}"))
                    .isInstanceOf(IrFormatException.class)
                    .extracting(e -> ((IrFormatException) e).getPath())
                    .isEqualTo("$.effects[0].position");
            assertThat(codec.read("{\"signature\":{\"name\":\"f\"},"
                    + "\"effects\":[{\"kind\":\"call\",\"text\":\"a\",\"position\":2.0}]}")
                    .getEffects().get(0).getPosition()).isEqualTo(2);
        }

        @Test
        @DisplayName("非法的 branch_id")
        void testBadBranchId() {
            assertThatThrownBy(() -> codec.read("{\"signature\":{\"name\":\"f\"},"
                    + "\"effects\":[{\"kind\":\"call\",\"text\":\"a\",\"branch_id\":\"L1//C2\"}]}"))
                    .isInstanceOf(IrFormatException.class)
                    .extracting(e -> ((IrFormatException) e).getPath())
                    .isEqualTo("$.effects[0]");
        }

        @Test
        @DisplayName("位置约束的主体个数")
        void testSubjects() {
            assertThatThrownBy(() -> codec.read("{\"signature\":{\"name\":\"f\"},"
                    + "\"constraints\":[{\"type\":\"position_constraint\",\"relation\":\"ADJACENT\",\"subjects\":[\"a\"]}]}"))
                    .isInstanceOf(IrFormatException.class)
                    .extracting(e -> ((IrFormatException) e).getPath())
                    .isEqualTo("$.constraints[0].subjects");
        }
    }
}
