package com.liftsys.ir;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Effect 与 IR 构建测试")
class EffectTest {

    @Test
    @DisplayName("文本占位符计入引用")
    void testPlaceholderReferences() {
        Effect e = Effect.builder(EffectKind.CALL, "split {text} by {sep}").reads("limit").build();
        assertThat(e.getAllReferences()).containsExactly("limit", "text", "sep");
        assertThat(e.getReferences()).containsExactly("limit");
    }

    @Test
    @DisplayName("return 携带值的判定")
    void testCarriesValue() {
        assertThat(Effect.of(EffectKind.RETURN, "return").carriesValue()).isFalse();
        assertThat(Effect.builder(EffectKind.RETURN, "return count").reads("count").build().carriesValue()).isTrue();
        assertThat(Effect.builder(EffectKind.RETURN, "return -1").valueType("int").build().carriesValue()).isTrue();
        assertThat(Effect.builder(EffectKind.CALL, "log").valueType("int").build().carriesValue()).isFalse();
    }

    @Test
    @DisplayName("空白字段归一化为 null")
    void testBlankFields() {
        Effect e = Effect.builder(EffectKind.ASSIGNMENT, "x = 1").branch("  ").binds(" ", "").build();
        assertThat(e.getBranchId()).isNull();
        assertThat(e.getBinding()).isNull();
        assertThat(e.isBranched()).isFalse();
    }

    @Test
    @DisplayName("IR 按序号补齐未指定的位置")
    void testPositionsAssigned() {
        IntermediateRepresentation ir = IntermediateRepresentation
                .builder(new Signature("f", Collections.<Parameter>emptyList(), "int"))
                .effect(EffectKind.ASSIGNMENT, "a")
                .effect(Effect.builder(EffectKind.ASSIGNMENT, "b").position(7).build())
                .effect(EffectKind.RETURN, "c")
                .build();
        assertThat(ir.getEffects()).extracting(Effect::getPosition).containsExactly(0, 7, 2);
    }

    @Test
    @DisplayName("IR 列表只读")
    void testImmutable() {
        IntermediateRepresentation ir = IntermediateRepresentation
                .builder(new Signature("f", Arrays.asList(new Parameter("x", "int")), null))
                .effect(EffectKind.CALL, "print {x}")
                .build();
        assertThatThrownBy(() -> ir.getEffects().add(Effect.of(EffectKind.OTHER, "x")))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(ir.getSignature().isVoid()).isTrue();
        assertThat(ir.isNoOp()).isFalse();
    }

    @Test
    @DisplayName("void 返回类型的各种写法")
    void testVoidSignature() {
        for (String t : new String[]{null, "", "void", "None", "Unit", "null"}) {
            assertThat(new Signature("f", Collections.<Parameter>emptyList(), t).isVoid()).as(String.valueOf(t)).isTrue();
        }
        assertThat(new Signature("f", Collections.<Parameter>emptyList(), "int").isVoid()).isFalse();
    }
}
