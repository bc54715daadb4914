package com.liftsys.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 因果计划中的一步。创建后不可变，由所属 IR 独占。
 *
 * <p>除 kind/text/position/branchId 外，Effect 可以声明它引入的绑定
 * ({@link #getBinding()})、产出值的类型 ({@link #getValueType()})、
 * 消费的变量 ({@link #getReferences()}) 以及对所消费值的类型要求
 * ({@link #getExpectedType()})。文本中的 {@code {name}} 占位符同样视为引用。</p>
 */
public final class Effect {

    /** 尚未分配位置；由 {@link IntermediateRepresentation.Builder} 按序号补齐 */
    public static final int UNASSIGNED = -1;

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z_][A-Za-z0-9_]*)\\}");

    private final EffectKind kind;
    private final String text;
    private final int position;
    private final String branchId;
    private final String binding;
    private final String valueType;
    private final List<String> references;
    private final String expectedType;

    // 派生字段
    private final BranchPath branchPath;
    private final Set<String> allReferences;

    private Effect(Builder b) {
        this.kind = Objects.requireNonNull(b.kind, "kind");
        this.text = b.text != null ? b.text : "";
        this.position = b.position;
        this.branchId = blankToNull(b.branchId);
        this.binding = blankToNull(b.binding);
        this.valueType = blankToNull(b.valueType);
        this.references = Collections.unmodifiableList(new ArrayList<String>(b.references));
        this.expectedType = blankToNull(b.expectedType);
        this.branchPath = BranchPath.parse(this.branchId);
        this.allReferences = Collections.unmodifiableSet(collectReferences(this.references, this.text));
    }

    public static Builder builder(EffectKind kind, String text) {
        return new Builder(kind, text);
    }

    public static Effect of(EffectKind kind, String text) {
        return builder(kind, text).build();
    }

    public EffectKind getKind() { return kind; }
    public String getText() { return text; }
    public int getPosition() { return position; }
    public String getBranchId() { return branchId; }
    public String getBinding() { return binding; }
    public String getValueType() { return valueType; }
    public List<String> getReferences() { return references; }
    public String getExpectedType() { return expectedType; }
    public BranchPath getBranchPath() { return branchPath; }

    /** 是否位于某个循环/条件分支内 */
    public boolean isBranched() {
        return !branchPath.isTopLevel();
    }

    /** 显式引用与文本占位符引用的并集，按出现顺序 */
    public Set<String> getAllReferences() {
        return allReferences;
    }

    /** return 是否携带返回值（声明了值类型，或引用了任何名称） */
    public boolean carriesValue() {
        return kind == EffectKind.RETURN && (valueType != null || !allReferences.isEmpty());
    }

    /** 复制并替换位置 */
    public Effect withPosition(int newPosition) {
        return toBuilder().position(newPosition).build();
    }

    public Builder toBuilder() {
        Builder b = new Builder(kind, text);
        b.position = position;
        b.branchId = branchId;
        b.binding = binding;
        b.valueType = valueType;
        b.references.addAll(references);
        b.expectedType = expectedType;
        return b;
    }

    private static Set<String> collectReferences(List<String> explicit, String text) {
        Set<String> result = new LinkedHashSet<String>();
        for (String ref : explicit) {
            if (ref != null && !ref.trim().isEmpty()) result.add(ref.trim());
        }
        Matcher m = PLACEHOLDER.matcher(text);
        while (m.find()) {
            result.add(m.group(1));
        }
        return result;
    }

    private static String blankToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Effect)) return false;
        Effect other = (Effect) o;
        return position == other.position
                && kind == other.kind
                && text.equals(other.text)
                && Objects.equals(branchId, other.branchId)
                && Objects.equals(binding, other.binding)
                && Objects.equals(valueType, other.valueType)
                && references.equals(other.references)
                && Objects.equals(expectedType, other.expectedType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, position, branchId, binding, valueType, references, expectedType);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('#').append(position).append(' ').append(kind.getTag());
        if (branchId != null) sb.append('{').append(branchId).append('}');
        if (binding != null) {
            sb.append(" -> ").append(binding);
            if (valueType != null) sb.append(':').append(valueType);
        }
        sb.append(" \"").append(text).append('"');
        return sb.toString();
    }

    /**
     * Effect 构建器
     */
    public static final class Builder {
        private final EffectKind kind;
        private final String text;
        private int position = UNASSIGNED;
        private String branchId;
        private String binding;
        private String valueType;
        private final List<String> references = new ArrayList<String>();
        private String expectedType;

        private Builder(EffectKind kind, String text) {
            this.kind = kind;
            this.text = text;
        }

        public Builder position(int position) {
            this.position = position;
            return this;
        }

        public Builder branch(String branchId) {
            this.branchId = branchId;
            return this;
        }

        /** 引入的绑定及其类型 */
        public Builder binds(String name, String type) {
            this.binding = name;
            this.valueType = type;
            return this;
        }

        public Builder binds(String name) {
            this.binding = name;
            return this;
        }

        public Builder valueType(String type) {
            this.valueType = type;
            return this;
        }

        public Builder reads(String... names) {
            Collections.addAll(references, names);
            return this;
        }

        public Builder reads(List<String> names) {
            references.addAll(names);
            return this;
        }

        /** 对所消费值的类型要求 */
        public Builder expects(String type) {
            this.expectedType = type;
            return this;
        }

        public Effect build() {
            return new Effect(this);
        }
    }
}
