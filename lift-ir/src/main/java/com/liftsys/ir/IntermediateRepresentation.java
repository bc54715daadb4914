package com.liftsys.ir;

import com.liftsys.ir.constraint.Constraint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 中间表示：函数的意图、签名、有序 Effect、断言与约束。
 *
 * <p>由上游生成步骤一次性构造，此后不可变。所有列表均为只读副本。</p>
 */
public final class IntermediateRepresentation {

    private final IntentClause intent;
    private final Signature signature;
    private final List<Effect> effects;
    private final List<Assertion> assertions;
    private final List<Constraint> constraints;
    private final String patternExample;
    private final Metadata metadata;

    private IntermediateRepresentation(Builder b) {
        this.intent = b.intent != null ? b.intent : new IntentClause("");
        this.signature = Objects.requireNonNull(b.signature, "signature");
        List<Effect> positioned = new ArrayList<Effect>(b.effects.size());
        for (int i = 0; i < b.effects.size(); i++) {
            Effect e = b.effects.get(i);
            positioned.add(e.getPosition() == Effect.UNASSIGNED ? e.withPosition(i) : e);
        }
        this.effects = Collections.unmodifiableList(positioned);
        this.assertions = Collections.unmodifiableList(new ArrayList<Assertion>(b.assertions));
        this.constraints = Collections.unmodifiableList(new ArrayList<Constraint>(b.constraints));
        this.patternExample = b.patternExample;
        this.metadata = b.metadata != null ? b.metadata : Metadata.EMPTY;
    }

    public static Builder builder(Signature signature) {
        return new Builder(signature);
    }

    public IntentClause getIntent() { return intent; }
    public Signature getSignature() { return signature; }
    public List<Effect> getEffects() { return effects; }
    public List<Assertion> getAssertions() { return assertions; }
    public List<Constraint> getConstraints() { return constraints; }
    public String getPatternExample() { return patternExample; }
    public Metadata getMetadata() { return metadata; }

    /** 无 Effect 即视为空操作函数 */
    public boolean isNoOp() {
        return effects.isEmpty();
    }

    /** 按约束类型过滤 */
    public <T extends Constraint> List<T> constraintsOf(Class<T> type) {
        List<T> result = new ArrayList<T>();
        for (Constraint c : constraints) {
            if (type.isInstance(c)) result.add(type.cast(c));
        }
        return result;
    }

    public Builder toBuilder() {
        Builder b = new Builder(signature);
        b.intent = intent;
        b.effects.addAll(effects);
        b.assertions.addAll(assertions);
        b.constraints.addAll(constraints);
        b.patternExample = patternExample;
        b.metadata = metadata;
        return b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IntermediateRepresentation)) return false;
        IntermediateRepresentation other = (IntermediateRepresentation) o;
        return intent.equals(other.intent)
                && signature.equals(other.signature)
                && effects.equals(other.effects)
                && assertions.equals(other.assertions)
                && constraints.equals(other.constraints)
                && Objects.equals(patternExample, other.patternExample)
                && metadata.equals(other.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(intent, signature, effects, assertions, constraints, patternExample, metadata);
    }

    @Override
    public String toString() {
        return "IR[" + signature + ", " + effects.size() + " effects, "
                + constraints.size() + " constraints]";
    }

    /**
     * IR 构建器。未指定位置的 Effect 按加入顺序编号。
     */
    public static final class Builder {
        private IntentClause intent;
        private final Signature signature;
        private final List<Effect> effects = new ArrayList<Effect>();
        private final List<Assertion> assertions = new ArrayList<Assertion>();
        private final List<Constraint> constraints = new ArrayList<Constraint>();
        private String patternExample;
        private Metadata metadata;

        private Builder(Signature signature) {
            this.signature = signature;
        }

        public Builder intent(String summary) {
            this.intent = new IntentClause(summary);
            return this;
        }

        public Builder intent(IntentClause intent) {
            this.intent = intent;
            return this;
        }

        public Builder effect(Effect effect) {
            effects.add(Objects.requireNonNull(effect, "effect"));
            return this;
        }

        public Builder effect(EffectKind kind, String text) {
            return effect(Effect.of(kind, text));
        }

        public Builder effects(List<Effect> list) {
            for (Effect e : list) effect(e);
            return this;
        }

        public Builder assertion(String predicate) {
            assertions.add(new Assertion(predicate));
            return this;
        }

        public Builder assertion(Assertion assertion) {
            assertions.add(Objects.requireNonNull(assertion, "assertion"));
            return this;
        }

        public Builder constraint(Constraint constraint) {
            constraints.add(Objects.requireNonNull(constraint, "constraint"));
            return this;
        }

        public Builder patternExample(String example) {
            this.patternExample = example;
            return this;
        }

        public Builder metadata(Metadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public IntermediateRepresentation build() {
            return new IntermediateRepresentation(this);
        }
    }
}
