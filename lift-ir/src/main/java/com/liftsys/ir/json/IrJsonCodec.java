package com.liftsys.ir.json;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.liftsys.ir.Assertion;
import com.liftsys.ir.Effect;
import com.liftsys.ir.EffectKind;
import com.liftsys.ir.IntentClause;
import com.liftsys.ir.IntermediateRepresentation;
import com.liftsys.ir.Metadata;
import com.liftsys.ir.Parameter;
import com.liftsys.ir.Signature;
import com.liftsys.ir.constraint.Constraint;
import com.liftsys.ir.constraint.ConstraintVisitor;
import com.liftsys.ir.constraint.LoopBehaviorConstraint;
import com.liftsys.ir.constraint.LoopPattern;
import com.liftsys.ir.constraint.PositionConstraint;
import com.liftsys.ir.constraint.PositionRelation;
import com.liftsys.ir.constraint.ReturnConstraint;
import com.liftsys.ir.constraint.TypeConstraint;

import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * IR 的 JSON 编解码（Gson 树模型）。
 *
 * <p>字段命名沿用上游 IR 生成器的 snake_case 约定。
 * 解码失败统一抛出 {@link IrFormatException} 并给出字段路径。</p>
 */
public final class IrJsonCodec {

    private final Gson gson;

    public IrJsonCodec() {
        this(false);
    }

    public IrJsonCodec(boolean pretty) {
        GsonBuilder builder = new GsonBuilder().disableHtmlEscaping();
        if (pretty) builder.setPrettyPrinting();
        this.gson = builder.create();
    }

    // ============ 解码 ============

    public IntermediateRepresentation read(String json) {
        return fromJsonTree(parse(json == null ? "" : json, "$"));
    }

    public IntermediateRepresentation read(Reader reader) {
        JsonElement root;
        try {
            root = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new IrFormatException("无法解析 JSON: " + e.getMessage(), "$", e);
        }
        return fromJsonTree(root);
    }

    private static JsonElement parse(String json, String path) {
        try {
            return JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new IrFormatException("无法解析 JSON: " + e.getMessage(), path, e);
        }
    }

    public IntermediateRepresentation fromJsonTree(JsonElement root) {
        JsonObject obj = asObject(root, "$");

        Signature signature = readSignature(requireObject(obj, "signature", "$"));
        IntermediateRepresentation.Builder b = IntermediateRepresentation.builder(signature);

        JsonObject intent = optObject(obj, "intent", "$");
        if (intent != null) {
            b.intent(new IntentClause(optString(intent, "summary", "$.intent"),
                    optString(intent, "rationale", "$.intent")));
        }

        JsonArray effects = optArray(obj, "effects", "$");
        if (effects != null) {
            for (int i = 0; i < effects.size(); i++) {
                try {
                    b.effect(readEffect(asObject(effects.get(i), "$.effects[" + i + "]"), i));
                } catch (IllegalArgumentException e) {
                    throw new IrFormatException(e.getMessage(), "$.effects[" + i + "]", e);
                }
            }
        }

        JsonArray assertions = optArray(obj, "assertions", "$");
        if (assertions != null) {
            for (int i = 0; i < assertions.size(); i++) {
                String path = "$.assertions[" + i + "]";
                JsonObject a = asObject(assertions.get(i), path);
                b.assertion(new Assertion(requireString(a, "predicate", path), optString(a, "rationale", path)));
            }
        }

        JsonArray constraints = optArray(obj, "constraints", "$");
        if (constraints != null) {
            for (int i = 0; i < constraints.size(); i++) {
                String path = "$.constraints[" + i + "]";
                try {
                    b.constraint(readConstraint(asObject(constraints.get(i), path), path));
                } catch (IllegalArgumentException e) {
                    throw new IrFormatException(e.getMessage(), path, e);
                }
            }
        }

        b.patternExample(optString(obj, "pattern_example", "$"));

        JsonObject metadata = optObject(obj, "metadata", "$");
        if (metadata != null) {
            b.metadata(new Metadata(optString(metadata, "source_path", "$.metadata"),
                    optString(metadata, "language", "$.metadata"),
                    optString(metadata, "origin", "$.metadata")));
        }
        return b.build();
    }

    private Signature readSignature(JsonObject sig) {
        String path = "$.signature";
        List<Parameter> params = new ArrayList<Parameter>();
        JsonArray arr = optArray(sig, "parameters", path);
        if (arr != null) {
            for (int i = 0; i < arr.size(); i++) {
                String p = path + ".parameters[" + i + "]";
                JsonObject po = asObject(arr.get(i), p);
                params.add(new Parameter(requireString(po, "name", p),
                        optString(po, "type_hint", p), optString(po, "description", p)));
            }
        }
        return new Signature(requireString(sig, "name", path), params, optString(sig, "returns", path));
    }

    private Effect readEffect(JsonObject e, int index) {
        String path = "$.effects[" + index + "]";
        String kindTag = requireString(e, "kind", path);
        EffectKind kind = EffectKind.fromTag(kindTag);
        if (kind == null) {
            throw new IrFormatException("未知的 effect 种类 '" + kindTag + "'", path + ".kind");
        }
        Effect.Builder b = Effect.builder(kind, requireString(e, "text", path));
        b.position(e.has("position") && !e.get("position").isJsonNull()
                ? requireInt(e, "position", path) : index);
        b.branch(optString(e, "branch_id", path));
        b.binds(optString(e, "binding", path), optString(e, "value_type", path));
        b.expects(optString(e, "expected_type", path));
        JsonArray refs = optArray(e, "references", path);
        if (refs != null) {
            for (int i = 0; i < refs.size(); i++) {
                b.reads(asString(refs.get(i), path + ".references[" + i + "]"));
            }
        }
        return b.build();
    }

    private Constraint readConstraint(JsonObject c, String path) {
        String type = requireString(c, "type", path);
        String description = optString(c, "description", path);
        if (ReturnConstraint.TYPE_TAG.equals(type)) {
            boolean mustReturn = !c.has("must_return") || requireBoolean(c, "must_return", path);
            return new ReturnConstraint(mustReturn, optString(c, "value_name", path), description);
        }
        if (LoopBehaviorConstraint.TYPE_TAG.equals(type)) {
            String patternName = requireString(c, "pattern", path);
            LoopPattern pattern = LoopPattern.fromName(patternName);
            if (pattern == null) {
                throw new IrFormatException("未知的循环模式 '" + patternName + "'", path + ".pattern");
            }
            boolean early = c.has("early_return") && requireBoolean(c, "early_return", path);
            return new LoopBehaviorConstraint(pattern, early, optString(c, "loop_variable", path), description);
        }
        if (PositionConstraint.TYPE_TAG.equals(type)) {
            String relationName = requireString(c, "relation", path);
            PositionRelation relation = PositionRelation.fromName(relationName);
            if (relation == null) {
                throw new IrFormatException("未知的位置关系 '" + relationName + "'", path + ".relation");
            }
            JsonArray subjects = optArray(c, "subjects", path);
            if (subjects == null || subjects.size() != 2) {
                throw new IrFormatException("subjects 必须恰好包含两个元素", path + ".subjects");
            }
            return new PositionConstraint(relation,
                    asString(subjects.get(0), path + ".subjects[0]"),
                    asString(subjects.get(1), path + ".subjects[1]"), description);
        }
        if (TypeConstraint.TYPE_TAG.equals(type)) {
            return new TypeConstraint(requireString(c, "expected_type", path), description);
        }
        throw new IrFormatException("未知的约束类型 '" + type + "'", path + ".type");
    }

    // ============ 编码 ============

    public String write(IntermediateRepresentation ir) {
        return gson.toJson(toJsonTree(ir));
    }

    public JsonObject toJsonTree(IntermediateRepresentation ir) {
        JsonObject root = new JsonObject();

        JsonObject intent = new JsonObject();
        intent.addProperty("summary", ir.getIntent().getSummary());
        putIfPresent(intent, "rationale", ir.getIntent().getRationale());
        root.add("intent", intent);

        Signature sig = ir.getSignature();
        JsonObject signature = new JsonObject();
        signature.addProperty("name", sig.getName());
        JsonArray params = new JsonArray();
        for (Parameter p : sig.getParameters()) {
            JsonObject po = new JsonObject();
            po.addProperty("name", p.getName());
            putIfPresent(po, "type_hint", p.getTypeHint());
            putIfPresent(po, "description", p.getDescription());
            params.add(po);
        }
        signature.add("parameters", params);
        putIfPresent(signature, "returns", sig.getReturnType());
        root.add("signature", signature);

        JsonArray effects = new JsonArray();
        for (Effect e : ir.getEffects()) {
            effects.add(writeEffect(e));
        }
        root.add("effects", effects);

        JsonArray assertions = new JsonArray();
        for (Assertion a : ir.getAssertions()) {
            JsonObject ao = new JsonObject();
            ao.addProperty("predicate", a.getPredicate());
            putIfPresent(ao, "rationale", a.getRationale());
            assertions.add(ao);
        }
        root.add("assertions", assertions);

        JsonArray constraints = new JsonArray();
        for (Constraint c : ir.getConstraints()) {
            constraints.add(c.accept(CONSTRAINT_WRITER, null));
        }
        root.add("constraints", constraints);

        putIfPresent(root, "pattern_example", ir.getPatternExample());

        Metadata m = ir.getMetadata();
        if (!Metadata.EMPTY.equals(m)) {
            JsonObject mo = new JsonObject();
            putIfPresent(mo, "source_path", m.getSourcePath());
            putIfPresent(mo, "language", m.getLanguage());
            putIfPresent(mo, "origin", m.getOrigin());
            root.add("metadata", mo);
        }
        return root;
    }

    private static JsonObject writeEffect(Effect e) {
        JsonObject eo = new JsonObject();
        eo.addProperty("kind", e.getKind().getTag());
        eo.addProperty("text", e.getText());
        eo.addProperty("position", e.getPosition());
        putIfPresent(eo, "branch_id", e.getBranchId());
        putIfPresent(eo, "binding", e.getBinding());
        putIfPresent(eo, "value_type", e.getValueType());
        if (!e.getReferences().isEmpty()) {
            JsonArray refs = new JsonArray();
            for (String r : e.getReferences()) refs.add(r);
            eo.add("references", refs);
        }
        putIfPresent(eo, "expected_type", e.getExpectedType());
        return eo;
    }

    private static final ConstraintVisitor<JsonObject, Void> CONSTRAINT_WRITER = new ConstraintVisitor<JsonObject, Void>() {
        @Override
        public JsonObject visitReturn(ReturnConstraint c, Void ctx) {
            JsonObject o = header(c);
            o.addProperty("must_return", c.isMustReturn());
            putIfPresent(o, "value_name", c.getValueName());
            return o;
        }

        @Override
        public JsonObject visitLoopBehavior(LoopBehaviorConstraint c, Void ctx) {
            JsonObject o = header(c);
            o.addProperty("pattern", c.getPattern().name());
            o.addProperty("early_return", c.isEarlyReturn());
            putIfPresent(o, "loop_variable", c.getLoopVariable());
            return o;
        }

        @Override
        public JsonObject visitPosition(PositionConstraint c, Void ctx) {
            JsonObject o = header(c);
            o.addProperty("relation", c.getRelation().name());
            JsonArray subjects = new JsonArray();
            subjects.add(c.getFirst());
            subjects.add(c.getSecond());
            o.add("subjects", subjects);
            return o;
        }

        @Override
        public JsonObject visitType(TypeConstraint c, Void ctx) {
            JsonObject o = header(c);
            o.addProperty("expected_type", c.getExpectedType());
            return o;
        }

        private JsonObject header(Constraint c) {
            JsonObject o = new JsonObject();
            o.addProperty("type", c.getTypeTag());
            if (c.hasExplicitDescription()) o.addProperty("description", c.getDescription());
            return o;
        }
    };

    // ============ 字段访问辅助 ============

    private static void putIfPresent(JsonObject obj, String key, String value) {
        if (value != null) obj.addProperty(key, value);
    }

    private static JsonObject asObject(JsonElement el, String path) {
        if (el == null || !el.isJsonObject()) {
            throw new IrFormatException("期望 JSON 对象", path);
        }
        return el.getAsJsonObject();
    }

    private static String asString(JsonElement el, String path) {
        if (el == null || !el.isJsonPrimitive() || !((JsonPrimitive) el).isString()) {
            throw new IrFormatException("期望字符串", path);
        }
        return el.getAsString();
    }

    private static JsonObject requireObject(JsonObject obj, String key, String path) {
        if (!obj.has(key) || obj.get(key).isJsonNull()) {
            throw new IrFormatException("缺少必填字段 '" + key + "'", path + "." + key);
        }
        return asObject(obj.get(key), path + "." + key);
    }

    private static JsonObject optObject(JsonObject obj, String key, String path) {
        if (!obj.has(key) || obj.get(key).isJsonNull()) return null;
        return asObject(obj.get(key), path + "." + key);
    }

    private static JsonArray optArray(JsonObject obj, String key, String path) {
        if (!obj.has(key) || obj.get(key).isJsonNull()) return null;
        JsonElement el = obj.get(key);
        if (!el.isJsonArray()) {
            throw new IrFormatException("期望 JSON 数组", path + "." + key);
        }
        return el.getAsJsonArray();
    }

    private static String requireString(JsonObject obj, String key, String path) {
        if (!obj.has(key) || obj.get(key).isJsonNull()) {
            throw new IrFormatException("缺少必填字段 '" + key + "'", path + "." + key);
        }
        return asString(obj.get(key), path + "." + key);
    }

    private static String optString(JsonObject obj, String key, String path) {
        if (!obj.has(key) || obj.get(key).isJsonNull()) return null;
        return asString(obj.get(key), path + "." + key);
    }

    private static int requireInt(JsonObject obj, String key, String path) {
        JsonElement el = obj.get(key);
        if (el == null || !el.isJsonPrimitive() || !((JsonPrimitive) el).isNumber()) {
            throw new IrFormatException("期望整数", path + "." + key);
        }
        try {
            // 1.5 之类的非整数值不截断
            return el.getAsBigDecimal().intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new IrFormatException("期望整数", path + "." + key, e);
        }
    }

    private static boolean requireBoolean(JsonObject obj, String key, String path) {
        JsonElement el = obj.get(key);
        if (el == null || !el.isJsonPrimitive() || !((JsonPrimitive) el).isBoolean()) {
            throw new IrFormatException("期望布尔值", path + "." + key);
        }
        return el.getAsBoolean();
    }
}
