package com.liftsys.ir.types;

import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * 类型名兼容性判断：仅依据 Signature/Effect 上声明的类型名，不做执行。
 *
 * <p>规则：别名归一化后相等即兼容；Any/Object 兼容一切；
 * list/array 族、dict/map 族各自互相兼容；数值拓宽 int → float/number。</p>
 */
public final class TypeCompatibility {

    private TypeCompatibility() {}

    private static final Map<String, String> ALIASES = new HashMap<String, String>();
    private static final Set<String> WILDCARDS = new HashSet<String>(Arrays.asList("any", "object", "unknown"));
    private static final Set<String> LIST_FAMILY = new HashSet<String>(
            Arrays.asList("list", "array", "sequence", "collection", "iterable"));
    private static final Set<String> DICT_FAMILY = new HashSet<String>(
            Arrays.asList("dict", "map", "mapping", "dictionary"));
    private static final Set<String> WIDE_NUMERIC = new HashSet<String>(Arrays.asList("float", "number"));
    private static final Set<String> NUMERIC = new HashSet<String>(Arrays.asList("int", "float", "number"));

    static {
        ALIASES.put("string", "str");
        ALIASES.put("text", "str");
        ALIASES.put("char", "str");
        ALIASES.put("integer", "int");
        ALIASES.put("long", "int");
        ALIASES.put("short", "int");
        ALIASES.put("boolean", "bool");
        ALIASES.put("double", "float");
        ALIASES.put("decimal", "float");
        ALIASES.put("real", "float");
        ALIASES.put("hashmap", "dict");
        ALIASES.put("arraylist", "list");
        ALIASES.put("none", "void");
        ALIASES.put("unit", "void");
        ALIASES.put("null", "void");
    }

    /**
     * 归一化类型名：去掉泛型参数与 Optional 包装，小写并展开别名。
     * {@code List<String>} → {@code list}，{@code Optional[int]} → {@code int}。
     *
     * @return 归一化结果；null/空白返回 null
     */
    public static String normalize(String typeName) {
        if (typeName == null) return null;
        String t = typeName.trim();
        if (t.isEmpty()) return null;
        t = unwrapOptional(t);
        if (t.endsWith("[]")) return "list";
        int generic = indexOfGenericStart(t);
        if (generic > 0) t = t.substring(0, generic).trim();
        if (t.endsWith("?")) t = t.substring(0, t.length() - 1);
        int dot = t.lastIndexOf('.');
        if (dot >= 0 && dot < t.length() - 1) t = t.substring(dot + 1);
        t = t.toLowerCase();
        String alias = ALIASES.get(t);
        return alias != null ? alias : t;
    }

    private static String unwrapOptional(String t) {
        String lower = t.toLowerCase();
        for (String wrapper : new String[]{"optional[", "optional<"}) {
            if (lower.startsWith(wrapper) && (t.endsWith("]") || t.endsWith(">"))) {
                return t.substring(wrapper.length(), t.length() - 1).trim();
            }
        }
        return t;
    }

    private static int indexOfGenericStart(String t) {
        int bracket = t.indexOf('[');
        int angle = t.indexOf('<');
        if (bracket < 0) return angle;
        if (angle < 0) return bracket;
        return Math.min(bracket, angle);
    }

    /**
     * 判断声明为 {@code actual} 的值能否用在要求 {@code expected} 的位置。
     * 任一方未声明时视为兼容。
     */
    public static boolean isCompatible(String expected, String actual) {
        String e = normalize(expected);
        String a = normalize(actual);
        if (e == null || a == null) return true;
        if (e.equals(a)) return true;
        if (WILDCARDS.contains(e) || WILDCARDS.contains(a)) return true;
        if (LIST_FAMILY.contains(e) && LIST_FAMILY.contains(a)) return true;
        if (DICT_FAMILY.contains(e) && DICT_FAMILY.contains(a)) return true;
        // 数值拓宽
        return WIDE_NUMERIC.contains(e) && NUMERIC.contains(a);
    }

    /** 未声明、空白或 void/None/Unit/null 均视为无返回值 */
    public static boolean isVoid(String typeName) {
        String n = normalize(typeName);
        return n == null || "void".equals(n);
    }

    /** 是否为数值类型名 */
    public static boolean isNumeric(String typeName) {
        String n = normalize(typeName);
        return n != null && NUMERIC.contains(n);
    }
}
