package com.liftsys.compiler.assembly;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 单个结构节点的实现代码片段。
 *
 * <p>{@code code} 可以是多行，并自带相对缩进（首行相对缩进为 0）。
 * {@code rationale} 非空时作为注释行输出在代码之前。</p>
 */
public final class Fragment {

    private final String code;
    private final String rationale;

    public Fragment(String code, String rationale) {
        this.code = code != null ? code : "";
        this.rationale = rationale;
    }

    public static Fragment of(String code) {
        return new Fragment(code, null);
    }

    /** 将 id → 代码 的映射包装为片段表 */
    public static Map<String, Fragment> codeMap(Map<String, String> codeById) {
        Map<String, Fragment> result = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : codeById.entrySet()) {
            result.put(entry.getKey(), of(entry.getValue()));
        }
        return result;
    }

    public String getCode() { return code; }
    public String getRationale() { return rationale; }

    public boolean hasRationale() {
        return rationale != null && !rationale.trim().isEmpty();
    }
}
