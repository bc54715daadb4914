package com.liftsys.compiler.assembly;

import java.util.ArrayList;
import java.util.List;

/**
 * 组装上下文，收集输出行并缓存各层的缩进前缀
 */
class AssemblyContext {
    private final List<String> lines = new ArrayList<>();
    private final List<String> indentCache = new ArrayList<>();
    private final AssemblyConfig config;
    private final String unit;

    AssemblyContext(AssemblyConfig config) {
        this.config = config;
        this.unit = config.getIndentString();
        indentCache.add("");
    }

    AssemblyConfig getConfig() {
        return config;
    }

    /**
     * 获取指定深度的缩进前缀
     */
    String indentFor(int depth) {
        while (indentCache.size() <= depth) {
            indentCache.add(indentCache.get(indentCache.size() - 1) + unit);
        }
        return indentCache.get(depth);
    }

    /** 原样追加一行 */
    void line(String text) {
        lines.add(text);
    }

    /** 追加空行（不带任何缩进） */
    void blankLine() {
        lines.add("");
    }

    int lineCount() {
        return lines.size();
    }

    /**
     * 以换行连接全部输出行，末尾无换行
     */
    String getOutput() {
        return String.join("\n", lines);
    }
}
