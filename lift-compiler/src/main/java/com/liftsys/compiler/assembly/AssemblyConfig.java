package com.liftsys.compiler.assembly;

/**
 * 代码组装配置
 */
public class AssemblyConfig {
    private int indentSize = 4;
    private boolean useSpaces = true;
    private boolean emitRationale = true;
    private String commentPrefix = "#";
    private String emptyBodyPlaceholder = "pass";

    public AssemblyConfig() {
    }

    public int getIndentSize() {
        return indentSize;
    }

    public void setIndentSize(int indentSize) {
        if (indentSize < 0) {
            throw new IllegalArgumentException("indentSize must be >= 0: " + indentSize);
        }
        this.indentSize = indentSize;
    }

    public boolean isUseSpaces() {
        return useSpaces;
    }

    public void setUseSpaces(boolean useSpaces) {
        this.useSpaces = useSpaces;
    }

    public boolean isEmitRationale() {
        return emitRationale;
    }

    public void setEmitRationale(boolean emitRationale) {
        this.emitRationale = emitRationale;
    }

    public String getCommentPrefix() {
        return commentPrefix;
    }

    public void setCommentPrefix(String commentPrefix) {
        this.commentPrefix = commentPrefix;
    }

    /** 函数体为空时填充的语句 */
    public String getEmptyBodyPlaceholder() {
        return emptyBodyPlaceholder;
    }

    public void setEmptyBodyPlaceholder(String emptyBodyPlaceholder) {
        this.emptyBodyPlaceholder = emptyBodyPlaceholder;
    }

    /**
     * 获取单层缩进字符串
     */
    public String getIndentString() {
        if (useSpaces) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < indentSize; i++) {
                sb.append(' ');
            }
            return sb.toString();
        } else {
            return "\t";
        }
    }
}
