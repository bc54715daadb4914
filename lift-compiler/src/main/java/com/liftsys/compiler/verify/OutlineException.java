package com.liftsys.compiler.verify;

/**
 * 源码无法解析为语句大纲
 */
public class OutlineException extends RuntimeException {
    private final int line;

    public OutlineException(String message, int line) {
        super(line > 0 ? message + " (line " + line + ")" : message);
        this.line = line;
    }

    /** 出错行号（从 1 开始），未知为 0 */
    public int getLine() {
        return line;
    }
}
