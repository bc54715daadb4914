package com.liftsys.ir.json;

/**
 * IR JSON 格式错误
 */
public class IrFormatException extends RuntimeException {
    private final String path;

    public IrFormatException(String message, String path) {
        super(message);
        this.path = path;
    }

    public IrFormatException(String message, String path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    /** 出错字段的 JSON 路径，如 {@code effects[2].kind} */
    public String getPath() {
        return path;
    }

    @Override
    public String getMessage() {
        return path != null ? super.getMessage() + " (at " + path + ")" : super.getMessage();
    }
}
