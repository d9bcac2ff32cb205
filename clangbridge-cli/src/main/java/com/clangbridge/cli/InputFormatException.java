package com.clangbridge.cli;

/**
 * 输入文件（签名描述、类型表）格式错误
 */
public class InputFormatException extends RuntimeException {
    private final String source;

    public InputFormatException(String message, String source) {
        super(message);
        this.source = source;
    }

    public InputFormatException(String message, String source, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    @Override
    public String getMessage() {
        if (source == null) return super.getMessage();
        return source + ": " + super.getMessage();
    }
}
