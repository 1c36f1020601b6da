package com.luascript.compiler;

import com.luascript.compiler.ast.SourceSpan;

/**
 * 编译各阶段异常的公共基类。
 */
public class CompileException extends RuntimeException {
    private final SourceSpan span;

    public CompileException(String message, SourceSpan span) {
        super(message);
        this.span = span;
    }

    public CompileException(String message, SourceSpan span, Throwable cause) {
        super(message, cause);
        this.span = span;
    }

    public SourceSpan getSpan() {
        return span;
    }

    /** 不带位置信息的原始消息 */
    public String getRawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (span != null && span.getStart() != null) {
            sb.append(" at ").append(span.getStart());
        }
        return sb.toString();
    }
}
