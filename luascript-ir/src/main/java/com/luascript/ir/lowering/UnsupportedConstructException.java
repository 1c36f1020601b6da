package com.luascript.ir.lowering;

import com.luascript.compiler.CompileException;
import com.luascript.compiler.ast.SourceSpan;

/**
 * 降级阶段遇到不支持的语法结构或运算符。
 */
public class UnsupportedConstructException extends CompileException {
    private final String construct;

    public UnsupportedConstructException(String message, String construct, SourceSpan span) {
        super(message, span);
        this.construct = construct;
    }

    /** 被拒绝的节点种类或运算符 */
    public String getConstruct() {
        return construct;
    }
}
