package com.luascript.ir.node;

import com.luascript.compiler.CompileException;

/**
 * 节点 ID 或平衡三进制数字串格式错误。
 */
public class FormatException extends CompileException {
    private final String input;

    public FormatException(String message, String input) {
        super(message, null);
        this.input = input;
    }

    public String getInput() {
        return input;
    }
}
