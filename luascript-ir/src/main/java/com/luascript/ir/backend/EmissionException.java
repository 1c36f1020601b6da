package com.luascript.ir.backend;

import com.luascript.compiler.CompileException;
import com.luascript.compiler.ast.SourceSpan;

/**
 * Lua 代码生成失败：节点结构不完整，或控制流无法在 Lua 中表达。
 */
public class EmissionException extends CompileException {
    private final String nodeId;

    public EmissionException(String message, String nodeId, SourceSpan span) {
        super(message, span);
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
