package com.luascript.compiler.tree;

import com.luascript.compiler.CompileException;
import com.luascript.compiler.ast.SourceSpan;

/**
 * 规范化阶段的结构错误：已识别的节点缺少必需字段或取值非法。
 */
public class StructuralException extends CompileException {
    private final String nodeType;
    private final String field;

    public StructuralException(String message, String nodeType, String field, SourceSpan span) {
        super(message, span);
        this.nodeType = nodeType;
        this.field = field;
    }

    public String getNodeType() {
        return nodeType;
    }

    public String getField() {
        return field;
    }
}
