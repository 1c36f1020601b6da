package com.luascript.ir.lowering;

import com.luascript.compiler.ast.SourceSpan;
import com.luascript.ir.node.IdGenerator;
import com.luascript.ir.node.IrDocument;
import com.luascript.ir.node.IrKind;
import com.luascript.ir.node.IrNode;

import java.util.List;

/**
 * IR 构建辅助类。
 * 分配节点 ID 并把节点登记到文档的扁平节点表。
 */
public class IrBuilder {

    private final IrDocument document;
    private final IdGenerator ids;

    public IrBuilder(IrDocument document) {
        this.document = document;
        this.ids = document.getIdGenerator();
    }

    /**
     * 创建并登记节点。
     */
    public IrNode create(IrKind kind, SourceSpan span) {
        IrNode node = new IrNode(ids.next(kind.getCategory()), kind);
        node.setSpan(span);
        document.addNode(node);
        return node;
    }

    // ========== 常用节点 ==========

    public IrNode identifier(String name, SourceSpan span) {
        return create(IrKind.IDENTIFIER, span).setString("name", name);
    }

    public IrNode block(List<String> body, SourceSpan span) {
        return create(IrKind.BLOCK_STATEMENT, span).setRefs("body", body);
    }
}
