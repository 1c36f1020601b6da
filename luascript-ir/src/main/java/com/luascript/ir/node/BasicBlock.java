package com.luascript.ir.node;

import java.util.ArrayList;
import java.util.List;

/**
 * 控制流图中的基本块：有序的语句 ID 与后继块 ID。
 */
public class BasicBlock {

    private final String id;
    private final BlockKind kind;
    private final List<String> statements = new ArrayList<>();
    private final List<String> successors = new ArrayList<>();

    public BasicBlock(String id, BlockKind kind) {
        this.id = id;
        this.kind = kind;
    }

    public String getId() { return id; }

    public BlockKind getKind() { return kind; }

    public List<String> getStatements() { return statements; }

    public List<String> getSuccessors() { return successors; }

    public void addStatement(String statementId) {
        statements.add(statementId);
    }

    public void addSuccessor(String blockId) {
        if (!successors.contains(blockId)) {
            successors.add(blockId);
        }
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(id).append(" (").append(kind.getTag()).append("):\n");
        for (String s : statements) {
            sb.append("  ").append(s).append('\n');
        }
        if (!successors.isEmpty()) {
            sb.append("  -> ").append(String.join(", ", successors)).append('\n');
        }
        return sb.toString();
    }
}
