package com.luascript.ir.pass;

import com.google.gson.JsonObject;
import com.luascript.compiler.compiler.CompileOptions;
import com.luascript.ir.node.*;

import java.util.*;

/**
 * 控制流图构建：把每个函数体（以及模块顶层）划分为基本块。
 *
 * <p>直线语句累积在当前块；分支/循环/switch/try 各自独占一个块；
 * return/throw/break/continue 结束当前块。末尾追加 exit 块。
 * 后继关系：顺序落入下一个块，return/throw 跳到 exit。</p>
 */
public class ControlFlowGraphPass implements IrPass {

    @Override
    public String getName() {
        return "ControlFlowGraph";
    }

    @Override
    public boolean isEnabled(CompileOptions options) {
        return options.isBuildControlFlowGraphs();
    }

    @Override
    public IrDocument run(IrDocument document) {
        IdGenerator ids = document.getIdGenerator();
        // 先收集再构建，避免遍历时修改
        List<IrNode> owners = new ArrayList<>();
        for (IrNode node : document.getNodes()) {
            if (node.is(IrKind.PROGRAM) || (node.getKind() != null && node.getKind().isFunction())) {
                owners.add(node);
            }
        }
        for (IrNode owner : owners) {
            List<String> body = bodyStatements(document, owner);
            if (body == null) continue;
            dropPrevious(document, owner);
            ControlFlowGraph graph = build(document, ids, owner.getId(), body);
            document.addControlFlowGraph(graph);
            JsonObject cfg = new JsonObject();
            cfg.addProperty("id", graph.getId());
            cfg.addProperty("entry", graph.getEntry());
            cfg.addProperty("exit", graph.getExit());
            owner.meta().add("cfg", cfg);
        }
        return document;
    }

    /**
     * 函数体语句列表：Program 取自身 body，函数取 body 块的 body。
     */
    static List<String> bodyStatements(IrDocument document, IrNode owner) {
        if (owner.is(IrKind.PROGRAM)) {
            return owner.getRefs("body");
        }
        IrNode block = document.getNode(owner.getRef("body"));
        if (block == null || !block.is(IrKind.BLOCK_STATEMENT)) {
            return null;
        }
        return block.getRefs("body");
    }

    private static void dropPrevious(IrDocument document, IrNode owner) {
        JsonObject meta = owner.getMeta();
        if (meta != null && meta.has("cfg") && meta.get("cfg").isJsonObject()) {
            JsonObject old = meta.getAsJsonObject("cfg");
            if (old.has("id") && !old.get("id").isJsonNull()) {
                document.removeControlFlowGraph(old.get("id").getAsString());
            }
        }
    }

    private ControlFlowGraph build(IrDocument document, IdGenerator ids, String ownerId, List<String> body) {
        ControlFlowGraph graph = new ControlFlowGraph(ids.next(NodeCategory.GRAPH), ownerId);
        BasicBlock entry = new BasicBlock(ids.next(NodeCategory.BLOCK), BlockKind.ENTRY);
        graph.addBlock(entry);
        graph.setEntry(entry.getId());

        Set<String> closed = new HashSet<>();
        List<BasicBlock> jumpsToExit = new ArrayList<>();
        BasicBlock current = entry;
        BasicBlock previous = null;

        for (String stmtId : body) {
            IrNode stmt = document.getNode(stmtId);
            IrKind kind = stmt == null ? null : stmt.getKind();
            if (isCompound(kind)) {
                BasicBlock branch = new BasicBlock(ids.next(NodeCategory.BLOCK), BlockKind.BRANCH);
                graph.addBlock(branch);
                BasicBlock from = current != null ? current : previous;
                if (from != null && !closed.contains(from.getId())) {
                    from.addSuccessor(branch.getId());
                }
                branch.addStatement(stmtId);
                if (containsExitJump(document, stmt)) {
                    jumpsToExit.add(branch);
                }
                previous = branch;
                current = null;
                continue;
            }
            if (current == null || closed.contains(current.getId())) {
                BasicBlock next = new BasicBlock(ids.next(NodeCategory.BLOCK), BlockKind.BODY);
                graph.addBlock(next);
                BasicBlock from = current != null ? current : previous;
                if (from != null && !closed.contains(from.getId())) {
                    from.addSuccessor(next.getId());
                }
                current = next;
            }
            current.addStatement(stmtId);
            if (isJump(kind)) {
                closed.add(current.getId());
                if (kind == IrKind.RETURN_STATEMENT || kind == IrKind.THROW_STATEMENT) {
                    jumpsToExit.add(current);
                }
            }
            previous = current;
        }

        BasicBlock exit = new BasicBlock(ids.next(NodeCategory.BLOCK), BlockKind.EXIT);
        graph.addBlock(exit);
        graph.setExit(exit.getId());
        BasicBlock last = current != null ? current : previous;
        if (last == null) {
            last = entry;
        }
        if (!closed.contains(last.getId())) {
            last.addSuccessor(exit.getId());
        }
        for (BasicBlock b : jumpsToExit) {
            b.addSuccessor(exit.getId());
        }
        return graph;
    }

    private static boolean isCompound(IrKind kind) {
        if (kind == null) return false;
        return kind == IrKind.IF_STATEMENT || kind.isLoop()
                || kind == IrKind.SWITCH_STATEMENT || kind == IrKind.TRY_STATEMENT;
    }

    private static boolean isJump(IrKind kind) {
        return kind == IrKind.RETURN_STATEMENT || kind == IrKind.THROW_STATEMENT
                || kind == IrKind.BREAK_STATEMENT || kind == IrKind.CONTINUE_STATEMENT;
    }

    /** 子树中（不进入嵌套函数）是否有 return/throw */
    private static boolean containsExitJump(IrDocument document, IrNode root) {
        Deque<IrNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            IrNode n = stack.pop();
            if (n.is(IrKind.RETURN_STATEMENT) || n.is(IrKind.THROW_STATEMENT)) {
                return true;
            }
            for (String childId : n.children()) {
                IrNode c = document.getNode(childId);
                if (c == null || (c.getKind() != null && c.getKind().isFunction())) continue;
                stack.push(c);
            }
        }
        return false;
    }
}
