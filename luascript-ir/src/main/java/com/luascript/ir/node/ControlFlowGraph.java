package com.luascript.ir.node;

import java.util.ArrayList;
import java.util.List;

/**
 * 单个函数体（或模块顶层）的控制流图。
 */
public class ControlFlowGraph {

    private final String id;
    private final String functionId;
    private final List<BasicBlock> blocks = new ArrayList<>();
    private String entry;
    private String exit;

    public ControlFlowGraph(String id, String functionId) {
        this.id = id;
        this.functionId = functionId;
    }

    public String getId() { return id; }

    public String getFunctionId() { return functionId; }

    public List<BasicBlock> getBlocks() { return blocks; }

    public void addBlock(BasicBlock block) {
        blocks.add(block);
    }

    public BasicBlock getBlock(String blockId) {
        if (blockId == null) return null;
        for (BasicBlock b : blocks) {
            if (b.getId().equals(blockId)) return b;
        }
        return null;
    }

    public String getEntry() { return entry; }

    public void setEntry(String entry) {
        this.entry = entry;
    }

    public String getExit() { return exit; }

    public void setExit(String exit) {
        this.exit = exit;
    }
}
