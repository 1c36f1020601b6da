package com.luascript.ir.node;

import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * IR 文档：模块头、扁平节点表与可选的控制流图。
 *
 * <p>节点表按插入顺序保存，是所有节点的唯一所有者。</p>
 */
public class IrDocument {

    private String schemaVersion;
    private String moduleId;
    private final List<String> moduleBody = new ArrayList<>();
    private JsonObject metadata = new JsonObject();
    private final Map<String, IrNode> nodes = new LinkedHashMap<>();
    private final Map<String, ControlFlowGraph> controlFlowGraphs = new LinkedHashMap<>();
    /** 本次编译的 ID 分配器，不参与序列化 */
    private IdGenerator idGenerator;

    public IrDocument(String schemaVersion) {
        this.schemaVersion = schemaVersion;
    }

    public String getSchemaVersion() { return schemaVersion; }

    public void setSchemaVersion(String schemaVersion) {
        this.schemaVersion = schemaVersion;
    }

    // ============ module ============

    public String getModuleId() { return moduleId; }

    public void setModuleId(String moduleId) {
        this.moduleId = moduleId;
    }

    /** module.body：与 Program 节点的 body 一致 */
    public List<String> getModuleBody() { return moduleBody; }

    public JsonObject getMetadata() { return metadata; }

    public void setMetadata(JsonObject metadata) {
        this.metadata = metadata == null ? new JsonObject() : metadata;
    }

    // ============ nodes ============

    public void addNode(IrNode node) {
        if (nodes.containsKey(node.getId())) {
            throw new IllegalStateException("Duplicate node id: " + node.getId());
        }
        nodes.put(node.getId(), node);
    }

    public IrNode getNode(String id) {
        return id == null ? null : nodes.get(id);
    }

    public boolean hasNode(String id) {
        return id != null && nodes.containsKey(id);
    }

    public Collection<IrNode> getNodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public int getNodeCount() {
        return nodes.size();
    }

    public IrNode getProgram() {
        return getNode(moduleId);
    }

    // ============ CFG ============

    public void addControlFlowGraph(ControlFlowGraph graph) {
        controlFlowGraphs.put(graph.getId(), graph);
    }

    public ControlFlowGraph getControlFlowGraph(String id) {
        return id == null ? null : controlFlowGraphs.get(id);
    }

    public Collection<ControlFlowGraph> getControlFlowGraphs() {
        return Collections.unmodifiableCollection(controlFlowGraphs.values());
    }

    public void removeControlFlowGraph(String id) {
        controlFlowGraphs.remove(id);
    }

    // ============ ID ============

    public void setIdGenerator(IdGenerator idGenerator) {
        this.idGenerator = idGenerator;
    }

    /**
     * 获取 ID 分配器。反序列化得到的文档没有分配器，
     * 此时从已用最大值之后继续分配。
     */
    public IdGenerator getIdGenerator() {
        if (idGenerator == null) {
            long max = 0;
            for (String id : nodes.keySet()) {
                max = Math.max(max, valueOf(id));
            }
            for (ControlFlowGraph g : controlFlowGraphs.values()) {
                max = Math.max(max, valueOf(g.getId()));
                for (BasicBlock b : g.getBlocks()) {
                    max = Math.max(max, valueOf(b.getId()));
                }
            }
            idGenerator = new IdGenerator(max + 1);
        }
        return idGenerator;
    }

    private static long valueOf(String id) {
        if (!NodeId.isValid(id)) return 0;
        try {
            return NodeId.parse(id).getValue();
        } catch (FormatException e) {
            // 超出 long 范围的 ID 不参与续号
            return 0;
        }
    }
}
