package com.luascript.ir.serial;

import com.luascript.ir.node.*;

import java.util.List;

/**
 * Graphviz DOT 视图：节点引用图，以及每个控制流图一个 cluster。
 */
public class IrDotWriter {

    public String write(IrDocument document) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph ir {\n");
        sb.append("  node [shape=box, fontname=\"monospace\"];\n");
        for (IrNode node : document.getNodes()) {
            sb.append("  ").append(quote(node.getId()))
                    .append(" [label=").append(quote(node.getTag() + "\n" + node.getId())).append("];\n");
        }
        for (IrNode node : document.getNodes()) {
            if (node.getKind() == null) continue;
            for (FieldSpec field : node.getKind().getFields()) {
                switch (field.getType()) {
                    case NODE:
                    case OPTIONAL_NODE: {
                        String ref = node.getRef(field.getName());
                        if (ref != null) {
                            edge(sb, "  ", node.getId(), ref, field.getName());
                        }
                        break;
                    }
                    case NODE_LIST:
                    case SPARSE_NODE_LIST: {
                        List<String> refs = node.getRefs(field.getName());
                        for (int i = 0; i < refs.size(); i++) {
                            if (refs.get(i) != null) {
                                edge(sb, "  ", node.getId(), refs.get(i), field.getName() + "[" + i + "]");
                            }
                        }
                        break;
                    }
                    default:
                        break;
                }
            }
        }
        for (ControlFlowGraph graph : document.getControlFlowGraphs()) {
            writeGraph(graph, sb);
        }
        sb.append("}\n");
        return sb.toString();
    }

    private void writeGraph(ControlFlowGraph graph, StringBuilder sb) {
        sb.append("  subgraph ").append(quote("cluster_" + graph.getId())).append(" {\n");
        sb.append("    label=").append(quote(graph.getId() + " (" + graph.getFunctionId() + ")")).append(";\n");
        sb.append("    style=dashed;\n");
        for (BasicBlock block : graph.getBlocks()) {
            StringBuilder label = new StringBuilder(block.getKind().getTag()).append(' ').append(block.getId());
            for (String stmt : block.getStatements()) {
                label.append('\n').append(stmt);
            }
            sb.append("    ").append(quote(block.getId()))
                    .append(" [shape=ellipse, label=").append(quote(label.toString())).append("];\n");
        }
        for (BasicBlock block : graph.getBlocks()) {
            for (String succ : block.getSuccessors()) {
                edge(sb, "    ", block.getId(), succ, null);
            }
        }
        sb.append("  }\n");
    }

    private static void edge(StringBuilder sb, String indent, String from, String to, String label) {
        sb.append(indent).append(quote(from)).append(" -> ").append(quote(to));
        if (label != null) {
            sb.append(" [label=").append(quote(label)).append(']');
        }
        sb.append(";\n");
    }

    static String quote(String s) {
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"': sb.append("\\\""); break;
                case '\\': sb.append("\\\\"); break;
                case '\n': sb.append("\\n"); break;
                default: sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
