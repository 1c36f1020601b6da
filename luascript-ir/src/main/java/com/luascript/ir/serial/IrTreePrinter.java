package com.luascript.ir.serial;

import com.google.gson.JsonElement;
import com.luascript.ir.node.FieldSpec;
import com.luascript.ir.node.IrDocument;
import com.luascript.ir.node.IrNode;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * IR 的缩进树视图（调试用），从 {@code module.id} 出发按负载声明顺序展开子节点。
 *
 * <pre>
 * Program#mod_1
 *   VariableDeclaration#decl_1T declarationKind=const
 *     declarations:
 *       VariableDeclarator#decl_10 declarationKind=const
 * </pre>
 */
public class IrTreePrinter {

    private static final String INDENT = "  ";

    public String print(IrDocument document) {
        StringBuilder sb = new StringBuilder();
        IrNode root = document.getNode(document.getModuleId());
        if (root == null) {
            sb.append("<missing module ").append(document.getModuleId()).append(">\n");
            return sb.toString();
        }
        printNode(document, root, 0, new HashSet<String>(), sb);
        return sb.toString();
    }

    private void printNode(IrDocument document, IrNode node, int depth, Set<String> visiting, StringBuilder sb) {
        indent(sb, depth);
        sb.append(node);
        if (node.getKind() == null) {
            sb.append(" <unknown kind>\n");
            return;
        }
        for (FieldSpec field : node.getKind().getFields()) {
            if (field.getType().isReference()) continue;
            JsonElement v = node.getField(field.getName());
            if (v == null || v.isJsonNull()) continue;
            sb.append(' ').append(field.getName()).append('=').append(v.isJsonPrimitive() ? v.getAsString() : v);
        }
        sb.append('\n');
        if (!visiting.add(node.getId())) {
            indent(sb, depth + 1);
            sb.append("<cycle>\n");
            return;
        }
        for (FieldSpec field : node.getKind().getFields()) {
            switch (field.getType()) {
                case NODE:
                case OPTIONAL_NODE: {
                    String ref = node.getRef(field.getName());
                    if (ref == null) continue;
                    indent(sb, depth + 1);
                    sb.append(field.getName()).append(":\n");
                    printRef(document, ref, depth + 2, visiting, sb);
                    break;
                }
                case NODE_LIST:
                case SPARSE_NODE_LIST: {
                    List<String> refs = node.getRefs(field.getName());
                    if (refs.isEmpty()) continue;
                    indent(sb, depth + 1);
                    sb.append(field.getName()).append(":\n");
                    for (String ref : refs) {
                        if (ref == null) {
                            indent(sb, depth + 2);
                            sb.append("<hole>\n");
                        } else {
                            printRef(document, ref, depth + 2, visiting, sb);
                        }
                    }
                    break;
                }
                default:
                    break;
            }
        }
        visiting.remove(node.getId());
    }

    private void printRef(IrDocument document, String ref, int depth, Set<String> visiting, StringBuilder sb) {
        IrNode child = document.getNode(ref);
        if (child == null) {
            indent(sb, depth);
            sb.append("<missing ").append(ref).append(">\n");
            return;
        }
        printNode(document, child, depth, visiting, sb);
    }

    private static void indent(StringBuilder sb, int depth) {
        for (int i = 0; i < depth; i++) {
            sb.append(INDENT);
        }
    }
}
