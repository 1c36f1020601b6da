package com.luascript.ir.pass;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.luascript.compiler.ast.SourceSpan;
import com.luascript.ir.node.*;

import java.util.*;

/**
 * IR 结构校验器（只读）。
 *
 * <p>不在第一个错误处停止，按固定顺序收集全部错误：schemaVersion 与模块头、
 * 节点表（按插入顺序）、控制流图、性能元数据。对同一文档重复校验结果相同。</p>
 */
public class IrValidator {

    private static final Set<String> DECLARATION_KINDS = new HashSet<>(Arrays.asList("var", "let", "const"));

    public ValidationResult validate(IrDocument document) {
        List<String> errors = new ArrayList<>();
        checkModule(document, errors);
        for (IrNode node : document.getNodes()) {
            checkNode(document, node, errors);
        }
        checkControlFlowGraphs(document, errors);
        checkMetaPerf(document, errors);
        return new ValidationResult(errors);
    }

    // ========== 模块 ==========

    private void checkModule(IrDocument document, List<String> errors) {
        String version = document.getSchemaVersion();
        if (version == null || version.trim().isEmpty()) {
            errors.add("schemaVersion is missing or empty");
        }
        String moduleId = document.getModuleId();
        IrNode program = document.getNode(moduleId);
        if (program == null) {
            errors.add("module.id '" + moduleId + "' does not resolve to a node");
        } else if (!program.is(IrKind.PROGRAM)) {
            errors.add("module.id '" + moduleId + "' names a " + program.getTag() + ", expected Program");
        }
        for (String id : document.getModuleBody()) {
            if (!document.hasNode(id)) {
                errors.add("module.body references missing node '" + id + "'");
            }
        }
        if (program != null && program.is(IrKind.PROGRAM)
                && !program.getRefs("body").equals(document.getModuleBody())) {
            errors.add("module.body does not match the body of Program '" + moduleId + "'");
        }
    }

    // ========== 节点 ==========

    private void checkNode(IrDocument document, IrNode node, List<String> errors) {
        String id = node.getId();
        if (!NodeId.isValid(id)) {
            errors.add("Node id '" + id + "' is malformed");
        }
        IrKind kind = node.getKind();
        if (kind == null) {
            errors.add("Node '" + id + "' has unknown kind '" + node.getTag() + "'");
            return;
        }
        if (NodeId.isValid(id) && !id.startsWith(kind.getCategory().getPrefix() + "_")) {
            errors.add("Node '" + id + "' (" + kind.getTag() + ") should use id category '"
                    + kind.getCategory().getPrefix() + "'");
        }

        checkFields(document, node, errors);

        Set<String> allowed = Operators.allowedFor(kind);
        if (allowed != null) {
            String op = node.getString("operator");
            if (op != null && !allowed.contains(op)) {
                errors.add("Node '" + id + "' (" + kind.getTag() + ") has unsupported operator '" + op + "'");
            }
        }

        SourceSpan span = node.getSpan();
        if (span != null && !span.isWellFormed()) {
            errors.add("Node '" + id + "' has a span with non-finite or negative positions: " + span);
        }

        if (kind == IrKind.VARIABLE_DECLARATION) {
            checkDeclarationKinds(document, node, errors);
        }
        if (kind == IrKind.TEMPLATE_LITERAL) {
            int quasis = node.getStrings("quasis").size();
            int expressions = node.getRefs("expressions").size();
            if (quasis != expressions + 1) {
                errors.add("TemplateLiteral '" + id + "' has " + quasis + " quasis for "
                        + expressions + " expressions");
            }
        }
        checkSpreadPlacement(document, node, errors);
    }

    /** 展开元素只能出现在调用参数与数组元素中 */
    private void checkSpreadPlacement(IrDocument document, IrNode node, List<String> errors) {
        IrKind kind = node.getKind();
        for (FieldSpec field : kind.getFields()) {
            if (!field.getType().isReference() || allowsSpread(kind, field.getName())) continue;
            List<String> refs = field.getType() == FieldType.NODE || field.getType() == FieldType.OPTIONAL_NODE
                    ? Collections.singletonList(node.getRef(field.getName()))
                    : node.getRefs(field.getName());
            for (String ref : refs) {
                IrNode child = ref == null ? null : document.getNode(ref);
                if (child != null && child.is(IrKind.SPREAD_ELEMENT)) {
                    errors.add("SpreadElement '" + ref + "' cannot appear in field '" + field.getName()
                            + "' of " + kind.getTag() + " '" + node.getId() + "'");
                }
            }
        }
    }

    private static boolean allowsSpread(IrKind kind, String field) {
        switch (kind) {
            case CALL_EXPRESSION:
            case NEW_EXPRESSION:
            case OPTIONAL_CALL_EXPRESSION:
                return "arguments".equals(field);
            case ARRAY_EXPRESSION:
                return "elements".equals(field);
            default:
                return false;
        }
    }

    private void checkFields(IrDocument document, IrNode node, List<String> errors) {
        String id = node.getId();
        for (FieldSpec field : node.getKind().getFields()) {
            String name = field.getName();
            JsonElement value = node.getField(name);
            boolean missing = value == null || value.isJsonNull();
            switch (field.getType()) {
                case NODE:
                    if (missing) {
                        errors.add("Node '" + id + "' is missing required field '" + name + "'");
                    } else {
                        checkRef(document, id, name, value, errors);
                    }
                    break;
                case OPTIONAL_NODE:
                    if (!missing) {
                        checkRef(document, id, name, value, errors);
                    }
                    break;
                case NODE_LIST:
                case SPARSE_NODE_LIST:
                    if (missing || !value.isJsonArray()) {
                        errors.add("Node '" + id + "' field '" + name + "' must be a list");
                        break;
                    }
                    JsonArray items = value.getAsJsonArray();
                    for (int i = 0; i < items.size(); i++) {
                        JsonElement item = items.get(i);
                        if (item == null || item.isJsonNull()) {
                            if (field.getType() == FieldType.NODE_LIST) {
                                errors.add("Node '" + id + "' field '" + name + "' has a hole at index " + i);
                            }
                            continue;
                        }
                        checkRef(document, id, name + "[" + i + "]", item, errors);
                    }
                    break;
                case STRING:
                    if (missing || !isString(value)) {
                        errors.add("Node '" + id + "' is missing required field '" + name + "'");
                    }
                    break;
                case OPTIONAL_STRING:
                    if (!missing && !isString(value)) {
                        errors.add("Node '" + id + "' field '" + name + "' must be a string");
                    }
                    break;
                case STRING_LIST:
                    if (missing || !value.isJsonArray()) {
                        errors.add("Node '" + id + "' field '" + name + "' must be a list");
                        break;
                    }
                    for (JsonElement item : value.getAsJsonArray()) {
                        if (!isString(item)) {
                            errors.add("Node '" + id + "' field '" + name + "' must contain only strings");
                            break;
                        }
                    }
                    break;
                case BOOLEAN:
                    if (missing || !value.isJsonPrimitive() || !value.getAsJsonPrimitive().isBoolean()) {
                        errors.add("Node '" + id + "' field '" + name + "' must be a boolean");
                    }
                    break;
                case INTEGER:
                    if (missing || !value.isJsonPrimitive() || !value.getAsJsonPrimitive().isNumber()) {
                        errors.add("Node '" + id + "' field '" + name + "' must be an integer");
                    }
                    break;
                case VALUE:
                    if (!missing && !value.isJsonPrimitive()) {
                        errors.add("Node '" + id + "' field '" + name + "' must be a primitive value");
                    }
                    break;
                default:
                    break;
            }
        }
    }

    private static void checkRef(IrDocument document, String owner, String field, JsonElement value,
                                 List<String> errors) {
        if (!isString(value)) {
            errors.add("Node '" + owner + "' field '" + field + "' must be a node id");
            return;
        }
        String ref = value.getAsString();
        if (!document.hasNode(ref)) {
            errors.add("Node '" + owner + "' field '" + field + "' references missing node '" + ref + "'");
        }
    }

    private static boolean isString(JsonElement e) {
        return e != null && e.isJsonPrimitive() && e.getAsJsonPrimitive().isString();
    }

    private void checkDeclarationKinds(IrDocument document, IrNode decl, List<String> errors) {
        String kind = decl.getString("declarationKind");
        if (kind != null && !DECLARATION_KINDS.contains(kind)) {
            errors.add("Node '" + decl.getId() + "' has unknown declaration kind '" + kind + "'");
        }
        for (String declaratorId : decl.getRefs("declarations")) {
            IrNode declarator = document.getNode(declaratorId);
            if (declarator == null || !declarator.is(IrKind.VARIABLE_DECLARATOR)) continue;
            String declaratorKind = declarator.getString("declarationKind");
            if (!Objects.equals(kind, declaratorKind)) {
                errors.add("Declarator '" + declaratorId + "' has kind '" + declaratorKind
                        + "' but its declaration '" + decl.getId() + "' is '" + kind + "'");
            }
        }
    }

    // ========== 控制流图 ==========

    private void checkControlFlowGraphs(IrDocument document, List<String> errors) {
        for (IrNode node : document.getNodes()) {
            JsonObject meta = node.getMeta();
            if (meta == null || !meta.has("cfg")) continue;
            if (!meta.get("cfg").isJsonObject()) {
                errors.add("Node '" + node.getId() + "' has malformed cfg metadata");
                continue;
            }
            JsonObject cfg = meta.getAsJsonObject("cfg");
            String graphId = stringOrNull(cfg.get("id"));
            ControlFlowGraph graph = document.getControlFlowGraph(graphId);
            if (graph == null) {
                errors.add("Node '" + node.getId() + "' references missing control flow graph '" + graphId + "'");
                continue;
            }
            String entryId = stringOrNull(cfg.get("entry"));
            String exitId = stringOrNull(cfg.get("exit"));
            BasicBlock entry = graph.getBlock(entryId);
            if (entry == null) {
                errors.add("Control flow graph '" + graphId + "' has no entry block '" + entryId + "'");
            }
            if (graph.getBlock(exitId) == null) {
                errors.add("Control flow graph '" + graphId + "' has no exit block '" + exitId + "'");
            }
            if (entry != null) {
                List<String> body = ControlFlowGraphPass.bodyStatements(document, node);
                Set<String> allowed = body == null ? Collections.<String>emptySet() : new HashSet<>(body);
                for (String stmt : entry.getStatements()) {
                    if (!allowed.contains(stmt)) {
                        errors.add("Entry block '" + entryId + "' of graph '" + graphId
                                + "' contains '" + stmt + "' which is not in the body of '" + node.getId() + "'");
                    }
                }
            }
        }
    }

    private static String stringOrNull(JsonElement e) {
        return isString(e) ? e.getAsString() : null;
    }

    // ========== 元数据 ==========

    private void checkMetaPerf(IrDocument document, List<String> errors) {
        JsonElement perf = document.getMetadata().get("metaPerf");
        if (perf == null || perf.isJsonNull()) return;
        if (!perf.isJsonObject()) {
            errors.add("metadata.metaPerf must be an object");
            return;
        }
        for (Map.Entry<String, JsonElement> e : perf.getAsJsonObject().entrySet()) {
            JsonElement v = e.getValue();
            if (v == null || !v.isJsonPrimitive() || !v.getAsJsonPrimitive().isNumber()) {
                errors.add("metadata.metaPerf." + e.getKey() + " must be numeric");
                continue;
            }
            double d = v.getAsDouble();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                errors.add("metadata.metaPerf." + e.getKey() + " must be finite");
            }
        }
    }
}
