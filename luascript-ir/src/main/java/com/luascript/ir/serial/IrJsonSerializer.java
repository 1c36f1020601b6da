package com.luascript.ir.serial;

import com.google.gson.*;
import com.luascript.compiler.ast.SourceSpan;
import com.luascript.ir.node.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * IR 文档 ⇄ JSON。
 *
 * <p>布局：{@code {schemaVersion, module:{id, body, metadata}, nodes:{<id>: node}, controlFlowGraphs:{<id>: graph}}}。
 * 节点写作 {@code {id, kind, <负载字段>..., span, meta}}，以节点 ID 为键、按插入顺序输出，
 * 空位以 JSON null 表示。未知的节点标签在读入时原样保留，交由校验器报告。</p>
 */
public class IrJsonSerializer {

    private static final String[] RESERVED_KEYS = {"id", "kind", "span", "meta"};

    private final Gson gson;

    public IrJsonSerializer() {
        this.gson = new GsonBuilder().serializeNulls().setPrettyPrinting().disableHtmlEscaping().create();
    }

    public String toJson(IrDocument document) {
        return gson.toJson(toJsonTree(document));
    }

    public JsonObject toJsonTree(IrDocument document) {
        JsonObject root = new JsonObject();
        root.addProperty("schemaVersion", document.getSchemaVersion());

        JsonObject module = new JsonObject();
        module.addProperty("id", document.getModuleId());
        module.add("body", stringArray(document.getModuleBody()));
        module.add("metadata", document.getMetadata().deepCopy());
        root.add("module", module);

        JsonObject nodes = new JsonObject();
        for (IrNode node : document.getNodes()) {
            nodes.add(node.getId(), nodeToJson(node));
        }
        root.add("nodes", nodes);

        if (!document.getControlFlowGraphs().isEmpty()) {
            JsonObject graphs = new JsonObject();
            for (ControlFlowGraph graph : document.getControlFlowGraphs()) {
                graphs.add(graph.getId(), graphToJson(graph));
            }
            root.add("controlFlowGraphs", graphs);
        }
        return root;
    }

    private static JsonObject nodeToJson(IrNode node) {
        JsonObject json = new JsonObject();
        json.addProperty("id", node.getId());
        json.addProperty("kind", node.getTag());
        for (Map.Entry<String, JsonElement> e : node.getFields().entrySet()) {
            json.add(e.getKey(), e.getValue() == null ? JsonNull.INSTANCE : e.getValue().deepCopy());
        }
        if (node.getSpan() != null) {
            json.add("span", node.getSpan().toJson());
        }
        if (node.getMeta() != null) {
            json.add("meta", node.getMeta().deepCopy());
        }
        return json;
    }

    private static JsonObject graphToJson(ControlFlowGraph graph) {
        JsonObject json = new JsonObject();
        json.addProperty("id", graph.getId());
        json.addProperty("functionId", graph.getFunctionId());
        json.addProperty("entry", graph.getEntry());
        json.addProperty("exit", graph.getExit());
        JsonArray blocks = new JsonArray();
        for (BasicBlock block : graph.getBlocks()) {
            JsonObject b = new JsonObject();
            b.addProperty("id", block.getId());
            b.addProperty("kind", block.getKind().getTag());
            b.add("statements", stringArray(block.getStatements()));
            b.add("successors", stringArray(block.getSuccessors()));
            blocks.add(b);
        }
        json.add("blocks", blocks);
        return json;
    }

    // ============ 读入 ============

    public IrDocument fromJson(String json) {
        JsonElement root;
        try {
            root = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new FormatException("Malformed IR JSON: " + e.getMessage(), json);
        }
        if (!root.isJsonObject()) {
            throw new FormatException("IR document must be a JSON object", json);
        }
        return fromJsonTree(root.getAsJsonObject());
    }

    public IrDocument fromJsonTree(JsonObject root) {
        IrDocument document = new IrDocument(stringOrNull(root.get("schemaVersion")));

        JsonObject module = objectOrFail(root, "module");
        document.setModuleId(stringOrNull(module.get("id")));
        JsonElement body = module.get("body");
        if (body != null && body.isJsonArray()) {
            for (JsonElement e : body.getAsJsonArray()) {
                document.getModuleBody().add(stringOrNull(e));
            }
        }
        JsonElement metadata = module.get("metadata");
        if (metadata != null && metadata.isJsonObject()) {
            document.setMetadata(metadata.getAsJsonObject().deepCopy());
        }

        JsonElement nodes = root.get("nodes");
        if (nodes == null || !nodes.isJsonObject()) {
            throw new FormatException("IR document has no 'nodes' object", null);
        }
        for (Map.Entry<String, JsonElement> e : nodes.getAsJsonObject().entrySet()) {
            if (!e.getValue().isJsonObject()) {
                throw new FormatException("Node entry '" + e.getKey() + "' must be a JSON object",
                        e.getValue().toString());
            }
            IrNode node = nodeFromJson(e.getValue().getAsJsonObject());
            requireKey(e.getKey(), node.getId());
            document.addNode(node);
        }

        JsonElement graphs = root.get("controlFlowGraphs");
        if (graphs != null && !graphs.isJsonNull()) {
            if (!graphs.isJsonObject()) {
                throw new FormatException("'controlFlowGraphs' must be a JSON object", graphs.toString());
            }
            for (Map.Entry<String, JsonElement> e : graphs.getAsJsonObject().entrySet()) {
                if (!e.getValue().isJsonObject()) {
                    throw new FormatException("Graph entry '" + e.getKey() + "' must be a JSON object",
                            e.getValue().toString());
                }
                ControlFlowGraph graph = graphFromJson(e.getValue().getAsJsonObject());
                requireKey(e.getKey(), graph.getId());
                document.addControlFlowGraph(graph);
            }
        }
        return document;
    }

    private static IrNode nodeFromJson(JsonObject json) {
        String id = stringOrNull(json.get("id"));
        String tag = stringOrNull(json.get("kind"));
        if (id == null || tag == null) {
            throw new FormatException("Node entry needs 'id' and 'kind'", json.toString());
        }
        IrNode node = new IrNode(id, tag);
        for (Map.Entry<String, JsonElement> e : json.entrySet()) {
            if (isReserved(e.getKey())) continue;
            node.setField(e.getKey(), e.getValue().deepCopy());
        }
        node.setSpan(SourceSpan.fromJson(json.get("span")));
        JsonElement meta = json.get("meta");
        if (meta != null && meta.isJsonObject()) {
            node.setMeta(meta.getAsJsonObject().deepCopy());
        }
        return node;
    }

    private static ControlFlowGraph graphFromJson(JsonObject json) {
        ControlFlowGraph graph = new ControlFlowGraph(stringOrNull(json.get("id")),
                stringOrNull(json.get("functionId")));
        graph.setEntry(stringOrNull(json.get("entry")));
        graph.setExit(stringOrNull(json.get("exit")));
        JsonElement blocks = json.get("blocks");
        if (blocks != null && blocks.isJsonArray()) {
            for (JsonElement e : blocks.getAsJsonArray()) {
                JsonObject b = e.getAsJsonObject();
                String kindTag = stringOrNull(b.get("kind"));
                BlockKind kind = BlockKind.fromTag(kindTag);
                if (kind == null) {
                    throw new FormatException("Unknown basic block kind '" + kindTag + "'", b.toString());
                }
                BasicBlock block = new BasicBlock(stringOrNull(b.get("id")), kind);
                for (String s : strings(b.get("statements"))) {
                    block.addStatement(s);
                }
                for (String s : strings(b.get("successors"))) {
                    block.addSuccessor(s);
                }
                graph.addBlock(block);
            }
        }
        return graph;
    }

    /**
     * 去掉与运行相关的易变数据（{@code module.metadata.metaPerf}），用于确定性比较。
     */
    public static JsonObject stripVolatile(JsonObject documentJson) {
        JsonObject copy = documentJson.deepCopy();
        JsonElement module = copy.get("module");
        if (module != null && module.isJsonObject()) {
            JsonElement metadata = module.getAsJsonObject().get("metadata");
            if (metadata != null && metadata.isJsonObject()) {
                metadata.getAsJsonObject().remove("metaPerf");
            }
        }
        return copy;
    }

    // ============ 工具 ============

    /** 映射的键必须等于条目自身的 id */
    private static void requireKey(String key, String id) {
        if (!key.equals(id)) {
            throw new FormatException("Entry key '" + key + "' does not match its id '" + id + "'", key);
        }
    }

    private static boolean isReserved(String key) {
        for (String k : RESERVED_KEYS) {
            if (k.equals(key)) return true;
        }
        return false;
    }

    private static JsonArray stringArray(List<String> values) {
        JsonArray array = new JsonArray();
        for (String v : values) {
            if (v == null) {
                array.add(JsonNull.INSTANCE);
            } else {
                array.add(v);
            }
        }
        return array;
    }

    private static List<String> strings(JsonElement e) {
        List<String> out = new ArrayList<>();
        if (e != null && e.isJsonArray()) {
            for (JsonElement item : e.getAsJsonArray()) {
                out.add(stringOrNull(item));
            }
        }
        return out;
    }

    private static JsonObject objectOrFail(JsonObject root, String key) {
        JsonElement e = root.get(key);
        if (e == null || !e.isJsonObject()) {
            throw new FormatException("IR document has no '" + key + "' object", null);
        }
        return e.getAsJsonObject();
    }

    private static String stringOrNull(JsonElement e) {
        if (e == null || e.isJsonNull() || !e.isJsonPrimitive()) return null;
        return e.getAsString();
    }
}
