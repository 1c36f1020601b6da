package com.luascript.ir.node;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.luascript.compiler.ast.SourceSpan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 扁平 IR 节点。
 *
 * <p>子节点只以 ID 引用，节点本身归 {@link IrDocument} 的节点表所有。
 * 负载字段的形状由 {@link IrKind#getFields()} 声明。</p>
 */
public class IrNode {

    private final String id;
    private final IrKind kind;
    /** 反序列化遇到未知标签时保留原始标签，kind 为 null */
    private final String tag;
    private final Map<String, JsonElement> fields = new LinkedHashMap<>();
    private SourceSpan span;
    private JsonObject meta;

    public IrNode(String id, IrKind kind) {
        this.id = id;
        this.kind = kind;
        this.tag = kind.getTag();
    }

    public IrNode(String id, String tag) {
        this.id = id;
        this.kind = IrKind.fromTag(tag);
        this.tag = tag;
    }

    public String getId() { return id; }

    public IrKind getKind() { return kind; }

    public String getTag() { return tag; }

    public boolean is(IrKind k) {
        return kind == k;
    }

    // ============ 负载字段 ============

    public Map<String, JsonElement> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    public boolean hasField(String name) {
        return fields.containsKey(name);
    }

    public JsonElement getField(String name) {
        return fields.get(name);
    }

    public IrNode setField(String name, JsonElement value) {
        fields.put(name, value == null ? JsonNull.INSTANCE : value);
        return this;
    }

    public IrNode setRef(String name, String childId) {
        return setField(name, childId == null ? JsonNull.INSTANCE : new JsonPrimitive(childId));
    }

    public IrNode setRefs(String name, List<String> childIds) {
        JsonArray arr = new JsonArray();
        for (String c : childIds) {
            if (c == null) {
                arr.add(JsonNull.INSTANCE);
            } else {
                arr.add(c);
            }
        }
        return setField(name, arr);
    }

    /** 字符串列表字段，写法与子节点 ID 列表相同 */
    public IrNode setStrings(String name, List<String> values) {
        return setRefs(name, values);
    }

    public IrNode setString(String name, String value) {
        return setField(name, value == null ? JsonNull.INSTANCE : new JsonPrimitive(value));
    }

    public IrNode setBoolean(String name, boolean value) {
        return setField(name, new JsonPrimitive(value));
    }

    public IrNode setInt(String name, int value) {
        return setField(name, new JsonPrimitive(value));
    }

    /** 单个子节点 ID；缺失或为 null 时返回 null */
    public String getRef(String name) {
        return getString(name);
    }

    /** 子节点 ID 列表，空位保留为 null */
    public List<String> getRefs(String name) {
        JsonElement e = fields.get(name);
        if (e == null || !e.isJsonArray()) {
            return Collections.emptyList();
        }
        List<String> out = new ArrayList<>();
        for (JsonElement item : e.getAsJsonArray()) {
            out.add(item == null || item.isJsonNull() ? null : item.getAsString());
        }
        return out;
    }

    public List<String> getStrings(String name) {
        return getRefs(name);
    }

    public String getString(String name) {
        JsonElement e = fields.get(name);
        if (e == null || e.isJsonNull() || !e.isJsonPrimitive()) {
            return null;
        }
        return e.getAsString();
    }

    public boolean getBoolean(String name) {
        JsonElement e = fields.get(name);
        return e != null && e.isJsonPrimitive() && e.getAsJsonPrimitive().isBoolean() && e.getAsBoolean();
    }

    public int getInt(String name) {
        JsonElement e = fields.get(name);
        if (e == null || !e.isJsonPrimitive() || !e.getAsJsonPrimitive().isNumber()) {
            return -1;
        }
        return e.getAsInt();
    }

    /** Literal 的值，可能为 JSON null */
    public JsonElement getValue() {
        JsonElement e = fields.get("value");
        return e == null ? JsonNull.INSTANCE : e;
    }

    /**
     * 按负载声明顺序列出全部子节点 ID（跳过 null）。
     */
    public List<String> children() {
        if (kind == null) {
            return Collections.emptyList();
        }
        List<String> out = new ArrayList<>();
        for (FieldSpec f : kind.getFields()) {
            switch (f.getType()) {
                case NODE:
                case OPTIONAL_NODE: {
                    String ref = getRef(f.getName());
                    if (ref != null) out.add(ref);
                    break;
                }
                case NODE_LIST:
                case SPARSE_NODE_LIST:
                    for (String ref : getRefs(f.getName())) {
                        if (ref != null) out.add(ref);
                    }
                    break;
                default:
                    break;
            }
        }
        return out;
    }

    // ============ 位置与元数据 ============

    public SourceSpan getSpan() { return span; }

    public IrNode setSpan(SourceSpan span) {
        this.span = span;
        return this;
    }

    /** 元数据；未设置时为 null */
    public JsonObject getMeta() { return meta; }

    public void setMeta(JsonObject meta) {
        this.meta = meta;
    }

    /** 获取元数据，不存在时创建 */
    public JsonObject meta() {
        if (meta == null) {
            meta = new JsonObject();
        }
        return meta;
    }

    @Override
    public String toString() {
        return tag + "#" + id;
    }
}
