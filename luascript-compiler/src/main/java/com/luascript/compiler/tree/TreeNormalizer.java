package com.luascript.compiler.tree;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.luascript.compiler.ast.SourceSpan;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * ESTree 规范化器。
 *
 * <p>把不同前端交出的原始树整理成统一形态：补齐可选字段的默认值、
 * 统一节点标签和声明种类、把 loc/start/end/range 合并为 {@code span}。
 * 不做任何脱糖，未识别的节点原样复制，由降级阶段拒绝。</p>
 *
 * <p>纯函数：输入树不会被修改，每次返回一棵新树。</p>
 */
public class TreeNormalizer {

    private static final Gson RAW_GSON = new GsonBuilder().disableHtmlEscaping().create();

    /** 位置相关的原始字段，统一折叠为 span */
    private static final Set<String> LOCATION_KEYS = new HashSet<>(
            Arrays.asList("loc", "start", "end", "range", "span"));

    private static final Set<String> DECLARATION_KINDS = new HashSet<>(
            Arrays.asList("var", "let", "const"));

    private static final Map<String, Rule> RULES = new HashMap<>();

    static {
        rule("Program").lists("body").strings("sourceType", "script");
        rule("VariableDeclaration").required("declarations").lists("declarations");
        rule("VariableDeclarator").required("id").nulls("init");
        rule("FunctionDeclaration").required("id", "body").lists("params")
                .flags("async", "generator");
        rule("FunctionExpression").required("body").nulls("id").lists("params")
                .flags("async", "generator");
        rule("ArrowFunctionExpression").required("body").nulls("id").lists("params")
                .flags("async", "generator");
        rule("BlockStatement").lists("body");
        rule("EmptyStatement");
        rule("ExpressionStatement").required("expression");
        rule("IfStatement").required("test", "consequent").nulls("alternate");
        rule("WhileStatement").required("test", "body");
        rule("DoWhileStatement").required("test", "body");
        rule("ForStatement").required("body").nulls("init", "test", "update");
        rule("ForInStatement").required("left", "right", "body");
        rule("ForOfStatement").required("left", "right", "body").flags("await");
        rule("SwitchStatement").required("discriminant").lists("cases");
        rule("SwitchCase").nulls("test").lists("consequent");
        rule("ReturnStatement").nulls("argument");
        rule("BreakStatement").nulls("label");
        rule("ContinueStatement").nulls("label");
        rule("ThrowStatement").required("argument");
        rule("TryStatement").required("block").nulls("handler", "finalizer");
        rule("CatchClause").required("body").nulls("param");
        rule("LabeledStatement").required("label", "body");
        rule("BinaryExpression").required("operator", "left", "right");
        rule("LogicalExpression").required("operator", "left", "right");
        rule("AssignmentExpression").required("left", "right").strings("operator", "=");
        rule("UpdateExpression").required("operator", "argument").flags("prefix");
        rule("UnaryExpression").required("operator", "argument");
        rule("ConditionalExpression").required("test", "consequent", "alternate");
        rule("CallExpression").required("callee").lists("arguments").flags("optional");
        rule("NewExpression").required("callee").lists("arguments");
        rule("MemberExpression").required("object", "property").flags("computed", "optional");
        rule("ArrayExpression").lists("elements");
        rule("ObjectExpression").lists("properties");
        rule("Property").required("key").flags("computed", "shorthand", "method")
                .strings("kind", "init");
        rule("Identifier").required("name");
        rule("Literal");
        rule("AwaitExpression").required("argument");
        rule("ThisExpression");
        rule("SpreadElement").required("argument");
        rule("TemplateLiteral").lists("quasis", "expressions");
        rule("TemplateElement").required("value").flags("tail");
        rule("ChainExpression").required("expression");
        rule("ArrayPattern").lists("elements");
        rule("ObjectPattern").lists("properties");
        rule("RestElement").required("argument");
        rule("AssignmentPattern").required("left", "right");
    }

    private static Rule rule(String type) {
        Rule r = new Rule();
        RULES.put(type, r);
        return r;
    }

    /** 已识别的节点种类 */
    public static boolean isKnownType(String type) {
        return RULES.containsKey(type);
    }

    /**
     * 规范化一棵原始树。
     *
     * @param rawTree    前端交出的原始 ESTree 根节点
     * @param sourceText 源码文本，用于在行列与偏移之间换算；可为 null
     * @return 新的规范化树
     */
    public JsonObject normalize(JsonObject rawTree, String sourceText) {
        if (rawTree == null) {
            throw new StructuralException("Tree root is null", null, null, null);
        }
        LineIndex lines = sourceText != null ? new LineIndex(sourceText) : null;
        return normalizeNode(rawTree, lines);
    }

    private JsonObject normalizeNode(JsonObject raw, LineIndex lines) {
        JsonElement typeElement = raw.get("type");
        if (typeElement == null || !typeElement.isJsonPrimitive()) {
            throw new StructuralException("Node has no 'type'", null, "type", null);
        }
        String type = typeElement.getAsString();
        SourceSpan span = readSpan(raw, lines);

        // 未识别节点原样复制
        Rule rule = RULES.get(canonicalType(type));
        if (rule == null) {
            JsonObject copy = raw.deepCopy();
            if (span != null) {
                copy.add("span", span.toJson());
            }
            return copy;
        }

        JsonObject out = new JsonObject();
        String canonical = canonicalType(type);
        out.addProperty("type", canonical);
        for (Map.Entry<String, JsonElement> entry : raw.entrySet()) {
            String key = entry.getKey();
            if ("type".equals(key) || LOCATION_KEYS.contains(key)) continue;
            out.add(key, normalizeValue(entry.getValue(), lines));
        }

        applyAliasSemantics(type, out);
        applyDefaults(canonical, rule, out, span);
        applyKindSpecific(canonical, out, span);

        if (span != null) {
            out.add("span", span.toJson());
        }
        return out;
    }

    private JsonElement normalizeValue(JsonElement value, LineIndex lines) {
        if (value == null || value.isJsonNull()) {
            return JsonNull.INSTANCE;
        }
        if (value.isJsonObject()) {
            JsonObject obj = value.getAsJsonObject();
            if (obj.has("type")) {
                return normalizeNode(obj, lines);
            }
            return obj.deepCopy();
        }
        if (value.isJsonArray()) {
            JsonArray out = new JsonArray();
            for (JsonElement e : value.getAsJsonArray()) {
                // 数组空位保持为 null
                out.add(normalizeValue(e, lines));
            }
            return out;
        }
        return value.deepCopy();
    }

    private static String canonicalType(String type) {
        switch (type) {
            case "ArrowFunction":
                return "ArrowFunctionExpression";
            case "AsyncFunctionDeclaration":
                return "FunctionDeclaration";
            case "Parameter":
                return "Identifier";
            default:
                return type;
        }
    }

    private static void applyAliasSemantics(String rawType, JsonObject out) {
        if ("AsyncFunctionDeclaration".equals(rawType)) {
            out.addProperty("async", true);
        }
    }

    private void applyDefaults(String type, Rule rule, JsonObject out, SourceSpan span) {
        for (String field : rule.required) {
            JsonElement v = out.get(field);
            if (v == null || v.isJsonNull()) {
                throw new StructuralException(type + " is missing required field '" + field + "'",
                        type, field, span);
            }
        }
        for (String field : rule.lists) {
            JsonElement v = out.get(field);
            if (v == null || v.isJsonNull()) {
                out.add(field, new JsonArray());
            } else if (!v.isJsonArray()) {
                throw new StructuralException(type + "." + field + " must be a list", type, field, span);
            }
        }
        for (String field : rule.nulls) {
            if (!out.has(field)) {
                out.add(field, JsonNull.INSTANCE);
            }
        }
        for (String field : rule.flags) {
            JsonElement v = out.get(field);
            if (v == null || v.isJsonNull()) {
                out.addProperty(field, false);
            } else if (!v.isJsonPrimitive() || !v.getAsJsonPrimitive().isBoolean()) {
                throw new StructuralException(type + "." + field + " must be a boolean", type, field, span);
            }
        }
        for (Map.Entry<String, String> e : rule.strings.entrySet()) {
            JsonElement v = out.get(e.getKey());
            if ((v == null || v.isJsonNull()) && e.getValue() != null) {
                out.addProperty(e.getKey(), e.getValue());
            }
        }
    }

    private void applyKindSpecific(String type, JsonObject out, SourceSpan span) {
        switch (type) {
            case "VariableDeclaration": {
                JsonElement kind = out.get("kind");
                String value = kind == null || kind.isJsonNull() ? "var" : kind.getAsString().toLowerCase();
                if (!DECLARATION_KINDS.contains(value)) {
                    throw new StructuralException("Unknown declaration kind '" + value + "'",
                            type, "kind", span);
                }
                out.addProperty("kind", value);
                break;
            }
            case "ArrowFunctionExpression": {
                JsonObject body = out.getAsJsonObject("body");
                boolean expression = !"BlockStatement".equals(body.get("type").getAsString());
                out.addProperty("expression", expression);
                break;
            }
            case "UnaryExpression":
                out.addProperty("prefix", true);
                break;
            case "Property":
                if (!out.has("value") || out.get("value").isJsonNull()) {
                    if (!out.get("shorthand").getAsBoolean()) {
                        throw new StructuralException("Property is missing required field 'value'",
                                type, "value", span);
                    }
                    out.add("value", out.get("key").deepCopy());
                }
                break;
            case "Literal":
                normalizeLiteral(out, span);
                break;
            default:
                break;
        }
    }

    private static void normalizeLiteral(JsonObject out, SourceSpan span) {
        if (!out.has("value") && !out.has("regex")) {
            throw new StructuralException("Literal is missing required field 'value'",
                    "Literal", "value", span);
        }
        if (!out.has("value")) {
            out.add("value", JsonNull.INSTANCE);
        }
        JsonElement raw = out.get("raw");
        if (raw == null || raw.isJsonNull()) {
            out.addProperty("raw", deriveRaw(out.get("value")));
        }
    }

    /**
     * 根据字面量的值重新生成 raw 文本。
     */
    static String deriveRaw(JsonElement value) {
        if (value == null || value.isJsonNull()) {
            return "null";
        }
        if (value.isJsonPrimitive()) {
            JsonPrimitive p = value.getAsJsonPrimitive();
            if (p.isNumber()) {
                double d = p.getAsDouble();
                if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
                    return Long.toString((long) d);
                }
                return Double.toString(d);
            }
            if (p.isBoolean()) {
                return Boolean.toString(p.getAsBoolean());
            }
        }
        return RAW_GSON.toJson(value);
    }

    // ============ 位置信息 ============

    private SourceSpan readSpan(JsonObject raw, LineIndex lines) {
        JsonElement existing = raw.get("span");
        if (existing != null && existing.isJsonObject()) {
            return SourceSpan.fromJson(existing);
        }

        Integer startOffset = null;
        Integer endOffset = null;
        JsonElement range = raw.get("range");
        if (range != null && range.isJsonArray() && range.getAsJsonArray().size() == 2) {
            startOffset = range.getAsJsonArray().get(0).getAsInt();
            endOffset = range.getAsJsonArray().get(1).getAsInt();
        }
        if (startOffset == null && isNumber(raw.get("start"))) {
            startOffset = raw.get("start").getAsInt();
        }
        if (endOffset == null && isNumber(raw.get("end"))) {
            endOffset = raw.get("end").getAsInt();
        }

        int[] startLc = null;
        int[] endLc = null;
        JsonElement loc = raw.get("loc");
        if (loc != null && loc.isJsonObject()) {
            startLc = readLineColumn(loc.getAsJsonObject().get("start"));
            endLc = readLineColumn(loc.getAsJsonObject().get("end"));
        }

        if (startLc == null && startOffset == null) {
            return null;
        }
        int[] start = resolve(startLc, startOffset, lines);
        int[] end = resolve(endLc != null ? endLc : startLc,
                endOffset != null ? endOffset : startOffset, lines);
        if (start == null || end == null) {
            return null;
        }
        return SourceSpan.of(start[0], start[1], start[2], end[0], end[1], end[2]);
    }

    /** 合并行列与偏移，缺失的一方借助源码推导；无法推导时返回 null */
    private static int[] resolve(int[] lineColumn, Integer offset, LineIndex lines) {
        if (lineColumn != null && offset != null) {
            return new int[]{lineColumn[0], lineColumn[1], offset};
        }
        if (lines == null) {
            return null;
        }
        if (lineColumn != null) {
            return new int[]{lineColumn[0], lineColumn[1], lines.offsetOf(lineColumn[0], lineColumn[1])};
        }
        if (offset != null) {
            int[] lc = lines.lineColumnOf(offset);
            return new int[]{lc[0], lc[1], offset};
        }
        return null;
    }

    private static int[] readLineColumn(JsonElement element) {
        if (element == null || !element.isJsonObject()) return null;
        JsonObject obj = element.getAsJsonObject();
        if (!isNumber(obj.get("line")) || !isNumber(obj.get("column"))) return null;
        return new int[]{obj.get("line").getAsInt(), obj.get("column").getAsInt()};
    }

    private static boolean isNumber(JsonElement e) {
        return e != null && e.isJsonPrimitive() && e.getAsJsonPrimitive().isNumber();
    }

    /**
     * 行首偏移表。行号从 1 开始，列号从 0 开始（与 ESTree loc 一致）。
     */
    static final class LineIndex {
        private final int[] lineStarts;
        private final int length;

        LineIndex(String text) {
            List<Integer> starts = new ArrayList<>();
            starts.add(0);
            for (int i = 0; i < text.length(); i++) {
                if (text.charAt(i) == '\n') {
                    starts.add(i + 1);
                }
            }
            lineStarts = new int[starts.size()];
            for (int i = 0; i < lineStarts.length; i++) {
                lineStarts[i] = starts.get(i);
            }
            length = text.length();
        }

        int offsetOf(int line, int column) {
            int idx = Math.max(0, Math.min(line - 1, lineStarts.length - 1));
            return Math.min(lineStarts[idx] + Math.max(0, column), length);
        }

        int[] lineColumnOf(int offset) {
            int target = Math.max(0, Math.min(offset, length));
            int lo = 0;
            int hi = lineStarts.length - 1;
            while (lo < hi) {
                int mid = (lo + hi + 1) >>> 1;
                if (lineStarts[mid] <= target) {
                    lo = mid;
                } else {
                    hi = mid - 1;
                }
            }
            return new int[]{lo + 1, target - lineStarts[lo]};
        }
    }

    private static final class Rule {
        final List<String> required = new ArrayList<>();
        final List<String> lists = new ArrayList<>();
        final List<String> nulls = new ArrayList<>();
        final List<String> flags = new ArrayList<>();
        final Map<String, String> strings = new LinkedHashMap<>();

        Rule required(String... fields) {
            Collections.addAll(required, fields);
            return this;
        }

        Rule lists(String... fields) {
            Collections.addAll(lists, fields);
            return this;
        }

        Rule nulls(String... fields) {
            Collections.addAll(nulls, fields);
            return this;
        }

        Rule flags(String... fields) {
            Collections.addAll(flags, fields);
            return this;
        }

        Rule strings(String field, String defaultValue) {
            strings.put(field, defaultValue);
            return this;
        }
    }
}
