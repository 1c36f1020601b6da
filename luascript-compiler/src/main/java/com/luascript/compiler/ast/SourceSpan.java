package com.luascript.compiler.ast;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.Objects;

/**
 * 源码区间信息（起止位置）。
 */
public final class SourceSpan {
    private final SourcePosition start;
    private final SourcePosition end;

    public SourceSpan(SourcePosition start, SourcePosition end) {
        this.start = start;
        this.end = end;
    }

    public static SourceSpan of(int startLine, int startColumn, int startOffset,
                                int endLine, int endColumn, int endOffset) {
        return new SourceSpan(new SourcePosition(startLine, startColumn, startOffset),
                new SourcePosition(endLine, endColumn, endOffset));
    }

    public SourcePosition getStart() {
        return start;
    }

    public SourcePosition getEnd() {
        return end;
    }

    public boolean isWellFormed() {
        return start != null && end != null && start.isWellFormed() && end.isWellFormed();
    }

    /**
     * 转为 {@code { start: {line, column, offset}, end: {...} }} 形式。
     */
    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        json.add("start", positionToJson(start));
        json.add("end", positionToJson(end));
        return json;
    }

    /**
     * 从 JSON 读取区间；缺失的数值读为 NaN，交给校验器报告。
     *
     * @return 区间；element 为空或 JSON null 时返回 null
     */
    public static SourceSpan fromJson(JsonElement element) {
        if (element == null || element.isJsonNull() || !element.isJsonObject()) {
            return null;
        }
        JsonObject json = element.getAsJsonObject();
        return new SourceSpan(positionFromJson(json.get("start")), positionFromJson(json.get("end")));
    }

    private static JsonObject positionToJson(SourcePosition pos) {
        JsonObject json = new JsonObject();
        if (pos == null) return json;
        json.addProperty("line", number(pos.getLine()));
        json.addProperty("column", number(pos.getColumn()));
        json.addProperty("offset", number(pos.getOffset()));
        return json;
    }

    private static Number number(double v) {
        if (v == Math.rint(v) && !Double.isInfinite(v)) {
            return (long) v;
        }
        return v;
    }

    private static SourcePosition positionFromJson(JsonElement element) {
        if (element == null || !element.isJsonObject()) {
            return null;
        }
        JsonObject json = element.getAsJsonObject();
        return new SourcePosition(read(json, "line"), read(json, "column"), read(json, "offset"));
    }

    private static double read(JsonObject json, String key) {
        JsonElement v = json.get(key);
        if (v == null || !v.isJsonPrimitive() || !v.getAsJsonPrimitive().isNumber()) {
            return Double.NaN;
        }
        return v.getAsDouble();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceSpan)) return false;
        SourceSpan that = (SourceSpan) o;
        return Objects.equals(start, that.start) && Objects.equals(end, that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
