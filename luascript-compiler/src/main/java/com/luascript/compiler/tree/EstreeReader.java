package com.luascript.compiler.tree;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

/**
 * 读取 ESTree JSON 文本。
 */
public final class EstreeReader {

    private EstreeReader() {}

    public static JsonObject read(String json) {
        try {
            return requireObject(JsonParser.parseString(json));
        } catch (JsonParseException e) {
            throw new StructuralException("Malformed tree JSON: " + e.getMessage(), null, null, null);
        }
    }

    public static JsonObject read(Reader reader) {
        try {
            return requireObject(JsonParser.parseReader(reader));
        } catch (JsonParseException e) {
            throw new StructuralException("Malformed tree JSON: " + e.getMessage(), null, null, null);
        }
    }

    /**
     * 读取 UTF-8 编码的 JSON 流（流由调用方关闭）。
     */
    public static JsonObject read(InputStream in) throws IOException {
        if (in == null) {
            throw new IOException("tree input not found");
        }
        return read(new InputStreamReader(in, StandardCharsets.UTF_8));
    }

    private static JsonObject requireObject(JsonElement element) {
        if (element == null || !element.isJsonObject()) {
            throw new StructuralException("Tree root must be a JSON object", null, null, null);
        }
        JsonObject root = element.getAsJsonObject();
        if (!root.has("type")) {
            throw new StructuralException("Tree root has no 'type'", null, "type", null);
        }
        return root;
    }
}
