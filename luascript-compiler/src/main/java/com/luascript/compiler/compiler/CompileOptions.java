package com.luascript.compiler.compiler;

import com.google.gson.JsonObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 单次编译的选项。
 */
public class CompileOptions {
    public static final String DEFAULT_SCHEMA_VERSION = "1.0.0";

    private String sourcePath;
    private String sourceHash;
    private final Map<String, String> toolchain = new LinkedHashMap<>();
    private String schemaVersion = DEFAULT_SCHEMA_VERSION;
    private JsonObject functionMeta;
    private boolean validate = true;
    private boolean buildControlFlowGraphs = true;

    public CompileOptions() {
    }

    public static CompileOptions defaults() {
        return new CompileOptions();
    }

    public String getSourcePath() {
        return sourcePath;
    }

    public CompileOptions setSourcePath(String sourcePath) {
        this.sourcePath = sourcePath;
        return this;
    }

    /** 显式指定的源码哈希；未指定时由管线按源码文本计算 */
    public String getSourceHash() {
        return sourceHash;
    }

    public CompileOptions setSourceHash(String sourceHash) {
        this.sourceHash = sourceHash;
        return this;
    }

    public Map<String, String> getToolchain() {
        return Collections.unmodifiableMap(toolchain);
    }

    public CompileOptions putToolchain(String name, String version) {
        toolchain.put(name, version);
        return this;
    }

    public String getSchemaVersion() {
        return schemaVersion;
    }

    public CompileOptions setSchemaVersion(String schemaVersion) {
        this.schemaVersion = schemaVersion;
        return this;
    }

    /** 合并到每个函数元数据中的附加字段 */
    public JsonObject getFunctionMeta() {
        return functionMeta;
    }

    public CompileOptions setFunctionMeta(JsonObject functionMeta) {
        this.functionMeta = functionMeta;
        return this;
    }

    public boolean isValidate() {
        return validate;
    }

    public CompileOptions setValidate(boolean validate) {
        this.validate = validate;
        return this;
    }

    public boolean isBuildControlFlowGraphs() {
        return buildControlFlowGraphs;
    }

    public CompileOptions setBuildControlFlowGraphs(boolean buildControlFlowGraphs) {
        this.buildControlFlowGraphs = buildControlFlowGraphs;
        return this;
    }
}
