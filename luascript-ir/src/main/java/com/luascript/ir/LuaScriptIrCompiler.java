package com.luascript.ir;

import com.google.gson.JsonObject;
import com.luascript.compiler.compiler.CompileOptions;
import com.luascript.compiler.compiler.LuaScriptCompilerApi;
import com.luascript.compiler.parser.SourceParser;
import com.luascript.ir.backend.EmitConfig;
import com.luascript.ir.backend.LuaEmitter;
import com.luascript.ir.node.IrDocument;
import com.luascript.ir.pass.PassPipeline;
import com.luascript.ir.pass.ValidationResult;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * 基于 IR 的编译器门面。
 * 管线：源码 → 外部解析器 → ESTree → 规范化 → IR → 校验 → Lua 源码。
 *
 * <p>不持有单次编译的可变状态，不同编译可以在不同线程上进行。</p>
 */
public class LuaScriptIrCompiler implements LuaScriptCompilerApi {

    private final SourceParser parser;
    private final PassPipeline pipeline;
    private final EmitConfig emitConfig;

    public LuaScriptIrCompiler() {
        this(null);
    }

    public LuaScriptIrCompiler(SourceParser parser) {
        this(parser, PassPipeline.createDefault(), new EmitConfig());
    }

    public LuaScriptIrCompiler(SourceParser parser, PassPipeline pipeline, EmitConfig emitConfig) {
        this.parser = parser;
        this.pipeline = pipeline;
        this.emitConfig = emitConfig;
    }

    public PassPipeline getPipeline() {
        return pipeline;
    }

    /**
     * 用配置的解析器解析源码并降级为 IR。
     *
     * @throws IllegalStateException 未配置解析器时
     */
    public IrDocument parseAndLower(String sourceText, CompileOptions options) {
        if (parser == null) {
            throw new IllegalStateException("No SourceParser configured");
        }
        CompileOptions opts = options != null ? options : CompileOptions.defaults();
        JsonObject tree = parser.parse(sourceText, opts.getSourcePath());
        return lower(tree, sourceText, opts);
    }

    /**
     * 从已解析的 ESTree 降级为 IR（按选项执行 Pass 与校验）。
     */
    public IrDocument lower(JsonObject rawTree, String sourceText, CompileOptions options) {
        return pipeline.execute(rawTree, sourceText, options);
    }

    public ValidationResult validateIR(IrDocument document) {
        return pipeline.validate(document);
    }

    public String emit(IrDocument document) {
        return new LuaEmitter(emitConfig).emit(document);
    }

    /**
     * 编译源代码。
     *
     * @param source   源代码
     * @param fileName 文件名
     * @return Lua 源码
     */
    @Override
    public String compile(String source, String fileName) {
        IrDocument document = parseAndLower(source, CompileOptions.defaults().setSourcePath(fileName));
        return emit(document);
    }

    /**
     * 编译文件。
     */
    public String compileFile(File file) throws IOException {
        String source = new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);
        return compile(source, file.getName());
    }
}
