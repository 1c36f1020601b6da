package com.luascript.ir.pass;

import com.google.gson.JsonObject;
import com.luascript.compiler.compiler.CompileOptions;
import com.luascript.compiler.compiler.SourceHashes;
import com.luascript.compiler.tree.TreeNormalizer;
import com.luascript.ir.lowering.IrLowerer;
import com.luascript.ir.node.IrDocument;
import com.luascript.ir.serial.IrTreePrinter;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 编译 Pass 管线。
 * 串联完整流程：原始树 → 规范化 → IR → IR Pass → 校验。
 */
public class PassPipeline {

    private static final Logger LOG = Logger.getLogger(PassPipeline.class.getName());

    private final List<IrPass> passes = new ArrayList<>();
    private final TreeNormalizer normalizer = new TreeNormalizer();
    private final IrLowerer lowerer = new IrLowerer();
    private final IrValidator validator = new IrValidator();

    public PassPipeline() {
    }

    /**
     * 创建默认管线（包含控制流图构建）。
     */
    public static PassPipeline createDefault() {
        PassPipeline pipeline = new PassPipeline();
        pipeline.addPass(new ControlFlowGraphPass());
        return pipeline;
    }

    public void addPass(IrPass pass) {
        passes.add(pass);
    }

    public List<IrPass> getPasses() { return passes; }

    public IrValidator getValidator() { return validator; }

    /**
     * 执行完整管线。
     *
     * @param rawTree    前端给出的 ESTree 根节点
     * @param sourceText 源码（用于位置换算和默认的源码哈希）
     * @throws ValidationException 开启校验且 IR 不合法时
     */
    public IrDocument execute(JsonObject rawTree, String sourceText, CompileOptions options) {
        CompileOptions opts = options != null ? options : CompileOptions.defaults();
        long start = System.nanoTime();

        // 1. 规范化
        JsonObject normalized = normalizer.normalize(rawTree, sourceText);
        long t1 = System.nanoTime();

        // 2. 降级
        IrDocument document = lowerer.lower(normalized, opts);
        if (opts.getSourceHash() == null && sourceText != null) {
            document.getMetadata().getAsJsonObject("source").addProperty("hash", SourceHashes.sha256(sourceText));
        }
        long t2 = System.nanoTime();

        // 3. IR Pass
        for (IrPass pass : passes) {
            if (pass.isEnabled(opts)) {
                document = pass.run(document);
            }
        }
        long t3 = System.nanoTime();

        // IR dump（设置 LUASCRIPT_DUMP_IR=1 环境变量启用）
        if ("1".equals(System.getenv("LUASCRIPT_DUMP_IR"))) {
            LOG.info("===== IR DUMP " + opts.getSourcePath() + " =====\n" + new IrTreePrinter().print(document));
        }

        // 4. 校验
        ValidationResult result = null;
        if (opts.isValidate()) {
            result = validator.validate(document);
        }
        long t4 = System.nanoTime();

        JsonObject perf = new JsonObject();
        perf.addProperty("normalizeMs", millis(start, t1));
        perf.addProperty("lowerMs", millis(t1, t2));
        perf.addProperty("cfgMs", millis(t2, t3));
        perf.addProperty("validateMs", millis(t3, t4));
        perf.addProperty("totalMs", millis(start, t4));
        perf.addProperty("nodeCount", document.getNodeCount());
        document.getMetadata().add("metaPerf", perf);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Compiled " + opts.getSourcePath() + ": " + perf);
        }

        if (result != null && !result.isOk()) {
            throw new ValidationException(result);
        }
        return document;
    }

    /**
     * 只校验，不抛出。
     */
    public ValidationResult validate(IrDocument document) {
        return validator.validate(document);
    }

    private static double millis(long from, long to) {
        return Math.round((to - from) / 1000.0) / 1000.0;
    }
}
