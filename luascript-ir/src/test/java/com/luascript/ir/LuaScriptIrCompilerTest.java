package com.luascript.ir;

import com.google.gson.JsonObject;
import com.luascript.compiler.compiler.CompileOptions;
import com.luascript.compiler.compiler.SourceHashes;
import com.luascript.compiler.parser.SourceParser;
import com.luascript.ir.backend.EmitConfig;
import com.luascript.ir.node.IrDocument;
import com.luascript.ir.node.IrKind;
import com.luascript.ir.node.IrNode;
import com.luascript.ir.pass.IrPass;
import com.luascript.ir.pass.PassPipeline;
import com.luascript.ir.pass.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicReference;

import static com.luascript.ir.Estree.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("LuaScriptIrCompiler 测试")
class LuaScriptIrCompilerTest {

    /** 忽略源码文本，始终交出同一棵树的解析器 */
    private static SourceParser fixed(JsonObject tree) {
        return (sourceText, fileName) -> tree.deepCopy();
    }

    // ============ 编译入口 ============

    @Nested
    @DisplayName("编译入口")
    class EntryPoints {

        @Test
        @DisplayName("compile 走完整管线并产出 Lua")
        void testCompile() {
            LuaScriptIrCompiler compiler = new LuaScriptIrCompiler(
                    fixed(program(exprStmt(call(member(id("console"), "log"), str("hello"))))));

            assertThat(compiler.compile("console.log('hello')", "hello.js")).isEqualTo("print(\"hello\")\n");
        }

        @Test
        @DisplayName("解析器收到源码与文件名")
        void testParserReceivesSource() {
            AtomicReference<String> seen = new AtomicReference<>();
            LuaScriptIrCompiler compiler = new LuaScriptIrCompiler((sourceText, fileName) -> {
                seen.set(fileName + ":" + sourceText);
                return program();
            });

            compiler.compile("x", "a.js");
            assertThat(seen.get()).isEqualTo("a.js:x");
        }

        @Test
        @DisplayName("compileFile 读取 UTF-8 文件")
        void testCompileFile(@TempDir Path dir) throws IOException {
            File file = dir.resolve("main.js").toFile();
            Files.write(file.toPath(), "let s = '你好';".getBytes(StandardCharsets.UTF_8));
            AtomicReference<String> seen = new AtomicReference<>();
            LuaScriptIrCompiler compiler = new LuaScriptIrCompiler((sourceText, fileName) -> {
                seen.set(sourceText);
                return program(let(id("s"), str("你好")));
            });

            assertThat(compiler.compileFile(file)).isEqualTo("local s = \"你好\"\n");
            assertThat(seen.get()).isEqualTo("let s = '你好';");
        }

        @Test
        @DisplayName("未配置解析器时 parseAndLower 报错")
        void testNoParser() {
            assertThatThrownBy(() -> new LuaScriptIrCompiler().parseAndLower("x", null))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("No SourceParser configured");
        }

        @Test
        @DisplayName("缩进配置生效")
        void testEmitConfig() {
            LuaScriptIrCompiler compiler = new LuaScriptIrCompiler(
                    fixed(program(ifStmt(id("a"), block(exprStmt(call(id("f")))), null))),
                    PassPipeline.createDefault(), new EmitConfig().setUseSpaces(false));

            assertThat(compiler.compile("", "t.js")).isEqualTo("if a then\n\tf()\nend\n");
        }
    }

    // ============ 元数据 ============

    @Nested
    @DisplayName("元数据")
    class Metadata {

        @Test
        @DisplayName("未给出哈希时按源码计算")
        void testSourceHash() {
            LuaScriptIrCompiler compiler = new LuaScriptIrCompiler(fixed(program()));
            IrDocument doc = compiler.parseAndLower("let x = 1;", CompileOptions.defaults().setSourcePath("x.js"));

            JsonObject source = doc.getMetadata().getAsJsonObject("source");
            assertThat(source.get("path").getAsString()).isEqualTo("x.js");
            assertThat(source.get("hash").getAsString()).isEqualTo(SourceHashes.sha256("let x = 1;"));
        }

        @Test
        @DisplayName("显式哈希优先")
        void testExplicitHash() {
            LuaScriptIrCompiler compiler = new LuaScriptIrCompiler(fixed(program()));
            IrDocument doc = compiler.parseAndLower("let x = 1;", CompileOptions.defaults().setSourceHash("pinned"));

            assertThat(doc.getMetadata().getAsJsonObject("source").get("hash").getAsString()).isEqualTo("pinned");
        }

        @Test
        @DisplayName("性能数据包含各阶段耗时与节点数")
        void testMetaPerf() {
            IrDocument doc = new LuaScriptIrCompiler().lower(program(exprStmt(call(id("f")))), null,
                    CompileOptions.defaults());

            JsonObject perf = doc.getMetadata().getAsJsonObject("metaPerf");
            assertThat(perf.keySet()).contains("normalizeMs", "lowerMs", "cfgMs", "validateMs", "totalMs", "nodeCount");
            assertThat(perf.get("nodeCount").getAsInt()).isEqualTo(doc.getNodeCount());
            assertThat(perf.get("totalMs").getAsDouble()).isGreaterThanOrEqualTo(0.0);
        }
    }

    // ============ 校验 ============

    @Nested
    @DisplayName("校验")
    class Validation {

        private PassPipeline corrupting() {
            PassPipeline pipeline = PassPipeline.createDefault();
            pipeline.addPass(new IrPass() {
                @Override
                public String getName() {
                    return "Corrupt";
                }

                @Override
                public IrDocument run(IrDocument document) {
                    for (IrNode n : document.getNodes()) {
                        if (n.is(IrKind.CALL_EXPRESSION)) {
                            n.setRef("callee", "expr_TTT");
                        }
                    }
                    return document;
                }
            });
            return pipeline;
        }

        @Test
        @DisplayName("不合法的 IR 以 ValidationException 报告全部错误")
        void testValidationFailure() {
            LuaScriptIrCompiler compiler = new LuaScriptIrCompiler(null, corrupting(), new EmitConfig());

            assertThatThrownBy(() -> compiler.lower(program(exprStmt(call(id("f"))), exprStmt(call(id("g")))),
                    null, CompileOptions.defaults()))
                    .isInstanceOfSatisfying(ValidationException.class, e -> {
                        assertThat(e.getErrors()).hasSize(2);
                        assertThat(e.getMessage()).startsWith("IR validation failed with 2 errors");
                    });
        }

        @Test
        @DisplayName("关闭校验时照常返回文档")
        void testValidationDisabled() {
            LuaScriptIrCompiler compiler = new LuaScriptIrCompiler(null, corrupting(), new EmitConfig());
            IrDocument doc = compiler.lower(program(exprStmt(call(id("f")))), null,
                    CompileOptions.defaults().setValidate(false));

            assertThat(compiler.validateIR(doc).isOk()).isFalse();
        }
    }

    // ============ 端到端 ============

    @Nested
    @DisplayName("端到端")
    class EndToEnd {

        @Test
        @DisplayName("函数内跳过空位的数组解构")
        void testPick() {
            JsonObject tree = program(function("pick", list(), block(
                    constant(arrayPattern(id("a"), null, id("c")), array(num(1), num(2), num(3))),
                    ret(binary("+", id("a"), id("c"))))));
            LuaScriptIrCompiler compiler = new LuaScriptIrCompiler(fixed(tree));

            String first = compiler.compile("", "pick.js");
            assertThat(compiler.compile("", "pick.js")).isEqualTo(first);
            assertThat(first).matches(
                    "local function pick\\(\\)\n" +
                    "    local (__pat_[T01]+) = \\{1, 2, 3\\}\n" +
                    "    local a = \\1\\[1\\]\n" +
                    "    local c = \\1\\[3\\]\n" +
                    "    return a \\+ c\n" +
                    "end\n");
        }

        @Test
        @DisplayName("默认值对 false 不生效")
        void testDefaultKeepsFalse() {
            JsonObject tree = program(
                    constant(id("o"), object(prop("flag", bool(false)))),
                    constant(objectPattern(prop("flag", withDefault(id("flag"), bool(true)))), id("o")));
            String out = new LuaScriptIrCompiler(fixed(tree)).compile("", "flags.js");

            assertThat(out).contains("if flag == nil then flag = true end");
            assertThat(out).doesNotContain("flag or true");
        }
    }
}
