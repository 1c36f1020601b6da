package com.luascript.ir.pass;

import com.google.gson.JsonObject;
import com.luascript.compiler.compiler.CompileOptions;
import com.luascript.ir.node.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.luascript.ir.Estree.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("ControlFlowGraphPass 测试")
class ControlFlowGraphPassTest {

    private static IrDocument compile(JsonObject program) {
        return PassPipeline.createDefault().execute(program, null, CompileOptions.defaults());
    }

    private static ControlFlowGraph graphOf(IrDocument doc, IrNode owner) {
        String id = owner.getMeta().getAsJsonObject("cfg").get("id").getAsString();
        return doc.getControlFlowGraph(id);
    }

    private static IrNode functionNode(IrDocument doc) {
        for (IrNode n : doc.getNodes()) {
            if (n.is(IrKind.FUNCTION_DECLARATION)) return n;
        }
        throw new AssertionError("no function");
    }

    @Test
    @DisplayName("模块和每个函数各有一张图")
    void testGraphPerOwner() {
        IrDocument doc = compile(program(
                function("f", list(), block(ret(num(1)))),
                exprStmt(call(id("f")))));

        assertThat(doc.getControlFlowGraphs()).hasSize(2);
        assertThat(graphOf(doc, doc.getProgram()).getFunctionId()).isEqualTo(doc.getModuleId());
        assertThat(graphOf(doc, functionNode(doc)).getFunctionId()).isEqualTo(functionNode(doc).getId());
    }

    @Test
    @DisplayName("空函数体只有 entry → exit")
    void testEmptyBody() {
        IrDocument doc = compile(program(function("f", list(), block())));

        ControlFlowGraph graph = graphOf(doc, functionNode(doc));
        List<BasicBlock> blocks = graph.getBlocks();
        assertThat(blocks).hasSize(2);
        assertThat(blocks.get(0).getKind()).isEqualTo(BlockKind.ENTRY);
        assertThat(blocks.get(0).getSuccessors()).containsExactly(graph.getExit());
        assertThat(blocks.get(1).getKind()).isEqualTo(BlockKind.EXIT);
    }

    @Test
    @DisplayName("分支语句独占一块，return 跳到 exit")
    void testBranchAndReturn() {
        IrDocument doc = compile(program(function("f", list(id("x")), block(
                let(id("y"), num(1)),
                ifStmt(id("x"), block(exprStmt(call(id("g")))), null),
                ret(id("y"))))));

        IrNode fn = functionNode(doc);
        ControlFlowGraph graph = graphOf(doc, fn);
        List<BasicBlock> blocks = graph.getBlocks();
        assertThat(blocks).extracting(BasicBlock::getKind)
                .containsExactly(BlockKind.ENTRY, BlockKind.BRANCH, BlockKind.BODY, BlockKind.EXIT);

        List<String> body = doc.getNode(fn.getRef("body")).getRefs("body");
        assertThat(blocks.get(0).getStatements()).containsExactly(body.get(0));
        assertThat(blocks.get(1).getStatements()).containsExactly(body.get(1));
        assertThat(blocks.get(2).getStatements()).containsExactly(body.get(2));

        assertThat(blocks.get(0).getSuccessors()).containsExactly(blocks.get(1).getId());
        assertThat(blocks.get(1).getSuccessors()).containsExactly(blocks.get(2).getId());
        assertThat(blocks.get(2).getSuccessors()).containsExactly(graph.getExit());
    }

    @Test
    @DisplayName("块与图使用 bb/cfg 类别的 ID")
    void testIdCategories() {
        IrDocument doc = compile(program(exprStmt(call(id("f")))));

        ControlFlowGraph graph = graphOf(doc, doc.getProgram());
        assertThat(graph.getId()).startsWith("cfg_");
        for (BasicBlock b : graph.getBlocks()) {
            assertThat(NodeId.isValid(b.getId())).isTrue();
            assertThat(b.getId()).startsWith("bb_");
        }
    }

    @Test
    @DisplayName("重复执行替换旧图而不是累加")
    void testRerunReplaces() {
        IrDocument doc = compile(program(function("f", list(), block())));
        int before = doc.getControlFlowGraphs().size();

        new ControlFlowGraphPass().run(doc);

        assertThat(doc.getControlFlowGraphs()).hasSize(before);
        assertThat(new IrValidator().validate(doc).isOk()).isTrue();
    }

    @Test
    @DisplayName("关闭选项时不构建")
    void testDisabled() {
        IrDocument doc = PassPipeline.createDefault().execute(program(function("f", list(), block())), null,
                CompileOptions.defaults().setBuildControlFlowGraphs(false));

        assertThat(doc.getControlFlowGraphs()).isEmpty();
        assertThat(doc.getProgram().getMeta() == null || !doc.getProgram().getMeta().has("cfg")).isTrue();
    }
}
