package com.luascript.ir.serial;

import com.google.gson.JsonObject;
import com.luascript.compiler.compiler.CompileOptions;
import com.luascript.ir.LuaScriptIrCompiler;
import com.luascript.ir.node.IrDocument;
import com.luascript.ir.node.IrKind;
import com.luascript.ir.node.IrNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.luascript.ir.Estree.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("IR 文本视图测试")
class IrTreePrinterTest {

    private final LuaScriptIrCompiler compiler = new LuaScriptIrCompiler();

    private IrDocument lower(JsonObject program) {
        return compiler.lower(program, null, CompileOptions.defaults());
    }

    @Test
    @DisplayName("树视图从 Program 出发逐层缩进")
    void testTreeShape() {
        String out = new IrTreePrinter().print(lower(program(constant(id("a"), num(1)))));
        String[] lines = out.split("\n");

        assertThat(lines[0]).isEqualTo("Program#mod_1");
        assertThat(lines[1]).isEqualTo("  body:");
        assertThat(lines[2]).matches("    VariableDeclaration#decl_[T01]+ declarationKind=const");
        assertThat(out).containsPattern("\n {12}Identifier#expr_[T01]+ name=a\n");
        assertThat(out).contains("value=1");
    }

    @Test
    @DisplayName("空位、缺失引用与未知种类都有标记")
    void testMarkers() {
        IrDocument doc = lower(program(exprStmt(array(num(1), null)), exprStmt(call(id("f")))));
        for (IrNode n : doc.getNodes()) {
            if (n.is(IrKind.CALL_EXPRESSION)) {
                n.setRef("callee", "expr_TTT");
            }
        }
        doc.addNode(new IrNode("expr_1TTTTT", "JSXElement"));
        List<String> body = new ArrayList<>(doc.getProgram().getRefs("body"));
        body.add("expr_1TTTTT");
        doc.getProgram().setRefs("body", body);

        String out = new IrTreePrinter().print(doc);
        assertThat(out).contains("<hole>");
        assertThat(out).contains("<missing expr_TTT>");
        assertThat(out).contains("JSXElement#expr_1TTTTT <unknown kind>");
    }

    @Test
    @DisplayName("DOT 视图包含引用边与控制流图 cluster")
    void testDot() {
        IrDocument doc = lower(program(exprStmt(call(id("f")))));
        String dot = new IrDotWriter().write(doc);

        assertThat(dot).startsWith("digraph ir {\n");
        assertThat(dot).endsWith("}\n");
        assertThat(dot).containsPattern("\"mod_1\" -> \"stmt_[T01]+\" \\[label=\"body\\[0\\]\"\\];");
        assertThat(dot).contains("subgraph \"cluster_cfg_");
        assertThat(dot).containsPattern("\\[shape=ellipse, label=\"entry bb_[T01]+\\\\nstmt_[T01]+\"\\]");
    }

    @Test
    @DisplayName("DOT 字符串转义")
    void testQuote() {
        assertThat(IrDotWriter.quote("a\"b\\c\nd")).isEqualTo("\"a\\\"b\\\\c\\nd\"");
    }
}
