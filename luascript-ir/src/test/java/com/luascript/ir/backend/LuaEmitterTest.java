package com.luascript.ir.backend;

import com.google.gson.JsonObject;
import com.luascript.compiler.compiler.CompileOptions;
import com.luascript.ir.LuaScriptIrCompiler;
import com.luascript.ir.node.IrDocument;
import com.luascript.ir.node.IrKind;
import com.luascript.ir.node.IrNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.luascript.ir.Estree.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("LuaEmitter 测试")
class LuaEmitterTest {

    private static final LuaScriptIrCompiler COMPILER = new LuaScriptIrCompiler();

    private static IrDocument lower(JsonObject program) {
        return COMPILER.lower(program, null, CompileOptions.defaults());
    }

    private static String lua(JsonObject program) {
        return COMPILER.emit(lower(program));
    }

    private static IrNode first(IrDocument doc, IrKind kind) {
        for (IrNode node : doc.getNodes()) {
            if (node.is(kind)) return node;
        }
        throw new AssertionError("no " + kind);
    }

    /** {@code const r = expr} 生成的右侧表达式 */
    private static String expr(JsonObject expression) {
        String out = lua(program(constant(id("r"), expression)));
        assertThat(out).startsWith("local r = ");
        return out.substring("local r = ".length()).trim();
    }

    // ============ 表达式 ============

    @Nested
    @DisplayName("运算符与优先级")
    class Operators {

        @Test
        @DisplayName("只在需要时加括号")
        void testGrouping() {
            assertThat(expr(binary("+", num(1), binary("*", num(2), num(3))))).isEqualTo("1 + 2 * 3");
            assertThat(expr(binary("*", binary("+", num(1), num(2)), num(3)))).isEqualTo("(1 + 2) * 3");
            assertThat(expr(binary("-", id("a"), binary("-", id("b"), id("c"))))).isEqualTo("a - (b - c)");
            assertThat(expr(binary("-", binary("-", id("a"), id("b")), id("c")))).isEqualTo("a - b - c");
        }

        @Test
        @DisplayName("相等与幂运算映射到 Lua 写法")
        void testOperatorMapping() {
            assertThat(expr(binary("===", id("a"), id("b")))).isEqualTo("a == b");
            assertThat(expr(binary("!=", id("a"), id("b")))).isEqualTo("a ~= b");
            assertThat(expr(binary("**", num(2), num(3)))).isEqualTo("2 ^ 3");
            assertThat(expr(binary("%", id("a"), num(2)))).isEqualTo("a % 2");
        }

        @Test
        @DisplayName("字符串相加生成连接运算")
        void testConcat() {
            assertThat(expr(binary("+", str("n="), id("n")))).isEqualTo("\"n=\" .. n");
            assertThat(expr(binary("+", id("a"), id("b")))).isEqualTo("a + b");
        }

        @Test
        @DisplayName("逻辑与一元运算")
        void testLogicalAndUnary() {
            assertThat(expr(logical("&&", id("a"), logical("||", id("b"), id("c"))))).isEqualTo("a and (b or c)");
            assertThat(expr(unary("!", id("a")))).isEqualTo("not a");
            assertThat(expr(unary("!", binary("==", id("a"), id("b"))))).isEqualTo("not (a == b)");
            assertThat(expr(unary("-", unary("-", id("a"))))).isEqualTo("-(-a)");
            assertThat(expr(unary("typeof", id("a")))).isEqualTo("type(a)");
        }

        @Test
        @DisplayName("in 与 instanceof")
        void testInAndInstanceof() {
            assertThat(expr(binary("in", str("k"), id("o")))).isEqualTo("o[\"k\"] ~= nil");

            String out = lua(program(constant(id("r"), binary("instanceof", id("x"), id("Foo")))));
            assertThat(out).startsWith("local function __instanceof(value, class)");
            assertThat(out).contains("local r = __instanceof(x, Foo)");
        }
    }

    @Nested
    @DisplayName("值与访问")
    class Values {

        @Test
        @DisplayName("字面量")
        void testLiterals() {
            assertThat(expr(num(42))).isEqualTo("42");
            assertThat(expr(num(1.5))).isEqualTo("1.5");
            assertThat(expr(str("a\"b\n"))).isEqualTo("\"a\\\"b\\n\"");
            assertThat(expr(bool(false))).isEqualTo("false");
            assertThat(expr(nullLiteral())).isEqualTo("nil");
            assertThat(expr(id("undefined"))).isEqualTo("nil");
        }

        @Test
        @DisplayName("成员访问")
        void testMembers() {
            assertThat(expr(member(id("xs"), "length"))).isEqualTo("#xs");
            assertThat(expr(member(id("o"), "end"))).isEqualTo("o[\"end\"]");
            assertThat(expr(index(id("o"), id("k")))).isEqualTo("o[k]");
            assertThat(expr(member(member(id("a"), "b"), "c"))).isEqualTo("a.b.c");
        }

        @Test
        @DisplayName("调用与构造")
        void testCalls() {
            assertThat(lua(program(exprStmt(call(member(id("console"), "log"), str("hi"))))))
                    .isEqualTo("print(\"hi\")\n");
            assertThat(expr(newExpr(id("Point"), num(1), num(2)))).isEqualTo("Point.new(1, 2)");
        }

        @Test
        @DisplayName("数组与对象构造器")
        void testTables() {
            assertThat(expr(array(num(1), null, num(3)))).isEqualTo("{1, nil, 3}");
            JsonObject quotedKey = node("Property", "key", str("b-c"), "value", num(2), "kind", "init",
                    "computed", false, "shorthand", false, "method", false);
            assertThat(expr(object(prop("a", num(1)), quotedKey))).isEqualTo("{a = 1, [\"b-c\"] = 2}");
            assertThat(expr(object())).isEqualTo("{}");
        }

        @Test
        @DisplayName("保留字标识符被改写")
        void testReservedNames() {
            assertThat(lua(program(let(id("end"), num(1))))).isEqualTo("local end_ = 1\n");
        }

        @Test
        @DisplayName("条件表达式")
        void testConditional() {
            assertThat(expr(conditional(id("c"), num(1), num(2)))).isEqualTo("c and 1 or 2");
            assertThat(expr(conditional(id("c"), bool(false), num(2))))
                    .isEqualTo("(function() if c then return false else return 2 end end)()");
        }
    }

    // ============ 语句 ============

    @Nested
    @DisplayName("语句")
    class Statements {

        @Test
        @DisplayName("声明：let/const 为 local，var 提升后赋值")
        void testDeclarations() {
            assertThat(lua(program(let(id("x"), null)))).isEqualTo("local x\n");
            assertThat(lua(program(varDecl(id("y"), num(1))))).isEqualTo("local y\ny = 1\n");
        }

        @Test
        @DisplayName("复合赋值与自增")
        void testCompoundAssignment() {
            String out = lua(program(
                    exprStmt(assign("+=", id("x"), num(2))),
                    exprStmt(assign("*=", id("x"), binary("+", id("a"), id("b")))),
                    exprStmt(update("++", false, id("i")))));
            assertThat(out).isEqualTo("x = x + 2\nx = x * (a + b)\ni = i + 1\n");
        }

        @Test
        @DisplayName("嵌套赋值改写为立即调用函数")
        void testNestedAssignment() {
            String out = lua(program(exprStmt(assign("=", id("a"), assign("=", id("b"), num(1))))));
            assertThat(out).matches("a = \\(function\\(\\) local (__expr_[T01]+) = 1; b = \\1; return \\1 end\\)\\(\\)\n");
        }

        @Test
        @DisplayName("if / elseif / else")
        void testIfChain() {
            String out = lua(program(ifStmt(id("a"), block(exprStmt(call(id("f")))),
                    ifStmt(id("b"), block(exprStmt(call(id("g")))), block(exprStmt(call(id("h"))))))));
            assertThat(out).isEqualTo(
                    "if a then\n" +
                    "    f()\n" +
                    "elseif b then\n" +
                    "    g()\n" +
                    "else\n" +
                    "    h()\n" +
                    "end\n");
        }

        @Test
        @DisplayName("for 循环展开为 while")
        void testForLoop() {
            String out = lua(program(forStmt(let(id("i"), num(0)), binary("<", id("i"), num(3)),
                    update("++", false, id("i")), block(exprStmt(call(id("f"), id("i")))))));
            assertThat(out).isEqualTo(
                    "do\n" +
                    "    local i = 0\n" +
                    "    while i < 3 do\n" +
                    "        do\n" +
                    "            f(i)\n" +
                    "        end\n" +
                    "        i = i + 1\n" +
                    "    end\n" +
                    "end\n");
        }

        @Test
        @DisplayName("continue 变为 goto 标签")
        void testContinue() {
            String out = lua(program(whileStmt(id("running"), block(
                    ifStmt(id("skip"), block(cont()), null),
                    exprStmt(call(id("work")))))));
            assertThat(out).containsPattern("goto (continue_stmt_[T01]+)");
            assertThat(out).containsPattern("::continue_stmt_[T01]+::");
            assertThat(out).startsWith("while running do\n    do\n");
        }

        @Test
        @DisplayName("非块尾的 return 包裹为 do ... end")
        void testEarlyReturn() {
            String out = lua(program(function("f", list(id("x")), block(
                    ifStmt(id("x"), block(ret(num(1)), exprStmt(call(id("g")))), null),
                    ret(num(2))))));
            assertThat(out).contains("        do return 1 end\n");
            assertThat(out).contains("    return 2\n");
        }

        @Test
        @DisplayName("switch 展开为 repeat ... until true")
        void testSwitch() {
            JsonObject sw = node("SwitchStatement", "discriminant", id("x"), "cases", list(
                    node("SwitchCase", "test", num(1), "consequent", list(exprStmt(call(id("one"))), brk())),
                    node("SwitchCase", "test", null, "consequent", list(exprStmt(call(id("other")))))));
            String out = lua(program(sw));
            assertThat(out).startsWith("repeat\n");
            assertThat(out).endsWith("until true\n");
            assertThat(out).containsPattern("if __stmt_[T01]+_matched or __stmt_[T01]+ == 1 then");
            assertThat(out).containsPattern("if __stmt_[T01]+_matched or not \\(__stmt_[T01]+ == 1\\) then");
            assertThat(out).contains("        break\n");
        }

        @Test
        @DisplayName("throw 变为 error(x, 0)")
        void testThrow() {
            assertThat(lua(program(node("ThrowStatement", "argument", str("boom")))))
                    .isEqualTo("error(\"boom\", 0)\n");
        }

        @Test
        @DisplayName("非调用表达式语句赋给占位变量")
        void testBareExpression() {
            assertThat(lua(program(exprStmt(binary("+", id("a"), num(1)))))).isEqualTo("local __ = a + 1\n");
        }
    }

    // ============ try ============

    @Nested
    @DisplayName("try 语句")
    class TryStatements {

        @Test
        @DisplayName("catch 与 finally 基于 pcall")
        void testTryCatchFinally() {
            String out = lua(program(tryStmt(block(exprStmt(call(id("risky")))), id("e"),
                    block(exprStmt(call(id("report"), id("e")))), block(exprStmt(call(id("cleanup")))))));
            assertThat(out).containsPattern("local (__stmt_[T01]+)_ok, \\1_res = pcall\\(function\\(\\)");
            assertThat(out).containsPattern("_ok, __stmt_[T01]+_res = pcall\\(function\\(e\\)");
            assertThat(out).contains("cleanup()");
            assertThat(out).containsPattern("error\\(__stmt_[T01]+_res, 0\\)");
            assertThat(out.indexOf("cleanup()")).isLessThan(out.indexOf("error("));
        }

        @Test
        @DisplayName("try 体内的 return 装箱并在外面拆箱")
        void testReturnInsideTry() {
            String out = lua(program(function("f", list(), block(
                    tryStmt(block(ret(num(1))), id("e"), block(ret(num(2))), null)))));
            assertThat(out).contains("return {1}");
            assertThat(out).contains("return {2}");
            assertThat(out).containsPattern("return __stmt_[T01]+_res\\[1\\]");
        }

        @Test
        @DisplayName("从 JSON 读入的 IR 中 break 跨越 try 时报错")
        void testBreakAcrossTry() {
            // 降级阶段会拒绝这种写法，这里把循环体里的 break 挪进 try 块
            IrDocument doc = lower(program(whileStmt(bool(true), block(
                    tryStmt(block(), id("e"), block(), null), brk()))));
            IrNode loopBody = doc.getNode(first(doc, IrKind.WHILE_STATEMENT).getRef("body"));
            List<String> stmts = new ArrayList<>(loopBody.getRefs("body"));
            String breakId = stmts.remove(1);
            loopBody.setRefs("body", stmts);
            IrNode tryBlock = doc.getNode(first(doc, IrKind.TRY_STATEMENT).getRef("block"));
            tryBlock.setRefs("body", Collections.singletonList(breakId));

            assertThatThrownBy(() -> COMPILER.emit(doc))
                    .isInstanceOf(EmissionException.class)
                    .hasMessageContaining("'break' cannot cross");
        }
    }

    // ============ 函数 ============

    @Nested
    @DisplayName("函数")
    class Functions {

        @Test
        @DisplayName("默认参数与 rest 参数")
        void testParameters() {
            String out = lua(program(function("f",
                    list(id("a"), withDefault(id("b"), num(2)), rest(id("more"))),
                    block(ret(id("b"))))));
            assertThat(out).isEqualTo(
                    "local function f(a, b, ...)\n" +
                    "    if b == nil then b = 2 end\n" +
                    "    local more = {...}\n" +
                    "    return b\n" +
                    "end\n");
        }

        @Test
        @DisplayName("var 提升为函数顶部的 local，不重复声明参数")
        void testHoisting() {
            String out = lua(program(function("f", list(id("x")), block(
                    varDecl(id("x"), num(1)),
                    ifStmt(id("c"), block(varDecl(id("y"), num(2))), null)))));
            assertThat(out).startsWith("local function f(x)\n    local y\n    x = 1\n");
        }

        @Test
        @DisplayName("箭头函数体缩进到所在层级之后")
        void testArrowFunction() {
            String out = lua(program(constant(id("inc"), arrow(list(id("x")), binary("+", id("x"), num(1))))));
            assertThat(out).isEqualTo(
                    "local inc = function(x)\n" +
                    "    return x + 1\n" +
                    "end\n");
        }

        @Test
        @DisplayName("具名函数表达式可以引用自身")
        void testNamedFunctionExpression() {
            JsonObject fact = node("FunctionExpression", "id", id("fact"), "params", list(id("n")),
                    "body", block(ret(call(id("fact"), id("n")))), "async", false, "generator", false);
            String out = lua(program(constant(id("f"), fact)));
            assertThat(out).startsWith("local f = (function() local fact; fact = function(n)\n");
            assertThat(out).endsWith("end; return fact end)()\n");
        }
    }

    // ============ 展开、模板、this 与可选链 ============

    @Nested
    @DisplayName("展开参数与数组展开")
    class Spread {

        @Test
        @DisplayName("末尾的展开写作 table.unpack")
        void testTrailingSpread() {
            assertThat(lua(program(exprStmt(call(id("f"), id("a"), spread(id("xs")))))))
                    .isEqualTo("f(a, table.unpack(xs))\n");
            assertThat(expr(array(num(1), spread(id("xs"))))).isEqualTo("{1, table.unpack(xs)}");
        }

        @Test
        @DisplayName("不在末尾的展开先用 __spread 拼成一张表")
        void testInnerSpread() {
            String call = lua(program(exprStmt(call(id("f"), spread(id("xs")), id("b")))));
            assertThat(call).startsWith("local function __spread(...)\n");
            assertThat(call).endsWith("f(table.unpack(__spread(xs, {b})))\n");

            String arr = lua(program(constant(id("r"), array(spread(id("xs")), num(1), num(2), spread(id("ys"))))));
            assertThat(arr).endsWith("local r = __spread(xs, {1, 2}, ys)\n");
        }

        @Test
        @DisplayName("new 的参数同样展开")
        void testNewSpread() {
            assertThat(expr(newExpr(id("Point"), spread(id("coords"))))).isEqualTo("Point.new(table.unpack(coords))");
        }
    }

    @Nested
    @DisplayName("模板字符串")
    class Templates {

        @Test
        @DisplayName("各段用 .. 连接，插值经过 tostring")
        void testConcatenation() {
            assertThat(expr(template("hi ", id("name"), "!"))).isEqualTo("\"hi \" .. tostring(name) .. \"!\"");
        }

        @Test
        @DisplayName("空段省略")
        void testEmptyQuasis() {
            assertThat(expr(template("", id("n"), ""))).isEqualTo("tostring(n)");
            assertThat(expr(template("", id("a"), "", id("b"), ""))).isEqualTo("tostring(a) .. tostring(b)");
            assertThat(expr(template(""))).isEqualTo("\"\"");
            assertThat(expr(template("plain"))).isEqualTo("\"plain\"");
        }

        @Test
        @DisplayName("作为操作数时按优先级加括号，参与 + 时按字符串连接")
        void testPrecedence() {
            assertThat(expr(member(template("a", id("x"), ""), "length"))).isEqualTo("#(\"a\" .. tostring(x))");
            assertThat(expr(binary("+", template("", id("x"), ""), num(1)))).isEqualTo("tostring(x) .. 1");
        }
    }

    @Nested
    @DisplayName("this")
    class ThisExpressions {

        @Test
        @DisplayName("this 写作 self，用到 this 的函数以 self 为首个参数")
        void testMethodSelf() {
            String out = lua(program(function("getX", list(), block(ret(member(thisExpr(), "x"))))));
            assertThat(out).isEqualTo(
                    "local function getX(self)\n" +
                    "    return self.x\n" +
                    "end\n");
        }

        @Test
        @DisplayName("箭头函数沿用外层的 self")
        void testArrowKeepsOuterSelf() {
            String out = lua(program(function("f", list(), block(
                    ret(arrow(list(), member(thisExpr(), "x")))))));
            assertThat(out).isEqualTo(
                    "local function f(self)\n" +
                    "    return function()\n" +
                    "        return self.x\n" +
                    "    end\n" +
                    "end\n");
        }

        @Test
        @DisplayName("不用 this 的函数参数不变，内层普通函数的 this 不算外层的")
        void testNoSelfWithoutThis() {
            JsonObject inner = node("FunctionExpression", "id", null, "params", list(),
                    "body", block(ret(thisExpr())), "async", false, "generator", false);
            String out = lua(program(function("outer", list(id("a")), block(ret(inner)))));
            assertThat(out).startsWith("local function outer(a)\n");
            assertThat(out).contains("return function(self)\n");
        }
    }

    @Nested
    @DisplayName("可选链")
    class OptionalChaining {

        @Test
        @DisplayName("表达式中的可选链用临时变量和 ~= nil 守卫")
        void testExpression() {
            // a?.b.c
            String code = expr(chain(member(optionalMember(id("a"), "b"), "c")));
            assertThat(code).matches(
                    "\\(function\\(\\) local (__expr_[T01]+) = a; if \\1 ~= nil then return \\1\\.b\\.c end end\\)\\(\\)");
        }

        @Test
        @DisplayName("多个 ?. 的守卫逐层嵌套")
        void testNestedGuards() {
            // a?.b?.()
            String code = expr(chain(optionalCall(optionalMember(id("a"), "b"))));
            assertThat(code).matches("\\(function\\(\\) local (__expr_[T01]+) = a; if \\1 ~= nil then "
                    + "local (__expr_[T01]+) = \\1\\.b; if \\2 ~= nil then return \\2\\(\\) end end end\\)\\(\\)");
        }

        @Test
        @DisplayName("语句中的可选调用展开为 if 块")
        void testStatement() {
            // obj?.save(1)
            String out = lua(program(exprStmt(chain(call(optionalMember(id("obj"), "save"), num(1))))));
            assertThat(out).matches(
                    "local (__expr_[T01]+) = obj\n" +
                    "if \\1 ~= nil then\n" +
                    "    \\1\\.save\\(1\\)\n" +
                    "end\n");
        }

        @Test
        @DisplayName("可选访问 length 仍写作 #")
        void testLength() {
            String code = expr(chain(optionalMember(id("xs"), "length")));
            assertThat(code).matches("\\(function\\(\\) local (__expr_[T01]+) = xs; if \\1 ~= nil then return #\\1 end end\\)\\(\\)");
        }
    }

    // ============ 确定性 ============

    @Test
    @DisplayName("同一文档多次生成结果一致")
    void testDeterministic() {
        IrDocument doc = lower(program(
                function("f", list(id("x")), block(ret(binary("instanceof", id("x"), id("A"))))),
                constant(id("r"), call(id("f"), num(1)))));
        String first = COMPILER.emit(doc);
        assertThat(COMPILER.emit(doc)).isEqualTo(first);
        assertThat(first.indexOf("local function __instanceof"))
                .isEqualTo(first.lastIndexOf("local function __instanceof"));
    }
}
