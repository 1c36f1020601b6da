package com.luascript.ir.backend;

import com.google.gson.JsonObject;
import com.luascript.compiler.compiler.CompileOptions;
import com.luascript.ir.LuaScriptIrCompiler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.luascript.ir.Estree.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("LuaNames 测试")
class LuaNamesTest {

    private static String lua(JsonObject program) {
        LuaScriptIrCompiler compiler = new LuaScriptIrCompiler();
        return compiler.emit(compiler.lower(program, null, CompileOptions.defaults()));
    }

    // ============ 字符串字面量 ============

    @Nested
    @DisplayName("字符串字面量")
    class Quote {

        @Test
        @DisplayName("常用转义")
        void testCommonEscapes() {
            assertThat(LuaNames.quote("a\"b\\c\nd\te")).isEqualTo("\"a\\\"b\\\\c\\nd\\te\"");
        }

        @Test
        @DisplayName("控制字符固定写三位，后随数字不会连读")
        void testControlCharBeforeDigit() {
            assertThat(LuaNames.quote("\u00001")).isEqualTo("\"\\0001\"");
            assertThat(LuaNames.quote("\u00012")).isEqualTo("\"\\0012\"");
            assertThat(LuaNames.quote("\u007f")).isEqualTo("\"\\127\"");
        }

        @Test
        @DisplayName("非 ASCII 字符原样保留")
        void testUnicode() {
            assertThat(LuaNames.quote("你好")).isEqualTo("\"你好\"");
        }
    }

    // ============ 标识符改写 ============

    @Nested
    @DisplayName("标识符改写")
    class Mangle {

        @Test
        @DisplayName("普通名称不变")
        void testPlainName() {
            assertThat(LuaNames.mangle("count")).isEqualTo("count");
            assertThat(LuaNames.mangle("_private")).isEqualTo("_private");
            assertThat(LuaNames.mangle("x1")).isEqualTo("x1");
        }

        @Test
        @DisplayName("保留字及其下划线后缀形式各追加一个下划线")
        void testReservedFamily() {
            assertThat(LuaNames.mangle("end")).isEqualTo("end_");
            assertThat(LuaNames.mangle("end_")).isEqualTo("end__");
            assertThat(LuaNames.mangle("end__")).isEqualTo("end___");
            assertThat(LuaNames.mangle("ending")).isEqualTo("ending");
        }

        @Test
        @DisplayName("生成代码的 __ 前缀不会被源码名称占用")
        void testGeneratedPrefixReserved() {
            assertThat(LuaNames.mangle("__pat_1")).doesNotStartWith("__");
            assertThat(LuaNames.mangle("__i")).doesNotStartWith("__");
            assertThat(LuaNames.mangle("__await")).doesNotStartWith("__");
            assertThat(LuaNames.mangle("__")).doesNotStartWith("__");
        }

        @Test
        @DisplayName("非法字符编码")
        void testEncoding() {
            assertThat(LuaNames.mangle("a$")).isEqualTo("_Xa_S");
            assertThat(LuaNames.mangle("$")).isEqualTo("_X_S");
            assertThat(LuaNames.mangle("é")).isEqualTo("_X_u00E9");
            assertThat(LuaNames.mangle("__k")).isEqualTo("_X____k");
        }

        @Test
        @DisplayName("不同的源码名称改写后仍不同")
        void testInjective() {
            List<String> names = Arrays.asList("end", "end_", "end__", "a$", "a_S", "_Xa_S", "_S_", "a_S_",
                    "__k", "_X____k", "_X", "x", "_x", "$a", "_Sa", "é", "_u00E9", "__", "_", "then_", "then");
            Set<String> mangled = new HashSet<>();
            for (String name : names) {
                String out = LuaNames.mangle(name);
                assertThat(LuaNames.isLuaName(out)).as(name).isTrue();
                assertThat(mangled.add(out)).as(name + " -> " + out).isTrue();
            }
        }
    }

    // ============ 生成结果 ============

    @Nested
    @DisplayName("生成结果")
    class Emission {

        @Test
        @DisplayName("保留字变量与带下划线的同名变量互不覆盖")
        void testReservedAndSuffixedNames() {
            String out = lua(program(
                    let(id("end"), num(1)),
                    let(id("end_"), num(2)),
                    exprStmt(call(id("print"), id("end")))));

            assertThat(out).isEqualTo(
                    "local end_ = 1\n" +
                    "local end__ = 2\n" +
                    "print(end_)\n");
        }

        @Test
        @DisplayName("源码中的 __ 名称不与解构临时变量冲突")
        void testUserNameVersusTemp() {
            String out = lua(program(
                    let(id("__i"), num(1)),
                    constant(arrayPattern(id("a"), rest(id("tail"))), id("xs")),
                    exprStmt(call(id("print"), id("__i")))));

            assertThat(out).contains("local _X____i = 1\n");
            assertThat(out).contains("for __i = 2, #");
            assertThat(out).endsWith("print(_X____i)\n");
        }
    }
}
