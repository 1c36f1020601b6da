package com.luascript.ir.backend;

/**
 * 已生成的 Lua 表达式片段及其优先级。
 */
final class LuaExpr {
    final String code;
    final int precedence;
    /** 二元运算符（Lua 写法）；非二元表达式为 null */
    final String operator;
    /** 是否为 Lua 前缀表达式（可直接被调用或索引） */
    final boolean prefix;

    private LuaExpr(String code, int precedence, String operator, boolean prefix) {
        this.code = code;
        this.precedence = precedence;
        this.operator = operator;
        this.prefix = prefix;
    }

    /** 名称、索引、调用等前缀表达式 */
    static LuaExpr prefix(String code) {
        return new LuaExpr(code, LuaPrecedence.PRIMARY, null, true);
    }

    /** 字面量、表构造器、函数体等不可直接索引的原子 */
    static LuaExpr atom(String code) {
        return new LuaExpr(code, LuaPrecedence.PRIMARY, null, false);
    }

    static LuaExpr binary(String code, String operator) {
        return new LuaExpr(code, LuaPrecedence.of(operator), operator, false);
    }

    static LuaExpr unary(String code) {
        return new LuaExpr(code, LuaPrecedence.UNARY, null, false);
    }

    /** 作为调用目标或被索引对象时的写法 */
    String asPrefix() {
        return prefix ? code : "(" + code + ")";
    }

    @Override
    public String toString() {
        return code;
    }
}
