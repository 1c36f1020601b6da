package com.luascript.compiler.compiler;

/**
 * 编译器统一接口。
 */
public interface LuaScriptCompilerApi {

    /**
     * 编译源码为 Lua 源码。
     *
     * @param source   源码字符串
     * @param fileName 文件名（用于错误信息和模块元数据）
     * @return Lua 源码
     */
    String compile(String source, String fileName);
}
