package com.luascript.compiler.parser;

import com.google.gson.JsonObject;

/**
 * 前端解析器契约。
 *
 * <p>词法/语法分析不在本项目内实现，外部解析器（acorn、esprima 等）
 * 交出 ESTree 形态的 JSON 树即可接入管线。</p>
 */
public interface SourceParser {

    /**
     * 解析源码。
     *
     * @param sourceText 源码文本
     * @param fileName   文件名（用于错误信息）
     * @return ESTree 形态的 Program 根节点
     */
    JsonObject parse(String sourceText, String fileName);
}
