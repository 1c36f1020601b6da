package com.luascript.ir.backend;

/**
 * 生成代码按需引用的前置辅助函数。按声明顺序输出，每个最多一次。
 */
enum LuaHelper {
    AWAIT(
            "local function __await(value)",
            "    if type(value) == \"thread\" or (type(value) == \"table\" and type(value[\"then\"]) == \"function\") then",
            "        return coroutine.yield(value)",
            "    end",
            "    return value",
            "end"),
    INSTANCEOF(
            "local function __instanceof(value, class)",
            "    if type(value) ~= \"table\" then",
            "        return false",
            "    end",
            "    local mt = getmetatable(value)",
            "    while mt ~= nil do",
            "        if mt == class or mt.__index == class then",
            "            return true",
            "        end",
            "        mt = getmetatable(mt)",
            "    end",
            "    return false",
            "end"),
    SPREAD(
            "local function __spread(...)",
            "    local out, n = {}, 0",
            "    for i = 1, select(\"#\", ...) do",
            "        local part = select(i, ...)",
            "        for j = 1, #part do",
            "            n = n + 1",
            "            out[n] = part[j]",
            "        end",
            "    end",
            "    return out",
            "end");

    private final String[] lines;

    LuaHelper(String... lines) {
        this.lines = lines;
    }

    String[] getLines() {
        return lines;
    }
}
