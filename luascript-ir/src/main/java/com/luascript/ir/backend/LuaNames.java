package com.luascript.ir.backend;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * Lua 标识符与字符串字面量工具。
 */
public final class LuaNames {

    private static final Set<String> RESERVED = new HashSet<>(Arrays.asList(
            "and", "break", "do", "else", "elseif", "end", "false", "for", "function", "goto",
            "if", "in", "local", "nil", "not", "or", "repeat", "return", "then", "true",
            "until", "while"));

    /** 编码后名称的前缀 */
    private static final String ESCAPE_PREFIX = "_X";

    private LuaNames() {}

    public static boolean isReserved(String name) {
        return RESERVED.contains(name);
    }

    /** 是否可以直接作为 Lua 名称使用（含保留字检查） */
    public static boolean isLuaName(String name) {
        if (name == null || name.isEmpty() || isReserved(name)) return false;
        char first = name.charAt(0);
        if (!(isAsciiLetter(first) || first == '_')) return false;
        for (int i = 1; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!(isAsciiLetter(c) || c == '_' || (c >= '0' && c <= '9'))) return false;
        }
        return true;
    }

    /**
     * 把源语言标识符改写为合法的 Lua 名称，改写是单射的：
     * <ul>
     *   <li>保留字及其后跟若干下划线的形式各追加一个下划线（{@code end → end_}，{@code end_ → end__}）；</li>
     *   <li>含非法字符、以 {@code __} 或 {@code _X} 开头的名称整体编码为 {@code _X<body>}：
     *       字母数字原样保留，{@code _} 写作 {@code __}，{@code $} 写作 {@code _S}，
     *       其他字符写作 {@code _uXXXX}。</li>
     * </ul>
     * 以 {@code __} 开头的名称留给生成代码（临时变量与辅助函数）。
     */
    public static String mangle(String name) {
        if (isReservedFamily(name)) {
            return name + "_";
        }
        if (isLuaName(name) && !name.startsWith("__") && !name.startsWith(ESCAPE_PREFIX)) {
            return name;
        }
        StringBuilder sb = new StringBuilder(ESCAPE_PREFIX);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (isAsciiLetter(c) || (c >= '0' && c <= '9')) {
                sb.append(c);
            } else if (c == '_') {
                sb.append("__");
            } else if (c == '$') {
                sb.append("_S");
            } else {
                sb.append("_u").append(String.format("%04X", (int) c));
            }
        }
        return sb.toString();
    }

    /** 保留字本身，或保留字后跟一个以上下划线 */
    private static boolean isReservedFamily(String name) {
        int end = name.length();
        while (end > 0 && name.charAt(end - 1) == '_') {
            end--;
        }
        return isReserved(name.substring(0, end));
    }

    /**
     * 单次表访问：合法名称用 {@code t.key}，否则用 {@code t["key"]}。
     */
    public static String field(String table, String key) {
        if (isLuaName(key)) {
            return table + "." + key;
        }
        return table + "[" + quote(key) + "]";
    }

    /** 表构造器中的键：{@code key = } 或 {@code ["key"] = } */
    public static String tableKey(String key) {
        if (isLuaName(key)) {
            return key;
        }
        return "[" + quote(key) + "]";
    }

    /** 转为双引号包裹的 Lua 字符串字面量 */
    public static String quote(String s) {
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '"': sb.append("\\\""); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                default:
                    // 固定三位，避免与后随数字连读
                    if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\%03d", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        return sb.append('"').toString();
    }

    /** 由节点 ID 派生的临时变量名，如 {@code pat_1T0} → {@code __pat_1T0} */
    public static String temp(String nodeId) {
        return "__" + nodeId;
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
