package com.luascript.ir.node;

/**
 * 节点 ID 的类别前缀。
 */
public enum NodeCategory {
    MODULE("mod"),
    DECLARATION("decl"),
    STATEMENT("stmt"),
    CLAUSE("clause"),
    EXPRESSION("expr"),
    PATTERN("pat"),
    GRAPH("cfg"),
    BLOCK("bb");

    private final String prefix;

    NodeCategory(String prefix) {
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }

    public static NodeCategory fromPrefix(String prefix) {
        for (NodeCategory c : values()) {
            if (c.prefix.equals(prefix)) return c;
        }
        return null;
    }
}
