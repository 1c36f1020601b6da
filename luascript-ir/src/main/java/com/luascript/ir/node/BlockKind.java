package com.luascript.ir.node;

/**
 * 基本块种类。
 */
public enum BlockKind {
    ENTRY("entry"),
    BODY("body"),
    BRANCH("branch"),
    EXIT("exit");

    private final String tag;

    BlockKind(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public static BlockKind fromTag(String tag) {
        for (BlockKind k : values()) {
            if (k.tag.equals(tag)) return k;
        }
        return null;
    }
}
