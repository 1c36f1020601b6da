package com.luascript.ir.backend;

/**
 * Lua 输出配置
 */
public class EmitConfig {
    private int indentSize = 4;
    private boolean useSpaces = true;

    public EmitConfig() {
    }

    public int getIndentSize() {
        return indentSize;
    }

    public EmitConfig setIndentSize(int indentSize) {
        this.indentSize = indentSize;
        return this;
    }

    public boolean isUseSpaces() {
        return useSpaces;
    }

    public EmitConfig setUseSpaces(boolean useSpaces) {
        this.useSpaces = useSpaces;
        return this;
    }

    /**
     * 获取单层缩进字符串
     */
    public String getIndentString() {
        if (!useSpaces) {
            return "\t";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < indentSize; i++) {
            sb.append(' ');
        }
        return sb.toString();
    }
}
