package com.luascript.ir.node;

/**
 * 节点负载字段的类型。
 */
public enum FieldType {
    /** 必需的子节点 ID */
    NODE,
    /** 可为 null 的子节点 ID */
    OPTIONAL_NODE,
    /** 子节点 ID 列表 */
    NODE_LIST,
    /** 允许 null 空位的子节点 ID 列表 */
    SPARSE_NODE_LIST,
    STRING,
    OPTIONAL_STRING,
    /** 字符串列表，不允许空位 */
    STRING_LIST,
    BOOLEAN,
    INTEGER,
    /** JSON 原始值或 null */
    VALUE;

    public boolean isReference() {
        return this == NODE || this == OPTIONAL_NODE || this == NODE_LIST || this == SPARSE_NODE_LIST;
    }

    public boolean isOptional() {
        return this == OPTIONAL_NODE || this == OPTIONAL_STRING || this == VALUE;
    }
}
