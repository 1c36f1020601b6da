package com.luascript.ir.node;

/**
 * 节点负载的一个字段声明。
 */
public final class FieldSpec {
    private final String name;
    private final FieldType type;

    private FieldSpec(String name, FieldType type) {
        this.name = name;
        this.type = type;
    }

    public String getName() {
        return name;
    }

    public FieldType getType() {
        return type;
    }

    static FieldSpec node(String name) { return new FieldSpec(name, FieldType.NODE); }
    static FieldSpec optionalNode(String name) { return new FieldSpec(name, FieldType.OPTIONAL_NODE); }
    static FieldSpec nodes(String name) { return new FieldSpec(name, FieldType.NODE_LIST); }
    static FieldSpec sparseNodes(String name) { return new FieldSpec(name, FieldType.SPARSE_NODE_LIST); }
    static FieldSpec string(String name) { return new FieldSpec(name, FieldType.STRING); }
    static FieldSpec optionalString(String name) { return new FieldSpec(name, FieldType.OPTIONAL_STRING); }
    static FieldSpec strings(String name) { return new FieldSpec(name, FieldType.STRING_LIST); }
    static FieldSpec bool(String name) { return new FieldSpec(name, FieldType.BOOLEAN); }
    static FieldSpec integer(String name) { return new FieldSpec(name, FieldType.INTEGER); }
    static FieldSpec value(String name) { return new FieldSpec(name, FieldType.VALUE); }

    @Override
    public String toString() {
        return name + ":" + type;
    }
}
