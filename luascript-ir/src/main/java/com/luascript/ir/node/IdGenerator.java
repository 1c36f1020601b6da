package com.luascript.ir.node;

/**
 * 单次编译内的 ID 分配器。所有类别共用一个计数器，ID 不会复用。
 */
public class IdGenerator {

    private long counter;

    public IdGenerator() {
        this(1);
    }

    public IdGenerator(long start) {
        this.counter = start;
    }

    public String next(NodeCategory category) {
        return NodeId.format(category, counter++);
    }

    /** 查看下一个 ID 而不消耗 */
    public String peek(NodeCategory category) {
        return NodeId.format(category, counter);
    }

    public long getCounter() {
        return counter;
    }
}
