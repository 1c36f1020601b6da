package com.luascript.ir.node;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 各类运算符的白名单。
 */
public final class Operators {

    public static final Set<String> BINARY = of(
            "+", "-", "*", "/", "%", "**",
            "==", "!=", "===", "!==", "<", "<=", ">", ">=",
            "&", "|", "^", "<<", ">>", ">>>", "in", "instanceof");

    public static final Set<String> LOGICAL = of("&&", "||", "??");

    public static final Set<String> UNARY = of("-", "+", "!", "~", "typeof");

    public static final Set<String> UPDATE = of("++", "--");

    public static final Set<String> ASSIGNMENT = of(
            "=", "+=", "-=", "*=", "/=", "%=", "**=", "<<=", ">>=", "&=", "|=", "^=");

    private Operators() {}

    /**
     * 节点种类对应的白名单；没有 operator 字段的种类返回 null。
     */
    public static Set<String> allowedFor(IrKind kind) {
        if (kind == null) return null;
        switch (kind) {
            case BINARY_EXPRESSION: return BINARY;
            case LOGICAL_EXPRESSION: return LOGICAL;
            case UNARY_EXPRESSION: return UNARY;
            case UPDATE_EXPRESSION: return UPDATE;
            case ASSIGNMENT_EXPRESSION: return ASSIGNMENT;
            default: return null;
        }
    }

    /** 复合赋值对应的二元运算符，如 {@code +=} → {@code +} */
    public static String compoundBase(String assignmentOperator) {
        if ("=".equals(assignmentOperator)) return null;
        return assignmentOperator.substring(0, assignmentOperator.length() - 1);
    }

    private static Set<String> of(String... ops) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(ops)));
    }
}
