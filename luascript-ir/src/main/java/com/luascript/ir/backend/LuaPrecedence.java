package com.luascript.ir.backend;

import java.util.HashMap;
import java.util.Map;

/**
 * Lua 运算符优先级表（由低到高）。
 *
 * <pre>
 * or
 * and
 * &lt; &gt; &lt;= &gt;= ~= ==
 * |
 * ~
 * &amp;
 * &lt;&lt; &gt;&gt;
 * ..            (右结合)
 * + -
 * * / // %
 * 一元 not # - ~
 * ^             (右结合)
 * </pre>
 */
public final class LuaPrecedence {

    public static final int OR = 1;
    public static final int AND = 2;
    public static final int COMPARISON = 3;
    public static final int BIT_OR = 4;
    public static final int BIT_XOR = 5;
    public static final int BIT_AND = 6;
    public static final int SHIFT = 7;
    public static final int CONCAT = 8;
    public static final int ADDITIVE = 9;
    public static final int MULTIPLICATIVE = 10;
    public static final int UNARY = 11;
    public static final int POWER = 12;
    public static final int PRIMARY = 13;

    private static final Map<String, Integer> BINARY = new HashMap<>();

    static {
        BINARY.put("or", OR);
        BINARY.put("and", AND);
        for (String op : new String[]{"<", ">", "<=", ">=", "~=", "=="}) {
            BINARY.put(op, COMPARISON);
        }
        BINARY.put("|", BIT_OR);
        BINARY.put("~", BIT_XOR);
        BINARY.put("&", BIT_AND);
        BINARY.put("<<", SHIFT);
        BINARY.put(">>", SHIFT);
        BINARY.put("..", CONCAT);
        BINARY.put("+", ADDITIVE);
        BINARY.put("-", ADDITIVE);
        BINARY.put("*", MULTIPLICATIVE);
        BINARY.put("/", MULTIPLICATIVE);
        BINARY.put("//", MULTIPLICATIVE);
        BINARY.put("%", MULTIPLICATIVE);
        BINARY.put("^", POWER);
    }

    private LuaPrecedence() {}

    /** Lua 二元运算符的优先级 */
    public static int of(String luaOperator) {
        Integer p = BINARY.get(luaOperator);
        if (p == null) {
            throw new IllegalArgumentException("Unknown Lua operator: " + luaOperator);
        }
        return p;
    }

    public static boolean isRightAssociative(String luaOperator) {
        return "..".equals(luaOperator) || "^".equals(luaOperator);
    }

    /** 满足结合律、右侧同运算符无需加括号的运算符 */
    public static boolean isAssociative(String luaOperator) {
        switch (luaOperator) {
            case "or":
            case "and":
            case "..":
            case "+":
            case "*":
            case "&":
            case "|":
            case "~":
                return true;
            default:
                return false;
        }
    }

    /**
     * 子表达式是否需要括号。
     * 优先级严格低于父节点时加括号；相等时只在结合方向冲突时加：
     * 右结合父节点给左侧子节点加，左结合父节点给运算符不同或不满足结合律的右侧子节点加。
     */
    public static boolean needsParens(int childPrecedence, String childOperator,
                                      String parentOperator, boolean rightOperand) {
        int parent = of(parentOperator);
        if (childPrecedence < parent) return true;
        if (childPrecedence > parent) return false;
        if (isRightAssociative(parentOperator)) {
            return !rightOperand;
        }
        if (!rightOperand) return false;
        return !(parentOperator.equals(childOperator) && isAssociative(parentOperator));
    }

    static String wrap(LuaExpr child, String parentOperator, boolean rightOperand) {
        if (needsParens(child.precedence, child.operator, parentOperator, rightOperand)) {
            return "(" + child.code + ")";
        }
        return child.code;
    }

    /** 一元运算符的操作数 */
    static String wrapUnaryOperand(LuaExpr operand) {
        if (operand.precedence < UNARY) {
            return "(" + operand.code + ")";
        }
        return operand.code;
    }
}
