package com.luascript.ir.node;

import java.math.BigInteger;

/**
 * 平衡三进制编解码。
 *
 * <p>数位取 {-1, 0, +1}，分别写作 {@code T}、{@code 0}、{@code 1}，
 * 最高位在前。负数无需符号位。</p>
 */
public final class BalancedTernary {

    private static final BigInteger THREE = BigInteger.valueOf(3);
    private static final BigInteger MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private BalancedTernary() {}

    /**
     * 编码任意 long（含 {@link Long#MIN_VALUE}）。
     */
    public static String encode(long value) {
        if (value == 0) {
            return "0";
        }
        StringBuilder sb = new StringBuilder();
        long n = value;
        while (n != 0) {
            int r = (int) Math.floorMod(n, 3L);
            n = Math.floorDiv(n, 3L);
            if (r == 2) {
                // 余 2 记为 -1 并向高位进 1
                r = -1;
                n += 1;
            }
            sb.append(digit(r));
        }
        return sb.reverse().toString();
    }

    /**
     * 解码数字串。
     *
     * @throws FormatException 空串、非法字符或超出 long 范围
     */
    public static long decode(String digits) {
        if (digits == null || digits.isEmpty()) {
            throw new FormatException("Empty balanced ternary string", digits);
        }
        BigInteger acc = BigInteger.ZERO;
        for (int i = 0; i < digits.length(); i++) {
            char c = digits.charAt(i);
            int d;
            switch (c) {
                case 'T': d = -1; break;
                case '0': d = 0; break;
                case '1': d = 1; break;
                default:
                    throw new FormatException("Invalid balanced ternary digit '" + c + "' in \""
                            + digits + "\"", digits);
            }
            acc = acc.multiply(THREE).add(BigInteger.valueOf(d));
        }
        if (acc.compareTo(MIN) < 0 || acc.compareTo(MAX) > 0) {
            throw new FormatException("Balanced ternary value out of range: " + digits, digits);
        }
        return acc.longValue();
    }

    /** 字符串是否只由 T/0/1 组成且非空 */
    public static boolean isDigits(String s) {
        if (s == null || s.isEmpty()) return false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c != 'T' && c != '0' && c != '1') return false;
        }
        return true;
    }

    private static char digit(int d) {
        switch (d) {
            case -1: return 'T';
            case 0: return '0';
            case 1: return '1';
            default: throw new IllegalArgumentException("digit " + d);
        }
    }
}
