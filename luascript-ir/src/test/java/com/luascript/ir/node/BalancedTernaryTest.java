package com.luascript.ir.node;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.*;

@DisplayName("BalancedTernary 测试")
class BalancedTernaryTest {

    // ============ 编码 ============

    @Nested
    @DisplayName("encode")
    class Encode {

        @Test
        @DisplayName("小整数的规范写法")
        void testSmallValues() {
            assertThat(BalancedTernary.encode(0)).isEqualTo("0");
            assertThat(BalancedTernary.encode(1)).isEqualTo("1");
            assertThat(BalancedTernary.encode(2)).isEqualTo("1T");
            assertThat(BalancedTernary.encode(3)).isEqualTo("10");
            assertThat(BalancedTernary.encode(4)).isEqualTo("11");
            assertThat(BalancedTernary.encode(5)).isEqualTo("1TT");
            assertThat(BalancedTernary.encode(13)).isEqualTo("111");
        }

        @Test
        @DisplayName("负数不需要符号位")
        void testNegativeValues() {
            assertThat(BalancedTernary.encode(-1)).isEqualTo("T");
            assertThat(BalancedTernary.encode(-2)).isEqualTo("T1");
            assertThat(BalancedTernary.encode(-13)).isEqualTo("TTT");
        }

        @Test
        @DisplayName("非零值不带前导零")
        void testNoLeadingZero() {
            for (long v = -500; v <= 500; v++) {
                if (v == 0) continue;
                assertThat(BalancedTernary.encode(v)).doesNotStartWith("0");
            }
        }
    }

    // ============ 解码 ============

    @Nested
    @DisplayName("decode")
    class Decode {

        @Test
        @DisplayName("与 encode 互逆（含边界值）")
        void testInverse() {
            long[] samples = {0, 1, -1, 42, -42, Integer.MAX_VALUE, Integer.MIN_VALUE,
                    Long.MAX_VALUE, Long.MIN_VALUE, Long.MAX_VALUE - 1, Long.MIN_VALUE + 1};
            for (long v : samples) {
                assertThat(BalancedTernary.decode(BalancedTernary.encode(v))).isEqualTo(v);
            }
        }

        @Test
        @DisplayName("随机大范围取值互逆")
        void testRandomInverse() {
            Random random = new Random(20240601L);
            for (int i = 0; i < 10_000; i++) {
                long v = random.nextLong();
                assertThat(BalancedTernary.decode(BalancedTernary.encode(v))).isEqualTo(v);
            }
        }

        @Test
        @DisplayName("接受前导零")
        void testLeadingZeros() {
            assertThat(BalancedTernary.decode("001T")).isEqualTo(2);
        }

        @Test
        @DisplayName("空串报错")
        void testEmpty() {
            assertThatThrownBy(() -> BalancedTernary.decode(""))
                    .isInstanceOf(FormatException.class);
        }

        @Test
        @DisplayName("非法字符报错")
        void testInvalidDigit() {
            assertThatThrownBy(() -> BalancedTernary.decode("1T2"))
                    .isInstanceOf(FormatException.class)
                    .hasMessageContaining("'2'");
        }

        @Test
        @DisplayName("超出 long 范围报错")
        void testOverflow() {
            StringBuilder digits = new StringBuilder();
            for (int i = 0; i < 45; i++) {
                digits.append('1');
            }
            assertThatThrownBy(() -> BalancedTernary.decode(digits.toString()))
                    .isInstanceOf(FormatException.class)
                    .hasMessageContaining("out of range");
        }
    }

    @Test
    @DisplayName("isDigits 只接受 T/0/1")
    void testIsDigits() {
        assertThat(BalancedTernary.isDigits("T01")).isTrue();
        assertThat(BalancedTernary.isDigits("")).isFalse();
        assertThat(BalancedTernary.isDigits("t01")).isFalse();
        assertThat(BalancedTernary.isDigits(null)).isFalse();
    }
}
