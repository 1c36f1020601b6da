package com.luascript.compiler.ast;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SourceSpan 测试")
class SourceSpanTest {

    @Test
    @DisplayName("写出的 JSON 使用整数")
    void testToJson() {
        JsonObject json = SourceSpan.of(1, 0, 0, 2, 7, 18).toJson();

        assertThat(json.toString()).isEqualTo(
                "{\"start\":{\"line\":1,\"column\":0,\"offset\":0},\"end\":{\"line\":2,\"column\":7,\"offset\":18}}");
    }

    @Test
    @DisplayName("读回后相等")
    void testFromJson() {
        SourceSpan span = SourceSpan.of(3, 2, 20, 3, 14, 32);

        assertThat(SourceSpan.fromJson(span.toJson())).isEqualTo(span);
        assertThat(SourceSpan.fromJson(span.toJson()).hashCode()).isEqualTo(span.hashCode());
    }

    @Test
    @DisplayName("缺失的数值读为 NaN，区间不再合法")
    void testMissingValues() {
        SourceSpan span = SourceSpan.fromJson(JsonParser.parseString(
                "{\"start\":{\"line\":1,\"column\":\"0\"},\"end\":{\"line\":1,\"column\":4,\"offset\":4}}"));

        assertThat(span.getStart().getLine()).isEqualTo(1.0);
        assertThat(span.getStart().getColumn()).isNaN();
        assertThat(span.getStart().getOffset()).isNaN();
        assertThat(span.isWellFormed()).isFalse();
        assertThat(span.getEnd().isWellFormed()).isTrue();
    }

    @Test
    @DisplayName("缺少端点或非对象输入")
    void testAbsent() {
        assertThat(SourceSpan.fromJson(null)).isNull();
        assertThat(SourceSpan.fromJson(JsonParser.parseString("null"))).isNull();
        assertThat(SourceSpan.fromJson(JsonParser.parseString("[1]"))).isNull();

        SourceSpan noEnd = SourceSpan.fromJson(JsonParser.parseString("{\"start\":{\"line\":1,\"column\":0,\"offset\":0}}"));
        assertThat(noEnd.getEnd()).isNull();
        assertThat(noEnd.isWellFormed()).isFalse();
    }

    @Test
    @DisplayName("负数与无穷不合法")
    void testWellFormed() {
        assertThat(new SourcePosition(1, 0, 0).isWellFormed()).isTrue();
        assertThat(new SourcePosition(-1, 0, 0).isWellFormed()).isFalse();
        assertThat(new SourcePosition(1, Double.POSITIVE_INFINITY, 0).isWellFormed()).isFalse();
    }

    @Test
    @DisplayName("文本形式为 行:列-行:列")
    void testToString() {
        assertThat(SourceSpan.of(1, 0, 0, 2, 7, 18).toString()).isEqualTo("1:0-2:7");
        assertThat(new SourcePosition(1.5, 2, 0).toString()).isEqualTo("1.5:2");
    }
}
