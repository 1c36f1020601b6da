package com.luascript.compiler.compiler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SourceHashes 测试")
class SourceHashesTest {

    @Test
    @DisplayName("已知摘要")
    void testKnownDigests() {
        assertThat(SourceHashes.sha256(""))
                .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
        assertThat(SourceHashes.sha256("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    @DisplayName("按 UTF-8 编码计算")
    void testUtf8() {
        String hash = SourceHashes.sha256("你好");
        assertThat(hash).hasSize(64).matches("[0-9a-f]+");
        assertThat(hash).isNotEqualTo(SourceHashes.sha256("你"));
    }
}
