package com.quill.compiler.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ParseUtil 测试")
class ParseUtilTest {

    @Test
    @DisplayName("合法标识符保持不变")
    void testAlreadyValid() {
        assertThat(ParseUtil.sanitizeIdentifier("Comp_Template_0")).isEqualTo("Comp_Template_0");
        assertThat(ParseUtil.isSanitized("Comp_Template_0")).isTrue();
    }

    @Test
    @DisplayName("非单词字符替换为下划线")
    void testReplaceNonWordChars() {
        assertThat(ParseUtil.sanitizeIdentifier("my-el")).isEqualTo("my_el");
        assertThat(ParseUtil.sanitizeIdentifier("@open.done")).isEqualTo("_open_done");
        assertThat(ParseUtil.sanitizeIdentifier("a b$c")).isEqualTo("a_b_c");
    }

    @Test
    @DisplayName("非 ASCII 字符同样被替换")
    void testNonAscii() {
        assertThat(ParseUtil.sanitizeIdentifier("组件")).isEqualTo("__");
        assertThat(ParseUtil.isSanitized("组件")).isFalse();
    }

    @Test
    @DisplayName("清洗结果是不动点")
    void testIdempotent() {
        String once = ParseUtil.sanitizeIdentifier("x-y.z");
        assertThat(ParseUtil.sanitizeIdentifier(once)).isEqualTo(once);
        assertThat(ParseUtil.isSanitized(once)).isTrue();
    }
}
