package com.quill.compiler.style;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("StyleParser 测试")
class StyleParserTest {

    @Test
    @DisplayName("camelCase 转为 kebab-case")
    void testHyphenate() {
        assertThat(StyleParser.hyphenate("fontSize")).isEqualTo("font-size");
        assertThat(StyleParser.hyphenate("borderTopLeftRadius")).isEqualTo("border-top-left-radius");
    }

    @Test
    @DisplayName("已是 kebab-case 的名字不变")
    void testAlreadyHyphenated() {
        assertThat(StyleParser.hyphenate("font-size")).isEqualTo("font-size");
        assertThat(StyleParser.hyphenate("color")).isEqualTo("color");
    }

    @Test
    @DisplayName("连续大写字母只在小写后断开")
    void testConsecutiveUpper() {
        assertThat(StyleParser.hyphenate("aBC")).isEqualTo("a-bc");
        assertThat(StyleParser.hyphenate("WebkitTransform")).isEqualTo("webkit-transform");
    }

    @Test
    @DisplayName("识别 CSS 自定义属性")
    void testCustomProperty() {
        assertThat(StyleParser.isCustomProperty("--my-var")).isTrue();
        assertThat(StyleParser.isCustomProperty("-webkit-x")).isFalse();
    }
}
