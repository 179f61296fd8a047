package com.quill.ir.pass.naming;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("StylePropNormalizer 测试")
class StylePropNormalizerTest {

    @Test
    @DisplayName("普通样式名转 kebab-case")
    void testNormalize() {
        assertThat(StylePropNormalizer.normalizeStylePropName("fontSize")).isEqualTo("font-size");
        assertThat(StylePropNormalizer.normalizeStylePropName("width")).isEqualTo("width");
    }

    @Test
    @DisplayName("CSS 变量原样保留")
    void testCustomProperty() {
        assertThat(StylePropNormalizer.normalizeStylePropName("--my-var")).isEqualTo("--my-var");
        assertThat(StylePropNormalizer.normalizeStylePropName("--myVar")).isEqualTo("--myVar");
    }

    @Test
    @DisplayName("兼容模式截掉 !important 及其后内容")
    void testStripImportant() {
        assertThat(StylePropNormalizer.stripImportant("color!important", true)).isEqualTo("color");
        assertThat(StylePropNormalizer.stripImportant("color!important!important", true)).isEqualTo("color");
        assertThat(StylePropNormalizer.stripImportant("color", true)).isEqualTo("color");
    }

    @Test
    @DisplayName("非兼容模式不做截断")
    void testNoStripOutsideCompatibility() {
        assertThat(StylePropNormalizer.stripImportant("color!important", false)).isEqualTo("color!important");
    }
}
