package com.quill.ir.pass.naming;

import com.quill.compiler.style.StyleParser;

/**
 * 样式/类名规范化，纯函数。
 */
public final class StylePropNormalizer {

    static final String IMPORTANT = "!important";

    private StylePropNormalizer() {}

    /**
     * 样式属性名转 kebab-case，CSS 变量（{@code --x}）原样保留。
     */
    public static String normalizeStylePropName(String name) {
        return StyleParser.isCustomProperty(name) ? name : StyleParser.hyphenate(name);
    }

    /**
     * 兼容模式下截掉第一个 {@code !important} 及其后的全部内容。
     */
    public static String stripImportant(String name, boolean compatibility) {
        if (!compatibility) return name;
        int importantIndex = name.indexOf(IMPORTANT);
        if (importantIndex > -1) {
            return name.substring(0, importantIndex);
        }
        return name;
    }
}
