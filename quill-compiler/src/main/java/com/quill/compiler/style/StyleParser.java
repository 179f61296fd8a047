package com.quill.compiler.style;

import java.util.Locale;

/**
 * 样式属性名工具。
 */
public final class StyleParser {

    /** CSS 自定义属性前缀 */
    public static final String CUSTOM_PROPERTY_PREFIX = "--";

    private StyleParser() {}

    /**
     * camelCase → kebab-case。
     * 每个「小写字母 + 大写字母」相邻处插入 '-'，最后整体转小写，
     * 例如 {@code fontSize} → {@code font-size}。
     */
    public static String hyphenate(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 4);
        int i = 0;
        while (i < value.length()) {
            char c = value.charAt(i);
            sb.append(c);
            if (i + 1 < value.length() && isAsciiLower(c) && isAsciiUpper(value.charAt(i + 1))) {
                // 一对字符整体消费，和正则的非重叠匹配保持一致
                sb.append('-').append(value.charAt(i + 1));
                i += 2;
                continue;
            }
            i++;
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }

    /**
     * 是否为 CSS 自定义属性（{@code --foo}）。
     */
    public static boolean isCustomProperty(String name) {
        return name.startsWith(CUSTOM_PROPERTY_PREFIX);
    }

    private static boolean isAsciiLower(char c) {
        return c >= 'a' && c <= 'z';
    }

    private static boolean isAsciiUpper(char c) {
        return c >= 'A' && c <= 'Z';
    }
}
