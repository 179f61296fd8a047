package com.quill.compiler.util;

/**
 * 解析/生成阶段共用的字符串工具。
 */
public final class ParseUtil {

    private ParseUtil() {}

    /**
     * 把任意字符串清洗为合法的裸标识符：
     * 除 {@code [A-Za-z0-9_]} 以外的字符一律替换为 {@code _}。
     */
    public static String sanitizeIdentifier(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            sb.append(isWordChar(c) ? c : '_');
        }
        return sb.toString();
    }

    /**
     * 是否为 ASCII 单词字符（字母、数字、下划线）。
     */
    public static boolean isWordChar(char c) {
        return (c >= 'a' && c <= 'z')
                || (c >= 'A' && c <= 'Z')
                || (c >= '0' && c <= '9')
                || c == '_';
    }

    /**
     * 是否已经是合法标识符（sanitizeIdentifier 的不动点）。
     */
    public static boolean isSanitized(String name) {
        for (int i = 0; i < name.length(); i++) {
            if (!isWordChar(name.charAt(i))) return false;
        }
        return true;
    }
}
