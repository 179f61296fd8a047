package com.quill.ir;

/**
 * 兼容模式。
 * TEMPLATE_DEFINITION_BUILDER 复现旧模板编译器的命名/格式化行为，用于迁移期逐字节对比输出。
 */
public enum CompatibilityMode {
    NORMAL,
    TEMPLATE_DEFINITION_BUILDER
}
