package com.quill.ir.variable;

/**
 * 语义变量种类。
 */
public enum SemanticVariableKind {
    CONTEXT,        // 某个视图的上下文对象
    IDENTIFIER,     // 模板中带名字的局部引用/模板变量
    SAVED_VIEW,     // 保存的视图引用（监听器恢复视图用）
    ALIAS           // @for 等块内的别名
}
