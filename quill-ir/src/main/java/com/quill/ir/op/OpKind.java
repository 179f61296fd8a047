package com.quill.ir.op;

/**
 * 模板 IR op 种类。
 */
public enum OpKind {
    // create 阶段
    ELEMENT_START,
    ELEMENT_END,
    TEXT,
    TEMPLATE,
    REPEATER_CREATE,
    LISTENER,

    // 两个阶段通用
    VARIABLE,
    STATEMENT,

    // update 阶段
    ADVANCE,
    PROPERTY,
    HOST_PROPERTY,
    STYLE_PROP,
    CLASS_PROP,
    INTERPOLATE_TEXT
}
