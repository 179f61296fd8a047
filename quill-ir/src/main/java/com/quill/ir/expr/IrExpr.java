package com.quill.ir.expr;

import java.util.function.Consumer;

/**
 * 模板 IR 表达式基类。
 */
public abstract class IrExpr {

    /**
     * 依次把直接子表达式交给 visitor，叶子表达式什么也不做。
     */
    public void forEachChild(Consumer<IrExpr> visitor) {
    }
}
