package com.quill.ir.expr;

import com.quill.ir.XrefId;

/**
 * 引用某个视图的上下文对象。
 */
public class ContextExpr extends IrExpr {

    private final XrefId view;

    public ContextExpr(XrefId view) {
        this.view = view;
    }

    public XrefId getView() { return view; }

    @Override
    public String toString() {
        return "ctx(" + view + ")";
    }
}
