package com.quill.ir.op;

import com.quill.ir.XrefId;

/**
 * 元素结束。
 */
public class ElementEndOp extends IrOp {

    private final XrefId xref;

    public ElementEndOp(XrefId xref) {
        super(OpKind.ELEMENT_END);
        this.xref = xref;
    }

    public XrefId getXref() { return xref; }

    @Override
    public <R, C> R accept(OpVisitor<R, C> visitor, C context) {
        return visitor.visitElementEnd(this, context);
    }
}
