package com.quill.ir.op;

import com.quill.ir.XrefId;

/**
 * 元素开始。
 */
public class ElementStartOp extends IrOp {

    private final XrefId xref;
    private final String tag;
    private final SlotHandle handle;

    public ElementStartOp(XrefId xref, String tag, SlotHandle handle) {
        super(OpKind.ELEMENT_START);
        this.xref = xref;
        this.tag = tag;
        this.handle = handle;
    }

    public XrefId getXref() { return xref; }
    public String getTag() { return tag; }
    public SlotHandle getHandle() { return handle; }

    @Override
    public <R, C> R accept(OpVisitor<R, C> visitor, C context) {
        return visitor.visitElementStart(this, context);
    }
}
