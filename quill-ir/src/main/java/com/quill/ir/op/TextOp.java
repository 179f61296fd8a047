package com.quill.ir.op;

import com.quill.ir.XrefId;

/**
 * 静态文本节点。
 */
public class TextOp extends IrOp {

    private final XrefId xref;
    private final String initialValue;
    private final SlotHandle handle;

    public TextOp(XrefId xref, String initialValue, SlotHandle handle) {
        super(OpKind.TEXT);
        this.xref = xref;
        this.initialValue = initialValue;
        this.handle = handle;
    }

    public XrefId getXref() { return xref; }
    public String getInitialValue() { return initialValue; }
    public SlotHandle getHandle() { return handle; }

    @Override
    public <R, C> R accept(OpVisitor<R, C> visitor, C context) {
        return visitor.visitText(this, context);
    }
}
