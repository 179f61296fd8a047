package com.quill.ir.op;

import com.quill.ir.XrefId;

/**
 * 嵌入模板（ng-template、@if 分支等）。
 * xref 即子视图的 xref。
 */
public class TemplateOp extends IrOp {

    private final XrefId xref;
    private final String tag;
    /** 生成函数名后缀，如 "Conditional"；空串表示无后缀 */
    private final String functionNameSuffix;
    private final SlotHandle slot;

    public TemplateOp(XrefId xref, String tag, String functionNameSuffix, SlotHandle slot) {
        super(OpKind.TEMPLATE);
        this.xref = xref;
        this.tag = tag;
        this.functionNameSuffix = functionNameSuffix != null ? functionNameSuffix : "";
        this.slot = slot;
    }

    public XrefId getXref() { return xref; }
    public String getTag() { return tag; }
    public String getFunctionNameSuffix() { return functionNameSuffix; }
    public SlotHandle getSlot() { return slot; }

    @Override
    public <R, C> R accept(OpVisitor<R, C> visitor, C context) {
        return visitor.visitTemplate(this, context);
    }

    @Override
    public String toString() {
        return "TEMPLATE " + xref + " " + slot;
    }
}
