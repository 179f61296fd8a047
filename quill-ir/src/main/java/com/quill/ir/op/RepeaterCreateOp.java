package com.quill.ir.op;

import com.quill.ir.XrefId;
import com.quill.ir.expr.IrExpr;

import java.util.Collections;
import java.util.List;

/**
 * {@code @for} 块。xref 为主分支视图，emptyView 为 {@code @empty} 分支视图（可为 null）。
 */
public class RepeaterCreateOp extends IrOp {

    private final XrefId xref;
    private final XrefId emptyView;
    private final String functionNameSuffix;
    private final SlotHandle slot;
    private final IrExpr track;

    public RepeaterCreateOp(XrefId xref, XrefId emptyView, String functionNameSuffix,
                            SlotHandle slot, IrExpr track) {
        super(OpKind.REPEATER_CREATE);
        this.xref = xref;
        this.emptyView = emptyView;
        this.functionNameSuffix = functionNameSuffix;
        this.slot = slot;
        this.track = track;
    }

    public XrefId getXref() { return xref; }
    public XrefId getEmptyView() { return emptyView; }
    public String getFunctionNameSuffix() { return functionNameSuffix; }
    public SlotHandle getSlot() { return slot; }
    public IrExpr getTrack() { return track; }

    @Override
    public List<IrExpr> getExpressions() {
        return track != null ? Collections.singletonList(track) : Collections.emptyList();
    }

    @Override
    public <R, C> R accept(OpVisitor<R, C> visitor, C context) {
        return visitor.visitRepeaterCreate(this, context);
    }

    @Override
    public String toString() {
        return "REPEATER_CREATE " + xref + (emptyView != null ? " empty=" + emptyView : "") + " " + slot;
    }
}
