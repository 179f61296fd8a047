package com.quill.ir.op;

/**
 * update 阶段推进选中槽位。
 */
public class AdvanceOp extends IrOp {

    private final int delta;

    public AdvanceOp(int delta) {
        super(OpKind.ADVANCE);
        this.delta = delta;
    }

    public int getDelta() { return delta; }

    @Override
    public <R, C> R accept(OpVisitor<R, C> visitor, C context) {
        return visitor.visitAdvance(this, context);
    }
}
