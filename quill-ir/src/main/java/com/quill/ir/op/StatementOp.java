package com.quill.ir.op;

import com.quill.ir.expr.IrExpr;

import java.util.Collections;
import java.util.List;

/**
 * 表达式语句（监听函数体内的调用、return 等）。
 */
public class StatementOp extends IrOp {

    private final IrExpr expression;
    private final boolean isReturn;

    public StatementOp(IrExpr expression, boolean isReturn) {
        super(OpKind.STATEMENT);
        this.expression = expression;
        this.isReturn = isReturn;
    }

    public IrExpr getExpression() { return expression; }
    public boolean isReturn() { return isReturn; }

    @Override
    public List<IrExpr> getExpressions() {
        return Collections.singletonList(expression);
    }

    @Override
    public <R, C> R accept(OpVisitor<R, C> visitor, C context) {
        return visitor.visitStatement(this, context);
    }
}
