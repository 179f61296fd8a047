package com.quill.ir.expr;

import java.util.function.Consumer;

/**
 * 二元运算。
 */
public class BinaryOperatorExpr extends IrExpr {

    private final String operator;
    private final IrExpr lhs;
    private final IrExpr rhs;

    public BinaryOperatorExpr(String operator, IrExpr lhs, IrExpr rhs) {
        this.operator = operator;
        this.lhs = lhs;
        this.rhs = rhs;
    }

    public String getOperator() { return operator; }
    public IrExpr getLhs() { return lhs; }
    public IrExpr getRhs() { return rhs; }

    @Override
    public void forEachChild(Consumer<IrExpr> visitor) {
        visitor.accept(lhs);
        visitor.accept(rhs);
    }

    @Override
    public String toString() {
        return "(" + lhs + " " + operator + " " + rhs + ")";
    }
}
