package com.quill.ir.op;

import com.quill.ir.expr.IrExpr;

import java.util.Collections;
import java.util.List;

/**
 * 宿主属性绑定 {@code host: {'[name]': 'expr'}}。
 */
public class HostPropertyOp extends IrOp {

    private final IrExpr expression;
    private final boolean animationTrigger;
    private String name;

    public HostPropertyOp(String name, IrExpr expression, boolean animationTrigger) {
        super(OpKind.HOST_PROPERTY);
        this.name = name;
        this.expression = expression;
        this.animationTrigger = animationTrigger;
    }

    public IrExpr getExpression() { return expression; }
    public boolean isAnimationTrigger() { return animationTrigger; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    @Override
    public List<IrExpr> getExpressions() {
        return Collections.singletonList(expression);
    }

    @Override
    public <R, C> R accept(OpVisitor<R, C> visitor, C context) {
        return visitor.visitHostProperty(this, context);
    }

    @Override
    public String toString() {
        return "HOST_PROPERTY " + name;
    }
}
