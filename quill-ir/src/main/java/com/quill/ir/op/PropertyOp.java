package com.quill.ir.op;

import com.quill.ir.XrefId;
import com.quill.ir.expr.IrExpr;

import java.util.Collections;
import java.util.List;

/**
 * 元素属性绑定 {@code [name]="expr"}。
 */
public class PropertyOp extends IrOp {

    private final XrefId target;
    private final IrExpr expression;
    private final boolean animationTrigger;
    private String name;

    public PropertyOp(XrefId target, String name, IrExpr expression, boolean animationTrigger) {
        super(OpKind.PROPERTY);
        this.target = target;
        this.name = name;
        this.expression = expression;
        this.animationTrigger = animationTrigger;
    }

    public XrefId getTarget() { return target; }
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
        return visitor.visitProperty(this, context);
    }

    @Override
    public String toString() {
        return "PROPERTY " + name;
    }
}
