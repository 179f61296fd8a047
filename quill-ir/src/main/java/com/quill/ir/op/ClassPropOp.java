package com.quill.ir.op;

import com.quill.ir.XrefId;
import com.quill.ir.expr.IrExpr;

import java.util.Collections;
import java.util.List;

/**
 * 单个 class 开关绑定 {@code [class.name]="expr"}。
 */
public class ClassPropOp extends IrOp {

    private final XrefId target;
    private final IrExpr expression;
    private String name;

    public ClassPropOp(XrefId target, String name, IrExpr expression) {
        super(OpKind.CLASS_PROP);
        this.target = target;
        this.name = name;
        this.expression = expression;
    }

    public XrefId getTarget() { return target; }
    public IrExpr getExpression() { return expression; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    @Override
    public List<IrExpr> getExpressions() {
        return Collections.singletonList(expression);
    }

    @Override
    public <R, C> R accept(OpVisitor<R, C> visitor, C context) {
        return visitor.visitClassProp(this, context);
    }

    @Override
    public String toString() {
        return "CLASS_PROP " + name;
    }
}
