package com.quill.ir.op;

import com.quill.ir.XrefId;
import com.quill.ir.expr.IrExpr;

import java.util.Collections;
import java.util.List;

/**
 * 单个样式属性绑定 {@code [style.name.unit]="expr"}。
 */
public class StylePropOp extends IrOp {

    private final XrefId target;
    private final IrExpr expression;
    /** 单位后缀，如 "px"，可为 null */
    private final String unit;
    private String name;

    public StylePropOp(XrefId target, String name, IrExpr expression, String unit) {
        super(OpKind.STYLE_PROP);
        this.target = target;
        this.name = name;
        this.expression = expression;
        this.unit = unit;
    }

    public XrefId getTarget() { return target; }
    public IrExpr getExpression() { return expression; }
    public String getUnit() { return unit; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    @Override
    public List<IrExpr> getExpressions() {
        return Collections.singletonList(expression);
    }

    @Override
    public <R, C> R accept(OpVisitor<R, C> visitor, C context) {
        return visitor.visitStyleProp(this, context);
    }

    @Override
    public String toString() {
        return "STYLE_PROP " + name;
    }
}
