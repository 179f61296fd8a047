package com.quill.ir.op;

import com.quill.ir.XrefId;
import com.quill.ir.expr.IrExpr;

import java.util.List;

/**
 * 文本插值 {@code a{{x}}b{{y}}c}：strings 比 expressions 多一个。
 */
public class InterpolateTextOp extends IrOp {

    private final XrefId target;
    private final List<String> strings;
    private final List<IrExpr> expressions;

    public InterpolateTextOp(XrefId target, List<String> strings, List<IrExpr> expressions) {
        super(OpKind.INTERPOLATE_TEXT);
        if (strings.size() != expressions.size() + 1) {
            throw new IllegalArgumentException("Expected " + (expressions.size() + 1)
                    + " string parts for " + expressions.size() + " expressions, got " + strings.size());
        }
        this.target = target;
        this.strings = strings;
        this.expressions = expressions;
    }

    public XrefId getTarget() { return target; }
    public List<String> getStrings() { return strings; }

    @Override
    public List<IrExpr> getExpressions() {
        return expressions;
    }

    @Override
    public <R, C> R accept(OpVisitor<R, C> visitor, C context) {
        return visitor.visitInterpolateText(this, context);
    }
}
