package com.quill.ir.op;

import com.quill.ir.XrefId;
import com.quill.ir.expr.IrExpr;
import com.quill.ir.variable.SemanticVariable;

import java.util.Collections;
import java.util.List;

/**
 * 变量声明。xref 为该变量的身份，读取点通过 {@link com.quill.ir.expr.ReadVariableExpr} 引用它。
 */
public class VariableOp extends IrOp {

    private final XrefId xref;
    private final SemanticVariable variable;
    private final IrExpr initializer;

    public VariableOp(XrefId xref, SemanticVariable variable, IrExpr initializer) {
        super(OpKind.VARIABLE);
        this.xref = xref;
        this.variable = variable;
        this.initializer = initializer;
    }

    public XrefId getXref() { return xref; }
    public SemanticVariable getVariable() { return variable; }
    public IrExpr getInitializer() { return initializer; }

    @Override
    public List<IrExpr> getExpressions() {
        return initializer != null ? Collections.singletonList(initializer) : Collections.emptyList();
    }

    @Override
    public <R, C> R accept(OpVisitor<R, C> visitor, C context) {
        return visitor.visitVariable(this, context);
    }

    @Override
    public String toString() {
        return "VARIABLE " + xref + " " + variable;
    }
}
