package com.quill.ir.op;

import com.quill.ir.expr.IrExpr;

import java.util.Collections;
import java.util.List;

/**
 * 模板 IR op 基类。
 * 具体种类是封闭集合，每个子类在 {@link OpVisitor} 里都有对应的 visit 方法。
 */
public abstract class IrOp {

    private final OpKind kind;

    protected IrOp(OpKind kind) {
        this.kind = kind;
    }

    public OpKind getKind() { return kind; }

    /**
     * op 直接持有的表达式（不含子表达式），按求值顺序排列。
     */
    public List<IrExpr> getExpressions() {
        return Collections.emptyList();
    }

    public abstract <R, C> R accept(OpVisitor<R, C> visitor, C context);

    @Override
    public String toString() {
        return kind.name();
    }
}
