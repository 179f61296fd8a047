package com.quill.ir.expr;

import com.quill.ir.op.IrOp;

import java.util.function.Consumer;

/**
 * 表达式遍历工具。
 */
public final class ExpressionWalker {

    private ExpressionWalker() {}

    /**
     * 深度优先访问 op 持有的全部表达式（父节点先于子节点）。
     * 不会进入监听器的 handler op，它们由 {@link com.quill.ir.compilation.CompilationUnit#ops()} 单独列出。
     */
    public static void visitExpressionsInOp(IrOp op, Consumer<IrExpr> visitor) {
        for (IrExpr expr : op.getExpressions()) {
            visitExpression(expr, visitor);
        }
    }

    /**
     * 深度优先访问以 expr 为根的表达式树。
     */
    public static void visitExpression(IrExpr expr, Consumer<IrExpr> visitor) {
        if (expr == null) return;
        visitor.accept(expr);
        expr.forEachChild(child -> visitExpression(child, visitor));
    }
}
