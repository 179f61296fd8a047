package com.quill.ir.pass.naming;

import com.quill.ir.XrefId;
import com.quill.ir.compilation.CompilationUnit;
import com.quill.ir.expr.ExpressionWalker;
import com.quill.ir.expr.ReadVariableExpr;
import com.quill.ir.op.IrOp;

import java.util.Map;

/**
 * 把单元内已分配的变量名回填到所有 {@link ReadVariableExpr}。
 * 单元自身的声明对其内部全部表达式可见，包括位于声明之前的读取。
 */
final class VariableNameBackfill {

    private VariableNameBackfill() {}

    /**
     * @param unit     要回填的单元
     * @param varNames 扫描该单元 VariableOp 时得到的 xref → 名字表
     * @throws NamingException 读取的变量不在表中
     */
    static void backfill(CompilationUnit unit, Map<XrefId, String> varNames) {
        for (IrOp op : unit.ops()) {
            ExpressionWalker.visitExpressionsInOp(op, expr -> {
                if (!(expr instanceof ReadVariableExpr)) return;
                ReadVariableExpr read = (ReadVariableExpr) expr;
                if (read.getName() != null) return;
                String name = varNames.get(read.getXref());
                if (name == null) {
                    throw new NamingException(NamingException.Reason.UNDECLARED_VARIABLE,
                            "Variable " + read.getXref() + " not yet named in " + unit, read.getXref());
                }
                read.setName(name);
            });
        }
    }
}
