package com.quill.ir.expr;

import com.quill.ir.XrefId;

/**
 * 通过 xref 读取语义变量。
 * 名字在命名阶段回填，回填后必须与声明处的名字一致。
 */
public class ReadVariableExpr extends IrExpr {

    private final XrefId xref;
    private String name;

    public ReadVariableExpr(XrefId xref) {
        this.xref = xref;
    }

    public XrefId getXref() { return xref; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    @Override
    public String toString() {
        return "read(" + xref + (name != null ? " = " + name : "") + ")";
    }
}
