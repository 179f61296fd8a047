package com.quill.ir.expr;

/**
 * 字面量。
 */
public class LiteralExpr extends IrExpr {

    private final Object value;

    public LiteralExpr(Object value) {
        this.value = value;
    }

    public Object getValue() { return value; }

    @Override
    public String toString() {
        return value instanceof String ? "'" + value + "'" : String.valueOf(value);
    }
}
