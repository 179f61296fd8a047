package com.quill.ir.expr;

import java.util.function.Consumer;

/**
 * 属性读取 {@code receiver.name}。
 */
public class ReadPropExpr extends IrExpr {

    private final IrExpr receiver;
    private final String name;

    public ReadPropExpr(IrExpr receiver, String name) {
        this.receiver = receiver;
        this.name = name;
    }

    public IrExpr getReceiver() { return receiver; }
    public String getName() { return name; }

    @Override
    public void forEachChild(Consumer<IrExpr> visitor) {
        visitor.accept(receiver);
    }

    @Override
    public String toString() {
        return receiver + "." + name;
    }
}
