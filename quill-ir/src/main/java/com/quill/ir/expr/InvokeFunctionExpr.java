package com.quill.ir.expr;

import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * 函数调用 {@code fn(args)}。
 */
public class InvokeFunctionExpr extends IrExpr {

    private final IrExpr fn;
    private final List<IrExpr> args;

    public InvokeFunctionExpr(IrExpr fn, List<IrExpr> args) {
        this.fn = fn;
        this.args = args != null ? args : Collections.emptyList();
    }

    public IrExpr getFn() { return fn; }
    public List<IrExpr> getArgs() { return args; }

    @Override
    public void forEachChild(Consumer<IrExpr> visitor) {
        visitor.accept(fn);
        for (IrExpr arg : args) {
            visitor.accept(arg);
        }
    }

    @Override
    public String toString() {
        return fn + "(" + args + ")";
    }
}
