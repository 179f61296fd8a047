package com.quill.ir.expr;

/**
 * 尚未解析到具体变量的词法读取（由上游作用域解析阶段替换）。
 */
public class LexicalReadExpr extends IrExpr {

    private final String name;

    public LexicalReadExpr(String name) {
        this.name = name;
    }

    public String getName() { return name; }

    @Override
    public String toString() {
        return name;
    }
}
