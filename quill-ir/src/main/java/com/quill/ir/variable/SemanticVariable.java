package com.quill.ir.variable;

import com.quill.ir.XrefId;

/**
 * 由 {@link com.quill.ir.op.VariableOp} 声明的逻辑变量。
 * 最终名字只写一次，由命名阶段分配。
 */
public class SemanticVariable {

    private final SemanticVariableKind kind;
    /** IDENTIFIER 的源码标识符，其余种类为 null */
    private final String identifier;
    /** CONTEXT / SAVED_VIEW 所指向的视图，其余种类为 null */
    private final XrefId view;
    private String name;

    private SemanticVariable(SemanticVariableKind kind, String identifier, XrefId view) {
        this.kind = kind;
        this.identifier = identifier;
        this.view = view;
    }

    public static SemanticVariable context(XrefId view) {
        return new SemanticVariable(SemanticVariableKind.CONTEXT, null, view);
    }

    public static SemanticVariable identifier(String identifier) {
        return new SemanticVariable(SemanticVariableKind.IDENTIFIER, identifier, null);
    }

    public static SemanticVariable savedView(XrefId view) {
        return new SemanticVariable(SemanticVariableKind.SAVED_VIEW, null, view);
    }

    public static SemanticVariable alias(String identifier) {
        return new SemanticVariable(SemanticVariableKind.ALIAS, identifier, null);
    }

    public SemanticVariableKind getKind() { return kind; }
    public String getIdentifier() { return identifier; }
    public XrefId getView() { return view; }
    public String getName() { return name; }
    public boolean isNamed() { return name != null; }

    /**
     * 写入最终名字；已命名的变量不允许改名。
     */
    public void setName(String name) {
        if (this.name != null && !this.name.equals(name)) {
            throw new IllegalStateException("Variable already named '" + this.name + "', cannot rename to '" + name + "'");
        }
        this.name = name;
    }

    @Override
    public String toString() {
        return kind + (identifier != null ? "(" + identifier + ")" : "") + (name != null ? " as " + name : "");
    }
}
