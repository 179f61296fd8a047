package com.quill.ir;

/**
 * 交叉引用 id。
 * 由 {@link com.quill.ir.compilation.CompilationJob#allocateXrefId()} 分配，
 * 在一次编译内唯一且不复用，用于把声明（视图、变量）和所有引用点关联起来。
 * xref 只是身份标记，不是名字。
 */
public final class XrefId {

    private final int id;

    public XrefId(int id) {
        this.id = id;
    }

    public int getId() { return id; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof XrefId)) return false;
        return id == ((XrefId) o).id;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(id);
    }

    @Override
    public String toString() {
        return "xref#" + id;
    }
}
