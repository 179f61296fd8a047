package com.quill.ir.compilation;

import com.quill.ir.XrefId;

/**
 * 视图单元：组件根视图或嵌入视图（模板、条件分支、repeater 分支）。
 */
public class ViewCompilationUnit extends CompilationUnit {

    /** 父视图，根视图为 null */
    private final XrefId parent;

    public ViewCompilationUnit(ComponentCompilationJob job, XrefId xref, XrefId parent) {
        super(job, xref);
        this.parent = parent;
    }

    public XrefId getParent() { return parent; }

    @Override
    public ComponentCompilationJob getJob() {
        return (ComponentCompilationJob) super.getJob();
    }
}
