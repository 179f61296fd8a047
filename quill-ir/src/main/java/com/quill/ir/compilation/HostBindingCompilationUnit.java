package com.quill.ir.compilation;

import com.quill.ir.XrefId;

/**
 * 宿主绑定单元。不是视图，不能声明模板。
 */
public class HostBindingCompilationUnit extends CompilationUnit {

    public HostBindingCompilationUnit(HostBindingCompilationJob job, XrefId xref) {
        super(job, xref);
    }
}
