package com.quill.ir.compilation;

import com.quill.ir.CompatibilityMode;

import java.util.Collection;
import java.util.Collections;

/**
 * 宿主绑定编译任务，只有一个根单元。
 */
public class HostBindingCompilationJob extends CompilationJob {

    private final HostBindingCompilationUnit root;

    public HostBindingCompilationJob(String componentName, CompatibilityMode compatibility) {
        super(componentName, compatibility);
        this.root = new HostBindingCompilationUnit(this, allocateXrefId());
    }

    @Override
    public String getFnSuffix() {
        return "HostBindings";
    }

    @Override
    public HostBindingCompilationUnit getRoot() {
        return root;
    }

    @Override
    public Collection<HostBindingCompilationUnit> getUnits() {
        return Collections.singletonList(root);
    }
}
