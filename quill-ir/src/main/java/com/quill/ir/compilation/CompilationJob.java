package com.quill.ir.compilation;

import com.quill.ir.CompatibilityMode;
import com.quill.ir.XrefId;

import java.util.Collection;

/**
 * 一次模板编译任务。
 * 持有根单元及全部嵌套单元，生命周期等于一次编译调用。
 */
public abstract class CompilationJob {

    private final String componentName;
    private final CompatibilityMode compatibility;
    /** xref 分配器，只增不减 */
    private int nextXrefId = 0;

    protected CompilationJob(String componentName, CompatibilityMode compatibility) {
        this.componentName = componentName;
        this.compatibility = compatibility != null ? compatibility : CompatibilityMode.NORMAL;
    }

    public String getComponentName() { return componentName; }
    public CompatibilityMode getCompatibility() { return compatibility; }

    /**
     * 是否复现旧模板编译器的输出格式。
     */
    public boolean isCompatibilityMode() {
        return compatibility == CompatibilityMode.TEMPLATE_DEFINITION_BUILDER;
    }

    /**
     * 分配一个新的 xref，编译期内不会重复。
     */
    public XrefId allocateXrefId() {
        return new XrefId(nextXrefId++);
    }

    /**
     * 生成函数名后缀，拼在每个单元的基础名之后。
     */
    public abstract String getFnSuffix();

    public abstract CompilationUnit getRoot();

    /**
     * 任务内的全部单元，根单元在最前。
     */
    public abstract Collection<? extends CompilationUnit> getUnits();
}
