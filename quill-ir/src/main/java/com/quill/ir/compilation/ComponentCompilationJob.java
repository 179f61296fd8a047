package com.quill.ir.compilation;

import com.quill.ir.CompatibilityMode;
import com.quill.ir.XrefId;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 组件模板编译任务。
 * 所有视图以 xref 为键登记在 views 中，父子关系通过 op 里的 xref 引用表达。
 */
public class ComponentCompilationJob extends CompilationJob {

    private final Map<XrefId, ViewCompilationUnit> views = new LinkedHashMap<>();
    private final ViewCompilationUnit root;

    public ComponentCompilationJob(String componentName, CompatibilityMode compatibility) {
        super(componentName, compatibility);
        this.root = new ViewCompilationUnit(this, allocateXrefId(), null);
        views.put(root.getXref(), root);
    }

    @Override
    public String getFnSuffix() {
        return "Template";
    }

    @Override
    public ViewCompilationUnit getRoot() {
        return root;
    }

    /**
     * 新建并登记一个嵌入视图。
     */
    public ViewCompilationUnit allocateView(XrefId parent) {
        ViewCompilationUnit view = new ViewCompilationUnit(this, allocateXrefId(), parent);
        views.put(view.getXref(), view);
        return view;
    }

    public Map<XrefId, ViewCompilationUnit> getViews() {
        return Collections.unmodifiableMap(views);
    }

    @Override
    public Collection<ViewCompilationUnit> getUnits() {
        return Collections.unmodifiableCollection(views.values());
    }
}
