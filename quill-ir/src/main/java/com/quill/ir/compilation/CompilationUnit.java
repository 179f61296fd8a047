package com.quill.ir.compilation;

import com.quill.ir.XrefId;
import com.quill.ir.op.IrOp;
import com.quill.ir.op.ListenerOp;

import java.util.ArrayList;
import java.util.List;

/**
 * 编译单元：一组有序 op 加上一个生成函数名。
 * create 列表在首次渲染时执行，update 列表在每次变更检测时执行。
 */
public abstract class CompilationUnit {

    private final CompilationJob job;
    private final XrefId xref;
    private final List<IrOp> create = new ArrayList<>();
    private final List<IrOp> update = new ArrayList<>();
    /** 生成函数名，只写一次 */
    private String fnName;

    protected CompilationUnit(CompilationJob job, XrefId xref) {
        this.job = job;
        this.xref = xref;
    }

    public CompilationJob getJob() { return job; }
    public XrefId getXref() { return xref; }
    public List<IrOp> getCreate() { return create; }
    public List<IrOp> getUpdate() { return update; }
    public String getFnName() { return fnName; }

    public void setFnName(String fnName) {
        if (this.fnName != null && !this.fnName.equals(fnName)) {
            throw new IllegalStateException("Unit " + xref + " already named '" + this.fnName + "'");
        }
        this.fnName = fnName;
    }

    /**
     * 按执行顺序列出单元内全部 op：
     * 先 create（每个监听器之后紧跟其 handler op），再 update。
     */
    public List<IrOp> ops() {
        List<IrOp> all = new ArrayList<>(create.size() + update.size());
        for (IrOp op : create) {
            all.add(op);
            if (op instanceof ListenerOp) {
                all.addAll(((ListenerOp) op).getHandlerOps());
            }
        }
        all.addAll(update);
        return all;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + xref + (fnName != null ? " " + fnName : "") + ")";
    }
}
