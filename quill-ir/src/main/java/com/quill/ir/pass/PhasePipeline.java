package com.quill.ir.pass;

import com.quill.ir.compilation.CompilationJob;
import com.quill.ir.debug.IrDumper;
import com.quill.ir.pass.naming.NamingPhase;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 模板 IR phase 管线。
 * 按顺序对同一个编译任务执行各 phase，任何 phase 抛出的错误都中止整个编译。
 */
public class PhasePipeline {

    private static final Logger LOG = Logger.getLogger(PhasePipeline.class.getName());

    private final List<TemplatePhase> phases = new ArrayList<>();
    /** IR dump（设置 QUILL_DUMP_IR=1 环境变量启用） */
    private boolean dumpIr = "1".equals(System.getenv("QUILL_DUMP_IR"));
    private PrintStream dumpOut = System.err;

    public PhasePipeline() {
    }

    /**
     * 创建默认管线。
     * 槽位分配、常量池等 phase 在命名之前由上游管线完成。
     */
    public static PhasePipeline createDefault() {
        PhasePipeline pipeline = new PhasePipeline();
        pipeline.addPhase(new NamingPhase());
        return pipeline;
    }

    public void addPhase(TemplatePhase phase) {
        phases.add(phase);
    }

    public List<TemplatePhase> getPhases() { return phases; }

    public boolean isDumpIr() { return dumpIr; }

    public void setDumpIr(boolean dumpIr) {
        this.dumpIr = dumpIr;
    }

    public void setDumpOut(PrintStream dumpOut) {
        this.dumpOut = dumpOut;
    }

    /**
     * 依次执行全部 phase。
     *
     * @param job 编译任务，原地修改
     * @return 同一个编译任务
     */
    public CompilationJob execute(CompilationJob job) {
        for (TemplatePhase phase : phases) {
            LOG.fine(() -> "phase " + phase.getName() + " on " + job.getComponentName());
            try {
                phase.run(job);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Phase " + phase.getName() + " failed for " + job.getComponentName(), e);
                throw e;
            }
        }

        if (dumpIr) {
            dumpOut.println("===== IR DUMP =====");
            dumpOut.println(IrDumper.toPrettyJson(job));
            dumpOut.println("===== END IR DUMP =====");
        }
        return job;
    }
}
