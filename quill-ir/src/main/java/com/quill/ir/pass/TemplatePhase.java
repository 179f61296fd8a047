package com.quill.ir.pass;

import com.quill.ir.compilation.CompilationJob;

/**
 * 模板 IR phase 接口。
 */
public interface TemplatePhase {

    /**
     * Phase 名称（用于日志/调试）。
     */
    String getName();

    /**
     * 对编译任务原地执行本 phase。
     */
    CompilationJob run(CompilationJob job);
}
