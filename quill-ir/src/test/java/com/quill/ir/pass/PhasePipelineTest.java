package com.quill.ir.pass;

import com.quill.ir.CompatibilityMode;
import com.quill.ir.compilation.CompilationJob;
import com.quill.ir.compilation.ComponentCompilationJob;
import com.quill.ir.op.ListenerOp;
import com.quill.ir.op.SlotHandle;
import com.quill.ir.pass.naming.NamingException;
import com.quill.ir.pass.naming.NamingPhase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PhasePipeline 测试")
class PhasePipelineTest {

    @Test
    @DisplayName("默认管线只包含命名 phase")
    void testDefaultPipeline() {
        PhasePipeline pipeline = PhasePipeline.createDefault();
        assertThat(pipeline.getPhases()).hasSize(1);
        assertThat(pipeline.getPhases().get(0)).isInstanceOf(NamingPhase.class);
        assertThat(pipeline.getPhases().get(0).getName()).isEqualTo("Naming");
    }

    @Test
    @DisplayName("按添加顺序执行 phase")
    void testPhaseOrder() {
        List<String> trace = new ArrayList<>();
        PhasePipeline pipeline = new PhasePipeline();
        pipeline.setDumpIr(false);
        pipeline.addPhase(recording("first", trace));
        pipeline.addPhase(recording("second", trace));
        ComponentCompilationJob job = new ComponentCompilationJob("Comp", CompatibilityMode.NORMAL);
        assertThat(pipeline.execute(job)).isSameAs(job);
        assertThat(trace).containsExactly("first", "second");
    }

    @Test
    @DisplayName("phase 失败时中止并原样抛出")
    void testFailureAborts() {
        List<String> trace = new ArrayList<>();
        PhasePipeline pipeline = PhasePipeline.createDefault();
        pipeline.setDumpIr(false);
        pipeline.addPhase(recording("after", trace));
        ComponentCompilationJob job = new ComponentCompilationJob("Comp", CompatibilityMode.NORMAL);
        job.getRoot().getCreate().add(ListenerOp.element(job.allocateXrefId(), new SlotHandle(), "div", "click"));

        assertThatThrownBy(() -> pipeline.execute(job))
                .isInstanceOf(NamingException.class)
                .hasMessageStartingWith("[SLOT_NOT_ASSIGNED]");
        assertThat(trace).isEmpty();
    }

    @Test
    @DisplayName("开启 dump 后输出命名后的 IR")
    void testDumpIr() {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        PhasePipeline pipeline = PhasePipeline.createDefault();
        pipeline.setDumpIr(true);
        pipeline.setDumpOut(new PrintStream(baos, true, StandardCharsets.UTF_8));
        pipeline.execute(new ComponentCompilationJob("Comp", CompatibilityMode.NORMAL));

        String out = baos.toString(StandardCharsets.UTF_8);
        assertThat(out).contains("===== IR DUMP =====")
                .contains("\"fnName\": \"Comp_Template\"")
                .contains("===== END IR DUMP =====");
    }

    private static TemplatePhase recording(String name, List<String> trace) {
        return new TemplatePhase() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public CompilationJob run(CompilationJob job) {
                trace.add(name);
                return job;
            }
        };
    }
}
