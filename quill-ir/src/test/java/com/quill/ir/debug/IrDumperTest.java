package com.quill.ir.debug;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.quill.ir.CompatibilityMode;
import com.quill.ir.compilation.ComponentCompilationJob;
import com.quill.ir.compilation.ViewCompilationUnit;
import com.quill.ir.expr.ReadVariableExpr;
import com.quill.ir.op.ListenerOp;
import com.quill.ir.op.PropertyOp;
import com.quill.ir.op.SlotHandle;
import com.quill.ir.op.TemplateOp;
import com.quill.ir.op.VariableOp;
import com.quill.ir.pass.naming.NamingPhase;
import com.quill.ir.variable.SemanticVariable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("IrDumper 测试")
class IrDumperTest {

    @Test
    @DisplayName("导出单元、函数名与变量读取")
    void testDumpNamedJob() {
        ComponentCompilationJob job = new ComponentCompilationJob("Comp", CompatibilityMode.TEMPLATE_DEFINITION_BUILDER);
        ViewCompilationUnit root = job.getRoot();
        ViewCompilationUnit child = job.allocateView(root.getXref());
        root.getCreate().add(new TemplateOp(child.getXref(), "ng-template", "", new SlotHandle(1)));
        root.getCreate().add(ListenerOp.element(job.allocateXrefId(), new SlotHandle(2), "div", "click"));
        VariableOp ctx = new VariableOp(job.allocateXrefId(), SemanticVariable.context(root.getXref()), null);
        root.getUpdate().add(ctx);
        root.getUpdate().add(new PropertyOp(job.allocateXrefId(), "id", new ReadVariableExpr(ctx.getXref()), false));
        new NamingPhase().run(job);

        JsonObject json = IrDumper.toJson(job);
        assertThat(json.get("component").getAsString()).isEqualTo("Comp");
        assertThat(json.get("compatibility").getAsString()).isEqualTo("TEMPLATE_DEFINITION_BUILDER");

        JsonArray units = json.getAsJsonArray("units");
        assertThat(units.size()).isEqualTo(2);
        JsonObject rootJson = units.get(0).getAsJsonObject();
        assertThat(rootJson.get("fnName").getAsString()).isEqualTo("Comp_Template");
        assertThat(rootJson.get("parent").isJsonNull()).isTrue();
        assertThat(units.get(1).getAsJsonObject().get("fnName").getAsString()).isEqualTo("Comp_1_Template");

        JsonArray ops = rootJson.getAsJsonArray("ops");
        assertThat(ops.size()).isEqualTo(4);
        assertThat(ops.get(1).getAsJsonObject().get("handlerFnName").getAsString())
                .isEqualTo("Comp_Template_div_click_2_listener");
        assertThat(ops.get(2).getAsJsonObject().get("name").getAsString()).isEqualTo("ctx_r0");
        assertThat(ops.get(3).getAsJsonObject().getAsJsonArray("reads").get(0).getAsString()).isEqualTo("ctx_r0");
    }

    @Test
    @DisplayName("未命名的 IR 以 null 导出")
    void testDumpUnnamedJob() {
        ComponentCompilationJob job = new ComponentCompilationJob("Comp", CompatibilityMode.NORMAL);
        assertThat(IrDumper.toPrettyJson(job)).contains("\"fnName\": null");
    }
}
