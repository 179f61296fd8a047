package com.quill.ir.debug;

import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.quill.ir.compilation.CompilationJob;
import com.quill.ir.compilation.CompilationUnit;
import com.quill.ir.compilation.ViewCompilationUnit;
import com.quill.ir.expr.ExpressionWalker;
import com.quill.ir.expr.ReadVariableExpr;
import com.quill.ir.op.*;

/**
 * 把编译任务导出为 JSON（调试用），只包含与命名相关的字段。
 */
public final class IrDumper {

    private IrDumper() {}

    public static JsonObject toJson(CompilationJob job) {
        JsonObject root = new JsonObject();
        root.addProperty("component", job.getComponentName());
        root.addProperty("compatibility", job.getCompatibility().name());
        root.addProperty("fnSuffix", job.getFnSuffix());

        JsonArray units = new JsonArray();
        for (CompilationUnit unit : job.getUnits()) {
            units.add(unitToJson(unit));
        }
        root.add("units", units);
        return root;
    }

    public static String toPrettyJson(CompilationJob job) {
        return new GsonBuilder().setPrettyPrinting().serializeNulls().create().toJson(toJson(job));
    }

    private static JsonObject unitToJson(CompilationUnit unit) {
        JsonObject u = new JsonObject();
        u.addProperty("xref", unit.getXref().getId());
        u.addProperty("fnName", unit.getFnName());
        if (unit instanceof ViewCompilationUnit) {
            ViewCompilationUnit view = (ViewCompilationUnit) unit;
            u.addProperty("parent", view.getParent() != null ? view.getParent().getId() : null);
        }
        JsonArray ops = new JsonArray();
        OpJsonWriter writer = new OpJsonWriter();
        for (IrOp op : unit.ops()) {
            JsonObject o = new JsonObject();
            o.addProperty("kind", op.getKind().name());
            op.accept(writer, o);
            JsonArray reads = new JsonArray();
            ExpressionWalker.visitExpressionsInOp(op, expr -> {
                if (expr instanceof ReadVariableExpr) {
                    reads.add(((ReadVariableExpr) expr).getName());
                }
            });
            if (reads.size() > 0) {
                o.add("reads", reads);
            }
            ops.add(o);
        }
        u.add("ops", ops);
        return u;
    }

    /**
     * 把各 op 的命名相关字段写入给定 JsonObject。
     */
    private static final class OpJsonWriter implements OpVisitor<Void, JsonObject> {

        @Override
        public Void visitElementStart(ElementStartOp op, JsonObject o) {
            o.addProperty("tag", op.getTag());
            o.addProperty("slot", op.getHandle().getSlot());
            return null;
        }

        @Override
        public Void visitElementEnd(ElementEndOp op, JsonObject o) { return null; }

        @Override
        public Void visitText(TextOp op, JsonObject o) {
            o.addProperty("slot", op.getHandle().getSlot());
            return null;
        }

        @Override
        public Void visitTemplate(TemplateOp op, JsonObject o) {
            o.addProperty("view", op.getXref().getId());
            o.addProperty("slot", op.getSlot().getSlot());
            return null;
        }

        @Override
        public Void visitRepeaterCreate(RepeaterCreateOp op, JsonObject o) {
            o.addProperty("view", op.getXref().getId());
            if (op.getEmptyView() != null) {
                o.addProperty("emptyView", op.getEmptyView().getId());
            }
            o.addProperty("slot", op.getSlot().getSlot());
            return null;
        }

        @Override
        public Void visitListener(ListenerOp op, JsonObject o) {
            o.addProperty("name", op.getName());
            o.addProperty("handlerFnName", op.getHandlerFnName());
            o.addProperty("host", op.isHostListener());
            return null;
        }

        @Override
        public Void visitVariable(VariableOp op, JsonObject o) {
            o.addProperty("xref", op.getXref().getId());
            o.addProperty("variableKind", op.getVariable().getKind().name());
            o.addProperty("name", op.getVariable().getName());
            return null;
        }

        @Override
        public Void visitStatement(StatementOp op, JsonObject o) { return null; }

        @Override
        public Void visitAdvance(AdvanceOp op, JsonObject o) {
            o.addProperty("delta", op.getDelta());
            return null;
        }

        @Override
        public Void visitProperty(PropertyOp op, JsonObject o) {
            o.addProperty("name", op.getName());
            return null;
        }

        @Override
        public Void visitHostProperty(HostPropertyOp op, JsonObject o) {
            o.addProperty("name", op.getName());
            return null;
        }

        @Override
        public Void visitStyleProp(StylePropOp op, JsonObject o) {
            o.addProperty("name", op.getName());
            return null;
        }

        @Override
        public Void visitClassProp(ClassPropOp op, JsonObject o) {
            o.addProperty("name", op.getName());
            return null;
        }

        @Override
        public Void visitInterpolateText(InterpolateTextOp op, JsonObject o) { return null; }
    }
}
