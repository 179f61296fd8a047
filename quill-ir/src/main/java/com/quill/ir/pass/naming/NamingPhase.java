package com.quill.ir.pass.naming;

import com.quill.compiler.util.ParseUtil;
import com.quill.ir.XrefId;
import com.quill.ir.compilation.CompilationJob;
import com.quill.ir.compilation.CompilationUnit;
import com.quill.ir.compilation.ViewCompilationUnit;
import com.quill.ir.op.*;
import com.quill.ir.pass.TemplatePhase;

import java.util.HashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 为所有视图生成函数名与变量名。
 * <p>
 * 从根单元开始深度优先：先扫描单元内 op，给监听器、变量、样式/类属性命名，
 * 遇到模板/repeater 按槽位偏移递归子视图；扫描完成后再把变量名回填到本单元的读取表达式。
 * 已有的名字一律不覆盖，重复执行结果不变。
 */
public class NamingPhase implements TemplatePhase, OpVisitor<Void, NamingPhase.UnitScope> {

    private static final Logger LOG = Logger.getLogger(NamingPhase.class.getName());

    @Override
    public String getName() {
        return "Naming";
    }

    @Override
    public CompilationJob run(CompilationJob job) {
        addNamesToUnit(job.getRoot(), job.getComponentName(), new NamingState(), job.isCompatibilityMode());
        return job;
    }

    /**
     * 命名单个单元并递归其子视图。
     *
     * @param unit          当前单元
     * @param baseName      当前单元的基础名（子视图在其上追加后缀与槽位）
     * @param state         整个任务共享的计数器
     * @param compatibility 是否兼容旧编译器输出
     */
    void addNamesToUnit(CompilationUnit unit, String baseName, NamingState state, boolean compatibility) {
        if (unit.getFnName() == null) {
            unit.setFnName(ParseUtil.sanitizeIdentifier(baseName + "_" + unit.getJob().getFnSuffix()));
        }
        if (LOG.isLoggable(Level.FINER)) {
            LOG.finer("naming " + unit.getXref() + " as " + unit.getFnName());
        }

        // 第一遍：命名本单元声明的一切，变量名先记在本地表里
        UnitScope scope = new UnitScope(unit, baseName, state, compatibility);
        for (IrOp op : unit.ops()) {
            op.accept(this, scope);
        }

        // 第二遍：变量全部命名后再回填读取点
        VariableNameBackfill.backfill(unit, scope.varNames);
    }

    /**
     * 单个单元的命名上下文。
     */
    static final class UnitScope {
        final CompilationUnit unit;
        final String baseName;
        final NamingState state;
        final boolean compatibility;
        /** xref → 已分配变量名，供回填使用 */
        final Map<XrefId, String> varNames = new HashMap<>();

        UnitScope(CompilationUnit unit, String baseName, NamingState state, boolean compatibility) {
            this.unit = unit;
            this.baseName = baseName;
            this.state = state;
            this.compatibility = compatibility;
        }
    }

    // ===== 需要命名的 op =====

    @Override
    public Void visitProperty(PropertyOp op, UnitScope scope) {
        if (op.isAnimationTrigger()) {
            op.setName(animationTriggerName(op.getName()));
        }
        return null;
    }

    @Override
    public Void visitHostProperty(HostPropertyOp op, UnitScope scope) {
        if (op.isAnimationTrigger()) {
            op.setName(animationTriggerName(op.getName()));
        }
        return null;
    }

    @Override
    public Void visitListener(ListenerOp op, UnitScope scope) {
        if (op.getHandlerFnName() != null) {
            return null;
        }
        if (!op.isHostListener()) {
            if (!op.getTargetSlot().isAssigned()) {
                throw new NamingException(NamingException.Reason.SLOT_NOT_ASSIGNED,
                        "Expected a slot to be assigned for listener '" + op.getName() + "'", op.getTarget());
            }
            requireView(scope, op, op.getTarget());
        }

        String animation = "";
        if (op.isAnimationListener()) {
            op.setName("@" + op.getName() + "." + op.getAnimationPhase());
            animation = "animation";
        }

        String handlerFnName;
        if (op.isHostListener()) {
            handlerFnName = scope.baseName + "_" + animation + op.getName() + "_HostBindingHandler";
        } else {
            // 自定义元素标签可能带连字符
            String tag = op.getTag() != null ? op.getTag().replace('-', '_') : "";
            handlerFnName = scope.unit.getFnName() + "_" + tag + "_" + animation + op.getName()
                    + "_" + op.getTargetSlot().getSlot() + "_listener";
        }
        op.setHandlerFnName(ParseUtil.sanitizeIdentifier(handlerFnName));
        return null;
    }

    @Override
    public Void visitVariable(VariableOp op, UnitScope scope) {
        scope.varNames.put(op.getXref(), VariableNameAllocator.getVariableName(op.getVariable(), scope.state));
        return null;
    }

    @Override
    public Void visitTemplate(TemplateOp op, UnitScope scope) {
        requireView(scope, op, op.getXref());
        int slot = requireSlot(op.getSlot(), op, op.getXref());
        ViewCompilationUnit childView = lookupView(scope, op.getXref());
        String suffix = op.getFunctionNameSuffix().isEmpty() ? "" : "_" + op.getFunctionNameSuffix();
        addNamesToUnit(childView, scope.baseName + suffix + "_" + slot, scope.state, scope.compatibility);
        return null;
    }

    @Override
    public Void visitRepeaterCreate(RepeaterCreateOp op, UnitScope scope) {
        requireView(scope, op, op.getXref());
        int slot = requireSlot(op.getSlot(), op, op.getXref());
        if (op.getEmptyView() != null) {
            ViewCompilationUnit emptyView = lookupView(scope, op.getEmptyView());
            // 空状态视图函数位于 slot + 2（首个槽位存放元数据）
            addNamesToUnit(emptyView, scope.baseName + "_" + op.getFunctionNameSuffix() + "Empty_" + (slot + 2),
                    scope.state, scope.compatibility);
        }
        // 主视图函数位于 slot + 1
        addNamesToUnit(lookupView(scope, op.getXref()),
                scope.baseName + "_" + op.getFunctionNameSuffix() + "_" + (slot + 1),
                scope.state, scope.compatibility);
        return null;
    }

    @Override
    public Void visitStyleProp(StylePropOp op, UnitScope scope) {
        String name = StylePropNormalizer.normalizeStylePropName(op.getName());
        op.setName(StylePropNormalizer.stripImportant(name, scope.compatibility));
        return null;
    }

    @Override
    public Void visitClassProp(ClassPropOp op, UnitScope scope) {
        op.setName(StylePropNormalizer.stripImportant(op.getName(), scope.compatibility));
        return null;
    }

    // ===== 与命名无关的 op =====

    @Override
    public Void visitElementStart(ElementStartOp op, UnitScope scope) { return null; }

    @Override
    public Void visitElementEnd(ElementEndOp op, UnitScope scope) { return null; }

    @Override
    public Void visitText(TextOp op, UnitScope scope) { return null; }

    @Override
    public Void visitStatement(StatementOp op, UnitScope scope) { return null; }

    @Override
    public Void visitAdvance(AdvanceOp op, UnitScope scope) { return null; }

    @Override
    public Void visitInterpolateText(InterpolateTextOp op, UnitScope scope) { return null; }

    // ===== 辅助 =====

    private static String animationTriggerName(String name) {
        return name.startsWith("@") ? name : "@" + name;
    }

    /**
     * 只有视图单元才能声明模板与元素监听器。
     */
    private static void requireView(UnitScope scope, IrOp op, XrefId xref) {
        if (!(scope.unit instanceof ViewCompilationUnit)) {
            throw new NamingException(NamingException.Reason.NOT_A_VIEW,
                    "AssertionError: " + op.getKind() + " must be compiled inside a component view, found "
                            + scope.unit, xref);
        }
    }

    private static int requireSlot(SlotHandle handle, IrOp op, XrefId xref) {
        if (!handle.isAssigned()) {
            throw new NamingException(NamingException.Reason.SLOT_NOT_ASSIGNED,
                    "Expected slot to be assigned for " + op.getKind(), xref);
        }
        return handle.getSlot();
    }

    private static ViewCompilationUnit lookupView(UnitScope scope, XrefId xref) {
        ViewCompilationUnit view = ((ViewCompilationUnit) scope.unit).getJob().getViews().get(xref);
        if (view == null) {
            throw new NamingException(NamingException.Reason.VIEW_NOT_FOUND,
                    "No view registered for " + xref, xref);
        }
        return view;
    }
}
