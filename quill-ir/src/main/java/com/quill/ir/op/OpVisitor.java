package com.quill.ir.op;

/**
 * op 访问者接口，每个 op 子类一个 visit 方法。
 * 新增 op 种类时所有 phase 都必须显式处理，不会被静默跳过。
 *
 * @param <R> 返回类型
 * @param <C> 上下文类型
 */
public interface OpVisitor<R, C> {

    // ===== create (6) =====
    R visitElementStart(ElementStartOp op, C context);
    R visitElementEnd(ElementEndOp op, C context);
    R visitText(TextOp op, C context);
    R visitTemplate(TemplateOp op, C context);
    R visitRepeaterCreate(RepeaterCreateOp op, C context);
    R visitListener(ListenerOp op, C context);

    // ===== 通用 (2) =====
    R visitVariable(VariableOp op, C context);
    R visitStatement(StatementOp op, C context);

    // ===== update (6) =====
    R visitAdvance(AdvanceOp op, C context);
    R visitProperty(PropertyOp op, C context);
    R visitHostProperty(HostPropertyOp op, C context);
    R visitStyleProp(StylePropOp op, C context);
    R visitClassProp(ClassPropOp op, C context);
    R visitInterpolateText(InterpolateTextOp op, C context);
}
