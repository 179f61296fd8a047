package com.quill.ir.pass.naming;

import com.quill.ir.XrefId;

/**
 * 命名阶段的内部一致性错误。
 * 这些错误都说明上游管线产出了不完整或乱序的 IR，不是用户输入错误，不可恢复。
 */
public class NamingException extends RuntimeException {

    /**
     * 违反的约束种类。
     */
    public enum Reason {
        /** 需要槽位的 op 还没有分配槽位 */
        SLOT_NOT_ASSIGNED,
        /** 模板/repeater/元素监听器出现在非视图单元中 */
        NOT_A_VIEW,
        /** 读取了本单元从未声明的变量 */
        UNDECLARED_VARIABLE,
        /** op 引用的子视图不在任务的视图表中 */
        VIEW_NOT_FOUND
    }

    private final Reason reason;
    private final XrefId xref;

    public NamingException(Reason reason, String message, XrefId xref) {
        super(message);
        this.reason = reason;
        this.xref = xref;
    }

    public Reason getReason() {
        return reason;
    }

    public XrefId getXref() {
        return xref;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(reason).append("] ").append(super.getMessage());
        if (xref != null) {
            sb.append(" (").append(xref).append(')');
        }
        return sb.toString();
    }
}
