package com.quill.ir.pass.naming;

/**
 * 整个编译任务共享的变量命名计数器。
 * 显式传入递归调用，不做成全局状态；只增不减，保证变量名在任务内唯一。
 */
public class NamingState {

    private int index;

    public NamingState() {
        this(0);
    }

    public NamingState(int start) {
        this.index = start;
    }

    public int getIndex() { return index; }

    /** 先取值再自增 */
    int postIncrement() {
        return index++;
    }

    /** 先自增再取值 */
    int preIncrement() {
        return ++index;
    }
}
