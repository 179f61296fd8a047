package com.quill.ir.op;

/**
 * 运行时槽位句柄，由上游槽位分配阶段填写。
 * 视图占用槽位 s 时，s 存放元数据，s+1 为主内容，repeater 的空状态内容在 s+2。
 */
public class SlotHandle {

    private Integer slot;

    public SlotHandle() {
    }

    public SlotHandle(int slot) {
        this.slot = slot;
    }

    public Integer getSlot() { return slot; }
    public void setSlot(Integer slot) { this.slot = slot; }

    public boolean isAssigned() {
        return slot != null;
    }

    @Override
    public String toString() {
        return slot == null ? "slot(?)" : "slot(" + slot + ")";
    }
}
