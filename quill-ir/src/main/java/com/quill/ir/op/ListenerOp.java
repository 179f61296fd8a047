package com.quill.ir.op;

import com.quill.ir.XrefId;

import java.util.ArrayList;
import java.util.List;

/**
 * 事件监听器。
 * 宿主监听器（hostListener）没有目标槽位；普通监听器挂在目标元素的槽位上。
 * handlerOps 为监听函数体，其中声明的变量与所属视图一起命名。
 */
public class ListenerOp extends IrOp {

    private final XrefId target;
    private final SlotHandle targetSlot;
    /** 所属元素标签，可能带连字符（自定义元素）；宿主监听器为 null */
    private final String tag;
    private final boolean hostListener;
    private final boolean animationListener;
    /** 动画阶段，如 "start" / "done"；仅动画监听器使用 */
    private final String animationPhase;
    private final List<IrOp> handlerOps = new ArrayList<>();
    private String name;
    private String handlerFnName;

    public ListenerOp(XrefId target, SlotHandle targetSlot, String name, String tag,
                      boolean hostListener, boolean animationListener, String animationPhase) {
        super(OpKind.LISTENER);
        this.target = target;
        this.targetSlot = targetSlot;
        this.name = name;
        this.tag = tag;
        this.hostListener = hostListener;
        this.animationListener = animationListener;
        this.animationPhase = animationPhase;
    }

    /** 普通元素监听器 */
    public static ListenerOp element(XrefId target, SlotHandle targetSlot, String tag, String eventName) {
        return new ListenerOp(target, targetSlot, eventName, tag, false, false, null);
    }

    /** 宿主监听器 */
    public static ListenerOp host(XrefId target, String eventName) {
        return new ListenerOp(target, new SlotHandle(), eventName, null, true, false, null);
    }

    public XrefId getTarget() { return target; }
    public SlotHandle getTargetSlot() { return targetSlot; }
    public String getTag() { return tag; }
    public boolean isHostListener() { return hostListener; }
    public boolean isAnimationListener() { return animationListener; }
    public String getAnimationPhase() { return animationPhase; }
    public List<IrOp> getHandlerOps() { return handlerOps; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getHandlerFnName() { return handlerFnName; }
    public void setHandlerFnName(String handlerFnName) { this.handlerFnName = handlerFnName; }

    @Override
    public <R, C> R accept(OpVisitor<R, C> visitor, C context) {
        return visitor.visitListener(this, context);
    }

    @Override
    public String toString() {
        return "LISTENER " + name + (hostListener ? " (host)" : " " + targetSlot);
    }
}
