package com.quill.ir.pass.naming;

import com.quill.ir.variable.SemanticVariable;

/**
 * 语义变量命名规则。
 */
public final class VariableNameAllocator {

    private VariableNameAllocator() {}

    /**
     * 返回变量的最终名字；首次调用时分配并写回变量，之后直接返回已有名字，不再消耗计数器。
     * <ul>
     *   <li>CONTEXT：{@code ctx_r<n>}，取值后自增</li>
     *   <li>IDENTIFIER：{@code <identifier>_r<n>}，自增后取值</li>
     *   <li>其他：{@code _r<n>}，自增后取值</li>
     * </ul>
     * 两种自增顺序并存是为了和旧编译器的编号逐字节一致。
     */
    public static String getVariableName(SemanticVariable variable, NamingState state) {
        if (variable.getName() == null) {
            switch (variable.getKind()) {
                case CONTEXT:
                    variable.setName("ctx_r" + state.postIncrement());
                    break;
                case IDENTIFIER:
                    variable.setName(variable.getIdentifier() + "_r" + state.preIncrement());
                    break;
                default:
                    variable.setName("_r" + state.preIncrement());
                    break;
            }
        }
        return variable.getName();
    }
}
