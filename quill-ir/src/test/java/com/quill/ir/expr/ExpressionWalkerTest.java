package com.quill.ir.expr;

import com.quill.ir.XrefId;
import com.quill.ir.op.RepeaterCreateOp;
import com.quill.ir.op.SlotHandle;
import com.quill.ir.op.StatementOp;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ExpressionWalker 测试")
class ExpressionWalkerTest {

    @Test
    @DisplayName("父节点先于子节点，按子节点顺序访问")
    void testPreOrder() {
        ReadVariableExpr x = new ReadVariableExpr(new XrefId(1));
        LiteralExpr one = new LiteralExpr(1);
        ReadPropExpr fn = new ReadPropExpr(new ContextExpr(new XrefId(0)), "update");
        BinaryOperatorExpr sum = new BinaryOperatorExpr("+", x, one);
        InvokeFunctionExpr call = new InvokeFunctionExpr(fn, Arrays.asList(sum, new LexicalReadExpr("y")));

        List<IrExpr> visited = new ArrayList<>();
        ExpressionWalker.visitExpressionsInOp(new StatementOp(call, false), visited::add);

        assertThat(visited).hasSize(7);
        assertThat(visited.get(0)).isSameAs(call);
        assertThat(visited.get(1)).isSameAs(fn);
        assertThat(visited.get(2)).isInstanceOf(ContextExpr.class);
        assertThat(visited.get(3)).isSameAs(sum);
        assertThat(visited.get(4)).isSameAs(x);
        assertThat(visited.get(5)).isSameAs(one);
        assertThat(visited.get(6)).isInstanceOf(LexicalReadExpr.class);
    }

    @Test
    @DisplayName("没有表达式的 op 不触发访问")
    void testOpWithoutExpressions() {
        List<IrExpr> visited = new ArrayList<>();
        ExpressionWalker.visitExpressionsInOp(
                new RepeaterCreateOp(new XrefId(1), null, "For", new SlotHandle(0), null), visited::add);
        assertThat(visited).isEmpty();
    }
}
