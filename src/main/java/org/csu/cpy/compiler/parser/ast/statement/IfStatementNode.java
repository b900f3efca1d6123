package org.csu.cpy.compiler.parser.ast.statement;

import org.csu.cpy.compiler.parser.ast.BlockNode;
import org.csu.cpy.compiler.parser.ast.ExpressionNode;
import org.csu.cpy.compiler.parser.ast.StatementNode;

/**
 * AST 节点: 表示 if / if-else 语句
 * @param condition 条件表达式
 * @param thenBlock 条件成立时执行的语句块
 * @param elseBlock else 分支 (可以为 null)
 */
public record IfStatementNode(
        ExpressionNode condition,
        BlockNode thenBlock,
        BlockNode elseBlock
) implements StatementNode {

    public boolean hasElse() {
        return elseBlock != null;
    }
}
