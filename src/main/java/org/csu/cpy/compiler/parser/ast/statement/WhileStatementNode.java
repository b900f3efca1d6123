package org.csu.cpy.compiler.parser.ast.statement;

import org.csu.cpy.compiler.parser.ast.BlockNode;
import org.csu.cpy.compiler.parser.ast.ExpressionNode;
import org.csu.cpy.compiler.parser.ast.StatementNode;

/**
 * AST 节点: 表示 while 循环
 */
public record WhileStatementNode(
        ExpressionNode condition,
        BlockNode body
) implements StatementNode {
}
