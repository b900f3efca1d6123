package org.csu.cpy.compiler.parser.ast.statement;

import org.csu.cpy.compiler.parser.ast.ExpressionNode;
import org.csu.cpy.compiler.parser.ast.StatementNode;

/**
 * AST 节点: 表示赋值语句 (e.g., x = x + 1;)
 */
public record AssignmentNode(
        String name,
        ExpressionNode value
) implements StatementNode {
}
