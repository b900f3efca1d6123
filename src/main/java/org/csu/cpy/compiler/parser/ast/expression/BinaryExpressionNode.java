package org.csu.cpy.compiler.parser.ast.expression;

import org.csu.cpy.compiler.lexer.Token;
import org.csu.cpy.compiler.parser.ast.ExpressionNode;

/**
 * AST 节点: 表示一个二元运算表达式 (e.g., x < 10, a && b)
 */
public record BinaryExpressionNode(
        ExpressionNode left,
        Token operator,
        ExpressionNode right
) implements ExpressionNode {
}
