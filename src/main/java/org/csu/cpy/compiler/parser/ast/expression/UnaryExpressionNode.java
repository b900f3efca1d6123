package org.csu.cpy.compiler.parser.ast.expression;

import org.csu.cpy.compiler.lexer.Token;
import org.csu.cpy.compiler.parser.ast.ExpressionNode;

/**
 * AST 节点: 表示逻辑非 (e.g., !done)
 */
public record UnaryExpressionNode(
        Token operator,
        ExpressionNode operand
) implements ExpressionNode {
}
