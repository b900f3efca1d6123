package org.csu.cpy.compiler.parser.ast.expression;

import org.csu.cpy.compiler.parser.ast.ExpressionNode;
import org.csu.cpy.compiler.lexer.Token;

/**
 * AST 节点: 表示一个基本表达式 (数字、标识符或字符串)
 */
public record LiteralNode(Token literal) implements ExpressionNode {
}
