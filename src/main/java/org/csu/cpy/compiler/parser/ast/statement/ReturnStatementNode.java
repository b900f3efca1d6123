package org.csu.cpy.compiler.parser.ast.statement;

import org.csu.cpy.compiler.parser.ast.ExpressionNode;
import org.csu.cpy.compiler.parser.ast.StatementNode;

/**
 * AST 节点: 表示 return 语句
 */
public record ReturnStatementNode(ExpressionNode value) implements StatementNode {
}
