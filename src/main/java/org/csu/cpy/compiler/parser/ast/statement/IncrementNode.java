package org.csu.cpy.compiler.parser.ast.statement;

import org.csu.cpy.compiler.parser.ast.StatementNode;

/**
 * AST 节点: 表示后置自增语句 (e.g., i++;)
 */
public record IncrementNode(String name) implements StatementNode {
}
