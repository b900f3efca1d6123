package org.csu.cpy.compiler.parser.ast;

import java.util.List;

/**
 * AST 节点: 一串顺序执行的语句 (程序顶层或 { ... } 内部)
 */
public record BlockNode(List<StatementNode> statements) implements AstNode {

    public BlockNode {
        statements = List.copyOf(statements);
    }
}
