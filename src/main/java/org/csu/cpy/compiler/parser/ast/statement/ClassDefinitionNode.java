package org.csu.cpy.compiler.parser.ast.statement;

import org.csu.cpy.compiler.parser.ast.StatementNode;

import java.util.List;

/**
 * AST 节点: 表示只包含字段声明的类定义
 * e.g., class Point { int x; int y; };
 */
public record ClassDefinitionNode(
        String name,
        List<DeclarationNode> fields
) implements StatementNode {

    public ClassDefinitionNode {
        fields = List.copyOf(fields);
    }
}
