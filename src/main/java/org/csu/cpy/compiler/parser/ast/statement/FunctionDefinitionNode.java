package org.csu.cpy.compiler.parser.ast.statement;

import org.csu.cpy.compiler.parser.ast.BlockNode;
import org.csu.cpy.compiler.parser.ast.StatementNode;

import java.util.List;

/**
 * AST 节点: 表示函数定义 (e.g., int add(int a, int b) { return a + b; })
 * @param name   函数名
 * @param params 形参列表 (可以为空)
 * @param body   函数体
 */
public record FunctionDefinitionNode(
        String name,
        List<ParamNode> params,
        BlockNode body
) implements StatementNode {

    public FunctionDefinitionNode {
        params = List.copyOf(params);
    }
}
