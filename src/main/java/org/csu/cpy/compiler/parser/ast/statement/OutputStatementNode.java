package org.csu.cpy.compiler.parser.ast.statement;

import org.csu.cpy.compiler.parser.ast.ExpressionNode;
import org.csu.cpy.compiler.parser.ast.StatementNode;

import java.util.List;

/**
 * AST 节点: 表示 cout 输出语句
 * e.g., cout << x; / cout << "i = " << i << endl;
 * @param values  依次输出的表达式，一个或两个
 * @param endLine 语句末尾是否带 endl
 */
public record OutputStatementNode(
        List<ExpressionNode> values,
        boolean endLine
) implements StatementNode {

    public OutputStatementNode {
        values = List.copyOf(values);
    }
}
