package org.csu.cpy.compiler.parser.ast.statement;

import org.csu.cpy.compiler.parser.ast.BlockNode;
import org.csu.cpy.compiler.parser.ast.ExpressionNode;
import org.csu.cpy.compiler.parser.ast.StatementNode;
import org.csu.cpy.compiler.parser.ast.expression.BinaryExpressionNode;

/**
 * @author hidyouth
 * @description: 表示固定形状的计数循环
 * for (int i = &lt;initializer&gt;; &lt;condition&gt;; i++) { ... }
 *
 * @param variable    循环变量名
 * @param initializer 循环变量的初值
 * @param condition   循环条件，顶层一定是比较运算
 * @param body        循环体
 */
public record ForStatementNode(
        String variable,
        ExpressionNode initializer,
        BinaryExpressionNode condition,
        BlockNode body
) implements StatementNode {
}
