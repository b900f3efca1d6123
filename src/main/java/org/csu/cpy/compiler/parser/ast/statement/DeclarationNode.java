package org.csu.cpy.compiler.parser.ast.statement;

import org.csu.cpy.compiler.lexer.Token;
import org.csu.cpy.compiler.parser.ast.ExpressionNode;
import org.csu.cpy.compiler.parser.ast.StatementNode;

/**
 * AST 节点: 表示变量声明 (e.g., int x = 5; / float y; )
 * 也用作类的字段声明
 * @param type        类型关键字 (INT 或 FLOAT)
 * @param name        变量名
 * @param initializer 初始值表达式 (可以为 null)
 */
public record DeclarationNode(
        Token type,
        String name,
        ExpressionNode initializer
) implements StatementNode {

    public boolean hasInitializer() {
        return initializer != null;
    }
}
