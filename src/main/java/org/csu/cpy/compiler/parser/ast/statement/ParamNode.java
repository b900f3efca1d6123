package org.csu.cpy.compiler.parser.ast.statement;

import org.csu.cpy.compiler.parser.ast.AstNode;

/**
 * 函数的形参，只支持 int 类型，因此只保留名字
 */
public record ParamNode(String name) implements AstNode {
}
