package org.csu.cpy.compiler.parser.ast;

/**
 * 表达式节点，代码生成时输出不带缩进和换行的行内片段
 */
public interface ExpressionNode extends AstNode {
}
