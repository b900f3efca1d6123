package org.csu.cpy.compiler.parser.ast;

/**
 * 语句节点，代码生成时输出带缩进、以换行结尾的若干行
 */
public interface StatementNode extends AstNode {
}
