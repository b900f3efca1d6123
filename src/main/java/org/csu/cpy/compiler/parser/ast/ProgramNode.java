package org.csu.cpy.compiler.parser.ast;

import java.util.List;

/**
 * @author hidyouth
 * @description: AST 的根节点
 *
 * @param includes   程序开头的 #include 指令 (可以为空)
 * @param statements 顶层语句，至少一条
 */
public record ProgramNode(
        List<IncludeNode> includes,
        BlockNode statements
) implements AstNode {

    public ProgramNode {
        includes = List.copyOf(includes);
    }
}
