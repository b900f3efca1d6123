package org.csu.cpy.compiler.parser.ast;

/**
 * AST 节点: 表示 #include &lt;header&gt;
 * @param directive 指令原文
 * @param header    尖括号中的头文件名
 */
public record IncludeNode(String directive, String header) implements AstNode {
}
