package org.csu.cpy.common.exception;

/**
 * 代码生成阶段遇到了语法分析器不可能产生的节点，属于内部错误而不是用户输入错误
 */
public class CodeGenerationException extends TranspileException {

    public CodeGenerationException(String message) {
        super("Internal error: " + message);
    }
}
