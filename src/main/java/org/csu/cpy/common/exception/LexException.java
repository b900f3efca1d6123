package org.csu.cpy.common.exception;

import lombok.Getter;

/**
 * @author hidyouth
 * @description: 词法分析阶段的异常，遇到任何规则都无法匹配的字符时抛出
 */
@Getter
public class LexException extends TranspileException {

    private final char character;
    private final int line;
    private final int column;

    public LexException(char character, int line, int column) {
        super(String.format("Lexical error at line %d, column %d: illegal character '%c'",
                line, column, character));
        this.character = character;
        this.line = line;
        this.column = column;
    }
}
