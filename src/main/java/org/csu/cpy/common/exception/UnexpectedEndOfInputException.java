package org.csu.cpy.common.exception;

import org.csu.cpy.compiler.lexer.Token;

/**
 * 产生式尚未完成时输入已经结束
 */
public class UnexpectedEndOfInputException extends ParseException {

    public UnexpectedEndOfInputException(Token eof, String expected) {
        super(String.format("Syntax error at line %d: unexpected end of input, expected %s",
                eof.line(), expected), eof);
    }
}
