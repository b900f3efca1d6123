package org.csu.cpy.common.exception;

import lombok.Getter;
import org.csu.cpy.compiler.lexer.Token;

/**
 * @author hidyouth
 */
public class ParseException extends TranspileException {

    @Getter
    private final Token token;

    public ParseException(Token token, String expected) {
        super(String.format("Syntax error at line %d, column %d: expected %s, but found '%s' (%s)",
                token.line(),
                token.column(),
                expected,
                token.lexeme(),
                token.type()));
        this.token = token;
    }

    protected ParseException(String message, Token token) {
        super(message);
        this.token = token;
    }
}
