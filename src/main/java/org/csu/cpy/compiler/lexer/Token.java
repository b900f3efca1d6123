package org.csu.cpy.compiler.lexer;

/**
 * @param type 词法单元的类型 (种别码)
 * @param lexeme 词法单元的原始文本 (词素值)
 * @param value 扫描时计算出的值: 整数为 BigInteger, 小数为 Double, 标识符/关键字/字符串为其文本, 标点为 null
 * @param line 所在的行号
 * @param column 所在的列号
 */
public record Token(TokenType type, String lexeme, Object value, int line, int column) {

    @Override
    public String toString() {
        // 重写toString方法，方便调试和打印
        return String.format("Token[Type=%-17s, Lexeme='%s', Position=%d:%d]",
                type, lexeme, line, column);
    }
}
