package org.csu.cpy.compiler.lexer;

import org.csu.cpy.common.exception.LexException;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * @author hidyouth
 * @description: 词法分析器 (Lexer/Scanner)
 *
 * 负责将输入的 C++ 源码分解为一系列的Token。
 * 每个实例只对应一段输入，行号等扫描状态不会在两次调用之间共享。
 *
 * 已知限制: 块注释只有在同一行内闭合时才会被识别，
 * 跨行的 /* 会被当作除号和乘号处理。
 */
public class Lexer {

    private final String input;
    private int position = 0; // 当前读取的位置
    private int line = 1;     // 当前行号
    private int column = 1;   // 当前列号

    // 关键字映射表
    private static final Map<String, TokenType> keywords;

    static {
        keywords = new HashMap<>();
        keywords.put("int", TokenType.INT);
        keywords.put("float", TokenType.FLOAT);
        keywords.put("class", TokenType.CLASS);
        keywords.put("if", TokenType.IF);
        keywords.put("else", TokenType.ELSE);
        keywords.put("for", TokenType.FOR);
        keywords.put("while", TokenType.WHILE);
        keywords.put("return", TokenType.RETURN);
        keywords.put("cout", TokenType.COUT);
        keywords.put("endl", TokenType.ENDL);
        keywords.put("include", TokenType.INCLUDE);
        keywords.put("string", TokenType.STRING_TYPE);
        keywords.put("iostream", TokenType.IOSTREAM);
        keywords.put("namespace", TokenType.NAMESPACE);
        keywords.put("std", TokenType.STD);
    }

    public Lexer(String input) {
        this.input = input;
    }

    /**
     * 主方法，执行词法分析并返回所有Token
     * @return Token列表，最后一个总是 EOF
     * @throws LexException 遇到无法识别的字符
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return tokens;
    }

    private Token nextToken() {
        skipWhitespaceAndComments();

        if (position >= input.length()) {
            return new Token(TokenType.EOF, "", null, line, column);
        }

        char currentChar = peek();

        if (currentChar == '#') {
            return readIncludeDirective();
        }

        // 识别标识符或关键字
        if (isLetter(currentChar)) {
            return readIdentifierOrKeyword();
        }

        // 识别数字
        if (isDigit(currentChar)) {
            return readNumber();
        }

        // 识别字符串
        if (currentChar == '"') {
            return readString();
        }

        // 识别运算符和分隔符
        switch (currentChar) {
            case '(':
                return consumeAndReturn(TokenType.LPAREN, "(");
            case ')':
                return consumeAndReturn(TokenType.RPAREN, ")");
            case '{':
                return consumeAndReturn(TokenType.LBRACE, "{");
            case '}':
                return consumeAndReturn(TokenType.RBRACE, "}");
            case '[':
                return consumeAndReturn(TokenType.LBRACKET, "[");
            case ']':
                return consumeAndReturn(TokenType.RBRACKET, "]");
            case ';':
                return consumeAndReturn(TokenType.SEMICOLON, ";");
            case ',':
                return consumeAndReturn(TokenType.COMMA, ",");
            case ':':
                return consumeAndReturn(TokenType.COLON, ":");
            case '=':
                return consumeAndReturn(TokenType.EQUAL, "=");
            case '*':
                return consumeAndReturn(TokenType.ASTERISK, "*");
            case '/':
                return consumeAndReturn(TokenType.SLASH, "/");
            case '>':
                return consumeAndReturn(TokenType.GREATER, ">");
            case '!':
                return consumeAndReturn(TokenType.NOT, "!");
            case '+':
                if (peekNext() == '+') {
                    return consumeTwoAndReturn(TokenType.PLUS_PLUS, "++");
                }
                return consumeAndReturn(TokenType.PLUS, "+");
            case '-':
                if (peekNext() == '>') {
                    return consumeTwoAndReturn(TokenType.ARROW, "->");
                }
                return consumeAndReturn(TokenType.MINUS, "-");
            case '<':
                if (peekNext() == '<') {
                    return consumeTwoAndReturn(TokenType.SHIFT_LEFT, "<<");
                }
                return consumeAndReturn(TokenType.LESS, "<");
            case '&':
                if (peekNext() == '&') {
                    return consumeTwoAndReturn(TokenType.AND, "&&");
                }
                throw new LexException(currentChar, line, column);
            case '|':
                if (peekNext() == '|') {
                    return consumeTwoAndReturn(TokenType.OR, "||");
                }
                throw new LexException(currentChar, line, column);
            default:
                throw new LexException(currentChar, line, column);
        }
    }

    /**
     * #include &lt;name&gt; 作为一个不可分割的 Token，中间只允许空格和制表符
     */
    private Token readIncludeDirective() {
        int startPos = position;
        int startCol = column;
        int cursor = position + 1;
        if (!input.startsWith("include", cursor)) {
            throw new LexException('#', line, startCol);
        }
        cursor += "include".length();
        while (cursor < input.length() && (input.charAt(cursor) == ' ' || input.charAt(cursor) == '\t')) {
            cursor++;
        }
        if (cursor >= input.length() || input.charAt(cursor) != '<') {
            throw new LexException('#', line, startCol);
        }
        cursor++;
        int nameStart = cursor;
        while (cursor < input.length() && isLetterOrDigit(input.charAt(cursor))) {
            cursor++;
        }
        if (cursor == nameStart || cursor >= input.length() || input.charAt(cursor) != '>') {
            throw new LexException('#', line, startCol);
        }
        String header = input.substring(nameStart, cursor);
        cursor++;
        while (position < cursor) {
            advance();
        }
        return new Token(TokenType.INCLUDE_DIRECTIVE, input.substring(startPos, position), header, line, startCol);
    }

    private Token readIdentifierOrKeyword() {
        int startPos = position;
        int startCol = column;
        while (position < input.length() && isLetterOrDigit(peek())) {
            advance();
        }
        String text = input.substring(startPos, position);
        // 关键字区分大小写，精确匹配
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
        return new Token(type, text, text, line, startCol);
    }

    private Token readNumber() {
        int startPos = position;
        int startCol = column;
        while (position < input.length() && isDigit(peek())) {
            advance();
        }

        // 小数点后必须还有数字，否则 '.' 留给下一轮（并因无法识别而报错）
        if (position < input.length() && peek() == '.' && isDigit(peekNext())) {
            advance(); // 消耗掉 '.'
            while (position < input.length() && isDigit(peek())) {
                advance();
            }
            String number = input.substring(startPos, position);
            return new Token(TokenType.NUMBER, number, Double.valueOf(number), line, startCol);
        }
        String number = input.substring(startPos, position);
        return new Token(TokenType.NUMBER, number, new BigInteger(number), line, startCol);
    }

    private Token readString() {
        int startPos = position;
        int startCol = column;
        advance(); // 跳过起始的双引号
        while (position < input.length() && peek() != '"' && peek() != '\n') {
            advance();
        }
        if (position >= input.length() || peek() != '"') {
            // 未闭合的字符串，报告起始的引号
            throw new LexException('"', line, startCol);
        }
        advance(); // 跳过结束的双引号
        // 不处理转义，保留引号原样输出
        String text = input.substring(startPos, position);
        return new Token(TokenType.STRING, text, text, line, startCol);
    }

    // --- 辅助方法 ---

    private void skipWhitespaceAndComments() {
        while (position < input.length()) {
            char ch = peek();
            if (ch == ' ' || ch == '\t' || ch == '\r') {
                advance();
            } else if (ch == '\n') {
                line++;
                column = 0; // advance会加1，所以这里设为0
                advance();
            } else if (ch == '/' && peekNext() == '/') {
                while (position < input.length() && peek() != '\n') {
                    advance();
                }
            } else if (ch == '/' && peekNext() == '*' && closesOnSameLine()) {
                int end = input.indexOf("*/", position + 2) + 2;
                while (position < end) {
                    advance();
                }
            } else {
                break;
            }
        }
    }

    private boolean closesOnSameLine() {
        int close = input.indexOf("*/", position + 2);
        if (close < 0) {
            return false;
        }
        int newline = input.indexOf('\n', position);
        return newline < 0 || close < newline;
    }

    private char peek() {
        if (position >= input.length()) return '\0'; // 文件结束符
        return input.charAt(position);
    }

    private char peekNext() {
        if (position + 1 >= input.length()) return '\0';
        return input.charAt(position + 1);
    }

    private void advance() {
        position++;
        column++;
    }

    private Token consumeAndReturn(TokenType type, String lexeme) {
        Token token = new Token(type, lexeme, null, line, column);
        advance();
        return token;
    }

    private Token consumeTwoAndReturn(TokenType type, String lexeme) {
        Token token = new Token(type, lexeme, null, line, column);
        advance();
        advance();
        return token;
    }

    private boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isLetterOrDigit(char c) {
        return isLetter(c) || isDigit(c);
    }
}
