package org.csu.cpy.compiler.lexer;

/**
 * @author hidyouth
 * @description: 定义词法单元（Token）的类型，即“种别码”
 *
 * 这是源语言（C++ 子集）中所有可能出现的“单词”的分类。
 */
public enum TokenType {
    // ---- 关键字 (Keywords) ----
    INT,        // "int"
    FLOAT,      // "float"
    CLASS,      // "class"
    IF,         // "if"
    ELSE,       // "else"
    FOR,        // "for"
    WHILE,      // "while"
    RETURN,     // "return"
    COUT,       // "cout"
    ENDL,       // "endl"

    // 保留字，语法中没有对应的产生式
    INCLUDE,    // "include"
    STRING_TYPE,// "string"
    IOSTREAM,   // "iostream"
    NAMESPACE,  // "namespace"
    STD,        // "std"

    // ---- 标识符 (Identifier) ----
    IDENTIFIER, // 变量名、函数名、类名

    // ---- 常量 (Constants) ----
    NUMBER,     // 整数或小数, e.g., 42, 3.14
    STRING,     // 字符串常量, e.g., "hello"

    // ---- 预处理指令 ----
    INCLUDE_DIRECTIVE, // #include <iostream>, 整体作为一个 Token

    // ---- 运算符 (Operators) ----
    EQUAL,      // =
    PLUS,       // +
    MINUS,      // -
    ASTERISK,   // *
    SLASH,      // /
    LESS,       // <
    GREATER,    // >
    SHIFT_LEFT, // <<
    PLUS_PLUS,  // ++
    AND,        // &&
    OR,         // ||
    NOT,        // !
    ARROW,      // ->

    // ---- 分隔符 (Delimiters) ----
    LPAREN,     // (
    RPAREN,     // )
    LBRACE,     // {
    RBRACE,     // }
    LBRACKET,   // [
    RBRACKET,   // ]
    SEMICOLON,  // ;
    COMMA,      // ,
    COLON,      // :

    // ---- 特殊 Token ----
    EOF         // End-Of-File，表示输入流结束
}
