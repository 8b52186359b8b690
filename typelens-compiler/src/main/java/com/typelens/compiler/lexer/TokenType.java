package com.typelens.compiler.lexer;

/**
 * TypeLens 词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    NUMBER_LITERAL,         // literal = 规范文本
    STRING_LITERAL,         // literal = 转义后的内容

    // === 标识符 ===
    IDENTIFIER,

    // === 关键词 ===
    KW_TYPE,
    KW_CONST,
    KW_ASSERT,
    KW_READONLY,
    KW_KEYOF,
    KW_NEW,
    KW_TRUE,
    KW_FALSE,
    KW_NULL,

    // === 分隔符 ===
    LPAREN,                 // (
    RPAREN,                 // )
    LBRACE,                 // {
    RBRACE,                 // }
    LBRACKET,               // [
    RBRACKET,               // ]
    LT,                     // <
    GT,                     // >
    COMMA,                  // ,
    SEMICOLON,              // ;
    COLON,                  // :
    QUESTION,               // ?
    DOT,                    // .
    ELLIPSIS,               // ...

    // === 运算符 ===
    ARROW,                  // =>
    PIPE,                   // |
    AMP,                    // &
    MINUS,                  // -
    ASSIGN,                 // =

    // === 特殊 ===
    EOF,
    ERROR;

    /**
     * 是否为关键词
     */
    public boolean isKeyword() {
        return name().startsWith("KW_");
    }

    /**
     * 是否可以作为声明的起始
     */
    public boolean isDeclarationKeyword() {
        switch (this) {
            case KW_TYPE:
            case KW_CONST:
            case KW_ASSERT:
                return true;
            default:
                return false;
        }
    }
}
