package com.roadmanlang.compiler.lexer;

/**
 * Roadman 词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    NUMBER_LITERAL,
    STRING_LITERAL,

    // === 标识符 ===
    IDENTIFIER,

    // === 关键词 - 声明 ===
    KW_GIMME,               // 可变变量
    KW_CONSTE,              // 常量
    KW_FAM,                 // 函数

    // === 关键词 - 控制流 ===
    KW_INNIT,               // if
    KW_ELSEWAY,             // else
    KW_LOOPZ,               // while
    KW_STOPIT,              // break
    KW_RETURNZ,             // return
    KW_SWITCHUP, KW_CASEZ, KW_DEFEND,

    // === 关键词 - 字面量 ===
    KW_TRUE, KW_FALSE,

    // === 关键词 - 类型名（保留，不做类型检查） ===
    KW_DIGIT, KW_WORD, KW_BOOLA, KW_LISTZ, KW_MAPZ,

    // === 运算符 ===
    PLUS,                   // +
    MINUS,                  // -
    MUL,                    // *
    DIV,                    // /
    MOD,                    // %

    EQ,                     // ==
    NE,                     // !=
    LT,                     // <
    GT,                     // >
    LE,                     // <=
    GE,                     // >=

    AND,                    // &&
    OR,                     // ||
    NOT,                    // !

    ASSIGN,                 // =

    // === 分隔符 ===
    LPAREN,                 // (
    RPAREN,                 // )
    LBRACE,                 // {
    RBRACE,                 // }
    LBRACKET,               // [
    RBRACKET,               // ]
    COMMA,                  // ,
    DOT,                    // .
    COLON,                  // :
    SEMICOLON,              // ;

    // === 特殊 ===
    EOF
}
