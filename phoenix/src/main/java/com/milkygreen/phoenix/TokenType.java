package com.milkygreen.phoenix;

/**
 * Token类型
 */
public enum TokenType {

    // 空白，连续的空白字符合并成一个token
    WHITESPACE,

    // 数字字面量
    NUMBER,

    // 单字符 tokens.
    PLUS, MINUS, STAR, SLASH,
    LEFT_PAREN, RIGHT_PAREN,

    // 无法识别的字符
    BAD,

    EOF

}
