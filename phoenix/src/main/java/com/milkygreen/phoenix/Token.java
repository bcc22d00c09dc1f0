package com.milkygreen.phoenix;

/**
 * 词法单元，创建后不可修改
 */
public final class Token {

    // token类型
    final TokenType type;
    // 词素，BAD 和 EOF 为空串
    final String lexeme;
    // 字面值，只有 NUMBER 有，是一个 NumberLiteral
    final Object literal;
    // 在源代码中的起始位置（char下标）
    final int offset;
    // 覆盖的源代码字符数
    final int length;

    Token(TokenType type, String lexeme, Object literal, int offset, int length) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.offset = offset;
        this.length = length;
    }

    /**
     * 构造一个不对应任何源代码的 EOF token
     */
    static Token eof(int offset) {
        return new Token(TokenType.EOF, "", null, offset, 0);
    }

    /**
     * NUMBER 类型token的字面值
     *
     * @return
     * @throws IllegalStateException 不是 NUMBER 类型时
     */
    public NumberLiteral number() {
        if (type != TokenType.NUMBER) {
            throw new IllegalStateException("Not a number token: " + this);
        }
        return (NumberLiteral) literal;
    }

    public String toString() {
        if (literal == null) {
            return type + " '" + lexeme + "' @" + offset;
        }
        return type + " '" + lexeme + "' " + literal + " @" + offset;
    }

}
