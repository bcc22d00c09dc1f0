package com.milkygreen.phoenix;

/**
 * 语法错误，token序列不符合 ( number operator number ) 的形式
 */
public class SyntaxError extends RuntimeException {

    /**
     * 错误分类
     */
    public enum Kind {
        MISSING_OPEN_PAREN,
        MISSING_LEFT_OPERAND,
        INVALID_NUMBER,
        INVALID_OPERATOR,
        MISSING_RIGHT_OPERAND,
        MISSING_CLOSE_PAREN
    }

    final Kind kind;
    // 出错位置的token，可能是合成的 EOF
    final Token token;

    SyntaxError(Kind kind, Token token, String message) {
        super(message);
        this.kind = kind;
        this.token = token;
    }

}
