package com.milkygreen.phoenix;

/**
 * 二元表达式支持的操作符
 */
public enum Operator {
    PLUS("+"),
    MINUS("-"),
    STAR("*"),
    SLASH("/");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * 根据token类型找到对应的操作符
     *
     * @param type token类型
     * @return 不是操作符时返回null
     */
    static Operator of(TokenType type) {
        switch (type) {
            case PLUS:
                return PLUS;
            case MINUS:
                return MINUS;
            case STAR:
                return STAR;
            case SLASH:
                return SLASH;
            default:
                return null;
        }
    }
}
