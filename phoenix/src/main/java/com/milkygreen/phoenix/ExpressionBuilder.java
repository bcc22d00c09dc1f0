package com.milkygreen.phoenix;

import java.util.List;

import static com.milkygreen.phoenix.TokenType.*;

/**
 * 按照固定的语法 ( number operator number ) 把token列表解析成一个二元表达式
 *
 * 从第一个左括号开始逐个匹配，左括号之前、右括号之后的token都不关心。
 * 语法不对时抛出 SyntaxError，由调用方决定怎么报告。
 */
public class ExpressionBuilder {

    private final Parser parser;
    // 当前处理到的token位置，相对 parser 的起始位置
    private int current = 0;

    ExpressionBuilder(Parser parser) {
        this.parser = parser;
    }

    /**
     * 构造表达式，parser 必须已经调用过 parse()
     *
     * @return
     * @throws SyntaxError 语法不符合预期时
     */
    Expr.Binary build() {
        current = indexOfOpenParen();
        Token open = consume(LEFT_PAREN, SyntaxError.Kind.MISSING_OPEN_PAREN, "Expect '('.");

        Expr left = operand(SyntaxError.Kind.MISSING_LEFT_OPERAND, "Expect number after '('.");

        Operator operator = Operator.of(peek().type);
        if (operator == null) {
            throw error(SyntaxError.Kind.INVALID_OPERATOR, peek(),
                    "Invalid operator, expect '+', '-', '*' or '/'.");
        }
        advance();

        Expr right = operand(SyntaxError.Kind.MISSING_RIGHT_OPERAND, "Expect number after operator.");

        consume(RIGHT_PAREN, SyntaxError.Kind.MISSING_CLOSE_PAREN, "Expect ')' after expression.");

        return new Expr.Binary(left, operator, right, open.offset);
    }

    /**
     * 解析一个数字操作数，数字溢出在这里才报错
     */
    private Expr operand(SyntaxError.Kind missing, String message) {
        Token token = consume(NUMBER, missing, message);
        NumberLiteral number = token.number();
        if (!number.isValid()) {
            throw error(SyntaxError.Kind.INVALID_NUMBER, token, number.error());
        }
        return new Expr.Literal(number.value());
    }

    /**
     * 找到第一个左括号的位置，找不到时返回列表长度，让后面的 consume 报错
     */
    private int indexOfOpenParen() {
        List<Token> tokens = parser.tokens();
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).type == LEFT_PAREN) {
                return i;
            }
        }
        return tokens.size();
    }

    /**
     * 消费下一个token，如果类型不符，则报错
     */
    private Token consume(TokenType type, SyntaxError.Kind kind, String message) {
        if (check(type)) {
            return advance();
        }
        throw error(kind, peek(), message);
    }

    private boolean check(TokenType type) {
        return peek().type == type;
    }

    private Token advance() {
        Token token = peek();
        current++;
        return token;
    }

    private Token peek() {
        return parser.peek(current);
    }

    private SyntaxError error(SyntaxError.Kind kind, Token token, String message) {
        return new SyntaxError(kind, token, message);
    }

}
