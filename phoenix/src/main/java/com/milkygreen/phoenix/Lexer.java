package com.milkygreen.phoenix;

import static com.milkygreen.phoenix.TokenType.*;

/**
 * 词法分析器
 *
 * 逐字扫描源代码，每调用一次 next() 识别出一个token，放到当前token里。
 * 扫描本身不会失败：无法识别的字符变成 BAD token，数字溢出记录在 NumberLiteral 中。
 */
public class Lexer {

    private final String source;

    private int current = 0; // 当前扫描到的位置
    // 最近一次识别出的token，每次 next() 都会被覆盖
    private Token token;

    Lexer(String source) {
        this.source = source;
        this.token = new Token(BAD, "", null, 0, 0);
    }

    /**
     * 识别下一个token，结果通过 current() 读取
     */
    void next() {
        int start = current;

        if (isAtEnd()) {
            // 越过结尾之后继续调用，一直返回 EOF
            current++;
            token = Token.eof(Math.min(start, source.length()));
            return;
        }

        char c = peek();
        if (isWhitespace(c)) {
            // 连续的空白合并成一个token
            while (!isAtEnd() && isWhitespace(peek())) {
                current++;
            }
            token = makeToken(WHITESPACE, start, null);
            return;
        }

        if (isDigit(c)) {
            number(start);
            return;
        }

        switch (c) {
            case '+':
                current++;
                token = makeToken(PLUS, start, null);
                break;
            case '-':
                current++;
                token = makeToken(MINUS, start, null);
                break;
            case '*':
                current++;
                token = makeToken(STAR, start, null);
                break;
            case '/':
                current++;
                token = makeToken(SLASH, start, null);
                break;
            case '(':
                current++;
                token = makeToken(LEFT_PAREN, start, null);
                break;
            case ')':
                current++;
                token = makeToken(RIGHT_PAREN, start, null);
                break;
            default:
                // 不认识的字符，跳过一个字符（代理对算一个），词素为空
                current += Character.charCount(source.codePointAt(start));
                token = new Token(BAD, "", null, start, current - start);
                break;
        }
    }

    /**
     * 处理连续的数字，解析失败不在这里报错
     */
    private void number(int start) {
        while (!isAtEnd() && isDigit(peek())) {
            current++;
        }

        String digits = source.substring(start, current);
        token = makeToken(NUMBER, start, NumberLiteral.parse(digits));
    }

    /**
     * 当前token
     *
     * @return
     */
    Token current() {
        return token;
    }

    /**
     * 回到源代码开头重新扫描
     */
    void reset() {
        current = 0;
        token = new Token(BAD, "", null, 0, 0);
    }

    String source() {
        return source;
    }

    private Token makeToken(TokenType type, int start, Object literal) {
        String text = source.substring(start, current); // 从源代码中截取出识别到的token文本
        return new Token(type, text, literal, start, current - start);
    }

    /**
     * 查看当前字符，但是并不前进
     * @return
     */
    private char peek() {
        return source.charAt(current);
    }

    /**
     * Unicode White_Space 属性：\t-\r、NEL 以及 Zs/Zl/Zp 类字符
     * Character.isWhitespace 不含不换行空格，却包含 U+001C-U+001F，不能直接用
     */
    static boolean isWhitespace(char c) {
        return (c >= '\t' && c <= '\r') || c == '\u0085' || Character.isSpaceChar(c);
    }

    // 只认 ASCII 数字，保证数字能原样格式化回来
    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

}
