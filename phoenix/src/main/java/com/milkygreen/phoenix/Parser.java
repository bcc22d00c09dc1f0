package com.milkygreen.phoenix;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

import static com.milkygreen.phoenix.TokenType.*;

/**
 * Parser负责把 Lexer 的输出收集成token列表，并提供向前查看（lookahead）的能力
 *
 * 空白和无法识别的字符不进入列表，EOF 也不保存，越界查看时临时构造一个。
 */
public class Parser {

    private static final Logger LOG = Logger.getLogger(Parser.class.getName());

    private final Lexer lexer;
    // 过滤后的token列表
    private final List<Token> tokens = new ArrayList<>();
    // 被丢弃的 BAD token，报错时用来指出第一个无法识别的字符
    private final List<Token> badTokens = new ArrayList<>();
    // 当前处理到的token位置
    private int position = 0;

    Parser(Lexer lexer) {
        this.lexer = lexer;
    }

    Parser(String source) {
        this(new Lexer(source));
    }

    /**
     * 从头扫描一遍源代码，填充token列表
     * 每次调用都会重置 Lexer，重复调用得到相同的结果
     */
    void parse() {
        lexer.reset();
        tokens.clear();
        badTokens.clear();
        position = 0;

        for (;;) {
            lexer.next();
            Token token = lexer.current();

            if (token.type == WHITESPACE) {
                continue;
            }
            if (token.type == BAD) {
                badTokens.add(token);
                continue;
            }
            if (token.type == EOF) {
                break;
            }
            tokens.add(token);
        }

        LOG.fine("Parsed " + tokens.size() + " tokens, dropped " + badTokens.size() + " bad characters");
    }

    /**
     * 查看 position + offset 处的token，不移动位置
     * 越界时（包括负数）返回 EOF，不会抛异常
     *
     * @param offset 相对当前位置的偏移
     * @return
     */
    Token peek(int offset) {
        long index = (long) position + offset;
        if (index < 0 || index >= tokens.size()) {
            return Token.eof(lexer.source().length());
        }
        return tokens.get((int) index);
    }

    Token current() {
        return peek(0);
    }

    List<Token> tokens() {
        return Collections.unmodifiableList(tokens);
    }

    List<Token> badTokens() {
        return Collections.unmodifiableList(badTokens);
    }

    String source() {
        return lexer.source();
    }

}
