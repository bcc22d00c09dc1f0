package com.milkygreen.phoenix;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import java.util.logging.Logger;

/**
 * ph 命令行入口
 *
 * ph build <file>   编译一个源文件，打印token列表和语法树
 * ph repl           交互式命令行，每行一个表达式
 */
public class Phoenix {

    private static final Logger LOG = Logger.getLogger(Phoenix.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 64;
    static final int EXIT_SYNTAX = 65;
    static final int EXIT_NO_INPUT = 66;

    static final String USAGE = "Usage: ph <command>\n"
            + "\n"
            + "Commands:\n"
            + "  build, b <file>  Builds the file\n"
            + "  repl             Starts an interactive prompt";

    static final String EXPECTED_SHAPE = "( number operator number )";

    private final PrintStream out;
    private final PrintStream err;

    Phoenix(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) throws IOException {
        LogConfig.configureOnce();
        int code = new Phoenix(System.out, System.err).run(args, System.in);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    /**
     * 根据命令行参数分发到对应的子命令
     *
     * @return 进程退出码
     */
    int run(String[] args, InputStream in) throws IOException {
        if (args.length == 0) {
            out.println(USAGE);
            return EXIT_USAGE;
        }

        switch (args[0]) {
            case "build":
            case "b":
                if (args.length != 2) {
                    out.println(USAGE);
                    return EXIT_USAGE;
                }
                return build(args[1]);
            case "repl":
                if (args.length != 1) {
                    out.println(USAGE);
                    return EXIT_USAGE;
                }
                repl(in);
                return EXIT_OK;
            default:
                out.println(USAGE);
                return EXIT_USAGE;
        }
    }

    /**
     * 以文件方式编译源代码
     * @param path 源代码文件路径
     */
    int build(String path) {
        out.println("Building " + path);
        LOG.fine("Building " + path);

        String source;
        try {
            // 非法的 UTF-8 会抛 MalformedInputException，不做替换
            source = Files.readString(Paths.get(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.info("Failed to read " + path + ": " + e);
            err.println(path + ": Error: failed to read file (" + e.getMessage() + ")");
            return EXIT_NO_INPUT;
        }

        Expr.Binary expr = compile(path, source, true);
        if (expr == null) {
            return EXIT_SYNTAX;
        }
        out.println("Expression: " + new AstPrinter().print(expr));
        LOG.fine("Built " + path);
        return EXIT_OK;
    }

    /**
     * 以命令行方式交互运行，出错后继续读取下一行
     */
    void repl(InputStream in) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        for (;;) {
            out.print("> ");
            out.flush();
            String line = reader.readLine();
            if (line == null) {
                break;
            }
            if (line.isBlank()) {
                continue;
            }
            Expr.Binary expr = compile("<stdin>", line, false);
            if (expr != null) {
                out.println(new AstPrinter().print(expr));
            }
        }
    }

    /**
     * 把源码解析成表达式
     *
     * @param source 完整的源代码
     * @return
     * @throws SyntaxError 语法不符合 ( number operator number ) 时
     */
    public static Expr.Binary parse(String source) {
        Parser parser = new Parser(source);
        parser.parse();
        return new ExpressionBuilder(parser).build();
    }

    /**
     * 执行 词法分析 -> token列表 -> 表达式，出错时报告并返回null
     */
    private Expr.Binary compile(String name, String source, boolean dumpTokens) {
        Parser parser = new Parser(source);
        parser.parse();

        if (dumpTokens) {
            out.println("Tokens:");
            for (Token token : parser.tokens()) {
                out.println("  " + token);
            }
        }

        try {
            return new ExpressionBuilder(parser).build();
        } catch (SyntaxError error) {
            LOG.info("Syntax error in " + name + ": " + error.kind);
            report(name, parser, error);
            return null;
        }
    }

    private void report(String name, Parser parser, SyntaxError error) {
        Token token = error.token;
        String where = token.type == TokenType.EOF ? " at end" : " at '" + token.lexeme + "'";
        err.println(name + ":" + token.offset + ": Error" + where + ": " + error.getMessage());
        err.println("  expected: " + EXPECTED_SHAPE);

        List<Token> bad = parser.badTokens();
        if (!bad.isEmpty()) {
            Token first = bad.get(0);
            String text = parser.source().substring(first.offset, first.offset + first.length);
            err.println("  note: unrecognized character '" + text + "' at offset " + first.offset
                    + " was ignored");
        }
    }
}
