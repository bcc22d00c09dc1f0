package com.milkygreen.phoenix;

/**
 * 把语法树打印成带括号的字符串，如 (1 + 2)
 */
class AstPrinter implements Expr.Visitor<String> {

    String print(Expr expr) {
        return expr.accept(this);
    }

    @Override
    public String visitBinaryExpr(Expr.Binary expr) {
        return "(" + print(expr.left) + " " + expr.operator.symbol() + " " + print(expr.right) + ")";
    }

    @Override
    public String visitLiteralExpr(Expr.Literal expr) {
        return Long.toString(expr.value);
    }
}
