package com.milkygreen.phoenix;

/**
 * 语法树
 */
public abstract class Expr {
    /**
     * Visitor模式接口，后续的求值、代码生成都通过它遍历语法树
     * @param <R>
     */
    interface Visitor<R> {
        R visitBinaryExpr(Binary expr);

        R visitLiteralExpr(Literal expr);
    }

    /**
     * 二元语法，一个操作符和两个表达式
     * 目前的语法里两边都是 Literal，保留 Expr 类型是为了以后支持嵌套
     */
    public static final class Binary extends Expr {
        Binary(Expr left, Operator operator, Expr right, int offset) {
            this.left = left;
            this.operator = operator;
            this.right = right;
            this.offset = offset;
        }

        @Override
        <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }

        final Expr left;
        final Operator operator;
        final Expr right;
        // 左括号在源代码中的位置
        final int offset;
    }

    /**
     * 字面值，64位有符号整数
     */
    public static final class Literal extends Expr {
        Literal(long value) {
            this.value = value;
        }

        @Override
        <R> R accept(Visitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }

        final long value;
    }

    /**
     * 基础类的accept,用于接收visitor，来实现各自的操作
     * @param visitor
     * @param <R>
     * @return
     */
    abstract <R> R accept(Visitor<R> visitor);
}
