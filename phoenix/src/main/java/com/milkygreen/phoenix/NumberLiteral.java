package com.milkygreen.phoenix;

/**
 * 数字token携带的字面值
 *
 * 词法阶段只负责识别"看起来像数字"的字符串，是否能表示成64位有符号整数要等到语法阶段真正用到时才报错，
 * 因此这里保存的是解析结果：要么是值，要么是失败原因。
 */
public final class NumberLiteral {

    // 原始的数字字符串
    private final String digits;
    // 解析出的值，失败时无意义
    private final long value;
    // 失败原因，成功时为null
    private final String error;

    private NumberLiteral(String digits, long value, String error) {
        this.digits = digits;
        this.value = value;
        this.error = error;
    }

    /**
     * 将一串连续的数字解析成64位有符号整数，溢出时不抛异常，而是把失败记录下来
     *
     * @param digits 连续的数字字符
     * @return
     */
    static NumberLiteral parse(String digits) {
        try {
            return new NumberLiteral(digits, Long.parseLong(digits), null);
        } catch (NumberFormatException e) {
            return new NumberLiteral(digits, 0L,
                    "Number '" + digits + "' does not fit in a 64-bit signed integer.");
        }
    }

    public String digits() {
        return digits;
    }

    public boolean isValid() {
        return error == null;
    }

    /**
     * 获取解析出的值
     *
     * @return
     * @throws IllegalStateException 解析失败时
     */
    public long value() {
        if (error != null) {
            throw new IllegalStateException(error);
        }
        return value;
    }

    public String error() {
        return error;
    }

    @Override
    public String toString() {
        return isValid() ? Long.toString(value) : "<" + error + ">";
    }
}
