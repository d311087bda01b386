package com.natsort.text;

import java.math.BigInteger;
import java.util.Objects;

/**
 * 自然排序中的一个词项：字母段或数字段。
 */
public sealed interface Token permits Token.Letters, Token.Number {

    /** 词项类别 */
    enum Kind {
        LETTERS,
        NUMBER
    }

    Kind kind();

    /**
     * 词项在原文中的文本。
     */
    String text();

    /**
     * 连续的非数字字符，保留空白与标点。
     */
    record Letters(String text) implements Token {
        public Letters {
            Objects.requireNonNull(text, "text");
            if (text.isEmpty()) {
                throw new IllegalArgumentException("字母段不能为空");
            }
        }

        @Override
        public Kind kind() {
            return Kind.LETTERS;
        }
    }

    /**
     * 连续的十进制数字，value为任意精度非负整数，text保留原始写法（含前导零）。
     */
    record Number(BigInteger value, String text) implements Token {
        public Number {
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(text, "text");
            if (value.signum() < 0) {
                throw new IllegalArgumentException("数字段不能为负数: " + value);
            }
            if (text.isEmpty()) {
                throw new IllegalArgumentException("数字段不能为空");
            }
        }

        @Override
        public Kind kind() {
            return Kind.NUMBER;
        }
    }

    static Letters letters(String text) {
        return new Letters(text);
    }

    /**
     * 以ASCII数字文本构造数字段，主要用于测试与检查。
     */
    static Number number(String digits) {
        return new Number(new BigInteger(digits), digits);
    }

    static Number number(long value) {
        return number(Long.toString(value));
    }
}
