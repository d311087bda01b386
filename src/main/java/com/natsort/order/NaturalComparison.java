package com.natsort.order;

import com.natsort.text.Token;

/**
 * 词项序列之间的偏序比较。
 *
 * 规则：
 * - 按位置逐对比较，直到较短序列结束
 * - 数字段按数值比较，字母段按码点比较
 * - 类别不同立即返回 INCOMPARABLE
 * - 首个 LESS/GREATER 即为结果
 * - 全部相等时按长度决定，较短者较小
 */
public final class NaturalComparison {

    private NaturalComparison() {
        // 工具类，禁止实例化
    }

    public static PartialOrdering compare(TokenSequence left, TokenSequence right) {
        int pairCount = Math.min(left.size(), right.size());
        for (int i = 0; i < pairCount; i++) {
            PartialOrdering pairResult = compareTokens(left.get(i), right.get(i));
            if (pairResult != PartialOrdering.EQUAL) {
                return pairResult;
            }
        }
        return PartialOrdering.fromInt(Integer.compare(left.size(), right.size()));
    }

    /**
     * 比较单个词项对。
     */
    public static PartialOrdering compareTokens(Token left, Token right) {
        if (left instanceof Token.Number leftNumber && right instanceof Token.Number rightNumber) {
            return PartialOrdering.fromInt(leftNumber.value().compareTo(rightNumber.value()));
        }
        if (left instanceof Token.Letters leftLetters && right instanceof Token.Letters rightLetters) {
            return PartialOrdering.fromInt(compareCodePoints(leftLetters.text(), rightLetters.text()));
        }
        return PartialOrdering.INCOMPARABLE;
    }

    /**
     * 逐码点比较。String.compareTo 比较的是UTF-16单元，对增补平面字符顺序不同。
     */
    static int compareCodePoints(String left, String right) {
        int leftIndex = 0;
        int rightIndex = 0;
        while (leftIndex < left.length() && rightIndex < right.length()) {
            int leftCodePoint = left.codePointAt(leftIndex);
            int rightCodePoint = right.codePointAt(rightIndex);
            if (leftCodePoint != rightCodePoint) {
                return Integer.compare(leftCodePoint, rightCodePoint);
            }
            leftIndex += Character.charCount(leftCodePoint);
            rightIndex += Character.charCount(rightCodePoint);
        }
        boolean leftRemaining = leftIndex < left.length();
        boolean rightRemaining = rightIndex < right.length();
        return Boolean.compare(leftRemaining, rightRemaining);
    }
}
