package com.natsort.text;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * 按数字/非数字分段的分词器。
 *
 * 数字判定使用 {@link Character#isDigit(int)}，覆盖全部Unicode十进制数字（Nd类），
 * 不限于ASCII的0-9。每段取最长连续同类字符。
 */
public class DigitRunTokenizer implements Tokenizer {

    /** 无状态，可在线程间共享 */
    public static final DigitRunTokenizer INSTANCE = new DigitRunTokenizer();

    @Override
    public List<Token> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<Token> tokens = new ArrayList<>();
        int cursor = 0;

        while (cursor < text.length()) {
            boolean numericRun = isNumeric(text.codePointAt(cursor));
            int runStart = cursor;
            int runEnd = cursor + Character.charCount(text.codePointAt(cursor));

            while (runEnd < text.length() && isNumeric(text.codePointAt(runEnd)) == numericRun) {
                runEnd += Character.charCount(text.codePointAt(runEnd));
            }

            String runText = text.substring(runStart, runEnd);
            tokens.add(numericRun ? new Token.Number(parseDigits(runText), runText) : new Token.Letters(runText));

            cursor = runEnd;
        }

        return List.copyOf(tokens);
    }

    /**
     * 判断码点是否为十进制数字。
     */
    private boolean isNumeric(int codePoint) {
        return Character.isDigit(codePoint);
    }

    /**
     * 将数字段解析为任意精度整数，非ASCII数字先折算为ASCII。
     */
    private BigInteger parseDigits(String digits) {
        StringBuilder ascii = new StringBuilder(digits.length());
        digits.codePoints().forEach(codePoint -> ascii.append((char) ('0' + Character.digit(codePoint, 10))));
        return new BigInteger(ascii.toString());
    }
}
