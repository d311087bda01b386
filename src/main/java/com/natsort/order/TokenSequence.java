package com.natsort.order;

import com.natsort.text.DigitRunTokenizer;
import com.natsort.text.Token;
import com.natsort.text.Tokenizer;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 由单个字符串切分得到的不可变词项序列。
 *
 * equals/hashCode 为结构相等：长度相同且逐位词项相同（数字段比较原始文本），
 * 与 {@link #compareWith} 的数值意义上的 EQUAL 不同，例如 "007" 与 "7"。
 */
public record TokenSequence(List<Token> tokens) {

    public TokenSequence {
        tokens = List.copyOf(tokens);
        for (int i = 1; i < tokens.size(); i++) {
            if (tokens.get(i).kind() == tokens.get(i - 1).kind()) {
                throw new IllegalArgumentException("相邻词项类别必须交替，位置 " + i + ": " + tokens);
            }
        }
    }

    /**
     * 使用默认分词器构造序列。
     */
    public static TokenSequence of(String text) {
        return of(text, DigitRunTokenizer.INSTANCE);
    }

    public static TokenSequence of(String text, Tokenizer tokenizer) {
        return new TokenSequence(tokenizer.tokenize(text));
    }

    public static TokenSequence of(Token... tokens) {
        return new TokenSequence(List.of(tokens));
    }

    public int size() {
        return tokens.size();
    }

    public Token get(int index) {
        return tokens.get(index);
    }

    /**
     * 按原文拼接各词项，还原输入字符串。
     */
    public String text() {
        return tokens.stream().map(Token::text).collect(Collectors.joining());
    }

    public PartialOrdering compareWith(TokenSequence other) {
        return NaturalComparison.compare(this, other);
    }
}
