package com.natsort.text;

import java.util.List;

public interface Tokenizer {

    /**
     * 将输入文本切分为字母段与数字段交替的词项列表。
     */
    List<Token> tokenize(String text);
}
