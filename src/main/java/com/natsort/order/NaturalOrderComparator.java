package com.natsort.order;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;

/**
 * 自然顺序的字符串比较器，适配JDK集合API。
 *
 * 每次比较都会重新分词；批量排序请使用 {@link NaturalSort}，它对每个字符串只分词一次。
 * 遇到无法比较的一对字符串时抛出 {@link UnorderablePairException}。
 */
public final class NaturalOrderComparator implements Comparator<String> {

    private static final Logger logger = LoggerFactory.getLogger(NaturalOrderComparator.class);

    public static final NaturalOrderComparator INSTANCE = new NaturalOrderComparator();

    private NaturalOrderComparator() {
    }

    @Override
    public int compare(String left, String right) {
        return resolve(left, right, TokenSequence.of(left).compareWith(TokenSequence.of(right)));
    }

    /**
     * 将偏序结果转换为比较器整数，原文仅用于报错。
     */
    static int resolve(String left, String right, PartialOrdering ordering) {
        if (!ordering.isComparable()) {
            logger.debug("无法比较的输入: {} <-> {}", left, right);
            throw new UnorderablePairException(left, right);
        }
        return ordering.toInt();
    }
}
