package com.natsort.order;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 自然排序入口。
 *
 * 每个字符串只分词一次；若排序过程中遇到无法比较的一对字符串，
 * 抛出 {@link UnorderablePairException}，且调用方的列表或数组保持原样。
 */
public final class NaturalSort {

    private static final Logger logger = LoggerFactory.getLogger(NaturalSort.class);

    private NaturalSort() {
        // 工具类，禁止实例化
    }

    /**
     * 原地排序。
     */
    public static void sort(List<String> strings) {
        sort(strings, false);
    }

    /**
     * 原地排序，reverse 为 true 时降序。
     */
    public static void sort(List<String> strings, boolean reverse) {
        List<String> ordered = sortedKeys(strings, reverse);
        for (int i = 0; i < ordered.size(); i++) {
            strings.set(i, ordered.get(i));
        }
    }

    public static void sort(String[] strings) {
        List<String> ordered = sortedKeys(List.of(strings), false);
        for (int i = 0; i < ordered.size(); i++) {
            strings[i] = ordered.get(i);
        }
    }

    /**
     * 返回排序后的新列表，不修改输入。
     */
    public static List<String> sorted(Collection<String> strings) {
        return sorted(strings, false);
    }

    public static List<String> sorted(Collection<String> strings, boolean reverse) {
        return sortedKeys(strings, reverse);
    }

    private static List<String> sortedKeys(Collection<String> strings, boolean reverse) {
        List<SortKey> keys = new ArrayList<>(strings.size());
        for (String value : strings) {
            Objects.requireNonNull(value, "自然排序不支持null元素");
            keys.add(new SortKey(value, TokenSequence.of(value)));
        }

        Comparator<SortKey> comparator = (left, right) -> {
            PartialOrdering ordering = left.tokens().compareWith(right.tokens());
            return NaturalOrderComparator.resolve(left.value(), right.value(), reverse ? ordering.reverse() : ordering);
        };
        keys.sort(comparator);
        logger.debug("自然排序完成: {} 个元素, reverse={}", keys.size(), reverse);

        List<String> ordered = new ArrayList<>(keys.size());
        for (SortKey key : keys) {
            ordered.add(key.value());
        }
        return ordered;
    }

    private record SortKey(String value, TokenSequence tokens) {
    }
}
