package com.natsort.order;

/**
 * 偏序比较结果。INCOMPARABLE 表示两者之间不存在顺序关系，是合法结果而非错误。
 */
public enum PartialOrdering {
    LESS,
    EQUAL,
    GREATER,
    INCOMPARABLE;

    /**
     * 将 {@link Comparable#compareTo} 风格的整数结果转换为偏序结果。
     */
    public static PartialOrdering fromInt(int comparison) {
        if (comparison < 0) {
            return LESS;
        }
        return comparison > 0 ? GREATER : EQUAL;
    }

    public boolean isComparable() {
        return this != INCOMPARABLE;
    }

    /**
     * 反转方向，EQUAL 与 INCOMPARABLE 保持不变。
     */
    public PartialOrdering reverse() {
        return switch (this) {
            case LESS -> GREATER;
            case GREATER -> LESS;
            default -> this;
        };
    }

    /**
     * 转换为 {@link java.util.Comparator} 约定的整数。
     *
     * @throws IllegalStateException 如果结果为 INCOMPARABLE
     */
    public int toInt() {
        return switch (this) {
            case LESS -> -1;
            case EQUAL -> 0;
            case GREATER -> 1;
            case INCOMPARABLE -> throw new IllegalStateException("INCOMPARABLE 无法转换为整数比较结果");
        };
    }
}
