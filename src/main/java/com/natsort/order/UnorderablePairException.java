package com.natsort.order;

/**
 * 排序过程中遇到无法比较的两个字符串时抛出。
 */
public class UnorderablePairException extends RuntimeException {
    private final String left;
    private final String right;

    public UnorderablePairException(String left, String right) {
        super(buildMessage(left, right));
        this.left = left;
        this.right = right;
    }

    public String getLeft() {
        return left;
    }

    public String getRight() {
        return right;
    }

    private static String buildMessage(String left, String right) {
        return "Unorderable input pair: \"" + left + "\" and \"" + right + "\""
                + " (a number and letters meet at the same position)";
    }
}
