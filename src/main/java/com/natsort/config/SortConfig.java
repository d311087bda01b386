package com.natsort.config;

import java.nio.charset.Charset;

/**
 * 排序运行时配置
 * 
 * 由CLI参数注入，覆盖Constants默认值
 */
public class SortConfig {
    private boolean reverse = false;
    private String format = Constants.FORMAT_TEXT;
    private Charset charset = Constants.DEFAULT_CHARSET;
    private int maxInputLines = Constants.MAX_INPUT_LINES;

    public boolean isReverse() {
        return reverse;
    }

    public void setReverse(boolean reverse) {
        this.reverse = reverse;
    }

    public String getFormat() {
        return format;
    }

    public void setFormat(String format) {
        this.format = format;
    }

    public Charset getCharset() {
        return charset;
    }

    public void setCharset(Charset charset) {
        this.charset = charset;
    }

    public int getMaxInputLines() {
        return maxInputLines;
    }

    public void setMaxInputLines(int maxInputLines) {
        this.maxInputLines = maxInputLines;
    }

    public boolean isJsonFormat() {
        return Constants.FORMAT_JSON.equalsIgnoreCase(format);
    }

    /**
     * 使用默认配置创建实例
     */
    public static SortConfig defaults() {
        return new SortConfig();
    }
}
