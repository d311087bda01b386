package com.natsort.config;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * 全局常量定义
 * 
 * 包含输出格式与命令行输入限制
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 输出格式 ====================
    /** 纯文本输出，每行一个结果 */
    public static final String FORMAT_TEXT = "text";
    /** JSON输出 */
    public static final String FORMAT_JSON = "json";

    // ==================== 输入参数 ====================
    /** 单次排序允许读取的最大行数 */
    public static final int MAX_INPUT_LINES = 1_000_000;
    /** 输入输出默认字符集 */
    public static final Charset DEFAULT_CHARSET = StandardCharsets.UTF_8;
}
