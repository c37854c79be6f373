package com.phrasedict.config;

import java.nio.charset.StandardCharsets;

/**
 * 全局常量定义
 *
 * 包含词条记录布局、词典文件魔数和查询参数
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 音节编码 ====================
    /** 单个音节编码的字节宽度（小端 u16） */
    public static final int SYLLABLE_BYTES = 2;
    /** 音节编码最大值 */
    public static final int MAX_SYLLABLE_CODE = 0xFFFF;

    // ==================== 词条记录布局 ====================
    /** 词频字段字节数（小端 u32） */
    public static final int FREQUENCY_BYTES = 4;
    /** 最近使用时间字段字节数（小端 u64） */
    public static final int LAST_USED_BYTES = 8;
    /** 记录头长度：词频 + 最近使用时间 + 文本长度字节 */
    public static final int RECORD_HEADER_BYTES = FREQUENCY_BYTES + LAST_USED_BYTES + 1;
    /** 词条文本 UTF-8 字节上限，由单字节长度字段决定 */
    public static final int MAX_PHRASE_BYTES = 0xFF;
    /** 词频上限（u32） */
    public static final long MAX_FREQUENCY = 0xFFFF_FFFFL;

    // ==================== 词典文件 ====================
    /** 词典文件魔数 "PDSF" */
    public static final int DICT_MAGIC = 0x50445346;
    /** 文件格式版本号 */
    public static final short FORMAT_VERSION = 1;
    /** 元数据保留键 */
    public static final String INFO_KEY = "INFO";
    /** 元数据保留键的字节形式 */
    private static final byte[] INFO_KEY_BYTES = INFO_KEY.getBytes(StandardCharsets.US_ASCII);

    // ==================== 查询参数 ====================
    /** 默认候选词数量 */
    public static final int DEFAULT_LOOKUP_LIMIT = 10;
    /** 命令行候选词数量上限 */
    public static final int MAX_LOOKUP_LIMIT = 1000;

    /**
     * 返回元数据保留键字节的副本。
     */
    public static byte[] infoKeyBytes() {
        return INFO_KEY_BYTES.clone();
    }
}
