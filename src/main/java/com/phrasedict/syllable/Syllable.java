package com.phrasedict.syllable;

import com.phrasedict.config.Constants;

/**
 * 单个音节，以 16 位无符号编码标识。编码与注音符号之间的映射由输入法上层负责。
 */
public record Syllable(int code) {

    /** 空音节（编码 0） */
    public static final Syllable EMPTY = new Syllable(0);

    public Syllable {
        if (code < 0 || code > Constants.MAX_SYLLABLE_CODE) {
            throw new IllegalArgumentException("音节编码超出范围: " + code);
        }
    }

    /**
     * 解析十进制或 0x 前缀十六进制的音节编码。
     *
     * @param text 编码文本
     * @return 音节
     */
    public static Syllable parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("音节编码不能为空");
        }
        String trimmed = text.trim();
        try {
            int code = trimmed.startsWith("0x") || trimmed.startsWith("0X")
                ? Integer.parseInt(trimmed.substring(2), 16)
                : Integer.parseInt(trimmed);
            return new Syllable(code);
        } catch (NumberFormatException exception) {
            throw new IllegalArgumentException("无法解析音节编码: " + text, exception);
        }
    }

    public boolean isEmpty() {
        return code == 0;
    }

    @Override
    public String toString() {
        return String.format("0x%04X", code);
    }
}
