package com.phrasedict.dictionary;

import com.phrasedict.config.Constants;

import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Comparator;

/**
 * 候选词条：文本、使用频次与最近使用时间。
 *
 * <p>{@code lastUsed} 为 {@code null} 仅出现在新构造的词条上；从词典读出的词条总带有时间戳。
 * 频次为无符号 32 位，时间戳为无符号 64 位，均以 {@code long} 保存。</p>
 *
 * @param text      词条文本
 * @param frequency 使用频次
 * @param lastUsed  最近使用时间，可为空
 */
public record Phrase(String text, long frequency, Long lastUsed) {

    /**
     * 同文本词条之间的取舍顺序：先比较频次，频次相同再比较最近使用时间，缺失时间戳视为最小。
     */
    public static final Comparator<Phrase> BY_FREQUENCY_THEN_RECENCY = Comparator
        .comparingLong(Phrase::frequency)
        .thenComparing(Phrase::lastUsed, Comparator.nullsFirst((Long left, Long right) -> Long.compareUnsigned(left, right)));

    public Phrase {
        if (text == null) {
            throw new IllegalArgumentException("词条文本不能为空");
        }
        if (!isWellFormed(text)) {
            throw new IllegalArgumentException("词条文本包含未配对的代理字符，无法编码为 UTF-8");
        }
        if (frequency < 0 || frequency > Constants.MAX_FREQUENCY) {
            throw new IllegalArgumentException("词频超出 u32 范围: " + frequency);
        }
    }

    public static Phrase of(String text, long frequency) {
        return new Phrase(text, frequency, null);
    }

    public static Phrase of(String text, long frequency, long lastUsed) {
        return new Phrase(text, frequency, lastUsed);
    }

    public boolean hasLastUsed() {
        return lastUsed != null;
    }

    /**
     * 返回最近使用时间，缺失时返回 0。
     */
    public long lastUsedOrZero() {
        return lastUsed == null ? 0L : lastUsed;
    }

    // 孤立代理字符经 getBytes 会被替换为 '?'，写盘后主键顺序与内存中不一致
    private static boolean isWellFormed(String text) {
        return StandardCharsets.UTF_8.newEncoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT)
            .canEncode(text);
    }

    @Override
    public String toString() {
        return text;
    }
}
