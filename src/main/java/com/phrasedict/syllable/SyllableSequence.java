package com.phrasedict.syllable;

import com.phrasedict.config.Constants;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 音节序列，词条查找的主键。
 *
 * <p>字节形式为每个音节编码的小端 u16 依次拼接，字节相等即序列相等。</p>
 */
public record SyllableSequence(List<Syllable> syllables) {

    public SyllableSequence {
        if (syllables == null) {
            throw new IllegalArgumentException("音节列表不能为空");
        }
        syllables = List.copyOf(syllables);
    }

    public static SyllableSequence of(int... codes) {
        List<Syllable> syllables = new ArrayList<>(codes.length);
        for (int code : codes) {
            syllables.add(new Syllable(code));
        }
        return new SyllableSequence(syllables);
    }

    /**
     * 解析逗号分隔的音节编码列表，例如 {@code 0x2A01,0x1C0B}。
     */
    public static SyllableSequence parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("音节序列不能为空");
        }
        List<Syllable> syllables = Arrays.stream(text.split(","))
            .map(Syllable::parse)
            .toList();
        return new SyllableSequence(syllables);
    }

    /**
     * 从字节键还原音节序列，按 2 字节切分，末尾不足 2 字节的部分忽略。
     *
     * @param bytes 音节键字节
     * @return 音节序列
     */
    public static SyllableSequence fromBytes(byte[] bytes) {
        int count = bytes.length / Constants.SYLLABLE_BYTES;
        List<Syllable> syllables = new ArrayList<>(count);
        for (int index = 0; index < count; index++) {
            int offset = index * Constants.SYLLABLE_BYTES;
            int code = (bytes[offset] & 0xFF) | ((bytes[offset + 1] & 0xFF) << 8);
            syllables.add(new Syllable(code));
        }
        return new SyllableSequence(syllables);
    }

    /**
     * 编码为音节键字节。
     */
    public byte[] toBytes() {
        byte[] bytes = new byte[syllables.size() * Constants.SYLLABLE_BYTES];
        for (int index = 0; index < syllables.size(); index++) {
            int code = syllables.get(index).code();
            bytes[index * Constants.SYLLABLE_BYTES] = (byte) code;
            bytes[index * Constants.SYLLABLE_BYTES + 1] = (byte) (code >>> 8);
        }
        return bytes;
    }

    public int size() {
        return syllables.size();
    }

    public boolean isEmpty() {
        return syllables.isEmpty();
    }

    @Override
    public String toString() {
        return syllables.stream().map(Syllable::toString).collect(Collectors.joining(","));
    }
}
