package com.phrasedict.dictionary;

import com.phrasedict.config.Constants;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * 词条记录编解码器
 *
 * 记录布局（小端）：
 * - 词频：4 字节无符号整数
 * - 最近使用时间：8 字节无符号整数
 * - 文本长度：1 字节
 * - 文本：UTF-8 字节，长度由上一字段给出
 *
 * 长度不足、声明长度越界或文本不是合法 UTF-8 的记录视为无效，解码返回空而不抛异常。
 */
public final class PhraseRecordCodec {

    private static final int FREQUENCY_OFFSET = 0;
    private static final int LAST_USED_OFFSET = Constants.FREQUENCY_BYTES;
    private static final int TEXT_LENGTH_OFFSET = Constants.FREQUENCY_BYTES + Constants.LAST_USED_BYTES;

    private PhraseRecordCodec() {
        // 工具类，禁止实例化
    }

    /**
     * 判断记录字节是否有效。
     *
     * @param bytes 记录字节
     * @return 有效返回true
     */
    public static boolean isValid(byte[] bytes) {
        return decode(bytes).isPresent();
    }

    /**
     * 解码一条词条记录。
     *
     * @param bytes 记录字节
     * @return 解码后的词条，无效记录返回空
     */
    public static Optional<Phrase> decode(byte[] bytes) {
        if (bytes == null || bytes.length < Constants.RECORD_HEADER_BYTES) {
            return Optional.empty();
        }
        int textLength = bytes[TEXT_LENGTH_OFFSET] & 0xFF;
        if (Constants.RECORD_HEADER_BYTES + textLength > bytes.length) {
            return Optional.empty();
        }
        Optional<String> text = decodeText(bytes, textLength);
        if (text.isEmpty()) {
            return Optional.empty();
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        long frequency = Integer.toUnsignedLong(buffer.getInt(FREQUENCY_OFFSET));
        long lastUsed = buffer.getLong(LAST_USED_OFFSET);
        return Optional.of(new Phrase(text.get(), frequency, lastUsed));
    }

    /**
     * 将词条编码为记录字节，缺失的最近使用时间写为 0。
     *
     * @param phrase 词条
     * @return 记录字节
     * @throws IllegalArgumentException 文本 UTF-8 长度超过 255 字节时抛出
     */
    public static byte[] encode(Phrase phrase) {
        byte[] textBytes = phrase.text().getBytes(StandardCharsets.UTF_8);
        if (textBytes.length > Constants.MAX_PHRASE_BYTES) {
            throw new IllegalArgumentException("词条文本超过 " + Constants.MAX_PHRASE_BYTES
                + " 字节: length=" + textBytes.length);
        }
        return ByteBuffer.allocate(Constants.RECORD_HEADER_BYTES + textBytes.length)
            .order(ByteOrder.LITTLE_ENDIAN)
            .putInt((int) phrase.frequency())
            .putLong(phrase.lastUsedOrZero())
            .put((byte) textBytes.length)
            .put(textBytes)
            .array();
    }

    private static Optional<String> decodeText(byte[] bytes, int textLength) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            ByteBuffer textBuffer = ByteBuffer.wrap(bytes, Constants.RECORD_HEADER_BYTES, textLength);
            return Optional.of(decoder.decode(textBuffer).toString());
        } catch (CharacterCodingException exception) {
            return Optional.empty();
        }
    }
}
