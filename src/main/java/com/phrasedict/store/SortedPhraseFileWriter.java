package com.phrasedict.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phrasedict.config.Constants;
import com.phrasedict.dictionary.DictionaryInfo;
import com.phrasedict.dictionary.Phrase;
import com.phrasedict.dictionary.PhraseKey;
import com.phrasedict.dictionary.PhraseRecordCodec;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * 有序词库文件写入器，按 (键, 文本) 严格递增写入词条并在关闭时追加 CRC32。
 */
public final class SortedPhraseFileWriter implements AutoCloseable {
    private static final long ENTRY_COUNT_OFFSET = Integer.BYTES + Short.BYTES;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final RandomAccessFile file;
    private final String fileName;
    private int entryCount;
    private PhraseKey lastKey;
    private boolean infoWritten;
    private boolean closed;

    /**
     * 创建写入器并写入文件头，已有文件会被截断。
     *
     * @param path 目标词库文件
     * @throws IOException 初始化失败时抛出
     */
    public SortedPhraseFileWriter(Path path) throws IOException {
        if (path == null) {
            throw new IllegalArgumentException("词库文件不能为空");
        }
        this.file = new RandomAccessFile(path.toFile(), "rw");
        this.fileName = path.getFileName().toString();
        this.file.setLength(0L);
        this.file.writeInt(Constants.DICT_MAGIC);
        this.file.writeShort(Constants.FORMAT_VERSION);
        this.file.writeInt(0);
    }

    /**
     * 写入词典元数据，必须在任何词条之前且只能写一次。
     *
     * @param info 元数据
     * @throws IOException 写入失败时抛出
     */
    public void writeInfo(DictionaryInfo info) throws IOException {
        ensureOpen();
        if (infoWritten || entryCount > 0) {
            throw new IllegalStateException("INFO 条目必须最先写入且只能写一次");
        }
        StorageFileUtil.writeLengthPrefixed(file, Constants.infoKeyBytes());
        StorageFileUtil.writeLengthPrefixed(file, MAPPER.writeValueAsBytes(info));
        entryCount++;
        infoWritten = true;
    }

    /**
     * 写入一个词条，要求 (音节键, 文本) 严格递增。
     *
     * @param syllableKey 音节键字节
     * @param phrase 词条
     * @throws IOException 写入失败时抛出
     */
    public void writePhrase(byte[] syllableKey, Phrase phrase) throws IOException {
        ensureOpen();
        if (syllableKey == null || phrase == null) {
            throw new IllegalArgumentException("音节键与词条不能为空");
        }
        if (Arrays.equals(syllableKey, Constants.infoKeyBytes())) {
            throw new IllegalArgumentException("音节键与保留键 INFO 冲突");
        }
        PhraseKey key = new PhraseKey(syllableKey, phrase.text());
        if (lastKey != null && key.compareTo(lastKey) <= 0) {
            throw new IllegalArgumentException("词条必须严格递增，last=" + lastKey + ", current=" + key);
        }
        byte[] record = PhraseRecordCodec.encode(phrase);
        StorageFileUtil.writeLengthPrefixed(file, syllableKey);
        StorageFileUtil.writeLengthPrefixed(file, record);
        entryCount++;
        lastKey = key;
    }

    /**
     * 回填 entryCount 并写入 CRC32 页脚。
     *
     * @throws IOException 关闭失败时抛出
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        try {
            file.seek(ENTRY_COUNT_OFFSET);
            file.writeInt(entryCount);
            file.seek(file.length());
            StorageFileUtil.appendCrc32Footer(file);
            StorageFileUtil.verifyCrc32Footer(file, fileName);
        } catch (IOException exception) {
            throw new IOException("关闭词库写入器失败: file=" + fileName + ", entryCount=" + entryCount, exception);
        } finally {
            file.close();
            closed = true;
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("SortedPhraseFileWriter 已关闭");
        }
    }
}
