package com.phrasedict.store;

import com.phrasedict.dictionary.DictionaryInfo;
import com.phrasedict.dictionary.Phrase;
import com.phrasedict.dictionary.PhraseRecordCodec;
import com.phrasedict.dictionary.StoreEntry;
import com.phrasedict.syllable.SyllableSequence;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 有序词库文件格式测试，覆盖写入读取一致性、排序约束与 CRC 防护。
 */
class SortedPhraseFileTest {

    private static final SyllableSequence CE_SHI = SyllableSequence.of(0x1604, 0x2B04);
    private static final SyllableSequence ZI_DIAN = SyllableSequence.of(0x2A04, 0x0C53);
    private static final DictionaryInfo INFO = new DictionaryInfo("系統詞庫", "© test", "LGPL-2.1", "1.2.0", "pdict");

    @TempDir
    Path tempDir;

    private Path writeSample() throws IOException {
        Path file = tempDir.resolve("sample.dict");
        try (SortedPhraseFileWriter writer = new SortedPhraseFileWriter(file)) {
            writer.writeInfo(INFO);
            writer.writePhrase(CE_SHI.toBytes(), Phrase.of("測試", 12, 5));
            writer.writePhrase(ZI_DIAN.toBytes(), Phrase.of("字典", 30, 6));
            writer.writePhrase(ZI_DIAN.toBytes(), Phrase.of("自點", 2, 7));
        }
        return file;
    }

    /**
     * 验证写入后可读回元数据、精确查找与有序遍历。
     */
    @Test
    @DisplayName("写入后读回元数据、精确查找与有序遍历")
    void testRoundTripPreservesInfoLookupAndOrder() throws IOException {
        SortedPhraseFile store = new SortedPhraseFile(writeSample());

        assertEquals(INFO, store.info());
        assertEquals(4, store.entryCount());
        assertEquals(0, store.invalidRecordCount());

        List<String> found = new ArrayList<>();
        store.find(ZI_DIAN.toBytes()).forEachRemaining(bytes -> found.add(PhraseRecordCodec.decode(bytes).orElseThrow().text()));
        assertEquals(List.of("字典", "自點"), found);
        assertFalse(store.find(SyllableSequence.of(0x2A04).toBytes()).hasNext(), "查找应为精确匹配");

        Iterator<StoreEntry> iterator = store.iterator();
        assertTrue(iterator.next().isInfo());
        List<String> ordered = new ArrayList<>();
        iterator.forEachRemaining(entry -> ordered.add(PhraseRecordCodec.decode(entry.value()).orElseThrow().text()));
        assertEquals(List.of("測試", "字典", "自點"), ordered);
    }

    @Test
    @DisplayName("写入器拒绝乱序或重复的词条")
    void testWriterRejectsOutOfOrderPhrase() throws IOException {
        Path file = tempDir.resolve("unordered.dict");
        try (SortedPhraseFileWriter writer = new SortedPhraseFileWriter(file)) {
            writer.writePhrase(ZI_DIAN.toBytes(), Phrase.of("字典", 1));
            assertThrows(IllegalArgumentException.class, () -> writer.writePhrase(CE_SHI.toBytes(), Phrase.of("測試", 1)));
            assertThrows(IllegalArgumentException.class, () -> writer.writePhrase(ZI_DIAN.toBytes(), Phrase.of("字典", 2)));
        }
    }

    @Test
    @DisplayName("INFO必须最先写入")
    void testWriterRequiresInfoFirst() throws IOException {
        Path file = tempDir.resolve("late-info.dict");
        try (SortedPhraseFileWriter writer = new SortedPhraseFileWriter(file)) {
            writer.writePhrase(ZI_DIAN.toBytes(), Phrase.of("字典", 1));
            assertThrows(IllegalStateException.class, () -> writer.writeInfo(INFO));
        }
    }

    @Test
    @DisplayName("关闭后的写入器拒绝写入")
    void testWriterRejectsWritesAfterClose() throws IOException {
        SortedPhraseFileWriter writer = new SortedPhraseFileWriter(tempDir.resolve("closed.dict"));
        writer.close();
        writer.close();

        assertThrows(IllegalStateException.class, () -> writer.writePhrase(ZI_DIAN.toBytes(), Phrase.of("字典", 1)));
    }

    @Test
    @DisplayName("没有INFO条目时元数据为空")
    void testFileWithoutInfoHasEmptyMetadata() throws IOException {
        Path file = tempDir.resolve("no-info.dict");
        try (SortedPhraseFileWriter writer = new SortedPhraseFileWriter(file)) {
            writer.writePhrase(ZI_DIAN.toBytes(), Phrase.of("字典", 1));
        }

        assertEquals(DictionaryInfo.empty(), new SortedPhraseFile(file).info());
    }

    /**
     * 验证篡改数据区后 CRC 校验失败。
     */
    @Test
    @DisplayName("数据区被篡改时CRC校验失败")
    void testCorruptedFileIsRejected() throws IOException {
        Path file = writeSample();
        try (RandomAccessFile randomAccessFile = new RandomAccessFile(file.toFile(), "rw")) {
            randomAccessFile.seek(12);
            int original = randomAccessFile.read();
            randomAccessFile.seek(12);
            randomAccessFile.write(original ^ 0xFF);
        }

        IOException exception = assertThrows(IOException.class, () -> new SortedPhraseFile(file));
        assertTrue(exception.getMessage().contains("CRC32"));
    }

    @Test
    @DisplayName("过短的文件被拒绝")
    void testTruncatedFileIsRejected() throws IOException {
        Path file = tempDir.resolve("tiny.dict");
        Files.write(file, new byte[]{1, 2});

        assertThrows(IOException.class, () -> new SortedPhraseFile(file));
    }

    @Test
    @DisplayName("不存在的文件被拒绝")
    void testMissingFileIsRejected() {
        assertThrows(IOException.class, () -> new SortedPhraseFile(tempDir.resolve("absent.dict")));
    }
}
