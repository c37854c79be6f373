package com.phrasedict.store;

import com.phrasedict.dictionary.DictionaryEntry;
import com.phrasedict.dictionary.DictionaryInfo;
import com.phrasedict.dictionary.DictionaryUpdateException;
import com.phrasedict.dictionary.Phrase;
import com.phrasedict.syllable.SyllableSequence;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 文件词典测试：写回、重新打开与持久化一致性。
 */
class FileDictionaryTest {

    private static final SyllableSequence ZI_DIAN = SyllableSequence.of(0x2A04, 0x0C53);
    private static final SyllableSequence CE_SHI = SyllableSequence.of(0x1604, 0x2B04);
    private static final DictionaryInfo INFO = new DictionaryInfo("使用者詞庫", "", "", "1.0.0", "pdict");

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("新建词库为空并带有元数据")
    void testCreatedDictionaryIsEmptyAndCarriesInfo() throws IOException {
        Path file = tempDir.resolve("nested/user.dict");

        FileDictionary dictionary = FileDictionary.create(file, INFO);

        assertTrue(Files.exists(file));
        assertEquals(INFO, dictionary.about());
        assertTrue(dictionary.entries().isEmpty());
        assertEquals(0, dictionary.pendingChanges());
        assertEquals(file, dictionary.path());
    }

    /**
     * 验证写回后新打开的实例可以读到修改。
     */
    @Test
    @DisplayName("写回后新打开的实例可读到新增词条")
    void testFlushPersistsAddedPhrases() throws Exception {
        Path file = tempDir.resolve("user.dict");
        FileDictionary dictionary = FileDictionary.create(file, INFO);
        dictionary.addPhrase(ZI_DIAN, Phrase.of("字典", 3, 100));
        dictionary.addPhrase(CE_SHI, Phrase.of("測試", 1));
        assertEquals(2, dictionary.pendingChanges());

        dictionary.flush();

        assertEquals(0, dictionary.pendingChanges());
        assertFalse(Files.exists(tempDir.resolve("user.dict.tmp")), "临时文件应被替换");
        FileDictionary reopened = FileDictionary.open(file);
        assertEquals(List.of(Phrase.of("字典", 3, 100)), reopened.lookupAllPhrases(ZI_DIAN));
        assertEquals(List.of(Phrase.of("測試", 1, 0)), reopened.lookupAllPhrases(CE_SHI));
        assertEquals(INFO, reopened.about());
        assertEquals(2, reopened.entries().size());
    }

    @Test
    @DisplayName("写回后删除的词条不再出现")
    void testFlushDropsRemovedPhrases() throws Exception {
        Path file = tempDir.resolve("user.dict");
        FileDictionary dictionary = FileDictionary.create(file, INFO);
        dictionary.addPhrase(ZI_DIAN, Phrase.of("字典", 3));
        dictionary.addPhrase(ZI_DIAN, Phrase.of("自點", 1));
        dictionary.flush();

        dictionary.removePhrase(ZI_DIAN, "自點");
        dictionary.flush();

        List<DictionaryEntry> entries = FileDictionary.open(file).entries();
        assertEquals(1, entries.size());
        assertEquals("字典", entries.get(0).phrase().text());
        assertEquals(ZI_DIAN, entries.get(0).syllables());
    }

    @Test
    @DisplayName("更新覆盖已持久化的词频")
    void testUpdateOverridesPersistedFrequency() throws Exception {
        Path file = tempDir.resolve("user.dict");
        FileDictionary dictionary = FileDictionary.create(file, INFO);
        dictionary.addPhrase(ZI_DIAN, Phrase.of("字典", 3));
        dictionary.flush();

        dictionary.updatePhrase(ZI_DIAN, Phrase.of("字典", 3), 9, 77);
        dictionary.flush();

        assertEquals(List.of(Phrase.of("字典", 9, 77)), FileDictionary.open(file).lookupAllPhrases(ZI_DIAN));
    }

    /**
     * reopen 只替换底层文件句柄，未写回的覆盖层修改仍然可见。
     */
    @Test
    @DisplayName("reopen保留未写回的修改")
    void testReopenKeepsPendingChanges() throws Exception {
        Path file = tempDir.resolve("user.dict");
        FileDictionary dictionary = FileDictionary.create(file, INFO);
        dictionary.addPhrase(CE_SHI, Phrase.of("測試", 2));

        dictionary.reopen();

        assertEquals(1, dictionary.pendingChanges());
        assertEquals(List.of(Phrase.of("測試", 2, 0)), dictionary.lookupAllPhrases(CE_SHI));
    }

    @Test
    @DisplayName("reopen读到外部重写的词库")
    void testReopenSeesExternalRewrite() throws Exception {
        Path file = tempDir.resolve("user.dict");
        FileDictionary dictionary = FileDictionary.create(file, INFO);
        try (SortedPhraseFileWriter writer = new SortedPhraseFileWriter(file)) {
            writer.writeInfo(INFO);
            writer.writePhrase(ZI_DIAN.toBytes(), Phrase.of("字典", 5, 1));
        }

        dictionary.reopen();

        assertEquals(List.of(Phrase.of("字典", 5, 1)), dictionary.lookupAllPhrases(ZI_DIAN));
    }

    @Test
    @DisplayName("reopen失败时保留原词库")
    void testFailedReopenKeepsPreviousStore() throws Exception {
        Path file = tempDir.resolve("user.dict");
        FileDictionary dictionary = FileDictionary.create(file, INFO);
        dictionary.addPhrase(ZI_DIAN, Phrase.of("字典", 3));
        dictionary.flush();
        Files.write(file, new byte[]{0, 1, 2, 3, 4, 5});

        assertThrows(DictionaryUpdateException.class, dictionary::reopen);
        assertEquals(List.of(Phrase.of("字典", 3, 0)), dictionary.lookupAllPhrases(ZI_DIAN));
    }

    @Test
    @DisplayName("超长文本无法写入词库")
    void testAddRejectsTextThatCannotBeStored() throws IOException {
        FileDictionary dictionary = FileDictionary.create(tempDir.resolve("user.dict"), INFO);

        assertThrows(DictionaryUpdateException.class,
            () -> dictionary.addPhrase(ZI_DIAN, Phrase.of("字".repeat(86), 1)));
        assertThrows(DictionaryUpdateException.class,
            () -> dictionary.updatePhrase(ZI_DIAN, Phrase.of("字".repeat(86), 1), 2, 0));
        assertEquals(0, dictionary.pendingChanges());
    }

    @Test
    @DisplayName("与词库文件重复的新增被拒绝")
    void testDuplicateAcrossFileAndOverlayIsRejected() throws Exception {
        Path file = tempDir.resolve("user.dict");
        FileDictionary dictionary = FileDictionary.create(file, INFO);
        dictionary.addPhrase(ZI_DIAN, Phrase.of("字典", 3));
        dictionary.flush();

        assertThrows(DictionaryUpdateException.class, () -> dictionary.addPhrase(ZI_DIAN, Phrase.of("字典", 8)));
    }

    @Test
    @DisplayName("与INFO保留键相同的音节序列被拒绝且不影响写回")
    void testReservedInfoKeyIsRejected() throws Exception {
        Path file = tempDir.resolve("user.dict");
        FileDictionary dictionary = FileDictionary.create(file, INFO);
        // 小端编码下 0x4E49,0x4F46 的字节恰为 "INFO"
        SyllableSequence infoLike = SyllableSequence.of(0x4E49, 0x4F46);

        assertThrows(DictionaryUpdateException.class, () -> dictionary.addPhrase(infoLike, Phrase.of("x", 1, 1)));
        assertThrows(DictionaryUpdateException.class,
            () -> dictionary.updatePhrase(infoLike, Phrase.of("x", 1), 2, 2));
        assertEquals(0, dictionary.pendingChanges());

        dictionary.addPhrase(ZI_DIAN, Phrase.of("字典", 1));
        dictionary.flush();

        assertFalse(Files.exists(tempDir.resolve("user.dict.tmp")));
        assertEquals(INFO, FileDictionary.open(file).about());
        assertEquals(1, FileDictionary.open(file).entries().size());
    }

    @Test
    @DisplayName("含孤立代理字符的词条无法构造，词库文件保持可读")
    void testUnpairedSurrogateNeverReachesFile() throws Exception {
        Path file = tempDir.resolve("user.dict");
        FileDictionary dictionary = FileDictionary.create(file, INFO);
        SyllableSequence key = SyllableSequence.of(1);
        dictionary.addPhrase(key, Phrase.of("A", 1));

        assertThrows(IllegalArgumentException.class, () -> Phrase.of("\uD800", 1));
        dictionary.flush();

        assertEquals(List.of(Phrase.of("A", 1, 0)), FileDictionary.open(file).lookupAllPhrases(key));
    }

    @Test
    @DisplayName("打开不存在的词库失败")
    void testOpenMissingFileFails() {
        assertThrows(IOException.class, () -> FileDictionary.open(tempDir.resolve("missing.dict")));
    }
}
