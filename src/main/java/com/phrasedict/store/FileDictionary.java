package com.phrasedict.store;

import com.phrasedict.config.Constants;
import com.phrasedict.dictionary.Dictionary;
import com.phrasedict.dictionary.DictionaryEntry;
import com.phrasedict.dictionary.DictionaryInfo;
import com.phrasedict.dictionary.DictionaryUpdateException;
import com.phrasedict.dictionary.KeyValueDictionary;
import com.phrasedict.dictionary.Phrase;
import com.phrasedict.syllable.SyllableSequence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * 基于有序词库文件的词典。
 *
 * <p>查询与修改委托给 {@link KeyValueDictionary}；{@link #flush()} 把合并结果重写为新文件并原子替换，
 * 之后覆盖层与墓碑集清空；{@link #reopen()} 只替换底层词库句柄，未写回的修改保留。</p>
 */
public final class FileDictionary implements Dictionary {
    private static final Logger logger = LoggerFactory.getLogger(FileDictionary.class);

    private final Path path;
    private KeyValueDictionary<SortedPhraseFile> delegate;
    private DictionaryInfo info;

    private FileDictionary(Path path, SortedPhraseFile store) {
        this.path = path;
        this.delegate = new KeyValueDictionary<>(store);
        this.info = store.info();
    }

    /**
     * 打开已有词库文件。
     *
     * @param path 词库文件
     * @return 词典
     * @throws IOException 文件不存在或损坏时抛出
     */
    public static FileDictionary open(Path path) throws IOException {
        return new FileDictionary(path, new SortedPhraseFile(path));
    }

    /**
     * 创建只含元数据的空词库文件并打开，已有文件会被覆盖。
     *
     * @param path 词库文件
     * @param info 元数据
     * @return 词典
     * @throws IOException 写入失败时抛出
     */
    public static FileDictionary create(Path path, DictionaryInfo info) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (SortedPhraseFileWriter writer = new SortedPhraseFileWriter(path)) {
            writer.writeInfo(info);
        }
        logger.info("已创建空词库: path={}", path);
        return open(path);
    }

    @Override
    public List<Phrase> lookupFirstNPhrases(SyllableSequence syllables, int first) {
        return delegate.lookupFirstNPhrases(syllables, first);
    }

    @Override
    public List<DictionaryEntry> entries() {
        return delegate.entries();
    }

    @Override
    public DictionaryInfo about() {
        return info;
    }

    @Override
    public void reopen() throws DictionaryUpdateException {
        Optional<SortedPhraseFile> previous = delegate.take();
        try {
            SortedPhraseFile reopened = new SortedPhraseFile(path);
            delegate.set(reopened);
            info = reopened.info();
        } catch (IOException exception) {
            previous.ifPresent(delegate::set);
            throw new DictionaryUpdateException("重新打开词库失败: " + path, exception);
        }
    }

    @Override
    public void flush() throws DictionaryUpdateException {
        int pending = pendingChanges();
        List<DictionaryEntry> merged = delegate.entries();
        Path tempFile = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            try (SortedPhraseFileWriter writer = new SortedPhraseFileWriter(tempFile)) {
                writer.writeInfo(info);
                for (DictionaryEntry entry : merged) {
                    writer.writePhrase(entry.syllables().toBytes(), entry.phrase());
                }
            }
            // 替换前先按读取路径校验一遍，损坏的新文件不能覆盖旧词库
            new SortedPhraseFile(tempFile);
            replaceAtomically(tempFile, path);
            delegate = new KeyValueDictionary<>(new SortedPhraseFile(path));
        } catch (IOException | IllegalArgumentException exception) {
            deleteQuietly(tempFile, exception);
            throw new DictionaryUpdateException("写回词库失败: " + path, exception);
        }
        logger.info("词库已写回: path={}, entries={}, pendingChanges={}", path, merged.size(), pending);
    }

    @Override
    public void addPhrase(SyllableSequence syllables, Phrase phrase) throws DictionaryUpdateException {
        requireStorable(syllables, phrase.text());
        delegate.addPhrase(syllables, phrase);
    }

    @Override
    public void updatePhrase(SyllableSequence syllables, Phrase phrase, long frequency, long lastUsed)
        throws DictionaryUpdateException {
        requireStorable(syllables, phrase.text());
        delegate.updatePhrase(syllables, phrase, frequency, lastUsed);
    }

    @Override
    public void removePhrase(SyllableSequence syllables, String text) {
        delegate.removePhrase(syllables, text);
    }

    /**
     * 尚未写回的覆盖层词条与墓碑数量之和。
     */
    public int pendingChanges() {
        return delegate.overlaySize() + delegate.tombstoneCount();
    }

    public Path path() {
        return path;
    }

    private static void requireStorable(SyllableSequence syllables, String text) throws DictionaryUpdateException {
        if (Arrays.equals(syllables.toBytes(), Constants.infoKeyBytes())) {
            throw new DictionaryUpdateException("音节序列与元数据保留键 INFO 冲突: syllables=" + syllables);
        }
        int length = text.getBytes(StandardCharsets.UTF_8).length;
        if (length > Constants.MAX_PHRASE_BYTES) {
            throw new DictionaryUpdateException("词条文本超过 " + Constants.MAX_PHRASE_BYTES
                + " 字节，无法写入词库: length=" + length);
        }
    }

    private static void replaceAtomically(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException exception) {
            logger.warn("文件系统不支持原子移动，改用普通替换: target={}", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path file, Exception primary) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException cleanupFailure) {
            primary.addSuppressed(cleanupFailure);
        }
    }
}
