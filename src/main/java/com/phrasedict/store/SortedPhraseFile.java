package com.phrasedict.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phrasedict.config.Constants;
import com.phrasedict.dictionary.DictionaryInfo;
import com.phrasedict.dictionary.KeyValueStore;
import com.phrasedict.dictionary.Phrase;
import com.phrasedict.dictionary.PhraseKey;
import com.phrasedict.dictionary.PhraseRecordCodec;
import com.phrasedict.dictionary.StoreEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 有序词库文件读取器，打开时全量加载并提供精确查找与有序遍历。
 *
 * 文件布局：
 * - magic(int) + version(short) + entryCount(int)
 * - 每个条目：VarInt 键长 + 键字节 + VarInt 值长 + 值字节
 * - CRC32 页脚
 *
 * INFO 条目保存 JSON 格式的 {@link DictionaryInfo}，其余条目按 (键, 解码文本) 严格递增。
 */
public final class SortedPhraseFile implements KeyValueStore {
    private static final Logger logger = LoggerFactory.getLogger(SortedPhraseFile.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path path;
    private final List<StoreEntry> entries = new ArrayList<>();
    private final TreeMap<byte[], List<byte[]>> valuesByKey = new TreeMap<byte[], List<byte[]>>(Arrays::compareUnsigned);
    private DictionaryInfo info = DictionaryInfo.empty();
    private int invalidRecordCount;

    /**
     * 打开词库文件并完成全量加载。
     *
     * @param path 词库文件
     * @throws IOException 文件损坏或解析失败时抛出
     */
    public SortedPhraseFile(Path path) throws IOException {
        if (path == null) {
            throw new IllegalArgumentException("词库文件不能为空");
        }
        this.path = path;
        String fileName = path.getFileName().toString();
        try (RandomAccessFile file = new RandomAccessFile(path.toFile(), "r")) {
            long dataLength = StorageFileUtil.verifyCrc32Footer(file, fileName);
            file.seek(0L);

            int magic = file.readInt();
            if (magic != Constants.DICT_MAGIC) {
                throw new IOException("词库文件 magic 不匹配: " + fileName);
            }
            short version = file.readShort();
            if (version != Constants.FORMAT_VERSION) {
                throw new IOException("词库文件版本不支持: " + version);
            }
            int entryCount = file.readInt();
            if (entryCount < 0) {
                throw new IOException("词库 entryCount 非法: " + entryCount + ", file=" + path.toAbsolutePath());
            }

            PhraseKey previousKey = null;
            for (int index = 0; index < entryCount; index++) {
                byte[] key = StorageFileUtil.readLengthPrefixed(file, dataLength, "键");
                byte[] value = StorageFileUtil.readLengthPrefixed(file, dataLength, "值");
                StoreEntry entry = new StoreEntry(key, value);
                if (entry.isInfo()) {
                    info = MAPPER.readValue(value, DictionaryInfo.class);
                    entries.add(entry);
                    continue;
                }
                Optional<Phrase> phrase = PhraseRecordCodec.decode(value);
                if (phrase.isEmpty()) {
                    invalidRecordCount++;
                } else {
                    PhraseKey currentKey = new PhraseKey(key, phrase.get().text());
                    if (previousKey != null && currentKey.compareTo(previousKey) <= 0) {
                        throw new IOException("词库词序损坏，条目未严格递增: " + currentKey);
                    }
                    previousKey = currentKey;
                }
                entries.add(entry);
                valuesByKey.computeIfAbsent(key, ignored -> new ArrayList<>()).add(value);
            }

            if (file.getFilePointer() != dataLength) {
                throw new IOException("词库文件包含未解析字节，可能已损坏: " + fileName);
            }
        }
        if (invalidRecordCount > 0) {
            logger.warn("词库包含无效记录，查询时将被跳过: file={}, count={}", fileName, invalidRecordCount);
        }
        logger.info("词库已加载: file={}, entries={}", fileName, entries.size());
    }

    @Override
    public Iterator<byte[]> find(byte[] key) {
        return valuesByKey.getOrDefault(key, List.of()).stream()
            .map(byte[]::clone)
            .iterator();
    }

    @Override
    public Iterator<StoreEntry> iterator() {
        return entries.stream()
            .map(entry -> new StoreEntry(entry.key().clone(), entry.value().clone()))
            .iterator();
    }

    /**
     * 词库元数据，文件中没有 INFO 条目时为空元数据。
     */
    public DictionaryInfo info() {
        return info;
    }

    /**
     * 条目数量（含 INFO 与无效记录）。
     */
    public int entryCount() {
        return entries.size();
    }

    public int invalidRecordCount() {
        return invalidRecordCount;
    }

    public Path path() {
        return path;
    }
}
