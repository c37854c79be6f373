package com.phrasedict.dictionary;

import com.phrasedict.syllable.SyllableSequence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * 覆盖层键值词典：只读底层词库 + 内存覆盖层 + 墓碑集，对外呈现一个合并后的查询面。
 *
 * <p>修改只作用于覆盖层与墓碑集，底层词库永远不被写入。覆盖层与墓碑集随对象存活，
 * 只有在外部持久化流程通过 {@link #fromRawParts} 或新建实例时才会替换。</p>
 *
 * <p>非线程安全，调用方需自行保证互斥。</p>
 *
 * @param <S> 底层词库类型
 */
public class KeyValueDictionary<S extends KeyValueStore> implements Dictionary {
    private static final Logger logger = LoggerFactory.getLogger(KeyValueDictionary.class);

    private S store;
    private final TreeMap<PhraseKey, OverlayValue> overlay;
    private final TreeSet<PhraseKey> tombstones;

    private record OverlayValue(long frequency, long lastUsed) {
    }

    /**
     * 以指定底层词库创建词典，覆盖层与墓碑集为空。
     *
     * @param store 底层词库
     */
    public KeyValueDictionary(S store) {
        this(requireStore(store), new TreeMap<>(), new TreeSet<>());
    }

    private KeyValueDictionary(S store, TreeMap<PhraseKey, OverlayValue> overlay, TreeSet<PhraseKey> tombstones) {
        this.store = store;
        this.overlay = overlay;
        this.tombstones = tombstones;
    }

    /**
     * 创建不带底层词库的纯内存词典。
     */
    public static <S extends KeyValueStore> KeyValueDictionary<S> newInMemory() {
        return new KeyValueDictionary<>(null, new TreeMap<>(), new TreeSet<>());
    }

    /**
     * 用新的底层词库和另一个词典的覆盖层、墓碑集组装词典，供外部持久化在替换词库文件后保留未写回的修改。
     * 覆盖层与墓碑集被复制，{@code other} 本身不受影响。
     *
     * @param store 新底层词库
     * @param other 提供覆盖层与墓碑集的词典
     * @return 新词典
     */
    public static <S extends KeyValueStore> KeyValueDictionary<S> fromRawParts(S store, KeyValueDictionary<?> other) {
        return new KeyValueDictionary<>(requireStore(store), new TreeMap<>(other.overlay), new TreeSet<>(other.tombstones));
    }

    /**
     * 取下底层词库句柄，之后查询只看到覆盖层。
     *
     * @return 原底层词库，没有时为空
     */
    public Optional<S> take() {
        S detached = store;
        store = null;
        return Optional.ofNullable(detached);
    }

    /**
     * 挂上新的底层词库句柄。
     */
    public void set(S store) {
        this.store = requireStore(store);
    }

    /**
     * 精确查找音节键的全部词条：底层词库的有效记录与覆盖层对应区间，去掉被墓碑屏蔽的文本。
     * 不去重，也不保证顺序。
     *
     * @param syllableKey 音节键字节
     * @return 词条流
     */
    Stream<Phrase> entriesFor(byte[] syllableKey) {
        Stream<Phrase> storePhrases = store == null
            ? Stream.empty()
            : stream(store.find(syllableKey))
                .map(this::decodeRecord)
                .flatMap(Optional::stream);
        Stream<Phrase> overlayPhrases = overlayRange(syllableKey).entrySet().stream()
            .takeWhile(entry -> entry.getKey().hasSyllableKey(syllableKey))
            .map(entry -> toPhrase(entry.getKey(), entry.getValue()));
        return Stream.concat(storePhrases, overlayPhrases)
            .filter(phrase -> !tombstones.contains(new PhraseKey(syllableKey, phrase.text())));
    }

    /**
     * 全量有序合并：底层词库遍历（跳过 INFO 与无效记录）与覆盖层遍历归并，每个主键只保留一条，再去掉墓碑。
     *
     * @return 按主键升序的词条流
     */
    Stream<KeyedPhrase> mergedEntries() {
        Iterator<KeyedPhrase> storeSide = store == null
            ? List.<KeyedPhrase>of().iterator()
            : stream(store.iterator())
                .filter(entry -> !entry.isInfo())
                .map(this::decodeEntry)
                .flatMap(Optional::stream)
                .iterator();
        Iterator<KeyedPhrase> overlaySide = overlay.entrySet().stream()
            .map(entry -> new KeyedPhrase(entry.getKey(), toPhrase(entry.getKey(), entry.getValue())))
            .iterator();
        return stream(new PhraseMergeIterator(storeSide, overlaySide))
            .filter(keyed -> !tombstones.contains(keyed.key()));
    }

    @Override
    public List<Phrase> lookupFirstNPhrases(SyllableSequence syllables, int first) {
        Map<String, Integer> indexByText = new HashMap<>();
        List<Phrase> phrases = new ArrayList<>();
        entriesFor(syllables.toBytes()).forEach(phrase -> {
            Integer index = indexByText.get(phrase.text());
            if (index == null) {
                indexByText.put(phrase.text(), phrases.size());
                phrases.add(phrase);
            } else if (Phrase.BY_FREQUENCY_THEN_RECENCY.compare(phrase, phrases.get(index)) > 0) {
                phrases.set(index, phrase);
            }
        });
        int limit = Math.max(first, 0);
        return phrases.size() > limit ? new ArrayList<>(phrases.subList(0, limit)) : phrases;
    }

    @Override
    public List<DictionaryEntry> entries() {
        return mergedEntries()
            .map(keyed -> new DictionaryEntry(SyllableSequence.fromBytes(keyed.key().syllableKey()), keyed.phrase()))
            .toList();
    }

    @Override
    public DictionaryInfo about() {
        return DictionaryInfo.empty();
    }

    @Override
    public void reopen() {
    }

    @Override
    public void flush() {
    }

    @Override
    public void addPhrase(SyllableSequence syllables, Phrase phrase) throws DictionaryUpdateException {
        byte[] syllableKey = syllables.toBytes();
        if (entriesFor(syllableKey).anyMatch(existing -> existing.text().equals(phrase.text()))) {
            throw new DictionaryUpdateException("词条已存在: syllables=" + syllables + ", phrase=" + phrase.text());
        }
        PhraseKey key = new PhraseKey(syllableKey, phrase.text());
        // 重新加入的词条必须解除此前的墓碑，否则立即不可见
        tombstones.remove(key);
        overlay.put(key, new OverlayValue(phrase.frequency(), phrase.lastUsedOrZero()));
    }

    @Override
    public void updatePhrase(SyllableSequence syllables, Phrase phrase, long frequency, long lastUsed) {
        Phrase updated = new Phrase(phrase.text(), frequency, lastUsed);
        PhraseKey key = new PhraseKey(syllables.toBytes(), updated.text());
        tombstones.remove(key);
        overlay.put(key, new OverlayValue(updated.frequency(), lastUsed));
    }

    @Override
    public void removePhrase(SyllableSequence syllables, String text) {
        PhraseKey key = new PhraseKey(syllables.toBytes(), text);
        overlay.remove(key);
        tombstones.add(key);
    }

    /**
     * 覆盖层词条数量。
     */
    public int overlaySize() {
        return overlay.size();
    }

    /**
     * 墓碑数量。
     */
    public int tombstoneCount() {
        return tombstones.size();
    }

    private NavigableMap<PhraseKey, OverlayValue> overlayRange(byte[] syllableKey) {
        return overlay.tailMap(PhraseKey.lowest(syllableKey), true);
    }

    private Optional<Phrase> decodeRecord(byte[] bytes) {
        Optional<Phrase> phrase = PhraseRecordCodec.decode(bytes);
        if (phrase.isEmpty()) {
            logger.debug("跳过无效词条记录: length={}", bytes.length);
        }
        return phrase;
    }

    private Optional<KeyedPhrase> decodeEntry(StoreEntry entry) {
        return decodeRecord(entry.value())
            .map(phrase -> new KeyedPhrase(new PhraseKey(entry.key(), phrase.text()), phrase));
    }

    private static Phrase toPhrase(PhraseKey key, OverlayValue value) {
        return new Phrase(key.text(), value.frequency(), value.lastUsed());
    }

    private static <T> Stream<T> stream(Iterator<T> iterator) {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED), false);
    }

    private static <S> S requireStore(S store) {
        if (store == null) {
            throw new IllegalArgumentException("底层词库不能为空");
        }
        return store;
    }
}
