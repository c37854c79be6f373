package com.phrasedict.dictionary;

import java.util.Iterator;

/**
 * 只读底层词库需要提供的能力。
 *
 * <p>值字节采用 {@link PhraseRecordCodec} 描述的记录格式，无效记录由读取方跳过。</p>
 */
public interface KeyValueStore extends Iterable<StoreEntry> {

    /**
     * 精确查找键等于 {@code key} 的全部值，不做前缀匹配，结果顺序不限。
     *
     * @param key 音节键字节
     * @return 值字节迭代器
     */
    Iterator<byte[]> find(byte[] key);

    /**
     * 遍历全部键值对，必须按 (键字节, 解码后文本) 严格递增。
     * 可以包含保留键 {@code INFO}，读取方会跳过它。
     *
     * @return 有序键值对迭代器
     */
    @Override
    Iterator<StoreEntry> iterator();
}
