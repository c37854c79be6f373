package com.phrasedict.dictionary;

import java.util.Collections;
import java.util.Iterator;

/**
 * 空词库，供纯内存词典使用。
 */
public enum EmptyStore implements KeyValueStore {
    INSTANCE;

    @Override
    public Iterator<byte[]> find(byte[] key) {
        return Collections.emptyIterator();
    }

    @Override
    public Iterator<StoreEntry> iterator() {
        return Collections.emptyIterator();
    }
}
