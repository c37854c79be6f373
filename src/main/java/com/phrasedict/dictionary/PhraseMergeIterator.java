package com.phrasedict.dictionary;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * 底层词库与覆盖层两路有序流的归并迭代器。
 *
 * <p>两路都按 {@link PhraseKey} 升序。主键不同时输出较小者；主键相同时两路同时前进，
 * 底层词频不大于覆盖层词频则输出覆盖层词条，否则输出底层词条。一路耗尽后直接输出另一路。</p>
 *
 * <p>底层词库必须严格递增，违反时抛出 {@link IllegalStateException}，否则归并结果会出现重复或遗漏。</p>
 */
final class PhraseMergeIterator implements Iterator<KeyedPhrase> {
    private final Iterator<KeyedPhrase> storeSide;
    private final Iterator<KeyedPhrase> overlaySide;
    private KeyedPhrase storeHead;
    private KeyedPhrase overlayHead;
    private PhraseKey lastStoreKey;

    PhraseMergeIterator(Iterator<KeyedPhrase> storeSide, Iterator<KeyedPhrase> overlaySide) {
        this.storeSide = storeSide;
        this.overlaySide = overlaySide;
        this.storeHead = nextFromStore();
        this.overlayHead = nextFromOverlay();
    }

    @Override
    public boolean hasNext() {
        return storeHead != null || overlayHead != null;
    }

    @Override
    public KeyedPhrase next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        if (overlayHead == null) {
            return takeStoreHead();
        }
        if (storeHead == null) {
            return takeOverlayHead();
        }
        int order = storeHead.key().compareTo(overlayHead.key());
        if (order < 0) {
            return takeStoreHead();
        }
        if (order > 0) {
            return takeOverlayHead();
        }
        if (storeHead.phrase().frequency() <= overlayHead.phrase().frequency()) {
            storeHead = nextFromStore();
            return takeOverlayHead();
        }
        overlayHead = nextFromOverlay();
        return takeStoreHead();
    }

    private KeyedPhrase takeStoreHead() {
        KeyedPhrase current = storeHead;
        storeHead = nextFromStore();
        return current;
    }

    private KeyedPhrase takeOverlayHead() {
        KeyedPhrase current = overlayHead;
        overlayHead = nextFromOverlay();
        return current;
    }

    private KeyedPhrase nextFromStore() {
        if (!storeSide.hasNext()) {
            return null;
        }
        KeyedPhrase candidate = storeSide.next();
        if (lastStoreKey != null && candidate.key().compareTo(lastStoreKey) <= 0) {
            throw new IllegalStateException("底层词库遍历未严格递增: previous=" + lastStoreKey
                + ", current=" + candidate.key());
        }
        lastStoreKey = candidate.key();
        return candidate;
    }

    private KeyedPhrase nextFromOverlay() {
        return overlaySide.hasNext() ? overlaySide.next() : null;
    }
}
