package com.phrasedict.dictionary;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * 词条主键 (音节键字节, 词条文本)。
 *
 * <p>排序：先按音节键无符号字节序，再按文本的 Unicode 码点序。覆盖层、墓碑集与合并算法共用此顺序。</p>
 */
public final class PhraseKey implements Comparable<PhraseKey> {
    private final byte[] syllableKey;
    private final String text;

    public PhraseKey(byte[] syllableKey, String text) {
        if (syllableKey == null || text == null) {
            throw new IllegalArgumentException("音节键与文本不能为空");
        }
        this.syllableKey = syllableKey.clone();
        this.text = text;
    }

    /**
     * 指定音节键下排序最小的主键，作为范围查询的下界。
     */
    static PhraseKey lowest(byte[] syllableKey) {
        return new PhraseKey(syllableKey, "");
    }

    public byte[] syllableKey() {
        return syllableKey.clone();
    }

    public String text() {
        return text;
    }

    boolean hasSyllableKey(byte[] other) {
        return Arrays.equals(syllableKey, other);
    }

    @Override
    public int compareTo(PhraseKey other) {
        int byKey = Arrays.compareUnsigned(syllableKey, other.syllableKey);
        if (byKey != 0) {
            return byKey;
        }
        return compareCodePoints(text, other.text);
    }

    /**
     * 按 Unicode 码点比较，与 UTF-8 字节序一致；{@link String#compareTo} 的 UTF-16 码元序在增补平面字符上与之不同。
     */
    static int compareCodePoints(String left, String right) {
        int leftIndex = 0;
        int rightIndex = 0;
        while (leftIndex < left.length() && rightIndex < right.length()) {
            int leftCodePoint = left.codePointAt(leftIndex);
            int rightCodePoint = right.codePointAt(rightIndex);
            if (leftCodePoint != rightCodePoint) {
                return Integer.compare(leftCodePoint, rightCodePoint);
            }
            leftIndex += Character.charCount(leftCodePoint);
            rightIndex += Character.charCount(rightCodePoint);
        }
        return Integer.compare(left.length() - leftIndex, right.length() - rightIndex);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PhraseKey that)) {
            return false;
        }
        return Arrays.equals(syllableKey, that.syllableKey) && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(syllableKey) + text.hashCode();
    }

    @Override
    public String toString() {
        return "PhraseKey[" + HexFormat.of().formatHex(syllableKey) + ", " + text + "]";
    }
}
