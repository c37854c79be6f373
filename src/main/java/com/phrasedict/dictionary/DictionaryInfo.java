package com.phrasedict.dictionary;

/**
 * 词典元数据，持久化词库中保存在保留键 {@code INFO} 下。
 */
public record DictionaryInfo(String name, String copyright, String license, String version, String software) {

    private static final DictionaryInfo EMPTY = new DictionaryInfo("", "", "", "", "");

    public static DictionaryInfo empty() {
        return EMPTY;
    }
}
