package com.phrasedict.dictionary;

/**
 * 合并过程中携带主键的词条。
 */
record KeyedPhrase(PhraseKey key, Phrase phrase) {
}
