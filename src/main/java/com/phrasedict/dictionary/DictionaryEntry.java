package com.phrasedict.dictionary;

import com.phrasedict.syllable.SyllableSequence;

/**
 * 全量遍历结果中的一项：音节序列与对应词条。
 */
public record DictionaryEntry(SyllableSequence syllables, Phrase phrase) {
}
