package com.phrasedict.dictionary;

import com.phrasedict.syllable.SyllableSequence;

import java.util.List;

/**
 * 词典对外能力，供组字编辑层与管理工具使用。
 *
 * <p>实现不做内部加锁：多线程使用时由调用方保证修改操作互斥、查询与修改不并发。
 * 查询返回的结果不应跨越后续的修改操作继续使用。</p>
 */
public interface Dictionary {

    /**
     * 查找音节序列对应的前 {@code first} 个候选词，同文本词条只保留一条。
     *
     * @param syllables 音节序列
     * @param first     最多返回数量
     * @return 按首次出现顺序排列的候选词，无命中时为空列表
     */
    List<Phrase> lookupFirstNPhrases(SyllableSequence syllables, int first);

    /**
     * 查找音节序列对应的全部候选词。
     */
    default List<Phrase> lookupAllPhrases(SyllableSequence syllables) {
        return lookupFirstNPhrases(syllables, Integer.MAX_VALUE);
    }

    /**
     * 按 (音节键, 文本) 升序返回合并后的全部词条。
     */
    List<DictionaryEntry> entries();

    /**
     * 词典元数据。
     */
    DictionaryInfo about();

    /**
     * 重新打开底层词库，保留尚未写回的修改。
     */
    void reopen() throws DictionaryUpdateException;

    /**
     * 将修改写回底层词库。
     */
    void flush() throws DictionaryUpdateException;

    /**
     * 新增词条。
     *
     * @throws DictionaryUpdateException 同音节序列下已存在同文本词条时抛出
     */
    void addPhrase(SyllableSequence syllables, Phrase phrase) throws DictionaryUpdateException;

    /**
     * 写入或覆盖词条的频次与最近使用时间。
     */
    void updatePhrase(SyllableSequence syllables, Phrase phrase, long frequency, long lastUsed)
        throws DictionaryUpdateException;

    /**
     * 删除词条。底层词库中的词条通过墓碑屏蔽，不改写词库本身。
     */
    void removePhrase(SyllableSequence syllables, String text) throws DictionaryUpdateException;
}
