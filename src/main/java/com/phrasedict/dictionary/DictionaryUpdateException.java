package com.phrasedict.dictionary;

/**
 * 词典更新失败。
 *
 * <p>内存覆盖层只在新增重复词条时抛出；持久化实现会把底层 I/O 异常作为 cause 附带上来。</p>
 */
public class DictionaryUpdateException extends Exception {

    public DictionaryUpdateException(String message) {
        super(message);
    }

    public DictionaryUpdateException(String message, Throwable cause) {
        super(message, cause);
    }
}
