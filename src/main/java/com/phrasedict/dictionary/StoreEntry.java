package com.phrasedict.dictionary;

import com.phrasedict.config.Constants;

import java.util.Arrays;

/**
 * 底层词库中的一个键值对。
 */
public record StoreEntry(byte[] key, byte[] value) {

    public StoreEntry {
        if (key == null || value == null) {
            throw new IllegalArgumentException("键与值不能为空");
        }
    }

    /**
     * 是否为元数据保留键。
     */
    public boolean isInfo() {
        return Arrays.equals(key, Constants.infoKeyBytes());
    }
}
