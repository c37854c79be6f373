package com.phrasedict.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 词典运行时配置
 *
 * 支持从CLI参数或JSON配置文件注入，覆盖Constants默认值
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DictionaryConfig {
    private String dictionaryFile = "./phrase.dict";
    private int lookupLimit = Constants.DEFAULT_LOOKUP_LIMIT;
    private String dictionaryName = "user";
    private String dictionaryVersion = "1.0.0";

    public String getDictionaryFile() {
        return dictionaryFile;
    }

    public void setDictionaryFile(String dictionaryFile) {
        this.dictionaryFile = dictionaryFile;
    }

    public int getLookupLimit() {
        return lookupLimit;
    }

    public void setLookupLimit(int lookupLimit) {
        this.lookupLimit = lookupLimit;
    }

    public String getDictionaryName() {
        return dictionaryName;
    }

    public void setDictionaryName(String dictionaryName) {
        this.dictionaryName = dictionaryName;
    }

    public String getDictionaryVersion() {
        return dictionaryVersion;
    }

    public void setDictionaryVersion(String dictionaryVersion) {
        this.dictionaryVersion = dictionaryVersion;
    }

    /**
     * 将配置中的词典文件解析为路径。
     */
    public Path resolveDictionaryPath() {
        return Paths.get(dictionaryFile);
    }

    /**
     * 使用默认配置创建实例
     */
    public static DictionaryConfig defaults() {
        return new DictionaryConfig();
    }

    /**
     * 从JSON配置文件加载，未出现的字段保留默认值。
     *
     * @param configFile 配置文件路径
     * @return 配置实例
     * @throws IOException 文件不存在或JSON格式错误时抛出
     */
    public static DictionaryConfig load(Path configFile) throws IOException {
        if (configFile == null) {
            throw new IllegalArgumentException("配置文件路径不能为空");
        }
        if (!Files.isRegularFile(configFile)) {
            throw new IOException("配置文件不存在: " + configFile);
        }
        return new ObjectMapper().readValue(configFile.toFile(), DictionaryConfig.class);
    }
}
