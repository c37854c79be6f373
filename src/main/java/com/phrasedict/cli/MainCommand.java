package com.phrasedict.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phrasedict.config.Constants;
import com.phrasedict.config.DictionaryConfig;
import com.phrasedict.dictionary.DictionaryEntry;
import com.phrasedict.dictionary.DictionaryInfo;
import com.phrasedict.dictionary.Phrase;
import com.phrasedict.store.FileDictionary;
import com.phrasedict.syllable.SyllableSequence;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "pdict",
    description = "📖 注音输入法词库管理工具",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.InitSubcommand.class,
        MainCommand.LookupSubcommand.class,
        MainCommand.ListSubcommand.class,
        MainCommand.AddSubcommand.class,
        MainCommand.UpdateSubcommand.class,
        MainCommand.RemoveSubcommand.class,
        MainCommand.InfoSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"--dict"}, description = "词库文件路径，优先于配置文件")
    private Path dictPath;

    @Option(names = {"--config"}, description = "JSON 配置文件路径")
    private Path configPath;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("📖 注音输入法词库管理工具");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    DictionaryConfig loadConfig() throws IOException {
        return configPath == null ? DictionaryConfig.defaults() : DictionaryConfig.load(configPath);
    }

    Path resolveDictPath() throws IOException {
        return dictPath != null ? dictPath : loadConfig().resolveDictionaryPath();
    }

    private int sanitizeLimit(int rawLimit) {
        if (rawLimit < 0) {
            System.err.printf("⚠️ limit=%d 非法，已使用 0%n", rawLimit);
            return 0;
        }
        if (rawLimit > Constants.MAX_LOOKUP_LIMIT) {
            System.err.printf("⚠️ limit=%d 超过上限 %d，已自动限制%n", rawLimit, Constants.MAX_LOOKUP_LIMIT);
            return Constants.MAX_LOOKUP_LIMIT;
        }
        return rawLimit;
    }

    static String formatPhrase(Phrase phrase) {
        return String.format("%s (freq: %d, lastUsed: %d)", phrase.text(), phrase.frequency(), phrase.lastUsedOrZero());
    }

    static void printJson(Object value) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value));
    }

    /**
     * JSON 输出用的扁平视图。
     */
    record EntryView(String syllables, String text, long frequency, long lastUsed) {
        static EntryView of(SyllableSequence syllables, Phrase phrase) {
            return new EntryView(syllables.toString(), phrase.text(), phrase.frequency(), phrase.lastUsedOrZero());
        }
    }

    @Command(name = "init", description = "🆕 创建空词库文件")
    static class InitSubcommand implements Callable<Integer> {

        @Option(names = {"--yes"}, description = "确认覆盖已有词库", defaultValue = "false")
        private boolean confirmed;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                Path path = main.resolveDictPath();
                if (Files.exists(path) && !confirmed) {
                    System.out.println("⚠️ 警告: 词库已存在，将被覆盖: " + path);
                    System.out.println("使用 --yes 确认");
                    return 1;
                }
                DictionaryConfig config = main.loadConfig();
                DictionaryInfo info = new DictionaryInfo(config.getDictionaryName(), "", "",
                    config.getDictionaryVersion(), "pdict 1.0.0");
                FileDictionary.create(path, info);
                System.out.println("✅ 已创建词库: " + path);
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 创建词库失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "lookup", description = "🔎 查找音节序列的候选词")
    static class LookupSubcommand implements Callable<Integer> {

        @Parameters(description = "逗号分隔的音节编码，例如 0x2A01,0x1C0B", arity = "1")
        private String syllables;

        @Option(names = {"-l", "--limit"}, description = "返回候选数量，缺省取配置值")
        private Integer limit;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                SyllableSequence sequence = SyllableSequence.parse(syllables);
                int effectiveLimit = main.sanitizeLimit(limit != null ? limit : main.loadConfig().getLookupLimit());
                FileDictionary dictionary = FileDictionary.open(main.resolveDictPath());
                List<Phrase> phrases = dictionary.lookupFirstNPhrases(sequence, effectiveLimit);
                if ("json".equalsIgnoreCase(format)) {
                    printJson(phrases.stream().map(phrase -> EntryView.of(sequence, phrase)).toList());
                } else {
                    printText(phrases);
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 查找失败: " + exception.getMessage());
                return 1;
            }
        }

        private void printText(List<Phrase> phrases) {
            if (phrases.isEmpty()) {
                System.out.println("⚠️ 未找到候选词");
                return;
            }
            int rank = 1;
            for (Phrase phrase : phrases) {
                System.out.printf("%d. %s%n", rank++, formatPhrase(phrase));
            }
        }
    }

    @Command(name = "list", description = "📋 列出全部词条")
    static class ListSubcommand implements Callable<Integer> {

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                FileDictionary dictionary = FileDictionary.open(main.resolveDictPath());
                List<DictionaryEntry> entries = dictionary.entries();
                if ("json".equalsIgnoreCase(format)) {
                    printJson(entries.stream().map(entry -> EntryView.of(entry.syllables(), entry.phrase())).toList());
                } else {
                    for (DictionaryEntry entry : entries) {
                        System.out.println(entry.syllables() + "\t" + formatPhrase(entry.phrase()));
                    }
                    System.out.println("📊 共 " + entries.size() + " 条词条");
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 列出词条失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "add", description = "➕ 新增用户词条")
    static class AddSubcommand implements Callable<Integer> {

        @Parameters(index = "0", description = "逗号分隔的音节编码")
        private String syllables;

        @Parameters(index = "1", description = "词条文本")
        private String text;

        @Option(names = {"--freq"}, description = "词频", defaultValue = "1")
        private long frequency;

        @Option(names = {"--time"}, description = "最近使用时间", defaultValue = "0")
        private long lastUsed;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                SyllableSequence sequence = SyllableSequence.parse(syllables);
                FileDictionary dictionary = FileDictionary.open(main.resolveDictPath());
                dictionary.addPhrase(sequence, Phrase.of(text, frequency, lastUsed));
                dictionary.flush();
                System.out.println("✅ 已新增: " + sequence + " → " + text);
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 新增失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "update", description = "✏️ 写入或覆盖词条的词频与时间")
    static class UpdateSubcommand implements Callable<Integer> {

        @Parameters(index = "0", description = "逗号分隔的音节编码")
        private String syllables;

        @Parameters(index = "1", description = "词条文本")
        private String text;

        @Option(names = {"--freq"}, description = "词频", required = true)
        private long frequency;

        @Option(names = {"--time"}, description = "最近使用时间", defaultValue = "0")
        private long lastUsed;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                SyllableSequence sequence = SyllableSequence.parse(syllables);
                FileDictionary dictionary = FileDictionary.open(main.resolveDictPath());
                dictionary.updatePhrase(sequence, Phrase.of(text, frequency), frequency, lastUsed);
                dictionary.flush();
                System.out.println("✅ 已更新: " + sequence + " → " + text);
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 更新失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "remove", description = "🗑️ 删除词条")
    static class RemoveSubcommand implements Callable<Integer> {

        @Parameters(index = "0", description = "逗号分隔的音节编码")
        private String syllables;

        @Parameters(index = "1", description = "词条文本")
        private String text;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                SyllableSequence sequence = SyllableSequence.parse(syllables);
                FileDictionary dictionary = FileDictionary.open(main.resolveDictPath());
                dictionary.removePhrase(sequence, text);
                dictionary.flush();
                System.out.println("✅ 已删除: " + sequence + " → " + text);
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 删除失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "info", description = "ℹ️ 查看词库元数据")
    static class InfoSubcommand implements Callable<Integer> {

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                Path path = main.resolveDictPath();
                FileDictionary dictionary = FileDictionary.open(path);
                DictionaryInfo info = dictionary.about();
                System.out.println("📖 词库信息");
                System.out.println("═══════════");
                System.out.println("📁 文件: " + path);
                System.out.println("🏷️ 名称: " + info.name());
                System.out.println("🔢 版本: " + info.version());
                System.out.println("🛠️ 生成工具: " + info.software());
                System.out.println("📄 词条数: " + dictionary.entries().size());
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 获取信息失败: " + exception.getMessage());
                return 1;
            }
        }
    }
}
