package com.phrasedict;

import com.phrasedict.dictionary.DictionaryInfo;
import com.phrasedict.dictionary.DictionaryUpdateException;
import com.phrasedict.dictionary.KeyValueDictionary;
import com.phrasedict.dictionary.Phrase;
import com.phrasedict.store.FileDictionary;
import com.phrasedict.store.SortedPhraseFile;
import com.phrasedict.syllable.SyllableSequence;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * 词典查询性能基准测试
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class LookupBenchmark {

    private static final int KEY_COUNT = 5_000;
    private static final int PHRASES_PER_KEY = 8;

    @State(Scope.Benchmark)
    public static class DictionaryState {
        Path tempDir;
        FileDictionary fileDictionary;
        KeyValueDictionary<SortedPhraseFile> overlayDictionary;
        SyllableSequence hotKey;

        @Setup
        public void setup() throws IOException, DictionaryUpdateException {
            tempDir = Files.createTempDirectory("pdict-benchmark");
            Path dictFile = tempDir.resolve("bench.dict");
            fileDictionary = FileDictionary.create(dictFile, new DictionaryInfo("bench", "", "", "1.0.0", "jmh"));

            // 半数词条落盘，半数留在覆盖层
            for (int key = 0; key < KEY_COUNT; key++) {
                SyllableSequence syllables = SyllableSequence.of(key, key + 1);
                for (int index = 0; index < PHRASES_PER_KEY; index++) {
                    fileDictionary.addPhrase(syllables, Phrase.of("詞" + key + "-" + index, index, key));
                }
            }
            fileDictionary.flush();

            overlayDictionary = new KeyValueDictionary<>(new SortedPhraseFile(dictFile));
            for (int key = 0; key < KEY_COUNT; key += 2) {
                SyllableSequence syllables = SyllableSequence.of(key, key + 1);
                overlayDictionary.updatePhrase(syllables, Phrase.of("詞" + key + "-0", 0), 100, key);
                overlayDictionary.removePhrase(syllables, "詞" + key + "-1");
            }
            hotKey = SyllableSequence.of(KEY_COUNT / 2, KEY_COUNT / 2 + 1);
        }

        @TearDown
        public void tearDown() throws IOException {
            if (tempDir == null || !Files.exists(tempDir)) {
                return;
            }
            List<Path> paths;
            try (Stream<Path> walk = Files.walk(tempDir)) {
                paths = walk.sorted(Comparator.reverseOrder()).toList();
            }
            for (Path path : paths) {
                Files.deleteIfExists(path);
            }
        }
    }

    @Benchmark
    public List<Phrase> lookupFromFile(DictionaryState state) {
        return state.fileDictionary.lookupFirstNPhrases(state.hotKey, 10);
    }

    @Benchmark
    public List<Phrase> lookupWithOverlay(DictionaryState state) {
        return state.overlayDictionary.lookupFirstNPhrases(state.hotKey, 10);
    }

    @Benchmark
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public int mergeAllEntries(DictionaryState state) {
        return state.overlayDictionary.entries().size();
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(LookupBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
