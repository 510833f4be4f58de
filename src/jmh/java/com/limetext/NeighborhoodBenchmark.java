package com.limetext;

import com.limetext.document.IndexMode;
import com.limetext.document.IndexedDocument;
import com.limetext.sampling.NeighborhoodSampler;
import com.limetext.sampling.Perturbations;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * 邻域生成性能基准测试
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class NeighborhoodBenchmark {

    @Param({"BOW", "POSITIONAL"})
    public IndexMode mode;

    private String rawText;
    private IndexedDocument document;

    @Setup
    public void setup() {
        rawText = generateDocument(400);
        document = IndexedDocument.of(rawText, mode);
    }

    @Benchmark
    public IndexedDocument indexDocument() {
        return IndexedDocument.of(rawText, mode);
    }

    @Benchmark
    public Perturbations perturbDefaultNeighborhood() {
        return new NeighborhoodSampler(new Random(42)).perturb(document, 5000);
    }

    private static String generateDocument(int words) {
        String[] vocabulary = {"movie", "plot", "acting", "great", "boring", "the", "a", "scene", "director", "music"};
        Random random = new Random(7);
        StringBuilder builder = new StringBuilder();
        for (int index = 0; index < words; index++) {
            builder.append(vocabulary[random.nextInt(vocabulary.length)]);
            builder.append(index % 12 == 11 ? ". " : " ");
        }
        return builder.toString();
    }

    public static void main(String[] args) throws RunnerException {
        Options options = new OptionsBuilder()
            .include(NeighborhoodBenchmark.class.getSimpleName())
            .build();
        new Runner(options).run();
    }
}
