package com.natsort;

import com.natsort.order.NaturalOrderComparator;
import com.natsort.order.NaturalSort;
import com.natsort.order.TokenSequence;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * 分词与自然排序性能基准测试
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class NaturalSortBenchmark {

    @State(Scope.Thread)
    public static class SortState {
        @Param({"1000", "100000"})
        int size;

        List<String> names;

        @Setup
        public void setup() {
            // 固定种子，保证多次运行输入一致
            Random random = new Random(42);
            names = new ArrayList<>(size);
            for (int i = 0; i < size; i++) {
                names.add("photo_" + random.nextInt(size) + "_v" + random.nextInt(20) + ".jpg");
            }
            Collections.shuffle(names, random);
        }
    }

    @Benchmark
    public TokenSequence tokenize() {
        return TokenSequence.of("release-2024-10-18_build00123456789012345678901234567890.tar.gz");
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public List<String> naturalSort(SortState state) {
        return NaturalSort.sorted(state.names);
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public List<String> comparatorSort(SortState state) {
        List<String> copy = new ArrayList<>(state.names);
        copy.sort(NaturalOrderComparator.INSTANCE);
        return copy;
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(NaturalSortBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
