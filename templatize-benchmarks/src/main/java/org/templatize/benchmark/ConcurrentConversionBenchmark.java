package org.templatize.benchmark;

import org.openjdk.jmh.annotations.*;
import org.templatize.benchmark.domain.ChainSources;
import org.templatize.engine.ConversionOutcome;
import org.templatize.javaparser.JavaConcatToTemplateRefactoring;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Two threads converting different chains through one shared engine. Each thread parses with its
 * own symbol solver; the engine itself holds no mutable state.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
@Threads(2)
public class ConcurrentConversionBenchmark {

    @State(Scope.Benchmark)
    public static class SharedState {

        final String[] sources = {
                ChainSources.shortChain(),
                ChainSources.longChain(50)
        };
    }

    @State(Scope.Thread)
    public static class ThreadState {

        private static final AtomicInteger THREAD_COUNTER = new AtomicInteger(0);
        int threadIndex;
        JavaConcatToTemplateRefactoring refactoring;

        @Setup(Level.Trial)
        public void init() {
            threadIndex = THREAD_COUNTER.getAndIncrement() % 2;
            refactoring = new JavaConcatToTemplateRefactoring();
        }
    }

    @Benchmark
    public ConversionOutcome<?> concurrentParseAndConvert(SharedState shared, ThreadState local) {
        String source = shared.sources[local.threadIndex];
        return local.refactoring.convertAt(source, ChainSources.LINE, ChainSources.firstPlusColumn(source));
    }
}
