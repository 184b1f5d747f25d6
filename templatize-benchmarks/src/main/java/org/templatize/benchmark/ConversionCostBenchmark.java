package org.templatize.benchmark;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.expr.BinaryExpr;
import org.openjdk.jmh.annotations.*;
import org.templatize.TemplatizeConfiguration;
import org.templatize.benchmark.domain.ChainSources;
import org.templatize.engine.ConversionOutcome;
import org.templatize.javaparser.JavaConcatToTemplateRefactoring;
import org.templatize.javaparser.JavaSourceParser;
import org.templatize.syntax.JavaEmbeddedExpressionSyntax;

import java.util.concurrent.TimeUnit;

/**
 * Measures conversion cost on an already parsed tree, for a typical chain and for a
 * pathologically long one, plus the parse-and-convert cost a host pays per request.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2, jvmArgsAppend = {
        "-Dtemplatize.syntax=csharp",
        "-Dtemplatize.cancellation.checkInterval=64"
})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class ConversionCostBenchmark {

    @State(Scope.Thread)
    public static class ShortChainState {

        final JavaSourceParser parser = new JavaSourceParser();
        JavaConcatToTemplateRefactoring refactoring;
        String source;
        BinaryExpr node;

        @Setup(Level.Trial)
        public void init() {
            refactoring = new JavaConcatToTemplateRefactoring(parser, TemplatizeConfiguration.fromSystemProperties(JavaEmbeddedExpressionSyntax.INSTANCE));
            source = ChainSources.shortChain();
            CompilationUnit unit = parser.parse(source);
            node = parser.findPlusAt(unit, ChainSources.LINE, ChainSources.firstPlusColumn(source)).orElseThrow();
        }
    }

    @State(Scope.Thread)
    public static class LongChainState {

        @Param({"100", "400"})
        int operands;

        final JavaSourceParser parser = new JavaSourceParser();
        JavaConcatToTemplateRefactoring refactoring;
        BinaryExpr node;

        @Setup(Level.Trial)
        public void init() {
            refactoring = new JavaConcatToTemplateRefactoring(parser, TemplatizeConfiguration.fromSystemProperties(JavaEmbeddedExpressionSyntax.INSTANCE));
            String source = ChainSources.longChain(operands);
            CompilationUnit unit = parser.parse(source);
            node = parser.findPlusAt(unit, ChainSources.LINE, ChainSources.firstPlusColumn(source)).orElseThrow();
        }
    }

    @Benchmark
    public ConversionOutcome<?> convertShortChain(ShortChainState state) {
        return state.refactoring.convert(state.node);
    }

    @Benchmark
    public ConversionOutcome<?> parseAndConvertShortChain(ShortChainState state) {
        return state.refactoring.convertAt(state.source, ChainSources.LINE, ChainSources.firstPlusColumn(state.source));
    }

    @Benchmark
    public ConversionOutcome<?> convertLongChain(LongChainState state) {
        return state.refactoring.convert(state.node);
    }
}
