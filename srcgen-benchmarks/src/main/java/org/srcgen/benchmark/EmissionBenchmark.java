package org.srcgen.benchmark;

import java.util.concurrent.TimeUnit;

import org.srcgen.GenerationResult;
import org.srcgen.SourceGen;
import org.srcgen.ast.Module;
import org.srcgen.benchmark.domain.SampleTrees;
import org.srcgen.printer.EmitterConfiguration;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

/**
 * Measures the cost of one emission run per backend over trees of increasing size.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class EmissionBenchmark {

    @State(Scope.Thread)
    public static class TreeState {

        @Param({"1", "10", "100"})
        int classes;

        Module module;
        final EmitterConfiguration withLines = EmitterConfiguration.builder().lineInformation(true).build();

        @Setup(Level.Trial)
        public void init() {
            module = SampleTrees.module(classes, 5);
        }
    }

    @Benchmark
    public void mirror(TreeState state, Blackhole bh) {
        GenerationResult result = SourceGen.toSource(state.module, SourceGen.Backend.MIRROR);
        bh.consume(result.getSource());
    }

    @Benchmark
    public void mirrorWithLineInformation(TreeState state, Blackhole bh) {
        GenerationResult result = SourceGen.toSource(state.module, SourceGen.Backend.MIRROR, state.withLines);
        bh.consume(result.getSource());
    }

    @Benchmark
    public void objectiveC(TreeState state, Blackhole bh) {
        GenerationResult result = SourceGen.toSource(state.module, SourceGen.Backend.OBJECTIVE_C);
        bh.consume(result.getSource());
        bh.consume(result.getDiagnostics());
    }
}
