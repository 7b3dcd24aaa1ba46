package org.assertflat.benchmark;

import java.util.concurrent.TimeUnit;

import org.assertflat.migration.DocumentMigrator;
import org.assertflat.migration.DocumentResult;
import org.assertflat.rewriter.RewriteListener;
import org.assertflat.types.TypeSolvers;
import org.openjdk.jmh.annotations.*;

/**
 * Measures the cost of migrating one document, with and without type resolution. The type solver is
 * warm after the first iteration, so the resolved variants show the steady-state cost.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@Fork(value = 2)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class RewriteCostBenchmark {

    @State(Scope.Thread)
    public static class ResolvingState {

        DocumentMigrator migrator;

        @Setup(Level.Trial)
        public void init() {
            migrator = new DocumentMigrator(TypeSolvers.jdkOnly(), RewriteListener.NONE);
        }
    }

    @State(Scope.Thread)
    public static class SyntacticState {

        DocumentMigrator migrator;

        @Setup(Level.Trial)
        public void init() {
            migrator = new DocumentMigrator(null, RewriteListener.NONE);
        }
    }

    @Benchmark
    public DocumentResult migrateSmallResolved(ResolvingState state) {
        return state.migrator.migrate("SmallTest.java", BenchmarkSources.SMALL_TEST);
    }

    @Benchmark
    public DocumentResult migrateSmallSyntactic(SyntacticState state) {
        return state.migrator.migrate("SmallTest.java", BenchmarkSources.SMALL_TEST);
    }

    @Benchmark
    public DocumentResult migrateLargeResolved(ResolvingState state) {
        return state.migrator.migrate("LargeTest.java", BenchmarkSources.LARGE_TEST);
    }

    @Benchmark
    public DocumentResult migrateLargeSyntactic(SyntacticState state) {
        return state.migrator.migrate("LargeTest.java", BenchmarkSources.LARGE_TEST);
    }
}
