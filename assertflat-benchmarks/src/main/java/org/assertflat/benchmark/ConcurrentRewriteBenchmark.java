package org.assertflat.benchmark;

import java.util.concurrent.TimeUnit;

import org.assertflat.migration.DocumentMigrator;
import org.assertflat.migration.DocumentResult;
import org.assertflat.rewriter.RewriteListener;
import org.assertflat.types.TypeSolvers;
import org.openjdk.jmh.annotations.*;

/**
 * Two threads migrating through one shared migrator, each resolving types with its own solver.
 * Compare with {@link RewriteCostBenchmark#migrateLargeResolved} for the contention overhead.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@Fork(value = 2)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
@Threads(2)
public class ConcurrentRewriteBenchmark {

    @State(Scope.Benchmark)
    public static class SharedState {

        DocumentMigrator migrator;

        @Setup(Level.Trial)
        public void init() {
            migrator = new DocumentMigrator(TypeSolvers.jdkOnly(), RewriteListener.NONE);
        }
    }

    @Benchmark
    public DocumentResult concurrentMigrateLarge(SharedState shared) {
        return shared.migrator.migrate("LargeTest.java", BenchmarkSources.LARGE_TEST);
    }
}
