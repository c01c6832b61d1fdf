package org.celshape.benchmark;

import java.util.concurrent.TimeUnit;

import org.celshape.benchmark.domain.SampleMessages;
import org.celshape.config.ShapeOptions;
import org.celshape.shape.MessageSchema;
import org.celshape.shape.TypeShapeGenerator;
import org.celshape.shape.printer.ShapePrinter;
import org.openjdk.jmh.annotations.*;

/**
 * Two threads generating and printing shapes through one shared generator. Shows the generator holds no
 * per-call state and gives a contention baseline.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(2)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
@Threads(2)
public class ConcurrentShapeGenerationBenchmark {

    @State(Scope.Benchmark)
    public static class SharedState {

        TypeShapeGenerator generator;
        ShapePrinter printer;
        MessageSchema message;

        @Setup(Level.Trial)
        public void init() {
            generator = new TypeShapeGenerator(ShapeOptions.defaults());
            printer = new ShapePrinter();
            message = SampleMessages.order();
        }
    }

    @Benchmark
    public String generateAndPrint(SharedState shared) {
        return shared.printer.print(shared.generator.generate(shared.message));
    }
}
