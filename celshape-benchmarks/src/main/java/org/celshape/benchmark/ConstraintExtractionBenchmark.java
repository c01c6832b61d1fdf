package org.celshape.benchmark;

import java.util.concurrent.TimeUnit;

import org.celshape.benchmark.domain.SampleMessages;
import org.celshape.constraint.ConstraintExtractor;
import org.celshape.constraint.ConstraintResult;
import org.celshape.parser.antlr4.Antlr4CelParser;
import org.celshape.parser.ast.expr.CelExpr;
import org.openjdk.jmh.annotations.*;

/**
 * Cost of analyzing one rule, split into parsing alone and the full extraction.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(2)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
@State(Scope.Benchmark)
public class ConstraintExtractionBenchmark {

    @Param({SampleMessages.SIMPLE_RULE, SampleMessages.CONJUNCTION_RULE, SampleMessages.UNION_RULE})
    String expression;

    ConstraintExtractor extractor;

    @Setup(Level.Trial)
    public void init() {
        extractor = new ConstraintExtractor();
    }

    @Benchmark
    public CelExpr parseOnly() {
        return Antlr4CelParser.parseExpression(expression);
    }

    @Benchmark
    public ConstraintResult extract() {
        return extractor.extract(expression);
    }
}
