package org.carball.cflow.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.cflow.cfg.ControlFlowGraph;
import org.carball.cflow.cfg.ControlFlowGraphBuilder;
import org.carball.cflow.cfg.MalformedControlFlowException;
import org.carball.cflow.config.ComplexityThresholds;
import org.carball.cflow.model.analysis.ComplexityReport;
import org.carball.cflow.model.analysis.FileAnalysis;
import org.carball.cflow.model.function.ExtractionError;
import org.carball.cflow.model.function.ExtractionResult;
import org.carball.cflow.model.function.FunctionUnit;
import org.carball.cflow.model.token.Token;
import org.carball.cflow.output.MermaidCfgRenderer;
import org.carball.cflow.parser.FunctionExtractor;
import org.carball.cflow.parser.Tokenizer;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs the whole pipeline for one source text: tokenize, extract functions, then
 * build and measure a graph per function. Failures are scoped to the function they
 * occur in. With a parallelism above one, functions are measured on a fixed pool;
 * the result order is the discovery order either way.
 */
@Slf4j
public class SourceAnalyzer {

    private final ComplexityThresholds thresholds;
    private final boolean renderDiagrams;
    private final FunctionExtractor extractor = new FunctionExtractor();
    private final ControlFlowGraphBuilder builder;
    private final ComplexityCalculator calculator;
    private final MermaidCfgRenderer renderer = new MermaidCfgRenderer();

    public SourceAnalyzer(ComplexityThresholds thresholds) {
        this(thresholds, false);
    }

    public SourceAnalyzer(ComplexityThresholds thresholds, boolean renderDiagrams) {
        this.thresholds = thresholds;
        this.renderDiagrams = renderDiagrams;
        this.builder = new ControlFlowGraphBuilder(thresholds.isCountBooleanOperators(), thresholds.getMaxNesting());
        this.calculator = new ComplexityCalculator(thresholds);
    }

    /**
     * @throws CancellationException if the calling thread is interrupted between functions
     */
    public FileAnalysis analyze(String path, String source) {
        Tokenizer tokenizer = new Tokenizer(source);
        List<Token> tokens = tokenizer.tokenize();
        ExtractionResult extraction = extractor.extract(tokens);
        log.debug("{}: {} tokens, {} functions, {} extraction errors",
                path, tokens.size(), extraction.units().size(), extraction.errors().size());

        ReportAggregator aggregator = new ReportAggregator();
        for (ExtractionError error : extraction.errors()) {
            aggregator.recordExtractionError(error);
        }

        if (thresholds.getParallelism() > 1 && extraction.units().size() > 1) {
            analyzeParallel(extraction.units(), aggregator);
        } else {
            for (FunctionUnit unit : extraction.units()) {
                checkInterrupted();
                analyzeUnit(unit, aggregator);
            }
        }

        if (aggregator.failureCount() > 0) {
            log.info("{}: {} of {} functions could not be analyzed", path, aggregator.failureCount(), aggregator.size());
        }
        return new FileAnalysis(path, aggregator.results(), tokenizer.anomalies());
    }

    private void analyzeParallel(List<FunctionUnit> units, ReportAggregator aggregator) {
        int workers = Math.min(thresholds.getParallelism(), units.size());
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        try {
            for (FunctionUnit unit : units) {
                checkInterrupted();
                futures.add(CompletableFuture.runAsync(() -> {
                    if (!Thread.currentThread().isInterrupted()) {
                        analyzeUnit(unit, aggregator);
                    }
                }, pool));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get();
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new CancellationException("analysis interrupted");
        } catch (ExecutionException e) {
            throw new IllegalStateException("function analysis failed unexpectedly", e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    private void analyzeUnit(FunctionUnit unit, ReportAggregator aggregator) {
        try {
            ControlFlowGraph graph = builder.build(unit);
            ComplexityReport report = calculator.calculate(graph);
            String diagram = renderDiagrams ? renderer.render(graph) : null;
            aggregator.record(unit, report, diagram);
        } catch (MalformedControlFlowException e) {
            log.warn("Skipping {}: {}", unit.qualifiedName(), e.getMessage());
            aggregator.recordMalformed(unit, e.getMessage());
        } catch (InvariantViolationException e) {
            log.error("Invariant violated while measuring {}", unit.qualifiedName(), e);
            aggregator.recordInvariantViolation(unit, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure while measuring {}", unit.qualifiedName(), e);
            aggregator.recordInvariantViolation(unit, "internal error: " + e);
        }
    }

    private static void checkInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("analysis interrupted");
        }
    }
}
