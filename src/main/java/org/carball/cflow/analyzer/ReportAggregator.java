package org.carball.cflow.analyzer;

import org.carball.cflow.model.analysis.ComplexityReport;
import org.carball.cflow.model.analysis.FunctionResult;
import org.carball.cflow.model.analysis.ResultStatus;
import org.carball.cflow.model.function.ExtractionError;
import org.carball.cflow.model.function.FunctionUnit;

import java.util.List;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Collectors;

/**
 * Collects one result per discovered function. Results may be recorded from any
 * thread in any order; {@link #results()} always returns them in discovery order.
 */
public class ReportAggregator {

    private final ConcurrentSkipListMap<Integer, FunctionResult> entries = new ConcurrentSkipListMap<>();

    public void record(FunctionUnit unit, ComplexityReport report) {
        record(unit, report, null);
    }

    public void record(FunctionUnit unit, ComplexityReport report, String diagram) {
        put(FunctionResult.success(unit.index(), unit.qualifiedName(), report, diagram));
    }

    public void recordExtractionError(ExtractionError error) {
        put(FunctionResult.failure(error.index(), error.name(), ResultStatus.EXTRACTION_ERROR,
                error.message() + " at offset " + error.offset()));
    }

    public void recordMalformed(FunctionUnit unit, String message) {
        put(FunctionResult.failure(unit.index(), unit.qualifiedName(), ResultStatus.MALFORMED_CONTROL_FLOW, message));
    }

    public void recordInvariantViolation(FunctionUnit unit, String message) {
        put(FunctionResult.failure(unit.index(), unit.qualifiedName(), ResultStatus.INVARIANT_VIOLATION, message));
    }

    private void put(FunctionResult result) {
        FunctionResult previous = entries.putIfAbsent(result.index(), result);
        if (previous != null) {
            throw new IllegalStateException(String.format(
                    "result for discovery index %d recorded twice (%s, then %s)",
                    result.index(), previous.name(), result.name()));
        }
    }

    public List<FunctionResult> results() {
        return List.copyOf(entries.values());
    }

    public int size() {
        return entries.size();
    }

    public int failureCount() {
        return (int) entries.values().stream().filter(r -> !r.isSuccess()).count();
    }

    public List<ComplexityReport> successes() {
        return entries.values().stream()
                .filter(FunctionResult::isSuccess)
                .map(FunctionResult::report)
                .collect(Collectors.toList());
    }
}
