package org.carball.cflow.model.analysis;

import org.carball.cflow.model.token.LexicalAnomaly;

import java.util.List;
import java.util.stream.Collectors;

/**
 * @param error set when the file could not be read; the function list is then empty
 */
public record FileAnalysis(
        String path,
        List<FunctionResult> functions,
        List<LexicalAnomaly> anomalies,
        String error
) {

    public FileAnalysis {
        functions = List.copyOf(functions);
        anomalies = List.copyOf(anomalies);
    }

    public FileAnalysis(String path, List<FunctionResult> functions, List<LexicalAnomaly> anomalies) {
        this(path, functions, anomalies, null);
    }

    public static FileAnalysis unreadable(String path, String error) {
        return new FileAnalysis(path, List.of(), List.of(), error);
    }

    public boolean isReadable() {
        return error == null;
    }

    public List<FunctionResult> successes() {
        return functions.stream().filter(FunctionResult::isSuccess).collect(Collectors.toList());
    }

    public List<FunctionResult> failures() {
        return functions.stream().filter(f -> !f.isSuccess()).collect(Collectors.toList());
    }
}
