package org.carball.cflow.model.function;

import java.util.List;

public record ExtractionResult(
        List<FunctionUnit> units,
        List<ExtractionError> errors
) {
    public ExtractionResult {
        units = List.copyOf(units);
        errors = List.copyOf(errors);
    }

    public int fragmentCount() {
        return units.size() + errors.size();
    }
}
