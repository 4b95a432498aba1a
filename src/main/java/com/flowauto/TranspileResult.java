package com.flowauto;

import com.flowauto.engine.TopologyReport;
import com.flowauto.validate.ValidationError;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one compilation. On failure only {@code errors} and
 * {@code warnings} are meaningful.
 *
 * @param document the structured document that {@code yaml} serializes
 * @param report   topology analysis; null when validation failed first
 * @param strategy name of the backend used
 */
public record TranspileResult(boolean success, String yaml, Map<String, Object> document, TopologyReport report,
        List<ValidationError> errors, List<String> warnings, String strategy) {

    public TranspileResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    static TranspileResult success(String yaml, Map<String, Object> document, TopologyReport report,
            List<String> warnings, String strategy) {
        return new TranspileResult(true, yaml, document, report, List.of(), warnings, strategy);
    }

    static TranspileResult failure(List<ValidationError> errors, TopologyReport report, List<String> warnings) {
        return new TranspileResult(false, null, null, report, errors, warnings, null);
    }
}
