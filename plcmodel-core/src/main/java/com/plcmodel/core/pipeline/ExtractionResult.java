package com.plcmodel.core.pipeline;

import com.plcmodel.core.diagnostics.DiagnosticEvent;
import com.plcmodel.core.diagnostics.ExtractionStatistics;
import com.plcmodel.core.model.CanonicalModel;

import java.util.List;
import java.util.Objects;

/**
 * Model extracted from one document together with the diagnostics of the run.
 *
 * @param model extracted model
 * @param events diagnostic events in emission order
 * @param statistics aggregated diagnostics
 */
public record ExtractionResult(
    CanonicalModel model,
    List<DiagnosticEvent> events,
    ExtractionStatistics statistics
) {
    public ExtractionResult {
        Objects.requireNonNull(model, "model must not be null");
        events = events == null ? List.of() : List.copyOf(events);
        if (statistics == null) {
            statistics = ExtractionStatistics.empty();
        }
    }

    public String sourceName() {
        return model.sourceName();
    }

    /**
     * Returns true if the model holds anything.
     *
     * @return true if at least one record was extracted
     */
    public boolean hasFindings() {
        return !model.isEmpty();
    }
}
