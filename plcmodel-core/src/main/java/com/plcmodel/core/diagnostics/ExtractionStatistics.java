package com.plcmodel.core.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate counts over the diagnostic events of one extraction run.
 *
 * @param strategiesAttempted locator tiers tried, across all concerns
 * @param sectionsLocated tiers that produced an accepted result
 * @param sectionsNotFound tiers (or whole cascades) that found nothing
 * @param recordsAccepted records stored in the model
 * @param recordsRejected nodes skipped because they could not be named or extracted
 * @param duplicatesIgnored records dropped by the first-write-wins rule
 * @param rejectionCounts rejected records per collection, in order of first rejection
 * @param topRejections first rejection messages (max 10)
 *
 * @since 1.0.0
 */
public record ExtractionStatistics(
    int strategiesAttempted,
    int sectionsLocated,
    int sectionsNotFound,
    int recordsAccepted,
    int recordsRejected,
    int duplicatesIgnored,
    Map<String, Integer> rejectionCounts,
    List<String> topRejections
) {
    private static final int MAX_TOP_REJECTIONS = 10;

    public ExtractionStatistics {
        if (rejectionCounts == null) {
            rejectionCounts = Map.of();
        }
        if (topRejections == null) {
            topRejections = List.of();
        }
    }

    public static ExtractionStatistics empty() {
        return new ExtractionStatistics(0, 0, 0, 0, 0, 0, Map.of(), List.of());
    }

    /**
     * Returns true if any node was rejected.
     *
     * @return true if at least one record was rejected
     */
    public boolean hasRejections() {
        return recordsRejected > 0;
    }

    /**
     * Returns a human-readable summary of the statistics.
     *
     * @return summary string
     */
    public String getSummary() {
        return String.format(
            "Strategies: %d, Located: %d, Not found: %d, Accepted: %d, Rejected: %d, Duplicates: %d",
            strategiesAttempted,
            sectionsLocated,
            sectionsNotFound,
            recordsAccepted,
            recordsRejected,
            duplicatesIgnored
        );
    }

    /**
     * Builder for collecting statistics event by event.
     */
    public static class Builder {
        private int strategiesAttempted = 0;
        private int sectionsLocated = 0;
        private int sectionsNotFound = 0;
        private int recordsAccepted = 0;
        private int recordsRejected = 0;
        private int duplicatesIgnored = 0;
        private final Map<String, Integer> rejectionCounts = new LinkedHashMap<>();
        private final List<String> topRejections = new ArrayList<>();

        public Builder record(DiagnosticEvent event) {
            switch (event.type()) {
                case STRATEGY_ATTEMPTED -> strategiesAttempted++;
                case SECTION_LOCATED -> sectionsLocated++;
                case SECTION_NOT_FOUND -> sectionsNotFound++;
                case RECORD_ACCEPTED -> recordsAccepted++;
                case RECORD_REJECTED -> addRejection(event);
                case DUPLICATE_IGNORED -> duplicatesIgnored++;
                case COLLECTION_COUNT -> { }
            }
            return this;
        }

        private void addRejection(DiagnosticEvent event) {
            recordsRejected++;
            rejectionCounts.merge(event.concern(), 1, Integer::sum);
            if (topRejections.size() < MAX_TOP_REJECTIONS) {
                topRejections.add(event.concern() + " " + event.subject() + ": " + event.detail());
            }
        }

        public ExtractionStatistics build() {
            return new ExtractionStatistics(
                strategiesAttempted,
                sectionsLocated,
                sectionsNotFound,
                recordsAccepted,
                recordsRejected,
                duplicatesIgnored,
                Collections.unmodifiableMap(new LinkedHashMap<>(rejectionCounts)),
                List.copyOf(topRejections)
            );
        }
    }
}
