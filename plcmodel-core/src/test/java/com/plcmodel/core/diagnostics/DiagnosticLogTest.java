package com.plcmodel.core.diagnostics;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DiagnosticLog} and {@link ExtractionStatistics}.
 */
class DiagnosticLogTest {

    @Test
    void accept_keepsEventsInOrder() {
        DiagnosticLog log = new DiagnosticLog();

        log.accept(DiagnosticEvent.strategyAttempted("application", "namespaced-block"));
        log.accept(DiagnosticEvent.sectionLocated("application", "namespaced-block", 2));
        log.accept(DiagnosticEvent.recordAccepted("Structures", "ST_Point"));

        assertThat(log.events()).extracting(DiagnosticEvent::type).containsExactly(
            DiagnosticType.STRATEGY_ATTEMPTED,
            DiagnosticType.SECTION_LOCATED,
            DiagnosticType.RECORD_ACCEPTED
        );
        assertThat(log.eventsOfType(DiagnosticType.RECORD_ACCEPTED))
            .singleElement()
            .satisfies(event -> assertThat(event.subject()).isEqualTo("ST_Point"));
    }

    @Test
    void statistics_countsEachEventType() {
        DiagnosticLog log = new DiagnosticLog();

        log.accept(DiagnosticEvent.strategyAttempted("application", "namespaced-block"));
        log.accept(DiagnosticEvent.sectionNotFound("application", "namespaced-block"));
        log.accept(DiagnosticEvent.strategyAttempted("application", "resource-scan"));
        log.accept(DiagnosticEvent.sectionLocated("application", "resource-scan", 1));
        log.accept(DiagnosticEvent.recordAccepted("Enums", "E_State"));
        log.accept(DiagnosticEvent.recordRejected("DataTypes", "<dataType>", "no resolvable name"));
        log.accept(DiagnosticEvent.recordRejected("DataTypes", "<dataType>", "no resolvable name"));
        log.accept(DiagnosticEvent.duplicateIgnored("Structures", "Packed"));
        log.accept(DiagnosticEvent.collectionCount("Enums", 1));

        ExtractionStatistics stats = log.statistics();

        assertThat(stats.strategiesAttempted()).isEqualTo(2);
        assertThat(stats.sectionsNotFound()).isEqualTo(1);
        assertThat(stats.sectionsLocated()).isEqualTo(1);
        assertThat(stats.recordsAccepted()).isEqualTo(1);
        assertThat(stats.recordsRejected()).isEqualTo(2);
        assertThat(stats.duplicatesIgnored()).isEqualTo(1);
        assertThat(stats.rejectionCounts()).containsEntry("DataTypes", 2);
        assertThat(stats.topRejections()).hasSize(2);
        assertThat(stats.hasRejections()).isTrue();
    }

    @Test
    void statistics_rejectionCountsKeepFirstRejectionOrder() {
        ExtractionStatistics stats = new ExtractionStatistics.Builder()
            .record(DiagnosticEvent.recordRejected("Unions", "<Union>", "no resolvable name"))
            .record(DiagnosticEvent.recordRejected("POUs", "<pou>", "no resolvable name"))
            .record(DiagnosticEvent.recordRejected("GlobalVariables", "<variable>", "no resolvable name"))
            .record(DiagnosticEvent.recordRejected("POUs", "<pou>", "no resolvable name"))
            .record(DiagnosticEvent.recordRejected("DataTypes", "<dataType>", "no resolvable name"))
            .build();

        assertThat(stats.rejectionCounts().keySet())
            .containsExactly("Unions", "POUs", "GlobalVariables", "DataTypes");
        assertThat(stats.rejectionCounts()).containsEntry("POUs", 2);
    }

    @Test
    void statistics_topRejectionsAreCapped() {
        ExtractionStatistics.Builder builder = new ExtractionStatistics.Builder();
        for (int i = 0; i < 15; i++) {
            builder.record(DiagnosticEvent.recordRejected("GlobalVariables", "<variable>", "no name " + i));
        }

        ExtractionStatistics stats = builder.build();

        assertThat(stats.recordsRejected()).isEqualTo(15);
        assertThat(stats.topRejections()).hasSize(10);
    }

    @Test
    void empty_hasNoRejections() {
        ExtractionStatistics stats = ExtractionStatistics.empty();

        assertThat(stats.hasRejections()).isFalse();
        assertThat(stats.getSummary()).contains("Rejected: 0");
    }

    @Test
    void format_includesSubjectAndDetail() {
        assertThat(DiagnosticEvent.sectionLocated("global-variables", "flat-scan", 3).format())
            .isEqualTo("SECTION_LOCATED global-variables [flat-scan]: 3");
        assertThat(DiagnosticEvent.collectionCount("POUs", 0).format())
            .isEqualTo("COLLECTION_COUNT POUs: 0");
    }
}
