package com.plcmodel.core.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Sink that keeps every event, logs it, and maintains running statistics.
 *
 * <p>Rejections are logged at WARN, located sections and final counts at INFO, everything
 * else at DEBUG. One log per extraction run.
 *
 * @since 1.0.0
 */
public class DiagnosticLog implements DiagnosticSink {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticLog.class);

    private final List<DiagnosticEvent> events = new ArrayList<>();
    private final ExtractionStatistics.Builder statistics = new ExtractionStatistics.Builder();

    @Override
    public void accept(DiagnosticEvent event) {
        events.add(event);
        statistics.record(event);

        switch (event.type()) {
            case RECORD_REJECTED -> log.warn("{}", event.format());
            case SECTION_LOCATED, COLLECTION_COUNT -> log.info("{}", event.format());
            default -> log.debug("{}", event.format());
        }
    }

    /**
     * @return all events in emission order
     */
    public List<DiagnosticEvent> events() {
        return List.copyOf(events);
    }

    /**
     * Returns events of one type, in emission order.
     *
     * @param type event type
     * @return matching events
     */
    public List<DiagnosticEvent> eventsOfType(DiagnosticType type) {
        return events.stream()
            .filter(event -> event.type() == type)
            .toList();
    }

    /**
     * @return statistics over all events so far
     */
    public ExtractionStatistics statistics() {
        return statistics.build();
    }
}
