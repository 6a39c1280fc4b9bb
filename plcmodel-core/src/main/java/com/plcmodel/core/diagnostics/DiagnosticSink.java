package com.plcmodel.core.diagnostics;

/**
 * Receiver of diagnostic events.
 */
@FunctionalInterface
public interface DiagnosticSink {

    /**
     * Accepts one event. Implementations must not throw.
     *
     * @param event diagnostic event
     */
    void accept(DiagnosticEvent event);

    /**
     * Returns a sink that drops every event.
     *
     * @return no-op sink
     */
    static DiagnosticSink discarding() {
        return event -> { };
    }
}
