package com.plcmodel.core.diagnostics;

import java.util.Objects;

/**
 * One structured diagnostic event.
 *
 * <p>{@code concern} names what was being worked on: a located section such as
 * {@code application} or {@code global-variables}, or a model collection key such as
 * {@code Structures}. {@code subject} is the tier id, record name or node description the
 * event is about. {@code detail} is free text (a count, a reason).
 *
 * @param type event type
 * @param concern section or collection
 * @param subject tier, record name or node
 * @param detail additional information, may be empty
 */
public record DiagnosticEvent(DiagnosticType type, String concern, String subject, String detail) {

    public DiagnosticEvent {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(concern, "concern must not be null");
        if (subject == null) {
            subject = "";
        }
        if (detail == null) {
            detail = "";
        }
    }

    public static DiagnosticEvent strategyAttempted(String concern, String tier) {
        return new DiagnosticEvent(DiagnosticType.STRATEGY_ATTEMPTED, concern, tier, "");
    }

    public static DiagnosticEvent sectionLocated(String concern, String tier, int count) {
        return new DiagnosticEvent(DiagnosticType.SECTION_LOCATED, concern, tier, String.valueOf(count));
    }

    public static DiagnosticEvent sectionNotFound(String concern, String tier) {
        return new DiagnosticEvent(DiagnosticType.SECTION_NOT_FOUND, concern, tier, "");
    }

    public static DiagnosticEvent recordAccepted(String collection, String name) {
        return new DiagnosticEvent(DiagnosticType.RECORD_ACCEPTED, collection, name, "");
    }

    public static DiagnosticEvent recordRejected(String collection, String node, String reason) {
        return new DiagnosticEvent(DiagnosticType.RECORD_REJECTED, collection, node, reason);
    }

    public static DiagnosticEvent duplicateIgnored(String collection, String name) {
        return new DiagnosticEvent(DiagnosticType.DUPLICATE_IGNORED, collection, name, "");
    }

    public static DiagnosticEvent collectionCount(String collection, int count) {
        return new DiagnosticEvent(DiagnosticType.COLLECTION_COUNT, collection, "", String.valueOf(count));
    }

    /**
     * Returns a single-line rendering for logs and console output.
     *
     * @return formatted event
     */
    public String format() {
        StringBuilder line = new StringBuilder()
            .append(type)
            .append(' ')
            .append(concern);
        if (!subject.isEmpty()) {
            line.append(" [").append(subject).append(']');
        }
        if (!detail.isEmpty()) {
            line.append(": ").append(detail);
        }
        return line.toString();
    }
}
