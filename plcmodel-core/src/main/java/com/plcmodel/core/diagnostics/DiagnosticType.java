package com.plcmodel.core.diagnostics;

/**
 * Kinds of diagnostic events emitted during extraction.
 */
public enum DiagnosticType {
    /** A locator tier was tried for a concern. */
    STRATEGY_ATTEMPTED,
    /** A locator tier produced an accepted result. */
    SECTION_LOCATED,
    /** A locator tier, or the whole cascade, found nothing. */
    SECTION_NOT_FOUND,
    /** A record was stored in a model collection. */
    RECORD_ACCEPTED,
    /** A node could not be named or extracted and was skipped. */
    RECORD_REJECTED,
    /** A record was dropped because its name was already taken. */
    DUPLICATE_IGNORED,
    /** Final size of a model collection. */
    COLLECTION_COUNT
}
