package com.plcmodel.core.document;

/**
 * Fatal failure raised when a document cannot be traversed at all.
 *
 * <p>Thrown when the input has no usable root element, is not well-formed XML, or when a
 * tree query fails on the supplied node. Absent sections are never reported this way; they
 * surface as diagnostics and empty collections instead.
 *
 * @since 1.0.0
 */
public class StructuralFailureException extends RuntimeException {

    public StructuralFailureException(String message) {
        super(message);
    }

    public StructuralFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
