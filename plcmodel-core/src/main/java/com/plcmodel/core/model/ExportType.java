package com.plcmodel.core.model;

/**
 * Shape of an export, detected from its root element.
 */
public enum ExportType {
    PROJECT("project"),
    LIBRARY("library"),
    APPLICATION("application"),
    /** Root is not one of the known kinds but the document carries resource elements. */
    RESOURCE_BASED("resource_based"),
    UNKNOWN("unknown");

    private final String id;

    ExportType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}
