package com.plcmodel.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Project-level facts about an export.
 *
 * @param exportType detected export shape
 * @param configurationName name of the first configuration (the PLC), null if none
 * @param resourceName name of the first resource (the application), null if none
 * @param tasks tasks declared on resources, in document order
 */
public record ProjectInfo(
    ExportType exportType,
    String configurationName,
    String resourceName,
    List<TaskRecord> tasks
) {

    public ProjectInfo {
        Objects.requireNonNull(exportType, "exportType must not be null");
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }

    public ProjectInfo(ExportType exportType, String configurationName, String resourceName) {
        this(exportType, configurationName, resourceName, List.of());
    }

    public static ProjectInfo unknown() {
        return new ProjectInfo(ExportType.UNKNOWN, null, null);
    }
}
