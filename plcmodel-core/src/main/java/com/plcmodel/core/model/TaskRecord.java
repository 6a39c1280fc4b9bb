package com.plcmodel.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Task declared on a resource.
 *
 * @param name task name
 * @param interval cycle time literal such as {@code T#20ms}, null for event tasks
 * @param priority declared priority, null if missing
 * @param programUnits type names of the program instances the task runs, in declaration order
 */
public record TaskRecord(String name, String interval, String priority, List<String> programUnits) {

    public TaskRecord {
        Objects.requireNonNull(name, "name must not be null");
        programUnits = programUnits == null ? List.of() : List.copyOf(programUnits);
    }
}
