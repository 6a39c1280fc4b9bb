package com.plcmodel.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Program organization unit: function, function block or program.
 *
 * @param name unit name
 * @param pouType declared {@code pouType} attribute, {@code unknown} if missing
 * @param returnType declared return type for functions and methods, null if none
 * @param variables interface variables, grouped by declaring section
 * @param implementation structured text body, null if none
 * @param description documentation text, null if none
 * @param actions actions in declaration order
 * @param methods methods in declaration order
 */
public record ProgramUnitRecord(
    String name,
    String pouType,
    String returnType,
    List<VariableRecord> variables,
    String implementation,
    String description,
    List<Routine> actions,
    List<Routine> methods
) {
    public static final String UNKNOWN_POU_TYPE = "unknown";

    public ProgramUnitRecord {
        Objects.requireNonNull(name, "name must not be null");
        if (pouType == null) {
            pouType = UNKNOWN_POU_TYPE;
        }
        variables = variables == null ? List.of() : List.copyOf(variables);
        actions = actions == null ? List.of() : List.copyOf(actions);
        methods = methods == null ? List.of() : List.copyOf(methods);
    }
}
