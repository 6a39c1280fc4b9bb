package com.plcmodel.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Action or method attached to a program unit.
 *
 * @param name routine name
 * @param kind {@code action} or {@code method}
 * @param returnType declared return type, null if none
 * @param variables interface variables of the routine
 * @param implementation structured text body, null if none
 * @param description documentation text, null if none
 */
public record Routine(
    String name,
    String kind,
    String returnType,
    List<VariableRecord> variables,
    String implementation,
    String description
) {
    public static final String KIND_ACTION = "action";
    public static final String KIND_METHOD = "method";

    public Routine {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        variables = variables == null ? List.of() : List.copyOf(variables);
    }
}
