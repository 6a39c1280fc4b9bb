package com.plcmodel.core.locator;

import com.plcmodel.core.document.DocumentNode;

import java.util.List;
import java.util.Objects;

/**
 * A global variable collection and its variable nodes.
 *
 * @param name group name
 * @param variables variable nodes in document order
 */
public record VariableGroup(String name, List<DocumentNode> variables) {

    public VariableGroup {
        Objects.requireNonNull(name, "name must not be null");
        variables = variables == null ? List.of() : List.copyOf(variables);
    }
}
