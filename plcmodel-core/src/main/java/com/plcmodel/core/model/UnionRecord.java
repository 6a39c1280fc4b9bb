package com.plcmodel.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Union type.
 *
 * @param name type name
 * @param members member variables in declaration order
 * @param details auxiliary details
 */
public record UnionRecord(
    String name,
    List<VariableRecord> members,
    Map<String, String> details
) implements TypeDefinition {

    public UnionRecord {
        Objects.requireNonNull(name, "name must not be null");
        members = members == null ? List.of() : List.copyOf(members);
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    @Override
    public TypeKind kind() {
        return TypeKind.UNION;
    }
}
