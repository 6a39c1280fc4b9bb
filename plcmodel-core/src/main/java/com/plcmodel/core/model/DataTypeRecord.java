package com.plcmodel.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Basic (opaque or alias) data type.
 *
 * @param name type name
 * @param details auxiliary details
 */
public record DataTypeRecord(String name, Map<String, String> details) implements TypeDefinition {

    public DataTypeRecord {
        Objects.requireNonNull(name, "name must not be null");
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    @Override
    public TypeKind kind() {
        return TypeKind.BASIC;
    }
}
