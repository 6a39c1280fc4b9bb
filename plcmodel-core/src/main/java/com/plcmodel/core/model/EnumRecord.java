package com.plcmodel.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Enumeration type.
 *
 * @param name type name
 * @param baseType underlying integer type, {@code INT} when not declared
 * @param values values in declaration order
 * @param details auxiliary details
 */
public record EnumRecord(
    String name,
    String baseType,
    List<EnumValue> values,
    Map<String, String> details
) implements TypeDefinition {

    public static final String DEFAULT_BASE_TYPE = "INT";

    public EnumRecord {
        Objects.requireNonNull(name, "name must not be null");
        if (baseType == null) {
            baseType = DEFAULT_BASE_TYPE;
        }
        values = values == null ? List.of() : List.copyOf(values);
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    @Override
    public TypeKind kind() {
        return TypeKind.ENUM;
    }
}
