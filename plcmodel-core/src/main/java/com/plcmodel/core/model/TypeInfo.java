package com.plcmodel.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Declared type of a variable as read from its {@code type} element.
 *
 * @param name type name ({@code UNKNOWN} when the variable has no type element)
 * @param category one of {@code basic}, {@code derived}, {@code array}, {@code pointer}, {@code string}
 * @param derivedFrom referenced user type for derived types, otherwise null
 * @param length declared length for string types, otherwise null
 * @param dimensions array dimensions, empty for non-array types
 */
public record TypeInfo(
    String name,
    String category,
    String derivedFrom,
    String length,
    List<ArrayDimension> dimensions
) {
    public static final String UNKNOWN = "UNKNOWN";

    public static final String CATEGORY_BASIC = "basic";
    public static final String CATEGORY_DERIVED = "derived";
    public static final String CATEGORY_ARRAY = "array";
    public static final String CATEGORY_POINTER = "pointer";
    public static final String CATEGORY_STRING = "string";

    public TypeInfo {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(category, "category must not be null");
        dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
    }

    /**
     * Type info for variables without any type element.
     *
     * @return unknown basic type
     */
    public static TypeInfo unknown() {
        return new TypeInfo(UNKNOWN, CATEGORY_BASIC, null, null, List.of());
    }
}
