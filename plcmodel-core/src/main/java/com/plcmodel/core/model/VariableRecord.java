package com.plcmodel.core.model;

import java.util.Objects;

/**
 * A named variable declaration.
 *
 * <p>Used for global variables, POU interface variables and structure/union members. The
 * group name and origin make every entry traceable: the group is the variable collection it
 * was declared in, the origin is the strategy that discovered it.
 *
 * @param name variable name
 * @param type declared type name
 * @param defaultValue initial value, null if none
 * @param comment declaration comment, null if none
 * @param groupName owning variable collection
 * @param origin discovering strategy or context
 * @param typeInfo detailed type information
 */
public record VariableRecord(
    String name,
    String type,
    String defaultValue,
    String comment,
    String groupName,
    String origin,
    TypeInfo typeInfo
) {
    public VariableRecord {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (typeInfo == null) {
            typeInfo = TypeInfo.unknown();
        }
        if (type == null) {
            type = typeInfo.name();
        }
        if (groupName == null) {
            groupName = "";
        }
        if (origin == null) {
            origin = "";
        }
    }

    /**
     * Returns a copy assigned to a variable collection.
     *
     * @param group owning group name
     * @param discoveredBy strategy or context that found the variable
     * @return new record with group and origin set
     */
    public VariableRecord inGroup(String group, String discoveredBy) {
        return new VariableRecord(name, type, defaultValue, comment, group, discoveredBy, typeInfo);
    }
}
