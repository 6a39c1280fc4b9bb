package com.plcmodel.core.resolver;

import java.util.Objects;

/**
 * Structure or union member with its nesting link.
 *
 * @param name member name
 * @param type declared type
 * @param defaultValue initial value, null if none
 * @param nestedType name of the structure or union this member embeds, null otherwise
 */
public record ResolvedMember(String name, String type, String defaultValue, String nestedType) {

    public ResolvedMember {
        Objects.requireNonNull(name, "name must not be null");
    }

    public boolean isNested() {
        return nestedType != null;
    }
}
